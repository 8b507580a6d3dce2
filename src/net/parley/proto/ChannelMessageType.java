package net.parley.proto;

public final class ChannelMessageType {

    /* Request: channelName. Also carries USER_JOINED broadcasts. */
    public static final int JOIN_CHANNEL = 0;
    /* Reply: result, then on OK the operator and member lists. */
    public static final int JOIN_CHANNEL_COMPLETE = 1;
    /* Request: channelName. Also carries USER_LEFT broadcasts. */
    public static final int LEAVE_CHANNEL = 2;
    /* Reply: result, then on OK the channel name. */
    public static final int LEAVE_CHANNEL_COMPLETE = 3;

    private ChannelMessageType() {}

}
