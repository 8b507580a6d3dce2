package net.parley.user;

public final class UserMessageType {

    /* Request: username. */
    public static final int IDENTIFY = 0;
    /* Reply: result. */
    public static final int IDENTIFY_COMPLETE = 1;

    public static final int RESULT_OK = 0;
    public static final int RESULT_INVALID_USERNAME = 1;
    public static final int RESULT_USERNAME_TAKEN = 2;
    public static final int RESULT_ALREADY_IDENTIFIED = 3;

    private UserMessageType() {}

}
