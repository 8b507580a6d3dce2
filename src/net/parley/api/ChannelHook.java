package net.parley.api;

/**
 * Observer of channel activity, e.g. for auditing.
 * Hooks run synchronously on the thread of the request that caused the
 * event, but only after all channel locks have been released. Exceptions
 * thrown by a hook are logged and otherwise ignored.
 */
public interface ChannelHook {

    /**
     * A channel was created by its first member.
     * onChannelJoined() follows for the creator.
     */
    void onChannelCreated(Channel channel);

    /**
     * user became a member of channel.
     */
    void onChannelJoined(Channel channel, UserIdentity user);

    /**
     * user stopped being a member of channel, either by leaving or by
     * disconnecting.
     */
    void onChannelLeft(Channel channel, UserIdentity user);

    /**
     * A join request finished with the given result code.
     * Fired for every request that got a reply, successful or not.
     */
    void onJoinCompleted(ResultCode result, UserIdentity user);

    /**
     * A leave request finished with the given result code.
     */
    void onLeaveCompleted(ResultCode result, UserIdentity user);

}
