package net.parley.api;

/**
 * Outcomes of channel requests, as sent in the first field of replies and
 * broadcasts.
 */
public enum ResultCode {

    /**
     * The request succeeded.
     */
    OK(0),

    /**
     * The channel did not exist and was created; the requester is its sole
     * member and operator.
     */
    CHANNEL_CREATED(1),

    /**
     * The requester has not identified yet.
     */
    NOT_IDENTIFIED(2),

    /**
     * The name lacks a '#', or (when leaving) no such channel exists.
     */
    INVALID_CHANNEL_NAME(3),

    /**
     * The requester is already a member of the channel.
     */
    ALREADY_IN_CHANNEL(4),

    /**
     * The requester is not a member of the channel.
     */
    NOT_IN_CHANNEL(5),

    /**
     * Broadcast only: somebody joined.
     */
    USER_JOINED(6),

    /**
     * Broadcast only: somebody left or disconnected.
     */
    USER_LEFT(7);

    private final int code;

    private ResultCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ResultCode forCode(int code) {
        for (ResultCode r : values()) {
            if (r.code == code) return r;
        }
        return null;
    }

}
