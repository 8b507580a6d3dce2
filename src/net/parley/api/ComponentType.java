package net.parley.api;

/**
 * Tags the subsystem a wire message belongs to.
 * The numeric code is the first field of every frame.
 */
public enum ComponentType {

    /**
     * User identification.
     */
    USER(1),

    /**
     * Channel membership.
     */
    CHANNEL(2);

    private final int code;

    private ComponentType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * The type with the given code, or null if there is none.
     */
    public static ComponentType forCode(int code) {
        for (ComponentType t : values()) {
            if (t.code == code) return t;
        }
        return null;
    }

}
