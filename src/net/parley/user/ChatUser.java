package net.parley.user;

import net.parley.api.UserIdentity;

public class ChatUser implements UserIdentity {

    private final String hostname;
    private volatile String username;
    private volatile boolean identified;
    private volatile boolean enabled;

    public ChatUser(String hostname) {
        this.hostname = hostname;
        this.enabled = true;
    }

    public String getUsername() {
        return username;
    }

    public String getHostname() {
        return hostname;
    }

    public boolean isIdentified() {
        return identified;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Mark the user as identified under the given name.
     */
    public void identify(String name) {
        username = name;
        identified = true;
    }

    public void disable() {
        enabled = false;
    }

    public String toString() {
        return getClass().getSimpleName() + "[" + username + "@" +
            hostname + "]";
    }

}
