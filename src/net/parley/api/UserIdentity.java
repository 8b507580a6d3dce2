package net.parley.api;

/**
 * The user behind a connection, as far as the channel core is concerned.
 * Records are shared and owned by the user component; everybody else only
 * reads them.
 */
public interface UserIdentity {

    /**
     * The display name, or null while the user is not identified.
     */
    String getUsername();

    /**
     * The host the user connected from.
     */
    String getHostname();

    /**
     * Whether the user has identified and may take part in channels.
     */
    boolean isIdentified();

    /**
     * False once the owning connection is gone.
     * Disabled users are skipped in member lists and broadcasts.
     */
    boolean isEnabled();

}
