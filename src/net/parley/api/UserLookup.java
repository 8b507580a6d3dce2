package net.parley.api;

/**
 * Resolves the user record of a connection.
 */
public interface UserLookup {

    /**
     * The user associated with client, or null if there is none.
     * A null return for a live connection is an internal error; callers
     * drop the connection.
     */
    UserIdentity getUser(ClientConnection client);

}
