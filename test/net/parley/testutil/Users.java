package net.parley.testutil;

import java.util.HashMap;
import java.util.Map;
import net.parley.api.ClientConnection;
import net.parley.api.UserIdentity;
import net.parley.api.UserLookup;
import net.parley.user.ChatUser;

public class Users implements UserLookup {

    private final Map<ClientConnection, UserIdentity> users =
        new HashMap<ClientConnection, UserIdentity>();

    public synchronized UserIdentity getUser(ClientConnection client) {
        return users.get(client);
    }

    public synchronized void put(ClientConnection client,
                                 UserIdentity user) {
        users.put(client, user);
    }

    /**
     * Register an identified user for a new fake connection.
     */
    public FakeConnection connect(String name) {
        FakeConnection conn = new FakeConnection(name);
        put(conn, identified(name, name + ".example.org"));
        return conn;
    }

    public static ChatUser identified(String name, String host) {
        ChatUser ret = new ChatUser(host);
        ret.identify(name);
        return ret;
    }

}
