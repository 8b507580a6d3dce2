package net.parley.user;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import net.parley.api.ClientConnection;
import net.parley.api.Component;
import net.parley.api.ComponentType;
import net.parley.api.Notifier;
import net.parley.api.UserIdentity;
import net.parley.api.UserLookup;
import net.parley.util.MalformedDataException;
import net.parley.util.TypedBuffer;

public class UserComponent implements Component, UserLookup {

    private static final Logger LOGGER = Logger.getLogger("UserComp");

    public static final Pattern USERNAME_RE =
        Pattern.compile("[a-zA-Z][a-zA-Z0-9_-]{0,31}");

    public static final String UNKNOWN_HOST = "unknown";

    private final Notifier notifier;
    private final Map<ClientConnection, ChatUser> users;
    private final Map<String, ChatUser> names;

    public UserComponent(Notifier notifier) {
        this.notifier = notifier;
        this.users = new HashMap<ClientConnection, ChatUser>();
        this.names = new HashMap<String, ChatUser>();
    }

    public ComponentType getType() {
        return ComponentType.USER;
    }

    public synchronized UserIdentity getUser(ClientConnection client) {
        return users.get(client);
    }

    public synchronized int getUserCount() {
        return users.size();
    }

    public void initialize() {
        /* NOP */
    }

    public void shutdown() {
        clear();
    }

    public void onStart() {
        /* NOP */
    }

    public void onStop() {
        clear();
    }

    public void onClientConnected(ClientConnection client) {
        InetSocketAddress addr = client.getRemoteAddress();
        String host = (addr == null) ? UNKNOWN_HOST : addr.getHostString();
        synchronized (this) {
            users.put(client, new ChatUser(host));
        }
    }

    public void onClientDisconnected(ClientConnection client) {
        ChatUser user;
        synchronized (this) {
            user = users.remove(client);
            if (user == null) return;
            if (user.getUsername() != null &&
                    names.get(user.getUsername()) == user)
                names.remove(user.getUsername());
        }
        user.disable();
    }

    public boolean handle(ClientConnection client, int messageType,
                          TypedBuffer payload) {
        if (messageType != UserMessageType.IDENTIFY) return false;
        String name;
        try {
            name = payload.readString();
        } catch (MalformedDataException exc) {
            LOGGER.info("Malformed identify request from " +
                client.getID() + ": " + exc.getMessage());
            return false;
        }
        int result;
        synchronized (this) {
            ChatUser user = users.get(client);
            if (user == null) {
                LOGGER.warning("No user for connection " + client.getID() +
                    " (identify)");
                return false;
            }
            if (user.isIdentified()) {
                result = UserMessageType.RESULT_ALREADY_IDENTIFIED;
            } else if (! USERNAME_RE.matcher(name).matches()) {
                result = UserMessageType.RESULT_INVALID_USERNAME;
            } else if (names.containsKey(name)) {
                result = UserMessageType.RESULT_USERNAME_TAKEN;
            } else {
                names.put(name, user);
                user.identify(name);
                result = UserMessageType.RESULT_OK;
            }
        }
        if (result == UserMessageType.RESULT_OK)
            LOGGER.fine(client.getID() + " identified as " + name);
        TypedBuffer reply = new TypedBuffer();
        reply.writeUInt16(result);
        notifier.sendUnicast(client, ComponentType.USER,
                             UserMessageType.IDENTIFY_COMPLETE, reply);
        return true;
    }

    private void clear() {
        Map<ClientConnection, ChatUser> old;
        synchronized (this) {
            old = new HashMap<ClientConnection, ChatUser>(users);
            users.clear();
            names.clear();
        }
        for (ChatUser u : old.values()) u.disable();
    }

}
