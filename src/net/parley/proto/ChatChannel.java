package net.parley.proto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.parley.api.Channel;
import net.parley.api.ClientConnection;
import net.parley.api.ComponentType;
import net.parley.api.Notifier;
import net.parley.api.UserIdentity;
import net.parley.util.TypedBuffer;

/*
 * All state is guarded by the instance's monitor. Compound operations
 * (check-then-add, notify-then-remove) synchronize on the instance
 * themselves; the methods here are reentrant building blocks for that.
 * Operators are kept a subset of the members: removing a member always
 * revokes its operator status.
 */
public class ChatChannel implements Channel {

    private final String name;
    private final Map<ClientConnection, UserIdentity> members;
    private final Map<ClientConnection, UserIdentity> operators;
    private volatile boolean enabled;

    public ChatChannel(String name, ClientConnection creator,
                       UserIdentity user) {
        this.name = name;
        this.members = new LinkedHashMap<ClientConnection, UserIdentity>();
        this.operators = new LinkedHashMap<ClientConnection, UserIdentity>();
        this.members.put(creator, user);
        this.operators.put(creator, user);
        this.enabled = true;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public synchronized List<UserIdentity> getMembers() {
        return new ArrayList<UserIdentity>(members.values());
    }

    public synchronized List<UserIdentity> getOperators() {
        return new ArrayList<UserIdentity>(operators.values());
    }

    public synchronized List<ClientConnection> getClients() {
        return new ArrayList<ClientConnection>(members.keySet());
    }

    public synchronized int getMemberCount() {
        return members.size();
    }

    public synchronized UserIdentity getMember(ClientConnection client) {
        return members.get(client);
    }

    public synchronized boolean isMember(ClientConnection client) {
        return members.containsKey(client);
    }

    public synchronized boolean isOperator(ClientConnection client) {
        return operators.containsKey(client);
    }

    /**
     * Add a (non-operator) member.
     * Returns false if the channel is disabled or client is a member
     * already.
     */
    public synchronized boolean addMember(ClientConnection client,
                                          UserIdentity user) {
        if (! enabled || members.containsKey(client)) return false;
        members.put(client, user);
        return true;
    }

    /**
     * Remove a member and revoke its operator status.
     * If this empties the channel, it is disabled for good.
     * Returns the removed user, or null if client was no member.
     */
    public synchronized UserIdentity removeMember(ClientConnection client) {
        UserIdentity ret = members.remove(client);
        operators.remove(client);
        if (ret != null && members.isEmpty()) enabled = false;
        return ret;
    }

    public synchronized boolean removeOperator(ClientConnection client) {
        return (operators.remove(client) != null);
    }

    /**
     * Disable the channel and forget all members.
     */
    public synchronized void disable() {
        enabled = false;
        members.clear();
        operators.clear();
    }

    /**
     * Append the operators (count, then username/hostname pairs).
     * Disabled users are skipped and not counted.
     */
    public synchronized void writeOperators(TypedBuffer buf) {
        writeUsers(buf, operators);
    }

    /**
     * Append the members in the same format as writeOperators().
     */
    public synchronized void writeMembers(TypedBuffer buf) {
        writeUsers(buf, members);
    }

    /**
     * Send payload to every enabled member except exclude (which may be
     * null). Holding the monitor for the whole loop makes the recipient set
     * consistent with concurrent joins and leaves.
     */
    public synchronized int broadcast(Notifier notifier, int messageType,
                                      TypedBuffer payload,
                                      ClientConnection exclude) {
        int sent = 0;
        for (Map.Entry<ClientConnection, UserIdentity> e :
             members.entrySet()) {
            if (e.getKey() == exclude || ! e.getValue().isEnabled())
                continue;
            notifier.sendUnicast(e.getKey(), ComponentType.CHANNEL,
                                 messageType, payload);
            sent++;
        }
        return sent;
    }

    public String toString() {
        return getClass().getSimpleName() + "[" + name +
            ((enabled) ? "" : ",disabled") + "]";
    }

    private static void writeUsers(TypedBuffer buf,
            Map<ClientConnection, UserIdentity> users) {
        List<UserIdentity> listed = new ArrayList<UserIdentity>();
        for (UserIdentity u : users.values()) {
            if (u.isEnabled()) listed.add(u);
        }
        buf.writeUInt32(listed.size());
        for (UserIdentity u : listed) {
            buf.writeString(u.getUsername());
            buf.writeString(u.getHostname());
        }
    }

}
