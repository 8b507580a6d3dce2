package net.parley.proto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.parley.api.ChannelHook;
import net.parley.api.ClientConnection;
import net.parley.api.Component;
import net.parley.api.ComponentType;
import net.parley.api.Notifier;
import net.parley.api.ResultCode;
import net.parley.api.UserIdentity;
import net.parley.api.UserLookup;
import net.parley.util.MalformedDataException;
import net.parley.util.TypedBuffer;

/*
 * Lock order: the directory is only ever locked on its own (or with
 * nothing but a non-blocking send inside, for the creation reply); channel
 * monitors are taken after the directory lookup has returned. Hooks run
 * after every lock has been released.
 */
public class ChannelComponent implements Component {

    private static final Logger LOGGER = Logger.getLogger("ChannelComp");

    public static final String CHANNEL_MARKER = "#";

    private class Sweeper implements ChannelDirectory.Visitor {

        private final ClientConnection client;
        private final List<ChannelEvent> events;
        private int count;

        public Sweeper(ClientConnection client) {
            this.client = client;
            this.events = new ArrayList<ChannelEvent>();
        }

        public void visit(ChatChannel channel) {
            UserIdentity user;
            synchronized (channel) {
                if (! channel.isEnabled()) return;
                user = channel.getMember(client);
                if (user != null) {
                    channel.broadcast(notifier,
                        ChannelMessageType.LEAVE_CHANNEL,
                        makeNotice(ResultCode.USER_LEFT, user), client);
                    channel.removeMember(client);
                }
                channel.removeOperator(client);
            }
            if (user == null) return;
            events.add(ChannelEvent.left(channel, user));
            count++;
            if (! channel.isEnabled()) directory.evict(channel);
        }

    }

    private final ChannelDirectory directory;
    private final UserLookup users;
    private final Notifier notifier;
    private final List<ChannelHook> hooks;

    public ChannelComponent(ChannelDirectory directory, UserLookup users,
                            Notifier notifier) {
        this.directory = directory;
        this.users = users;
        this.notifier = notifier;
        this.hooks = new CopyOnWriteArrayList<ChannelHook>();
    }

    public ChannelDirectory getDirectory() {
        return directory;
    }

    public List<ChannelHook> getHooks() {
        return Collections.unmodifiableList(hooks);
    }
    public void addHook(ChannelHook h) {
        hooks.add(h);
    }
    public void removeHook(ChannelHook h) {
        hooks.remove(h);
    }

    public ComponentType getType() {
        return ComponentType.CHANNEL;
    }

    public void initialize() {
        LOGGER.fine("Channel component initialized");
    }

    public void shutdown() {
        directory.clear();
    }

    public void onStart() {
        /* NOP */
    }

    public void onStop() {
        directory.clear();
    }

    public void onClientConnected(ClientConnection client) {
        /* NOP */
    }

    public void onClientDisconnected(ClientConnection client) {
        int count = sweep(client);
        if (count != 0)
            LOGGER.fine("Removed " + client.getID() + " from " + count +
                " channel(s) on disconnect");
    }

    public boolean handle(ClientConnection client, int messageType,
                          TypedBuffer payload) {
        switch (messageType) {
            case ChannelMessageType.JOIN_CHANNEL:
                return handleJoin(client, payload);
            case ChannelMessageType.LEAVE_CHANNEL:
                return handleLeave(client, payload);
            default:
                return false;
        }
    }

    protected boolean handleJoin(ClientConnection client,
                                 TypedBuffer payload) {
        String name;
        try {
            name = payload.readString();
        } catch (MalformedDataException exc) {
            LOGGER.info("Malformed join request from " + client.getID() +
                ": " + exc.getMessage());
            return false;
        }
        UserIdentity user = users.getUser(client);
        if (user == null) {
            LOGGER.warning("No user for connection " + client.getID() +
                " (join)");
            return false;
        }
        join(client, user, name);
        return true;
    }

    protected boolean handleLeave(ClientConnection client,
                                  TypedBuffer payload) {
        String name;
        try {
            name = payload.readString();
        } catch (MalformedDataException exc) {
            LOGGER.info("Malformed leave request from " + client.getID() +
                ": " + exc.getMessage());
            return false;
        }
        UserIdentity user = users.getUser(client);
        if (user == null) {
            LOGGER.warning("No user for connection " + client.getID() +
                " (leave)");
            return false;
        }
        leave(client, user, name);
        return true;
    }

    /**
     * Add client (acting as user) to the named channel, creating it if
     * necessary, and answer the client.
     */
    public ResultCode join(final ClientConnection client,
                           final UserIdentity user, String name) {
        List<ChannelEvent> events = new ArrayList<ChannelEvent>();
        ResultCode result = joinInner(client, user, name, events);
        dispatch(events);
        return result;
    }

    /**
     * Remove client from the named channel and answer the client.
     */
    public ResultCode leave(ClientConnection client, UserIdentity user,
                            String name) {
        List<ChannelEvent> events = new ArrayList<ChannelEvent>();
        ResultCode result = leaveInner(client, user, name, events);
        dispatch(events);
        return result;
    }

    /**
     * Remove client from every channel it is a member of, notifying the
     * remaining members. Returns the number of channels left.
     */
    public int sweep(ClientConnection client) {
        Sweeper s = new Sweeper(client);
        directory.forEachEnabled(s);
        dispatch(s.events);
        return s.count;
    }

    private ResultCode joinInner(final ClientConnection client,
                                 UserIdentity user, String name,
                                 List<ChannelEvent> events) {
        ResultCode early = validate(user, name);
        if (early != null) {
            replyJoin(client, early);
            events.add(ChannelEvent.joinCompleted(early, user));
            return early;
        }
        for (;;) {
            ChannelDirectory.Resolution res = directory.findOrCreate(name,
                client, user, new ChannelDirectory.CreationHandler() {
                    public void channelCreated(ChatChannel channel) {
                        replyJoin(client, ResultCode.CHANNEL_CREATED);
                    }
                });
            ChatChannel channel = res.getChannel();
            if (res.isCreated()) {
                events.add(ChannelEvent.joinCompleted(
                    ResultCode.CHANNEL_CREATED, user));
                events.add(ChannelEvent.created(channel));
                events.add(ChannelEvent.joined(channel, user));
                return ResultCode.CHANNEL_CREATED;
            }
            synchronized (channel) {
                // Emptied between lookup and locking; look again.
                if (! channel.isEnabled()) continue;
                if (! channel.addMember(client, user)) {
                    replyJoin(client, ResultCode.ALREADY_IN_CHANNEL);
                    events.add(ChannelEvent.joinCompleted(
                        ResultCode.ALREADY_IN_CHANNEL, user));
                    return ResultCode.ALREADY_IN_CHANNEL;
                }
                TypedBuffer reply = new TypedBuffer();
                reply.writeUInt16(ResultCode.OK.getCode());
                channel.writeOperators(reply);
                channel.writeMembers(reply);
                notifier.sendUnicast(client, ComponentType.CHANNEL,
                    ChannelMessageType.JOIN_CHANNEL_COMPLETE, reply);
                channel.broadcast(notifier, ChannelMessageType.JOIN_CHANNEL,
                    makeNotice(ResultCode.USER_JOINED, user), null);
            }
            events.add(ChannelEvent.joinCompleted(ResultCode.OK, user));
            events.add(ChannelEvent.joined(channel, user));
            return ResultCode.OK;
        }
    }

    private ResultCode leaveInner(ClientConnection client, UserIdentity user,
                                  String name, List<ChannelEvent> events) {
        ResultCode result = validate(user, name);
        ChatChannel channel = null;
        UserIdentity member = null;
        if (result == null) {
            channel = directory.find(name);
            if (channel == null) result = ResultCode.INVALID_CHANNEL_NAME;
        }
        if (result == null) {
            synchronized (channel) {
                member = channel.getMember(client);
                if (! channel.isEnabled()) {
                    result = ResultCode.INVALID_CHANNEL_NAME;
                } else if (member == null) {
                    result = ResultCode.NOT_IN_CHANNEL;
                } else {
                    // The leaving member is notified as well.
                    channel.broadcast(notifier,
                        ChannelMessageType.LEAVE_CHANNEL,
                        makeNotice(ResultCode.USER_LEFT, member), null);
                    channel.removeMember(client);
                    result = ResultCode.OK;
                }
            }
        }
        if (result != ResultCode.OK) {
            replyLeave(client, result, null);
            events.add(ChannelEvent.leaveCompleted(result, user));
            return result;
        }
        if (! channel.isEnabled()) directory.evict(channel);
        events.add(ChannelEvent.left(channel, member));
        replyLeave(client, ResultCode.OK, name);
        events.add(ChannelEvent.leaveCompleted(ResultCode.OK, user));
        return ResultCode.OK;
    }

    private ResultCode validate(UserIdentity user, String name) {
        if (! user.isIdentified()) return ResultCode.NOT_IDENTIFIED;
        if (! isValidName(name)) return ResultCode.INVALID_CHANNEL_NAME;
        return null;
    }

    private void replyJoin(ClientConnection client, ResultCode result) {
        TypedBuffer buf = new TypedBuffer();
        buf.writeUInt16(result.getCode());
        notifier.sendUnicast(client, ComponentType.CHANNEL,
                             ChannelMessageType.JOIN_CHANNEL_COMPLETE, buf);
    }

    private void replyLeave(ClientConnection client, ResultCode result,
                            String name) {
        TypedBuffer buf = new TypedBuffer();
        buf.writeUInt16(result.getCode());
        if (name != null) buf.writeString(name);
        notifier.sendUnicast(client, ComponentType.CHANNEL,
                             ChannelMessageType.LEAVE_CHANNEL_COMPLETE, buf);
    }

    private void dispatch(List<ChannelEvent> events) {
        for (ChannelEvent ev : events) {
            for (ChannelHook h : hooks) {
                try {
                    ev.deliver(h);
                } catch (RuntimeException exc) {
                    LOGGER.log(Level.SEVERE, "Channel hook " + h +
                        " failed on " + ev, exc);
                }
            }
        }
    }

    public static boolean isValidName(String name) {
        return (name != null && name.contains(CHANNEL_MARKER));
    }

    public static TypedBuffer makeNotice(ResultCode code, UserIdentity user) {
        TypedBuffer ret = new TypedBuffer();
        ret.writeUInt16(code.getCode());
        ret.writeString(user.getUsername());
        ret.writeString(user.getHostname());
        return ret;
    }

}
