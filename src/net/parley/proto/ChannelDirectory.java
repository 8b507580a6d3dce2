package net.parley.proto;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.parley.api.ClientConnection;
import net.parley.api.UserIdentity;

/*
 * The directory's monitor only guards the name index. It is never held
 * while a channel's monitor is acquired; callers look a channel up, leave
 * the directory, and only then lock the channel.
 */
public class ChannelDirectory {

    private static final Logger LOGGER = Logger.getLogger("ChanDir");

    public interface Visitor {

        void visit(ChatChannel channel);

    }

    public interface CreationHandler {

        /**
         * Called with the directory locked, right after channel became
         * visible. Must not touch the directory or block.
         */
        void channelCreated(ChatChannel channel);

    }

    public static class Resolution {

        private final ChatChannel channel;
        private final boolean created;

        public Resolution(ChatChannel channel, boolean created) {
            this.channel = channel;
            this.created = created;
        }

        public ChatChannel getChannel() {
            return channel;
        }

        public boolean isCreated() {
            return created;
        }

    }

    private final Map<String, ChatChannel> channels;

    public ChannelDirectory() {
        channels = new LinkedHashMap<String, ChatChannel>();
    }

    /**
     * The enabled channel called name, or null.
     */
    public synchronized ChatChannel find(String name) {
        ChatChannel ret = channels.get(name);
        return (ret == null || ! ret.isEnabled()) ? null : ret;
    }

    /**
     * Register a new channel with client as its only member and operator.
     * A disabled channel of the same name is replaced; an enabled one is an
     * error.
     */
    public synchronized ChatChannel create(String name,
            ClientConnection client, UserIdentity user) {
        if (find(name) != null)
            throw new IllegalStateException("Channel " + name +
                " exists already");
        ChatChannel ret = new ChatChannel(name, client, user);
        channels.put(name, ret);
        LOGGER.fine("Created channel " + name);
        return ret;
    }

    /**
     * Look up the enabled channel called name, creating it (with client as
     * the founder) if there is none. Lookup and creation form one critical
     * section, so concurrent callers agree on a single channel.
     */
    public synchronized Resolution findOrCreate(String name,
            ClientConnection client, UserIdentity user,
            CreationHandler handler) {
        ChatChannel existing = find(name);
        if (existing != null) return new Resolution(existing, false);
        ChatChannel ret = create(name, client, user);
        if (handler != null) handler.channelCreated(ret);
        return new Resolution(ret, true);
    }

    /**
     * Drop channel from the index if it is disabled and still the entry
     * for its name. Returns whether anything was removed.
     */
    public synchronized boolean evict(ChatChannel channel) {
        if (channel.isEnabled() || channels.get(channel.getName()) != channel)
            return false;
        channels.remove(channel.getName());
        LOGGER.fine("Evicted channel " + channel.getName());
        return true;
    }

    /**
     * Remove all disabled channels. Returns how many there were.
     */
    public synchronized int compact() {
        int ret = 0;
        Iterator<ChatChannel> it = channels.values().iterator();
        while (it.hasNext()) {
            if (! it.next().isEnabled()) {
                it.remove();
                ret++;
            }
        }
        return ret;
    }

    public synchronized List<ChatChannel> getActiveChannels() {
        List<ChatChannel> ret = new ArrayList<ChatChannel>();
        for (ChatChannel ch : channels.values()) {
            if (ch.isEnabled()) ret.add(ch);
        }
        return ret;
    }

    /**
     * Run visitor on every channel that is enabled when the call starts.
     * The visitor runs without the directory locked; channels created
     * meanwhile may or may not be visited, and a channel may have become
     * disabled by the time it is visited.
     */
    public void forEachEnabled(Visitor visitor) {
        for (ChatChannel ch : getActiveChannels()) {
            visitor.visit(ch);
        }
    }

    /**
     * The number of index entries, including not yet evicted disabled
     * channels.
     */
    public synchronized int size() {
        return channels.size();
    }

    /**
     * Disable and forget all channels.
     */
    public void clear() {
        List<ChatChannel> old;
        synchronized (this) {
            old = new ArrayList<ChatChannel>(channels.values());
            channels.clear();
        }
        for (ChatChannel ch : old) ch.disable();
    }

}
