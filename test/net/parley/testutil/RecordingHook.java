package net.parley.testutil;

import java.util.ArrayList;
import java.util.List;
import net.parley.api.Channel;
import net.parley.api.ChannelHook;
import net.parley.api.ResultCode;
import net.parley.api.UserIdentity;

/**
 * Records hook calls as strings such as "joined #a alice" or
 * "joinCompleted OK alice".
 */
public class RecordingHook implements ChannelHook {

    private final List<String> calls = new ArrayList<String>();

    public synchronized void onChannelCreated(Channel channel) {
        calls.add("created " + channel.getName());
    }

    public synchronized void onChannelJoined(Channel channel,
                                             UserIdentity user) {
        calls.add("joined " + channel.getName() + " " + user.getUsername());
    }

    public synchronized void onChannelLeft(Channel channel,
                                           UserIdentity user) {
        calls.add("left " + channel.getName() + " " + user.getUsername());
    }

    public synchronized void onJoinCompleted(ResultCode result,
                                             UserIdentity user) {
        calls.add("joinCompleted " + result + " " + user.getUsername());
    }

    public synchronized void onLeaveCompleted(ResultCode result,
                                              UserIdentity user) {
        calls.add("leaveCompleted " + result + " " + user.getUsername());
    }

    public synchronized List<String> getCalls() {
        return new ArrayList<String>(calls);
    }

    public synchronized void clear() {
        calls.clear();
    }

}
