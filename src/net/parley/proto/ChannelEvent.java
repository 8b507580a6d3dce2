package net.parley.proto;

import net.parley.api.Channel;
import net.parley.api.ChannelHook;
import net.parley.api.ResultCode;
import net.parley.api.UserIdentity;

/**
 * A hook invocation recorded while channel locks are held and delivered
 * after they are released.
 */
public abstract class ChannelEvent {

    public enum Kind { CREATED, JOINED, LEFT, JOIN_COMPLETED, LEAVE_COMPLETED }

    private final Kind kind;
    private final Channel channel;
    private final UserIdentity user;
    private final ResultCode result;

    protected ChannelEvent(Kind kind, Channel channel, UserIdentity user,
                           ResultCode result) {
        this.kind = kind;
        this.channel = channel;
        this.user = user;
        this.result = result;
    }

    public Kind getKind() {
        return kind;
    }

    public Channel getChannel() {
        return channel;
    }

    public UserIdentity getUser() {
        return user;
    }

    public ResultCode getResult() {
        return result;
    }

    public abstract void deliver(ChannelHook hook);

    public String toString() {
        return kind + "[channel=" +
            ((channel == null) ? null : channel.getName()) + ",user=" +
            ((user == null) ? null : user.getUsername()) + ",result=" +
            result + "]";
    }

    public static ChannelEvent created(Channel channel) {
        return new ChannelEvent(Kind.CREATED, channel, null, null) {
            public void deliver(ChannelHook hook) {
                hook.onChannelCreated(getChannel());
            }
        };
    }

    public static ChannelEvent joined(Channel channel, UserIdentity user) {
        return new ChannelEvent(Kind.JOINED, channel, user, null) {
            public void deliver(ChannelHook hook) {
                hook.onChannelJoined(getChannel(), getUser());
            }
        };
    }

    public static ChannelEvent left(Channel channel, UserIdentity user) {
        return new ChannelEvent(Kind.LEFT, channel, user, null) {
            public void deliver(ChannelHook hook) {
                hook.onChannelLeft(getChannel(), getUser());
            }
        };
    }

    public static ChannelEvent joinCompleted(ResultCode result,
                                             UserIdentity user) {
        return new ChannelEvent(Kind.JOIN_COMPLETED, null, user, result) {
            public void deliver(ChannelHook hook) {
                hook.onJoinCompleted(getResult(), getUser());
            }
        };
    }

    public static ChannelEvent leaveCompleted(ResultCode result,
                                              UserIdentity user) {
        return new ChannelEvent(Kind.LEAVE_COMPLETED, null, user, result) {
            public void deliver(ChannelHook hook) {
                hook.onLeaveCompleted(getResult(), getUser());
            }
        };
    }

}
