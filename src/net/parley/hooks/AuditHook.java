package net.parley.hooks;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.parley.api.Channel;
import net.parley.api.ChannelHook;
import net.parley.api.ResultCode;
import net.parley.api.UserIdentity;
import net.parley.util.Util;
import org.json.JSONObject;

/**
 * Writes every channel event as a single-line JSON record to the "Audit"
 * logger.
 */
public class AuditHook implements ChannelHook {

    public static final String LOGGER_NAME = "Audit";

    private final Logger logger;
    private final Level level;

    public AuditHook(Logger logger, Level level) {
        this.logger = logger;
        this.level = level;
    }
    public AuditHook() {
        this(Logger.getLogger(LOGGER_NAME), Level.INFO);
    }

    public Logger getLogger() {
        return logger;
    }

    public void onChannelCreated(Channel channel) {
        record("created", channel, null, null);
    }

    public void onChannelJoined(Channel channel, UserIdentity user) {
        record("joined", channel, user, null);
    }

    public void onChannelLeft(Channel channel, UserIdentity user) {
        record("left", channel, user, null);
    }

    public void onJoinCompleted(ResultCode result, UserIdentity user) {
        record("join-completed", null, user, result);
    }

    public void onLeaveCompleted(ResultCode result, UserIdentity user) {
        record("leave-completed", null, user, result);
    }

    protected void record(String event, Channel channel, UserIdentity user,
                          ResultCode result) {
        if (! logger.isLoggable(level)) return;
        logger.log(level, makeRecord(event, channel, user, result)
            .toString());
    }

    public static JSONObject makeRecord(String event, Channel channel,
                                        UserIdentity user,
                                        ResultCode result) {
        return Util.createJSONObject("event", event,
            "channel", (channel == null) ? null : channel.getName(),
            "user", (user == null) ? null : user.getUsername(),
            "host", (user == null) ? null : user.getHostname(),
            "result", (result == null) ? null : result.name(),
            "timestamp", System.currentTimeMillis());
    }

}
