package net.parley.util;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Logging {

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    /**
     * Apply the given level to the root logger and all its handlers.
     * Unknown level names are reported and leave the configuration alone.
     */
    public static boolean setLevel(String name) {
        Level level;
        try {
            level = Level.parse(name.toUpperCase());
        } catch (IllegalArgumentException exc) {
            Logger.getLogger("Logging").warning("Unknown log level " +
                name);
            return false;
        }
        Logger rootLogger = Logger.getLogger("");
        rootLogger.setLevel(level);
        for (Handler hnd : rootLogger.getHandlers()) {
            hnd.setLevel(level);
        }
        return true;
    }

}
