package net.parley;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.parley.util.Logging;

public class Main implements Runnable {

    public static final String APPNAME = "Parley";
    public static final String VERSION = "1.0.0";

    public static final String K_LOG_LEVEL = "parley.log.level";

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
    }

    private final String[] args;
    private ChatServer server;

    public Main(String[] args) {
        this.args = args;
        this.server = new ChatServer();
    }

    public ChatServer getServer() {
        return server;
    }
    public void setServer(ChatServer s) {
        server = s;
    }

    /**
     * Apply the command line to the server's configuration.
     * Accepted: [--host ADDR] [--config FILE] [--log-level LEVEL]
     * [-o KEY=VALUE]... [PORT]. Throws IllegalArgumentException on bad
     * usage.
     */
    protected void parseArguments() throws IOException {
        boolean portSeen = false;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--host":
                    server.makeConfig().put(ChatServer.K_HOST,
                                            value(a, ++i));
                    break;
                case "--config":
                    server.addConfigFile(new File(value(a, ++i)));
                    break;
                case "--log-level":
                    server.makeConfig().put(K_LOG_LEVEL, value(a, ++i));
                    break;
                case "-o":
                    String kv = value(a, ++i);
                    int eq = kv.indexOf('=');
                    if (eq <= 0)
                        throw new IllegalArgumentException("Bad option " +
                            kv + " (expected KEY=VALUE)");
                    server.makeConfig().put(kv.substring(0, eq),
                                            kv.substring(eq + 1));
                    break;
                default:
                    if (a.startsWith("-") || portSeen)
                        throw new IllegalArgumentException("Unrecognized " +
                            "argument " + a);
                    try {
                        Integer.parseInt(a);
                    } catch (NumberFormatException exc) {
                        throw new IllegalArgumentException("Invalid port " +
                            a);
                    }
                    server.makeConfig().put(ChatServer.K_PORT, a);
                    portSeen = true;
                    break;
            }
        }
    }

    private String value(String option, int idx) {
        if (idx >= args.length)
            throw new IllegalArgumentException("Missing value for " +
                option);
        return args[idx];
    }

    public void run() {
        try {
            parseArguments();
        } catch (IllegalArgumentException exc) {
            System.err.println(APPNAME + ": " + exc.getMessage());
            System.exit(1);
        } catch (IOException exc) {
            System.err.println(APPNAME + ": cannot read configuration: " +
                exc.getMessage());
            System.exit(1);
        }
        String level = server.makeConfig().get(K_LOG_LEVEL);
        if (level != null) Logging.setLevel(level);
        LOGGER.info(APPNAME + " " + VERSION);
        try {
            server.setup();
        } catch (RuntimeException exc) {
            LOGGER.log(Level.SEVERE, "Exception during setup:", exc);
            System.exit(2);
        }
        server.registerShutdownHook();
        server.launch();
    }

    public static void main(String[] args) {
        new Main(args).run();
    }

}
