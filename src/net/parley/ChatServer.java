package net.parley;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.parley.api.ClientConnection;
import net.parley.api.Component;
import net.parley.api.ComponentType;
import net.parley.api.Notifier;
import net.parley.hooks.AuditHook;
import net.parley.proto.ChannelComponent;
import net.parley.proto.ChannelDirectory;
import net.parley.proto.DirectoryGC;
import net.parley.proto.Frame;
import net.parley.user.UserComponent;
import net.parley.util.TypedBuffer;
import net.parley.util.Util;
import net.parley.util.config.DynamicConfiguration;
import net.parley.util.config.PropertiesConfiguration;
import net.parley.ws.ParleyWebSocketServer;

public class ChatServer implements Notifier {

    private static final Logger LOGGER = Logger.getLogger("ChatServer");

    public static final String K_HOST = "parley.host";
    public static final String K_PORT = "parley.port";
    public static final String K_AUDIT = "parley.audit";
    public static final String K_GC_INTERVAL = "parley.gc.interval";

    public static final int DEFAULT_PORT = 8080;
    public static final int SHUTDOWN_TIME = 1000;

    private final Map<ComponentType, Component> components;
    private DynamicConfiguration config;
    private ChannelDirectory directory;
    private UserComponent users;
    private ChannelComponent channels;
    private ParleyWebSocketServer server;
    private ScheduledExecutorService jobScheduler;
    private boolean running;

    public ChatServer() {
        components = new LinkedHashMap<ComponentType, Component>();
    }

    public DynamicConfiguration getConfig() {
        return config;
    }
    public void setConfig(DynamicConfiguration cfg) {
        config = cfg;
    }
    public DynamicConfiguration makeConfig() {
        if (config == null) {
            config = DynamicConfiguration.makeDefault();
        }
        return config;
    }

    public void addConfigFile(File path) throws IOException {
        makeConfig().addSource(PropertiesConfiguration.load(path));
    }

    public ChannelDirectory getDirectory() {
        return directory;
    }
    public ChannelDirectory makeDirectory() {
        if (directory == null) {
            directory = new ChannelDirectory();
        }
        return directory;
    }

    public UserComponent getUsers() {
        return users;
    }
    public UserComponent makeUsers() {
        if (users == null) {
            users = new UserComponent(this);
            addComponent(users);
        }
        return users;
    }

    public ChannelComponent getChannels() {
        return channels;
    }
    public ChannelComponent makeChannels() {
        if (channels == null) {
            channels = new ChannelComponent(makeDirectory(), makeUsers(),
                                            this);
            if (makeConfig().getBoolean(K_AUDIT))
                channels.addHook(new AuditHook());
            addComponent(channels);
        }
        return channels;
    }

    public ParleyWebSocketServer getServer() {
        return server;
    }
    public ParleyWebSocketServer makeServer() {
        if (server == null) {
            String host = makeConfig().get(K_HOST);
            int port = makeConfig().getInt(K_PORT, DEFAULT_PORT);
            InetSocketAddress addr;
            if (! Util.nonempty(host) || host.equals("*")) {
                addr = new InetSocketAddress(port);
            } else {
                addr = new InetSocketAddress(host, port);
            }
            server = new ParleyWebSocketServer(this, addr);
        }
        return server;
    }

    public ScheduledExecutorService getJobScheduler() {
        return jobScheduler;
    }
    public ScheduledExecutorService makeJobScheduler() {
        if (jobScheduler == null) {
            jobScheduler = Executors.newSingleThreadScheduledExecutor();
        }
        return jobScheduler;
    }

    public Future<?> scheduleJob(Runnable callback, long delay,
                                 long period) {
        return makeJobScheduler().scheduleAtFixedRate(callback, delay,
            period, TimeUnit.MILLISECONDS);
    }

    public synchronized void addComponent(Component comp) {
        if (components.containsKey(comp.getType()))
            throw new IllegalStateException("Duplicate component for " +
                comp.getType());
        components.put(comp.getType(), comp);
    }

    public synchronized Component getComponent(ComponentType type) {
        return components.get(type);
    }

    public synchronized List<Component> getComponents() {
        return Collections.unmodifiableList(
            new ArrayList<Component>(components.values()));
    }

    public void sendUnicast(ClientConnection client, ComponentType component,
                            int messageType, TypedBuffer payload) {
        client.send(Frame.encode(component, messageType, payload));
    }

    /**
     * Route an inbound frame to its component.
     * Returns false if no component takes it; the caller should then drop
     * the connection.
     */
    public boolean dispatch(ClientConnection client, Frame frame) {
        ComponentType type = ComponentType.forCode(frame.getComponent());
        Component comp = (type == null) ? null : getComponent(type);
        if (comp == null) return false;
        try {
            return comp.handle(client, frame.getMessageType(),
                               frame.getPayload());
        } catch (RuntimeException exc) {
            LOGGER.log(Level.SEVERE, "Exception while handling message " +
                "from " + client.getID() + ":", exc);
            return false;
        }
    }

    public void clientConnected(ClientConnection client) {
        for (Component c : getComponents()) {
            c.onClientConnected(client);
        }
    }

    // Reverse order: dependent components (channels) forget a connection
    // before the ones they depend on (users) do.
    public void clientDisconnected(ClientConnection client) {
        List<Component> comps = new ArrayList<Component>(getComponents());
        Collections.reverse(comps);
        for (Component c : comps) {
            try {
                c.onClientDisconnected(client);
            } catch (RuntimeException exc) {
                LOGGER.log(Level.SEVERE, "Exception during disconnect of " +
                    client.getID() + ":", exc);
            }
        }
    }

    public void setup() {
        makeConfig();
        makeUsers();
        makeChannels();
        for (Component c : getComponents()) c.initialize();
        long interval = makeConfig().getLong(K_GC_INTERVAL,
                                             DirectoryGC.DEFAULT_INTERVAL);
        scheduleJob(new DirectoryGC(makeDirectory()), interval, interval);
    }

    public synchronized void start() {
        if (running) return;
        for (Component c : getComponents()) c.onStart();
        running = true;
    }

    public synchronized void stop() {
        if (! running) return;
        running = false;
        for (Component c : getComponents()) c.onStop();
    }

    public void shutdown() {
        stop();
        if (server != null) {
            try {
                server.stop(SHUTDOWN_TIME);
            } catch (InterruptedException exc) {
                Thread.currentThread().interrupt();
            }
        }
        if (jobScheduler != null) jobScheduler.shutdownNow();
        for (Component c : getComponents()) c.shutdown();
    }

    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread("Server closer") {

            {
                setPriority(MAX_PRIORITY);
            }

            public void run() {
                shutdown();
            }

        });
    }

    public void launch() {
        ParleyWebSocketServer srv = makeServer();
        start();
        LOGGER.info("Serving channels on " + srv.getAddress() + "...");
        // Binding happens in run(), which returns when the server stops.
        srv.run();
    }

}
