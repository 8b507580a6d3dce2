package net.parley.api;

import net.parley.util.TypedBuffer;

/**
 * A subsystem of the server that owns one ComponentType's messages.
 * All methods may be called concurrently from different connections'
 * threads, except for the lifecycle methods, which the server calls in
 * order: initialize(), onStart(), ..., onStop(), shutdown().
 */
public interface Component {

    /**
     * The type whose messages are routed to handle().
     */
    ComponentType getType();

    /**
     * Prepare for use. Called once before the server accepts connections.
     */
    void initialize();

    /**
     * Release everything. Called once after onStop().
     */
    void shutdown();

    /**
     * The server has started accepting connections.
     */
    void onStart();

    /**
     * The server is stopping; all per-connection state must be dropped.
     */
    void onStop();

    /**
     * A new connection has been established.
     */
    void onClientConnected(ClientConnection client);

    /**
     * A connection is gone. No further messages from it will be handled.
     */
    void onClientDisconnected(ClientConnection client);

    /**
     * Process an inbound message.
     * Returns false if messageType is unknown, the payload is malformed, or
     * an internal error occurred; the caller drops the connection then.
     * Protocol-level failures are answered to the client and return true.
     */
    boolean handle(ClientConnection client, int messageType,
                   TypedBuffer payload);

}
