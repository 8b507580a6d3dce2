package net.parley.api;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * A fully established connection to a client.
 * Instances are used as map keys by the core; implementations must keep
 * identity-based equals() and hashCode().
 */
public interface ClientConnection {

    /**
     * A short identifier unique among the connections of this process.
     * Only used for logging.
     */
    String getID();

    /**
     * The address of the peer, or null if it is not known (anymore).
     */
    InetSocketAddress getRemoteAddress();

    /**
     * Submit a complete frame for delivery.
     * This only enqueues the data; it never waits for the peer. Frames sent
     * to a connection that is already closed are dropped.
     */
    void send(ByteBuffer frame);

    /**
     * Close the connection with the given status code.
     * The disconnect handlers of all components run afterwards.
     */
    void close(int code, String reason);

}
