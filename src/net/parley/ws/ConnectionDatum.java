package net.parley.ws;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import net.parley.api.ClientConnection;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;

// WebSocket.send() only appends to the connection's output queue, which
// the selector thread drains; so send() never blocks the caller. The remote
// address is captured up front since the library reports null once the
// socket is closed, and we still want it for logging.
public class ConnectionDatum implements ClientConnection {

    private static final Logger LOGGER = Logger.getLogger("ConnDatum");

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final WebSocket connection;
    private final String id;
    private final InetSocketAddress remoteAddress;

    public ConnectionDatum(WebSocket connection) {
        this.connection = connection;
        this.id = "c" + SEQUENCE.incrementAndGet();
        this.remoteAddress = connection.getRemoteSocketAddress();
    }

    public WebSocket getConnection() {
        return connection;
    }

    public String getID() {
        return id;
    }

    public InetSocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    public void send(ByteBuffer frame) {
        try {
            connection.send(frame);
        } catch (WebsocketNotConnectedException exc) {
            LOGGER.finer("Dropping frame for closed connection " + id);
        }
    }

    public void close(int code, String reason) {
        connection.close(code, reason);
    }

    public String toString() {
        return id + "/" + remoteAddress;
    }

}
