package net.parley.ws;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.parley.ChatServer;
import net.parley.proto.Frame;
import net.parley.util.MalformedDataException;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

public class ParleyWebSocketServer extends WebSocketServer {

    private static final Logger LOGGER = Logger.getLogger("PWSServer");

    private final ChatServer parent;

    public ParleyWebSocketServer(ChatServer parent, InetSocketAddress addr) {
        super(addr);
        this.parent = parent;
        setReuseAddr(true);
    }

    public ChatServer getParent() {
        return parent;
    }

    @Override
    public void onStart() {
        LOGGER.info("Listening on " + getAddress());
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        ConnectionDatum d = new ConnectionDatum(conn);
        conn.setAttachment(d);
        LOGGER.fine("Connection " + d + " opened");
        parent.clientConnected(d);
    }

    @Override
    public void onMessage(WebSocket conn, ByteBuffer message) {
        ConnectionDatum d = conn.getAttachment();
        if (d == null) return;
        Frame frame;
        try {
            frame = Frame.parse(message);
        } catch (MalformedDataException exc) {
            LOGGER.info("Bad frame from " + d + ": " + exc.getMessage());
            d.close(CloseFrame.POLICY_VALIDATION, "Malformed frame");
            return;
        }
        if (! parent.dispatch(d, frame)) {
            LOGGER.info("Unhandled message " + frame.getComponent() + "/" +
                frame.getMessageType() + " from " + d + "; dropping");
            d.close(CloseFrame.POLICY_VALIDATION, "Protocol violation");
        }
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        ConnectionDatum d = conn.getAttachment();
        if (d == null) return;
        d.close(CloseFrame.REFUSE, "Binary frames only");
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason,
                        boolean remote) {
        ConnectionDatum d = conn.getAttachment();
        if (d == null) return;
        conn.setAttachment(null);
        LOGGER.fine("Connection " + d + " closed (" + code + ")");
        parent.clientDisconnected(d);
    }

    @Override
    public void onError(WebSocket conn, Exception exc) {
        if (conn == null) {
            LOGGER.log(Level.SEVERE, "Server error", exc);
            return;
        }
        LOGGER.log(Level.WARNING, "Error on connection " +
            conn.getAttachment(), exc);
    }

}
