package net.parley.api;

import net.parley.util.TypedBuffer;

/**
 * Delivers a typed message to a single connection.
 * The core decides who receives what; implementations decide how the bytes
 * travel. Implementations must not block, since the core calls them while
 * holding channel locks. Delivery failures are not reported back.
 */
public interface Notifier {

    /**
     * Send payload to client, tagged with the given component and message
     * type. The payload is not modified and may be sent to several
     * recipients in turn.
     */
    void sendUnicast(ClientConnection client, ComponentType component,
                     int messageType, TypedBuffer payload);

}
