package net.parley.testutil;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import net.parley.api.ClientConnection;
import net.parley.api.ComponentType;
import net.parley.api.Notifier;
import net.parley.util.TypedBuffer;

public class RecordingNotifier implements Notifier {

    public static class Sent {

        public final ClientConnection client;
        public final ComponentType component;
        public final int messageType;
        private final byte[] payload;

        public Sent(ClientConnection client, ComponentType component,
                    int messageType, byte[] payload) {
            this.client = client;
            this.component = component;
            this.messageType = messageType;
            this.payload = payload;
        }

        /**
         * A fresh reader over the payload.
         */
        public TypedBuffer payload() {
            return new TypedBuffer(ByteBuffer.wrap(payload));
        }

    }

    private final List<Sent> sent = new ArrayList<Sent>();

    public synchronized void sendUnicast(ClientConnection client,
                                         ComponentType component,
                                         int messageType,
                                         TypedBuffer payload) {
        sent.add(new Sent(client, component, messageType,
                          payload.toByteArray()));
    }

    public synchronized List<Sent> all() {
        return new ArrayList<Sent>(sent);
    }

    public synchronized List<Sent> to(ClientConnection client) {
        List<Sent> ret = new ArrayList<Sent>();
        for (Sent s : sent) {
            if (s.client == client) ret.add(s);
        }
        return ret;
    }

    public synchronized List<Sent> to(ClientConnection client,
                                      int messageType) {
        List<Sent> ret = new ArrayList<Sent>();
        for (Sent s : sent) {
            if (s.client == client && s.messageType == messageType)
                ret.add(s);
        }
        return ret;
    }

    public synchronized void clear() {
        sent.clear();
    }

}
