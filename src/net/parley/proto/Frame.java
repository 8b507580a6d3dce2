package net.parley.proto;

import java.nio.ByteBuffer;
import net.parley.api.ComponentType;
import net.parley.util.MalformedDataException;
import net.parley.util.TypedBuffer;

/**
 * A single wire message: component code, message type, payload.
 */
public class Frame {

    public static final int HEADER_SIZE = 4;

    private final int component;
    private final int messageType;
    private final TypedBuffer payload;

    public Frame(int component, int messageType, TypedBuffer payload) {
        this.component = component;
        this.messageType = messageType;
        this.payload = payload;
    }

    public int getComponent() {
        return component;
    }

    public int getMessageType() {
        return messageType;
    }

    public TypedBuffer getPayload() {
        return payload;
    }

    public static Frame parse(ByteBuffer data) throws MalformedDataException {
        TypedBuffer buf = new TypedBuffer(data);
        int component = buf.readUInt16();
        int type = buf.readUInt16();
        TypedBuffer payload = new TypedBuffer(buf.toByteBuffer());
        return new Frame(component, type, payload);
    }

    public static ByteBuffer encode(ComponentType component, int messageType,
                                    TypedBuffer payload) {
        TypedBuffer out = new TypedBuffer();
        out.writeUInt16(component.getCode());
        out.writeUInt16(messageType);
        out.write(payload);
        return ByteBuffer.wrap(out.toByteArray());
    }

}
