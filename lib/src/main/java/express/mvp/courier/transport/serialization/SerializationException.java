package express.mvp.courier.transport.serialization;

import express.mvp.courier.transport.TransportException;

/**
 * Base class for failures converting between frames and messages.
 *
 * <p>A serialization failure concerns one frame only. The byte stream stays aligned, so a receive
 * loop reports the failure and keeps reading.
 */
public class SerializationException extends TransportException {

    private final int typeId;

    public SerializationException(int typeId, String message) {
        super(message);
        this.typeId = typeId;
    }

    public SerializationException(int typeId, String message, Throwable cause) {
        super(message, cause);
        this.typeId = typeId;
    }

    /**
     * Returns the type id of the frame or message that failed.
     *
     * @return the type id
     */
    public int getTypeId() {
        return typeId;
    }
}
