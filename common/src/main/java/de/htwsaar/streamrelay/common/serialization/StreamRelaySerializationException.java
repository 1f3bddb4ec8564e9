package de.htwsaar.streamrelay.common.serialization;

public class StreamRelaySerializationException extends RuntimeException {

    public StreamRelaySerializationException(String message) {

        super(message);
    }

    public StreamRelaySerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
