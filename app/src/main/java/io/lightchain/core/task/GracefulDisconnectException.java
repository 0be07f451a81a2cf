package io.lightchain.core.task;

/** The server misbehaved; drop the connection and carry on with another one. */
public class GracefulDisconnectException extends RuntimeException {
    public GracefulDisconnectException(String message) {
        super(message);
    }

    public GracefulDisconnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
