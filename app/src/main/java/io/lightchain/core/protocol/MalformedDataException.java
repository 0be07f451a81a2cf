package io.lightchain.core.protocol;

/** Local, non-retryable rejection of a structurally invalid item (bad length, bad encoding, bad proof shape). */
public class MalformedDataException extends IllegalArgumentException {
    public MalformedDataException(String message) {
        super(message);
    }

    public MalformedDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
