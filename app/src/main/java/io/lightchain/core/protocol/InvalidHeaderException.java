package io.lightchain.core.protocol;

public class InvalidHeaderException extends MalformedDataException {
    public InvalidHeaderException(String message) {
        super(message);
    }
}
