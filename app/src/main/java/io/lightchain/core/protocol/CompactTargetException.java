package io.lightchain.core.protocol;

public class CompactTargetException extends MalformedDataException {
    public enum Kind { NEGATIVE, OVERFLOW }

    private final Kind kind;

    public CompactTargetException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
