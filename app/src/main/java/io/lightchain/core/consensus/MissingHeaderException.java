package io.lightchain.core.consensus;

/** A header lookup fell outside the locally stored data. */
public class MissingHeaderException extends RuntimeException {
    private final int height;

    public MissingHeaderException(int height) {
        super("Missing header at height " + height);
        this.height = height;
    }

    public int height() {
        return height;
    }
}
