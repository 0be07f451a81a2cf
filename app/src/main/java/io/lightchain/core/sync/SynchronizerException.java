package io.lightchain.core.sync;

/** The server left a status unexplained for too long, or answered with the wrong transaction. */
public class SynchronizerException extends RuntimeException {
    public SynchronizerException(String message) {
        super(message);
    }
}
