package io.lightchain.core.verifier;

/** A server-supplied proof did not check out. */
public class MerkleVerificationException extends RuntimeException {
    public MerkleVerificationException(String message) {
        super(message);
    }

    public MerkleVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
