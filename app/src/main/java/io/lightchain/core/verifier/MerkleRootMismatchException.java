package io.lightchain.core.verifier;

public class MerkleRootMismatchException extends MerkleVerificationException {
    public MerkleRootMismatchException(String message) {
        super(message);
    }
}
