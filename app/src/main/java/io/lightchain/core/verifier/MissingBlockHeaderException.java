package io.lightchain.core.verifier;

public class MissingBlockHeaderException extends MerkleVerificationException {
    public MissingBlockHeaderException(String message) {
        super(message);
    }
}
