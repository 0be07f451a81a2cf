package io.lightchain.core.verifier;

/** A 64-byte inner node of the branch also decodes as a transaction, so the proof could be forged. */
public class InnerNodeIsValidTransactionException extends MerkleVerificationException {
    public InnerNodeIsValidTransactionException() {
        super("Invalid merkle branch: an inner node decodes as a transaction");
    }
}
