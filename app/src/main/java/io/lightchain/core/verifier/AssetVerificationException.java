package io.lightchain.core.verifier;

/** Asset metadata disagrees with the transaction it cites, or cites a stale one. */
public class AssetVerificationException extends MerkleVerificationException {
    public AssetVerificationException(String message) {
        super(message);
    }

    public AssetVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
