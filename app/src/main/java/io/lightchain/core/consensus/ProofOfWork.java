package io.lightchain.core.consensus;

import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.CompactTarget;

import java.math.BigInteger;

/**
 * Proof-of-work checks against a 256-bit target.
 * The digest is read as a little-endian unsigned integer, the way block ids are compared to targets.
 */
public final class ProofOfWork {
    private ProofOfWork() {}

    /** Quick check: is the digest at or below the target? */
    public static boolean meetsTarget(byte[] powHash, BigInteger target) {
        return digestValue(powHash).compareTo(target) <= 0;
    }

    public static BigInteger digestValue(byte[] powHash) {
        return new BigInteger(1, Bytes.reverse(powHash));
    }

    /** Expected number of hashes needed to find a header meeting {@code target}. */
    public static BigInteger blockWork(BigInteger target) {
        if (target == null || target.signum() < 0) {
            return BigInteger.ZERO;
        }
        return CompactTarget.work(target);
    }
}
