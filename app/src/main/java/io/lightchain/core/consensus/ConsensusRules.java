package io.lightchain.core.consensus;

import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.CompactTarget;
import io.lightchain.core.protocol.Hash;

import java.math.BigInteger;

public final class ConsensusRules {
    private final NetworkParameters params;
    private final HeaderHasher hasher;

    public ConsensusRules(NetworkParameters params) {
        this.params = params;
        this.hasher = new HeaderHasher(params);
    }

    public HeaderHasher hasher() {
        return hasher;
    }

    /**
     * Checks, in order: expected id (when known), linkage to {@code prevHash}, the bits field against
     * {@code target} (skipped on testnet) and the proof of work.
     */
    public void verifyHeader(BlockHeader header, Hash prevHash, BigInteger target, Hash expectedHash)
            throws ConsensusViolationException {
        byte[] pow = hasher.powHash(header);
        Hash id = new Hash(pow);
        if (expectedHash != null && !expectedHash.equals(id)) {
            throw new ConsensusViolationException("hash mismatches with expected: " + expectedHash.hex() + " vs " + id.hex());
        }
        if (!prevHash.equals(header.prevHash())) {
            throw new ConsensusViolationException("prev hash mismatch: " + prevHash.hex() + " vs " + header.prevHash().hex());
        }
        if (params.isTestnet()) {
            return;
        }
        long bits = CompactTarget.targetToBits(target);
        if (bits != header.bits()) {
            throw new ConsensusViolationException("bits mismatch: 0x" + Long.toHexString(bits)
                    + " vs 0x" + Long.toHexString(header.bits()));
        }
        if (!ProofOfWork.meetsTarget(pow, target)) {
            throw new ConsensusViolationException("insufficient proof of work: " + ProofOfWork.digestValue(pow)
                    + " vs target " + target);
        }
    }
}
