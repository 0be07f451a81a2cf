package io.lightchain.core.chain;

import io.lightchain.core.consensus.Checkpoints;
import io.lightchain.core.protocol.Hash;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Block hash to cumulative work up to and including that block, filled in whole retarget epochs. */
public final class ChainWorkCache {
    private final Map<Hash, BigInteger> work = new ConcurrentHashMap<>();

    public ChainWorkCache(Checkpoints checkpoints) {
        // virtual block at height -1
        work.put(Hash.ZERO, BigInteger.ZERO);
        checkpoints.lastDgwHash().ifPresent(h -> work.put(h, BigInteger.ZERO));
    }

    public BigInteger get(Hash blockHash) {
        return work.get(blockHash);
    }

    public void put(Hash blockHash, BigInteger cumulativeWork) {
        work.put(blockHash, cumulativeWork);
    }

    public int size() {
        return work.size();
    }
}
