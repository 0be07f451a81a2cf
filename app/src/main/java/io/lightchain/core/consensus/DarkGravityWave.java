package io.lightchain.core.consensus;

import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.CompactTarget;

import java.math.BigInteger;
import java.util.function.IntFunction;

/**
 * Dark Gravity Wave v3 retargeting: the next target is the running average of the trailing window's
 * targets scaled by how long that window actually took, clamped to [1/3, 3] of the nominal timespan.
 */
public final class DarkGravityWave {
    private DarkGravityWave() {}

    /**
     * @param height height of the header whose target is computed
     * @param ancestors header lookup for heights below {@code height}; throws {@link MissingHeaderException}
     *                  when a header is unavailable
     */
    public static BigInteger nextTarget(int height, IntFunction<BlockHeader> ancestors, NetworkParameters params) {
        int pastBlocks = params.dgwPastBlocks();
        if (height - 1 < pastBlocks) {
            return params.maxTarget();
        }
        long actualTimespan = 0;
        long lastBlockTime = 0;
        BigInteger average = BigInteger.ZERO;
        int count = 0;
        for (int i = 0; i < pastBlocks; i++) {
            BlockHeader reading = ancestors.apply(height - 1 - i);
            if (reading == null) {
                throw new MissingHeaderException(height - 1 - i);
            }
            count++;
            BigInteger target = CompactTarget.decodeLenient(reading.bits());
            if (count == 1) {
                average = target;
            } else {
                average = average.multiply(BigInteger.valueOf(count)).add(target)
                        .divide(BigInteger.valueOf(count + 1L));
            }
            if (lastBlockTime > 0) {
                actualTimespan += lastBlockTime - reading.timestamp();
            }
            lastBlockTime = reading.timestamp();
        }

        long targetTimespan = count * params.targetSpacingSeconds();
        actualTimespan = Math.max(actualTimespan, targetTimespan / 3);
        actualTimespan = Math.min(actualTimespan, targetTimespan * 3);

        BigInteger next = average.multiply(BigInteger.valueOf(actualTimespan))
                .divide(BigInteger.valueOf(targetTimespan));
        return next.min(params.maxTarget());
    }
}
