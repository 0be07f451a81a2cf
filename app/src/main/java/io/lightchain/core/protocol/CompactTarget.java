package io.lightchain.core.protocol;

import java.math.BigInteger;

/**
 * Compact ("bits") encoding of a 256-bit target: one exponent byte followed by a
 * three-byte mantissa whose top bit (0x00800000) is a sign flag.
 */
public final class CompactTarget {
    private static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private CompactTarget() {}

    public static BigInteger bitsToTarget(long bits) {
        if (bits < 0 || bits > 0xffffffffL) {
            throw new IllegalArgumentException("bits should be uint32, got " + bits);
        }
        int size = (int) ((bits >>> 24) & 0xff);
        long word = bits & 0x007fffffL;
        BigInteger target;
        if (size <= 3) {
            target = BigInteger.valueOf(word >>> (8 * (3 - size)));
        } else {
            target = BigInteger.valueOf(word).shiftLeft(8 * (size - 3));
        }
        boolean nonZero = target.signum() != 0;
        if (nonZero && (bits & 0x00800000L) != 0) {
            throw new CompactTargetException(CompactTargetException.Kind.NEGATIVE,
                    "target cannot be negative: 0x" + Long.toHexString(bits));
        }
        if (nonZero && (size > 34 || (size > 33 && word > 0xff) || (size > 32 && word > 0xffff))) {
            throw new CompactTargetException(CompactTargetException.Kind.OVERFLOW,
                    "target has overflown: 0x" + Long.toHexString(bits));
        }
        return target;
    }

    public static long targetToBits(BigInteger target) {
        if (target.signum() < 0 || target.compareTo(MAX_UINT256) > 0) {
            throw new IllegalArgumentException("target must be an unsigned 256-bit value");
        }
        int size = (target.bitLength() + 7) / 8;
        long compact;
        if (size <= 3) {
            compact = target.longValue() << (8 * (3 - size));
        } else {
            compact = target.shiftRight(8 * (size - 3)).longValue();
        }
        if ((compact & 0x00800000L) != 0) {
            compact >>>= 8;
            size++;
        }
        return ((long) size << 24) | compact;
    }

    /**
     * Lenient decode used by the difficulty averaging: ignores the sign flag and
     * promotes small mantissas by one byte.
     */
    public static BigInteger decodeLenient(long bits) {
        long mantissa = bits % (1L << 24);
        if (mantissa < 0x8000) {
            mantissa *= 256;
        }
        int shift = 8 * ((int) (bits >>> 24) - 3);
        BigInteger m = BigInteger.valueOf(mantissa);
        return shift >= 0 ? m.shiftLeft(shift) : m.shiftRight(-shift);
    }

    /** Work represented by a single header with the given target: 2^256 / (target + 1), rounded. */
    public static BigInteger work(BigInteger target) {
        BigInteger two256 = BigInteger.ONE.shiftLeft(256);
        BigInteger t1 = target.add(BigInteger.ONE);
        return two256.subtract(target).subtract(BigInteger.ONE).divide(t1).add(BigInteger.ONE);
    }
}
