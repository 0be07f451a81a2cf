package io.lightchain.core.protocol;

import java.util.Objects;

/**
 * Block header as stored by the header chain.
 * - legacy form: version, prevHash, merkleRoot, timestamp, bits, 32-bit nonce
 * - extended form (post-upgrade timestamps): adds an explicit height, widens the nonce to 64 bits and carries a mix hash
 *
 * The {@code height} field is positional (derived from the record offset) and is not part of the legacy encoding.
 */
public final class BlockHeader {
    private final int version;
    private final Hash prevHash;
    private final Hash merkleRoot;
    private final long timestamp;      // uint32
    private final long bits;           // uint32 compact target
    private final long nonce;          // uint32 legacy, uint64 extended
    private final int extendedHeight;  // only meaningful when extended
    private final Hash mixHash;        // null for legacy headers
    private final int height;

    private BlockHeader(int version, Hash prevHash, Hash merkleRoot, long timestamp, long bits,
                        long nonce, int extendedHeight, Hash mixHash, int height) {
        this.version = version;
        this.prevHash = prevHash != null ? prevHash : Hash.ZERO;
        this.merkleRoot = merkleRoot != null ? merkleRoot : Hash.ZERO;
        this.timestamp = timestamp;
        this.bits = bits;
        this.nonce = nonce;
        this.extendedHeight = extendedHeight;
        this.mixHash = mixHash;
        this.height = height;
        basicValidate();
    }

    public static BlockHeader legacy(int version, Hash prevHash, Hash merkleRoot, long timestamp, long bits,
                                     long nonce, int height) {
        return new BlockHeader(version, prevHash, merkleRoot, timestamp, bits, nonce, 0, null, height);
    }

    public static BlockHeader extended(int version, Hash prevHash, Hash merkleRoot, long timestamp, long bits,
                                       int extendedHeight, long nonce, Hash mixHash, int height) {
        return new BlockHeader(version, prevHash, merkleRoot, timestamp, bits, nonce, extendedHeight,
                Objects.requireNonNull(mixHash, "mixHash"), height);
    }

    public int version() { return version; }
    public Hash prevHash() { return prevHash; }
    public Hash merkleRoot() { return merkleRoot; }
    public long timestamp() { return timestamp; }
    public long bits() { return bits; }
    public long nonce() { return nonce; }
    public int extendedHeight() { return extendedHeight; }
    public Hash mixHash() { return mixHash; }
    public int height() { return height; }
    public boolean isExtended() { return mixHash != null; }

    /** Same header with a different nonce; used by miners and test fixtures. */
    public BlockHeader withNonce(long newNonce) {
        return new BlockHeader(version, prevHash, merkleRoot, timestamp, bits, newNonce, extendedHeight, mixHash, height);
    }

    private void basicValidate() {
        if (timestamp < 0 || timestamp > 0xffffffffL) throw new IllegalArgumentException("timestamp must fit in uint32");
        if (bits < 0 || bits > 0xffffffffL) throw new IllegalArgumentException("bits must fit in uint32");
        if (mixHash == null && (nonce < 0 || nonce > 0xffffffffL)) {
            throw new IllegalArgumentException("legacy nonce must fit in uint32");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockHeader)) return false;
        BlockHeader other = (BlockHeader) o;
        return version == other.version
                && timestamp == other.timestamp
                && bits == other.bits
                && nonce == other.nonce
                && extendedHeight == other.extendedHeight
                && height == other.height
                && prevHash.equals(other.prevHash)
                && merkleRoot.equals(other.merkleRoot)
                && Objects.equals(mixHash, other.mixHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, prevHash, merkleRoot, timestamp, bits, nonce, extendedHeight, mixHash, height);
    }

    @Override public String toString() {
        return "BlockHeader{h=" + height + ", ts=" + timestamp + ", bits=0x" + Long.toHexString(bits) + "}";
    }
}
