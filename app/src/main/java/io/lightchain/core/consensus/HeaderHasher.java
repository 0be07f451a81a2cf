package io.lightchain.core.consensus;

import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.Hash;

import java.util.Arrays;

/**
 * Block id computation. The proof-of-work hash of the era-truncated header bytes is also the block id.
 */
public final class HeaderHasher {
    private final NetworkParameters params;

    public HeaderHasher(NetworkParameters params) {
        this.params = params;
    }

    /** Block id of {@code header}; {@link Hash#ZERO} for a missing header. */
    public Hash hash(BlockHeader header) {
        if (header == null) {
            return Hash.ZERO;
        }
        return new Hash(powHash(header));
    }

    /** Raw proof-of-work digest in wire order. */
    public byte[] powHash(BlockHeader header) {
        HashEra era = params.eraOf(header);
        byte[] raw = params.codec().serialize(header);
        byte[] input = raw.length > era.hashedLength() ? Arrays.copyOf(raw, era.hashedLength()) : raw;
        return params.hasher(era).hash(input);
    }

    /** Hash of a storage record; legacy records carry zero padding that the codec ignores. */
    public Hash hashRecord(byte[] record, int height) {
        return hash(params.codec().deserialize(record, height));
    }
}
