package io.lightchain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary header layout (all integers little-endian):
 * <pre>
 *   version:4 | prevHash:32 | merkleRoot:32 | timestamp:4 | bits:4 | nonce:4                     (legacy, 80 bytes)
 *   version:4 | prevHash:32 | merkleRoot:32 | timestamp:4 | bits:4 | height:4 | nonce:8 | mix:32 (extended, 120 bytes)
 * </pre>
 * The form is selected by comparing the timestamp with the extended-layout activation time.
 * Storage always uses 120-byte records; legacy headers are zero-padded.
 */
public final class BlockHeaderCodec {
    public static final int LEGACY_SIZE = 80;
    public static final int EXTENDED_SIZE = 120;
    public static final int RECORD_SIZE = EXTENDED_SIZE;

    private final long extendedActivationTime;

    public BlockHeaderCodec(long extendedActivationTime) {
        this.extendedActivationTime = extendedActivationTime;
    }

    public boolean usesExtendedLayout(long timestamp) {
        return timestamp >= extendedActivationTime;
    }

    public byte[] serialize(BlockHeader header) {
        boolean extended = usesExtendedLayout(header.timestamp());
        if (extended != header.isExtended()) {
            throw new InvalidHeaderException("Header layout does not match its timestamp " + header.timestamp());
        }
        ByteBuffer buf = ByteBuffer.allocate(extended ? EXTENDED_SIZE : LEGACY_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(header.version());
        buf.put(header.prevHash().bytes());
        buf.put(header.merkleRoot().bytes());
        writeUint32(buf, header.timestamp());
        writeUint32(buf, header.bits());
        if (extended) {
            buf.putInt(header.extendedHeight());
            buf.putLong(header.nonce());
            buf.put(header.mixHash().bytes());
        } else {
            writeUint32(buf, header.nonce());
        }
        return buf.array();
    }

    /** Fixed-size storage record; legacy headers are padded with zeros. */
    public byte[] serializeForStorage(BlockHeader header) {
        byte[] raw = serialize(header);
        return raw.length == RECORD_SIZE ? raw : pad(raw);
    }

    public BlockHeader deserialize(byte[] raw, int height) {
        if (raw == null || raw.length == 0) {
            throw new InvalidHeaderException("Invalid header: empty");
        }
        if (raw.length != LEGACY_SIZE && raw.length != EXTENDED_SIZE) {
            throw new InvalidHeaderException("Invalid header length: " + raw.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        int version = buf.getInt();
        Hash prev = new Hash(readBytes(buf, Hash.LENGTH));
        Hash merkle = new Hash(readBytes(buf, Hash.LENGTH));
        long timestamp = readUint32(buf);
        long bits = readUint32(buf);
        if (usesExtendedLayout(timestamp)) {
            if (raw.length != EXTENDED_SIZE) {
                throw new InvalidHeaderException("Extended header must be " + EXTENDED_SIZE + " bytes, got " + raw.length);
            }
            int extHeight = buf.getInt();
            long nonce = buf.getLong();
            Hash mix = new Hash(readBytes(buf, Hash.LENGTH));
            return BlockHeader.extended(version, prev, merkle, timestamp, bits, extHeight, nonce, mix, height);
        }
        long nonce = readUint32(buf);
        return BlockHeader.legacy(version, prev, merkle, timestamp, bits, nonce, height);
    }

    /**
     * Widens a chunk of mixed-size wire headers to 120-byte storage records.
     * Record size on the wire is chosen by height: legacy below {@code extendedActivationHeight}.
     */
    public static byte[] widenChunk(byte[] chunk, int startHeight, int extendedActivationHeight) {
        ByteBuffer out = ByteBuffer.allocate(countHeaders(chunk, startHeight, extendedActivationHeight) * RECORD_SIZE);
        int p = 0;
        int height = startHeight;
        while (p < chunk.length) {
            int size = wireSize(height, extendedActivationHeight);
            int end = Math.min(p + size, chunk.length);
            byte[] record = Bytes.slice(chunk, p, end);
            if (record.length != size) {
                throw new InvalidHeaderException("Header extension error at height " + height);
            }
            out.put(size == RECORD_SIZE ? record : pad(record));
            p = end;
            height++;
        }
        return out.array();
    }

    public static int wireSize(int height, int extendedActivationHeight) {
        return height < extendedActivationHeight ? LEGACY_SIZE : EXTENDED_SIZE;
    }

    /** Number of headers in a wire chunk, rounding a trailing partial record up. */
    public static int countHeaders(byte[] chunk, int startHeight, int extendedActivationHeight) {
        int p = 0;
        int n = 0;
        int height = startHeight;
        while (p < chunk.length) {
            p += wireSize(height++, extendedActivationHeight);
            n++;
        }
        return n;
    }

    private static byte[] pad(byte[] legacy) {
        byte[] out = new byte[RECORD_SIZE];
        System.arraycopy(legacy, 0, out, 0, legacy.length);
        return out;
    }

    private static byte[] readBytes(ByteBuffer buf, int len) {
        byte[] out = new byte[len];
        buf.get(out);
        return out;
    }

    private static void writeUint32(ByteBuffer buf, long v) {
        buf.putInt((int) v);
    }

    private static long readUint32(ByteBuffer buf) {
        return buf.getInt() & 0xffffffffL;
    }
}
