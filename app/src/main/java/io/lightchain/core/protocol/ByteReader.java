package io.lightchain.core.protocol;

/** Sequential little-endian reader over a byte array; every overrun is a {@link MalformedDataException}. */
public final class ByteReader {
    private final byte[] data;
    private int pos;

    public ByteReader(byte[] data) {
        this.data = data;
    }

    public int position() { return pos; }
    public int remaining() { return data.length - pos; }
    public boolean hasRemaining() { return pos < data.length; }

    public int readUint8() {
        require(1);
        return data[pos++] & 0xff;
    }

    public long readUint32() {
        require(4);
        long v = (data[pos] & 0xffL)
                | (data[pos + 1] & 0xffL) << 8
                | (data[pos + 2] & 0xffL) << 16
                | (data[pos + 3] & 0xffL) << 24;
        pos += 4;
        return v;
    }

    public long readInt64() {
        long lo = readUint32();
        long hi = readUint32();
        return lo | (hi << 32);
    }

    public int readUint16() {
        require(2);
        int v = (data[pos] & 0xff) | (data[pos + 1] & 0xff) << 8;
        pos += 2;
        return v;
    }

    /** Bitcoin CompactSize. Values that cannot index a Java array are rejected. */
    public long readCompactSize() {
        int first = readUint8();
        if (first < 0xfd) return first;
        if (first == 0xfd) return readUint16();
        if (first == 0xfe) return readUint32();
        long v = readInt64();
        if (v < 0) {
            throw new MalformedDataException("CompactSize out of range");
        }
        return v;
    }

    public byte[] readBytes(long len) {
        if (len < 0 || len > remaining()) {
            throw new MalformedDataException("Need " + len + " bytes at offset " + pos + ", have " + remaining());
        }
        byte[] out = Bytes.slice(data, pos, pos + (int) len);
        pos += (int) len;
        return out;
    }

    public byte[] readVarBytes() {
        return readBytes(readCompactSize());
    }

    public byte[] slice(int from, int to) {
        return Bytes.slice(data, from, to);
    }

    private void require(int n) {
        if (remaining() < n) {
            throw new MalformedDataException("Unexpected end of data at offset " + pos);
        }
    }
}
