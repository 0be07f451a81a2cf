package io.lightchain.core.protocol;

import java.util.Arrays;

/**
 * A 32-byte hash kept in wire (little-endian) order.
 * {@link #hex()} renders the conventional byte-reversed display form used by block explorers and servers.
 */
public final class Hash {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Parses the display (byte-reversed) hex form. */
    public static Hash fromHex(String hex) {
        byte[] raw = Bytes.fromHex(hex);
        if (raw.length != LENGTH) {
            throw new MalformedDataException("Hash must be 64 hex chars, got " + hex.length());
        }
        return new Hash(Bytes.reverse(raw));
    }

    public byte[] bytes() { return bytes.clone(); }

    public String hex() { return toHex(Bytes.reverse(bytes)); }

    /** Display hex without leading zeros, as used in fork file names. */
    public String hexStripped() {
        String h = hex();
        int i = 0;
        while (i < h.length() && h.charAt(i) == '0') i++;
        return h.substring(i);
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    static String toHex(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,16)+"…)"; }
}
