package io.lightchain.core.protocol;

import java.util.Arrays;

/** Byte-array helpers shared by the codecs. */
public final class Bytes {
    private Bytes() {}

    public static byte[] reverse(byte[] in) {
        byte[] out = new byte[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = in[in.length - 1 - i];
        }
        return out;
    }

    public static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public static byte[] slice(byte[] in, int from, int to) {
        return Arrays.copyOfRange(in, from, to);
    }

    public static boolean isAllZero(byte[] in) {
        for (byte b : in) {
            if (b != 0) return false;
        }
        return true;
    }

    public static String toHex(byte[] b) {
        return Hash.toHex(b);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null || (hex.length() & 1) != 0) {
            throw new MalformedDataException("Hex string must have even length");
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new MalformedDataException("Invalid hex character at " + (2 * i));
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
