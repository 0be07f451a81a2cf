package io.lightchain.core.verifier;

import org.bitcoinj.core.Base58;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads the asset payload that follows {@code OP_RVN_ASSET} in an output script. Only the three payloads
 * that write metadata are understood: create ({@code q}), reissue ({@code r}) and owner ({@code o}).
 */
public final class AssetScripts {
    public static final int OP_PUSHDATA1 = 0x4c;
    public static final int OP_PUSHDATA2 = 0x4d;
    public static final int OP_PUSHDATA4 = 0x4e;
    public static final int OP_RVN_ASSET = 0xc0;
    public static final int OP_DROP = 0x75;

    public static final long OWNER_SATS = 100_000_000L;
    public static final int IPFS_HASH_LENGTH = 34;

    private static final byte[] RVN = "rvn".getBytes(StandardCharsets.US_ASCII);

    private AssetScripts() {}

    /** Metadata carried by one asset script. {@code ipfs} is base58, or null. */
    public record ParsedAsset(char type, String name, long circulation, int divisions, boolean reissuable,
                              boolean hasIpfs, String ipfs) {}

    public static ParsedAsset parse(byte[] script) {
        if (script.length == 0 || (script[script.length - 1] & 0xff) != OP_DROP) {
            throw new BadAssetScriptException("No OP_DROP");
        }
        int ptr = findAssetOp(script);
        if (ptr <= 0) {
            throw new BadAssetScriptException("No OP_RVN_ASSET");
        }
        if (ptr + 5 <= script.length && Arrays.equals(Arrays.copyOfRange(script, ptr + 2, ptr + 5), RVN)) {
            ptr += 5;
        } else {
            ptr += 6;
        }
        char type = (char) at(script, ptr);
        ptr++;
        switch (type) {
            case 'q': {
                int nameLen = at(script, ptr);
                String name = ascii(script, ptr + 1, nameLen);
                int p = ptr + 1 + nameLen;
                long sats = uint64(script, p);
                int divs = at(script, p + 8);
                int reis = at(script, p + 9);
                int hasIpfs = at(script, p + 10);
                String ipfs = hasIpfs != 0 ? base58(script, p + 11) : null;
                return new ParsedAsset('q', name, sats, divs, reis != 0, hasIpfs != 0, ipfs);
            }
            case 'r': {
                int nameLen = at(script, ptr);
                String name = ascii(script, ptr + 1, nameLen);
                int p = ptr + 1 + nameLen;
                long sats = uint64(script, p);
                int divs = at(script, p + 8);
                int reis = at(script, p + 9);
                String ipfs = null;
                if (p + 10 != script.length - 1) {
                    ipfs = base58(script, p + 10);
                }
                boolean hasIpfs = ipfs != null && !ipfs.isEmpty();
                return new ParsedAsset('r', name, sats, divs, reis != 0, hasIpfs, hasIpfs ? ipfs : null);
            }
            case 'o': {
                int nameLen = at(script, ptr);
                String name = ascii(script, ptr + 1, nameLen);
                return new ParsedAsset('o', name, OWNER_SATS, 0, false, false, null);
            }
            default:
                throw new BadAssetScriptException("Not an asset creation script");
        }
    }

    /** Offset of the OP_RVN_ASSET opcode, or -1. Push payloads are skipped so their bytes are never mistaken for it. */
    static int findAssetOp(byte[] script) {
        int i = 0;
        while (i < script.length) {
            int op = script[i] & 0xff;
            int opIndex = i;
            i++;
            if (op == OP_RVN_ASSET) {
                return opIndex;
            }
            if (op <= OP_PUSHDATA4) {
                long len;
                if (op < OP_PUSHDATA1) {
                    len = op;
                } else if (op == OP_PUSHDATA1) {
                    len = at(script, i);
                    i += 1;
                } else if (op == OP_PUSHDATA2) {
                    len = at(script, i) | (long) at(script, i + 1) << 8;
                    i += 2;
                } else {
                    len = at(script, i) | (long) at(script, i + 1) << 8
                            | (long) at(script, i + 2) << 16 | (long) at(script, i + 3) << 24;
                    i += 4;
                }
                if (i + len > script.length) {
                    throw new BadAssetScriptException("push past end of script at " + opIndex);
                }
                i += (int) len;
            }
        }
        return -1;
    }

    private static int at(byte[] script, int index) {
        if (index < 0 || index >= script.length) {
            throw new BadAssetScriptException("asset script truncated at " + index);
        }
        return script[index] & 0xff;
    }

    private static String ascii(byte[] script, int from, int len) {
        if (from + len > script.length) {
            throw new BadAssetScriptException("asset name runs past end of script");
        }
        return new String(script, from, len, StandardCharsets.US_ASCII);
    }

    private static long uint64(byte[] script, int from) {
        long v = 0;
        for (int i = 7; i >= 0; i--) {
            v = (v << 8) | at(script, from + i);
        }
        return v;
    }

    private static String base58(byte[] script, int from) {
        int to = Math.min(from + IPFS_HASH_LENGTH, script.length);
        if (from >= to) {
            return null;
        }
        return Base58.encode(Arrays.copyOfRange(script, from, to));
    }
}
