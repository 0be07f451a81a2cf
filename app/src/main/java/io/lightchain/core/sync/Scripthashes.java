package io.lightchain.core.sync;

import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.Hashes;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

/** Address to the scripthash servers index histories by: reversed sha256 of the output script, as hex. */
public final class Scripthashes {
    private static final int HASH160_LENGTH = 20;

    private Scripthashes() {}

    public static String fromAddress(String address, NetworkParameters params) {
        return fromScript(outputScript(address, params));
    }

    public static String fromScript(byte[] script) {
        return Bytes.toHex(Bytes.reverse(Hashes.sha256(script)));
    }

    public static boolean isAddress(String address, NetworkParameters params) {
        try {
            outputScript(address, params);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** P2PKH or P2SH script for a base58check address of this network. */
    public static byte[] outputScript(String address, NetworkParameters params) {
        byte[] decoded;
        try {
            decoded = Base58.decodeChecked(address);
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("invalid address " + address, e);
        }
        if (decoded.length != 1 + HASH160_LENGTH) {
            throw new IllegalArgumentException("invalid address length " + address);
        }
        int version = decoded[0] & 0xff;
        byte[] hash160 = Bytes.slice(decoded, 1, decoded.length);
        if (version == params.p2pkhVersion()) {
            byte[] script = new byte[25];
            script[0] = 0x76;
            script[1] = (byte) 0xa9;
            script[2] = 0x14;
            System.arraycopy(hash160, 0, script, 3, HASH160_LENGTH);
            script[23] = (byte) 0x88;
            script[24] = (byte) 0xac;
            return script;
        }
        if (version == params.p2shVersion()) {
            byte[] script = new byte[23];
            script[0] = (byte) 0xa9;
            script[1] = 0x14;
            System.arraycopy(hash160, 0, script, 2, HASH160_LENGTH);
            script[22] = (byte) 0x87;
            return script;
        }
        throw new IllegalArgumentException("unknown address version " + version + " for " + params.name());
    }
}
