package io.lightchain.core.consensus;

import io.lightchain.core.protocol.Hashes;

/** Double SHA-256; bundled for custom and regression networks. */
public final class Sha256dPowHasher implements PowHasher {
    public static final Sha256dPowHasher INSTANCE = new Sha256dPowHasher();

    @Override
    public byte[] hash(byte[] headerBytes) {
        return Hashes.sha256d(headerBytes);
    }
}
