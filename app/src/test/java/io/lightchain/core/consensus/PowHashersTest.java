package io.lightchain.core.consensus;

import io.lightchain.core.protocol.Hash;
import io.lightchain.core.protocol.Hashes;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PowHashersTest {

    @Test
    void registeredProviderIsPickedUp() {
        Map<HashEra, PowHasher> hashers = PowHashers.installed();
        byte[] header = new byte[80];
        assertArrayEquals(Hashes.sha256d(header), hashers.get(HashEra.X16R).hash(header));
    }

    @Test
    void eraWithoutProviderFailsOnUse() {
        PowHasher kawpow = PowHashers.installed().get(HashEra.KAWPOW);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> kawpow.hash(new byte[120]));
        assertTrue(e.getMessage().contains("KAWPOW"));
        assertFalse(PowHashers.isAvailable(kawpow));
        assertTrue(PowHashers.isAvailable(PowHashers.installed().get(HashEra.X16R)));
    }

    @Test
    void eraFollowsTimestamp() {
        assertEquals(HashEra.X16R, HashEra.forTimestamp(99, 100, 200));
        assertEquals(HashEra.X16RV2, HashEra.forTimestamp(100, 100, 200));
        assertEquals(HashEra.KAWPOW, HashEra.forTimestamp(200, 100, 200));
        assertEquals(120, HashEra.KAWPOW.hashedLength());
    }

    @Test
    void networkNeedsAHasherForEveryEra() {
        NetworkParameters.Builder builder = NetworkParameters.builder("partial")
                .genesisHash(Hash.ZERO)
                .hashers(Map.of(HashEra.X16R, Sha256dPowHasher.INSTANCE));
        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
