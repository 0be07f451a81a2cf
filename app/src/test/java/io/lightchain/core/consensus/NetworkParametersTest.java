package io.lightchain.core.consensus;

import io.lightchain.core.protocol.Hash;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetworkParametersTest {

    @Test
    void namedNetworksCarryTheirFlagsAndVersions() {
        NetworkParameters testnet = NetworkParameters.forName("TESTNET");
        assertTrue(testnet.isTestnet());
        assertEquals(111, testnet.p2pkhVersion());
        assertEquals(196, testnet.p2shVersion());

        NetworkParameters mainnet = NetworkParameters.mainnet();
        assertFalse(mainnet.isTestnet());
        assertEquals(60, mainnet.p2pkhVersion());
        assertTrue(mainnet.inDifficultyResetBand(mainnet.kawpowActivationHeight()));
        assertFalse(mainnet.inDifficultyResetBand(mainnet.kawpowActivationHeight() + NetworkParameters.DGW_PAST_BLOCKS));

        assertThrows(IllegalArgumentException.class, () -> NetworkParameters.forName("regtest"));
    }

    @Test
    void customNetworkWithBundledHasherIsUsable() {
        NetworkParameters params = NetworkParameters.builder("custom")
                .genesisHash(Hash.ZERO)
                .dgwActivationHeight(0)
                .build();
        assertFalse(params.isTestnet());
        params.requireUsable();
    }

    @Test
    void testnetSkipsTheLegacyCheckpointRequirement() {
        NetworkParameters params = NetworkParameters.builder("sandbox")
                .testnet(true)
                .genesisHash(Hash.ZERO)
                .dgwActivationHeight(5_000)
                .build();
        params.requireUsable();
    }
}
