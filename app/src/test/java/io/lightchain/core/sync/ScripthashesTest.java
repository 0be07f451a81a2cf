package io.lightchain.core.sync;

import io.lightchain.core.consensus.NetworkParameters;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScripthashesTest {
    // all four carry the hash160 01 02 .. 14
    private static final String MAIN_P2PKH = "R9NXAVJezHiBnT3ijTpg3JUZre7PxhJWti";
    private static final String MAIN_P2SH = "r6KvDDnX1USWVKh6FUUS75MLsv5t1Gfy1c";
    private static final String TEST_P2PKH = "mfcHP2WMCVLsVZA8yrovmhMgxNFW9r98xw";
    private static final String TEST_P2SH = "2MsLZ5FqqYpjM1Q1W4X81zMVZTF9gdbhVwd";

    private static NetworkParameters mainnet;
    private static NetworkParameters testnet;

    @BeforeAll
    static void networks() {
        mainnet = NetworkParameters.mainnet();
        testnet = NetworkParameters.testnet();
    }

    @Test
    void scripthashIsReversedSha256OfOutputScript() {
        assertEquals("5546fc69d399ef99854c132abb060381cc159dbec67c496a6f0e0dbf12e83ae8",
                Scripthashes.fromAddress(MAIN_P2PKH, mainnet));
        assertEquals("92e3f1440947d182ecd856fc77a6ac4e8759720317683ae6153f343785911a28",
                Scripthashes.fromAddress(MAIN_P2SH, mainnet));
        assertEquals(Scripthashes.fromAddress(MAIN_P2PKH, mainnet), Scripthashes.fromAddress(TEST_P2PKH, testnet));
        assertEquals(Scripthashes.fromAddress(MAIN_P2SH, mainnet), Scripthashes.fromAddress(TEST_P2SH, testnet));
    }

    @Test
    void addressesBelongToOneNetwork() {
        assertTrue(Scripthashes.isAddress(MAIN_P2PKH, mainnet));
        assertFalse(Scripthashes.isAddress(MAIN_P2PKH, testnet));
        assertTrue(Scripthashes.isAddress(TEST_P2SH, testnet));
        assertFalse(Scripthashes.isAddress(TEST_P2SH, mainnet));
    }

    @Test
    void malformedAddressesAreRejected() {
        assertFalse(Scripthashes.isAddress("", mainnet));
        assertFalse(Scripthashes.isAddress("R9NXAVJezHiBnT3ijTpg3JUZre7PxhJWtj", mainnet));
        assertFalse(Scripthashes.isAddress("not-base58-0OIl", mainnet));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Scripthashes.outputScript(TEST_P2PKH, mainnet));
        assertTrue(e.getMessage().contains("unknown address version"));
    }
}
