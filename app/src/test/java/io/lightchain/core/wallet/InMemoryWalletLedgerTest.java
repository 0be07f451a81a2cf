package io.lightchain.core.wallet;

import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.Hash;
import io.lightchain.core.protocol.TransactionCodec;
import io.lightchain.core.protocol.TransactionFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWalletLedgerTest {
    private static final String ADDR = "mfcHP2WMCVLsVZA8yrovmhMgxNFW9r98xw";
    private static final String TX_A = "aa".repeat(32);
    private static final String TX_B = "bb".repeat(32);

    private InMemoryWalletLedger ledger;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ledger = new InMemoryWalletLedger();
        ledger.addListener(new WalletLedger.Listener() {
            @Override
            public void verifiedTx(String txid, TxMinedInfo info) {
                events.add("verified " + txid);
            }

            @Override
            public void removedVerifiedTx(String txid) {
                events.add("removed " + txid);
            }

            @Override
            public void removedVerifiedAssetMeta(String asset) {
                events.add("removed asset " + asset);
            }

            @Override
            public void upToDateChanged(boolean upToDate) {
                events.add("up to date " + upToDate);
            }
        });
    }

    private static TxMinedInfo minedAt(int height) {
        return new TxMinedInfo(height, 1_500_000_000L, 1, Hash.ZERO);
    }

    @Test
    void historySplitsMinedAndMempoolEntries() {
        ledger.receiveHistory(ADDR, List.of(new HistoryEntry(TX_A, 12), new HistoryEntry(TX_B, 0)),
                Map.of(TX_B, 250L));

        assertEquals(Map.of(TX_A, 12), ledger.unverifiedTxs());
        assertEquals(List.of(ADDR), List.copyOf(ledger.historyAddresses()));
        assertEquals(2, ledger.addressHistory(ADDR).size());
    }

    @Test
    void verifiedTxLeavesPendingAndNotifies() {
        ledger.receiveHistory(ADDR, List.of(new HistoryEntry(TX_A, 12)), Map.of());
        ledger.addVerifiedTx(TX_A, minedAt(12));

        assertTrue(ledger.unverifiedTxs().isEmpty());
        assertEquals(12, ledger.verifiedTxs().get(TX_A).height());
        assertEquals(List.of("verified " + TX_A), events);
    }

    @Test
    void droppedHistoryEntryLosesItsVerification() {
        ledger.receiveHistory(ADDR, List.of(new HistoryEntry(TX_A, 12)), Map.of());
        ledger.addVerifiedTx(TX_A, minedAt(12));

        ledger.receiveHistory(ADDR, List.of(new HistoryEntry(TX_B, 13)), Map.of());

        assertFalse(ledger.verifiedTxs().containsKey(TX_A));
        assertEquals(Map.of(TX_B, 13), ledger.unverifiedTxs());
        assertTrue(events.contains("removed " + TX_A));
    }

    @Test
    void minedTxSeenBackInMempoolIsUnverified() {
        String raw = TransactionFixtures.rawHex(9, Bytes.fromHex("51"));
        String txid = TransactionCodec.fromHex(raw).txid();
        ledger.addVerifiedTx(txid, minedAt(20));

        ledger.receiveTransaction(txid, TransactionCodec.fromHex(raw), 0);

        assertTrue(ledger.verifiedTxs().isEmpty());
        assertTrue(ledger.unverifiedTxs().isEmpty());
        assertTrue(ledger.hasTransaction(txid));
        assertEquals("removed " + txid, events.get(events.size() - 1));
    }

    @Test
    void unverifyKeepsTheOldHeightPending() {
        ledger.addVerifiedTx(TX_A, minedAt(30));
        ledger.unverifyTx(TX_A, 30);
        ledger.unverifyTx(TX_B, 31);

        assertEquals(Map.of(TX_A, 30), ledger.unverifiedTxs());
        assertEquals(List.of("verified " + TX_A, "removed " + TX_A), events);
    }

    @Test
    void removeUnverifiedOnlyAtTheFiledHeight() {
        ledger.receiveHistory(ADDR, List.of(new HistoryEntry(TX_A, 12)), Map.of());
        ledger.removeUnverifiedTx(TX_A, 11);
        assertTrue(ledger.unverifiedTxs().containsKey(TX_A));
        ledger.removeUnverifiedTx(TX_A, 12);
        assertTrue(ledger.unverifiedTxs().isEmpty());
    }

    @Test
    void assetMetaPrefersThePendingRecord() {
        AssetMeta.Provenance source = new AssetMeta.Provenance(new TxOutpoint(TX_A, 0), 12, null);
        AssetMeta verified = AssetMeta.of("LIGHT", 100L, true, 0, false, null, source, null, null);
        AssetMeta pending = AssetMeta.of("LIGHT", 200L, true, 0, false, null, source, null, null);

        ledger.addVerifiedAssetMeta(verified);
        ledger.addUnverifiedAssetMeta(pending);
        assertEquals(pending, ledger.assetMeta("LIGHT").orElseThrow());
        assertEquals(verified, ledger.verifiedAssetMeta("LIGHT").orElseThrow());

        ledger.unverifyAssetMeta("LIGHT");
        assertTrue(ledger.verifiedAssetMeta("LIGHT").isEmpty());
        assertEquals(pending, ledger.unverifiedAssetMetas().get("LIGHT"));
        assertTrue(events.contains("removed asset LIGHT"));
    }

    @Test
    void upToDateFiresOnlyOnChange() {
        ledger.setUpToDate(false);
        ledger.setUpToDate(true);
        ledger.setUpToDate(true);
        ledger.setUpToDate(false);

        assertEquals(List.of("up to date true", "up to date false"), events);
    }
}
