package io.lightchain.core.wallet;

import io.lightchain.core.protocol.Transaction;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wallet bookkeeping as seen by the synchronizer and the verifier: watched addresses and assets,
 * address histories, transaction bodies and the verification state of transactions and asset metadata.
 */
public interface WalletLedger {

    /** Callbacks fired after the ledger changed. */
    interface Listener {
        default void verifiedTx(String txid, TxMinedInfo info) {}
        default void removedVerifiedTx(String txid) {}
        default void verifiedAssetMeta(AssetMeta meta) {}
        default void removedVerifiedAssetMeta(String asset) {}
        default void upToDateChanged(boolean upToDate) {}
    }

    void addListener(Listener listener);

    Set<String> addresses();
    Set<String> assets();

    void addAddress(String address);
    void addAsset(String asset);

    List<HistoryEntry> addressHistory(String address);

    /** Addresses whose stored history is non-empty. */
    Set<String> historyAddresses();

    /**
     * Replaces an address history. Entries that disappeared lose their verification and become local;
     * every listed entry is (re)filed as unverified or unconfirmed.
     */
    void receiveHistory(String address, List<HistoryEntry> history, Map<String, Long> fees);

    boolean hasTransaction(String txid);
    Optional<Transaction> transaction(String txid);
    void receiveTransaction(String txid, Transaction tx, int height);

    /** Mined transactions awaiting a proof, txid to claimed height. */
    Map<String, Integer> unverifiedTxs();

    Map<String, TxMinedInfo> verifiedTxs();
    void addVerifiedTx(String txid, TxMinedInfo info);

    /** Drops the pending entry only if it is still filed at {@code height}. */
    void removeUnverifiedTx(String txid, int height);

    /** Moves a verified transaction back to pending at {@code height}. */
    void unverifyTx(String txid, int height);

    Optional<AssetMeta> verifiedAssetMeta(String asset);

    /** Newest metadata known for the asset: the pending record if any, else the verified one. */
    Optional<AssetMeta> assetMeta(String asset);

    Map<String, AssetMeta> unverifiedAssetMetas();
    Map<String, AssetMeta> verifiedAssetMetas();
    void addUnverifiedAssetMeta(AssetMeta meta);
    void addVerifiedAssetMeta(AssetMeta meta);
    void removeUnverifiedAssetMeta(String asset);
    void unverifyAssetMeta(String asset);

    boolean isUpToDate();
    void setUpToDate(boolean upToDate);
}
