package io.lightchain.core.wallet;

import io.lightchain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * In-memory implementation of WalletLedger.
 * Not persistent; resets every process run.
 */
public final class InMemoryWalletLedger implements WalletLedger {
    private static final Logger LOG = Logger.getLogger(InMemoryWalletLedger.class.getName());

    private final Set<String> addresses = new LinkedHashSet<>();
    private final Set<String> assets = new LinkedHashSet<>();
    private final Map<String, List<HistoryEntry>> histories = new HashMap<>();
    private final Map<String, Transaction> transactions = new HashMap<>();
    private final Map<String, Long> fees = new HashMap<>();
    private final Map<String, Integer> unverified = new HashMap<>();
    private final Map<String, Integer> unconfirmed = new HashMap<>();
    private final Map<String, TxMinedInfo> verified = new HashMap<>();
    private final Map<String, AssetMeta> unverifiedMeta = new HashMap<>();
    private final Map<String, AssetMeta> verifiedMeta = new HashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private boolean upToDate;

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    @Override
    public synchronized Set<String> addresses() {
        return new LinkedHashSet<>(addresses);
    }

    @Override
    public synchronized Set<String> assets() {
        return new LinkedHashSet<>(assets);
    }

    @Override
    public synchronized void addAddress(String address) {
        addresses.add(address);
    }

    @Override
    public synchronized void addAsset(String asset) {
        assets.add(asset);
    }

    @Override
    public synchronized List<HistoryEntry> addressHistory(String address) {
        return List.copyOf(histories.getOrDefault(address, List.of()));
    }

    @Override
    public synchronized Set<String> historyAddresses() {
        Set<String> out = new LinkedHashSet<>();
        histories.forEach((addr, hist) -> {
            if (!hist.isEmpty()) out.add(addr);
        });
        return out;
    }

    @Override
    public void receiveHistory(String address, List<HistoryEntry> history, Map<String, Long> txFees) {
        List<String> dropped = new ArrayList<>();
        synchronized (this) {
            for (HistoryEntry old : histories.getOrDefault(address, List.of())) {
                if (!history.contains(old)) {
                    // becomes local
                    unverified.remove(old.txHash());
                    unconfirmed.remove(old.txHash());
                    if (verified.remove(old.txHash()) != null) {
                        dropped.add(old.txHash());
                    }
                }
            }
            histories.put(address, List.copyOf(history));
            for (HistoryEntry e : history) {
                dropped.addAll(fileUnverifiedOrUnconfirmed(e.txHash(), e.height()));
            }
            fees.putAll(txFees);
        }
        for (String txid : dropped) {
            listeners.forEach(l -> l.removedVerifiedTx(txid));
        }
    }

    /** Returns the txid if it lost a verification (mined tx seen back in the mempool). */
    private List<String> fileUnverifiedOrUnconfirmed(String txid, int height) {
        if (verified.containsKey(txid)) {
            if (height <= 0) {
                verified.remove(txid);
                unconfirmed.put(txid, height);
                return List.of(txid);
            }
            return List.of();
        }
        if (height > 0) {
            unverified.put(txid, height);
        } else {
            unconfirmed.put(txid, height);
        }
        return List.of();
    }

    @Override
    public synchronized boolean hasTransaction(String txid) {
        return transactions.containsKey(txid);
    }

    @Override
    public synchronized Optional<Transaction> transaction(String txid) {
        return Optional.ofNullable(transactions.get(txid));
    }

    @Override
    public void receiveTransaction(String txid, Transaction tx, int height) {
        List<String> dropped;
        synchronized (this) {
            dropped = fileUnverifiedOrUnconfirmed(txid, height);
            transactions.put(txid, tx);
        }
        for (String d : dropped) {
            listeners.forEach(l -> l.removedVerifiedTx(d));
        }
    }

    @Override
    public synchronized Map<String, Integer> unverifiedTxs() {
        return new HashMap<>(unverified);
    }

    @Override
    public synchronized Map<String, TxMinedInfo> verifiedTxs() {
        return new HashMap<>(verified);
    }

    @Override
    public void addVerifiedTx(String txid, TxMinedInfo info) {
        synchronized (this) {
            unverified.remove(txid);
            verified.put(txid, info);
        }
        listeners.forEach(l -> l.verifiedTx(txid, info));
    }

    @Override
    public synchronized void removeUnverifiedTx(String txid, int height) {
        Integer current = unverified.get(txid);
        if (current != null && current == height) {
            unverified.remove(txid);
        }
    }

    @Override
    public void unverifyTx(String txid, int height) {
        synchronized (this) {
            if (verified.remove(txid) == null) {
                return;
            }
            // the old height stands until a status update overrides it
            unverified.put(txid, height);
        }
        listeners.forEach(l -> l.removedVerifiedTx(txid));
    }

    @Override
    public synchronized Optional<AssetMeta> verifiedAssetMeta(String asset) {
        return Optional.ofNullable(verifiedMeta.get(asset));
    }

    @Override
    public synchronized Optional<AssetMeta> assetMeta(String asset) {
        AssetMeta pending = unverifiedMeta.get(asset);
        return Optional.ofNullable(pending != null ? pending : verifiedMeta.get(asset));
    }

    @Override
    public synchronized Map<String, AssetMeta> unverifiedAssetMetas() {
        return new HashMap<>(unverifiedMeta);
    }

    @Override
    public synchronized Map<String, AssetMeta> verifiedAssetMetas() {
        return new HashMap<>(verifiedMeta);
    }

    @Override
    public synchronized void addUnverifiedAssetMeta(AssetMeta meta) {
        unverifiedMeta.put(meta.name(), meta);
    }

    @Override
    public void addVerifiedAssetMeta(AssetMeta meta) {
        synchronized (this) {
            unverifiedMeta.remove(meta.name());
            verifiedMeta.put(meta.name(), meta);
        }
        listeners.forEach(l -> l.verifiedAssetMeta(meta));
    }

    @Override
    public synchronized void removeUnverifiedAssetMeta(String asset) {
        unverifiedMeta.remove(asset);
    }

    @Override
    public void unverifyAssetMeta(String asset) {
        synchronized (this) {
            AssetMeta meta = verifiedMeta.remove(asset);
            if (meta == null) {
                return;
            }
            unverifiedMeta.putIfAbsent(asset, meta);
        }
        listeners.forEach(l -> l.removedVerifiedAssetMeta(asset));
    }

    @Override
    public synchronized boolean isUpToDate() {
        return upToDate;
    }

    @Override
    public void setUpToDate(boolean value) {
        boolean changed;
        synchronized (this) {
            changed = upToDate != value;
            upToDate = value;
        }
        if (changed) {
            LOG.info(() -> "set_up_to_date: " + value);
            listeners.forEach(l -> l.upToDateChanged(value));
        }
    }
}
