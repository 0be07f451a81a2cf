package io.lightchain.core.sync;

import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.protocol.Transaction;
import io.lightchain.core.protocol.TransactionCodec;
import io.lightchain.core.rpc.HistoryItem;
import io.lightchain.core.rpc.RpcException;
import io.lightchain.core.rpc.StatusUpdate;
import io.lightchain.core.task.GracefulDisconnectException;
import io.lightchain.core.task.NetworkJob;
import io.lightchain.core.task.TaskGroup;
import io.lightchain.core.verifier.AssetNames;
import io.lightchain.core.wallet.AssetMeta;
import io.lightchain.core.wallet.HistoryEntry;
import io.lightchain.core.wallet.WalletLedger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Keeps the ledger's addresses and assets in step with the server. Each watched item is subscribed once;
 * a pushed status that differs from the locally recomputed one pulls the history (or metadata), which must
 * hash to the announced status before it is accepted.
 */
public final class Synchronizer extends NetworkJob {
    private static final Logger LOG = Logger.getLogger(Synchronizer.class.getName());

    private record StatusKey(String subject, String status) {}

    private final WalletLedger ledger;
    private final NetworkParameters params;
    private final long staleTimeoutMillis;
    private final long scanIntervalMillis;
    private final BooleanSupplier proofsSettled;

    private final Set<String> watchedAddresses = ConcurrentHashMap.newKeySet();
    private final Set<String> watchedAssets = ConcurrentHashMap.newKeySet();
    private final Set<String> requestedAddrs = ConcurrentHashMap.newKeySet();
    private final Set<String> requestedAssets = ConcurrentHashMap.newKeySet();
    private final Map<String, String> scripthashToAddress = new ConcurrentHashMap<>();
    private final Set<StatusKey> requestedHistories = ConcurrentHashMap.newKeySet();
    private final Set<StatusKey> requestedAssetMetas = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> requestedTx = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> staleHistories = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> staleMetadata = new ConcurrentHashMap<>();

    private final BlockingQueue<String> addQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> assetAddQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<StatusUpdate> statusQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<StatusUpdate> assetStatusQueue = new LinkedBlockingQueue<>();

    private volatile boolean processedSomeNotifications;

    public Synchronizer(WalletLedger ledger, NetworkParameters params, Semaphore requestSlots,
                        long staleTimeoutMillis, long scanIntervalMillis, BooleanSupplier proofsSettled) {
        super("synchronizer", requestSlots);
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.params = Objects.requireNonNull(params, "params");
        this.staleTimeoutMillis = staleTimeoutMillis;
        this.scanIntervalMillis = Math.max(1L, scanIntervalMillis);
        this.proofsSettled = proofsSettled == null ? () -> true : proofsSettled;
    }

    @Override
    protected void runTasks(TaskGroup group) {
        group.spawn(this::sendSubscriptions);
        group.spawn(this::handleStatus);
        group.spawn(this::sendAssetSubscriptions);
        group.spawn(this::handleAssetStatus);
        group.spawn(this::mainLoop);
    }

    @Override
    protected void reset() {
        watchedAddresses.clear();
        watchedAssets.clear();
        requestedAddrs.clear();
        requestedAssets.clear();
        scripthashToAddress.clear();
        requestedHistories.clear();
        requestedAssetMetas.clear();
        requestedTx.clear();
        staleHistories.clear();
        staleMetadata.clear();
        addQueue.clear();
        assetAddQueue.clear();
        statusQueue.clear();
        assetStatusQueue.clear();
        processedSomeNotifications = false;
    }

    public boolean isUpToDate() {
        return requestedAddrs.isEmpty()
                && requestedAssets.isEmpty()
                && requestedAssetMetas.isEmpty()
                && requestedHistories.isEmpty()
                && requestedTx.isEmpty()
                && staleHistories.isEmpty()
                && proofsSettled.getAsBoolean();
    }

    public void add(String address) {
        if (!Scripthashes.isAddress(address, params)) {
            throw new IllegalArgumentException("invalid address " + address);
        }
        if (watchedAddresses.add(address)) {
            requestedAddrs.add(address);
            addQueue.add(address);
        }
    }

    public void addAsset(String asset) {
        if (asset.length() > AssetNames.MAX_SUBSCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Assets may be at most " + AssetNames.MAX_SUBSCRIPTION_LENGTH
                    + " characters. " + asset);
        }
        if (watchedAssets.add(asset)) {
            requestedAssets.add(asset);
            assetAddQueue.add(asset);
        }
    }

    // ---------- subscriptions ----------

    private void sendSubscriptions() throws InterruptedException {
        while (true) {
            String addr = addQueue.take();
            group().spawn(() -> subscribeToAddress(addr));
        }
    }

    private void subscribeToAddress(String addr) throws InterruptedException {
        String scripthash = Scripthashes.fromAddress(addr, params);
        scripthashToAddress.put(scripthash, addr);
        try {
            request(server -> {
                server.subscribeScripthash(scripthash, statusQueue);
                return null;
            });
        } catch (RpcException e) {
            if ("history too large".equals(e.getMessage())) {
                throw new GracefulDisconnectException("history too large for " + addr, e);
            }
            throw e;
        }
    }

    private void sendAssetSubscriptions() throws InterruptedException {
        while (true) {
            String asset = assetAddQueue.take();
            group().spawn(() -> subscribeToAsset(asset));
        }
    }

    private void subscribeToAsset(String asset) throws InterruptedException {
        request(server -> {
            server.subscribeAsset(asset, assetStatusQueue);
            return null;
        });
    }

    private void handleStatus() throws InterruptedException {
        while (true) {
            StatusUpdate update = statusQueue.take();
            String addr = scripthashToAddress.get(update.key());
            if (addr == null) {
                LOG.fine(() -> "status for unknown scripthash " + update.key());
                continue;
            }
            group().spawn(() -> onAddressStatus(addr, update.status()));
            processedSomeNotifications = true;
        }
    }

    private void handleAssetStatus() throws InterruptedException {
        while (true) {
            StatusUpdate update = assetStatusQueue.take();
            group().spawn(() -> onAssetStatus(update.key(), update.status()));
        }
    }

    // ---------- status handling ----------

    /** An address stays requested until its first status has been handled. */
    void onAddressStatus(String addr, String status) throws InterruptedException {
        try {
            syncHistory(addr, status);
        } finally {
            requestedAddrs.remove(addr);
        }
    }

    private void syncHistory(String addr, String status) throws InterruptedException {
        if (Objects.equals(StatusDigests.historyStatus(ledger.addressHistory(addr)), status)) {
            return;
        }
        // one fetch per announced status; a new status fetches again
        StatusKey key = new StatusKey(addr, status);
        if (!requestedHistories.add(key)) {
            return;
        }
        cancelStale(staleHistories, addr);
        String scripthash = Scripthashes.fromAddress(addr, params);
        List<HistoryItem> result = request(server -> server.getHistory(scripthash));
        LOG.info(() -> "receiving history " + addr + " " + result.size());
        List<HistoryEntry> hist = new ArrayList<>(result.size());
        Map<String, Long> fees = new HashMap<>();
        for (HistoryItem item : result) {
            hist.add(new HistoryEntry(item.txHash(), item.height()));
            if (item.fee() != null) {
                fees.put(item.txHash(), item.fee());
            }
        }
        if (!Objects.equals(StatusDigests.historyStatus(hist), status)) {
            LOG.info(() -> "error: status mismatch: " + addr + ". we'll wait a bit for status update.");
            staleHistories.put(addr, group().spawn(() -> disconnectIfStillStale("addr " + addr + ": history")));
        } else {
            cancelStale(staleHistories, addr);
            ledger.receiveHistory(addr, hist, fees);
            requestMissingTxs(hist, false);
        }
        requestedHistories.remove(key);
    }

    void onAssetStatus(String asset, String status) throws InterruptedException {
        try {
            syncAssetMeta(asset, status);
        } finally {
            requestedAssets.remove(asset);
        }
    }

    /** Matching metadata is filed as unverified; the verifier proves it against the cited transactions. */
    private void syncAssetMeta(String asset, String status) throws InterruptedException {
        Optional<AssetMeta> local = ledger.assetMeta(asset);
        if (Objects.equals(StatusDigests.assetStatus(local.orElse(null)), status)) {
            return;
        }
        StatusKey key = new StatusKey(asset, status);
        if (!requestedAssetMetas.add(key)) {
            return;
        }
        Optional<AssetMeta> result = request(server -> server.getAssetMeta(asset));
        LOG.info(() -> "receiving asset meta " + asset + " " + result.orElse(null));
        if (!Objects.equals(StatusDigests.assetStatus(result.orElse(null)), status)) {
            LOG.info(() -> "error: status mismatch: " + asset + ". we'll wait a bit for status update.");
            staleMetadata.put(asset, group().spawn(() -> disconnectIfStillStale("asset " + asset + ": asset")));
        } else {
            cancelStale(staleMetadata, asset);
            result.ifPresent(ledger::addUnverifiedAssetMeta);
        }
        requestedAssetMetas.remove(key);
    }

    private void disconnectIfStillStale(String what) throws InterruptedException {
        Thread.sleep(staleTimeoutMillis);
        throw new SynchronizerException("timeout reached waiting for " + what + " still stale");
    }

    private static void cancelStale(Map<String, Future<?>> timers, String key) {
        Future<?> timer = timers.remove(key);
        if (timer != null) {
            timer.cancel(true);
        }
    }

    // ---------- transactions ----------

    private void requestMissingTxs(List<HistoryEntry> hist, boolean allowServerNotFindingTx)
            throws InterruptedException {
        List<String> txids = new ArrayList<>();
        for (HistoryEntry e : hist) {
            if (requestedTx.containsKey(e.txHash()) || ledger.hasTransaction(e.txHash())) {
                continue;
            }
            txids.add(e.txHash());
            requestedTx.put(e.txHash(), e.height());
        }
        if (txids.isEmpty()) {
            return;
        }
        try (TaskGroup fetches = new TaskGroup(name() + "-txs")) {
            for (String txid : txids) {
                fetches.spawn(() -> getTransaction(txid, allowServerNotFindingTx));
            }
            fetches.join();
        }
    }

    private void getTransaction(String txid, boolean allowServerNotFindingTx) throws InterruptedException {
        String raw;
        try {
            raw = request(server -> server.getTransaction(txid));
        } catch (RpcException e) {
            // most likely "No such mempool or blockchain transaction"
            if (allowServerNotFindingTx && !e.isTimeout()) {
                requestedTx.remove(txid);
                return;
            }
            throw e;
        }
        Transaction tx = TransactionCodec.fromHex(raw);
        if (!txid.equals(tx.txid())) {
            throw new SynchronizerException("received tx does not match expected txid (" + txid + " != " + tx.txid() + ")");
        }
        Integer height = requestedTx.remove(txid);
        int txHeight = height == null ? 0 : height;
        ledger.receiveTransaction(txid, tx, txHeight);
        LOG.info(() -> "received tx " + txid + " height: " + txHeight + " bytes: " + raw.length() / 2);
    }

    // ---------- main loop ----------

    private void mainLoop() throws InterruptedException {
        ledger.setUpToDate(false);
        for (String addr : shuffled(ledger.historyAddresses())) {
            requestMissingTxs(ledger.addressHistory(addr), true);
        }
        for (String addr : shuffled(ledger.addresses())) {
            add(addr);
        }
        for (String asset : ledger.assets()) {
            addAsset(asset);
        }
        while (true) {
            Thread.sleep(scanIntervalMillis);
            watchNewItems();
            boolean upToDate = isUpToDate();
            if (upToDate != ledger.isUpToDate() || (upToDate && processedSomeNotifications)) {
                processedSomeNotifications = false;
                if (upToDate) {
                    resetRequestCounters();
                }
                ledger.setUpToDate(upToDate);
            }
        }
    }

    /** Picks up addresses and assets the wallet started watching since the last pass. */
    private void watchNewItems() {
        for (String addr : ledger.addresses()) {
            if (!watchedAddresses.contains(addr)) {
                add(addr);
            }
        }
        for (String asset : ledger.assets()) {
            if (!watchedAssets.contains(asset)) {
                addAsset(asset);
            }
        }
    }

    private static List<String> shuffled(Set<String> items) {
        List<String> out = new ArrayList<>(items);
        Collections.shuffle(out);
        return out;
    }
}
