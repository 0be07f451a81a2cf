package io.lightchain.core.rpc;

import io.lightchain.core.protocol.MerkleProof;
import io.lightchain.core.wallet.AssetMeta;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;

/**
 * Requests the SPV core makes against an indexing server. Every call blocks until answered and fails with
 * {@link RpcException} on a server error or timeout.
 */
public interface ChainServer {

    /**
     * Subscribes to a scripthash. The current status and every later change are put on {@code updates}
     * keyed by the scripthash.
     */
    void subscribeScripthash(String scripthash, BlockingQueue<StatusUpdate> updates) throws InterruptedException;

    /** Same as {@link #subscribeScripthash} for an asset name. */
    void subscribeAsset(String asset, BlockingQueue<StatusUpdate> updates) throws InterruptedException;

    List<HistoryItem> getHistory(String scripthash) throws InterruptedException;

    /** Raw transaction hex. */
    String getTransaction(String txid) throws InterruptedException;

    MerkleProof getMerkle(String txid, int height) throws InterruptedException;

    HeaderChunk getHeaders(int startHeight, int count) throws InterruptedException;

    Optional<AssetMeta> getAssetMeta(String asset) throws InterruptedException;
}
