package io.lightchain.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.lightchain.core.protocol.MalformedDataException;
import io.lightchain.core.protocol.MerkleProof;
import io.lightchain.core.wallet.AssetMeta;
import io.lightchain.core.wallet.TxOutpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.logging.Logger;

/** {@link ChainServer} over an Electrum-protocol JSON-RPC session. */
public final class ElectrumChainServer implements ChainServer {
    private static final Logger LOG = Logger.getLogger(ElectrumChainServer.class.getName());

    private final JsonRpcSession session;

    public ElectrumChainServer(JsonRpcSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    public JsonRpcSession session() {
        return session;
    }

    @Override
    public void subscribeScripthash(String scripthash, BlockingQueue<StatusUpdate> updates) throws InterruptedException {
        subscribe("blockchain.scripthash.subscribe", scripthash, updates);
    }

    @Override
    public void subscribeAsset(String asset, BlockingQueue<StatusUpdate> updates) throws InterruptedException {
        subscribe("blockchain.asset.subscribe", asset, updates);
    }

    private void subscribe(String method, String key, BlockingQueue<StatusUpdate> updates) throws InterruptedException {
        session.subscribe(method, key, status -> {
            StatusUpdate update = new StatusUpdate(key, status == null || status.isNull() ? null : status.asText());
            if (!updates.offer(update)) {
                LOG.warning(() -> "Status queue full, dropping update for " + key);
            }
        });
    }

    @Override
    public List<HistoryItem> getHistory(String scripthash) throws InterruptedException {
        JsonNode result = session.call("blockchain.scripthash.get_history", scripthash);
        if (!result.isArray()) {
            throw new MalformedDataException("history must be a list");
        }
        List<HistoryItem> out = new ArrayList<>(result.size());
        for (JsonNode item : result) {
            JsonNode fee = item.get("fee");
            out.add(new HistoryItem(required(item, "tx_hash").asText(), required(item, "height").asInt(),
                    fee == null || fee.isNull() ? null : fee.asLong()));
        }
        return out;
    }

    @Override
    public String getTransaction(String txid) throws InterruptedException {
        JsonNode result = session.call("blockchain.transaction.get", txid);
        if (!result.isTextual()) {
            throw new MalformedDataException("transaction must be a hex string");
        }
        return result.asText();
    }

    @Override
    public MerkleProof getMerkle(String txid, int height) throws InterruptedException {
        JsonNode result = session.call("blockchain.transaction.get_merkle", txid, height);
        JsonNode merkle = required(result, "merkle");
        List<String> branch = new ArrayList<>(merkle.size());
        for (JsonNode h : merkle) {
            branch.add(h.asText());
        }
        return new MerkleProof(branch, required(result, "pos").asInt(), required(result, "block_height").asInt());
    }

    @Override
    public HeaderChunk getHeaders(int startHeight, int count) throws InterruptedException {
        JsonNode result = session.call("blockchain.block.headers", startHeight, count);
        return new HeaderChunk(required(result, "hex").asText(), required(result, "count").asInt(),
                result.path("max").asInt(count));
    }

    @Override
    public Optional<AssetMeta> getAssetMeta(String asset) throws InterruptedException {
        JsonNode r = session.call("blockchain.asset.get_meta", asset);
        if (r == null || r.isNull() || r.isMissingNode() || r.isBoolean()) {
            return Optional.empty();
        }
        JsonNode ipfs = r.get("ipfs");
        return Optional.of(AssetMeta.of(asset,
                required(r, "sats_in_circulation").asLong(),
                required(r, "reissuable").asBoolean(),
                required(r, "divisions").asInt(),
                required(r, "has_ipfs").asBoolean(),
                ipfs == null || ipfs.isNull() ? null : ipfs.asText(),
                provenance(required(r, "source")),
                provenance(r.get("source_divisions")),
                provenance(r.get("source_ipfs"))));
    }

    private static AssetMeta.Provenance provenance(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        TxOutpoint outpoint = new TxOutpoint(required(node, "tx_hash").asText(), required(node, "tx_pos").asInt());
        return new AssetMeta.Provenance(outpoint, required(node, "height").asInt(), null);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            throw new MalformedDataException("missing field '" + field + "' in server response");
        }
        return v;
    }
}
