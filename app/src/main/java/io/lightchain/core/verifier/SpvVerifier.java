package io.lightchain.core.verifier;

import io.lightchain.core.chain.Blockchain;
import io.lightchain.core.chain.ChainRegistry;
import io.lightchain.core.chain.ChunkFetcher;
import io.lightchain.core.consensus.HeaderHasher;
import io.lightchain.core.metrics.SpvMetrics;
import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.Hash;
import io.lightchain.core.protocol.Hashes;
import io.lightchain.core.protocol.MalformedDataException;
import io.lightchain.core.protocol.Merkle;
import io.lightchain.core.protocol.MerkleProof;
import io.lightchain.core.protocol.Transaction;
import io.lightchain.core.protocol.TransactionCodec;
import io.lightchain.core.rpc.RpcException;
import io.lightchain.core.task.GracefulDisconnectException;
import io.lightchain.core.task.NetworkJob;
import io.lightchain.core.task.TaskGroup;
import io.lightchain.core.wallet.AssetMeta;
import io.lightchain.core.wallet.TxMinedInfo;
import io.lightchain.core.wallet.WalletLedger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.logging.Logger;

/**
 * Proves the ledger's pending transactions and asset metadata against the local header chain.
 * Proofs are requested for pending items whose block header is stored; missing headers inside the
 * checkpoint region are fetched first. A proof that fails to check out drops the server.
 */
public final class SpvVerifier extends NetworkJob {
    private static final Logger LOG = Logger.getLogger(SpvVerifier.class.getName());

    public static final int MAX_BRANCH_LENGTH = 30;

    private final ChainRegistry registry;
    private final WalletLedger ledger;
    private final ChunkFetcher chunks;
    private final HeaderHasher hasher;
    private final boolean skipMerkleCheck;
    private final long scanIntervalMillis;

    private final Map<String, Hash> merkleRoots = new ConcurrentHashMap<>();
    private final Set<String> requestedMerkle = ConcurrentHashMap.newKeySet();
    private final Set<String> requestedAssets = ConcurrentHashMap.newKeySet();
    private volatile Blockchain blockchain;

    /** A proof that checked out. {@code header} is null only when merkle checks are skipped. */
    record VerifiedProof(int height, BlockHeader header, int position) {}

    public SpvVerifier(ChainRegistry registry, WalletLedger ledger, ChunkFetcher chunks, Semaphore requestSlots,
                       boolean skipMerkleCheck, long scanIntervalMillis) {
        super("verifier", requestSlots);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.chunks = Objects.requireNonNull(chunks, "chunks");
        this.hasher = registry.hasher();
        this.skipMerkleCheck = skipMerkleCheck;
        this.scanIntervalMillis = Math.max(1L, scanIntervalMillis);
        ledger.addListener(new WalletLedger.Listener() {
            @Override
            public void removedVerifiedTx(String txid) {
                // a re-mined tx needs a fresh proof
                removeSpvProofForTx(txid);
            }
        });
    }

    @Override
    protected void runTasks(TaskGroup group) {
        group.spawn(this::mainLoop);
    }

    @Override
    protected void reset() {
        merkleRoots.clear();
        requestedMerkle.clear();
        requestedAssets.clear();
    }

    private void mainLoop() throws InterruptedException {
        blockchain = registry.bestChain();
        while (!Thread.currentThread().isInterrupted()) {
            maybeUndoVerifications();
            requestProofs();
            requestAssetProofs();
            Thread.sleep(scanIntervalMillis);
        }
    }

    public boolean isUpToDate() {
        return requestedMerkle.isEmpty() && requestedAssets.isEmpty() && ledger.unverifiedTxs().isEmpty();
    }

    public Optional<Hash> merkleRoot(String txid) {
        return Optional.ofNullable(merkleRoots.get(txid));
    }

    public void removeSpvProofForTx(String txid) {
        merkleRoots.remove(txid);
        requestedMerkle.remove(txid);
    }

    // ---------- transactions ----------

    private void requestProofs() {
        int localHeight = blockchain.height();
        for (Map.Entry<String, Integer> e : ledger.unverifiedTxs().entrySet()) {
            String txid = e.getKey();
            int height = e.getValue();
            if (requestedMerkle.contains(txid) || merkleRoots.containsKey(txid)) {
                continue;
            }
            if (!(0 < height && height <= localHeight)) {
                continue;
            }
            if (!headerAvailable(height)) {
                continue;
            }
            LOG.fine(() -> "requested merkle " + txid);
            requestedMerkle.add(txid);
            group().spawn(() -> requestAndVerifySingleProof(txid, height));
        }
    }

    /** True when the header is stored; otherwise fetches its chunk if it lies in the checkpoint region. */
    private boolean headerAvailable(int height) {
        if (blockchain.readHeader(height) != null) {
            return true;
        }
        if (height < registry.params().checkpoints().maxDgwCheckpoint()) {
            group().spawn(() -> request(server -> chunks.requestChunk(server, height)));
        }
        return false;
    }

    private void requestAndVerifySingleProof(String txid, int height) throws InterruptedException {
        VerifiedProof proof;
        try {
            proof = requestAndVerifyProof(txid, height);
        } catch (RpcException e) {
            if (e.isTimeout()) {
                throw e;
            }
            LOG.info(() -> "tx " + txid + " not at height " + height);
            ledger.removeUnverifiedTx(txid, height);
            requestedMerkle.remove(txid);
            return;
        }
        TxMinedInfo info;
        if (proof.header() == null) {
            info = new TxMinedInfo(proof.height(), 0L, proof.position(), Hash.ZERO);
        } else {
            merkleRoots.put(txid, proof.header().merkleRoot());
            info = new TxMinedInfo(proof.height(), proof.header().timestamp(), proof.position(),
                    hasher.hash(proof.header()));
            LOG.info(() -> "verified " + txid);
        }
        SpvMetrics.incrementProofsVerified();
        requestedMerkle.remove(txid);
        ledger.addVerifiedTx(txid, info);
    }

    /**
     * Fetches the inclusion proof and checks it against the stored header. The height the server returns
     * with the proof wins over the one asked for.
     */
    VerifiedProof requestAndVerifyProof(String txid, int height) throws InterruptedException {
        MerkleProof proof = request(server -> server.getMerkle(txid, height));
        if (proof.blockHeight() != height) {
            LOG.info(() -> "requested tx_height " + height + " differs from received tx_height "
                    + proof.blockHeight() + " for txid " + txid);
        }
        int provenHeight = proof.blockHeight();
        BlockHeader header = registry.bestChain().readHeader(provenHeight);
        try {
            verifyTxIsInBlock(txid, proof.branch(), proof.position(), header, provenHeight);
        } catch (MerkleVerificationException e) {
            if (!skipMerkleCheck) {
                SpvMetrics.incrementProofsRejected();
                LOG.info(() -> e.toString());
                throw new GracefulDisconnectException(e.getMessage(), e);
            }
            LOG.info(() -> "skipping merkle proof check " + txid);
        }
        return new VerifiedProof(provenHeight, header, proof.position());
    }

    /** Root of the tree holding {@code txid} at {@code pos}, walking {@code branch} (display hex) upward. */
    public static Hash hashMerkleRoot(List<String> branch, String txid, int pos) {
        if (pos < 0) {
            throw new MerkleVerificationException("leaf_pos_in_tree must be non-negative");
        }
        byte[] h;
        try {
            h = Hash.fromHex(txid).bytes();
        } catch (MalformedDataException e) {
            throw new MerkleVerificationException("bad txid " + txid, e);
        }
        int index = pos;
        for (String itemHex : branch) {
            byte[] item;
            try {
                item = Bytes.reverse(Bytes.fromHex(itemHex));
            } catch (MalformedDataException e) {
                throw new MerkleVerificationException("bad merkle branch item " + itemHex, e);
            }
            if (item.length != Hash.LENGTH) {
                throw new MerkleVerificationException("all merkle branch items have to 32 bytes long");
            }
            byte[] inner = (index & 1) == 1
                    ? Merkle.innerNode(new Hash(item), new Hash(h))
                    : Merkle.innerNode(new Hash(h), new Hash(item));
            raiseIfValidTx(inner);
            h = Hashes.sha256d(inner);
            index >>= 1;
        }
        if (index != 0) {
            throw new MerkleVerificationException("leaf_pos_in_tree too large for branch");
        }
        return new Hash(h);
    }

    private static void raiseIfValidTx(byte[] innerNode) {
        if (TransactionCodec.isValid(innerNode)) {
            throw new InnerNodeIsValidTransactionException();
        }
    }

    public static void verifyTxIsInBlock(String txid, List<String> branch, int pos, BlockHeader header, int height) {
        if (header == null) {
            throw new MissingBlockHeaderException("merkle verification failed for " + txid + " (missing header " + height + ")");
        }
        if (branch.size() > MAX_BRANCH_LENGTH) {
            throw new MerkleVerificationException("merkle branch too long: " + branch.size());
        }
        Hash root = hashMerkleRoot(branch, txid, pos);
        if (!header.merkleRoot().equals(root)) {
            throw new MerkleRootMismatchException("merkle verification failed for " + txid
                    + " (" + header.merkleRoot().hex() + " != " + root.hex() + ")");
        }
    }

    // ---------- asset metadata ----------

    private void requestAssetProofs() {
        int localHeight = blockchain.height();
        for (AssetMeta meta : ledger.unverifiedAssetMetas().values()) {
            String asset = meta.name();
            if (requestedAssets.contains(asset)) {
                continue;
            }
            int height = meta.source().height();
            if (!(0 < height && height <= localHeight)) {
                continue;
            }
            if (!headerAvailable(height)) {
                continue;
            }
            if (meta.divisionSource() != null && meta.divisionSource().height() > 0
                    && !headerAvailable(meta.divisionSource().height())) {
                continue;
            }
            if (meta.ipfsSource() != null && meta.ipfsSource().height() > 0
                    && !headerAvailable(meta.ipfsSource().height())) {
                continue;
            }
            LOG.fine(() -> "requested asset " + asset);
            requestedAssets.add(asset);
            group().spawn(() -> parseAndVerify(meta));
        }
    }

    void parseAndVerify(AssetMeta result) throws InterruptedException {
        String asset = result.name();
        AssetMeta verified;
        try {
            verified = verifyAssetMeta(result);
        } catch (MerkleVerificationException | GracefulDisconnectException | RpcException | MalformedDataException e) {
            LOG.info(() -> "Failed to verify metadata for " + asset);
            SpvMetrics.incrementProofsRejected();
            requestedAssets.remove(asset);
            throw e instanceof GracefulDisconnectException g ? g : new GracefulDisconnectException(e.getMessage(), e);
        }
        requestedAssets.remove(asset);
        SpvMetrics.incrementProofsVerified();
        LOG.info(() -> "verified asset " + asset);
        ledger.addVerifiedAssetMeta(verified);
    }

    /**
     * Re-derives every field of {@code result} from the transactions it cites. Returns the record with the
     * proven block hashes filled in.
     */
    AssetMeta verifyAssetMeta(AssetMeta result) throws InterruptedException {
        String asset = result.name();
        int mature = registry.params().mature();
        AssetMeta og = ledger.verifiedAssetMeta(asset).orElse(null);
        if (og != null && og.source().height() - mature > result.source().height()) {
            throw new AssetVerificationException("Server is trying to send old asset data for source (height "
                    + og.source().height() + " vs " + result.source().height() + ")");
        }

        AssetMeta.Provenance divSource = result.divisionSource();
        if (divSource != null && divSource.height() > 0) {
            if (og != null && og.divisionSource() != null
                    && og.divisionSource().height() - mature > divSource.height()) {
                throw new AssetVerificationException("Server is trying to send old asset data for division source (height "
                        + og.divisionSource().height() + " vs " + divSource.height() + ")");
            }
            Hash block = verifyAgainst(asset, divSource, ClaimedFields.divisionsOnly(result.divisions()));
            divSource = divSource.withBlockHash(block);
        }

        AssetMeta.Provenance ipfsSource = result.ipfsSource();
        if (ipfsSource != null && ipfsSource.height() > 0) {
            if (og != null && og.ipfsSource() != null
                    && og.ipfsSource().height() - mature > ipfsSource.height()) {
                throw new AssetVerificationException("Server is trying to send old asset data for ipfs source (height "
                        + og.ipfsSource().height() + " vs " + ipfsSource.height() + ")");
            }
            Hash block = verifyAgainst(asset, ipfsSource, ClaimedFields.ipfsOnly(result.ipfs()));
            ipfsSource = ipfsSource.withBlockHash(block);
        }

        boolean hasIpfs = result.hasIpfs() && result.ipfsSource() == null;
        ClaimedFields base = ClaimedFields.base(
                result.circulation(),
                result.divisionSource() == null ? result.divisions() : 0xff,
                result.reissuable(),
                hasIpfs,
                hasIpfs ? result.ipfs() : null);
        Hash block = verifyAgainst(asset, result.source(), base);
        return result.withSources(result.source().withBlockHash(block), divSource, ipfsSource);
    }

    /** Checks one cited output; returns the hash of the block that holds it (null when proofs are skipped). */
    private Hash verifyAgainst(String asset, AssetMeta.Provenance source, ClaimedFields claimed)
            throws InterruptedException {
        String txid = source.outpoint().txid();
        String raw = request(server -> server.getTransaction(txid));
        Transaction tx = TransactionCodec.fromHex(raw);
        if (!txid.equals(tx.txid())) {
            throw new MerkleVerificationException("received tx does not match expected txid (" + txid + " != " + tx.txid() + ")");
        }
        VerifiedProof proof = requestAndVerifyProof(txid, source.height());

        int idx = source.outpoint().index();
        if (idx >= tx.outputs().size()) {
            throw new AssetVerificationException("Non-existant vout " + idx);
        }
        byte[] script = tx.outputs().get(idx).scriptPubKey();
        AssetScripts.ParsedAsset parsed;
        try {
            parsed = AssetScripts.parse(script);
        } catch (BadAssetScriptException e) {
            throw new AssetVerificationException("Bad asset script " + Bytes.toHex(script), e);
        }
        if (!asset.equals(parsed.name())) {
            throw new AssetVerificationException("Not our asset! " + asset + " vs " + parsed.name());
        }
        claimed.check(parsed);
        return proof.header() == null ? null : hasher.hash(proof.header());
    }

    // ---------- reorgs ----------

    private void maybeUndoVerifications() {
        Blockchain old = blockchain;
        Blockchain current = registry.bestChain();
        if (current == old) {
            return;
        }
        blockchain = current;
        int above = current.lastCommonBlockHeight(old);
        LOG.info(() -> "undoing verifications above height " + above);
        undoVerifications(current, above);
    }

    /** Returns verified items above {@code above} whose block is no longer on {@code chain} to pending. */
    void undoVerifications(Blockchain chain, int above) {
        for (Map.Entry<String, TxMinedInfo> e : ledger.verifiedTxs().entrySet()) {
            TxMinedInfo info = e.getValue();
            if (info.height() <= above) {
                continue;
            }
            BlockHeader header = chain.readHeader(info.height());
            if (header == null || !hasher.hash(header).equals(info.headerHash())) {
                String txid = e.getKey();
                ledger.unverifyTx(txid, info.height());
                removeSpvProofForTx(txid);
                LOG.info(() -> "redoing " + txid);
            }
        }
        for (AssetMeta meta : ledger.verifiedAssetMetas().values()) {
            if (isStale(chain, meta.source(), above)
                    || isStale(chain, meta.divisionSource(), above)
                    || isStale(chain, meta.ipfsSource(), above)) {
                ledger.unverifyAssetMeta(meta.name());
                LOG.info(() -> "redoing asset " + meta.name());
            }
        }
    }

    private boolean isStale(Blockchain chain, AssetMeta.Provenance p, int above) {
        if (p == null || p.height() <= above) {
            return false;
        }
        if (p.blockHash() == null) {
            return true;
        }
        BlockHeader header = chain.readHeader(p.height());
        return header == null || !hasher.hash(header).equals(p.blockHash());
    }
}
