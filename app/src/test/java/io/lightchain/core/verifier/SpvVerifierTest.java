package io.lightchain.core.verifier;

import io.lightchain.core.chain.ChainRegistry;
import io.lightchain.core.chain.ChunkFetcher;
import io.lightchain.core.chain.HeaderChainBuilder;
import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.Hash;
import io.lightchain.core.protocol.Merkle;
import io.lightchain.core.protocol.MerkleProof;
import io.lightchain.core.protocol.Transaction;
import io.lightchain.core.protocol.TransactionCodec;
import io.lightchain.core.rpc.ScriptedChainServer;
import io.lightchain.core.task.GracefulDisconnectException;
import io.lightchain.core.wallet.AssetMeta;
import io.lightchain.core.wallet.HistoryEntry;
import io.lightchain.core.wallet.InMemoryWalletLedger;
import io.lightchain.core.wallet.TxMinedInfo;
import io.lightchain.core.wallet.TxOutpoint;
import io.lightchain.core.wallet.WalletLedger;
import org.bitcoinj.core.Base58;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SpvVerifierTest {
    private static final long LIGHT_SUPPLY = 1_000_00000000L;
    private static final long REISSUED = 500_00000000L;
    private static final int UNCHANGED_DIVISIONS = 0xff;

    private static HeaderChainBuilder chain;
    private static List<byte[]> raws;
    private static List<Transaction> block;
    private static List<Hash> leaves;
    private static Hash root;
    private static BlockHeader header10;
    private static List<BlockHeader> stored;

    @TempDir
    Path dataDir;

    private ChainRegistry registry;
    private WalletLedger ledger;
    private ScriptedChainServer server;
    private SpvVerifier verifier;

    @BeforeAll
    static void mineBlockWithTransactions() {
        chain = HeaderChainBuilder.mainChain(10);
        raws = List.of(
                AssetFixtures.rawTx(1, AssetFixtures.P2PKH),
                AssetFixtures.rawTx(2, AssetFixtures.P2PKH, AssetFixtures.P2PKH),
                AssetFixtures.rawTx(3, AssetFixtures.createScript("LIGHT", LIGHT_SUPPLY, 2, true, null),
                        AssetFixtures.ownerScript("LIGHT!")),
                AssetFixtures.rawTx(4, AssetFixtures.P2PKH),
                AssetFixtures.rawTx(5,
                        AssetFixtures.reissueScript("LIGHT", REISSUED, UNCHANGED_DIVISIONS, true, null),
                        AssetFixtures.reissueScript("LIGHT", 0L, UNCHANGED_DIVISIONS, true, AssetFixtures.ipfsHash(7))));
        block = new ArrayList<>();
        leaves = new ArrayList<>();
        for (byte[] raw : raws) {
            Transaction tx = TransactionCodec.fromBytes(raw);
            block.add(tx);
            leaves.add(tx.hash());
        }
        root = Merkle.rootOf(leaves);
        header10 = chain.withMerkleRoot(chain.tip(), root);
        stored = new ArrayList<>(chain.headers());
        stored.add(header10);
    }

    @BeforeEach
    void openChain() {
        registry = ChainRegistry.open(chain.params(), dataDir);
        assertTrue(registry.bestChain().connectChunk(0, chain.wire(stored)));
        ledger = new InMemoryWalletLedger();
        server = new ScriptedChainServer();
    }

    @AfterEach
    void stopVerifier() {
        if (verifier != null) {
            verifier.stop();
        }
    }

    private SpvVerifier newVerifier(boolean skipMerkleCheck) {
        verifier = new SpvVerifier(registry, ledger, new ChunkFetcher(registry), new Semaphore(10),
                skipMerkleCheck, 10L);
        return verifier;
    }

    private static List<String> branchHex(int index) {
        List<String> out = new ArrayList<>();
        for (Hash h : Merkle.branchFor(leaves, index)) {
            out.add(h.hex());
        }
        return out;
    }

    private static String txid(int index) {
        return block.get(index).txid();
    }


    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    // ---------- merkle branches ----------

    @Test
    void branchLeadsToTheBlockRootFromEveryLeaf() {
        for (int i = 0; i < block.size(); i++) {
            assertEquals(root, SpvVerifier.hashMerkleRoot(branchHex(i), txid(i), i));
        }
        SpvVerifier.verifyTxIsInBlock(txid(2), branchHex(2), 2, header10, 10);
    }

    @Test
    void tamperedBranchOrPositionMissesTheRoot() {
        List<String> tampered = new ArrayList<>(branchHex(1));
        Collections.reverse(tampered);
        assertThrows(MerkleRootMismatchException.class,
                () -> SpvVerifier.verifyTxIsInBlock(txid(1), tampered, 1, header10, 10));
        assertThrows(MerkleRootMismatchException.class,
                () -> SpvVerifier.verifyTxIsInBlock(txid(1), branchHex(1), 0, header10, 10));
    }

    @Test
    void positionMustFitTheBranch() {
        assertThrows(MerkleVerificationException.class,
                () -> SpvVerifier.hashMerkleRoot(branchHex(0), txid(0), 4));
        assertThrows(MerkleVerificationException.class,
                () -> SpvVerifier.hashMerkleRoot(branchHex(0), txid(0), -1));
    }

    @Test
    void missingHeaderAndOverlongBranchAreRefused() {
        assertThrows(MissingBlockHeaderException.class,
                () -> SpvVerifier.verifyTxIsInBlock(txid(0), branchHex(0), 0, null, 11));

        List<String> longBranch = Collections.nCopies(SpvVerifier.MAX_BRANCH_LENGTH + 1, "00".repeat(32));
        MerkleVerificationException e = assertThrows(MerkleVerificationException.class,
                () -> SpvVerifier.verifyTxIsInBlock(txid(0), longBranch, 0, header10, 10));
        assertTrue(e.getMessage().contains("too long"));
    }

    @Test
    void innerNodeThatParsesAsTransactionIsRefused() {
        // one input, one output with a four byte script: exactly 64 bytes
        byte[] forged = AssetFixtures.rawTx(7, Bytes.fromHex("51515151"));
        assertEquals(64, forged.length);
        String leaf = new Hash(Bytes.slice(forged, 0, 32)).hex();
        String sibling = new Hash(Bytes.slice(forged, 32, 64)).hex();

        assertThrows(InnerNodeIsValidTransactionException.class,
                () -> SpvVerifier.hashMerkleRoot(List.of(sibling), leaf, 0));
    }

    // ---------- proof requests ----------

    @Test
    void pendingTransactionGetsVerified() throws Exception {
        String txid = txid(1);
        ledger.receiveTransaction(txid, block.get(1), 10);
        server.proofs.put(txid, new MerkleProof(branchHex(1), 1, 10));

        newVerifier(false).start(server);
        await(() -> ledger.verifiedTxs().containsKey(txid));

        TxMinedInfo info = ledger.verifiedTxs().get(txid);
        assertEquals(10, info.height());
        assertEquals(1, info.txpos());
        assertEquals(header10.timestamp(), info.timestamp());
        assertEquals(chain.hash(header10), info.headerHash());
        assertEquals(root, verifier.merkleRoot(txid).orElseThrow());
        await(verifier::isUpToDate);
    }

    @Test
    void badProofDisconnects() throws Exception {
        String txid = txid(1);
        ledger.receiveTransaction(txid, block.get(1), 10);
        server.proofs.put(txid, new MerkleProof(branchHex(1), 0, 10));

        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        newVerifier(false).setFailureListener(failure::complete);
        verifier.start(server);

        Throwable t = failure.get(5, TimeUnit.SECONDS);
        assertInstanceOf(GracefulDisconnectException.class, t);
        assertInstanceOf(MerkleRootMismatchException.class, t.getCause());
        assertFalse(ledger.verifiedTxs().containsKey(txid));
    }

    @Test
    void skippedMerkleCheckAcceptsBadProof() throws Exception {
        String txid = txid(1);
        ledger.receiveTransaction(txid, block.get(1), 10);
        server.proofs.put(txid, new MerkleProof(branchHex(1), 0, 10));

        newVerifier(true).start(server);
        await(() -> ledger.verifiedTxs().containsKey(txid));
        assertEquals(0, ledger.verifiedTxs().get(txid).txpos());
    }

    @Test
    void transactionUnknownAtHeightIsDropped() throws Exception {
        String txid = txid(3);
        ledger.receiveTransaction(txid, block.get(3), 10);

        newVerifier(false).start(server);
        await(() -> ledger.unverifiedTxs().isEmpty());
        assertTrue(ledger.verifiedTxs().isEmpty());
        assertTrue(verifier.isRunning());
    }

    @Test
    void transactionAboveLocalTipWaits() throws Exception {
        ledger.receiveTransaction(txid(0), block.get(0), 50);

        newVerifier(false).start(server);
        Thread.sleep(100);
        assertTrue(server.calls.stream().noneMatch(c -> c.startsWith("get_merkle")));
        assertFalse(verifier.isUpToDate());
    }

    @Test
    void reorgReturnsVerifiedTransactionsToPending() throws Exception {
        String txid = txid(1);
        ledger.receiveTransaction(txid, block.get(1), 10);
        server.proofs.put(txid, new MerkleProof(branchHex(1), 1, 10));
        CountDownLatch removed = new CountDownLatch(1);
        ledger.addListener(new WalletLedger.Listener() {
            @Override
            public void removedVerifiedTx(String id) {
                removed.countDown();
            }
        });

        newVerifier(false).start(server);
        await(() -> ledger.verifiedTxs().containsKey(txid));

        // the proof is gone from the server once the block is orphaned
        server.proofs.clear();
        assertEquals(3, registry.acceptHeaders(10, chain.wire(chain.fork(9, 3, 3))));
        assertEquals(12, registry.bestChain().height());

        assertTrue(removed.await(5, TimeUnit.SECONDS));
        assertFalse(ledger.verifiedTxs().containsKey(txid));
        assertTrue(verifier.merkleRoot(txid).isEmpty());
    }

    @Test
    void transactionBackInMempoolIsProvenAgainOnceMined() throws Exception {
        String addr = "mfcHP2WMCVLsVZA8yrovmhMgxNFW9r98xw";
        String txid = txid(1);
        ledger.receiveHistory(addr, List.of(new HistoryEntry(txid, 10)), Map.of());
        server.proofs.put(txid, new MerkleProof(branchHex(1), 1, 10));

        newVerifier(false).start(server);
        await(() -> ledger.verifiedTxs().containsKey(txid));
        assertTrue(verifier.merkleRoot(txid).isPresent());

        ledger.receiveHistory(addr, List.of(new HistoryEntry(txid, 0)), Map.of());
        assertFalse(ledger.verifiedTxs().containsKey(txid));
        assertTrue(verifier.merkleRoot(txid).isEmpty());

        ledger.receiveHistory(addr, List.of(new HistoryEntry(txid, 10)), Map.of());
        await(() -> ledger.verifiedTxs().containsKey(txid));
        assertEquals(2, server.calls.stream().filter(c -> c.startsWith("get_merkle " + txid)).count());
        await(verifier::isUpToDate);
    }

    @Test
    void undoOnlyTouchesItemsAboveTheCommonHeight() {
        String stale = "aa".repeat(32);
        String belowFork = "bb".repeat(32);
        String stillThere = txid(2);
        ledger.addVerifiedTx(stale, new TxMinedInfo(10, 0L, 1, Hash.ZERO));
        ledger.addVerifiedTx(belowFork, new TxMinedInfo(3, 0L, 0, Hash.ZERO));
        ledger.addVerifiedTx(stillThere, new TxMinedInfo(10, header10.timestamp(), 2, chain.hash(header10)));
        AssetMeta unproven = AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 0), 10, null), null, null);
        ledger.addVerifiedAssetMeta(unproven);

        newVerifier(false).undoVerifications(registry.bestChain(), 5);

        assertEquals(10, ledger.unverifiedTxs().get(stale));
        assertTrue(ledger.verifiedTxs().containsKey(belowFork));
        assertTrue(ledger.verifiedTxs().containsKey(stillThere));
        assertTrue(ledger.verifiedAssetMeta("LIGHT").isEmpty());
        assertTrue(ledger.unverifiedAssetMetas().containsKey("LIGHT"));
    }

    // ---------- asset metadata ----------

    private AssetMeta lightMeta(long circulation, int divisions) {
        return AssetMeta.of("LIGHT", circulation, true, divisions, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 0), 10, null), null, null);
    }

    private void serveAssetTx() {
        server.transactions.put(txid(2), Bytes.toHex(raws.get(2)));
        server.proofs.put(txid(2), new MerkleProof(branchHex(2), 2, 10));
    }

    private void serveReissueTx() {
        server.transactions.put(txid(4), Bytes.toHex(raws.get(4)));
        server.proofs.put(txid(4), new MerkleProof(branchHex(4), 4, 10));
    }

    private static AssetMeta.Provenance at(int tx, int vout, int height) {
        return new AssetMeta.Provenance(new TxOutpoint(txid(tx), vout), height, null);
    }

    /** Supply last set by the reissue, divisions by the create and the ipfs pointer by a later output. */
    private static AssetMeta reissuedMeta(long circulation, int divisions, String ipfs) {
        return AssetMeta.of("LIGHT", circulation, true, divisions, true, ipfs,
                at(4, 0, 10), at(2, 0, 10), at(4, 1, 10));
    }

    private static String ipfs(int fill) {
        return Base58.encode(AssetFixtures.ipfsHash(fill));
    }

    @Test
    void assetMetadataIsTracedToItsBlock() throws Exception {
        serveAssetTx();
        newVerifier(false).start(server);

        AssetMeta verified = verifier.verifyAssetMeta(lightMeta(LIGHT_SUPPLY, 2));
        assertEquals(chain.hash(header10), verified.source().blockHash());
        assertEquals(LIGHT_SUPPLY, verified.circulation());
    }

    @Test
    void ownerTokenIsVerifiedFromItsOwnOutput() throws Exception {
        serveAssetTx();
        newVerifier(false).start(server);

        AssetMeta owner = AssetMeta.of("LIGHT!", AssetScripts.OWNER_SATS, false, 0, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 1), 10, null), null, null);
        assertTrue(owner.owner());
        assertNotNull(verifier.verifyAssetMeta(owner).source().blockHash());
    }

    @Test
    void mismatchedMetadataIsRejected() throws Exception {
        serveAssetTx();
        newVerifier(false).start(server);

        assertThrows(AssetVerificationException.class, () -> verifier.verifyAssetMeta(lightMeta(LIGHT_SUPPLY + 1, 2)));
        assertThrows(AssetVerificationException.class, () -> verifier.verifyAssetMeta(lightMeta(LIGHT_SUPPLY, 8)));

        AssetMeta wrongOutput = AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 5), 10, null), null, null);
        AssetVerificationException e = assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(wrongOutput));
        assertTrue(e.getMessage().contains("vout"));
    }

    @Test
    void olderSourceThanVerifiedIsRejected() {
        AssetMeta newer = AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 0), 100, Hash.ZERO), null, null);
        ledger.addVerifiedAssetMeta(newer);

        AssetVerificationException e = assertThrows(AssetVerificationException.class,
                () -> newVerifier(false).verifyAssetMeta(lightMeta(LIGHT_SUPPLY, 2)));
        assertTrue(e.getMessage().contains("old asset data"));
    }

    @Test
    void parseAndVerifyFilesTheResult() throws Exception {
        serveAssetTx();
        ledger.addUnverifiedAssetMeta(lightMeta(LIGHT_SUPPLY, 2));
        newVerifier(false).start(server);

        await(() -> ledger.verifiedAssetMeta("LIGHT").isPresent());
        assertTrue(ledger.unverifiedAssetMetas().isEmpty());
        assertEquals(chain.hash(header10), ledger.verifiedAssetMeta("LIGHT").orElseThrow().source().blockHash());
    }

    @Test
    void failedAssetVerificationDisconnects() throws Exception {
        serveAssetTx();
        newVerifier(false).start(server);

        GracefulDisconnectException e = assertThrows(GracefulDisconnectException.class,
                () -> verifier.parseAndVerify(lightMeta(1L, 2)));
        assertInstanceOf(AssetVerificationException.class, e.getCause());
        assertTrue(ledger.verifiedAssetMeta("LIGHT").isEmpty());
    }

    @Test
    void everySourcedFieldIsTracedToItsOwnOutput() throws Exception {
        serveAssetTx();
        serveReissueTx();
        newVerifier(false).start(server);

        AssetMeta verified = verifier.verifyAssetMeta(reissuedMeta(LIGHT_SUPPLY + REISSUED, 2, ipfs(7)));
        Hash block = chain.hash(header10);
        assertEquals(block, verified.source().blockHash());
        assertEquals(block, verified.divisionSource().blockHash());
        assertEquals(block, verified.ipfsSource().blockHash());
        assertEquals(new TxOutpoint(txid(4), 1), verified.ipfsSource().outpoint());
    }

    @Test
    void divisionAndIpfsSourcesMustMatchTheirOutputs() throws Exception {
        serveAssetTx();
        serveReissueTx();
        newVerifier(false).start(server);

        assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(reissuedMeta(LIGHT_SUPPLY + REISSUED, 3, ipfs(7))));
        assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(reissuedMeta(LIGHT_SUPPLY + REISSUED, 2, ipfs(8))));
    }

    @Test
    void reissuedAmountMayNotExceedCirculation() throws Exception {
        serveAssetTx();
        serveReissueTx();
        newVerifier(false).start(server);

        assertNotNull(verifier.verifyAssetMeta(reissuedMeta(REISSUED, 2, ipfs(7))).source().blockHash());
        AssetVerificationException e = assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(reissuedMeta(REISSUED - 1, 2, ipfs(7))));
        assertTrue(e.getMessage().contains("greater than the total"));
    }

    @Test
    void sourceExactlyOneMaturityBelowVerifiedIsAccepted() throws Exception {
        serveAssetTx();
        int mature = chain.params().mature();
        ledger.addVerifiedAssetMeta(AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 0), 10 + mature, Hash.ZERO), null, null));
        newVerifier(false).start(server);

        assertNotNull(verifier.verifyAssetMeta(lightMeta(LIGHT_SUPPLY, 2)).source().blockHash());

        ledger.addVerifiedAssetMeta(AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, false, null,
                new AssetMeta.Provenance(new TxOutpoint(txid(2), 0), 11 + mature, Hash.ZERO), null, null));
        AssetVerificationException e = assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(lightMeta(LIGHT_SUPPLY, 2)));
        assertTrue(e.getMessage().contains("old asset data for source"));
    }

    @Test
    void olderDivisionOrIpfsSourceThanVerifiedIsRejected() {
        int mature = chain.params().mature();
        AssetMeta.Provenance recent = new AssetMeta.Provenance(new TxOutpoint(txid(4), 0), 11 + mature, Hash.ZERO);
        AssetMeta.Provenance base = new AssetMeta.Provenance(new TxOutpoint(txid(4), 0), 10, Hash.ZERO);
        newVerifier(false);

        ledger.addVerifiedAssetMeta(AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, true, ipfs(7),
                base, recent, null));
        AssetVerificationException divisions = assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(reissuedMeta(LIGHT_SUPPLY + REISSUED, 2, ipfs(7))));
        assertTrue(divisions.getMessage().contains("division source"));

        ledger.addVerifiedAssetMeta(AssetMeta.of("LIGHT", LIGHT_SUPPLY, true, 2, true, ipfs(7),
                base, null, recent));
        AssetMeta pointerOnly = AssetMeta.of("LIGHT", LIGHT_SUPPLY + REISSUED, true, 2, true, ipfs(7),
                at(4, 0, 10), null, at(4, 1, 10));
        AssetVerificationException pointer = assertThrows(AssetVerificationException.class,
                () -> verifier.verifyAssetMeta(pointerOnly));
        assertTrue(pointer.getMessage().contains("ipfs source"));
    }
}
