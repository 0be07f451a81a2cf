package io.lightchain.core.chain;

import io.lightchain.core.consensus.Checkpoints;
import io.lightchain.core.consensus.ConsensusRules;
import io.lightchain.core.consensus.ConsensusViolationException;
import io.lightchain.core.consensus.DarkGravityWave;
import io.lightchain.core.consensus.HeaderHasher;
import io.lightchain.core.consensus.MissingHeaderException;
import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.metrics.SpvMetrics;
import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.BlockHeaderCodec;
import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.CompactTarget;
import io.lightchain.core.protocol.Hash;
import io.lightchain.core.protocol.InvalidHeaderException;
import io.lightchain.core.storage.HeaderFile;
import io.lightchain.core.storage.HeaderStorageException;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A contiguous run of headers starting at {@code forkpoint}, stored in its own file. Heights below the
 * forkpoint are served by the parent chain. The best chain has no parent and starts at genesis.
 *
 * <p>Identity is the hash at the forkpoint. A swap exchanges files and identities with the parent, so
 * the chain holding the most work always owns the best-chain file.
 *
 * <p>Locking: registry lock before any chain lock. Only code holding the registry lock takes two chain locks.
 */
public final class Blockchain {
    private static final Logger LOG = Logger.getLogger(Blockchain.class.getName());
    private static final int RECORD_SIZE = HeaderFile.RECORD_SIZE;

    private final ChainRegistry registry;
    private final NetworkParameters params;
    private final Checkpoints checkpoints;
    private final ConsensusRules rules;
    private final HeaderHasher hasher;
    private final BlockHeaderCodec codec;
    private final HeaderFile files;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private int forkpoint;
    private Blockchain parent;
    private Hash firstHash;
    private Hash prevHash;
    private int size;

    Blockchain(ChainRegistry registry, int forkpoint, Blockchain parent, Hash firstHash, Hash prevHash) {
        this.registry = registry;
        this.params = registry.params();
        this.checkpoints = params.checkpoints();
        this.rules = registry.rules();
        this.hasher = rules.hasher();
        this.codec = params.codec();
        this.files = registry.files();
        if (forkpoint > 0 && forkpoint <= checkpoints.maxDgwCheckpoint()) {
            throw new IllegalArgumentException("cannot fork below max checkpoint. forkpoint: " + forkpoint);
        }
        this.forkpoint = forkpoint;
        this.parent = parent;
        this.firstHash = firstHash;
        this.prevHash = prevHash;
        updateSize();
    }

    // ---------- identity ----------

    public Hash id() {
        lock.lock();
        try {
            return firstHash;
        } finally {
            lock.unlock();
        }
    }

    public int forkpoint() {
        lock.lock();
        try {
            return forkpoint;
        } finally {
            lock.unlock();
        }
    }

    public Blockchain parent() {
        lock.lock();
        try {
            return parent;
        } finally {
            lock.unlock();
        }
    }

    /** Hash right before the forkpoint; null for the best chain. */
    public Hash prevHash() {
        lock.lock();
        try {
            return prevHash;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int height() {
        lock.lock();
        try {
            return forkpoint + size - 1;
        } finally {
            lock.unlock();
        }
    }

    public Path path() {
        lock.lock();
        try {
            if (parent == null) {
                return files.bestChainPath();
            }
            return files.forksDir().resolve(forkFileName(forkpoint, prevHash, firstHash));
        } finally {
            lock.unlock();
        }
    }

    static String forkFileName(int forkpoint, Hash prevHash, Hash firstHash) {
        return HeaderFile.FORK_PREFIX + forkpoint + "_" + prevHash.hexStripped() + "_" + firstHash.hexStripped();
    }

    void updateSize() {
        lock.lock();
        try {
            size = files.recordCount(path());
        } finally {
            lock.unlock();
        }
    }

    void setParent(Blockchain newParent) {
        lock.lock();
        try {
            this.parent = newParent;
        } finally {
            lock.unlock();
        }
    }

    /** Each ancestor chain (this one included) mapped to the height of the last block shared with it. */
    public Map<Blockchain, Integer> parentHeights() {
        registry.lock();
        try {
            Map<Blockchain, Integer> result = new LinkedHashMap<>();
            result.put(this, height());
            Blockchain chain = this;
            while (true) {
                Blockchain p = chain.parent();
                if (p == null) break;
                result.put(p, chain.forkpoint() - 1);
                chain = p;
            }
            return result;
        } finally {
            registry.unlock();
        }
    }

    public int lastCommonBlockHeight(Blockchain other) {
        int last = 0;
        Map<Blockchain, Integer> ours = parentHeights();
        Map<Blockchain, Integer> theirs = other.parentHeights();
        for (Map.Entry<Blockchain, Integer> e : ours.entrySet()) {
            Integer h = theirs.get(e.getKey());
            if (h != null) {
                last = Math.max(last, Math.min(e.getValue(), h));
            }
        }
        return last;
    }

    // ---------- reads ----------

    /** Header at {@code height}, or null when unknown (beyond the tip or an unfilled slot). */
    public BlockHeader readHeader(int height) {
        if (height < 0) {
            return null;
        }
        Blockchain delegate;
        lock.lock();
        try {
            if (height < forkpoint) {
                delegate = parent;
            } else {
                if (height > forkpoint + size - 1) {
                    return null;
                }
                byte[] record = files.readRecord(path(), height - forkpoint);
                return record == null ? null : codec.deserialize(record, height);
            }
        } finally {
            lock.unlock();
        }
        return delegate == null ? null : delegate.readHeader(height);
    }

    public BlockHeader headerAtTip() {
        return readHeader(height());
    }

    public Hash getHash(int height) {
        if (height == -1) {
            return Hash.ZERO;
        }
        if (height == 0) {
            return params.genesisHash();
        }
        if (height <= params.dgwActivationHeight() && (height + 1) % Checkpoints.RETARGET_INTERVAL == 0) {
            var legacy = checkpoints.legacyWindow(height);
            if (legacy.isPresent()) {
                return legacy.get().hash();
            }
        }
        var dgw = checkpoints.dgwCheckpoint(height);
        if (dgw.isPresent()) {
            return dgw.get().hash();
        }
        BlockHeader header = readHeader(height);
        if (header == null) {
            throw new MissingHeaderException(height);
        }
        return hasher.hash(header);
    }

    public boolean checkHash(int height, Hash hash) {
        try {
            return hash.equals(getHash(height));
        } catch (MissingHeaderException | HeaderStorageException e) {
            return false;
        }
    }

    public boolean checkHeader(BlockHeader header) {
        return checkHash(header.height(), hasher.hash(header));
    }

    // ---------- targets and work ----------

    public BigInteger getTarget(int height) {
        return getTarget(height, Map.of());
    }

    /**
     * Target a header at {@code height} must meet. {@code window} supplies headers that are being verified
     * but not stored yet.
     */
    public BigInteger getTarget(int height, Map<Integer, BlockHeader> window) {
        if (params.isTestnet()) {
            return BigInteger.ZERO;
        }
        if (height < params.dgwActivationHeight()) {
            return checkpoints.legacyWindow(height)
                    .orElseThrow(() -> new IllegalStateException("no legacy checkpoint covers height " + height))
                    .target();
        }
        var dgw = checkpoints.dgwCheckpoint(height);
        if (dgw.isPresent()) {
            return dgw.get().target();
        }
        if (params.inDifficultyResetBand(height)) {
            return params.kawpowLimit();
        }
        if (height <= height()) {
            BlockHeader stored = readHeader(height);
            if (stored == null) {
                throw new MissingHeaderException(height);
            }
            return CompactTarget.bitsToTarget(stored.bits());
        }
        return DarkGravityWave.nextTarget(height, h -> {
            BlockHeader fromWindow = window.get(h);
            return fromWindow != null ? fromWindow : readHeader(h);
        }, params);
    }

    public BigInteger getChainwork() {
        return getChainwork(Math.max(0, height()));
    }

    /** Cumulative work up to {@code height}; heights inside the checkpoint region count as zero. */
    public BigInteger getChainwork(int height) {
        if (params.isTestnet()) {
            return BigInteger.valueOf(height);
        }
        if (height < checkpoints.floor()) {
            return BigInteger.ZERO;
        }
        ChainWorkCache cache = registry.workCache();
        int interval = Checkpoints.RETARGET_INTERVAL;
        int lastRetarget = height / interval * interval - 1;
        int cachedHeight = lastRetarget;
        while (cache.get(getHash(cachedHeight)) == null) {
            if (cachedHeight <= -1) break;
            cachedHeight -= interval;
        }
        if (cachedHeight < -1) {
            throw new IllegalStateException("chain work walk went below genesis: " + cachedHeight);
        }
        BigInteger running = cache.get(getHash(cachedHeight));
        while (cachedHeight < lastRetarget) {
            BigInteger epoch = BigInteger.ZERO;
            for (int i = 0; i < interval; i++) {
                cachedHeight++;
                epoch = epoch.add(workAt(cachedHeight));
            }
            running = running.add(epoch);
            cache.put(getHash(cachedHeight), running);
        }
        BigInteger partial = BigInteger.ZERO;
        while (cachedHeight < height) {
            cachedHeight++;
            partial = partial.add(workAt(cachedHeight));
        }
        return running.add(partial);
    }

    private BigInteger workAt(int height) {
        return CompactTarget.work(getTarget(height));
    }

    // ---------- connect ----------

    /** True if {@code header} links onto this chain and passes the header checks. */
    public boolean canConnect(BlockHeader header, boolean checkHeight) {
        if (header == null) {
            return false;
        }
        int height = header.height();
        if (checkHeight && height() != height - 1) {
            return false;
        }
        if (height == 0) {
            return hasher.hash(header).equals(params.genesisHash());
        }
        Hash prev;
        BigInteger target;
        try {
            prev = getHash(height - 1);
            if (!prev.equals(header.prevHash())) {
                return false;
            }
            target = getTarget(height, Map.of(height, header));
        } catch (MissingHeaderException | HeaderStorageException e) {
            return false;
        }
        try {
            rules.verifyHeader(header, prev, target, null);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.fine(() -> "header " + height + " does not connect: " + e.getMessage());
            return false;
        }
        return true;
    }

    /** Verifies and stores a chunk of wire headers; false (nothing stored) on any failure. */
    public boolean connectChunk(int startHeight, byte[] data) {
        if (startHeight < 0) {
            throw new IllegalArgumentException("startHeight must be >= 0");
        }
        try {
            SpvMetrics.recordChunkVerification(() -> {
                verifyChunk(startHeight, data);
                return null;
            });
            saveChunk(startHeight, data);
            SpvMetrics.incrementChunksConnected();
            return true;
        } catch (RuntimeException e) {
            SpvMetrics.incrementChunksRejected();
            LOG.info(() -> "verify_chunk from height " + startHeight + " failed: " + e);
            return false;
        }
    }

    public boolean connectChunk(int startHeight, String hex) {
        return connectChunk(startHeight, Bytes.fromHex(hex));
    }

    public void verifyChunk(int startHeight, byte[] data) {
        int activationHeight = params.kawpowActivationHeight();
        Hash prev = getHash(startHeight - 1);
        Map<Integer, BlockHeader> window = new HashMap<>();
        int p = 0;
        int s = startHeight;
        while (p < data.length) {
            int wireSize = BlockHeaderCodec.wireSize(s, activationHeight);
            byte[] raw = Bytes.slice(data, p, Math.min(p + wireSize, data.length));
            p += wireSize;
            Hash expected;
            try {
                expected = getHash(s);
            } catch (MissingHeaderException e) {
                expected = null;
            }
            if (raw.length != BlockHeaderCodec.LEGACY_SIZE && raw.length != BlockHeaderCodec.EXTENDED_SIZE) {
                throw new InvalidHeaderException("Invalid header length: " + raw.length);
            }
            BlockHeader header = codec.deserialize(raw, s);
            window.put(s, header);

            BigInteger target;
            if (s >= checkpoints.dgwStart() && s <= checkpoints.maxDgwCheckpoint() + Checkpoints.RETARGET_INTERVAL
                    && !checkpoints.dgw().isEmpty()) {
                // inside the DGW checkpoint region only window boundaries are pinned
                target = checkpoints.dgwCheckpoint(s).isPresent()
                        ? getTarget(s, window)
                        : CompactTarget.bitsToTarget(header.bits());
            } else {
                target = getTarget(s, window);
            }
            rules.verifyHeader(header, prev, target, expected);
            prev = hasher.hash(header);
            s++;
        }

        if (!checkpoints.dgw().isEmpty()
                && startHeight >= checkpoints.dgwStart() && startHeight <= checkpoints.maxDgwCheckpoint()) {
            if (startHeight % checkpoints.dgwSpacing() != 0) {
                throw new ConsensusViolationException("dgw chunk not from start");
            }
            if (s - startHeight != checkpoints.dgwSpacing()) {
                throw new ConsensusViolationException("dgw chunk not correct size");
            }
        }
    }

    /** Stores a verified chunk. Chunks inside the checkpoint region always go to the best chain. */
    public void saveChunk(int startHeight, byte[] chunk) {
        boolean inCheckpointRegion = startHeight < checkpoints.floor();
        if (inCheckpointRegion && parent() != null) {
            registry.bestChain().saveChunk(startHeight, chunk);
            return;
        }
        byte[] records = BlockHeaderCodec.widenChunk(chunk, startHeight, params.kawpowActivationHeight());
        lock.lock();
        try {
            long deltaBytes = (long) (startHeight - forkpoint) * RECORD_SIZE;
            // the part below the forkpoint belongs to the parent
            if (deltaBytes < 0) {
                records = Bytes.slice(records, (int) Math.min(-deltaBytes, records.length), records.length);
                deltaBytes = 0;
            }
            files.write(path(), records, deltaBytes, !inCheckpointRegion);
            updateSize();
        } finally {
            lock.unlock();
        }
        swapWithParent();
    }

    /** Appends one header at the tip. */
    public void saveHeader(BlockHeader header) {
        lock.lock();
        try {
            int delta = header.height() - forkpoint;
            if (delta != size) {
                throw new IllegalStateException("headers are only appended: delta " + delta + " vs size " + size);
            }
            files.write(path(), codec.serializeForStorage(header), (long) delta * RECORD_SIZE, true);
            updateSize();
        } finally {
            lock.unlock();
        }
        swapWithParent();
    }

    /** Starts a new chain with {@code header} as its first block, branching off this chain. */
    public Blockchain fork(BlockHeader header) {
        if (!canConnect(header, false)) {
            throw new ConsensusViolationException("forking header does not connect to parent chain");
        }
        int fp = header.height();
        if (fp <= checkpoints.floor()) {
            throw new ConsensusViolationException("cannot fork at or below the checkpoint floor: " + fp);
        }
        Blockchain child = new Blockchain(registry, fp, this, hasher.hash(header), getHash(fp - 1));
        files.assertAvailable(path());
        files.createEmpty(child.path());
        child.updateSize();
        registry.register(child);
        child.saveHeader(header);
        return child;
    }

    // ---------- swap ----------

    /** Swaps with the parent while this chain has more work, possibly several levels up. */
    public void swapWithParent() {
        registry.lock();
        try {
            int count = 0;
            while (true) {
                Blockchain oldParent = parent();
                if (!swapOnce()) {
                    break;
                }
                count++;
                if (count > registry.size()) {
                    throw new IllegalStateException("swapping fork with parent too many times: " + count);
                }
                // former siblings may now hang off this chain
                for (Blockchain sibling : registry.directChildren(oldParent)) {
                    if (checkHash(sibling.forkpoint() - 1, sibling.prevHash())) {
                        sibling.setParent(this);
                    }
                }
            }
        } finally {
            registry.unlock();
        }
    }

    private boolean swapOnce() {
        Blockchain p = parent();
        if (p == null) {
            return false;
        }
        if (p.getChainwork().compareTo(getChainwork()) >= 0) {
            return false;
        }
        lock.lock();
        p.lock.lock();
        try {
            LOG.info(() -> "swapping " + forkpoint + " " + p.forkpoint);
            int fp = forkpoint;
            if (fp <= p.forkpoint) {
                throw new IllegalStateException("forkpoint of parent chain (" + p.forkpoint
                        + ") should be at lower height than children's (" + fp + ")");
            }
            int parentBranchSize = p.forkpoint + p.size - 1 - fp + 1;
            Hash childOldId = firstHash;
            Hash parentOldId = p.firstHash;
            Path childOldPath = path();
            Path parentOldPath = p.path();
            files.assertAvailable(childOldPath);
            byte[] myData = files.readAll(childOldPath);
            files.assertAvailable(parentOldPath);
            long parentOffset = (long) (fp - p.forkpoint) * RECORD_SIZE;
            byte[] parentData = files.read(parentOldPath, parentOffset, Math.max(0, parentBranchSize) * RECORD_SIZE);
            if (parentData.length < RECORD_SIZE) {
                throw new IllegalStateException("parent has no headers past forkpoint " + fp);
            }
            files.write(childOldPath, parentData, 0, true);
            files.write(parentOldPath, myData, parentOffset, true);

            Blockchain grandParent = p.parent;
            this.parent = grandParent;
            p.parent = this;
            this.forkpoint = p.forkpoint;
            p.forkpoint = fp;
            this.firstHash = parentOldId;
            p.firstHash = hasher.hashRecord(Bytes.slice(parentData, 0, RECORD_SIZE), fp);
            Hash myPrev = this.prevHash;
            this.prevHash = p.prevHash;
            p.prevHash = myPrev;

            files.move(childOldPath, p.path());
            updateSize();
            p.updateSize();
            registry.rekey(childOldId, parentOldId, this, p);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "swap with parent failed", e);
            throw e;
        } finally {
            p.lock.unlock();
            lock.unlock();
        }
        SpvMetrics.incrementSwaps();
        return true;
    }

    @Override
    public String toString() {
        return "Blockchain{forkpoint=" + forkpoint() + ", height=" + height() + ", id=" + id() + "}";
    }
}
