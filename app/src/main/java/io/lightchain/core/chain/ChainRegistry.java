package io.lightchain.core.chain;

import io.lightchain.core.consensus.ConsensusRules;
import io.lightchain.core.consensus.HeaderHasher;
import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.consensus.ConsensusViolationException;
import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.BlockHeaderCodec;
import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.Hash;
import io.lightchain.core.protocol.MalformedDataException;
import io.lightchain.core.storage.HeaderFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Owns every known chain, keyed by the hash at its forkpoint. The best chain is always the one keyed by genesis.
 */
public final class ChainRegistry {
    private static final Logger LOG = Logger.getLogger(ChainRegistry.class.getName());

    private final NetworkParameters params;
    private final ConsensusRules rules;
    private final HeaderFile files;
    private final ChainWorkCache workCache;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Hash, Blockchain> chains = new LinkedHashMap<>();

    public ChainRegistry(NetworkParameters params, Path dataDir) {
        this.params = params;
        this.rules = new ConsensusRules(params);
        this.files = new HeaderFile(dataDir.resolve("headers"));
        this.workCache = new ChainWorkCache(params.checkpoints());
    }

    /** Registry with the best chain file preallocated and all valid fork files loaded. */
    public static ChainRegistry open(NetworkParameters params, Path dataDir) {
        ChainRegistry registry = new ChainRegistry(params, dataDir);
        registry.readBlockchains();
        registry.initHeadersFileForBestChain();
        return registry;
    }

    public NetworkParameters params() { return params; }
    ConsensusRules rules() { return rules; }
    HeaderFile files() { return files; }
    ChainWorkCache workCache() { return workCache; }

    public HeaderHasher hasher() {
        return rules.hasher();
    }

    void lock() { lock.lock(); }
    void unlock() { lock.unlock(); }

    public int size() {
        lock.lock();
        try {
            return chains.size();
        } finally {
            lock.unlock();
        }
    }

    public List<Blockchain> chains() {
        lock.lock();
        try {
            return new ArrayList<>(chains.values());
        } finally {
            lock.unlock();
        }
    }

    public Blockchain bestChain() {
        lock.lock();
        try {
            Blockchain best = chains.get(params.genesisHash());
            if (best == null) {
                throw new IllegalStateException("best chain not loaded");
            }
            return best;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Blockchain> get(Hash id) {
        lock.lock();
        try {
            return Optional.ofNullable(chains.get(id));
        } finally {
            lock.unlock();
        }
    }

    void register(Blockchain chain) {
        lock.lock();
        try {
            chains.put(chain.id(), chain);
        } finally {
            lock.unlock();
        }
    }

    void rekey(Hash childOldId, Hash parentOldId, Blockchain child, Blockchain parent) {
        lock.lock();
        try {
            chains.remove(childOldId);
            chains.remove(parentOldId);
            chains.put(child.id(), child);
            chains.put(parent.id(), parent);
        } finally {
            lock.unlock();
        }
    }

    List<Blockchain> directChildren(Blockchain parent) {
        lock.lock();
        try {
            List<Blockchain> out = new ArrayList<>();
            for (Blockchain c : chains.values()) {
                if (c.parent() == parent) {
                    out.add(c);
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** Loads the best chain and every fork file that still validates; invalid files are deleted. */
    public void readBlockchains() {
        files.ensureDirectories();
        lock.lock();
        try {
            chains.clear();
            Blockchain best = new Blockchain(this, 0, null, params.genesisHash(), null);
            chains.put(params.genesisHash(), best);
            int maxCheckpoint = params.checkpoints().maxDgwCheckpoint();
            if (best.height() > maxCheckpoint) {
                BlockHeader afterCheckpoint = best.readHeader(maxCheckpoint + 1);
                if (afterCheckpoint == null || !best.canConnect(afterCheckpoint, false)) {
                    LOG.info("[blockchain] deleting best chain. cannot connect header after last cp to last cp.");
                    files.delete(best.path());
                    best.updateSize();
                }
            }

            List<String> names = files.listForkFiles();
            names.sort(Comparator.comparingInt(ChainRegistry::forkpointOf));
            for (String name : names) {
                instantiateFork(name);
            }
        } finally {
            lock.unlock();
        }
    }

    private static int forkpointOf(String fileName) {
        try {
            return Integer.parseInt(fileName.split("_")[1]);
        } catch (RuntimeException e) {
            return Integer.MAX_VALUE;
        }
    }

    private void instantiateFork(String fileName) {
        String[] parts = fileName.split("_");
        if (parts.length != 4) {
            deleteFork(fileName, "unrecognised fork file name");
            return;
        }
        int forkpoint;
        Hash prevHash;
        Hash firstHash;
        try {
            forkpoint = Integer.parseInt(parts[1]);
            prevHash = Hash.fromHex(leftPad(parts[2]));
            firstHash = Hash.fromHex(leftPad(parts[3]));
        } catch (NumberFormatException | MalformedDataException e) {
            deleteFork(fileName, "unparseable fork file name");
            return;
        }
        if (forkpoint <= params.checkpoints().floor()) {
            deleteFork(fileName, "deleting fork below max checkpoint");
            return;
        }
        Blockchain parent = null;
        for (Blockchain candidate : chains.values()) {
            if (candidate.checkHash(forkpoint - 1, prevHash)) {
                parent = candidate;
                break;
            }
        }
        if (parent == null) {
            deleteFork(fileName, "cannot find parent for chain");
            return;
        }
        Blockchain chain = new Blockchain(this, forkpoint, parent, firstHash, prevHash);
        BlockHeader first = chain.readHeader(forkpoint);
        if (first == null || !firstHash.equals(hasher().hash(first))) {
            deleteFork(fileName, "incorrect first hash for chain");
            return;
        }
        if (!parent.canConnect(first, false)) {
            deleteFork(fileName, "cannot connect chain to parent");
            return;
        }
        chains.put(chain.id(), chain);
    }

    private static String leftPad(String hex) {
        return "0".repeat(Math.max(0, 64 - hex.length())) + hex;
    }

    private void deleteFork(String fileName, String reason) {
        LOG.info(() -> "[blockchain] deleting chain " + fileName + ": " + reason);
        files.delete(files.forksDir().resolve(fileName));
    }

    /** Grows the best chain file (sparse) so every checkpointed height has a slot. */
    public void initHeadersFileForBestChain() {
        Blockchain best = bestChain();
        long length = (long) HeaderFile.RECORD_SIZE * params.checkpoints().maxDgwCheckpoint();
        files.preallocate(best.path(), length);
        best.updateSize();
    }

    /** Any chain that contains {@code header} at its height. */
    public Optional<Blockchain> checkHeader(BlockHeader header) {
        for (Blockchain b : chains()) {
            if (b.checkHeader(header)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    /** The chain whose tip {@code header} directly extends. */
    public Optional<Blockchain> canConnect(BlockHeader header) {
        for (Blockchain b : chains()) {
            if (b.canConnect(header, true)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    /** Chains containing the given block, most work first. */
    public List<Blockchain> chainsContainingHeader(int height, Hash hash) {
        List<Blockchain> out = new ArrayList<>();
        for (Blockchain b : chains()) {
            if (b.checkHash(height, hash)) {
                out.add(b);
            }
        }
        out.sort(Comparator.comparing((Blockchain c) -> c.getChainwork()).reversed());
        return out;
    }

    /**
     * Files a single header: known headers are ignored, headers extending a tip are appended and headers
     * branching below a tip start a fork. Empty when the header links to nothing known.
     */
    public Optional<Blockchain> acceptHeader(BlockHeader header) {
        Optional<Blockchain> known = checkHeader(header);
        if (known.isPresent()) {
            return known;
        }
        Optional<Blockchain> extendable = canConnect(header);
        if (extendable.isPresent()) {
            extendable.get().saveHeader(header);
            return checkHeader(header);
        }
        for (Blockchain b : chainsContainingHeader(header.height() - 1, header.prevHash())) {
            if (b.height() >= header.height()) {
                return Optional.of(b.fork(header));
            }
        }
        return Optional.empty();
    }

    /**
     * Files the wire headers of a chunk one at a time, forking where needed. Stops at the first header
     * that links to nothing known or is refused; returns how many were filed.
     */
    public int acceptHeaders(int startHeight, byte[] data) {
        int activationHeight = params.kawpowActivationHeight();
        int height = startHeight;
        int p = 0;
        int accepted = 0;
        while (p < data.length) {
            int size = BlockHeaderCodec.wireSize(height, activationHeight);
            if (p + size > data.length) {
                LOG.info(() -> "[blockchain] trailing partial header in chunk from " + startHeight);
                break;
            }
            BlockHeader header;
            Optional<Blockchain> filed;
            try {
                header = params.codec().deserialize(Bytes.slice(data, p, p + size), height);
                filed = acceptHeader(header);
            } catch (MalformedDataException | ConsensusViolationException e) {
                int h = height;
                LOG.info(() -> "[blockchain] header " + h + " refused: " + e.getMessage());
                break;
            }
            if (filed.isEmpty()) {
                break;
            }
            accepted++;
            p += size;
            height++;
        }
        return accepted;
    }
}
