package io.lightchain.core.chain;

import io.lightchain.core.consensus.Checkpoints;
import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.MalformedDataException;
import io.lightchain.core.rpc.ChainServer;
import io.lightchain.core.rpc.HeaderChunk;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/** Pulls retarget-sized header chunks from the server into the registry. */
public final class ChunkFetcher {
    private static final Logger LOG = Logger.getLogger(ChunkFetcher.class.getName());

    public static final int CHUNK_SIZE = Checkpoints.RETARGET_INTERVAL;

    private final ChainRegistry registry;
    private final Set<Integer> inFlight = ConcurrentHashMap.newKeySet();

    public ChunkFetcher(ChainRegistry registry) {
        this.registry = registry;
    }

    /**
     * Fetches the aligned chunk covering {@code height} and connects it to the best chain. Returns the number
     * of headers connected; 0 when the chunk was refused or the same chunk is already being fetched.
     */
    public int requestChunk(ChainServer server, int height) throws InterruptedException {
        int index = height / CHUNK_SIZE;
        if (!inFlight.add(index)) {
            return 0;
        }
        try {
            int start = index * CHUNK_SIZE;
            LOG.fine(() -> "requesting chunk " + index + " from height " + start);
            HeaderChunk chunk = server.getHeaders(start, CHUNK_SIZE);
            if (chunk.count() == 0) {
                return 0;
            }
            return registry.bestChain().connectChunk(start, chunk.hex()) ? chunk.count() : 0;
        } finally {
            inFlight.remove(index);
        }
    }

    /**
     * Follows the server from the local tip until it answers with a short chunk. When the server's next
     * headers do not extend the best chain, walks back to the last header both sides hold and files the
     * server's branch from there, so a competing branch becomes a fork. Returns the number of headers taken.
     */
    public int catchUp(ChainServer server) throws InterruptedException {
        int total = 0;
        while (true) {
            Blockchain best = registry.bestChain();
            int start = best.height() + 1;
            HeaderChunk chunk = server.getHeaders(start, CHUNK_SIZE);
            if (chunk.count() == 0) {
                break;
            }
            if (best.connectChunk(start, chunk.hex())) {
                total += chunk.count();
                if (chunk.count() < CHUNK_SIZE) {
                    break;
                }
                continue;
            }
            int known = lastSharedHeight(server, start - 1);
            if (known < 0) {
                LOG.info(() -> "server chain shares nothing with ours above the checkpoints, from " + start);
                break;
            }
            HeaderChunk branch = server.getHeaders(known + 1, CHUNK_SIZE);
            registry.acceptHeaders(known + 1, Bytes.fromHex(branch.hex()));
            int tip = registry.bestChain().height();
            if (tip < start) {
                // the branch did not overtake us; nothing more to follow until it grows
                break;
            }
            total += tip - start + 1;
        }
        int caught = total;
        LOG.info(() -> "header catch-up took " + caught + " headers, best height " + registry.bestChain().height());
        return total;
    }

    /**
     * Height of the highest server header at or below {@code height} that some local chain holds, probing
     * backwards in doubling steps; -1 when none is found above the checkpoint floor.
     */
    int lastSharedHeight(ChainServer server, int height) throws InterruptedException {
        int floor = registry.params().checkpoints().floor();
        int h = height;
        int step = 1;
        while (h >= floor && h >= 0) {
            HeaderChunk one = server.getHeaders(h, 1);
            if (one.count() == 0) {
                return -1;
            }
            BlockHeader header;
            try {
                header = registry.params().codec().deserialize(Bytes.fromHex(one.hex()), h);
            } catch (MalformedDataException e) {
                LOG.info(() -> "bad header from server: " + e.getMessage());
                return -1;
            }
            if (registry.checkHeader(header).isPresent()) {
                return h;
            }
            if (h == floor || h == 0) {
                return -1;
            }
            h = Math.max(Math.max(floor, 0), h - step);
            step *= 2;
        }
        return -1;
    }
}
