package io.lightchain.core.chain;

import io.lightchain.core.consensus.HeaderHasher;
import io.lightchain.core.consensus.NetworkParameters;
import io.lightchain.core.consensus.ProofOfWork;
import io.lightchain.core.metrics.SpvMetrics;
import io.lightchain.core.protocol.BlockHeader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ChainRegistryTest {

    private static HeaderChainBuilder chain;
    private static NetworkParameters params;

    @TempDir
    Path dataDir;

    @BeforeAll
    static void mine() {
        chain = HeaderChainBuilder.mainChain(105);
        params = chain.params();
    }

    private ChainRegistry openWithMainChain() {
        ChainRegistry registry = ChainRegistry.open(params, dataDir);
        assertTrue(registry.bestChain().connectChunk(0, chain.wire(chain.headers())));
        return registry;
    }

    @Test
    void emptyBestChainHasNoHeaders() {
        ChainRegistry registry = ChainRegistry.open(params, dataDir);
        assertEquals(-1, registry.bestChain().height());
        assertNull(registry.bestChain().readHeader(0));
        assertEquals(1, registry.size());
    }

    @Test
    void connectsChunkFromGenesis() {
        ChainRegistry registry = openWithMainChain();
        Blockchain best = registry.bestChain();

        assertEquals(104, best.height());
        assertEquals(chain.hash(chain.header(57)), best.getHash(57));
        assertEquals(chain.header(104), best.headerAtTip());
        assertEquals(BigInteger.valueOf(2L * 105), best.getChainwork());
        assertEquals(BigInteger.valueOf(2L * 11), best.getChainwork(10));
    }

    @Test
    void rejectsChunkThatDoesNotLink() {
        ChainRegistry registry = ChainRegistry.open(params, dataDir);
        List<BlockHeader> headers = new ArrayList<>(chain.range(0, 20));
        headers.set(10, chain.fork(8, 2, 7).get(1));

        assertFalse(registry.bestChain().connectChunk(0, chain.wire(headers)));
        assertEquals(-1, registry.bestChain().height());
    }

    @Test
    void rejectsHeaderWithoutWork() {
        ChainRegistry registry = ChainRegistry.open(params, dataDir);
        List<BlockHeader> headers = new ArrayList<>(chain.range(0, 5));
        HeaderHasher hasher = new HeaderHasher(params);
        BlockHeader weak = headers.get(4);
        while (ProofOfWork.meetsTarget(hasher.powHash(weak), HeaderChainBuilder.EASY_TARGET)) {
            weak = weak.withNonce(weak.nonce() + 1);
        }
        headers.set(4, weak);

        assertFalse(registry.bestChain().connectChunk(0, chain.wire(headers)));
        assertEquals(-1, registry.bestChain().height());
    }

    @Test
    void appendsSingleHeadersAtTip() {
        ChainRegistry registry = ChainRegistry.open(params, dataDir);
        assertTrue(registry.bestChain().connectChunk(0, chain.wire(chain.range(0, 50))));

        BlockHeader next = chain.header(50);
        assertTrue(registry.bestChain().canConnect(next, true));
        assertFalse(registry.bestChain().canConnect(chain.header(51), true));

        assertTrue(registry.acceptHeader(next).isPresent());
        assertEquals(50, registry.bestChain().height());
    }

    @Test
    void siblingForksSwapOnceWhenOneOvertakesTheMainChain() {
        ChainRegistry registry = openWithMainChain();
        Blockchain original = registry.bestChain();

        List<BlockHeader> forkA = chain.fork(90, 10, 1);
        assertEquals(10, registry.acceptHeaders(91, chain.wire(forkA)));

        List<BlockHeader> forkB = chain.fork(90, 15, 2);
        double swapsBefore = SpvMetrics.chainSwaps();
        assertEquals(14, registry.acceptHeaders(91, chain.wire(forkB.subList(0, 14))));
        assertEquals(3, registry.size());
        // equal work does not swap
        assertSame(original, registry.bestChain());
        assertEquals(chain.hash(chain.header(104)), registry.bestChain().getHash(104));

        Blockchain chainB = registry.checkHeader(forkB.get(13)).orElseThrow();
        assertEquals(91, chainB.forkpoint());
        assertTrue(registry.acceptHeader(forkB.get(14)).isPresent());

        assertEquals(swapsBefore + 1, SpvMetrics.chainSwaps());
        Blockchain best = registry.bestChain();
        assertSame(chainB, best);
        assertEquals(105, best.height());
        assertEquals(chain.hash(forkB.get(14)), best.getHash(105));
        assertEquals(chain.hash(chain.header(90)), best.getHash(90));
        assertEquals(3, registry.size());

        // the old main branch and fork A both hang off the new best chain at 91
        for (Blockchain c : registry.chains()) {
            if (c != best) {
                assertSame(best, c.parent());
                assertEquals(91, c.forkpoint());
            }
        }
        assertEquals(104, original.height());
        assertEquals(chain.hash(chain.header(104)), original.getHash(104));
        assertEquals(90, best.lastCommonBlockHeight(original));
    }

    @Test
    void forkFilesSurviveReopen() throws Exception {
        ChainRegistry registry = openWithMainChain();
        List<BlockHeader> fork = chain.fork(90, 10, 1);
        assertEquals(10, registry.acceptHeaders(91, chain.wire(fork)));

        try (Stream<Path> files = Files.list(dataDir.resolve("headers").resolve("forks"))) {
            assertEquals(1, files.count());
        }

        ChainRegistry reopened = ChainRegistry.open(params, dataDir);
        assertEquals(2, reopened.size());
        Blockchain reloaded = reopened.checkHeader(fork.get(9)).orElseThrow();
        assertEquals(91, reloaded.forkpoint());
        assertEquals(100, reloaded.height());
        assertSame(reopened.bestChain(), reloaded.parent());
        assertEquals(chain.hash(fork.get(0)), reloaded.id());
    }

    @Test
    void unparseableForkFilesAreDeleted() throws Exception {
        openWithMainChain();
        Path forks = dataDir.resolve("headers").resolve("forks");
        Path junk = forks.resolve("fork2_notanumber_ab_cd");
        Files.write(junk, new byte[120]);
        Path orphan = forks.resolve("fork2_95_1_ab");
        Files.write(orphan, new byte[120]);

        ChainRegistry reopened = ChainRegistry.open(params, dataDir);
        assertEquals(1, reopened.size());
        assertFalse(Files.exists(junk));
        assertFalse(Files.exists(orphan));
    }

    @Test
    void headersLinkingToNothingAreNotFiled() {
        ChainRegistry registry = openWithMainChain();
        List<BlockHeader> orphans = chain.fork(90, 3, 9).subList(1, 3);
        assertEquals(0, registry.acceptHeaders(92, chain.wire(orphans)));
        assertEquals(1, registry.size());
    }

    @Test
    void chainsContainingHeaderPutMostWorkFirst() {
        ChainRegistry registry = openWithMainChain();
        List<BlockHeader> fork = chain.fork(90, 5, 3);
        registry.acceptHeaders(91, chain.wire(fork));

        List<Blockchain> holding = registry.chainsContainingHeader(90, chain.hash(chain.header(90)));
        assertEquals(2, holding.size());
        assertSame(registry.bestChain(), holding.get(0));
        assertEquals(1, registry.chainsContainingHeader(95, chain.hash(fork.get(4))).size());
    }
}
