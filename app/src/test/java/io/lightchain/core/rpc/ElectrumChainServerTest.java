package io.lightchain.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.lightchain.core.protocol.MalformedDataException;
import io.lightchain.core.protocol.MerkleProof;
import io.lightchain.core.wallet.AssetMeta;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ElectrumChainServerTest {
    private static final String SCRIPTHASH = "5546fc69d399ef99854c132abb060381cc159dbec67c496a6f0e0dbf12e83ae8";
    private static final String TXID = "aa".repeat(32);

    private FakeElectrumServer fake;
    private JsonRpcSession session;

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.close();
        }
        if (fake != null) {
            fake.close();
        }
    }

    private ElectrumChainServer connect(long timeoutMillis) throws Exception {
        int port = freePort();
        fake = new FakeElectrumServer(port);
        session = new JsonRpcSession("127.0.0.1", port, false, timeoutMillis);
        session.connect();
        return new ElectrumChainServer(session);
    }

    @Test
    void callReturnsTheResultNode() throws Exception {
        connect(2_000L);
        fake.on("server.version", params -> List.of("fake 1.0", params.get(1).asText()));

        JsonNode result = session.call("server.version", "lightchain", "1.10");
        assertEquals("fake 1.0", result.get(0).asText());
        assertEquals("1.10", result.get(1).asText());
        assertTrue(session.isConnected());
    }

    @Test
    void serverErrorBecomesRpcException() throws Exception {
        ElectrumChainServer server = connect(2_000L);
        fake.on("blockchain.transaction.get",
                params -> new FakeElectrumServer.ErrorReply(2, "No such mempool or blockchain transaction"));

        RpcException e = assertThrows(RpcException.class, () -> server.getTransaction(TXID));
        assertEquals(2, e.code());
        assertFalse(e.isTimeout());
        assertTrue(e.getMessage().contains("No such mempool"));
    }

    @Test
    void unansweredRequestTimesOut() throws Exception {
        connect(200L);
        fake.ignore("blockchain.block.headers");

        RpcException e = assertThrows(RpcException.class, () -> session.call("blockchain.block.headers", 0, 1));
        assertTrue(e.isTimeout());
    }

    @Test
    void lostConnectionFailsPendingRequests() throws Exception {
        connect(5_000L);
        fake.ignore("blockchain.block.headers");

        var pending = session.request("blockchain.block.headers", 0, 1);
        Thread.sleep(100);
        fake.dropClient();

        Exception e = assertThrows(Exception.class, () -> pending.get(5, TimeUnit.SECONDS));
        RpcException cause = assertInstanceOf(RpcException.class, e.getCause());
        assertEquals(RpcException.DISCONNECTED, cause.code());
    }

    @Test
    void connectingToAClosedPortFails() throws Exception {
        JsonRpcSession closed = new JsonRpcSession("127.0.0.1", freePort(), false, 1_000L);
        try {
            RpcException e = assertThrows(RpcException.class, closed::connect);
            assertEquals(RpcException.DISCONNECTED, e.code());
            assertFalse(closed.isConnected());
        } finally {
            closed.close();
        }
    }

    @Test
    void subscriptionDeliversInitialAndPushedStatus() throws Exception {
        ElectrumChainServer server = connect(2_000L);
        fake.on("blockchain.scripthash.subscribe", params -> "01".repeat(32));

        BlockingQueue<StatusUpdate> updates = new LinkedBlockingQueue<>();
        server.subscribeScripthash(SCRIPTHASH, updates);
        assertEquals(new StatusUpdate(SCRIPTHASH, "01".repeat(32)), updates.poll(5, TimeUnit.SECONDS));

        fake.notifyClient("blockchain.scripthash.subscribe", SCRIPTHASH, "02".repeat(32));
        assertEquals(new StatusUpdate(SCRIPTHASH, "02".repeat(32)), updates.poll(5, TimeUnit.SECONDS));

        fake.notifyClient("blockchain.scripthash.subscribe", SCRIPTHASH, null);
        assertEquals(new StatusUpdate(SCRIPTHASH, null), updates.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void historyAndMerkleAreParsed() throws Exception {
        ElectrumChainServer server = connect(2_000L);
        fake.on("blockchain.scripthash.get_history", params -> List.of(
                Map.of("tx_hash", TXID, "height", 120),
                Map.of("tx_hash", "bb".repeat(32), "height", 0, "fee", 226)));
        fake.on("blockchain.transaction.get_merkle", params -> Map.of(
                "block_height", 120, "pos", 3, "merkle", List.of("cc".repeat(32), "dd".repeat(32))));

        assertEquals(List.of(new HistoryItem(TXID, 120, null), new HistoryItem("bb".repeat(32), 0, 226L)),
                server.getHistory(SCRIPTHASH));
        assertEquals(new MerkleProof(List.of("cc".repeat(32), "dd".repeat(32)), 3, 120),
                server.getMerkle(TXID, 120));
    }

    @Test
    void headersAndAssetMetaAreParsed() throws Exception {
        ElectrumChainServer server = connect(2_000L);
        fake.on("blockchain.block.headers", params -> Map.of("hex", "00".repeat(80), "count", 1, "max", 2016));
        Map<String, Object> meta = new HashMap<>();
        meta.put("sats_in_circulation", 100_000_000_000L);
        meta.put("divisions", 2);
        meta.put("reissuable", true);
        meta.put("has_ipfs", false);
        meta.put("source", Map.of("tx_hash", TXID, "tx_pos", 1, "height", 500));
        meta.put("source_divisions", Map.of("tx_hash", "ee".repeat(32), "tx_pos", 0, "height", 700));
        fake.on("blockchain.asset.get_meta", params -> "LIGHT".equals(params.get(0).asText()) ? meta : false);

        assertEquals(new HeaderChunk("00".repeat(80), 1, 2016), server.getHeaders(0, 1));

        AssetMeta parsed = server.getAssetMeta("LIGHT").orElseThrow();
        assertEquals(100_000_000_000L, parsed.circulation());
        assertEquals(2, parsed.divisions());
        assertEquals(TXID, parsed.source().outpoint().txid());
        assertEquals(1, parsed.source().outpoint().index());
        assertEquals(700, parsed.divisionSource().height());
        assertNull(parsed.ipfsSource());
        assertFalse(parsed.owner());
        assertTrue(server.getAssetMeta("OTHER").isEmpty());
    }

    @Test
    void missingFieldIsMalformed() throws Exception {
        ElectrumChainServer server = connect(2_000L);
        fake.on("blockchain.transaction.get_merkle", params -> Map.of("pos", 0, "merkle", List.of()));
        fake.on("blockchain.transaction.get", params -> Arrays.asList(1, 2));

        assertThrows(MalformedDataException.class, () -> server.getMerkle(TXID, 5));
        assertThrows(MalformedDataException.class, () -> server.getTransaction(TXID));
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
