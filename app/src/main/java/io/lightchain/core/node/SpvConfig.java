package io.lightchain.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Settings of one light client. */
public final class SpvConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public final String network;
    public final Path dataDir;
    public final String serverHost;
    public final int serverPort;
    public final boolean tls;
    public final int maxConcurrentRequests;
    public final long networkTimeoutMillis;
    public final long scanIntervalMillis;
    public final boolean skipMerkleCheck;

    public SpvConfig(String network, Path dataDir, String serverHost, int serverPort, boolean tls,
                     int maxConcurrentRequests, long networkTimeoutMillis, long scanIntervalMillis,
                     boolean skipMerkleCheck) {
        if (maxConcurrentRequests <= 0) {
            throw new IllegalArgumentException("maxConcurrentRequests must be positive");
        }
        this.network = network;
        this.dataDir = dataDir;
        this.serverHost = serverHost;
        this.serverPort = serverPort;
        this.tls = tls;
        this.maxConcurrentRequests = maxConcurrentRequests;
        this.networkTimeoutMillis = networkTimeoutMillis;
        this.scanIntervalMillis = scanIntervalMillis;
        this.skipMerkleCheck = skipMerkleCheck;
    }

    public static SpvConfig defaultLocal() {
        return new SpvConfig(
                "mainnet",
                Path.of("./data/lightchain"),
                "127.0.0.1",
                50001,
                false,
                100,        // shared request slots per server
                30_000L,    // network timeout, also the stale-status grace period
                100L,       // job scan interval
                false
        );
    }

    public SpvConfig withNetwork(String network) {
        return new SpvConfig(network, dataDir, serverHost, serverPort, tls,
                maxConcurrentRequests, networkTimeoutMillis, scanIntervalMillis, skipMerkleCheck);
    }

    public SpvConfig withDataDir(Path dataDir) {
        return new SpvConfig(network, dataDir, serverHost, serverPort, tls,
                maxConcurrentRequests, networkTimeoutMillis, scanIntervalMillis, skipMerkleCheck);
    }

    public SpvConfig withServer(String host, int port, boolean tls) {
        return new SpvConfig(network, dataDir, host, port, tls,
                maxConcurrentRequests, networkTimeoutMillis, scanIntervalMillis, skipMerkleCheck);
    }

    public SpvConfig withTimeouts(long networkTimeoutMillis, long scanIntervalMillis) {
        return new SpvConfig(network, dataDir, serverHost, serverPort, tls,
                maxConcurrentRequests, networkTimeoutMillis, scanIntervalMillis, skipMerkleCheck);
    }

    public SpvConfig withMaxConcurrentRequests(int maxConcurrentRequests) {
        return new SpvConfig(network, dataDir, serverHost, serverPort, tls,
                maxConcurrentRequests, networkTimeoutMillis, scanIntervalMillis, skipMerkleCheck);
    }

    public SpvConfig withSkipMerkleCheck(boolean skipMerkleCheck) {
        return new SpvConfig(network, dataDir, serverHost, serverPort, tls,
                maxConcurrentRequests, networkTimeoutMillis, scanIntervalMillis, skipMerkleCheck);
    }

    /** Reads a JSON object on top of {@link #defaultLocal()}; absent keys keep their default. */
    public static SpvConfig load(Path path) {
        JsonNode root;
        try {
            root = JSON.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config from " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config " + path + " is not a JSON object");
        }
        SpvConfig d = defaultLocal();
        return new SpvConfig(
                root.path("network").asText(d.network),
                root.hasNonNull("dataDir") ? Path.of(root.get("dataDir").asText()) : d.dataDir,
                root.path("serverHost").asText(d.serverHost),
                root.path("serverPort").asInt(d.serverPort),
                root.path("tls").asBoolean(d.tls),
                root.path("maxConcurrentRequests").asInt(d.maxConcurrentRequests),
                root.path("networkTimeoutMillis").asLong(d.networkTimeoutMillis),
                root.path("scanIntervalMillis").asLong(d.scanIntervalMillis),
                root.path("skipMerkleCheck").asBoolean(d.skipMerkleCheck)
        );
    }

    @Override
    public String toString() {
        return "SpvConfig{" + network + ", " + serverHost + ":" + serverPort + (tls ? " tls" : "") + ", " + dataDir + "}";
    }
}
