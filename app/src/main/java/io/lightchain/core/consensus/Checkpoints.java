package io.lightchain.core.consensus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lightchain.core.protocol.Hash;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Trusted checkpoint tables.
 * <ul>
 *   <li>legacy: one (hash, target) per fixed 2016-block window, hash of the window's last block</li>
 *   <li>dgw: per retarget window starting at {@code dgwStart}, the (hash, target) of its first and last block</li>
 * </ul>
 */
public final class Checkpoints {
    public static final int RETARGET_INTERVAL = 2016;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record Checkpoint(Hash hash, BigInteger target) {}

    public record DgwWindow(Checkpoint first, Checkpoint last) {
        Checkpoint at(int position) {
            return position == 0 ? first : last;
        }
    }

    private final List<Checkpoint> legacy;
    private final int dgwStart;
    private final int dgwSpacing;
    private final List<DgwWindow> dgw;

    public Checkpoints(List<Checkpoint> legacy, int dgwStart, int dgwSpacing, List<DgwWindow> dgw) {
        if (dgwSpacing <= 1) {
            throw new IllegalArgumentException("dgwSpacing must be > 1");
        }
        this.legacy = List.copyOf(legacy);
        this.dgwStart = dgwStart;
        this.dgwSpacing = dgwSpacing;
        this.dgw = List.copyOf(dgw);
    }

    public static Checkpoints none() {
        return new Checkpoints(List.of(), 0, RETARGET_INTERVAL, List.of());
    }

    /** Loads {@code checkpoints/<network>.json} from the classpath; a missing resource yields empty tables. */
    public static Checkpoints loadResource(String network, int defaultDgwStart) {
        String resource = "/checkpoints/" + network + ".json";
        try (InputStream in = Checkpoints.class.getResourceAsStream(resource)) {
            if (in == null) {
                return new Checkpoints(List.of(), defaultDgwStart, RETARGET_INTERVAL, List.of());
            }
            return parse(MAPPER.readTree(in), defaultDgwStart);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    static Checkpoints parse(JsonNode root, int defaultDgwStart) {
        List<Checkpoint> legacy = new ArrayList<>();
        for (JsonNode n : root.path("legacy")) {
            legacy.add(checkpoint(n));
        }
        List<DgwWindow> dgw = new ArrayList<>();
        for (JsonNode n : root.path("dgw")) {
            dgw.add(new DgwWindow(checkpoint(n.get("first")), checkpoint(n.get("last"))));
        }
        int start = root.path("dgwStart").asInt(defaultDgwStart);
        int spacing = root.path("dgwSpacing").asInt(RETARGET_INTERVAL);
        return new Checkpoints(legacy, start, spacing, dgw);
    }

    private static Checkpoint checkpoint(JsonNode n) {
        if (n == null || !n.hasNonNull("hash") || !n.hasNonNull("target")) {
            throw new IllegalArgumentException("checkpoint entry needs hash and target: " + n);
        }
        return new Checkpoint(Hash.fromHex(n.get("hash").asText()), new BigInteger(n.get("target").asText()));
    }

    public List<Checkpoint> legacy() { return legacy; }
    public List<DgwWindow> dgw() { return dgw; }
    public int dgwStart() { return dgwStart; }
    public int dgwSpacing() { return dgwSpacing; }

    public Optional<Checkpoint> legacyWindow(int height) {
        int index = height / RETARGET_INTERVAL;
        if (height < 0 || index >= legacy.size()) {
            return Optional.empty();
        }
        return Optional.of(legacy.get(index));
    }

    /** Start height of the last DGW checkpoint window, or 0 without DGW checkpoints. */
    public int maxDgwCheckpoint() {
        return dgw.isEmpty() ? 0 : dgwStart + (dgw.size() - 1) * dgwSpacing;
    }

    /** End of the region whose headers are vouched for by checkpoints; forks at or below it are refused. */
    public int floor() {
        return dgw.isEmpty() ? 0 : maxDgwCheckpoint() + RETARGET_INTERVAL;
    }

    public boolean inDgwRegion(int height) {
        return !dgw.isEmpty() && height >= dgwStart && height <= floor();
    }

    /** Checkpoint for a DGW window boundary height (first or last block of a window), if the table covers it. */
    public Optional<Checkpoint> dgwCheckpoint(int height) {
        if (!inDgwRegion(height)) {
            return Optional.empty();
        }
        int mod = height % dgwSpacing;
        int position;
        if (mod == 0) {
            position = 0;
        } else if (mod == dgwSpacing - 1) {
            position = 1;
        } else {
            return Optional.empty();
        }
        int index = height / dgwSpacing - dgwStart / dgwSpacing;
        if (index < 0 || index >= dgw.size()) {
            return Optional.empty();
        }
        return Optional.of(dgw.get(index).at(position));
    }

    /** Hash closing the last DGW window; chain work is counted from here. */
    public Optional<Hash> lastDgwHash() {
        return dgw.isEmpty() ? Optional.empty() : Optional.of(dgw.get(dgw.size() - 1).last().hash());
    }
}
