package io.lightchain.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class SpvMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter requestsSent = registry.counter("rpc.requests.sent");
    private static final Counter requestsAnswered = registry.counter("rpc.requests.answered");
    private static final Counter proofsVerified = registry.counter("proofs.verified");
    private static final Counter proofsRejected = registry.counter("proofs.rejected");
    private static final Counter chunksConnected = registry.counter("chunks.connected");
    private static final Counter chunksRejected = registry.counter("chunks.rejected");
    private static final Counter chainSwaps = registry.counter("chain.swaps");
    private static final Timer chunkVerificationTime = registry.timer("chunk.verification.time");

    public static <T> T recordChunkVerification(Supplier<T> verification) {
        return chunkVerificationTime.record(verification);
    }

    public static void incrementRequestsSent() { requestsSent.increment(); }
    public static void incrementRequestsAnswered() { requestsAnswered.increment(); }
    public static void incrementProofsVerified() { proofsVerified.increment(); }
    public static void incrementProofsRejected() { proofsRejected.increment(); }
    public static void incrementChunksConnected() { chunksConnected.increment(); }
    public static void incrementChunksRejected() { chunksRejected.increment(); }
    public static void incrementSwaps() { chainSwaps.increment(); }

    public static double chainSwaps() {
        return chainSwaps.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
