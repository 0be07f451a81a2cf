package io.lightchain.core.rpc;

/** One row of {@code blockchain.scripthash.get_history}. {@code fee} is only sent for mempool entries. */
public record HistoryItem(String txHash, int height, Long fee) {
}
