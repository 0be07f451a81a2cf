package io.lightchain.core.wallet;

/** One {@code (txid, height)} pair of an address history. Heights of 0 or less are mempool entries. */
public record HistoryEntry(String txHash, int height) {
}
