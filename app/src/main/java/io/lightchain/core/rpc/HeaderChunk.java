package io.lightchain.core.rpc;

/** Concatenated raw headers as hex, how many there are and the server's per-request maximum. */
public record HeaderChunk(String hex, int count, int max) {
}
