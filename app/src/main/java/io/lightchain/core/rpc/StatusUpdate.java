package io.lightchain.core.rpc;

/** Status digest pushed for a subscribed scripthash or asset. {@code status} is null for "no history". */
public record StatusUpdate(String key, String status) {
}
