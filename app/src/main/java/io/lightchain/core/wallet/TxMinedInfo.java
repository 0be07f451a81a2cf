package io.lightchain.core.wallet;

import io.lightchain.core.protocol.Hash;

/** Where a verified transaction sits: block height, block time, position in the block and block hash. */
public record TxMinedInfo(int height, long timestamp, int txpos, Hash headerHash) {
}
