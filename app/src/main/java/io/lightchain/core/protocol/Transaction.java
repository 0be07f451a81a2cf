package io.lightchain.core.protocol;

import java.util.List;

/**
 * Parsed transaction. Only the parts the SPV core inspects are kept: outputs (asset scripts)
 * and the bytes that define the txid.
 */
public record Transaction(long version, List<Input> inputs, List<Output> outputs, long lockTime,
                          boolean segwit, byte[] txidPreimage) {

    public record Input(Hash prevTxid, long prevIndex, byte[] scriptSig, long sequence) {}

    public record Output(long value, byte[] scriptPubKey) {}

    public Transaction {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        txidPreimage = txidPreimage.clone();
    }

    /** Wire-order hash of the witness-stripped serialization. */
    public Hash hash() {
        return new Hash(Hashes.sha256d(txidPreimage));
    }

    /** Display txid, as exchanged with servers. */
    public String txid() {
        return hash().hex();
    }
}
