package io.lightchain.core.wallet;

/** A transaction output coordinate, {@code txid:index}. */
public record TxOutpoint(String txid, int index) {
    public TxOutpoint {
        if (txid == null || txid.isEmpty()) {
            throw new IllegalArgumentException("txid required");
        }
        if (index < 0) {
            throw new IllegalArgumentException("negative output index: " + index);
        }
    }

    public static TxOutpoint parse(String s) {
        int colon = s.lastIndexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("not an outpoint: " + s);
        }
        return new TxOutpoint(s.substring(0, colon), Integer.parseInt(s.substring(colon + 1)));
    }

    @Override
    public String toString() {
        return txid + ":" + index;
    }
}
