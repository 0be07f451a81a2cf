package io.lightchain.core.wallet;

import io.lightchain.core.protocol.Hash;

/**
 * Metadata of one asset as the server reported it. Every field set traces back to the transaction
 * that last wrote it: {@code source} for the base record, with divisions and the ipfs pointer
 * optionally set by later reissues.
 */
public record AssetMeta(String name,
                        long circulation,
                        boolean owner,
                        boolean reissuable,
                        int divisions,
                        boolean hasIpfs,
                        String ipfs,
                        Provenance source,
                        Provenance divisionSource,
                        Provenance ipfsSource) {

    /**
     * Output that set a field, the height it was mined at and, once verified, the hash of that block.
     */
    public record Provenance(TxOutpoint outpoint, int height, Hash blockHash) {
        public Provenance withBlockHash(Hash hash) {
            return new Provenance(outpoint, height, hash);
        }
    }

    public AssetMeta {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("asset name required");
        }
        if (source == null) {
            throw new IllegalArgumentException("source required for " + name);
        }
    }

    public static AssetMeta of(String name, long circulation, boolean reissuable, int divisions,
                               boolean hasIpfs, String ipfs, Provenance source,
                               Provenance divisionSource, Provenance ipfsSource) {
        return new AssetMeta(name, circulation, name.endsWith("!"), reissuable, divisions, hasIpfs, ipfs,
                source, divisionSource, ipfsSource);
    }

    public AssetMeta withSources(Provenance source, Provenance divisionSource, Provenance ipfsSource) {
        return new AssetMeta(name, circulation, owner, reissuable, divisions, hasIpfs, ipfs,
                source, divisionSource, ipfsSource);
    }

    /** True when any field was set by a block above {@code height}. */
    public boolean hasSourceAbove(int height) {
        return source.height() > height
                || (divisionSource != null && divisionSource.height() > height)
                || (ipfsSource != null && ipfsSource.height() > height);
    }
}
