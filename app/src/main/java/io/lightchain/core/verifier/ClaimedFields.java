package io.lightchain.core.verifier;

import java.util.Objects;

/** The metadata fields a cited output must reproduce. Null fields are not checked. */
final class ClaimedFields {
    private final Long circulation;
    private final Integer divisions;
    private final Boolean reissuable;
    private final Boolean hasIpfs;
    private final boolean checkIpfs;
    private final String ipfs;

    private ClaimedFields(Long circulation, Integer divisions, Boolean reissuable, Boolean hasIpfs,
                          boolean checkIpfs, String ipfs) {
        this.circulation = circulation;
        this.divisions = divisions;
        this.reissuable = reissuable;
        this.hasIpfs = hasIpfs;
        this.checkIpfs = checkIpfs;
        this.ipfs = ipfs;
    }

    static ClaimedFields base(long circulation, int divisions, boolean reissuable, boolean hasIpfs, String ipfs) {
        return new ClaimedFields(circulation, divisions, reissuable, hasIpfs, hasIpfs, ipfs);
    }

    static ClaimedFields divisionsOnly(int divisions) {
        return new ClaimedFields(null, divisions, null, null, false, null);
    }

    static ClaimedFields ipfsOnly(String ipfs) {
        return new ClaimedFields(null, null, null, null, true, ipfs);
    }

    /** A reissue only adds supply, so its amount may be below the claimed circulation. */
    void check(AssetScripts.ParsedAsset parsed) {
        if (circulation != null) {
            if (parsed.type() == 'r') {
                if (parsed.circulation() > circulation) {
                    throw new AssetVerificationException("Reissued amount is greater than the total amount: "
                            + circulation + ", " + parsed.name());
                }
            } else if (parsed.circulation() != circulation) {
                throw mismatch(circulation, parsed.circulation());
            }
        }
        if (divisions != null && parsed.divisions() != divisions) {
            throw mismatch(divisions, parsed.divisions());
        }
        if (reissuable != null && parsed.reissuable() != reissuable) {
            throw mismatch(reissuable, parsed.reissuable());
        }
        if (hasIpfs != null && parsed.hasIpfs() != hasIpfs) {
            throw mismatch(hasIpfs, parsed.hasIpfs());
        }
        if (checkIpfs && !Objects.equals(ipfs, parsed.ipfs())) {
            throw mismatch(ipfs, parsed.ipfs());
        }
    }

    private static AssetVerificationException mismatch(Object claimed, Object found) {
        return new AssetVerificationException("Metadata mismatch: " + claimed + " vs " + found);
    }
}
