package io.lightchain.core.protocol;

import java.util.List;

/** Server-supplied inclusion proof: sibling hashes (display hex), leaf position and the block height it claims. */
public record MerkleProof(List<String> branch, int position, int blockHeight) {
    public MerkleProof {
        branch = List.copyOf(branch);
    }
}
