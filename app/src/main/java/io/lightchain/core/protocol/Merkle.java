package io.lightchain.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Bitcoin-style Merkle tree over transaction hashes (wire order).
 * - Inner node = sha256d(left || right).
 * - If a level has an odd count, the last node is paired with itself.
 */
public final class Merkle {
    private Merkle(){}

    public static Hash rootOf(List<Hash> leaves) {
        if (leaves == null || leaves.isEmpty()) return Hash.ZERO;
        List<Hash> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            level = nextLevel(level);
        }
        return level.get(0);
    }

    /** Sibling hashes from the leaf at {@code index} up to (excluding) the root. */
    public static List<Hash> branchFor(List<Hash> leaves, int index) {
        if (leaves == null || index < 0 || index >= leaves.size()) {
            throw new IllegalArgumentException("index out of range: " + index);
        }
        List<Hash> branch = new ArrayList<>();
        List<Hash> level = new ArrayList<>(leaves);
        int i = index;
        while (level.size() > 1) {
            int sibling = (i ^ 1) < level.size() ? (i ^ 1) : i;
            branch.add(level.get(sibling));
            level = nextLevel(level);
            i >>= 1;
        }
        return branch;
    }

    public static byte[] innerNode(Hash left, Hash right) {
        return Bytes.concat(left.bytes(), right.bytes());
    }

    private static List<Hash> nextLevel(List<Hash> level) {
        List<Hash> next = new ArrayList<>((level.size()+1)/2);
        for (int i=0; i<level.size(); i+=2) {
            Hash left = level.get(i);
            Hash right = (i+1 < level.size()) ? level.get(i+1) : left;
            next.add(new Hash(Hashes.sha256d(innerNode(left, right))));
        }
        return next;
    }
}
