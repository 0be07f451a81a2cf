package io.lightchain.core.consensus;

/** A proof-of-work hash function. Returns 32 bytes in wire (little-endian) order. */
@FunctionalInterface
public interface PowHasher {
    byte[] hash(byte[] headerBytes);
}
