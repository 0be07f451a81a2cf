package io.lightchain.core.consensus;

/**
 * Service-provider hook for native hash implementations. Register implementations in
 * {@code META-INF/services/io.lightchain.core.consensus.PowHasherProvider}.
 */
public interface PowHasherProvider {
    HashEra era();

    PowHasher hasher();
}
