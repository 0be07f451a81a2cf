package io.lightchain.core.consensus;

import java.util.EnumMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Logger;

public final class PowHashers {
    private static final Logger LOG = Logger.getLogger(PowHashers.class.getName());

    private PowHashers() {}

    /** Same hasher for every era. */
    public static Map<HashEra, PowHasher> uniform(PowHasher hasher) {
        Map<HashEra, PowHasher> out = new EnumMap<>(HashEra.class);
        for (HashEra era : HashEra.values()) {
            out.put(era, hasher);
        }
        return out;
    }

    /**
     * Hashers discovered on the classpath. Eras without a provider get a hasher that fails
     * with {@link IllegalStateException} when used.
     */
    public static Map<HashEra, PowHasher> installed() {
        Map<HashEra, PowHasher> out = new EnumMap<>(HashEra.class);
        for (PowHasherProvider provider : ServiceLoader.load(PowHasherProvider.class)) {
            out.putIfAbsent(provider.era(), provider.hasher());
        }
        for (HashEra era : HashEra.values()) {
            if (!out.containsKey(era)) {
                LOG.fine(() -> "No proof-of-work provider installed for " + era);
                out.put(era, unavailable(era));
            }
        }
        return out;
    }

    /** False for the placeholder {@link #installed()} puts in for eras nobody provides. */
    public static boolean isAvailable(PowHasher hasher) {
        return !(hasher instanceof Unavailable);
    }

    private static PowHasher unavailable(HashEra era) {
        return new Unavailable(era);
    }

    private static final class Unavailable implements PowHasher {
        private final HashEra era;

        Unavailable(HashEra era) {
            this.era = era;
        }

        @Override
        public byte[] hash(byte[] header) {
            throw new IllegalStateException("No " + era + " hash provider installed");
        }
    }
}
