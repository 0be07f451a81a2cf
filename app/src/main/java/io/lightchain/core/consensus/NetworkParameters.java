package io.lightchain.core.consensus;

import io.lightchain.core.protocol.BlockHeader;
import io.lightchain.core.protocol.BlockHeaderCodec;
import io.lightchain.core.protocol.Hash;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Consensus constants of one network plus the header codec and hashers derived from them. */
public final class NetworkParameters {
    public static final BigInteger MAINNET_MAX_TARGET =
            new BigInteger("00000fffffffffffffffffffffffffffffffffffffffffffffffffffffffffff", 16);
    public static final BigInteger MAINNET_KAWPOW_LIMIT =
            new BigInteger("0000000000ffffffffffffffffffffffffffffffffffffffffffffffffffffff", 16);
    public static final int DGW_PAST_BLOCKS = 180;
    public static final int DEFAULT_MATURE = 60;

    private final String name;
    private final boolean testnet;
    private final Hash genesisHash;
    private final long x16rv2ActivationTime;
    private final long kawpowActivationTime;
    private final int kawpowActivationHeight;
    private final int dgwActivationHeight;
    private final boolean kawpowDifficultyReset;
    private final BigInteger maxTarget;
    private final BigInteger kawpowLimit;
    private final int dgwPastBlocks;
    private final long targetSpacingSeconds;
    private final int mature;
    private final int p2pkhVersion;
    private final int p2shVersion;
    private final Checkpoints checkpoints;
    private final Map<HashEra, PowHasher> hashers;
    private final BlockHeaderCodec codec;

    private NetworkParameters(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.testnet = b.testnet;
        this.genesisHash = Objects.requireNonNull(b.genesisHash, "genesisHash");
        this.x16rv2ActivationTime = b.x16rv2ActivationTime;
        this.kawpowActivationTime = b.kawpowActivationTime;
        this.kawpowActivationHeight = b.kawpowActivationHeight;
        this.dgwActivationHeight = b.dgwActivationHeight;
        this.kawpowDifficultyReset = b.kawpowDifficultyReset;
        this.maxTarget = b.maxTarget;
        this.kawpowLimit = b.kawpowLimit;
        this.dgwPastBlocks = b.dgwPastBlocks;
        this.targetSpacingSeconds = b.targetSpacingSeconds;
        this.mature = b.mature;
        this.p2pkhVersion = b.p2pkhVersion;
        this.p2shVersion = b.p2shVersion;
        this.checkpoints = b.checkpoints;
        this.hashers = new EnumMap<>(b.hashers);
        for (HashEra era : HashEra.values()) {
            if (!hashers.containsKey(era)) {
                throw new IllegalArgumentException("No hasher for era " + era);
            }
        }
        this.codec = new BlockHeaderCodec(kawpowActivationTime);
    }

    public static NetworkParameters mainnet() {
        return builder("mainnet")
                .genesisHash(Hash.fromHex("0000006b444bc2f2ffe627be9d9e7e7a0730000870ef6eb6da46c8eae389df90"))
                .x16rv2ActivationTime(1569945600L)
                .kawpowActivationTime(1588788000L)
                .kawpowActivationHeight(1219736)
                .dgwActivationHeight(338778)
                .kawpowDifficultyReset(true)
                .addressVersions(60, 122)
                .checkpoints(Checkpoints.loadResource("mainnet", 168 * Checkpoints.RETARGET_INTERVAL))
                .hashers(PowHashers.installed())
                .build();
    }

    public static NetworkParameters testnet() {
        return builder("testnet")
                .testnet(true)
                .genesisHash(Hash.fromHex("000000ecfc5e6324a079542221d00e10362bdc894d56500c414060eea8a3ad5a"))
                .x16rv2ActivationTime(1567533600L)
                .kawpowActivationTime(1585159200L)
                .kawpowActivationHeight(231544)
                .dgwActivationHeight(1)
                .addressVersions(111, 196)
                .checkpoints(Checkpoints.loadResource("testnet", 0))
                .hashers(PowHashers.installed())
                .build();
    }

    public static NetworkParameters forName(String name) {
        if ("mainnet".equalsIgnoreCase(name)) return mainnet();
        if ("testnet".equalsIgnoreCase(name)) return testnet();
        throw new IllegalArgumentException("Unknown network: " + name);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }
    public boolean isTestnet() { return testnet; }
    public Hash genesisHash() { return genesisHash; }
    public long x16rv2ActivationTime() { return x16rv2ActivationTime; }
    public long kawpowActivationTime() { return kawpowActivationTime; }
    public int kawpowActivationHeight() { return kawpowActivationHeight; }
    public int dgwActivationHeight() { return dgwActivationHeight; }
    public BigInteger maxTarget() { return maxTarget; }
    public BigInteger kawpowLimit() { return kawpowLimit; }
    public int dgwPastBlocks() { return dgwPastBlocks; }
    public long targetSpacingSeconds() { return targetSpacingSeconds; }
    public int mature() { return mature; }
    public int p2pkhVersion() { return p2pkhVersion; }
    public int p2shVersion() { return p2shVersion; }
    public Checkpoints checkpoints() { return checkpoints; }
    public BlockHeaderCodec codec() { return codec; }

    /** Heights right after the extended-layout switch that reuse the fixed reset limit. */
    public boolean inDifficultyResetBand(int height) {
        return kawpowDifficultyReset
                && height >= kawpowActivationHeight
                && height < kawpowActivationHeight + dgwPastBlocks;
    }

    /**
     * Fails when headers of this network cannot be validated from genesis: an era has no installed
     * hasher, or heights before the DGW switch have no legacy checkpoint to take their target from.
     */
    public void requireUsable() {
        List<HashEra> missing = new ArrayList<>();
        for (HashEra era : HashEra.values()) {
            if (!PowHashers.isAvailable(hashers.get(era))) {
                missing.add(era);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Network " + name + " has no proof-of-work provider for " + missing
                    + "; install a " + PowHasherProvider.class.getSimpleName() + " for each era");
        }
        if (!testnet && dgwActivationHeight > 0 && checkpoints.legacyWindow(dgwActivationHeight - 1).isEmpty()) {
            throw new IllegalStateException("Network " + name + " has no legacy checkpoints below height "
                    + dgwActivationHeight + "; checkpoints/" + name + ".json is incomplete");
        }
    }

    public HashEra eraOf(BlockHeader header) {
        return HashEra.forTimestamp(header.timestamp(), x16rv2ActivationTime, kawpowActivationTime);
    }

    public PowHasher hasher(HashEra era) {
        return hashers.get(era);
    }

    @Override
    public String toString() {
        return "NetworkParameters{" + name + "}";
    }

    public static final class Builder {
        private final String name;
        private boolean testnet;
        private Hash genesisHash;
        private long x16rv2ActivationTime;
        private long kawpowActivationTime;
        private int kawpowActivationHeight;
        private int dgwActivationHeight;
        private boolean kawpowDifficultyReset;
        private BigInteger maxTarget = MAINNET_MAX_TARGET;
        private BigInteger kawpowLimit = MAINNET_KAWPOW_LIMIT;
        private int dgwPastBlocks = DGW_PAST_BLOCKS;
        private long targetSpacingSeconds = 60L;
        private int mature = DEFAULT_MATURE;
        private int p2pkhVersion = 60;
        private int p2shVersion = 122;
        private Checkpoints checkpoints = Checkpoints.none();
        private Map<HashEra, PowHasher> hashers = PowHashers.uniform(Sha256dPowHasher.INSTANCE);

        private Builder(String name) {
            this.name = name;
        }

        public Builder testnet(boolean testnet) { this.testnet = testnet; return this; }
        public Builder genesisHash(Hash genesisHash) { this.genesisHash = genesisHash; return this; }
        public Builder x16rv2ActivationTime(long ts) { this.x16rv2ActivationTime = ts; return this; }
        public Builder kawpowActivationTime(long ts) { this.kawpowActivationTime = ts; return this; }
        public Builder kawpowActivationHeight(int height) { this.kawpowActivationHeight = height; return this; }
        public Builder dgwActivationHeight(int height) { this.dgwActivationHeight = height; return this; }
        public Builder kawpowDifficultyReset(boolean reset) { this.kawpowDifficultyReset = reset; return this; }
        public Builder maxTarget(BigInteger maxTarget) { this.maxTarget = maxTarget; return this; }
        public Builder kawpowLimit(BigInteger kawpowLimit) { this.kawpowLimit = kawpowLimit; return this; }
        public Builder dgwPastBlocks(int blocks) { this.dgwPastBlocks = blocks; return this; }
        public Builder targetSpacingSeconds(long seconds) { this.targetSpacingSeconds = seconds; return this; }
        public Builder mature(int mature) { this.mature = mature; return this; }
        public Builder addressVersions(int p2pkh, int p2sh) { this.p2pkhVersion = p2pkh; this.p2shVersion = p2sh; return this; }
        public Builder checkpoints(Checkpoints checkpoints) { this.checkpoints = Objects.requireNonNull(checkpoints); return this; }
        public Builder hashers(Map<HashEra, PowHasher> hashers) { this.hashers = Objects.requireNonNull(hashers); return this; }

        public NetworkParameters build() {
            return new NetworkParameters(this);
        }
    }
}
