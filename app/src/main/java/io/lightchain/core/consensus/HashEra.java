package io.lightchain.core.consensus;

/** Proof-of-work algorithm eras, selected purely by header timestamp. */
public enum HashEra {
    X16R(80),
    X16RV2(80),
    KAWPOW(120);

    private final int hashedLength;

    HashEra(int hashedLength) {
        this.hashedLength = hashedLength;
    }

    /** Number of leading header bytes fed to the hash function. */
    public int hashedLength() {
        return hashedLength;
    }

    public static HashEra forTimestamp(long timestamp, long x16rv2ActivationTime, long kawpowActivationTime) {
        if (timestamp >= kawpowActivationTime) {
            return KAWPOW;
        }
        if (timestamp >= x16rv2ActivationTime) {
            return X16RV2;
        }
        return X16R;
    }
}
