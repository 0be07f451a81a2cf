package io.lightchain.core.sync;

import io.lightchain.core.protocol.Bytes;
import io.lightchain.core.protocol.Hashes;
import io.lightchain.core.wallet.AssetMeta;
import io.lightchain.core.wallet.HistoryEntry;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** The status strings servers announce, recomputed from local data. */
public final class StatusDigests {
    private StatusDigests() {}

    /** sha256 over {@code txid:height:} for every entry, in order; null for an empty history. */
    public static String historyStatus(List<HistoryEntry> history) {
        if (history == null || history.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (HistoryEntry e : history) {
            sb.append(e.txHash()).append(':').append(e.height()).append(':');
        }
        return digest(sb.toString());
    }

    public static String assetStatus(AssetMeta meta) {
        if (meta == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder()
                .append(meta.circulation())
                .append(meta.divisions())
                .append(pyBool(meta.reissuable()))
                .append(pyBool(meta.hasIpfs()));
        if (meta.hasIpfs() && meta.ipfs() != null) {
            sb.append(meta.ipfs());
        }
        return digest(sb.toString());
    }

    private static String pyBool(boolean b) {
        return b ? "True" : "False";
    }

    private static String digest(String s) {
        return Bytes.toHex(Hashes.sha256(s.getBytes(StandardCharsets.US_ASCII)));
    }
}
