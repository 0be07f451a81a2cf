package io.lightchain.core.protocol;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Strict decoder for the Bitcoin-family transaction format (with optional segwit marker).
 * Any trailing byte, short read, or empty input/output list is rejected.
 */
public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromHex(String hex) {
        return fromBytes(Bytes.fromHex(hex));
    }

    public static Transaction fromBytes(byte[] bytes) {
        ByteReader in = new ByteReader(bytes);
        long version = in.readUint32();
        int bodyStart = in.position();

        long vinCount = in.readCompactSize();
        boolean segwit = vinCount == 0;
        if (segwit) {
            int flag = in.readUint8();
            if (flag != 0x01) {
                throw new MalformedDataException("invalid txn marker byte: " + flag);
            }
            bodyStart = in.position();
            vinCount = in.readCompactSize();
        }
        if (vinCount < 1) {
            throw new MalformedDataException("tx needs to have at least 1 input");
        }
        List<Transaction.Input> inputs = new ArrayList<>();
        for (long i = 0; i < vinCount; i++) {
            if (in.remaining() < 41) {
                throw new MalformedDataException("Truncated input " + i);
            }
            Hash prev = new Hash(in.readBytes(Hash.LENGTH));
            long prevIndex = in.readUint32();
            byte[] scriptSig = in.readVarBytes();
            long sequence = in.readUint32();
            inputs.add(new Transaction.Input(prev, prevIndex, scriptSig, sequence));
        }

        long voutCount = in.readCompactSize();
        if (voutCount < 1) {
            throw new MalformedDataException("tx needs to have at least 1 output");
        }
        List<Transaction.Output> outputs = new ArrayList<>();
        for (long i = 0; i < voutCount; i++) {
            if (in.remaining() < 9) {
                throw new MalformedDataException("Truncated output " + i);
            }
            long value = in.readInt64();
            byte[] script = in.readVarBytes();
            outputs.add(new Transaction.Output(value, script));
        }
        int bodyEnd = in.position();

        if (segwit) {
            for (long i = 0; i < vinCount; i++) {
                long items = in.readCompactSize();
                for (long j = 0; j < items; j++) {
                    in.readVarBytes();
                }
            }
        }
        int lockStart = in.position();
        long lockTime = in.readUint32();
        if (in.hasRemaining()) {
            throw new MalformedDataException("extra junk at the end of transaction");
        }

        ByteArrayOutputStream preimage = new ByteArrayOutputStream(bytes.length);
        preimage.writeBytes(in.slice(0, 4));
        preimage.writeBytes(in.slice(bodyStart, bodyEnd));
        preimage.writeBytes(in.slice(lockStart, lockStart + 4));
        return new Transaction(version, inputs, outputs, lockTime, segwit, preimage.toByteArray());
    }

    /** True when the bytes decode as a complete transaction. */
    public static boolean isValid(byte[] bytes) {
        try {
            fromBytes(bytes);
            return true;
        } catch (MalformedDataException e) {
            return false;
        }
    }
}
