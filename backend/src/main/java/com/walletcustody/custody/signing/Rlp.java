package com.walletcustody.custody.signing;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.List;

/**
 * Recursive Length Prefix encoding, limited to what transaction envelopes need: byte strings, unsigned integers
 * and lists of already-encoded items.
 */
public final class Rlp {

    private static final int STRING_OFFSET = 0x80;
    private static final int LIST_OFFSET = 0xc0;
    private static final int SHORT_LENGTH_LIMIT = 55;

    private Rlp() {
    }

    public static byte[] encodeBytes(byte[] value) {
        if (value.length == 1 && (value[0] & 0xff) < STRING_OFFSET) {
            return value;
        }
        return concat(lengthPrefix(STRING_OFFSET, value.length), value);
    }

    /** Minimal big-endian encoding; zero is the empty string. */
    public static byte[] encodeInteger(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP integers must be non-negative, got " + value);
        }
        return encodeBytes(toMinimalBytes(value));
    }

    public static byte[] encodeInteger(long value) {
        return encodeInteger(BigInteger.valueOf(value));
    }

    public static byte[] encodeList(List<byte[]> encodedItems) {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        for (byte[] item : encodedItems) {
            payload.writeBytes(item);
        }
        byte[] body = payload.toByteArray();
        return concat(lengthPrefix(LIST_OFFSET, body.length), body);
    }

    static byte[] toMinimalBytes(BigInteger value) {
        if (value.signum() == 0) {
            return new byte[0];
        }
        byte[] raw = value.toByteArray();
        if (raw[0] == 0) {
            byte[] trimmed = new byte[raw.length - 1];
            System.arraycopy(raw, 1, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return raw;
    }

    private static byte[] lengthPrefix(int offset, int length) {
        if (length <= SHORT_LENGTH_LIMIT) {
            return new byte[]{(byte) (offset + length)};
        }
        byte[] lengthBytes = toMinimalBytes(BigInteger.valueOf(length));
        byte[] prefix = new byte[1 + lengthBytes.length];
        prefix[0] = (byte) (offset + SHORT_LENGTH_LIMIT + lengthBytes.length);
        System.arraycopy(lengthBytes, 0, prefix, 1, lengthBytes.length);
        return prefix;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
