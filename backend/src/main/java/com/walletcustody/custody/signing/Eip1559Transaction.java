package com.walletcustody.custody.signing;

import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Unsigned type-2 (EIP-1559) transaction. The access list is always empty.
 */
public record Eip1559Transaction(
        long chainId,
        long nonce,
        BigInteger maxPriorityFeePerGas,
        BigInteger maxFeePerGas,
        BigInteger gasLimit,
        String to,
        BigInteger value,
        byte[] data
) {

    static final byte TYPE = 0x02;

    /** {@code 0x02 || rlp([chainId, nonce, maxPriorityFee, maxFee, gasLimit, to, value, data, accessList])}. */
    public byte[] signingPayload() {
        return typed(Rlp.encodeList(fields()));
    }

    public byte[] encodeSigned(int yParity, BigInteger r, BigInteger s) {
        List<byte[]> items = fields();
        items.add(Rlp.encodeInteger(yParity));
        items.add(Rlp.encodeInteger(r));
        items.add(Rlp.encodeInteger(s));
        return typed(Rlp.encodeList(items));
    }

    private List<byte[]> fields() {
        List<byte[]> items = new ArrayList<>();
        items.add(Rlp.encodeInteger(chainId));
        items.add(Rlp.encodeInteger(nonce));
        items.add(Rlp.encodeInteger(maxPriorityFeePerGas));
        items.add(Rlp.encodeInteger(maxFeePerGas));
        items.add(Rlp.encodeInteger(gasLimit));
        items.add(Rlp.encodeBytes(Hex.decode(strip0x(to))));
        items.add(Rlp.encodeInteger(value));
        items.add(Rlp.encodeBytes(data != null ? data : new byte[0]));
        items.add(Rlp.encodeList(List.of()));
        return items;
    }

    private static byte[] typed(byte[] rlp) {
        byte[] out = new byte[rlp.length + 1];
        out[0] = TYPE;
        System.arraycopy(rlp, 0, out, 1, rlp.length);
        return out;
    }

    static String strip0x(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
