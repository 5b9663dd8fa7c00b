package com.walletcustody.custody.signing;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 signing of EIP-1559 transactions with deterministic (RFC 6979) nonces and low-s normalisation.
 * The recovery id is found by recovering the public key from the signature.
 */
@Component
public class TransactionSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());
    static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    /**
     * @param privateKeyHex 32-byte key, optionally 0x-prefixed
     * @throws IllegalArgumentException when the key is not 32 bytes of hex or outside the curve order
     */
    public SignedTransaction sign(Eip1559Transaction tx, String privateKeyHex) {
        BigInteger privateKey = parsePrivateKey(privateKeyHex);
        byte[] messageHash = Keccak.keccak256(tx.signingPayload());

        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, CURVE));
        BigInteger[] components = signer.generateSignature(messageHash);
        BigInteger r = components[0];
        BigInteger s = components[1];
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            s = CURVE.getN().subtract(s);
        }

        ECPoint publicKey = publicPoint(privateKey);
        int recoveryId = -1;
        for (int i = 0; i < 2; i++) {
            ECPoint candidate = recoverFromSignature(i, r, s, messageHash);
            if (candidate != null && candidate.equals(publicKey)) {
                recoveryId = i;
                break;
            }
        }
        if (recoveryId == -1) {
            throw new IllegalStateException("Could not derive recovery id for signature");
        }
        byte[] raw = tx.encodeSigned(recoveryId, r, s);
        return new SignedTransaction(raw, "0x" + Hex.toHexString(Keccak.keccak256(raw)), recoveryId, r, s);
    }

    /** Lower-case 0x address of the key: last 20 bytes of keccak256 of the uncompressed public key. */
    public String addressOf(String privateKeyHex) {
        return addressOf(publicPoint(parsePrivateKey(privateKeyHex)));
    }

    /** Address that produced the signature over {@code messageHash}, or null when recovery fails. */
    static String recoverAddress(byte[] messageHash, int recoveryId, BigInteger r, BigInteger s) {
        ECPoint point = recoverFromSignature(recoveryId, r, s, messageHash);
        return point != null ? addressOf(point) : null;
    }

    private static String addressOf(ECPoint publicKey) {
        byte[] encoded = publicKey.normalize().getEncoded(false);
        byte[] hash = Keccak.keccak256(Arrays.copyOfRange(encoded, 1, encoded.length));
        return "0x" + Hex.toHexString(Arrays.copyOfRange(hash, hash.length - 20, hash.length));
    }

    private static ECPoint publicPoint(BigInteger privateKey) {
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKey).normalize();
    }

    private static BigInteger parsePrivateKey(String privateKeyHex) {
        if (privateKeyHex == null) {
            throw new IllegalArgumentException("Private key is required");
        }
        String hex = Eip1559Transaction.strip0x(privateKeyHex.trim());
        if (hex.length() != 64) {
            throw new IllegalArgumentException("Private key must be 32 bytes");
        }
        byte[] bytes;
        try {
            bytes = Hex.decode(hex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Private key is not hex", e);
        }
        BigInteger key = new BigInteger(1, bytes);
        if (key.signum() == 0 || key.compareTo(CURVE.getN()) >= 0) {
            throw new IllegalArgumentException("Private key outside curve order");
        }
        return key;
    }

    private static ECPoint recoverFromSignature(int recoveryId, BigInteger r, BigInteger s, byte[] message) {
        BigInteger n = CURVE.getN();
        BigInteger x = r.add(BigInteger.valueOf(recoveryId / 2L).multiply(n));
        BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
        if (x.compareTo(prime) >= 0) {
            return null;
        }
        ECPoint rPoint = decompressKey(x, (recoveryId & 1) == 1);
        if (!rPoint.multiply(n).isInfinity()) {
            return null;
        }
        BigInteger e = new BigInteger(1, message);
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        return ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, rPoint, srInv).normalize();
    }

    private static ECPoint decompressKey(BigInteger x, boolean yBit) {
        X9IntegerConverter converter = new X9IntegerConverter();
        byte[] compressed = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
        compressed[0] = (byte) (yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compressed);
    }
}
