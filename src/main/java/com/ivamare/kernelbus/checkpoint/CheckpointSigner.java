package com.ivamare.kernelbus.checkpoint;

import com.ivamare.kernelbus.exception.CheckpointConfigurationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signer for checkpoints.
 *
 * <p>The signed message is {@code atSequence + ":" + tipHash}.
 */
public final class CheckpointSigner {

    public static final String ALGORITHM = "HmacSHA256";

    /** Minimum secret length in bytes. */
    public static final int MIN_SECRET_BYTES = 32;

    private final SecretKeySpec key;

    public CheckpointSigner(byte[] secret) {
        if (secret == null || secret.length < MIN_SECRET_BYTES) {
            throw new CheckpointConfigurationException(
                "Checkpoint secret must be at least " + MIN_SECRET_BYTES + " bytes, got "
                    + (secret == null ? 0 : secret.length));
        }
        this.key = new SecretKeySpec(Arrays.copyOf(secret, secret.length), ALGORITHM);
    }

    /**
     * @param atSequence Checkpoint sequence
     * @param tipHash Hash of the entry at that sequence
     * @return lower-case hex signature
     */
    public String sign(long atSequence, String tipHash) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((atSequence + ":" + tipHash).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Constant-time comparison of a stored signature with the expected one.
     */
    public boolean verify(long atSequence, String tipHash, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(atSequence, tipHash).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }
}
