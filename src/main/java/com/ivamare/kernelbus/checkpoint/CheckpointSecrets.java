package com.ivamare.kernelbus.checkpoint;

import com.ivamare.kernelbus.exception.CheckpointConfigurationException;
import com.ivamare.kernelbus.store.JsonLinesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Resolves the checkpoint HMAC secret.
 *
 * <p>Order: inline secret, then the secret file. When neither is present and
 * generation is enabled, 32 random bytes are written hex-encoded to the secret
 * file with owner-only permissions.
 */
public final class CheckpointSecrets {

    private static final Logger log = LoggerFactory.getLogger(CheckpointSecrets.class);

    private CheckpointSecrets() {
    }

    /**
     * @param inlineSecret Secret given in configuration (nullable)
     * @param secretFile File holding the secret (nullable)
     * @param generate Whether to create the secret file when it is missing
     * @return the secret bytes
     * @throws CheckpointConfigurationException if no usable secret is available
     */
    public static byte[] resolve(String inlineSecret, Path secretFile, boolean generate) {
        if (inlineSecret != null && !inlineSecret.isBlank()) {
            return checked(inlineSecret.getBytes(StandardCharsets.UTF_8), "kernelbus.checkpoint.secret");
        }

        if (secretFile != null && Files.exists(secretFile)) {
            try {
                String content = Files.readString(secretFile, StandardCharsets.UTF_8).strip();
                log.info("Using checkpoint secret from {}", secretFile);
                return checked(content.getBytes(StandardCharsets.UTF_8), secretFile.toString());
            } catch (IOException e) {
                throw new CheckpointConfigurationException("Cannot read checkpoint secret file " + secretFile, e);
            }
        }

        if (generate && secretFile != null) {
            return generate(secretFile);
        }

        throw new CheckpointConfigurationException(
            "No checkpoint secret configured: set kernelbus.checkpoint.secret, provide "
                + (secretFile != null ? secretFile : "kernelbus.checkpoint.secret-file")
                + " or enable kernelbus.checkpoint.generate-secret");
    }

    private static byte[] generate(Path secretFile) {
        byte[] random = new byte[CheckpointSigner.MIN_SECRET_BYTES];
        new SecureRandom().nextBytes(random);
        String encoded = HexFormat.of().formatHex(random);
        try {
            JsonLinesStore.createParentDirectories(secretFile);
            if (secretFile.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.createFile(secretFile, PosixFilePermissions.asFileAttribute(
                    PosixFilePermissions.fromString("rw-------")));
            } else {
                Files.createFile(secretFile);
            }
            Files.writeString(secretFile, encoded, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CheckpointConfigurationException("Cannot write checkpoint secret file " + secretFile, e);
        }
        log.warn("Generated a new checkpoint secret at {}; back it up with the audit store", secretFile);
        return encoded.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] checked(byte[] secret, String source) {
        if (secret.length < CheckpointSigner.MIN_SECRET_BYTES) {
            throw new CheckpointConfigurationException(
                "Checkpoint secret from " + source + " is too short: " + secret.length
                    + " bytes, need at least " + CheckpointSigner.MIN_SECRET_BYTES);
        }
        return secret;
    }
}
