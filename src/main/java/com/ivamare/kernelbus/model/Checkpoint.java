package com.ivamare.kernelbus.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Signed snapshot of the chain tip.
 *
 * @param atSequence Sequence of the tip entry when the checkpoint was taken
 * @param tipHash Hash of that entry
 * @param recordedAt When the checkpoint was written
 * @param signature HMAC-SHA256 over {@code atSequence:tipHash}, lower-case hex
 */
@JsonPropertyOrder({"atSequence", "tipHash", "recordedAt", "signature"})
public record Checkpoint(
    long atSequence,
    String tipHash,
    Instant recordedAt,
    String signature
) {}
