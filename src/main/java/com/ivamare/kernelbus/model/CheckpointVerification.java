package com.ivamare.kernelbus.model;

import java.util.List;

/**
 * Result of cross-checking stored checkpoints against the chain.
 *
 * @param valid Whether no mismatch was found
 * @param checked Number of checkpoints examined
 * @param mismatches Every disagreeing field, in checkpoint order
 */
public record CheckpointVerification(
    boolean valid,
    int checked,
    List<Mismatch> mismatches
) {
    public CheckpointVerification {
        mismatches = List.copyOf(mismatches);
    }

    public static CheckpointVerification of(int checked, List<Mismatch> mismatches) {
        return new CheckpointVerification(mismatches.isEmpty(), checked, mismatches);
    }

    /**
     * A single field of a checkpoint that disagrees with the chain.
     *
     * @param atSequence Checkpoint sequence
     * @param field "tipHash" or "signature"
     * @param expected Value the checkpoint scheme requires
     * @param actual Value found
     */
    public record Mismatch(
        long atSequence,
        String field,
        String expected,
        String actual
    ) {
        public static final String TIP_HASH = "tipHash";
        public static final String SIGNATURE = "signature";
    }
}
