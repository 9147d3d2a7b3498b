package com.ivamare.kernelbus.model;

/**
 * Result of walking the hash chain.
 *
 * @param valid Whether every entry links and hashes correctly
 * @param brokenAtSequence First sequence where verification failed (null when valid)
 * @param details Human-readable summary
 * @param entriesChecked Number of entries verified before stopping
 */
public record ChainVerification(
    boolean valid,
    Long brokenAtSequence,
    String details,
    long entriesChecked
) {
    public static ChainVerification valid(long entriesChecked) {
        return new ChainVerification(true, null,
            entriesChecked == 0 ? "Chain is empty" : "Verified " + entriesChecked + " entries",
            entriesChecked);
    }

    public static ChainVerification broken(long sequence, String details, long entriesChecked) {
        return new ChainVerification(false, sequence, details, entriesChecked);
    }
}
