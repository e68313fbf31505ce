package com.tradeguard.domain.model;

import lombok.Value;

@Value
public class ChainVerificationResult {

    boolean valid;

    /** Index (== sequence) of the first entry that failed, null when the chain is intact. */
    Long firstBrokenIndex;

    long entriesChecked;
    String message;

    public static ChainVerificationResult intact(long entriesChecked) {
        return new ChainVerificationResult(true, null, entriesChecked, "Chain intact");
    }

    public static ChainVerificationResult broken(long index, long entriesChecked, String message) {
        return new ChainVerificationResult(false, index, entriesChecked, message);
    }
}
