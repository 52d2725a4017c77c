package com.identityvault.application;

/**
 * What a caller offers to justify retiring a key version: either a count of
 * records still tagged with it, or an explicit acknowledgement that those
 * records become unreadable.
 */
public record RetirementEvidence(long outstandingReferences, boolean forced, String reason) {

    public static RetirementEvidence referenceCount(long outstandingReferences) {
        if (outstandingReferences < 0) {
            throw new IllegalArgumentException("Reference count must not be negative");
        }
        return new RetirementEvidence(outstandingReferences, false, null);
    }

    public static RetirementEvidence forced(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Forced retirement requires a reason");
        }
        return new RetirementEvidence(-1, true, reason);
    }
}
