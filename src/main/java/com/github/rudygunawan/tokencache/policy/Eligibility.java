package com.github.rudygunawan.tokencache.policy;

/**
 * Outcome of a {@link ResourceGovernor} eligibility check.
 */
public enum Eligibility {
    ELIGIBLE,
    EMPTY_KEY,
    INVALID_PATH,
    IGNORED,
    NO_EXTENSION,
    INVALID_EXTENSION,
    MISSING,
    NOT_A_FILE,
    /**
     * Every other check passed but the file exceeds the size ceiling.
     */
    OVERSIZED;

    public boolean isEligible() {
        return this == ELIGIBLE;
    }
}
