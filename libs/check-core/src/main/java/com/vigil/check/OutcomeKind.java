package com.vigil.check;

import java.util.Locale;

/**
 * Three-valued severity of a check outcome.
 * <p>
 * Declaration order is severity order: {@link #SUCCESS} &lt; {@link #WARNING} &lt; {@link #ERROR}.
 */
public enum OutcomeKind {

    /** The target answered as expected. */
    SUCCESS,

    /** The target is reachable but an expectation is only partially met (e.g. content, expiry). */
    WARNING,

    /** The target is unreachable, misbehaving, misconfigured, or the check could not complete. */
    ERROR;

    /**
     * Returns the lower-case wire name ({@code success}, {@code warning}, {@code error}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the more severe of this kind and {@code other}.
     */
    public OutcomeKind worse(OutcomeKind other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    /**
     * Parses a wire name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not one of the three kinds
     */
    public static OutcomeKind fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("outcome kind must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid outcome kind: " + name + ". Must be one of: success, warning, error", e);
        }
    }
}
