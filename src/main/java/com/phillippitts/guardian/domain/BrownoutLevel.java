package com.phillippitts.guardian.domain;

/**
 * Cumulative degradation levels. Each level includes every action of the levels below it.
 */
public enum BrownoutLevel {
    NONE,
    LIGHT,
    MODERATE,
    HEAVY;

    public boolean includes(BrownoutLevel other) {
        return compareTo(other) >= 0;
    }
}
