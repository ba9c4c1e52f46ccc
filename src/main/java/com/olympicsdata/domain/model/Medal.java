package com.olympicsdata.domain.model;

import java.util.Locale;

/**
 * Medal awarded for an event result. Rows without a medal carry {@link #NONE}
 * explicitly rather than a blank value.
 */
public enum Medal {
    GOLD("Gold", "1"),
    SILVER("Silver", "2"),
    BRONZE("Bronze", "3"),
    NONE("None", "");

    private final String label;
    private final String position;

    Medal(String label, String position) {
        this.label = label;
        this.position = position;
    }

    public String getLabel() {
        return label;
    }

    /** Finishing position implied by the medal, empty for {@link #NONE}. */
    public String getPosition() {
        return position;
    }

    public boolean isPodium() {
        return this != NONE;
    }

    /**
     * Parses a medal cell. Accepts the plain labels as well as the
     * "Gold Medal" style used by the medallist tables; anything else is NONE.
     */
    public static Medal fromText(String text) {
        if (text == null) {
            return NONE;
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("gold")) {
            return GOLD;
        }
        if (value.startsWith("silver")) {
            return SILVER;
        }
        if (value.startsWith("bronze")) {
            return BRONZE;
        }
        return NONE;
    }

    @Override
    public String toString() {
        return label;
    }
}
