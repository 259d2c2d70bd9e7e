package io.droplite.core;

/**
 * Interaction categories a daily distribution is split by.
 * The ordinal is the on-wire uint8 value and must never be reordered.
 */
public enum Category {
    CREATE,
    LIKES,
    COMMENTS,
    TIPPING,
    CRYPTO,
    REFERRALS;

    private static final Category[] VALUES = values();

    public int code() {
        return ordinal();
    }

    /**
     * Resolve a wire code.
     *
     * @throws DistributionException INVALID_CATEGORY when out of range
     */
    public static Category fromCode(int code) {
        if (code < 0 || code >= VALUES.length) {
            throw new DistributionException(Failure.INVALID_CATEGORY, "category out of range: " + code);
        }
        return VALUES[code];
    }

    /** Accepts either the enum name (case-insensitive) or the numeric code. */
    public static Category parse(String s) {
        if (s == null || s.isBlank()) {
            throw new DistributionException(Failure.INVALID_CATEGORY, "category is required");
        }
        String t = s.trim();
        if (Character.isDigit(t.charAt(0))) {
            try {
                return fromCode(Integer.parseInt(t));
            } catch (NumberFormatException e) {
                throw new DistributionException(Failure.INVALID_CATEGORY, "invalid category: " + s);
            }
        }
        for (Category c : VALUES) {
            if (c.name().equalsIgnoreCase(t)) return c;
        }
        throw new DistributionException(Failure.INVALID_CATEGORY, "unknown category: " + s);
    }

    public static int count() {
        return VALUES.length;
    }
}
