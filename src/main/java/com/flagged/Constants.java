package com.flagged;

public final class Constants {
    /** Flag values are non-negative longs, so bit 63 is never usable. */
    public static final int USABLE_BITS = Long.SIZE - 1;
    public static final long USABLE_MASK = Long.MAX_VALUE;
    public static final String COMBINED_NAME_SEPARATOR = "|";
    public static final String DISPLAY_SEPARATOR = " | ";
    public static final String PRIVATE_NAME_PREFIX = "_";

    private Constants() {}
}
