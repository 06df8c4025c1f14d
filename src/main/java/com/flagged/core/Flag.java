package com.flagged.core;

import com.flagged.Constants;
import com.flagged.error.ErrorType;
import com.flagged.error.FlagException;
import lombok.Getter;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * A named bitmask belonging to exactly one {@link FlagSet}.
 * <p>
 * Instances are immutable. They are created either when their set is built (declared flags) or
 * the first time a union is requested through {@link #or(Flag)}, after which the union is
 * interned in the owning set and reused.
 * <p>
 * Two flags are equal when they belong to the same set and carry the same value. Since every
 * value has a single canonical instance per set, equal flags are also the same object.
 */
@Getter
public final class Flag {
    private final FlagSet flagSet;
    private final String name;
    private final long value;

    Flag(FlagSet flagSet, String name, long value) {
        this.flagSet = flagSet;
        this.name = name;
        this.value = value;
    }

    /**
     * Bitwise intersection with another flag of the same set.
     *
     * @return the shared bits; non-zero iff the flags overlap
     * @throws FlagException with {@link ErrorType#TYPE_MISMATCH} if {@code other} belongs to another set
     */
    public long and(Flag other) throws FlagException {
        requireSameSet(other, "AND");
        return value & other.value;
    }

    public boolean intersects(Flag other) throws FlagException {
        return and(other) != 0;
    }

    /**
     * @return true if every bit of {@code other} is set in this flag
     */
    public boolean includes(Flag other) throws FlagException {
        return and(other) == other.value;
    }

    /**
     * Union with another flag of the same set.
     *
     * @return the canonical instance for the combined value, created and interned on first use
     * @throws FlagException with {@link ErrorType#TYPE_MISMATCH} if {@code other} belongs to another set
     */
    public Flag or(Flag other) throws FlagException {
        requireSameSet(other, "OR");
        return flagSet.intern(value | other.value, name + Constants.COMBINED_NAME_SEPARATOR + other.name);
    }

    public boolean isDeclared() {
        return flagSet.isDeclared(this);
    }

    private void requireSameSet(Flag other, String operation) throws FlagException {
        Objects.requireNonNull(other, "Flag cannot be null");
        if (other.flagSet != flagSet) {
            throw new FlagException(ErrorType.TYPE_MISMATCH, other.name,
                    "Cannot " + operation + " " + flagSet.getName() + "." + name
                            + " with " + other.flagSet.getName() + "." + other.name);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Flag that = (Flag) obj;
        return flagSet == that.flagSet && value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    /**
     * Declared flags render as {@code Type.name(value)}; any other instance renders as the
     * declared flags it covers, joined with {@code " | "} in declaration order.
     */
    @Override
    public String toString() {
        if (isDeclared()) {
            return display();
        }
        var joiner = new StringJoiner(Constants.DISPLAY_SEPARATOR);
        for (var declared : flagSet) {
            if ((declared.value & value) != 0) {
                joiner.add(declared.display());
            }
        }
        return joiner.length() == 0 ? display() : joiner.toString();
    }

    private String display() {
        return flagSet.getName() + "." + name + "(" + value + ")";
    }
}
