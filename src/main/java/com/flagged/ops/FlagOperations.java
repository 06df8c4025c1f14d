package com.flagged.ops;

import com.flagged.core.Flag;
import com.flagged.core.FlagSet;
import com.flagged.error.ErrorType;
import com.flagged.error.FlagException;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Free functions over flags: reductions, decomposition and resolution of raw values.
 * Every result is a canonical instance of the owning {@link FlagSet}.
 */
@UtilityClass
public class FlagOperations {

    public static Flag union(Flag... flags) throws FlagException {
        return union(Arrays.asList(flags));
    }

    /**
     * OR-reduces {@code flags} from left to right.
     *
     * @throws FlagException {@link ErrorType#ILLEGAL_FLAG_VALUE} if {@code flags} is empty,
     *                       {@link ErrorType#TYPE_MISMATCH} if the flags belong to different sets
     */
    public static Flag union(Iterable<Flag> flags) throws FlagException {
        Flag result = null;
        for (var flag : flags) {
            Objects.requireNonNull(flag, "Flag cannot be null");
            result = result == null ? flag : result.or(flag);
        }
        if (result == null) {
            throw new FlagException(ErrorType.ILLEGAL_FLAG_VALUE, "Cannot take the union of no flags");
        }
        return result;
    }

    /**
     * @return the declared flags whose bits are set in {@code flag}, in declaration order
     */
    public static List<Flag> decompose(Flag flag) {
        var parts = new ArrayList<Flag>();
        for (var declared : flag.getFlagSet()) {
            if ((declared.getValue() & flag.getValue()) != 0) {
                parts.add(declared);
            }
        }
        return parts;
    }

    public static Flag fromNames(FlagSet flagSet, String... names) throws FlagException {
        var flags = new ArrayList<Flag>(names.length);
        for (var name : names) {
            flags.add(flagSet.getByName(name));
        }
        return union(flags);
    }

    /**
     * Resolves an arbitrary value to its canonical instance, interning the union of the covering
     * declared flags if the value has not been seen yet.
     *
     * @throws FlagException {@link ErrorType#ILLEGAL_FLAG_VALUE} if {@code value} has bits no
     *                       declared flag covers
     */
    public static Flag fromValue(FlagSet flagSet, long value) throws FlagException {
        var existing = flagSet.findByValue(value);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (value < 0 || (value & ~flagSet.mask()) != 0) {
            throw new FlagException(ErrorType.ILLEGAL_FLAG_VALUE,
                    "Value " + value + " has bits outside " + flagSet.getName()
                            + " (mask 0x" + Long.toHexString(flagSet.mask()) + ")");
        }
        var parts = new ArrayList<Flag>();
        long covered = 0;
        for (var declared : flagSet) {
            if (declared.getValue() != 0 && (declared.getValue() & value) == declared.getValue()) {
                parts.add(declared);
                covered |= declared.getValue();
            }
        }
        // nothing is interned unless the whole value resolves
        if (parts.isEmpty() || covered != value) {
            throw new FlagException(ErrorType.ILLEGAL_FLAG_VALUE,
                    "Value " + value + " is not a union of declared flags of " + flagSet.getName());
        }
        return union(parts);
    }
}
