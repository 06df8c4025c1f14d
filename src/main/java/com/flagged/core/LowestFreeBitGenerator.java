package com.flagged.core;

import com.flagged.Constants;
import com.flagged.error.ErrorType;
import com.flagged.error.FlagException;

/**
 * Default {@link FlagValueGenerator}: hands out the lowest bit not yet reserved.
 * Successive calls return strictly increasing powers of two.
 */
public final class LowestFreeBitGenerator implements FlagValueGenerator {
    private long reserved;

    public LowestFreeBitGenerator(long reserved) {
        this.reserved = reserved;
    }

    @Override
    public long next() throws FlagException {
        long free = ~reserved & Constants.USABLE_MASK;
        if (free == 0) {
            throw new FlagException(ErrorType.FLAG_SPACE_EXHAUSTED,
                    "All " + Constants.USABLE_BITS + " flag bits are reserved");
        }
        long next = Long.lowestOneBit(free);
        reserved |= next;
        return next;
    }

    @Override
    public long reserved() {
        return reserved;
    }
}
