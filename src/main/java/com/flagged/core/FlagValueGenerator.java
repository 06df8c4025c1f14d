package com.flagged.core;

import com.flagged.error.FlagException;

/**
 * Supplies values for flags declared with an auto marker.
 * A generator is created per build, seeded with the bits already claimed by literal flags.
 */
public interface FlagValueGenerator {
    /**
     * @return the next value, disjoint from every reserved bit and every value returned so far
     * @throws FlagException if no value can be produced
     */
    long next() throws FlagException;

    /**
     * @return the union of the seed mask and every value returned so far
     */
    long reserved();
}
