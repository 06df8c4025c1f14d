package com.flagged.core;

import com.flagged.Constants;
import com.flagged.error.ErrorType;
import com.flagged.error.FlagException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ordered declaration of the flags of one {@link FlagSet}.
 * <p>
 * Declarations are validated lazily by {@link #build()}, which resolves values in two passes:
 * literal values first, in declaration order, then auto markers in declaration order against the
 * union of every literal. The resulting flags keep declaration order either way.
 * <p>
 * Names starting with {@code _} and behavioural values (runnables, callables and the
 * {@code java.util.function} types) are not flags and are skipped.
 */
@Slf4j
public final class FlagSetBuilder {
    private final String name;
    private final List<Declaration> declarations = new ArrayList<>();
    private LongFunction<? extends FlagValueGenerator> generatorFactory = LowestFreeBitGenerator::new;

    @Value
    static class Declaration {
        String name;
        Object value;

        boolean isAuto() {
            return value == FlagSet.AUTO;
        }
    }

    FlagSetBuilder(String name) {
        this.name = Objects.requireNonNull(name, "FlagSet name cannot be null");
    }

    public FlagSetBuilder flag(String flagName, long value) {
        return declare(flagName, value);
    }

    public FlagSetBuilder auto(String flagName) {
        return declare(flagName, FlagSet.AUTO);
    }

    /**
     * Declares a raw entry. {@link FlagSet#AUTO} requests a generated value; integral numbers are
     * literals; anything else fails the build with {@link ErrorType#ILLEGAL_FLAG_VALUE}.
     */
    public FlagSetBuilder declare(String flagName, Object value) {
        declarations.add(new Declaration(flagName, value));
        return this;
    }

    /**
     * Replaces the generator used for auto markers. The factory receives the union of all
     * literal values.
     */
    public FlagSetBuilder valueGenerator(LongFunction<? extends FlagValueGenerator> factory) {
        this.generatorFactory = Objects.requireNonNull(factory, "Generator factory cannot be null");
        return this;
    }

    public FlagSet build() throws FlagException {
        var accepted = new ArrayList<Declaration>(declarations.size());
        var names = new HashSet<String>();
        for (var declaration : declarations) {
            if (isSkipped(declaration)) {
                log.debug("Skipping {}.{}: not a flag declaration", name, declaration.getName());
                continue;
            }
            validateName(declaration.getName());
            if (!names.add(declaration.getName())) {
                throw new FlagException(ErrorType.DUPLICATE_FLAG_NAME, declaration.getName(),
                        "Flag " + declaration.getName() + " is declared more than once in " + name);
            }
            accepted.add(declaration);
        }

        // literal pass
        var values = new LinkedHashMap<String, Long>();
        long reserved = 0;
        boolean zeroTaken = false;
        for (var declaration : accepted) {
            if (declaration.isAuto()) {
                values.put(declaration.getName(), null);
                continue;
            }
            long value = toFlagValue(declaration);
            if ((reserved & value) != 0 || (value == 0 && zeroTaken)) {
                throw repeated(declaration.getName(), value);
            }
            reserved |= value;
            zeroTaken |= value == 0;
            values.put(declaration.getName(), value);
        }

        // auto pass
        var generator = generatorFactory.apply(reserved);
        for (var declaration : accepted) {
            if (!declaration.isAuto()) {
                continue;
            }
            long value = generator.next();
            if (value <= 0 || (reserved & value) != 0) {
                throw repeated(declaration.getName(), value);
            }
            reserved |= value;
            values.put(declaration.getName(), value);
        }

        var flagSet = new FlagSet(name, values);
        log.debug("Built flag set {} with {} flags, reserved 0x{}", name, flagSet.size(),
                Long.toHexString(generator.reserved()));
        return flagSet;
    }

    private static boolean isSkipped(Declaration declaration) {
        var flagName = declaration.getName();
        if (flagName != null && flagName.startsWith(Constants.PRIVATE_NAME_PREFIX)) {
            return true;
        }
        var value = declaration.getValue();
        return value instanceof Runnable
                || value instanceof Callable
                || value instanceof Supplier
                || value instanceof Function
                || value instanceof BiFunction
                || value instanceof Consumer
                || value instanceof BiConsumer
                || value instanceof Predicate
                || value instanceof BiPredicate;
    }

    private void validateName(String flagName) throws FlagException {
        if (flagName == null || flagName.isEmpty()) {
            throw new FlagException(ErrorType.INVALID_FLAG_NAME, flagName, "Flag name cannot be empty in " + name);
        }
        if (flagName.contains(Constants.COMBINED_NAME_SEPARATOR)) {
            throw new FlagException(ErrorType.INVALID_FLAG_NAME, flagName,
                    "Flag name " + flagName + " contains reserved separator '" + Constants.COMBINED_NAME_SEPARATOR + "'");
        }
    }

    private static long toFlagValue(Declaration declaration) throws FlagException {
        var value = declaration.getValue();
        long result;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            result = ((Number) value).longValue();
        } else if (value instanceof BigInteger && ((BigInteger) value).bitLength() < Long.SIZE) {
            result = ((BigInteger) value).longValue();
        } else {
            throw illegal(declaration);
        }
        if (result < 0) {
            throw illegal(declaration);
        }
        return result;
    }

    private static FlagException illegal(Declaration declaration) {
        return new FlagException(ErrorType.ILLEGAL_FLAG_VALUE, declaration.getName(),
                declaration.getValue() + " is not legal flag value for " + declaration.getName());
    }

    private FlagException repeated(String flagName, long value) {
        return new FlagException(ErrorType.REPEATED_FLAG_VALUE, flagName,
                "Flag " + flagName + " (" + value + ") overlaps another flag of " + name);
    }
}
