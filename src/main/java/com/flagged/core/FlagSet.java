package com.flagged.core;

import com.flagged.error.ErrorType;
import com.flagged.error.FlagException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A named collection of bit-disjoint flags.
 * <p>
 * The declared flags are fixed when the set is built and are pairwise disjoint. The set also
 * keeps every combination produced by {@link Flag#or(Flag)}, keyed by value, so that each value
 * has one canonical {@link Flag} instance. That collection only ever grows.
 * <p>
 * Usage:
 * <pre>
 *   var flags = FlagSet.builder("MyEnum")
 *       .flag("read_only", 1)
 *       .flag("lowercase", 2)
 *       .auto("immediate")          // lowest free bit: 4
 *       .build();
 *   var readOnly = flags.get("read_only");
 *   var combined = readOnly.or(flags.get("lowercase"));   // value 3, interned
 * </pre>
 * Iteration yields the declared flags only, in declaration order.
 */
@Slf4j
public final class FlagSet implements Iterable<Flag> {

    /** Marker requesting an automatically assigned value, see {@link FlagSetBuilder#declare}. */
    public enum Marker { AUTO }

    public static final Marker AUTO = Marker.AUTO;

    @Getter
    private final String name;
    private final List<Flag> declared;
    private final Map<String, Flag> byName;
    private final long mask;

    // guarded by itself; insertion order is creation order
    private final Map<Long, Flag> all = new LinkedHashMap<>();

    FlagSet(String name, Map<String, Long> resolved) {
        this.name = name;
        var flags = new ArrayList<Flag>(resolved.size());
        var names = new LinkedHashMap<String, Flag>();
        long union = 0;
        for (var entry : resolved.entrySet()) {
            var flag = new Flag(this, entry.getKey(), entry.getValue());
            flags.add(flag);
            names.put(flag.getName(), flag);
            all.put(flag.getValue(), flag);
            union |= flag.getValue();
        }
        this.declared = Collections.unmodifiableList(flags);
        this.byName = Collections.unmodifiableMap(names);
        this.mask = union;
    }

    public static FlagSetBuilder builder(String name) {
        return new FlagSetBuilder(name);
    }

    @Override
    public Iterator<Flag> iterator() {
        return declared.iterator();
    }

    public Stream<Flag> stream() {
        return declared.stream();
    }

    public List<Flag> declared() {
        return declared;
    }

    /**
     * @return snapshot of every instance created under this set, declared flags first,
     *         then interned combinations in creation order
     */
    public List<Flag> all() {
        synchronized (all) {
            return List.copyOf(all.values());
        }
    }

    public int size() {
        return declared.size();
    }

    /**
     * @return union of all declared values
     */
    public long mask() {
        return mask;
    }

    public Flag get(String flagName) throws FlagException {
        return getByName(flagName);
    }

    public Flag getByName(String flagName) throws FlagException {
        var flag = byName.get(flagName);
        if (flag == null) {
            throw new FlagException(ErrorType.FLAG_NOT_FOUND, flagName,
                    "No declared flag with name " + flagName + " in " + name);
        }
        return flag;
    }

    /**
     * Looks up the declared flag or previously interned combination carrying exactly {@code value}.
     */
    public Flag getByValue(long value) throws FlagException {
        return findByValue(value).orElseThrow(() -> new FlagException(ErrorType.FLAG_NOT_FOUND,
                "No flag with value (" + value + ") in " + name));
    }

    public Optional<Flag> findByName(String flagName) {
        return Optional.ofNullable(byName.get(flagName));
    }

    public Optional<Flag> findByValue(long value) {
        synchronized (all) {
            return Optional.ofNullable(all.get(value));
        }
    }

    /**
     * @return true if {@code flag} belongs to this set and its value has been declared or interned here
     */
    public boolean contains(Flag flag) {
        if (flag == null || flag.getFlagSet() != this) {
            return false;
        }
        synchronized (all) {
            return all.containsKey(flag.getValue());
        }
    }

    boolean isDeclared(Flag flag) {
        return flag.getFlagSet() == this && byName.get(flag.getName()) == flag;
    }

    /**
     * Returns the canonical instance for {@code value}, registering a new one named
     * {@code candidateName} if none exists yet. Check and insert happen under one lock.
     */
    Flag intern(long value, String candidateName) {
        synchronized (all) {
            var existing = all.get(value);
            if (existing != null) {
                return existing;
            }
            var flag = new Flag(this, candidateName, value);
            all.put(value, flag);
            log.debug("Interned {}.{} ({})", name, candidateName, value);
            return flag;
        }
    }

    @Override
    public String toString() {
        return name + declared.stream().map(Flag::getName).collect(Collectors.toList());
    }
}
