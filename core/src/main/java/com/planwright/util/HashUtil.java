package com.planwright.util;

import java.util.Collection;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Deterministic 64-bit hashing helpers for plan and expression trees.
 *
 * <p>Plan hashes are used as plan cache keys and may be computed in different
 * processes (planner and executor), so nothing here may depend on object
 * identity. In particular enum constants are hashed by name rather than by
 * {@link Enum#hashCode()}.
 *
 * <p>Typical usage:
 * <pre>
 *   long h = HashUtil.hash(getPlanNodeType());
 *   h = HashUtil.combine(h, tableOid.value());
 *   h = HashUtil.combineAll(h, columnOids, oid -&gt; oid.value());
 * </pre>
 */
public final class HashUtil {

    /** Hash folded in for an absent optional value (e.g. a scan with no predicate). */
    public static final long ABSENT = 0x5bd1e995_9e3779b9L;

    private static final long GOLDEN = 0x9e3779b97f4a7c15L;

    private HashUtil() {}

    /**
     * Mixes a 64-bit value (murmur3 finalizer).
     *
     * @param value the value to mix
     * @return the mixed hash
     */
    public static long hash(long value) {
        long h = value;
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return h;
    }

    public static long hash(boolean value) {
        return hash(value ? 1231L : 1237L);
    }

    public static long hash(double value) {
        return hash(Double.doubleToLongBits(value));
    }

    /**
     * Hashes a string. {@link String#hashCode()} is specified by the JLS and
     * therefore stable across JVMs; the result is widened by mixing in the length.
     *
     * @param value the string (may be null)
     * @return the hash
     */
    public static long hash(String value) {
        if (value == null) {
            return ABSENT;
        }
        return hash(((long) value.length() << 32) | (value.hashCode() & 0xffffffffL));
    }

    /**
     * Hashes an enum constant by its name.
     *
     * @param value the constant
     * @return the hash
     */
    public static long hash(Enum<?> value) {
        return hash(value.getClass().getSimpleName() + "." + value.name());
    }

    /**
     * Combines an accumulated hash with another value. Order-sensitive.
     *
     * @param seed the accumulated hash
     * @param value the value to fold in
     * @return the combined hash
     */
    public static long combine(long seed, long value) {
        return seed ^ (hash(value) + GOLDEN + (seed << 6) + (seed >>> 2));
    }

    /**
     * Folds every element of an ordered collection into the seed, in iteration order.
     *
     * @param seed the accumulated hash
     * @param values the values
     * @param hasher element hash function
     * @param <T> element type
     * @return the combined hash
     */
    public static <T> long combineAll(long seed, Collection<? extends T> values, ToLongFunction<? super T> hasher) {
        long h = combine(seed, values.size());
        for (T value : values) {
            h = combine(h, hasher.applyAsLong(value));
        }
        return h;
    }

    /**
     * Folds an optional value into the seed, using {@link #ABSENT} when empty.
     *
     * @param seed the accumulated hash
     * @param value the optional value
     * @param hasher hash function for the present case
     * @param <T> value type
     * @return the combined hash
     */
    public static <T> long combineOptional(long seed, Optional<? extends T> value, ToLongFunction<? super T> hasher) {
        if (value.isEmpty()) {
            return combine(seed, ABSENT);
        }
        // present values get a tag before the value itself
        return combine(combine(seed, 1L), hasher.applyAsLong(value.get()));
    }
}
