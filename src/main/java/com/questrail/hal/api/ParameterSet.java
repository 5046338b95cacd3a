package com.questrail.hal.api;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ParameterSet
 * -----------------------------------------------------------------------------
 * A named, hierarchical configuration bag.
 *
 * <h2>Structure</h2>
 * Each entry maps a key to either an immutable scalar ({@link String},
 * {@link Boolean}, or one of the boxed or {@code java.math} number types) or a
 * nested {@code ParameterSet}. Mutable numbers such as {@code AtomicInteger}
 * are rejected. The
 * settings of a whole application are one tree whose top-level children are
 * keyed by module name, so a camera finds its own settings with
 * {@code settings.get(cameraName)}.
 * <p>
 * Lookups accept dotted paths: {@code get("cam1.roi")} descends through
 * {@code cam1} into {@code roi}.
 *
 * <h2>Copy semantics</h2>
 * {@link #copy()} is deep. A copy shares no mutable structure with its source,
 * so a snapshot handed to another module is unaffected by later changes to the
 * live set (and vice versa).
 *
 * <h2>Threading</h2>
 * Not thread-safe. A set is owned by one component at a time; hand out copies.
 */
public final class ParameterSet
{
    private static final Set<Class<?>> NUMBER_TYPES = Set.of(
            Byte.class, Short.class, Integer.class, Long.class,
            Float.class, Double.class, BigInteger.class, BigDecimal.class);

    private final String name;
    private final Map<String, Object> entries = new LinkedHashMap<>();

    public ParameterSet(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /**
     * Returns the keys of this level only, in insertion order.
     */
    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * Adds (or replaces) a child set under its own name.
     *
     * @return this set, for chaining
     */
    public ParameterSet add(ParameterSet child) {
        Objects.requireNonNull(child, "child");
        entries.put(child.name(), child);
        return this;
    }

    /**
     * Sets a scalar value. Intermediate levels of a dotted path must exist.
     *
     * @return this set, for chaining
     * @throws IllegalArgumentException if the value is not an immutable scalar
     *                                  or a sub-tree
     */
    public ParameterSet set(String path, Object value) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String || NUMBER_TYPES.contains(value.getClass())
                || value instanceof Boolean || value instanceof ParameterSet)) {
            throw new IllegalArgumentException(
                    "Unsupported parameter value type: " + value.getClass().getName());
        }

        int dot = path.lastIndexOf('.');
        ParameterSet parent = dot < 0 ? this : get(path.substring(0, dot));
        parent.entries.put(path.substring(dot + 1), value);
        return this;
    }

    /**
     * Returns the sub-tree at {@code path}.
     *
     * @throws UnknownParameterException if the path does not exist or does not
     *                                   name a sub-tree
     */
    public ParameterSet get(String path) {
        Object value = lookup(path);
        if (value instanceof ParameterSet child) {
            return child;
        }
        throw new UnknownParameterException(name, path);
    }

    /**
     * Returns the raw value at {@code path} (a scalar or a sub-tree).
     *
     * @throws UnknownParameterException if the path does not exist
     */
    public Object getValue(String path) {
        return lookup(path);
    }

    public <T> T getValue(String path, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object value = lookup(path);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Parameter '" + path + "' is a "
                    + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public boolean has(String path) {
        try {
            lookup(path);
            return true;
        } catch (UnknownParameterException e) {
            return false;
        }
    }

    /**
     * Returns a deep, independent copy of this set.
     */
    public ParameterSet copy() {
        ParameterSet copy = new ParameterSet(name);
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            Object v = e.getValue();
            copy.entries.put(e.getKey(), v instanceof ParameterSet child ? child.copy() : v);
        }
        return copy;
    }

    private Object lookup(String path) {
        Objects.requireNonNull(path, "path");

        ParameterSet level = this;
        String[] parts = path.split("\\.");
        for (int i = 0; i < parts.length; i++) {
            Object value = level.entries.get(parts[i]);
            if (value == null) {
                throw new UnknownParameterException(name, path);
            }
            if (i == parts.length - 1) {
                return value;
            }
            if (!(value instanceof ParameterSet child)) {
                throw new UnknownParameterException(name, path);
            }
            level = child;
        }
        // Path made only of separators.
        throw new UnknownParameterException(name, path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterSet that)) return false;
        return name.equals(that.name) && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entries);
    }

    @Override
    public String toString() {
        return name + entries;
    }
}
