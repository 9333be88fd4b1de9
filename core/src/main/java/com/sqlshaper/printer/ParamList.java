package com.sqlshaper.printer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameter values collected while rendering, in the shape the parameter style needs.
 *
 * <p>With {@link ParameterStyle#NAMED} values are keyed by name, one entry per distinct
 * name in first-occurrence order. With the other styles there is one value per
 * placeholder occurrence, in output order. Values may be null when a parameter was
 * never bound.
 */
public final class ParamList {

    private final boolean named;
    private final List<Object> values;
    private final Map<String, Object> byName;

    private ParamList(boolean named, List<Object> values, Map<String, Object> byName) {
        this.named = named;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    static ParamList positional(List<Object> values) {
        return new ParamList(false, values, Map.of());
    }

    static ParamList named(Map<String, Object> byName) {
        return new ParamList(true, new ArrayList<>(byName.values()), byName);
    }

    public boolean isNamed() {
        return named;
    }

    /**
     * Returns the values in output order.
     */
    public List<Object> values() {
        return values;
    }

    /**
     * Returns the values keyed by parameter name; empty unless {@link #isNamed()}.
     */
    public Map<String, Object> asMap() {
        return byName;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns the value at a 0-based output position.
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Returns the value bound to a name.
     *
     * @throws IllegalArgumentException if no parameter with that name was rendered
     */
    public Object get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!byName.containsKey(name)) {
            throw new IllegalArgumentException("Parameter not found: " + name);
        }
        return byName.get(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ParamList other)) {
            return false;
        }
        return named == other.named && values.equals(other.values) && byName.equals(other.byName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(named, values, byName);
    }

    @Override
    public String toString() {
        return named ? byName.toString() : values.toString();
    }
}
