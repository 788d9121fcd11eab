// PointAttributeSet.java

package com.openathena.insar.cloud;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ArrayList;

/**
 * Named per-point values, index aligned with the points of a cloud.  Names
 * keep their insertion order.  Every attribute holds exactly {@link #size()}
 * values; this is checked once, when the set is built.
 */
public final class PointAttributeSet
{
    public static final String DEFORMATION = "deformation";
    public static final String COHERENCE = "coherence";

    private final int size;
    private final Map<String, double[]> attributes;

    private PointAttributeSet(int size, Map<String, double[]> attributes)
    {
        for (Map.Entry<String, double[]> e : attributes.entrySet()) {
            if (e.getValue().length != size) {
                throw new IllegalArgumentException("Attribute '" + e.getKey() + "' has " + e.getValue().length
                                                   + " values, expected " + size);
            }
        }
        this.size = size;
        this.attributes = attributes;
    }

    public static PointAttributeSet empty(int size)
    {
        return new PointAttributeSet(size, new LinkedHashMap<>());
    }

    public static Builder builder(int size)
    {
        return new Builder(size);
    }

    /** Number of points every attribute covers. */
    public int size() { return size; }

    public List<String> names()
    {
        return Collections.unmodifiableList(new ArrayList<>(attributes.keySet()));
    }

    public boolean contains(String name)
    {
        return attributes.containsKey(name);
    }

    public double get(String name, int index)
    {
        return require(name)[index];
    }

    /** Copy of the values of one attribute. */
    public double[] values(String name)
    {
        double[] v = require(name);
        return Arrays.copyOf(v, v.length);
    }

    /** New set with one more attribute appended after the existing ones. */
    public PointAttributeSet with(String name, double[] values)
    {
        Builder b = new Builder(size);
        for (Map.Entry<String, double[]> e : attributes.entrySet()) {
            b.put(e.getKey(), e.getValue());
        }
        return b.put(name, values).build();
    }

    private double[] require(String name)
    {
        double[] v = attributes.get(name);
        if (v == null) throw new IllegalArgumentException("No attribute named '" + name + "'");
        return v;
    }

    public static final class Builder
    {
        private final int size;
        private final Map<String, double[]> attributes = new LinkedHashMap<>();

        private Builder(int size)
        {
            if (size < 0) throw new IllegalArgumentException("Negative point count " + size);
            this.size = size;
        }

        public Builder put(String name, double[] values)
        {
            if (name == null || name.isEmpty()) throw new IllegalArgumentException("Attribute name is empty");
            if (attributes.containsKey(name)) throw new IllegalArgumentException("Duplicate attribute '" + name + "'");
            attributes.put(name, Arrays.copyOf(values, values.length));
            return this;
        }

        public PointAttributeSet build()
        {
            return new PointAttributeSet(size, new LinkedHashMap<>(attributes));
        }
    }
}
