package com.sparkify.rowset;

import java.util.Objects;

/**
 * One output column of a projection: a source column, optionally renamed.
 */
public final class Projection {

    private final String source;
    private final String alias;

    private Projection(String source, String alias) {
        this.source = Objects.requireNonNull(source, "source");
        this.alias = Objects.requireNonNull(alias, "alias");
    }

    public static Projection col(String name) {
        return new Projection(name, name);
    }

    public Projection as(String newName) {
        return new Projection(source, newName);
    }

    public static Projection[] cols(String... names) {
        Projection[] projections = new Projection[names.length];
        for (int i = 0; i < names.length; i++) {
            projections[i] = col(names[i]);
        }
        return projections;
    }

    public String getSource() {
        return source;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public String toString() {
        return source.equals(alias) ? source : source + " as " + alias;
    }
}
