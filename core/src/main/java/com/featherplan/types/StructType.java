package com.featherplan.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Name-based rendering of a plan's output attributes, used for display and
 * diagnostics. Renders as {@code struct<a:integer,b:string>}.
 */
public final class StructType implements DataType {

    private final List<StructField> fields;

    public StructType(List<StructField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
    }

    public List<StructField> fields() {
        return fields;
    }

    @Override
    public String typeName() {
        return fields.stream()
            .map(field -> field.name() + ":" + field.dataType().typeName())
            .collect(Collectors.joining(",", "struct<", ">"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType)) return false;
        return fields.equals(((StructType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
