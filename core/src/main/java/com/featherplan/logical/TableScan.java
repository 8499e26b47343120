package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import com.featherplan.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a table scan, the leaf that analysis produces
 * for every table a query reads.
 *
 * <p>Each scan owns fresh attributes: scanning the same table twice (a
 * self-join) yields two scans whose columns share names but not identities.
 */
public final class TableScan extends LogicalPlan {

    private final String tableName;
    private final List<AttributeReference> output;

    /**
     * Creates a table scan node.
     *
     * @param tableName the table being read
     * @param output the resolved columns of the table
     */
    public TableScan(String tableName, List<AttributeReference> output) {
        super(); // No children
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.output = List.copyOf(Objects.requireNonNull(output, "output must not be null"));
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (!newChildren.isEmpty()) {
            throw new IllegalArgumentException("TableScan has no children");
        }
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableScan)) return false;
        TableScan that = (TableScan) obj;
        return tableName.equals(that.tableName) && output.equals(that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, output);
    }

    @Override
    public String toString() {
        return String.format("TableScan %s %s", tableName, output);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a scan whose columns are qualified with the table name and get
     * fresh identities.
     *
     * @param tableName the table name
     * @param columns alternating column names and {@link DataType}s
     * @return the table scan
     */
    public static TableScan of(String tableName, Object... columns) {
        if (columns.length % 2 != 0) {
            throw new IllegalArgumentException("columns must be name/type pairs");
        }
        List<AttributeReference> output = new ArrayList<>();
        for (int i = 0; i < columns.length; i += 2) {
            output.add(AttributeReference.qualified(
                tableName, (String) columns[i], (DataType) columns[i + 1]));
        }
        return new TableScan(tableName, output);
    }
}
