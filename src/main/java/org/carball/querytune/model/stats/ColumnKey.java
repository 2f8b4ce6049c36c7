package org.carball.querytune.model.stats;

/**
 * Identity of a tracked column. The table is {@value #UNKNOWN_TABLE} when the column carried no qualifier.
 */
public record ColumnKey(String table, String column) {

    public static final String UNKNOWN_TABLE = "unknown";

    public static ColumnKey unqualified(String column) {
        return new ColumnKey(UNKNOWN_TABLE, column);
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
