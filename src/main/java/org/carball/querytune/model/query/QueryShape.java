package org.carball.querytune.model.query;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Clause-level structure of a statement as found by keyword search.
 */
public record QueryShape(
        List<String> whereConditions,
        List<String> joinConditions,
        List<String> orderByColumns,
        List<String> selectColumns,
        List<String> fromTables,
        List<String> groupByColumns,
        Map<String, String> tableAliases,
        String fingerprint
) {

    public static final QueryShape EMPTY = new QueryShape(
            List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), Map.of(), "");

    public QueryShape {
        whereConditions = List.copyOf(whereConditions);
        joinConditions = List.copyOf(joinConditions);
        orderByColumns = List.copyOf(orderByColumns);
        selectColumns = List.copyOf(selectColumns);
        fromTables = List.copyOf(fromTables);
        groupByColumns = List.copyOf(groupByColumns);
        tableAliases = Map.copyOf(tableAliases);
    }

    public boolean hasJoins() {
        return !joinConditions.isEmpty();
    }

    public boolean hasOrderBy() {
        return !orderByColumns.isEmpty();
    }

    public boolean hasGroupBy() {
        return !groupByColumns.isEmpty();
    }

    /**
     * Resolves an alias or table name to the table it stands for; unknown names resolve to themselves.
     */
    public String resolveTable(String nameOrAlias) {
        return tableAliases.getOrDefault(nameOrAlias.toLowerCase(Locale.ROOT), nameOrAlias);
    }
}
