package org.carball.querytune.model.query;

import java.util.Locale;

public enum QueryType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    OTHER;

    /**
     * Classifies a statement by its leading keyword.
     */
    public static QueryType fromQuery(String query) {
        if (query == null) {
            return OTHER;
        }
        String upper = query.trim().toUpperCase(Locale.ROOT);
        for (QueryType type : values()) {
            if (type != OTHER && upper.startsWith(type.name())) {
                return type;
            }
        }
        return OTHER;
    }
}
