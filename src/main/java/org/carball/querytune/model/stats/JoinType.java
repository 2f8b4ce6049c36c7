package org.carball.querytune.model.stats;

import java.util.Locale;

public enum JoinType {
    INNER,
    LEFT,
    RIGHT;

    public static JoinType detect(String joinClause) {
        String upper = joinClause.toUpperCase(Locale.ROOT);
        if (upper.contains("LEFT JOIN") || upper.contains("LEFT OUTER JOIN")) {
            return LEFT;
        }
        if (upper.contains("RIGHT JOIN") || upper.contains("RIGHT OUTER JOIN")) {
            return RIGHT;
        }
        return INNER;
    }
}
