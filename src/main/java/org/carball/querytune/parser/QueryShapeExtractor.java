package org.carball.querytune.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.query.QueryShape;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-search statement splitter. Clause boundaries come from the positions of the clause keywords:
 * a clause runs from its keyword to the nearest keyword after it, or to the end of the text.
 * Parentheses, string literals and subqueries are not understood; they only make the result poorer.
 */
@Slf4j
public class QueryShapeExtractor implements QueryShapeParser {

    private static final Pattern CLAUSE_KEYWORD_PATTERN = Pattern.compile(
            "\\b(SELECT|FROM|WHERE|JOIN|ORDER\\s+BY|GROUP\\s+BY|HAVING|LIMIT)\\b",
            Pattern.CASE_INSENSITIVE
    );

    // Modifiers directly in front of JOIN belong to the join clause, not to the clause before it
    private static final Pattern JOIN_MODIFIER_PATTERN = Pattern.compile(
            "(?:\\b(?:LEFT|RIGHT|INNER|OUTER|FULL|CROSS)\\s+)+$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern CONDITION_SPLIT_PATTERN = Pattern.compile(
            "\\s+(?:AND|OR)\\s+",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LOGICAL_OPERATOR_PATTERN = Pattern.compile(
            "\\b(?:AND|OR)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern JOIN_KEYWORD_PATTERN = Pattern.compile("\\bJOIN\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern ON_PATTERN = Pattern.compile("\\bON\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern TABLE_ITEM_PATTERN = Pattern.compile(
            "^([\\w.\\[\\]`\"]+)(?:\\s+(?:AS\\s+)?([A-Za-z_]\\w*))?",
            Pattern.CASE_INSENSITIVE
    );

    private static final Set<String> RESERVED_ALIASES = Set.of(
            "ON", "USING", "WHERE", "LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "JOIN");

    @Override
    public QueryShape extract(String query) {
        if (query == null || query.isBlank()) {
            log.debug("Empty statement text, returning empty shape");
            return QueryShape.EMPTY;
        }

        List<ClauseMarker> markers = findClauseMarkers(query);

        List<String> selectColumns = splitOnCommas(firstClauseBody(query, markers, "SELECT"));
        String fromBody = firstClauseBody(query, markers, "FROM");
        List<String> fromItems = splitOnCommas(fromBody);
        String whereBody = firstClauseBody(query, markers, "WHERE");
        List<String> whereConditions = splitConditions(whereBody);
        List<String> orderByColumns = splitOnCommas(firstClauseBody(query, markers, "ORDER BY"));
        List<String> groupByColumns = splitOnCommas(firstClauseBody(query, markers, "GROUP BY"));
        List<String> joinConditions = extractJoinClauses(query, markers);

        Map<String, String> aliases = new HashMap<>();
        List<String> fromTables = new ArrayList<>();
        for (String item : fromItems) {
            String table = registerTableItem(item, aliases);
            if (table != null) {
                fromTables.add(table);
            }
        }
        for (String joinClause : joinConditions) {
            registerTableItem(joinTarget(joinClause), aliases);
        }

        String fingerprint = buildFingerprint(query, markers, joinConditions);

        QueryShape shape = new QueryShape(whereConditions, joinConditions, orderByColumns, selectColumns,
                fromTables, groupByColumns, aliases, fingerprint);
        log.debug("Extracted shape {} from statement of {} chars", fingerprint, query.length());
        return shape;
    }

    private List<ClauseMarker> findClauseMarkers(String query) {
        List<ClauseMarker> markers = new ArrayList<>();
        Matcher matcher = CLAUSE_KEYWORD_PATTERN.matcher(query);
        while (matcher.find()) {
            String keyword = matcher.group(1).toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
            int start = matcher.start();
            if (keyword.equals("JOIN")) {
                start = joinClauseStart(query, start);
            }
            markers.add(new ClauseMarker(keyword, start, matcher.end()));
        }
        return markers;
    }

    private int joinClauseStart(String query, int joinKeywordStart) {
        Matcher modifier = JOIN_MODIFIER_PATTERN.matcher(query.substring(0, joinKeywordStart));
        return modifier.find() ? modifier.start() : joinKeywordStart;
    }

    /**
     * Body of the first clause opened by {@code keyword}, or empty text when the keyword is absent.
     */
    private String firstClauseBody(String query, List<ClauseMarker> markers, String keyword) {
        for (int i = 0; i < markers.size(); i++) {
            ClauseMarker marker = markers.get(i);
            if (marker.keyword().equals(keyword)) {
                return query.substring(marker.bodyStart(), clauseEnd(query, markers, i)).trim();
            }
        }
        return "";
    }

    private int clauseEnd(String query, List<ClauseMarker> markers, int index) {
        int bodyStart = markers.get(index).bodyStart();
        int end = query.length();
        for (int j = index + 1; j < markers.size(); j++) {
            int candidate = markers.get(j).start();
            if (candidate >= bodyStart && candidate < end) {
                end = candidate;
            }
        }
        return end;
    }

    private List<String> extractJoinClauses(String query, List<ClauseMarker> markers) {
        List<String> joins = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            ClauseMarker marker = markers.get(i);
            if (marker.keyword().equals("JOIN")) {
                String clause = stripTerminator(query.substring(marker.start(), clauseEnd(query, markers, i)).trim());
                if (!clause.isEmpty()) {
                    joins.add(clause);
                }
            }
        }
        return joins;
    }

    /**
     * Table item of a join clause: the text between JOIN and ON.
     */
    public static String joinTarget(String joinClause) {
        Matcher joinKeyword = JOIN_KEYWORD_PATTERN.matcher(joinClause);
        if (!joinKeyword.find()) {
            return "";
        }
        String rest = joinClause.substring(joinKeyword.end());
        Matcher on = ON_PATTERN.matcher(rest);
        return (on.find() ? rest.substring(0, on.start()) : rest).trim();
    }

    /**
     * Condition part of a join clause: the text after ON, or empty text for joins without one.
     */
    public static String joinCondition(String joinClause) {
        Matcher on = ON_PATTERN.matcher(joinClause);
        return on.find() ? joinClause.substring(on.end()).trim() : "";
    }

    private String registerTableItem(String item, Map<String, String> aliases) {
        Matcher matcher = TABLE_ITEM_PATTERN.matcher(item.trim());
        if (!matcher.find()) {
            return null;
        }
        String table = stripTerminator(matcher.group(1));
        if (table.isEmpty()) {
            return null;
        }
        String alias = matcher.group(2);
        if (alias != null && !RESERVED_ALIASES.contains(alias.toUpperCase(Locale.ROOT))) {
            aliases.put(alias.toLowerCase(Locale.ROOT), table);
        }
        return table;
    }

    private List<String> splitConditions(String whereBody) {
        if (whereBody.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(CONDITION_SPLIT_PATTERN.split(stripTerminator(whereBody)))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private List<String> splitOnCommas(String clause) {
        if (clause.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(stripTerminator(clause).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private String buildFingerprint(String query, List<ClauseMarker> markers, List<String> joinConditions) {
        Set<String> present = markers.stream()
                .map(ClauseMarker::keyword)
                .collect(Collectors.toSet());

        StringBuilder fingerprint = new StringBuilder();
        if (present.contains("SELECT")) {
            fingerprint.append("SELECT_");
        }
        if (present.contains("FROM")) {
            fingerprint.append("FROM_");
        }
        if (present.contains("WHERE")) {
            fingerprint.append("WHERE_");
        }
        if (!joinConditions.isEmpty()) {
            fingerprint.append("JOIN_");
        }
        if (present.contains("ORDER BY")) {
            fingerprint.append("ORDER_");
        }

        long tableKeywords = markers.stream()
                .filter(marker -> marker.keyword().equals("FROM") || marker.keyword().equals("JOIN"))
                .count();
        long logicalOperators = LOGICAL_OPERATOR_PATTERN.matcher(query).results().count();
        fingerprint.append("TABLES_").append(tableKeywords);
        fingerprint.append("_CONDITIONS_").append(logicalOperators);
        return fingerprint.toString();
    }

    private static String stripTerminator(String text) {
        String trimmed = text.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private record ClauseMarker(String keyword, int start, int bodyStart) {}
}
