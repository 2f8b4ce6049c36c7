package org.carball.querytune.recommender;

import org.carball.querytune.model.schema.ConflictType;
import org.carball.querytune.model.schema.ExistingIndex;
import org.carball.querytune.model.schema.IndexConflict;
import org.carball.querytune.model.schema.IndexStatistics;

import java.util.*;

/**
 * Inventory of indexes already on the schema, used to vet new recommendations against them.
 */
public class ExistingIndexChecker {

    private static final int CONSOLIDATION_INDEX_COUNT = 3;

    private final Map<String, List<ExistingIndex>> existingIndexes = new LinkedHashMap<>();

    public void addExistingIndex(ExistingIndex index) {
        existingIndexes.computeIfAbsent(index.getTableName(), table -> new ArrayList<>()).add(index);
    }

    public List<IndexConflict> checkForConflicts(String table, List<String> recommendedColumns) {
        List<IndexConflict> conflicts = new ArrayList<>();
        for (ExistingIndex existing : existingIndexes.getOrDefault(table, List.of())) {
            conflictWith(existing, recommendedColumns).ifPresent(conflicts::add);
        }
        return conflicts;
    }

    private Optional<IndexConflict> conflictWith(ExistingIndex existing, List<String> recommendedColumns) {
        Set<String> existingSet = new HashSet<>(existing.getColumnNames());
        Set<String> recommendedSet = new HashSet<>(recommendedColumns);

        ConflictType type;
        if (existingSet.equals(recommendedSet)) {
            type = ConflictType.DUPLICATE;
        } else if (existingSet.containsAll(recommendedSet)) {
            type = ConflictType.REDUNDANT;
        } else if (!Collections.disjoint(existingSet, recommendedSet)) {
            type = ConflictType.OVERLAPPING;
        } else {
            return Optional.empty();
        }

        return Optional.of(new IndexConflict(String.join(", ", recommendedColumns),
                existing.getIndexName(), type, type.getSeverity()));
    }

    public List<String> getConsolidationSuggestions() {
        List<String> suggestions = new ArrayList<>();

        existingIndexes.forEach((table, indexes) -> {
            if (indexes.size() > CONSOLIDATION_INDEX_COUNT) {
                suggestions.add(String.format("Table '%s' has %d indexes - consider consolidation",
                        table, indexes.size()));
            }

            long singleColumnIndexes = indexes.stream()
                    .filter(index -> index.getColumnNames().size() == 1)
                    .count();
            if (singleColumnIndexes > 1) {
                suggestions.add(String.format("Table '%s' has multiple single-column indexes on similar columns",
                        table));
            }
        });

        return suggestions;
    }

    public IndexStatistics getIndexStatistics() {
        int total = 0;
        int unique = 0;
        int partial = 0;
        for (List<ExistingIndex> indexes : existingIndexes.values()) {
            for (ExistingIndex index : indexes) {
                total++;
                if (index.isUnique()) unique++;
                if (index.isPartial()) partial++;
            }
        }
        return new IndexStatistics(total, unique, partial);
    }
}
