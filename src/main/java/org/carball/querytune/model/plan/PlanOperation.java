package org.carball.querytune.model.plan;

/**
 * One node of an execution plan.
 *
 * @param operationType node type as the database reports it, such as {@code Seq Scan} or {@code Hash Join}
 * @param tableName     table the node reads, empty for nodes without one
 * @param cost          planner cost estimate of the node
 * @param rows          estimated rows produced
 * @param width         estimated row width in bytes
 * @param expensive     whether the node was flagged as expensive
 */
public record PlanOperation(
        String operationType,
        String tableName,
        double cost,
        long rows,
        long width,
        boolean expensive
) {

    public static final String SEQ_SCAN = "Seq Scan";
    public static final String INDEX_SCAN = "Index Scan";
    public static final String NESTED_LOOP = "Nested Loop";
    public static final String HASH_JOIN = "Hash Join";
    public static final String SORT = "Sort";

    public PlanOperation {
        operationType = operationType == null ? "" : operationType;
        tableName = tableName == null ? "" : tableName;
    }

    public boolean isType(String type) {
        return operationType.equals(type);
    }
}
