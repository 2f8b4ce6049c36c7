package org.carball.querytune.model.schema;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ExistingIndex {
    private String tableName;
    private String indexName;
    @Builder.Default
    private List<String> columnNames = new ArrayList<>();
    private String indexType;
    private boolean unique;
    private boolean partial;
    private String filterCondition;
}
