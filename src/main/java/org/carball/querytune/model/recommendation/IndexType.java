package org.carball.querytune.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IndexType {
    BTREE("BTree"),
    HASH("Hash");

    private final String displayName;

    IndexType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
