package dev.schemaeval.run;

public enum SchemaStatus {
    DRAFT,
    APPROVED,
    ARCHIVED
}
