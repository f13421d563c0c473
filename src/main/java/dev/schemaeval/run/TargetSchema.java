package dev.schemaeval.run;

import com.fasterxml.jackson.databind.JsonNode;
import javax.annotation.Nonnull;

/** A JSON Schema that model outputs are checked against. Only approved schemas can be run. */
public record TargetSchema(
        @Nonnull String id,
        @Nonnull String name,
        @Nonnull SchemaStatus status,
        @Nonnull JsonNode content) {

    public boolean isApproved() {
        return status == SchemaStatus.APPROVED;
    }
}
