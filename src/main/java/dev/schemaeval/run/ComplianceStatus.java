package dev.schemaeval.run;

public enum ComplianceStatus {
    PASS,
    FAIL,
    /** The output could not be parsed, so it was never checked against the schema. */
    NOT_APPLICABLE
}
