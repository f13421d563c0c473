package dev.schemaeval.schema;

/** The schema rule a {@link Violation} broke. */
public enum RuleKind {
    /** The raw output is not syntactically valid JSON. */
    PARSE,
    TYPE,
    REQUIRED,
    ADDITIONAL_PROPERTIES,
    ENUM,
    CONST,
    PATTERN,
    MIN_LENGTH,
    MAX_LENGTH,
    MINIMUM,
    MAXIMUM,
    EXCLUSIVE_MINIMUM,
    EXCLUSIVE_MAXIMUM,
    MIN_ITEMS,
    MAX_ITEMS,
    UNIQUE_ITEMS,
    ANY_OF,
    ONE_OF,
    /** A {@code false} schema: no value is allowed at this location. */
    NOT_ALLOWED,
    /** The schema itself could not be applied (bad regex, unresolvable $ref, unknown type). */
    SCHEMA
}
