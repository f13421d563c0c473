package dev.schemaeval.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nonnull;

/**
 * Validates a parsed document against a JSON Schema and reports every violation it finds.
 *
 * <p>Validation never stops at the first problem: the whole document is walked against the whole
 * schema. Results are deterministic. At each location the {@code type} check runs first and, when
 * it fails, suppresses the remaining checks for that location. Then come {@code enum}/{@code
 * const}, string and number constraints, composition keywords ({@code allOf}, {@code anyOf},
 * {@code oneOf}), and finally object and array members. Object members are reported as {@code
 * required} (declaration order), declared {@code properties} (schema order), then additional
 * properties (document order). Array members are reported after the size checks, by index.
 *
 * <p>Supported keywords: {@code type}, {@code properties}, {@code required}, {@code
 * additionalProperties}, {@code enum}, {@code const}, {@code pattern}, {@code minLength}, {@code
 * maxLength}, {@code minimum}, {@code maximum}, {@code exclusiveMinimum}, {@code
 * exclusiveMaximum}, {@code items}, {@code minItems}, {@code maxItems}, {@code uniqueItems},
 * {@code allOf}, {@code anyOf}, {@code oneOf} and local {@code $ref}. Anything else is ignored.
 *
 * <p>Instances are stateless and thread safe.
 */
public final class SchemaValidator {
    private static final int MAX_REF_HOPS = 32;

    /**
     * Validate {@code document} against {@code schema}.
     *
     * @return every violation found, in a stable order. Empty means the document complies.
     */
    public List<Violation> validate(@Nonnull JsonNode document, @Nonnull JsonNode schema) {
        var walk = new Walk(schema);
        walk.visit(document, schema, new ArrayList<>(), 0);
        return List.copyOf(walk.violations);
    }

    public boolean isValid(@Nonnull JsonNode document, @Nonnull JsonNode schema) {
        return validate(document, schema).isEmpty();
    }

    /** State for a single validation pass. */
    private static final class Walk {
        private final JsonNode rootSchema;
        private final Map<String, Pattern> patterns;
        private final List<Violation> violations = new ArrayList<>();

        Walk(JsonNode rootSchema) {
            this(rootSchema, new HashMap<>());
        }

        private Walk(JsonNode rootSchema, Map<String, Pattern> patterns) {
            this.rootSchema = rootSchema;
            this.patterns = patterns;
        }

        /** A walk sharing this walk's root and caches, with its own violation list. */
        Walk fork() {
            return new Walk(rootSchema, patterns);
        }

        void report(List<Object> path, RuleKind rule, String message) {
            violations.add(new Violation(message, path, rule));
        }

        void visit(JsonNode value, JsonNode schema, List<Object> path, int refHops) {
            if (schema.isBoolean()) {
                if (!schema.booleanValue()) {
                    report(path, RuleKind.NOT_ALLOWED, "no value is allowed here");
                }
                return;
            }
            if (!schema.isObject()) {
                return;
            }

            var ref = schema.get("$ref");
            if (ref != null && ref.isTextual()) {
                if (refHops >= MAX_REF_HOPS) {
                    report(path, RuleKind.SCHEMA, "$ref chain too deep at " + ref.asText());
                    return;
                }
                var target = resolveRef(ref.asText());
                if (target == null) {
                    report(path, RuleKind.SCHEMA, "unresolvable $ref " + ref.asText());
                    return;
                }
                visit(value, target, path, refHops + 1);
            }

            if (!checkType(value, schema, path)) {
                return;
            }
            checkEnumAndConst(value, schema, path);
            if (value.isTextual()) {
                checkString(value, schema, path);
            } else if (value.isNumber()) {
                checkNumber(value, schema, path);
            }
            checkComposition(value, schema, path, refHops);
            if (value.isObject()) {
                checkObject(value, schema, path);
            } else if (value.isArray()) {
                checkArray(value, schema, path);
            }
        }

        private JsonNode resolveRef(String ref) {
            if ("#".equals(ref)) {
                return rootSchema;
            }
            if (!ref.startsWith("#/")) {
                return null;
            }
            var target = rootSchema.at(ref.substring(1));
            return target.isMissingNode() ? null : target;
        }

        /** @return true when the remaining checks should run for this location */
        private boolean checkType(JsonNode value, JsonNode schema, List<Object> path) {
            var type = schema.get("type");
            if (type == null) {
                return true;
            }
            List<String> allowed = new ArrayList<>();
            if (type.isTextual()) {
                allowed.add(type.asText());
            } else if (type.isArray()) {
                type.forEach(t -> allowed.add(t.asText()));
            } else {
                report(path, RuleKind.SCHEMA, "'type' must be a string or an array");
                return true;
            }
            for (String candidate : allowed) {
                if (!isKnownType(candidate)) {
                    report(path, RuleKind.SCHEMA, "unknown type '%s'".formatted(candidate));
                    return true;
                }
                if (matchesType(value, candidate)) {
                    return true;
                }
            }
            report(
                    path,
                    RuleKind.TYPE,
                    "expected %s but found %s"
                            .formatted(String.join(" or ", allowed), describe(value)));
            return false;
        }

        private void checkEnumAndConst(JsonNode value, JsonNode schema, List<Object> path) {
            var enumValues = schema.get("enum");
            if (enumValues != null && enumValues.isArray()) {
                boolean found = false;
                for (JsonNode candidate : enumValues) {
                    if (jsonEquals(value, candidate)) {
                        found = true;
                        break;
                    }
                }
                if (!found) {
                    report(
                            path,
                            RuleKind.ENUM,
                            "value %s is not one of %s".formatted(value, enumValues));
                }
            }
            var constValue = schema.get("const");
            if (constValue != null && !jsonEquals(value, constValue)) {
                report(
                        path,
                        RuleKind.CONST,
                        "value %s does not equal %s".formatted(value, constValue));
            }
        }

        private void checkString(JsonNode value, JsonNode schema, List<Object> path) {
            var text = value.textValue();
            int length = text.codePointCount(0, text.length());
            var minLength = schema.get("minLength");
            if (minLength != null && minLength.canConvertToInt() && length < minLength.intValue()) {
                report(
                        path,
                        RuleKind.MIN_LENGTH,
                        "string of length %d is shorter than %d"
                                .formatted(length, minLength.intValue()));
            }
            var maxLength = schema.get("maxLength");
            if (maxLength != null && maxLength.canConvertToInt() && length > maxLength.intValue()) {
                report(
                        path,
                        RuleKind.MAX_LENGTH,
                        "string of length %d is longer than %d"
                                .formatted(length, maxLength.intValue()));
            }
            var pattern = schema.get("pattern");
            if (pattern != null && pattern.isTextual()) {
                Pattern compiled;
                try {
                    compiled = patterns.computeIfAbsent(pattern.asText(), Pattern::compile);
                } catch (PatternSyntaxException e) {
                    report(
                            path,
                            RuleKind.SCHEMA,
                            "invalid pattern '%s': %s"
                                    .formatted(pattern.asText(), e.getDescription()));
                    return;
                }
                if (!compiled.matcher(text).find()) {
                    report(
                            path,
                            RuleKind.PATTERN,
                            "'%s' does not match pattern '%s'".formatted(text, pattern.asText()));
                }
            }
        }

        private void checkNumber(JsonNode value, JsonNode schema, List<Object> path) {
            var minimum = schema.get("minimum");
            var maximum = schema.get("maximum");
            var exclusiveMinimum = schema.get("exclusiveMinimum");
            var exclusiveMaximum = schema.get("exclusiveMaximum");
            // draft-04 style: exclusive flags modify minimum/maximum
            boolean minIsExclusive = isTrue(exclusiveMinimum);
            boolean maxIsExclusive = isTrue(exclusiveMaximum);

            if (minimum != null && minimum.isNumber()) {
                int cmp = compareNumbers(value, minimum);
                if (cmp < 0 || (minIsExclusive && cmp == 0)) {
                    report(
                            path,
                            minIsExclusive ? RuleKind.EXCLUSIVE_MINIMUM : RuleKind.MINIMUM,
                            "%s is less than %s%s"
                                    .formatted(
                                            value, minIsExclusive ? "or equal to " : "", minimum));
                }
            }
            if (maximum != null && maximum.isNumber()) {
                int cmp = compareNumbers(value, maximum);
                if (cmp > 0 || (maxIsExclusive && cmp == 0)) {
                    report(
                            path,
                            maxIsExclusive ? RuleKind.EXCLUSIVE_MAXIMUM : RuleKind.MAXIMUM,
                            "%s is greater than %s%s"
                                    .formatted(
                                            value, maxIsExclusive ? "or equal to " : "", maximum));
                }
            }
            if (exclusiveMinimum != null
                    && exclusiveMinimum.isNumber()
                    && compareNumbers(value, exclusiveMinimum) <= 0) {
                report(
                        path,
                        RuleKind.EXCLUSIVE_MINIMUM,
                        "%s is less than or equal to %s".formatted(value, exclusiveMinimum));
            }
            if (exclusiveMaximum != null
                    && exclusiveMaximum.isNumber()
                    && compareNumbers(value, exclusiveMaximum) >= 0) {
                report(
                        path,
                        RuleKind.EXCLUSIVE_MAXIMUM,
                        "%s is greater than or equal to %s".formatted(value, exclusiveMaximum));
            }
        }

        private void checkComposition(
                JsonNode value, JsonNode schema, List<Object> path, int refHops) {
            var allOf = schema.get("allOf");
            if (allOf != null && allOf.isArray()) {
                for (JsonNode subschema : allOf) {
                    visit(value, subschema, path, refHops);
                }
            }
            var anyOf = schema.get("anyOf");
            if (anyOf != null && anyOf.isArray() && anyOf.size() > 0) {
                if (countMatches(value, anyOf, path, refHops) == 0) {
                    report(
                            path,
                            RuleKind.ANY_OF,
                            "value does not match any of the %d allowed schemas"
                                    .formatted(anyOf.size()));
                }
            }
            var oneOf = schema.get("oneOf");
            if (oneOf != null && oneOf.isArray() && oneOf.size() > 0) {
                int matches = countMatches(value, oneOf, path, refHops);
                if (matches != 1) {
                    report(
                            path,
                            RuleKind.ONE_OF,
                            "value matches %d of %d schemas, expected exactly one"
                                    .formatted(matches, oneOf.size()));
                }
            }
        }

        private int countMatches(
                JsonNode value, JsonNode alternatives, List<Object> path, int refHops) {
            int matches = 0;
            for (JsonNode alternative : alternatives) {
                var branch = fork();
                branch.visit(value, alternative, path, refHops);
                if (branch.violations.isEmpty()) {
                    matches++;
                }
            }
            return matches;
        }

        private void checkObject(JsonNode value, JsonNode schema, List<Object> path) {
            var required = schema.get("required");
            if (required != null && required.isArray()) {
                for (JsonNode name : required) {
                    if (!value.has(name.asText())) {
                        report(
                                child(path, name.asText()),
                                RuleKind.REQUIRED,
                                "missing required property '%s'".formatted(name.asText()));
                    }
                }
            }

            var properties = schema.get("properties");
            if (properties != null && properties.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> declared = properties.fields();
                while (declared.hasNext()) {
                    var property = declared.next();
                    var member = value.get(property.getKey());
                    if (member != null) {
                        visit(member, property.getValue(), child(path, property.getKey()), 0);
                    }
                }
            }

            var additional = schema.get("additionalProperties");
            if (additional == null || (additional.isBoolean() && additional.booleanValue())) {
                return;
            }
            Iterator<String> names = value.fieldNames();
            while (names.hasNext()) {
                var name = names.next();
                if (properties != null && properties.has(name)) {
                    continue;
                }
                if (additional.isBoolean()) {
                    report(
                            child(path, name),
                            RuleKind.ADDITIONAL_PROPERTIES,
                            "property '%s' is not allowed".formatted(name));
                } else {
                    visit(value.get(name), additional, child(path, name), 0);
                }
            }
        }

        private void checkArray(JsonNode value, JsonNode schema, List<Object> path) {
            int size = value.size();
            var minItems = schema.get("minItems");
            if (minItems != null && minItems.canConvertToInt() && size < minItems.intValue()) {
                report(
                        path,
                        RuleKind.MIN_ITEMS,
                        "array has %d items, fewer than %d".formatted(size, minItems.intValue()));
            }
            var maxItems = schema.get("maxItems");
            if (maxItems != null && maxItems.canConvertToInt() && size > maxItems.intValue()) {
                report(
                        path,
                        RuleKind.MAX_ITEMS,
                        "array has %d items, more than %d".formatted(size, maxItems.intValue()));
            }
            var uniqueItems = schema.get("uniqueItems");
            if (isTrue(uniqueItems)) {
                outer:
                for (int i = 0; i < size; i++) {
                    for (int j = i + 1; j < size; j++) {
                        if (jsonEquals(value.get(i), value.get(j))) {
                            report(
                                    path,
                                    RuleKind.UNIQUE_ITEMS,
                                    "items at index %d and %d are equal".formatted(i, j));
                            break outer;
                        }
                    }
                }
            }

            var items = schema.get("items");
            if (items == null) {
                return;
            }
            if (items.isArray()) {
                // tuple form: one schema per position
                for (int i = 0; i < size && i < items.size(); i++) {
                    visit(value.get(i), items.get(i), child(path, i), 0);
                }
            } else {
                for (int i = 0; i < size; i++) {
                    visit(value.get(i), items, child(path, i), 0);
                }
            }
        }
    }

    private static List<Object> child(List<Object> path, Object element) {
        var result = new ArrayList<>(path);
        result.add(element);
        return result;
    }

    private static boolean isTrue(JsonNode flag) {
        return flag != null && flag.isBoolean() && flag.booleanValue();
    }

    private static boolean isKnownType(String type) {
        switch (type) {
            case "object":
            case "array":
            case "string":
            case "boolean":
            case "null":
            case "number":
            case "integer":
                return true;
            default:
                return false;
        }
    }

    private static boolean matchesType(JsonNode value, String type) {
        switch (type) {
            case "object":
                return value.isObject();
            case "array":
                return value.isArray();
            case "string":
                return value.isTextual();
            case "boolean":
                return value.isBoolean();
            case "null":
                return value.isNull();
            case "number":
                return value.isNumber();
            case "integer":
                return value.isIntegralNumber()
                        || (isFinite(value) && isWhole(value.decimalValue()));
            default:
                return false;
        }
    }

    /** Doubles outside the decimal range (e.g. 1e309 read as a double) have no decimal value. */
    private static boolean isFinite(JsonNode number) {
        return !(number.isDouble() || number.isFloat()) || Double.isFinite(number.doubleValue());
    }

    static int compareNumbers(JsonNode a, JsonNode b) {
        if (isFinite(a) && isFinite(b)) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isWhole(BigDecimal number) {
        return number.signum() == 0
                || number.scale() <= 0
                || number.stripTrailingZeros().scale() <= 0;
    }

    private static String describe(JsonNode value) {
        if (value.isObject()) {
            return "object";
        } else if (value.isArray()) {
            return "array";
        } else if (value.isTextual()) {
            return "string";
        } else if (value.isBoolean()) {
            return "boolean";
        } else if (value.isNull()) {
            return "null";
        } else if (value.isIntegralNumber()) {
            return "integer";
        } else if (value.isNumber()) {
            return "number";
        }
        return value.getNodeType().name().toLowerCase();
    }

    /** JSON equality, treating numerically equal numbers as equal (1 == 1.0). */
    static boolean jsonEquals(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return compareNumbers(a, b) == 0;
        }
        if (a.isArray() && b.isArray()) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!jsonEquals(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a.isObject() && b.isObject()) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<String> names = a.fieldNames();
            while (names.hasNext()) {
                var name = names.next();
                var other = b.get(name);
                if (other == null || !jsonEquals(a.get(name), other)) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }
}
