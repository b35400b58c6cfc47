package org.docmutate.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Classifies an update specification as a replacement or a modifier set and flattens modifier sets into an
 * ordered list of {@link ModifierOperation}s.
 *
 * <p>Parsing is a pure function of the specification: it neither mutates documents nor touches the caller's
 * input, since every operand is copied into the result.
 */
final class UpdateSpecParser {
    private static final String EACH = "$each";
    private static final String SLICE = "$slice";

    private UpdateSpecParser() {}

    static ParsedUpdate parse(final Document spec) {
        Objects.requireNonNull(spec, "spec");
        if (spec.isEmpty()) {
            return ParsedUpdate.replacement(new Document());
        }

        if (!classifyAsModifiers(spec)) {
            return ParsedUpdate.replacement(DocumentValues.copy(spec));
        }

        final List<ModifierOperation> operations = new ArrayList<>();
        for (final Map.Entry<String, Object> entry : spec.entrySet()) {
            final String operatorName = entry.getKey();
            final ModifierOperator operator = ModifierOperator.forName(operatorName)
                    .orElseThrow(() -> new UnknownOperatorException(operatorName));
            final Map<?, ?> body = readBody(operatorName, entry.getValue());
            for (final Map.Entry<?, ?> target : body.entrySet()) {
                if (!(target.getKey() instanceof String rawPath)) {
                    throw new OperandShapeException(operatorName, null, operatorName + " field path must be a string");
                }
                final FieldPath path = parseTargetPath(rawPath);
                operations.add(readOperation(operator, path, target.getValue()));
            }
        }

        ensurePathsDistinct(operations);
        return ParsedUpdate.modifiers(operations);
    }

    private static boolean classifyAsModifiers(final Document spec) {
        String firstOperatorKey = null;
        String firstFieldKey = null;
        for (final String key : spec.keySet()) {
            if (ModifierOperator.isOperatorKey(key)) {
                if (firstOperatorKey == null) {
                    firstOperatorKey = key;
                }
            } else if (firstFieldKey == null) {
                firstFieldKey = key;
            }
        }
        if (firstOperatorKey != null && firstFieldKey != null) {
            throw new MixedModeException(firstFieldKey);
        }
        return firstOperatorKey != null;
    }

    private static Map<?, ?> readBody(final String operatorName, final Object rawBody) {
        if (!(rawBody instanceof Map<?, ?> body)) {
            throw new OperandShapeException(
                    operatorName,
                    null,
                    "Modifiers operate on fields but we found type " + typeName(rawBody) + " instead. For example: {"
                            + operatorName + ": {<field>: ...}} not {" + operatorName + ": " + typeName(rawBody) + "}");
        }
        if (body.isEmpty()) {
            throw new EmptyOperatorException(operatorName);
        }
        return body;
    }

    static FieldPath parseTargetPath(final String rawPath) {
        final FieldPath path = FieldPath.parse(rawPath);
        boolean positionalSeen = false;
        for (int i = 0; i < path.numParts(); i++) {
            final String part = path.part(i);
            if (!part.startsWith("$")) {
                continue;
            }
            if (!FieldPath.POSITIONAL_PART.equals(part)) {
                throw new InvalidPathException(rawPath, "unsupported $-prefixed field name '" + part + "'");
            }
            if (i == 0) {
                throw new InvalidPathException(rawPath, "the positional operator cannot be the first part");
            }
            if (positionalSeen) {
                throw new InvalidPathException(rawPath, "too many positional elements");
            }
            positionalSeen = true;
        }
        return path;
    }

    private static ModifierOperation readOperation(
            final ModifierOperator operator, final FieldPath path, final Object operand) {
        final String operatorName = operator.operatorName();
        switch (operator.operandRule()) {
            case ANY:
                return new ModifierOperation(operator, path, operator == ModifierOperator.UNSET_VALUE ? null : operand);
            case NUMBER:
                if (!(operand instanceof Number)) {
                    throw new OperandShapeException(
                            operatorName, path.dottedField(), "Cannot increment with non-numeric argument: {"
                                    + path.dottedField() + ": " + typeName(operand) + "}");
                }
                return new ModifierOperation(operator, path, operand);
            case ARRAY:
                if (!(operand instanceof List<?>)) {
                    throw new OperandShapeException(
                            operatorName, path.dottedField(), operatorName + " requires an array of values but was given "
                                    + typeName(operand));
                }
                return new ModifierOperation(operator, path, operand);
            case PUSH_CLAUSE:
                return readPushClause(operator, path, operand);
            case EACH_CLAUSE:
                return readEachClause(operator, path, operand);
            default:
                throw new IllegalStateException("unhandled operand rule " + operator.operandRule());
        }
    }

    private static ModifierOperation readPushClause(
            final ModifierOperator operator, final FieldPath path, final Object operand) {
        if (!isClauseDocument(operand)) {
            return new ModifierOperation(operator, path, Collections.singletonList(operand));
        }
        final String operatorName = operator.operatorName();
        final Map<?, ?> clauses = (Map<?, ?>) operand;
        Object each = null;
        Integer slice = null;
        for (final Map.Entry<?, ?> clause : clauses.entrySet()) {
            final String name = String.valueOf(clause.getKey());
            if (EACH.equals(name)) {
                each = clause.getValue();
            } else if (SLICE.equals(name)) {
                slice = readSlice(operatorName, path, clause.getValue());
            } else {
                throw new OperandShapeException(
                        operatorName, path.dottedField(), "Unrecognized clause in " + operatorName + ": " + name);
            }
        }
        if (each == null) {
            throw new OperandShapeException(
                    operatorName, path.dottedField(), operatorName + " clauses require " + EACH + " for '"
                            + path.dottedField() + "'");
        }
        if (!(each instanceof List<?>)) {
            throw new OperandShapeException(
                    operatorName, path.dottedField(), EACH + " for '" + path.dottedField() + "' must be an array");
        }
        return new ModifierOperation(operator, path, each, slice);
    }

    private static ModifierOperation readEachClause(
            final ModifierOperator operator, final FieldPath path, final Object operand) {
        if (!(operand instanceof Map<?, ?> mapValue) || !mapValue.containsKey(EACH)) {
            return new ModifierOperation(operator, path, Collections.singletonList(operand));
        }
        final String operatorName = operator.operatorName();
        if (mapValue.size() != 1) {
            throw new OperandShapeException(
                    operatorName, path.dottedField(), operatorName + " for '" + path.dottedField() + "' only supports "
                            + EACH);
        }
        final Object each = mapValue.get(EACH);
        if (!(each instanceof List<?>)) {
            throw new OperandShapeException(
                    operatorName, path.dottedField(), operatorName + "." + EACH + " for '" + path.dottedField()
                            + "' must be an array");
        }
        return new ModifierOperation(operator, path, each);
    }

    private static Integer readSlice(final String operatorName, final FieldPath path, final Object rawSlice) {
        if (rawSlice instanceof Integer value) {
            return value;
        }
        if (rawSlice instanceof Long value && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return value.intValue();
        }
        if (rawSlice instanceof Double value
                && value == Math.rint(value)
                && value >= Integer.MIN_VALUE
                && value <= Integer.MAX_VALUE) {
            return value.intValue();
        }
        throw new OperandShapeException(
                operatorName, path.dottedField(), "The value for " + SLICE + " must be an integral number, found "
                        + typeName(rawSlice));
    }

    private static boolean isClauseDocument(final Object operand) {
        if (!(operand instanceof Map<?, ?> map) || map.isEmpty()) {
            return false;
        }
        for (final Object key : map.keySet()) {
            if (String.valueOf(key).startsWith("$")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sorted order puts every extension of a path right after it, so comparing neighbours finds all
     * duplicate and prefix-overlapping targets.
     */
    private static void ensurePathsDistinct(final List<ModifierOperation> operations) {
        final List<FieldPath> paths = new ArrayList<>(operations.size());
        for (final ModifierOperation operation : operations) {
            paths.add(operation.path());
        }
        paths.sort(null);
        for (int i = 1; i < paths.size(); i++) {
            final FieldPath previous = paths.get(i - 1);
            final FieldPath current = paths.get(i);
            if (previous.isPrefixOf(current)) {
                throw new ConflictingPathsException(previous.dottedField(), current.dottedField());
            }
        }
    }

    private static String typeName(final Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Integer) {
            return "int";
        }
        if (value instanceof Long) {
            return "long";
        }
        if (value instanceof Double) {
            return "double";
        }
        return value.getClass().getSimpleName();
    }
}
