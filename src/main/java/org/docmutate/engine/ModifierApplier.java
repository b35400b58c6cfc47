package org.docmutate.engine;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.docmutate.engine.MutableDocument.ArrayNode;
import org.docmutate.engine.MutableDocument.Node;
import org.docmutate.engine.MutableDocument.ScalarNode;
import org.docmutate.engine.MutableDocument.Slot;

/**
 * Applies a {@link ParsedUpdate} to one target document.
 *
 * <p>The target is never mutated; operations run in order against a private {@link MutableDocument} and the
 * result is a new document. Any failure aborts the current document only.
 */
final class ModifierApplier {
    private ModifierApplier() {}

    static ApplyResult apply(
            final ParsedUpdate update,
            final Document target,
            final String matchedField,
            final UpdateContext context,
            final ShardKeyPattern shardKeys,
            final String identityField) {
        Objects.requireNonNull(update, "update");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(shardKeys, "shardKeys");

        if (update.isReplacement()) {
            return new ApplyResult(
                    applyReplacement(target, update.replacementDocument(), identityField), !shardKeys.isEmpty());
        }

        final MutableDocument tree = MutableDocument.of(target);
        boolean affectsShardKeys = false;
        for (final ModifierOperation operation : update.operations()) {
            final FieldPath path = resolvePositional(operation.path(), matchedField);
            final boolean applied = applyOperation(tree, operation, path, context);
            if (applied && !affectsShardKeys && shardKeys.isAffectedBy(path)) {
                affectsShardKeys = true;
            }
        }

        final Document result = tree.toDocument();
        ensureIdentityUnchanged(target, result, identityField);
        return new ApplyResult(result, affectsShardKeys);
    }

    private static Document applyReplacement(
            final Document current, final Document replacement, final String identityField) {
        if (identityField == null || !current.containsKey(identityField)) {
            return replacement;
        }
        if (replacement.containsKey(identityField)) {
            if (!DocumentValues.equivalent(current.get(identityField), replacement.get(identityField))) {
                throw new IdentityFieldImmutableException(identityField);
            }
            return replacement;
        }

        final Document next = new Document(identityField, DocumentValues.copyAny(current.get(identityField)));
        next.putAll(replacement);
        return next;
    }

    private static void ensureIdentityUnchanged(
            final Document before, final Document after, final String identityField) {
        if (identityField == null || !before.containsKey(identityField)) {
            return;
        }
        if (!after.containsKey(identityField)
                || !DocumentValues.equivalent(before.get(identityField), after.get(identityField))) {
            throw new IdentityFieldImmutableException(identityField);
        }
    }

    private static FieldPath resolvePositional(final FieldPath path, final String matchedField) {
        if (path.positionalPart() < 0) {
            return path;
        }
        if (matchedField == null || matchedField.isEmpty()) {
            throw new PositionalMatchException(path.dottedField());
        }
        return path.withPositional(matchedField);
    }

    /**
     * @return false when the operation was detected as a no-op and left the tree untouched
     */
    private static boolean applyOperation(
            final MutableDocument tree,
            final ModifierOperation operation,
            final FieldPath path,
            final UpdateContext context) {
        switch (operation.operator()) {
            case SET_VALUE:
                return applySet(tree, path, operation.operand());
            case SET_ON_INSERT_ONLY:
                return context == UpdateContext.INSERT && applySet(tree, path, operation.operand());
            case UNSET_VALUE:
                return applyUnset(tree, path);
            case APPEND_ALL:
                return applyAppend(tree, operation, path, null);
            case APPEND_WITH_SLICE_WINDOW:
                return applyAppend(tree, operation, path, operation.sliceWindow());
            case INCREMENT:
                return applyIncrement(tree, operation, path, (Number) operation.operand());
            case ADD_TO_SET:
                return applyAddToSet(tree, operation, path);
            default:
                throw new IllegalStateException("unhandled operator " + operation.operator());
        }
    }

    private static boolean applySet(final MutableDocument tree, final FieldPath path, final Object value) {
        final Slot slot = tree.resolveForWrite(path);
        final Node current = slot.get();
        if (current != null && DocumentValues.equivalent(current.toValue(), value)) {
            return false;
        }
        slot.set(Node.fromValue(value));
        return true;
    }

    private static boolean applyUnset(final MutableDocument tree, final FieldPath path) {
        final Slot slot = tree.resolveExisting(path);
        return slot != null && slot.remove();
    }

    /**
     * Appends are never reported as no-ops, even when a slice window brings the array back to its original
     * value; only the shard key check compares final values.
     */
    private static boolean applyAppend(
            final MutableDocument tree,
            final ModifierOperation operation,
            final FieldPath path,
            final Integer sliceWindow) {
        final ArrayNode array = targetArray(tree.resolveForWrite(path), operation, path);
        for (final Object element : operation.elements()) {
            array.append(Node.fromValue(element));
        }
        if (sliceWindow != null) {
            array.truncateToWindow(sliceWindow);
        }
        return true;
    }

    private static boolean applyAddToSet(
            final MutableDocument tree, final ModifierOperation operation, final FieldPath path) {
        final Slot slot = tree.resolveForWrite(path);
        boolean modified = slot.get() == null;
        final ArrayNode array = targetArray(slot, operation, path);
        for (final Object element : operation.elements()) {
            if (!contains(array, element)) {
                array.append(Node.fromValue(element));
                modified = true;
            }
        }
        return modified;
    }

    private static boolean applyIncrement(
            final MutableDocument tree,
            final ModifierOperation operation,
            final FieldPath path,
            final Number delta) {
        final Slot slot = tree.resolveForWrite(path);
        final Node current = slot.get();
        if (current == null) {
            slot.set(new ScalarNode(delta));
            return true;
        }
        if (!(current instanceof ScalarNode scalar) || !(scalar.value() instanceof Number currentNumber)) {
            throw new TypeMismatchException(
                    operation.operator().operatorName(),
                    path.dottedField(),
                    "Cannot apply $inc to a value of non-numeric type at '" + path.dottedField() + "'");
        }

        final Number updated = add(currentNumber, delta, path);
        if (DocumentValues.equivalent(currentNumber, updated)) {
            return false;
        }
        slot.set(new ScalarNode(updated));
        return true;
    }

    private static ArrayNode targetArray(
            final Slot slot, final ModifierOperation operation, final FieldPath path) {
        final Node current = slot.get();
        if (current == null) {
            final ArrayNode created = new ArrayNode();
            slot.set(created);
            return created;
        }
        if (!(current instanceof ArrayNode array)) {
            throw new TypeMismatchException(
                    operation.operator().operatorName(),
                    path.dottedField(),
                    "The field '" + path.dottedField() + "' must be an array but is of type "
                            + describeType(current.toValue()));
        }
        return array;
    }

    private static boolean contains(final ArrayNode array, final Object candidate) {
        for (final Node element : array.elements()) {
            if (DocumentValues.equivalent(element.toValue(), candidate)) {
                return true;
            }
        }
        return false;
    }

    private static Number add(final Number current, final Number delta, final FieldPath path) {
        if (current instanceof Decimal128 || delta instanceof Decimal128) {
            if (!isFinite(current) || !isFinite(delta)) {
                return addNonFinite(current, delta);
            }
            return new Decimal128(toBigDecimal(current).add(toBigDecimal(delta)));
        }
        if (isFloating(current) || isFloating(delta)) {
            return current.doubleValue() + delta.doubleValue();
        }
        if (current instanceof Long || delta instanceof Long) {
            try {
                return Math.addExact(current.longValue(), delta.longValue());
            } catch (final ArithmeticException exception) {
                throw new TypeMismatchException(
                        ModifierOperator.INCREMENT.operatorName(),
                        path.dottedField(),
                        "Failed to apply $inc to '" + path.dottedField() + "': result would overflow a 64-bit integer");
            }
        }

        final long sum = (long) current.intValue() + delta.intValue();
        if (sum >= Integer.MIN_VALUE && sum <= Integer.MAX_VALUE) {
            return (int) sum;
        }
        return sum;
    }

    // NaN absorbs everything; opposite infinities cancel to NaN.
    private static Decimal128 addNonFinite(final Number current, final Number delta) {
        if (isNaN(current) || isNaN(delta)) {
            return Decimal128.NaN;
        }
        final int currentSign = infinitySign(current);
        final int deltaSign = infinitySign(delta);
        final int sign = currentSign != 0 ? currentSign : deltaSign;
        if (currentSign != 0 && deltaSign != 0 && currentSign != deltaSign) {
            return Decimal128.NaN;
        }
        return sign > 0 ? Decimal128.POSITIVE_INFINITY : Decimal128.NEGATIVE_INFINITY;
    }

    private static boolean isFinite(final Number value) {
        return !isNaN(value) && infinitySign(value) == 0;
    }

    private static boolean isNaN(final Number value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.isNaN();
        }
        return isFloating(value) && !(value instanceof BigDecimal) && Double.isNaN(value.doubleValue());
    }

    private static int infinitySign(final Number value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.isInfinite() ? (decimal.isNegative() ? -1 : 1) : 0;
        }
        if (isFloating(value) && !(value instanceof BigDecimal) && Double.isInfinite(value.doubleValue())) {
            return value.doubleValue() > 0 ? 1 : -1;
        }
        return 0;
    }

    private static boolean isFloating(final Number value) {
        return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
    }

    private static BigDecimal toBigDecimal(final Number value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(value.doubleValue());
        }
        return BigDecimal.valueOf(value.longValue());
    }

    private static String describeType(final Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }

    record ApplyResult(Document document, boolean affectsShardKeys) {}
}
