package org.docmutate.engine;

import java.util.List;
import java.util.Objects;

/**
 * One (operator, target path, operand) instruction of a parsed update.
 *
 * <p>The operand is normalized by the parser: the value to write for {@code $set} and {@code $setOnInsert},
 * the increment for {@code $inc}, the elements to append or add (a {@code List}) for {@code $pushAll},
 * {@code $push} and {@code $addToSet}, and {@code null} for {@code $unset}. {@code sliceWindow} is only set for
 * {@code $push} with a {@code $slice} clause.
 */
public record ModifierOperation(ModifierOperator operator, FieldPath path, Object operand, Integer sliceWindow) {
    public ModifierOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(path, "path");
        operand = DocumentValues.copyAny(operand);
        if (sliceWindow != null && operator != ModifierOperator.APPEND_WITH_SLICE_WINDOW) {
            throw new IllegalArgumentException("slice window is only valid for $push");
        }
    }

    public ModifierOperation(final ModifierOperator operator, final FieldPath path, final Object operand) {
        this(operator, path, operand, null);
    }

    @Override
    public Object operand() {
        return DocumentValues.copyAny(operand);
    }

    @SuppressWarnings("unchecked")
    List<Object> elements() {
        return (List<Object>) DocumentValues.copyAny(operand);
    }
}
