package org.docmutate.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of update operators.
 *
 * <p>The set is closed: adding an operator means adding a constant here, its operand rule in
 * {@link UpdateSpecParser} and its application rule in {@link ModifierApplier}.
 */
public enum ModifierOperator {
    SET_VALUE("$set", OperandRule.ANY),
    UNSET_VALUE("$unset", OperandRule.ANY),
    APPEND_ALL("$pushAll", OperandRule.ARRAY),
    APPEND_WITH_SLICE_WINDOW("$push", OperandRule.PUSH_CLAUSE),
    SET_ON_INSERT_ONLY("$setOnInsert", OperandRule.ANY),
    INCREMENT("$inc", OperandRule.NUMBER),
    ADD_TO_SET("$addToSet", OperandRule.EACH_CLAUSE);

    public static final String SIGIL = "$";

    private static final Map<String, ModifierOperator> BY_NAME;

    static {
        final Map<String, ModifierOperator> byName = new LinkedHashMap<>();
        for (final ModifierOperator operator : values()) {
            byName.put(operator.operatorName, operator);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String operatorName;
    private final OperandRule operandRule;

    ModifierOperator(final String operatorName, final OperandRule operandRule) {
        this.operatorName = operatorName;
        this.operandRule = operandRule;
    }

    public String operatorName() {
        return operatorName;
    }

    public OperandRule operandRule() {
        return operandRule;
    }

    public static Optional<ModifierOperator> forName(final String operatorName) {
        return Optional.ofNullable(BY_NAME.get(operatorName));
    }

    public static boolean isOperatorKey(final String key) {
        return key != null && key.startsWith(SIGIL);
    }

    /**
     * Expected shape of the per-path operand.
     */
    public enum OperandRule {
        /** Any value, including null and nested documents. */
        ANY,
        ARRAY,
        NUMBER,
        /** A value to append, or {@code {$each: [...], $slice: <int>}}. */
        PUSH_CLAUSE,
        /** A value to add, or {@code {$each: [...]}}. */
        EACH_CLAUSE
    }
}
