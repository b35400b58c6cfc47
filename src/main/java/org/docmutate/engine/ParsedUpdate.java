package org.docmutate.engine;

import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Result of parsing an update specification: either an ordered list of modifier operations or a single
 * replacement document, never both.
 */
public final class ParsedUpdate {
    private final List<ModifierOperation> operations;
    private final Document replacementDocument;

    private ParsedUpdate(final List<ModifierOperation> operations, final Document replacementDocument) {
        this.operations = List.copyOf(operations);
        this.replacementDocument = replacementDocument == null ? null : DocumentValues.copy(replacementDocument);
    }

    static ParsedUpdate modifiers(final List<ModifierOperation> operations) {
        Objects.requireNonNull(operations, "operations");
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("modifier update must contain at least one operation");
        }
        return new ParsedUpdate(operations, null);
    }

    static ParsedUpdate replacement(final Document replacementDocument) {
        return new ParsedUpdate(List.of(), Objects.requireNonNull(replacementDocument, "replacementDocument"));
    }

    public boolean isReplacement() {
        return replacementDocument != null;
    }

    public Document replacementDocument() {
        return replacementDocument == null ? null : DocumentValues.copy(replacementDocument);
    }

    public List<ModifierOperation> operations() {
        return operations;
    }

    public int numMods() {
        return operations.size();
    }
}
