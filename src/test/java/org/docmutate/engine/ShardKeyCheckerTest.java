package org.docmutate.engine;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class ShardKeyCheckerTest {
    private static final ShardKeyPattern PATTERN = ShardKeyPattern.of(Document.parse("{'s.a': 1, 's.c': 1}"));

    @Test
    void extractReadsNestedValuesAndReportsAbsence() {
        Document document = Document.parse("{s: {a: [1], n: null, arr: [{k: 1}, {k: 2}]}}");

        assertEquals(List.of(1), ShardKeyChecker.extract(document, FieldPath.parse("s.a")));
        assertNull(ShardKeyChecker.extract(document, FieldPath.parse("s.n")));
        assertEquals(2, ShardKeyChecker.extract(document, FieldPath.parse("s.arr.1.k")));
        assertSame(ShardKeyChecker.ABSENT, ShardKeyChecker.extract(document, FieldPath.parse("s.b")));
        assertSame(ShardKeyChecker.ABSENT, ShardKeyChecker.extract(document, FieldPath.parse("s.a.5")));
        assertSame(ShardKeyChecker.ABSENT, ShardKeyChecker.extract(document, FieldPath.parse("s.a.0.deep")));
    }

    @Test
    void identicalShardKeyValuesPass() {
        Document before = Document.parse("{x: [1], s: {a: [1], b: [2], c: [3, 3, 3]}}");
        Document after = Document.parse("{x: [9], s: {c: [3, 3, 3], b: 'x', a: [1]}}");

        assertDoesNotThrow(() -> ShardKeyChecker.checkUnaltered(PATTERN, before, after));
    }

    @Test
    void objectValuesCompareRegardlessOfKeyOrder() {
        ShardKeyPattern pattern = ShardKeyPattern.of(new Document("k", 1));

        assertDoesNotThrow(() -> ShardKeyChecker.checkUnaltered(
                pattern, Document.parse("{k: {p: 1, q: 2}}"), Document.parse("{k: {q: 2, p: 1}}")));
    }

    @Test
    void changedValueFailsOnFirstDifferingPath() {
        Document before = Document.parse("{s: {a: [1], c: [3]}}");
        Document after = Document.parse("{s: {a: [2], c: [4]}}");

        ShardKeyViolationException error = assertThrows(
                ShardKeyViolationException.class, () -> ShardKeyChecker.checkUnaltered(PATTERN, before, after));
        assertEquals("s.a", error.path());
    }

    @Test
    void removedValueFailsEvenWhenPreviousValueWasNull() {
        Document before = Document.parse("{s: {a: null, c: [3]}}");
        Document after = Document.parse("{s: {c: [3]}}");

        ShardKeyViolationException error = assertThrows(
                ShardKeyViolationException.class, () -> ShardKeyChecker.checkUnaltered(PATTERN, before, after));
        assertEquals("s.a", error.path());
    }

    @Test
    void arrayOrderAndScalarTypeMatter() {
        ShardKeyPattern pattern = ShardKeyPattern.of(new Document("k", 1));

        assertThrows(ShardKeyViolationException.class, () -> ShardKeyChecker.checkUnaltered(
                pattern, Document.parse("{k: [1, 2]}"), Document.parse("{k: [2, 1]}")));
        assertThrows(ShardKeyViolationException.class, () -> ShardKeyChecker.checkUnaltered(
                pattern, new Document("k", 1), new Document("k", 1L)));
    }

    @Test
    void bothImagesMissingTheKeyPass() {
        assertDoesNotThrow(() -> ShardKeyChecker.checkUnaltered(
                PATTERN, Document.parse("{x: 1}"), Document.parse("{x: 2}")));
    }

    @Test
    void emptyPatternAlwaysPasses() {
        assertDoesNotThrow(() -> ShardKeyChecker.checkUnaltered(
                ShardKeyPattern.empty(), Document.parse("{a: 1}"), Document.parse("{a: 2}")));
    }
}
