package org.docmutate.engine;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.bson.Document;
import org.docmutate.obs.JsonLinesLogger;
import org.docmutate.obs.StructuredJsonLinesLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UpdateDriverTest {
    @Nested
    class Parse {
        private final UpdateDriver driver = new UpdateDriver(UpdateDriver.Options.defaults());

        @Test
        void singleModifier() {
            driver.parse(Document.parse("{$set: {a: 1}}"));

            assertEquals(1, driver.numMods());
            assertFalse(driver.isDocReplacement());
        }

        @Test
        void multipleTargetsOfOneOperator() {
            driver.parse(Document.parse("{$set: {a: 1, b: 1}}"));

            assertEquals(2, driver.numMods());
            assertFalse(driver.isDocReplacement());
        }

        @Test
        void multipleOperators() {
            driver.parse(Document.parse("{$set: {a: 1}, $unset: {b: 1}}"));

            assertEquals(2, driver.numMods());
            assertFalse(driver.isDocReplacement());
        }

        @Test
        void objectReplacement() {
            driver.parse(Document.parse("{obj: 'obj replacement'}"));

            assertTrue(driver.isDocReplacement());
            assertEquals(0, driver.numMods());
        }

        @Test
        void emptyModifierIsRejected() {
            assertThrows(EmptyOperatorException.class, () -> driver.parse(Document.parse("{$set: {}}")));
        }

        @Test
        void unknownModifierIsRejected() {
            assertThrows(UnknownOperatorException.class, () -> driver.parse(Document.parse("{$xyz: {a: 1}}")));
        }

        @Test
        void nonDocumentModifierBodyIsRejected() {
            assertThrows(OperandShapeException.class, () -> driver.parse(Document.parse("{$set: [{a: 1}]}")));
        }

        @Test
        void modifiersWithLaterReplacementFieldAreRejected() {
            assertThrows(
                    MixedModeException.class,
                    () -> driver.parse(Document.parse("{$set: {a: 1}, obj: 'obj replacement'}")));
        }

        @Test
        void pushAll() {
            driver.parse(Document.parse("{$pushAll: {a: [1, 2, 3]}}"));

            assertEquals(1, driver.numMods());
            assertFalse(driver.isDocReplacement());
        }

        @Test
        void setOnInsert() {
            driver.parse(Document.parse("{$setOnInsert: {a: 1}}"));

            assertEquals(1, driver.numMods());
            assertFalse(driver.isDocReplacement());
        }

        @Test
        void failedParseClearsPreviousSpecification() {
            driver.parse(Document.parse("{$set: {a: 1}}"));

            assertThrows(UnknownOperatorException.class, () -> driver.parse(Document.parse("{$xyz: {a: 1}}")));

            assertEquals(0, driver.numMods());
            assertThrows(IllegalStateException.class, () -> driver.update(null, new Document()));
        }

        @Test
        void updateBeforeParseIsIllegal() {
            assertThrows(IllegalStateException.class, () -> driver.update(null, new Document()));
        }
    }

    /**
     * Every field of the document is an array so that a no-op can be expressed through {@code $push} with
     * {@code $slice}, which is not detected as a no-op while applying.
     */
    @Nested
    class ShardKeys {
        private final Document shardKeyPattern = Document.parse("{'s.a': 1, 's.c': 1}");
        private Document original;
        private UpdateDriver driver;

        @BeforeEach
        void setUp() {
            original = Document.parse("{x: [1], s: {a: [1], b: [2], c: [3, 3, 3]}}");
            driver = new UpdateDriver(UpdateDriver.Options.defaults());
        }

        private Document apply(final String spec) {
            driver.parse(Document.parse(spec));
            driver.refreshShardKeyPattern(shardKeyPattern);
            return driver.update(null, original);
        }

        @Test
        void noOpsDoNotAffectShardKeys() {
            apply("{$set: {'s.a.0': 1, 's.c.0': 3}}");

            assertFalse(driver.modsAffectShardKeys());
            assertFalse(driver.docWasModified());
        }

        @Test
        void mutatingShardKeyFieldIsRejected() {
            Document updated = apply("{$push: {'s.a': {$each: [2], $slice: -1}}}");

            assertTrue(driver.modsAffectShardKeys());
            ShardKeyViolationException error = assertThrows(
                    ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
            assertEquals("s.a", error.path());
        }

        @Test
        void mutatingShardKeyFieldThroughReplacementIsRejected() {
            Document updated = apply("{x: [1], s: {a: [2], b: [2], c: [3, 3, 3]}}");

            assertTrue(driver.modsAffectShardKeys());
            assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void settingShardKeyFieldToSameValueIsNotRejected() {
            Document updated = apply("{$push: {'s.a': {$each: [1], $slice: -1}}}");

            assertTrue(driver.modsAffectShardKeys());
            assertDoesNotThrow(() -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void unsettingShardKeyFieldIsRejected() {
            Document updated = apply("{$unset: {'s.a': 1}}");

            assertTrue(driver.modsAffectShardKeys());
            assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void settingShardKeyChildrenIsRejected() {
            Document updated = apply("{$set: {'s.c.0': 0}}");

            assertTrue(driver.modsAffectShardKeys());
            ShardKeyViolationException error = assertThrows(
                    ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
            assertEquals("s.c", error.path());
        }

        @Test
        void unsettingShardKeyChildrenIsRejected() {
            Document updated = apply("{$unset: {'s.c.0': 1}}");

            assertTrue(driver.modsAffectShardKeys());
            assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void settingShardKeyChildrenToSameValueIsNotRejected() {
            Document updated = apply("{$push: {'s.c': {$each: [3], $slice: -3}}}");

            assertTrue(driver.modsAffectShardKeys());
            assertDoesNotThrow(() -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void appendingToShardKeyChildrenIsRejected() {
            Document updated = apply("{$push: {'s.c': 4}}");

            assertTrue(driver.modsAffectShardKeys());
            assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void modificationsToUnrelatedFieldsAreAllowed() {
            Document updated = apply("{$set: {x: 2, 's.b': 'x'}}");

            assertFalse(driver.modsAffectShardKeys());
            assertTrue(driver.docWasModified());
            assertDoesNotThrow(() -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void removingUnrelatedFieldsIsAllowed() {
            apply("{$unset: {x: 1, 's.b': 1}}");

            assertFalse(driver.modsAffectShardKeys());
        }

        @Test
        void addingUnrelatedFieldsIsAllowed() {
            apply("{$set: {z: 1}}");

            assertFalse(driver.modsAffectShardKeys());
        }

        @Test
        void overwritingShardKeyFieldsWithSameValuesByReplacementIsAllowed() {
            Document updated = apply("{x: [1], s: {a: [1], b: [2], c: [3, 3, 3]}}");

            assertTrue(driver.modsAffectShardKeys());
            assertDoesNotThrow(() -> driver.checkShardKeysUnaltered(original, updated));
        }

        @Test
        void refreshedPatternReplacesPrevious() {
            driver.parse(Document.parse("{$set: {'s.b': 'x'}}"));
            driver.refreshShardKeyPattern(shardKeyPattern);
            driver.update(null, original);
            assertFalse(driver.modsAffectShardKeys());

            driver.refreshShardKeyPattern(Document.parse("{'s.b': 1}"));
            Document updated = driver.update(null, original);

            assertTrue(driver.modsAffectShardKeys());
            assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
        }
    }

    @Test
    void oneDocumentFailingDoesNotAffectOthers() {
        UpdateDriver driver = new UpdateDriver(UpdateDriver.Options.defaults());
        driver.parse(Document.parse("{$set: {'profile.city': 'Seoul'}}"));

        List<Document> targets = List.of(
                Document.parse("{_id: 1, profile: {}}"),
                Document.parse("{_id: 2, profile: 'scalar'}"),
                Document.parse("{_id: 3}"));
        List<Object> outcomes = new ArrayList<>();
        for (Document target : targets) {
            try {
                outcomes.add(driver.update(null, target));
            } catch (final PathConflictException exception) {
                outcomes.add(exception.path());
            }
        }

        assertEquals(Document.parse("{_id: 1, profile: {city: 'Seoul'}}"), outcomes.get(0));
        assertEquals("profile.city", outcomes.get(1));
        assertEquals(Document.parse("{_id: 3, profile: {city: 'Seoul'}}"), outcomes.get(2));
    }

    @Test
    void flagsDescribeOnlyTheMostRecentUpdate() {
        UpdateDriver driver = new UpdateDriver(UpdateDriver.Options.builder()
                .shardKeyPattern(new Document("region", 1))
                .build());
        driver.parse(Document.parse("{$set: {region: 'eu'}}"));

        driver.update(null, Document.parse("{_id: 1, region: 'us'}"));
        assertTrue(driver.modsAffectShardKeys());
        assertTrue(driver.docWasModified());

        driver.update(null, Document.parse("{_id: 2, region: 'eu'}"));
        assertFalse(driver.modsAffectShardKeys());
        assertFalse(driver.docWasModified());
    }

    @Test
    void shardKeyPatternFromOptionsIsUsed() {
        UpdateDriver driver = new UpdateDriver(UpdateDriver.Options.builder()
                .shardKeyPattern(new Document("region", 1))
                .build());
        driver.parse(Document.parse("{$set: {region: 'eu'}}"));

        Document original = Document.parse("{_id: 1, region: 'us'}");
        Document updated = driver.update(null, original);

        assertTrue(driver.modsAffectShardKeys());
        assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
    }

    @Test
    void insertContextAppliesSetOnInsert() {
        UpdateDriver driver = new UpdateDriver(UpdateDriver.Options.builder()
                .context(UpdateContext.INSERT)
                .build());
        driver.parse(Document.parse("{$setOnInsert: {createdBy: 'upsert'}, $set: {n: 1}}"));

        assertEquals(Document.parse("{createdBy: 'upsert', n: 1}"), driver.update(null, new Document()));

        driver.setContext(UpdateContext.UPDATE);
        assertEquals(Document.parse("{n: 1}"), driver.update(null, new Document()));
    }

    @Test
    void failuresAreLoggedWithStructuredDetails() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Clock fixedClock = Clock.fixed(Instant.parse("2026-02-23T10:00:00Z"), ZoneOffset.UTC);
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, fixedClock, JsonLinesLogger.DEBUG);
        UpdateDriver driver = new UpdateDriver(UpdateDriver.Options.builder()
                .logger(logger)
                .requestId("req-7")
                .namespace("db.users")
                .shardKeyPattern(new Document("k", 1))
                .build());

        assertThrows(UnknownOperatorException.class, () -> driver.parse(Document.parse("{$xyz: {a: 1}}")));
        driver.parse(Document.parse("{$set: {k: 2}}"));
        Document original = new Document("k", 1);
        Document updated = driver.update(null, original);
        assertThrows(ShardKeyViolationException.class, () -> driver.checkShardKeysUnaltered(original, updated));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(3, lines.length);

        Document rejected = Document.parse(lines[0]);
        assertEquals("WARN", rejected.getString("level"));
        assertEquals("req-7", rejected.getString("requestId"));
        assertEquals("parse", rejected.getString("operation"));
        assertEquals("db.users", rejected.getString("namespace"));
        assertEquals("$xyz", rejected.getString("operator"));
        assertEquals(9, rejected.getInteger("code"));

        Document parsed = Document.parse(lines[1]);
        assertEquals("DEBUG", parsed.getString("level"));
        assertEquals(1, parsed.getInteger("numMods"));

        Document violation = Document.parse(lines[2]);
        assertEquals("ERROR", violation.getString("level"));
        assertEquals("checkShardKeys", violation.getString("operation"));
        assertEquals("k", violation.getString("shardKeyPath"));
        assertEquals("ImmutableField", violation.getString("codeName"));
    }
}
