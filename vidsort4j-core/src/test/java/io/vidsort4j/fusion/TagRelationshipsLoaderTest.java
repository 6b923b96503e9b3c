package io.vidsort4j.fusion;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagRelationshipsLoaderTest {

    private final TagRelationshipsLoader loader = new TagRelationshipsLoader(new ObjectMapper());

    @Test
    void bundledRelationshipsShouldDescribeTheHierarchy() throws Exception {
        TagRelationships r = loader.loadDefault();

        assertTrue(r.implicationsOf(Tag.TORTURE).contains(Tag.REPRESSION));
        assertTrue(r.implicationsOf(Tag.PRISONERS).contains(Tag.REPRESSION));
        assertTrue(r.implicationsOf(Tag.BIRTH_PREVENTION).contains(Tag.WOMEN));
        assertTrue(r.impliedByCategory(Category.IMPRISONMENT).contains(Tag.PRISONERS));
        assertTrue(r.visualLabels(Tag.HOSPITALS).contains("ambulance"));
    }

    @Test
    void conflictsShouldBeSymmetric() throws Exception {
        TagRelationships r = loader.loadDefault();

        assertTrue(r.conflicts(Tag.OTHER, Tag.CHILDREN));
        assertTrue(r.conflicts(Tag.CHILDREN, Tag.OTHER));
        assertFalse(r.conflicts(Tag.CHILDREN, Tag.HOSPITALS));
        assertEquals(Tag.values().length - 1, r.conflictsOf(Tag.OTHER).size());
    }

    @Test
    void unknownLabelShouldBeRejected() {
        InputStream in = json("{\"tags\": {\"Drones\": {\"parents\": []}}}");

        assertThrows(IllegalArgumentException.class, () -> loader.load(in));
    }

    @Test
    void unknownReferencedLabelShouldBeRejected() {
        InputStream in = json("{\"tags\": {\"Torture\": {\"parents\": [\"Cruelty\"]}}}");

        assertThrows(IllegalArgumentException.class, () -> loader.load(in));
    }

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
