package com.clusterops.command.model;

import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandDocumentTest {

    @Test
    void fromJson_parsesSections() {
        CommandDocument doc = CommandDocument.fromJson("{\"commandParams\": {\"phase\": \"INITIAL_START\"}}");

        assertEquals("INITIAL_START", doc.section("commandParams").get("phase").asText());
        assertTrue(doc.section("roleParams").isMissingNode());
    }

    @Test
    void fromJson_blankIsEmpty() {
        assertSame(CommandDocument.empty(), CommandDocument.fromJson("  "));
        assertSame(CommandDocument.empty(), CommandDocument.fromJson(null));
        assertTrue(CommandDocument.empty().isEmpty());
    }

    @Test
    void fromJson_malformedThrows() {
        assertThrows(UncheckedIOException.class, () -> CommandDocument.fromJson("{\"clusterName\": "));
    }

    @Test
    void of_missingRootIsEmpty() {
        assertSame(CommandDocument.empty(), CommandDocument.of(null));
        assertSame(CommandDocument.empty(), CommandDocument.of(MissingNode.getInstance()));
    }

    @Test
    void equality_isStructural() {
        CommandDocument a = CommandDocument.fromJson("{\"clusterName\": \"c1\", \"role\": \"DATANODE\"}");
        CommandDocument b = CommandDocument.fromJson("{\"role\": \"DATANODE\", \"clusterName\": \"c1\"}");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
