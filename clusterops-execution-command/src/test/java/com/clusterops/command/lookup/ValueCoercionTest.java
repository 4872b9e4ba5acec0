package com.clusterops.command.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueCoercionTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String DOC = """
            {
              "intText": " 8 ",
              "intNumber": 5,
              "bigNumber": 12345678901,
              "fraction": 1.5,
              "wholeFloat": 8.0,
              "negativeFraction": -0.5,
              "bigText": "12345678901",
              "floatText": "8.0",
              "flagFalse": false,
              "word": "eight",
              "flagTrue": true,
              "flagText": "False",
              "flagOne": 1,
              "flagTwo": 2,
              "port": 8080,
              "object": { "k": "v" },
              "hosts": ["h1", "h2", 3],
              "mixed": ["h1", {"k": "v"}]
            }
            """;

    private static LookupResult<JsonNode> raw(String path) throws Exception {
        return PathLookup.find(MAPPER.readTree(DOC), path);
    }

    @Test
    void toInteger_parsesNumbersAndText() throws Exception {
        assertEquals(8, ValueCoercion.toInteger(raw("intText")).orElse(-1));
        assertEquals(5, ValueCoercion.toInteger(raw("intNumber")).orElse(-1));
    }

    @Test
    void toInteger_truncatesFloatingPointNumbers() throws Exception {
        assertEquals(8, ValueCoercion.toInteger(raw("wholeFloat")).orElse(-1));
        assertEquals(1, ValueCoercion.toInteger(raw("fraction")).orElse(-1));
        assertEquals(0, ValueCoercion.toInteger(raw("negativeFraction")).orElse(-1));
    }

    @Test
    void toInteger_mapsBooleansToOneAndZero() throws Exception {
        assertEquals(1, ValueCoercion.toInteger(raw("flagTrue")).orElse(-1));
        assertEquals(0, ValueCoercion.toInteger(raw("flagFalse")).orElse(-1));
    }

    @Test
    void toInteger_outOfRangeForLargeIntegers() throws Exception {
        LookupResult<Integer> number = ValueCoercion.toInteger(raw("bigNumber"));
        assertTrue(number.isOutOfRange());
        assertFalse(number.isWrongType());
        assertTrue(ValueCoercion.toInteger(raw("bigText")).isOutOfRange());
        assertEquals(7, number.orElse(7));
    }

    @Test
    void toInteger_wrongTypeForNonNumericValues() throws Exception {
        assertTrue(ValueCoercion.toInteger(raw("word")).isWrongType());
        assertTrue(ValueCoercion.toInteger(raw("floatText")).isWrongType());
        assertTrue(ValueCoercion.toInteger(raw("object")).isWrongType());
        assertTrue(ValueCoercion.toInteger(raw("hosts")).isWrongType());
    }

    @Test
    void toInteger_absentStaysAbsent() throws Exception {
        LookupResult<Integer> result = ValueCoercion.toInteger(raw("missing"));
        assertTrue(result.isAbsent());
        assertEquals(Optional.empty(), result.optionalOrThrow());
    }

    @Test
    void optionalOrThrow_raisesOnWrongType() throws Exception {
        ValueCoercionException e = assertThrows(ValueCoercionException.class,
                () -> ValueCoercion.toInteger(raw("word")).optionalOrThrow());
        assertEquals("word", e.getPath());
        assertEquals("integer", e.getExpectedType());
        assertEquals("eight", e.getRawValue().asText());
    }

    @Test
    void optionalOrThrow_raisesOutOfRangeForLargeIntegers() throws Exception {
        ValueOutOfRangeException e = assertThrows(ValueOutOfRangeException.class,
                () -> ValueCoercion.toInteger(raw("bigNumber")).optionalOrThrow());
        assertEquals("bigNumber", e.getPath());
        assertEquals("integer", e.getExpectedType());
    }

    @Test
    void orElse_treatsWrongTypeLikeAbsent() throws Exception {
        assertEquals(7, ValueCoercion.toInteger(raw("word")).orElse(7));
        assertEquals(7, ValueCoercion.toInteger(raw("missing")).orElse(7));
    }

    @Test
    void toBoolean_acceptsBooleansTextAndZeroOne() throws Exception {
        assertEquals(true, ValueCoercion.toBoolean(raw("flagTrue")).orElse(null));
        assertEquals(false, ValueCoercion.toBoolean(raw("flagText")).orElse(null));
        assertEquals(true, ValueCoercion.toBoolean(raw("flagOne")).orElse(null));
        assertTrue(ValueCoercion.toBoolean(raw("flagTwo")).isWrongType());
        assertTrue(ValueCoercion.toBoolean(raw("word")).isWrongType());
    }

    @Test
    void toText_rendersScalarsOnly() throws Exception {
        assertEquals("8080", ValueCoercion.toText(raw("port")).orElse(null));
        assertEquals("true", ValueCoercion.toText(raw("flagTrue")).orElse(null));
        assertTrue(ValueCoercion.toText(raw("object")).isWrongType());
    }

    @Test
    void toStringList_requiresArrayOfScalars() throws Exception {
        assertEquals(List.of("h1", "h2", "3"), ValueCoercion.toStringList(raw("hosts")).orElse(List.of()));
        assertTrue(ValueCoercion.toStringList(raw("mixed")).isWrongType());
        assertTrue(ValueCoercion.toStringList(raw("word")).isWrongType());
    }
}
