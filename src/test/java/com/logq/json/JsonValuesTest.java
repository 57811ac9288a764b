package com.logq.json;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class JsonValuesTest {

    private final LogJsonParser parser = new LogJsonParser();

    @ParameterizedTest
    @ValueSource(strings = {"0", "0.0", "-0", "\"\"", "false", "null"})
    public void testFalsyValues(String json) throws IOException {
        assertFalse(JsonValues.isTruthy(parser.parse(json)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "-2.5", "\"0\"", "\" \"", "true", "[]", "{}"})
    public void testTruthyValues(String json) throws IOException {
        assertTrue(JsonValues.isTruthy(parser.parse(json)));
    }

    @Test
    public void testAbsentIsFalsy() {
        assertFalse(JsonValues.isTruthy(null));
    }

    @Test
    public void testNumbersEqualAcrossRepresentations() {
        assertTrue(JsonValues.strictEquals(JsonNode.JsonNumber.of(30L), JsonNode.JsonNumber.of(30.0)));
        assertFalse(JsonValues.strictEquals(JsonNode.JsonNumber.of(30L), JsonNode.JsonNumber.of(30.5)));
    }

    @Test
    public void testStrictEqualsDoesNotCoerce() {
        assertFalse(JsonValues.strictEquals(new JsonNode.JsonString("30"), JsonNode.JsonNumber.of(30L)));
        assertFalse(JsonValues.strictEquals(JsonNode.JsonBoolean.TRUE, JsonNode.JsonNumber.of(1L)));
        assertFalse(JsonValues.strictEquals(JsonNode.JsonNull.INSTANCE, JsonNode.JsonNumber.of(0L)));
    }

    @Test
    public void testAbsentNeverEquals() {
        assertFalse(JsonValues.strictEquals(null, JsonNode.JsonNull.INSTANCE));
        assertFalse(JsonValues.strictEquals(null, null));
    }

    @Test
    public void testStructuralEquality() throws IOException {
        assertTrue(JsonValues.strictEquals(parser.parse("[1,{\"a\":2.0}]"), parser.parse("[1.0,{\"a\":2}]")));
        assertTrue(JsonValues.strictEquals(parser.parse("{\"a\":1,\"b\":2}"), parser.parse("{\"b\":2,\"a\":1}")));
        assertFalse(JsonValues.strictEquals(parser.parse("{\"a\":1}"), parser.parse("{\"a\":1,\"b\":2}")));
        assertFalse(JsonValues.strictEquals(parser.parse("[1,2]"), parser.parse("[2,1]")));
    }

    @Test
    public void testCompareForFilterOnlyOrdersSameKinds() {
        assertEquals(-1, JsonValues.compareForFilter(JsonNode.JsonNumber.of(2L), JsonNode.JsonNumber.of(10.5)).getAsInt());
        assertEquals(1, JsonValues.compareForFilter(new JsonNode.JsonString("b"), new JsonNode.JsonString("a")).getAsInt());
        assertEquals(-1, JsonValues.compareForFilter(JsonNode.JsonBoolean.FALSE, JsonNode.JsonBoolean.TRUE).getAsInt());
        assertTrue(JsonValues.compareForFilter(new JsonNode.JsonString("2"), JsonNode.JsonNumber.of(1L)).isEmpty());
        assertTrue(JsonValues.compareForFilter(null, JsonNode.JsonNumber.of(1L)).isEmpty());
    }

    @Test
    public void testStringOrderIsCaseSensitive() {
        assertTrue(JsonValues.compareForFilter(new JsonNode.JsonString("Zed"), new JsonNode.JsonString("ann")).getAsInt() < 0);
    }

    @Test
    public void testCompareForSortRanksKinds() {
        JsonNode[] ascending = {
                null,
                JsonNode.JsonNull.INSTANCE,
                JsonNode.JsonBoolean.TRUE,
                JsonNode.JsonNumber.of(-5L),
                new JsonNode.JsonString(""),
                JsonNode.JsonArray.empty(),
                JsonNode.JsonObject.empty()
        };
        for (int i = 0; i + 1 < ascending.length; i++) {
            assertTrue(JsonValues.compareForSort(ascending[i], ascending[i + 1]) < 0, "rank " + i);
            assertTrue(JsonValues.compareForSort(ascending[i + 1], ascending[i]) > 0, "rank " + i);
        }
        assertEquals(0, JsonValues.compareForSort(JsonNode.JsonArray.of(JsonNode.JsonNumber.of(1L)), JsonNode.JsonArray.empty()));
    }

    @Test
    public void testValueOf() {
        assertEquals(JsonNode.JsonNumber.of(3L), JsonValues.valueOf(3));
        assertEquals(JsonNode.JsonNumber.of(1.5), JsonValues.valueOf(1.5f));
        assertEquals(new JsonNode.JsonString("x"), JsonValues.valueOf("x"));
        assertEquals(JsonNode.JsonBoolean.FALSE, JsonValues.valueOf(false));
        assertEquals(JsonNode.JsonNull.INSTANCE, JsonValues.valueOf(null));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.valueOf(new Object()));
    }
}
