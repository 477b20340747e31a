package com.taskquery.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PropertyExpressionTest {

    @Test
    void testPlainKeyValue() {
        PropertyExpression expression = PropertyExpression.parse("[type:Project]").orElseThrow();

        assertEquals("type", expression.key());
        assertEquals("Project", expression.value());
        assertFalse(expression.exact());
        assertEquals("type:Project", expression.canonical());
    }

    @Test
    void testQuotedKeyAndValue() {
        PropertyExpression expression = PropertyExpression.parse("[\"due date\":\"2024-01-01\"]").orElseThrow();

        assertEquals("due date", expression.key());
        assertEquals("2024-01-01", expression.value());
        assertTrue(expression.keyQuoted());
        assertTrue(expression.valueQuoted());
        assertTrue(expression.exact());
    }

    @Test
    void testKeyOnlyForms() {
        assertTrue(PropertyExpression.parse("[type]").orElseThrow().keyOnly());
        assertTrue(PropertyExpression.parse("[type:]").orElseThrow().keyOnly());
        assertTrue(PropertyExpression.parse("[type:   ]").orElseThrow().keyOnly());
    }

    @Test
    void testQuotedEmptyValueIsNotKeyOnly() {
        PropertyExpression expression = PropertyExpression.parse("[type:\"\"]").orElseThrow();

        assertFalse(expression.keyOnly());
        assertEquals("", expression.value());
        assertTrue(expression.exact());
    }

    @Test
    void testSpacesAroundColonAndValue() {
        PropertyExpression expression = PropertyExpression.parse("[size : >100 ]").orElseThrow();

        assertEquals("size", expression.key());
        assertEquals(">100", expression.value());
    }

    @Test
    void testInvalidBrackets() {
        assertTrue(PropertyExpression.parse("[]").isEmpty());
        assertTrue(PropertyExpression.parse("[type").isEmpty());
        assertTrue(PropertyExpression.parse("type:Project").isEmpty());
        assertTrue(PropertyExpression.parse(null).isEmpty());
    }

    @Test
    void testEscapedQuoteInValue() {
        PropertyExpression expression = PropertyExpression.parse("[title:\"say \\\"hi\\\"\"]").orElseThrow();

        assertEquals("say \"hi\"", expression.value());
        assertNull(PropertyExpression.parse("[type]").orElseThrow().value());
    }
}
