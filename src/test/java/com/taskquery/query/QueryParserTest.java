package com.taskquery.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QueryParserTest {

    @Test
    void testSimpleTerm() {
        assertParse("hello", QueryNode.Term.class);
    }

    @Test
    void testPhrase() {
        QueryNode.Phrase phrase = assertInstanceOf(QueryNode.Phrase.class, parse("\"star wars\""));
        assertEquals("star wars", phrase.value());
    }

    @Test
    void testMidExpressionNotCombinesWithAnd() {
        assertEquals("and(term(a), not(term(b)))", render("a -b"));
    }

    @Test
    void testLeadingNotIsPrefixOperator() {
        assertEquals("not(term(x))", render("-x"));
    }

    @Test
    void testConsecutiveNotsNestRightward() {
        assertEquals("and(term(a), not(and(term(b), not(term(c)))))", render("a -b -c"));
        assertEquals("not(and(term(b), not(term(c))))", render("-b -c"));
        assertEquals("and(term(a), not(term(b)), term(c))", render("a -b c"));
    }

    @Test
    void testDoubleNot() {
        assertEquals("not(not(term(x)))", render("--x"));
    }

    @Test
    void testImplicitAndIsFlattened() {
        assertEquals("and(term(a), term(b), term(c))", render("a b c"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a OR b | or(term(a), term(b))",
            "a AND b OR c | or(and(term(a), term(b)), term(c))",
            "a OR b AND c | or(term(a), and(term(b), term(c)))",
            "a OR b c | and(or(term(a), term(b)), term(c))",
            "(a OR b) c | and(or(term(a), term(b)), term(c))",
            "a and b | and(term(a), term(b))"
    })
    void testOperatorPrecedence(String query, String expected) {
        assertEquals(expected, render(query));
    }

    @Test
    void testPrefixFilter() {
        QueryNode.PrefixFilter filter = assertInstanceOf(QueryNode.PrefixFilter.class, parse("tag:context"));
        assertEquals(FilterField.TAG, filter.field());
        assertEquals("context", filter.value());
        assertFalse(filter.exact());
    }

    @Test
    void testQuotedPrefixFilterIsExact() {
        QueryNode.PrefixFilter filter = assertInstanceOf(QueryNode.PrefixFilter.class, parse("tag:\"context\""));
        assertTrue(filter.exact());
    }

    @Test
    void testAdjacentPrefixFiltersJoinWithAnd() {
        assertEquals("and(scheduled(today), state(TODO))", render("scheduled:today state:TODO"));
    }

    @Test
    void testRangeFilter() {
        QueryNode.RangeFilter range = assertInstanceOf(QueryNode.RangeFilter.class,
                parse("scheduled:2024-01-01..2024-01-31"));
        assertEquals(FilterField.SCHEDULED, range.field());
        assertEquals("2024-01-01", range.start());
        assertEquals("2024-01-31", range.end());
    }

    @Test
    void testRangeInsideOrAndNot() {
        assertEquals("or(term(x), deadline(2024-01-01..2024-01-31))", render("x OR deadline:2024-01-01..2024-01-31"));
        assertEquals("not(scheduled(2024-01-01..2024-01-31))", render("-scheduled:2024-01-01..2024-01-31"));
    }

    @Test
    void testRangeOnNonDateFieldFails() {
        QueryParseException error = assertThrows(QueryParseException.class, () -> parse("tag:a..b"));
        assertTrue(error.getMessage().startsWith("Range operator"));

        assertThrows(QueryParseException.class, () -> parse("tag:foo-bar..baz"));
    }

    @Test
    void testStrayRangeFails() {
        assertThrows(QueryParseException.class, () -> parse("foo ..bar"));
    }

    @Test
    void testPropertyFilters() {
        QueryNode.PropertyFilter plain = assertInstanceOf(QueryNode.PropertyFilter.class, parse("[type:Project]"));
        assertEquals("type", plain.key());
        assertEquals("Project", plain.value());
        assertFalse(plain.exact());

        QueryNode.PropertyFilter quoted = assertInstanceOf(QueryNode.PropertyFilter.class, parse("[type:\"Project\"]"));
        assertTrue(quoted.exact());

        QueryNode.PropertyFilter keyOnly = assertInstanceOf(QueryNode.PropertyFilter.class, parse("[type]"));
        assertTrue(keyOnly.keyOnly());
        assertNull(keyOnly.value());
    }

    @Test
    void testNegatedPropertyGroup() {
        assertEquals("and(state(TODO), not(or(property(type:Project), property(type:Task))))",
                render("state:TODO -([type:Project] OR [type:Task])"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "meeting OR | Unexpected end of expression",
            "'' | Unexpected end of expression",
            "(a | Expected closing parenthesis",
            "a) | Unmatched closing parenthesis",
            "() | 'Unexpected token: )'",
            "path: | Expected value after prefix path:"
    })
    void testSyntaxErrors(String query, String message) {
        QueryParseException error = assertThrows(QueryParseException.class, () -> parse(query));
        assertEquals(message, error.getMessage());
    }

    @Test
    void testErrorPositionAndDescription() {
        QueryParseException error = assertThrows(QueryParseException.class, () -> parse("meeting OR"));
        assertEquals(10, error.getPosition());
        assertEquals("meeting OR", error.getQueryString());
        assertTrue(error.describe().endsWith("          ^"));
    }

    @Test
    void testReparseYieldsEqualTree() {
        String query = "(meeting OR call) tag:work -[type:Archive] scheduled:2024-01..2024-03";
        assertEquals(parse(query), parse(query));
    }

    @Test
    void testParseFromTokens() {
        QueryNode node = new QueryParser().parse(new QueryLexer().tokenize("a OR b"));
        assertInstanceOf(QueryNode.Or.class, node);
    }

    private QueryNode parse(String query) {
        return new QueryParser().parse(query);
    }

    private String render(String query) {
        return QueryNodes.render(parse(query));
    }

    private void assertParse(String query, Class<? extends QueryNode> expectedType) {
        assertTrue(expectedType.isInstance(parse(query)));
    }
}
