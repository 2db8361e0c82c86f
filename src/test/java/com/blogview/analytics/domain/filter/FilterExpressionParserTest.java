package com.blogview.analytics.domain.filter;

import com.blogview.analytics.config.AnalyticsProperties;
import com.blogview.analytics.domain.exception.AnalyticsValidationException;
import com.blogview.analytics.domain.exception.ExpressionTooDeepException;
import com.blogview.analytics.domain.exception.UnsupportedOperatorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterExpressionParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FilterExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new FilterExpressionParser(new AnalyticsProperties());
    }

    @Test
    void testParse_NestedGroups() throws Exception {
        FilterExpression expression = parser.parse(json(
                "{\"operator\":\"or\",\"conditions\":["
                        + "{\"field\":\"country.code\",\"value\":\"US\"},"
                        + "{\"operator\":\"not\",\"conditions\":[{\"field\":\"blog.id\",\"op\":\"GTE\",\"value\":5}]}"
                        + "]}"));

        FilterGroup root = (FilterGroup) expression;
        assertEquals(Combinator.OR, root.getCombinator());
        assertEquals(2, root.getChildren().size());

        FilterLeaf first = (FilterLeaf) root.getChildren().get(0);
        assertEquals("country.code", first.getField());
        assertEquals(Operator.EQ, first.getOperator());
        assertEquals("US", first.getValue());

        FilterGroup negated = (FilterGroup) root.getChildren().get(1);
        assertEquals(Combinator.NOT, negated.getCombinator());
        FilterLeaf inner = (FilterLeaf) negated.getChildren().get(0);
        assertEquals(Operator.GTE, inner.getOperator());
        assertEquals(5L, inner.getValue());
        assertEquals(3, expression.depth());
    }

    @Test
    void testParse_GroupOperatorDefaultsToAnd() throws Exception {
        FilterGroup group = (FilterGroup) parser.parse(json("{\"conditions\":[]}"));

        assertEquals(Combinator.AND, group.getCombinator());
        assertTrue(group.getChildren().isEmpty());
    }

    @Test
    void testParse_BareLeaf() throws Exception {
        FilterLeaf leaf = (FilterLeaf) parser.parse(json("{\"field\":\"blog.title\",\"op\":\"contains\",\"value\":\"java\"}"));

        assertEquals(Operator.CONTAINS, leaf.getOperator());
        assertEquals(1, leaf.depth());
    }

    @Test
    void testParse_UnknownOperator() {
        UnsupportedOperatorException ex = assertThrows(UnsupportedOperatorException.class,
                () -> parser.parse(json("{\"field\":\"blog.id\",\"op\":\"like\",\"value\":1}")));

        assertEquals("like", ex.getOperator());
    }

    @Test
    void testParse_UnknownCombinator() {
        assertThrows(AnalyticsValidationException.class,
                () -> parser.parse(json("{\"operator\":\"xor\",\"conditions\":[]}")));
    }

    @Test
    void testParse_Malformed() {
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("[]")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"conditions\":{}}")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"conditions\":[\"US\"]}")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"op\":\"eq\",\"value\":1}")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"field\":\"  \",\"value\":1}")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"field\":\"blog.id\"}")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"field\":\"blog.id\",\"value\":null}")));
        assertThrows(AnalyticsValidationException.class, () -> parser.parse(json("{\"field\":\"blog.id\",\"value\":[1]}")));
    }

    @Test
    @DisplayName("Nesting beyond the configured depth is rejected")
    void testParse_TooDeep() throws Exception {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.setMaxExpressionDepth(3);
        FilterExpressionParser shallow = new FilterExpressionParser(properties);

        String leaf = "{\"field\":\"blog.id\",\"value\":1}";
        String depthThree = "{\"conditions\":[{\"conditions\":[" + leaf + "]}]}";
        String depthFour = "{\"conditions\":[" + depthThree + "]}";

        assertEquals(3, shallow.parse(json(depthThree)).depth());
        assertThrows(ExpressionTooDeepException.class, () -> shallow.parse(json(depthFour)));
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
