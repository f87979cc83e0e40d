package com.stylematch.syntax;

import com.stylematch.config.PropertyCatalog;
import com.stylematch.exception.SyntaxParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SyntaxTokenizer, ExpressionParser and StyleSyntaxParser.
 */
class StyleSyntaxParserTest {

    private StyleSyntaxParser parser;

    @BeforeEach
    void setUp() {
        PropertyCatalog catalog = new PropertyCatalog(
                Map.of(
                        "width", "<length-percentage> | auto",
                        "flex-basis", "<'width'>",
                        "loop-a", "<'loop-b'>",
                        "loop-b", "<'loop-a'>"),
                Map.of(
                        "length-percentage", "<length> | <percentage>",
                        "self", "<self> | auto"));
        parser = new StyleSyntaxParser(catalog);
    }

    // =====================================================================
    // Tokenizer
    // =====================================================================

    @Test
    @DisplayName("Should tokenize operators, terms and ranges")
    void shouldTokenize() {
        List<SyntaxToken> tokens = new SyntaxTokenizer("[ <length> || <'width'> ]{1,4} && a-b#").tokenize();

        List<SyntaxTokenType> types = tokens.stream().map(SyntaxToken::type).toList();
        assertEquals(List.of(
                SyntaxTokenType.LBRACKET,
                SyntaxTokenType.DATA_TYPE,
                SyntaxTokenType.DOUBLE_BAR,
                SyntaxTokenType.PROPERTY_REF,
                SyntaxTokenType.RBRACKET,
                SyntaxTokenType.RANGE,
                SyntaxTokenType.DOUBLE_AMPERSAND,
                SyntaxTokenType.KEYWORD,
                SyntaxTokenType.HASH,
                SyntaxTokenType.EOF), types);
        assertEquals("length", tokens.get(1).literal());
        assertEquals("width", tokens.get(3).literal());
        assertArrayEquals(new int[]{1, 4}, (int[]) tokens.get(5).literal());
    }

    @Test
    @DisplayName("Should read open-ended ranges")
    void shouldReadOpenEndedRange() {
        List<SyntaxToken> tokens = new SyntaxTokenizer("a{2,}").tokenize();
        assertArrayEquals(new int[]{2, ExpressionMultiplier.UNBOUNDED}, (int[]) tokens.get(1).literal());
    }

    @ParameterizedTest
    @ValueSource(strings = {"a & b", "<length", "<'width>", "a{2", "a{3,1}", "a $ b", "<>"})
    @DisplayName("Should reject malformed syntax text")
    void shouldRejectMalformedText(String syntax) {
        SyntaxParseException e = assertThrows(SyntaxParseException.class,
                () -> new SyntaxTokenizer(syntax).tokenize());
        assertTrue(e.getMessage().startsWith("Invalid syntax at position"));
        assertTrue(e.getPosition() >= 0);
    }

    // =====================================================================
    // Parser
    // =====================================================================

    @Test
    @DisplayName("Should honor combinator precedence")
    void shouldHonorPrecedence() {
        Expression root = parser.parseOrThrow("a b && c || d | e");

        assertEquals(ExpressionCombinator.OR, root.combinator());
        Expression orOr = root.subExpressions().get(0);
        assertEquals(ExpressionCombinator.OR_OR, orOr.combinator());
        Expression andAnd = orOr.subExpressions().get(0);
        assertEquals(ExpressionCombinator.AND_AND, andAnd.combinator());
        assertEquals(ExpressionCombinator.JUXTAPOSITION, andAnd.subExpressions().get(0).combinator());
        assertEquals("e", root.subExpressions().get(1).keyword());
    }

    @Test
    @DisplayName("Should collapse single-element combinators")
    void shouldCollapseSingleElements() {
        Expression root = parser.parseOrThrow("<length>");
        assertEquals(ExpressionType.DATA, root.type());
        assertEquals(DataType.LENGTH, root.dataType());
    }

    @Test
    @DisplayName("Should wrap multiplied terms in groups")
    void shouldWrapMultipliedTerms() {
        Expression root = parser.parseOrThrow("<length>{1,4}");
        assertEquals(ExpressionCombinator.GROUP, root.combinator());
        assertEquals(ExpressionMultiplier.range(1, 4), root.multiplier());
        assertEquals(DataType.LENGTH, root.subExpressions().get(0).dataType());

        Expression bracket = parser.parseOrThrow("[ a | b ]?");
        assertEquals(ExpressionCombinator.GROUP, bracket.combinator());
        assertEquals(ExpressionMultiplier.optional(), bracket.multiplier());
        assertEquals(ExpressionCombinator.OR, bracket.subExpressions().get(0).combinator());
    }

    @Test
    @DisplayName("Should parse every multiplier form")
    void shouldParseMultipliers() {
        assertEquals(ExpressionMultiplier.zeroOrMore(), parser.parseOrThrow("a*").multiplier());
        assertEquals(ExpressionMultiplier.oneOrMore(), parser.parseOrThrow("a+").multiplier());
        assertEquals(ExpressionMultiplier.range(2, 2), parser.parseOrThrow("a{2}").multiplier());
        assertEquals(ExpressionMultiplier.commaList(1, ExpressionMultiplier.UNBOUNDED),
                parser.parseOrThrow("a#").multiplier());
        assertEquals(ExpressionMultiplier.commaList(1, 3), parser.parseOrThrow("a#{1,3}").multiplier());
    }

    @Test
    @DisplayName("Should expand definitions and property references")
    void shouldExpandReferences() {
        Expression width = parser.parseOrThrow("<'width'>");
        assertEquals(ExpressionCombinator.GROUP, width.combinator());
        assertEquals("[ [ <length> | <percentage> ] | auto ]", width.toString());

        Expression flexBasis = parser.parseOrThrow("<'flex-basis'>");
        assertEquals("[ [ [ <length> | <percentage> ] | auto ] ]", flexBasis.toString());
    }

    @Test
    @DisplayName("Should detect recursive references")
    void shouldDetectRecursion() {
        assertThrows(SyntaxParseException.class, () -> parser.parseOrThrow("<'loop-a'>"));
        assertThrows(SyntaxParseException.class, () -> parser.parseOrThrow("<self>"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"<unknown-type>", "<'unknown-prop'>", "a | | b", "[ a b", "a ]", "a?+", "| a"})
    @DisplayName("Should reject malformed syntax structure")
    void shouldRejectMalformedStructure(String syntax) {
        assertThrows(SyntaxParseException.class, () -> parser.parseOrThrow(syntax));
        assertTrue(parser.parse(syntax).isEmpty());
    }

    @Test
    @DisplayName("Should cache parsed trees")
    void shouldCacheTrees() {
        Expression first = parser.parse("<length> | auto").orElseThrow();
        Expression second = parser.parse("<length> | auto").orElseThrow();
        assertSame(first, second);
        assertTrue(parser.parse("  ").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Should render trees back as syntax")
    void shouldRenderTrees() {
        assertEquals("[ <length> | auto ]{1,4}", parser.parseOrThrow("[ <length> | auto ]{1,4}").toString());
        assertEquals("<length> , <color>", parser.parseOrThrow("<length> , <color>").toString());
    }
}
