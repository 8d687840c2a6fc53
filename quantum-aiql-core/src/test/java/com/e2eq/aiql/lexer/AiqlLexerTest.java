package com.e2eq.aiql.lexer;

import com.e2eq.aiql.exceptions.LexException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class AiqlLexerTest {

    private static List<Token> lex(String source) {
        return new AiqlLexer(source).tokenize();
    }

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : lex(source)) {
            out.add(t.type());
        }
        return out;
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        List<Token> tokens = lex("");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type());
    }

    @Test
    void testConceptVersusLessThan() {
        assertEquals(List.of(TokenType.CONCEPT, TokenType.EOF), types("<Python>"));
        assertEquals("<Python>", lex("<Python>").get(0).value());

        assertEquals(List.of(TokenType.LT, TokenType.NUMBER, TokenType.EOF), types("<10"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LT, TokenType.IDENTIFIER, TokenType.EOF), types("x < y"));
        assertEquals(List.of(TokenType.LTE, TokenType.NUMBER, TokenType.EOF), types("<=5"));
        // a structural character before '>' means this is not a concept
        assertEquals(TokenType.LT, lex("<a(b)>").get(0).type());
    }

    @Test
    void testConceptLookaheadIsBounded() {
        String longName = "<" + "a".repeat(AiqlLexer.CONCEPT_LOOKAHEAD + 10) + ">";
        List<Token> tokens = lex(longName);
        assertEquals(TokenType.LT, tokens.get(0).type());
    }

    @Test
    void testRelationVersusListOpen() {
        assertEquals(List.of(TokenType.RELATION, TokenType.EOF), types("[is_a]"));
        assertEquals("[is_a]", lex("[is_a]").get(0).value());

        List<Token> list = lex("[a,b]");
        assertEquals(TokenType.SYMBOL, list.get(0).type());
        assertEquals("[", list.get(0).value());
        assertEquals(List.of(TokenType.SYMBOL, TokenType.IDENTIFIER, TokenType.SYMBOL, TokenType.IDENTIFIER,
                TokenType.SYMBOL, TokenType.EOF), types("[a,b]"));
        assertEquals(TokenType.SYMBOL, lex("[<A>]").get(0).type());
        assertEquals(TokenType.SYMBOL, lex("[\"x\"]").get(0).type());
    }

    @Test
    void testSlashDisambiguation() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.DIVIDE, TokenType.NUMBER, TokenType.EOF), types("10 / 2"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.EOF), types("10 // trailing comment"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF), types("1 /* block\n comment */ 2"));
    }

    @Test
    void testCommentsEmittedOnlyWhenPreservingWhitespace() {
        List<Token> tokens = new AiqlLexer("1 // note", LexerOptions.defaults().withWhitespace()).tokenize();
        assertEquals(List.of(TokenType.NUMBER, TokenType.WHITESPACE, TokenType.COMMENT, TokenType.EOF),
                tokens.stream().map(Token::type).toList());
        assertEquals("// note", tokens.get(2).value());
    }

    @Test
    void testHashMarkers() {
        Token seq = lex("##step_1").get(0);
        assertEquals(TokenType.SEQ_NUM, seq.type());
        assertEquals("##step_1", seq.value());

        assertEquals(TokenType.EXAMPLE_MARKER, lex("#example:").get(0).type());
        assertEquals(TokenType.EXAMPLE_PATTERN, lex("#example_pattern:").get(0).type());

        Token directive = lex("#strict").get(0);
        assertEquals(TokenType.DIRECTIVE, directive.type());
        assertEquals("#strict", directive.value());
    }

    @Test
    void testDollarTildeAndAtSigils() {
        assertEquals(TokenType.ID_MARKER, lex("$id:launch").get(0).type());
        assertEquals("$id:launch", lex("$id:launch").get(0).value());
        assertEquals(TokenType.GROUP_ID, lex("$$mission").get(0).type());
        assertEquals(TokenType.TEMPERATURE, lex("~0.7").get(0).type());
        assertEquals(TokenType.ENTROPY, lex("~~high").get(0).type());

        assertEquals(TokenType.CONFIDENCE, lex("@0.95").get(0).type());
        assertEquals("@0.95", lex("@0.95").get(0).value());
        assertEquals("@coherence:0.8", lex("@coherence:0.8").get(0).value());
        assertEquals("@version:\"2.0.0\"", lex("@version:\"2.0.0\"").get(0).value());
        assertEquals(TokenType.ORIGIN, lex("@origin:doi:10.1234/xyz").get(0).type());
        assertEquals("@origin:doi:10.1234/xyz", lex("@origin:doi:10.1234/xyz").get(0).value());

        Token cite = lex("@cite:[\"a\",\"b\"] !Assert").get(0);
        assertEquals(TokenType.CITE, cite.type());
        assertEquals("@cite:[\"a\",\"b\"]", cite.value());
    }

    @Test
    void testOperatorsAndArrow() {
        assertEquals(List.of(TokenType.GT, TokenType.GTE, TokenType.EQ, TokenType.ASSIGN, TokenType.NEQ,
                TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY, TokenType.MODULO, TokenType.POWER, TokenType.EOF),
                types("> >= == = != + - * % ^"));
        Token arrow = lex("->").get(0);
        assertTrue(arrow.isSymbol("->"));
    }

    @Test
    void testIntentToken() {
        Token intent = lex("!Assert { }").get(0);
        assertEquals(TokenType.INTENT, intent.type());
        assertEquals("!Assert", intent.value());
    }

    @Test
    void testNumbersWithExponent() {
        assertEquals("1.5e-10", lex("1.5e-10").get(0).value());
        assertEquals("2E+5", lex("2E+5").get(0).value());
        // 'e' not followed by a digit or sign is a separate token
        assertEquals(List.of(TokenType.NUMBER, TokenType.EULER, TokenType.EOF), types("2 e"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.EOF), types("2ex"));
    }

    @Test
    void testKeywordsAreCaseInsensitive() {
        Token and = lex("AND").get(0);
        assertEquals(TokenType.AND, and.type());
        assertEquals("and", and.value());
        assertEquals(TokenType.INFINITY, lex("inf").get(0).type());
        assertEquals(TokenType.INFINITY, lex("Infinity").get(0).type());
        assertEquals(TokenType.SUMMATION, lex("sum").get(0).type());
        assertEquals(TokenType.IDENTIFIER, lex("summary").get(0).type());
        assertEquals(TokenCategory.QUANTIFIER, lex("forall").get(0).category());
    }

    @Test
    void testStringsKeepQuotesAndEscapes() {
        Token s = lex("\"say \\\"hi\\\"\"").get(0);
        assertEquals(TokenType.STRING, s.type());
        assertEquals("\"say \\\"hi\\\"\"", s.value());
    }

    @Test
    void testPositionsAreOneBased() {
        List<Token> tokens = lex("!Assert {\n  <A> [is] <B>\n}");
        Token concept = tokens.get(2);
        assertEquals(TokenType.CONCEPT, concept.type());
        assertEquals(2, concept.line());
        assertEquals(3, concept.column());
        Token relation = tokens.get(3);
        assertEquals(2, relation.line());
        assertEquals(7, relation.column());
    }

    @Test
    void testRoundTripOfSingleTokens() {
        String source = "!Assert(scope:global) { <Python> [is_a] <Language> { year: >= 1991, name: \"py\" } } "
                + "@0.9 @coherence:0.8 $id:p $$g ##1 ~0.5 ~~low #strict 10 / 2 - 3 * 4 % 5 ^ 6 "
                + "forall exists and or not implies iff in then true false union intersect lambda pi e inf != == <= ->";
        for (Token original : lex(source)) {
            if (original.type() == TokenType.EOF) {
                continue;
            }
            List<Token> again = lex(original.value());
            assertEquals(2, again.size(), "re-lexing " + original.value());
            assertEquals(original.type(), again.get(0).type(), "type of " + original.value());
            assertEquals(original.value(), again.get(0).value());
        }
    }

    @Test
    void testLexErrors() {
        LexException s = assertThrows(LexException.class, () -> lex("!Assert { \"open"));
        assertEquals(1, s.getLine());
        assertEquals(11, s.getColumn());
        assertThrows(LexException.class, () -> lex("/* never closed"));
        assertThrows(LexException.class, () -> lex("[unclosed"));
        LexException bad = assertThrows(LexException.class, () -> lex("<A> ? <B>"));
        assertTrue(bad.getMessage().contains("Unexpected character"));
        assertEquals(5, bad.getColumn());
    }

    @Test
    void testInputSizeCap() {
        LexerOptions tiny = LexerOptions.defaults().withMaxInputSize(8);
        assertThrows(LexException.class, () -> new AiqlLexer("!Assert { <A> [p] <B> }", tiny).tokenize());
        assertEquals(2, new AiqlLexer("<A>", tiny).tokenize().size());
        assertThrows(IllegalArgumentException.class, () -> LexerOptions.defaults().withMaxInputSize(0));
    }
}
