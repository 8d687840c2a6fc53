package com.e2eq.aiql.lexer;

import com.e2eq.aiql.exceptions.LexException;

import java.util.*;

/**
 * Converts AIQL source text into an ordered list of tokens terminated by {@link TokenType#EOF}.
 * <p>
 * Several characters are overloaded in the surface syntax and are resolved here with
 * short, bounded scans rather than lookahead tables:
 * </p>
 * <ul>
 *   <li>{@code <} is a concept ({@code <Python>}) or the LT operator ({@code <10}, {@code x < y});</li>
 *   <li>{@code [} is a relation ({@code [is_a]}) or a list opener ({@code [a, b]});</li>
 *   <li>{@code /} opens a line or block comment or is the DIVIDE operator;</li>
 *   <li>{@code #}, {@code $}, {@code ~} and {@code @} select a metadata marker by what follows them.</li>
 * </ul>
 * A lexer instance is not thread-safe; {@link #tokenize()} may be called again and starts over.
 */
public final class AiqlLexer {

    static final int CONCEPT_LOOKAHEAD = 256;

    private static final String LIST_MARKERS = ",<{($\"[";
    private static final String CONCEPT_BREAKERS = "[{()]=";
    private static final String SYMBOLS = "{}():|,&]";
    private static final String MARKER_STOP = "!@$#~<{";

    private static final String EXAMPLE_PATTERN_PREFIX = "#example_pattern:";
    private static final String EXAMPLE_PREFIX = "#example:";
    private static final String COHERENCE_PREFIX = "@coherence:";
    private static final String VERSION_PREFIX = "@version:";
    private static final String ORIGIN_PREFIX = "@origin:";
    private static final String CITE_PREFIX = "@cite:";

    private final String input;
    private final LexerOptions options;

    private int pos;
    private int line;
    private int column;
    private int tokenLine;
    private int tokenColumn;

    public AiqlLexer(String input) {
        this(input, LexerOptions.defaults());
    }

    public AiqlLexer(String input, LexerOptions options) {
        this.input = Objects.requireNonNull(input, "input");
        this.options = Objects.requireNonNull(options, "options");
    }

    public List<Token> tokenize() {
        if (input.length() > options.maxInputSize()) {
            throw new LexException("Input of " + input.length() + " characters exceeds the maximum of "
                    + options.maxInputSize(), 1, 1);
        }
        pos = 0;
        line = 1;
        column = 1;

        List<Token> tokens = new ArrayList<>();
        while (!atEnd()) {
            tokenLine = line;
            tokenColumn = column;
            Token token = next();
            if (token != null) {
                tokens.add(token);
            }
        }
        tokenLine = line;
        tokenColumn = column;
        tokens.add(token(TokenType.EOF, ""));
        return tokens;
    }

    /**
     * Scans one token starting at the current position; returns {@code null} for skipped trivia.
     */
    private Token next() {
        char c = peek();
        if (Character.isWhitespace(c)) {
            return trivia(TokenType.WHITESPACE, consumeWhile(Character::isWhitespace));
        }
        switch (c) {
            case '/':
                return slash();
            case '>':
                return peek(1) == '=' ? operator(TokenType.GTE, 2) : operator(TokenType.GT, 1);
            case '<':
                return lessThanOrConcept();
            case '=':
                return peek(1) == '=' ? operator(TokenType.EQ, 2) : operator(TokenType.ASSIGN, 1);
            case '#':
                return hash();
            case '!':
                return peek(1) == '=' ? operator(TokenType.NEQ, 2) : prefixed(TokenType.INTENT, 1, AiqlLexer::isWordChar);
            case '[':
                return isListOpen() ? operator(TokenType.SYMBOL, 1) : relation();
            case '-':
                return peek(1) == '>' ? operator(TokenType.SYMBOL, 2) : operator(TokenType.MINUS, 1);
            case '+':
                return operator(TokenType.PLUS, 1);
            case '*':
                return operator(TokenType.MULTIPLY, 1);
            case '%':
                return operator(TokenType.MODULO, 1);
            case '^':
                return operator(TokenType.POWER, 1);
            case '$':
                return peek(1) == '$'
                        ? prefixed(TokenType.GROUP_ID, 2, AiqlLexer::isIdChar)
                        : prefixed(TokenType.ID_MARKER, 1, AiqlLexer::isIdChar);
            case '~':
                return peek(1) == '~'
                        ? prefixed(TokenType.ENTROPY, 2, AiqlLexer::isDottedIdChar)
                        : prefixed(TokenType.TEMPERATURE, 1, AiqlLexer::isDottedIdChar);
            case '@':
                return at();
            case '"':
                return string();
            default:
                break;
        }
        if (isDigit(c)) {
            return number();
        }
        if (isAsciiLetter(c) || c == '_') {
            return identifier();
        }
        if (SYMBOLS.indexOf(c) >= 0) {
            return operator(TokenType.SYMBOL, 1);
        }
        throw new LexException("Unexpected character '" + c + "'", line, column);
    }

    private Token slash() {
        if (peek(1) == '/') {
            return trivia(TokenType.COMMENT, consumeWhile(ch -> ch != '\n'));
        }
        if (peek(1) == '*') {
            StringBuilder sb = new StringBuilder();
            sb.append(advance()).append(advance());
            while (!atEnd() && !input.startsWith("*/", pos)) {
                sb.append(advance());
            }
            if (atEnd()) {
                throw new LexException("Unterminated block comment", tokenLine, tokenColumn);
            }
            sb.append(advance()).append(advance());
            return trivia(TokenType.COMMENT, sb.toString());
        }
        return operator(TokenType.DIVIDE, 1);
    }

    private Token lessThanOrConcept() {
        if (peek(1) == '=') {
            return operator(TokenType.LTE, 2);
        }
        if (pos + 1 >= input.length() || Character.isWhitespace(peek(1))) {
            return operator(TokenType.LT, 1);
        }
        if (!closesAsConcept()) {
            return operator(TokenType.LT, 1);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(advance());
        while (!atEnd() && peek() != '>') {
            sb.append(advance());
        }
        if (atEnd()) {
            throw new LexException("Unterminated concept", tokenLine, tokenColumn);
        }
        sb.append(advance());
        return token(TokenType.CONCEPT, sb.toString());
    }

    // A '>' must appear before whitespace, EOF or a structural character, within the lookahead window.
    private boolean closesAsConcept() {
        for (int i = 1; i < CONCEPT_LOOKAHEAD && pos + i < input.length(); i++) {
            char ch = input.charAt(pos + i);
            if (ch == '>') {
                return true;
            }
            if (Character.isWhitespace(ch) || CONCEPT_BREAKERS.indexOf(ch) >= 0) {
                return false;
            }
        }
        return false;
    }

    private boolean isListOpen() {
        for (int i = pos + 1; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (ch == ']' || ch == '\n') {
                return false;
            }
            if (LIST_MARKERS.indexOf(ch) >= 0) {
                return true;
            }
        }
        return false;
    }

    private Token relation() {
        StringBuilder sb = new StringBuilder();
        sb.append(advance());
        while (!atEnd() && peek() != ']') {
            sb.append(advance());
        }
        if (atEnd()) {
            throw new LexException("Unterminated relation", tokenLine, tokenColumn);
        }
        sb.append(advance());
        return token(TokenType.RELATION, sb.toString());
    }

    private Token hash() {
        if (peek(1) == '#') {
            return prefixed(TokenType.SEQ_NUM, 2, AiqlLexer::isIdChar);
        }
        if (input.startsWith(EXAMPLE_PATTERN_PREFIX, pos)) {
            return operator(TokenType.EXAMPLE_PATTERN, EXAMPLE_PATTERN_PREFIX.length());
        }
        if (input.startsWith(EXAMPLE_PREFIX, pos)) {
            return operator(TokenType.EXAMPLE_MARKER, EXAMPLE_PREFIX.length());
        }
        return prefixed(TokenType.DIRECTIVE, 1, AiqlLexer::isWordChar);
    }

    private Token at() {
        if (input.startsWith(COHERENCE_PREFIX, pos)) {
            StringBuilder sb = new StringBuilder(take(COHERENCE_PREFIX.length()));
            sb.append(consumeWhile(ch -> isDigit(ch) || ch == '.'));
            return token(TokenType.COHERENCE, sb.toString());
        }
        if (input.startsWith(VERSION_PREFIX, pos)) {
            return token(TokenType.VERSION, take(VERSION_PREFIX.length()) + markerValue());
        }
        if (input.startsWith(ORIGIN_PREFIX, pos)) {
            return token(TokenType.ORIGIN, take(ORIGIN_PREFIX.length()) + markerValue());
        }
        if (input.startsWith(CITE_PREFIX, pos)) {
            String prefix = take(CITE_PREFIX.length());
            if (peek() != '[') {
                return token(TokenType.CITE, prefix + bareMarkerValue());
            }
            StringBuilder sb = new StringBuilder(prefix);
            int depth = 0;
            do {
                char ch = peek();
                if (ch == '[') {
                    depth++;
                } else if (ch == ']') {
                    depth--;
                }
                sb.append(advance());
            } while (depth > 0 && !atEnd());
            return token(TokenType.CITE, sb.toString());
        }
        return prefixed(TokenType.CONFIDENCE, 1, ch -> isDigit(ch) || ch == '.');
    }

    private String markerValue() {
        if (peek() != '"') {
            return bareMarkerValue();
        }
        StringBuilder sb = new StringBuilder();
        sb.append(advance());
        while (!atEnd() && peek() != '"') {
            if (peek() == '\\') {
                sb.append(advance());
                if (atEnd()) {
                    break;
                }
            }
            sb.append(advance());
        }
        if (!atEnd()) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private String bareMarkerValue() {
        return consumeWhile(ch -> !Character.isWhitespace(ch) && MARKER_STOP.indexOf(ch) < 0);
    }

    private Token string() {
        StringBuilder sb = new StringBuilder();
        sb.append(advance());
        while (!atEnd() && peek() != '"') {
            if (peek() == '\\') {
                sb.append(advance());
                if (atEnd()) {
                    break;
                }
            }
            sb.append(advance());
        }
        if (atEnd()) {
            throw new LexException("Unterminated string", tokenLine, tokenColumn);
        }
        sb.append(advance());
        return token(TokenType.STRING, sb.toString());
    }

    private Token number() {
        StringBuilder sb = new StringBuilder(consumeWhile(ch -> isDigit(ch) || ch == '.'));
        if ((peek() == 'e' || peek() == 'E')) {
            char afterExponent = peek(1);
            if (isDigit(afterExponent) || afterExponent == '+' || afterExponent == '-') {
                sb.append(advance());
                if (peek() == '+' || peek() == '-') {
                    sb.append(advance());
                }
                sb.append(consumeWhile(AiqlLexer::isDigit));
            }
        }
        return token(TokenType.NUMBER, sb.toString());
    }

    private Token identifier() {
        String word = consumeWhile(AiqlLexer::isWordChar);
        return TokenType.keyword(word)
                .map(type -> token(type, word.toLowerCase(Locale.ROOT)))
                .orElseGet(() -> token(TokenType.IDENTIFIER, word));
    }

    private Token operator(TokenType type, int length) {
        return token(type, take(length));
    }

    private Token prefixed(TokenType type, int prefixLength, CharPredicate body) {
        String prefix = take(prefixLength);
        return token(type, prefix + consumeWhile(body));
    }

    private Token trivia(TokenType type, String text) {
        return options.includeWhitespace() ? token(type, text) : null;
    }

    private Token token(TokenType type, String value) {
        return new Token(type, value, tokenLine, tokenColumn);
    }

    private String take(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length && !atEnd(); i++) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private String consumeWhile(CharPredicate predicate) {
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && predicate.test(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private char advance() {
        char ch = input.charAt(pos++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return ch;
    }

    private char peek() {
        return peek(0);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static boolean isWordChar(char ch) {
        return isAsciiLetter(ch) || isDigit(ch) || ch == '_';
    }

    private static boolean isIdChar(char ch) {
        return isWordChar(ch) || ch == ':';
    }

    private static boolean isDottedIdChar(char ch) {
        return isIdChar(ch) || ch == '.';
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char ch);
    }
}
