package com.e2eq.aiql.parser;

import com.e2eq.aiql.ast.*;
import com.e2eq.aiql.exceptions.ParseException;
import com.e2eq.aiql.lexer.AiqlLexer;
import com.e2eq.aiql.lexer.Token;
import com.e2eq.aiql.lexer.TokenCategory;
import com.e2eq.aiql.lexer.TokenType;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;

import java.util.*;

/**
 * Recursive-descent parser turning a token list into a single {@link Program}.
 * <p>
 * Logical connectives ({@code and}, {@code or}, {@code implies}, {@code iff}, {@code then},
 * {@code ->}) are left-associative and share one precedence level; {@code not} applies to the
 * next unit only; a quantifier takes everything that follows it as its body. Arithmetic uses
 * the usual levels: {@code ^} over {@code * / %} over {@code + -}, each left-associative, with
 * unary minus binding tighter than any binary operator.
 * </p>
 * <p>
 * Sigil markers ({@code $id:}, {@code $$}, {@code ##}, {@code ~}, {@code ~~}, {@code #name})
 * attach to the next intent. Provenance markers written before the first item describe the
 * whole program; later ones attach to the next intent like the other markers.
 * </p>
 * Any error aborts the parse with a {@link ParseException}.
 */
public final class AiqlParser {

    static final String RULE = "Rule";
    static final String RELATIONSHIP = "Relationship";
    static final String EXAMPLE = "Example";
    static final String IMPLICIT_INTENT = "Assert";

    private static final String TENSE_MARKER = "@tense:";
    private static final Set<String> SYMMETRIC_RELATIONS = Set.of("simultaneous", "concurrent");

    private final List<Token> tokens;
    private int current;
    private IntentMetadata pending = IntentMetadata.EMPTY;

    public AiqlParser(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        List<Token> significant = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            if (!t.type().isTrivia()) {
                significant.add(t);
            }
        }
        if (significant.isEmpty() || !significant.get(significant.size() - 1).is(TokenType.EOF)) {
            Token last = significant.isEmpty() ? null : significant.get(significant.size() - 1);
            significant.add(new Token(TokenType.EOF, "", last != null ? last.line() : 1, last != null ? last.column() : 1));
        }
        this.tokens = significant;
    }

    /**
     * Lexes and parses source text with default lexer options.
     */
    public static Program parse(String source) {
        return new AiqlParser(new AiqlLexer(source).tokenize()).parse();
    }

    public Program parse() {
        current = 0;
        pending = IntentMetadata.EMPTY;

        List<LogicalNode> body = new ArrayList<>();
        Provenance provenance = Provenance.EMPTY;
        while (!check(TokenType.EOF)) {
            Token t = peek();
            if (t.category() == TokenCategory.PROVENANCE && body.isEmpty() && pending.isEmpty()
                    && !provenanceSet(provenance, t)) {
                provenance = applyProvenance(provenance, advance());
                continue;
            }
            body.add(parseLogical());
        }
        if (!pending.isEmpty()) {
            throw new ParseException("Metadata markers are not followed by an intent", peek());
        }
        return new Program(body, provenance);
    }

    // ---------------------------------------------------------------- logical layer

    private LogicalNode parseLogical() {
        LogicalNode left = parseUnit();
        LogicalOperator op;
        while ((op = binaryConnective(peek())) != null) {
            advance();
            LogicalNode right = parseUnit();
            left = new LogicalExpression(op, left, right);
        }
        if (peek().type().isProofOperator()) {
            throw new ParseException("Proof operators are reserved and cannot appear in a program", peek());
        }
        return left;
    }

    private static LogicalOperator binaryConnective(Token t) {
        switch (t.type()) {
            case AND:
                return LogicalOperator.AND;
            case OR:
                return LogicalOperator.OR;
            case IMPLIES:
            case THEN:
                return LogicalOperator.IMPLIES;
            case IFF:
                return LogicalOperator.IFF;
            case SYMBOL:
                return t.value().equals("->") ? LogicalOperator.IMPLIES : null;
            default:
                return null;
        }
    }

    private LogicalNode parseUnit() {
        Token t = peek();
        if (t.is(TokenType.NOT)) {
            advance();
            return LogicalExpression.not(parseUnit());
        }
        if (t.type().isQuantifier()) {
            return parseQuantified();
        }
        if (t.is(TokenType.INTENT)) {
            return parseIntentLike();
        }
        if (t.is(TokenType.EXAMPLE_MARKER) || t.is(TokenType.EXAMPLE_PATTERN)) {
            return parseExampleMarker();
        }
        if (t.isSymbol("(")) {
            advance();
            LogicalNode inner = parseLogical();
            expectSymbol(")");
            return inner;
        }
        if (t.type().isMetadata() || t.is(TokenType.DIRECTIVE)) {
            collectMetadata();
            return parseUnit();
        }
        if (startsStatement(t)) {
            // a bare triple in logical position stands for an assertion of it
            return new Intent(IMPLICIT_INTENT, Map.of(), List.of(parseStatement()), Optional.empty(),
                    Optional.empty(), takePending(), Map.of());
        }
        if (t.type().isProofOperator()) {
            throw new ParseException("Proof operators are reserved and cannot appear in a program", t);
        }
        throw new ParseException("Expected an intent, logical expression or quantifier", t);
    }

    private LogicalNode parseQuantified() {
        Token q = advance();
        Quantifier quantifier = q.is(TokenType.FORALL) ? Quantifier.FORALL : Quantifier.EXISTS;
        Token variable = peek();
        if (!variable.is(TokenType.IDENTIFIER)) {
            throw new ParseException("Expected a variable name after '" + q.value() + "'", variable);
        }
        advance();
        Optional<String> domain = Optional.empty();
        if (check(TokenType.IN)) {
            advance();
            Token d = peek();
            if (!d.is(TokenType.IDENTIFIER) && !d.is(TokenType.CONCEPT)) {
                throw new ParseException("Expected a domain after 'in'", d);
            }
            domain = Optional.of(advance().value());
        }
        expectSymbol(":");
        return new QuantifiedExpression(quantifier, variable.value(), domain, parseLogical());
    }

    private void collectMetadata() {
        while (peek().type().isMetadata() || check(TokenType.DIRECTIVE)) {
            Token t = peek();
            switch (t.type()) {
                case ID_MARKER -> pending = pending.withIdentifier(t.value().substring(1));
                case GROUP_ID -> pending = pending.withGroupIdentifier(t.value().substring(2));
                case SEQ_NUM -> pending = pending.withSequenceNumber(t.value().substring(2));
                case TEMPERATURE -> pending = pending.withTemperature(t.value().substring(1));
                case ENTROPY -> pending = pending.withEntropy(t.value().substring(2));
                case DIRECTIVE -> pending = pending.withDirective(t.value().substring(1));
                case VERSION, ORIGIN, CITE -> pending = pending.withProvenance(applyProvenance(pending.provenance(), t));
                case CONFIDENCE, COHERENCE -> throw new ParseException("Confidence must follow an intent", t);
                default -> throw new ParseException("Unexpected metadata marker", t);
            }
            advance();
        }
    }

    private IntentMetadata takePending() {
        IntentMetadata taken = pending;
        pending = IntentMetadata.EMPTY;
        return taken;
    }

    // ---------------------------------------------------------------- intents and friends

    private LogicalNode parseIntentLike() {
        Token intentToken = advance();
        String name = intentToken.value().substring(1);
        if (name.isEmpty()) {
            throw new ParseException("Expected an intent name after '!'", intentToken);
        }
        Map<String, String> params = checkSymbol("(") ? parseParams() : Map.of();

        if (name.equalsIgnoreCase(RULE)) {
            return parseRule(intentToken, params);
        }
        if (name.equalsIgnoreCase(RELATIONSHIP)) {
            return parseRelationship(intentToken, params);
        }
        if (name.equalsIgnoreCase(EXAMPLE)) {
            return parseExample(intentToken, params);
        }

        List<Statement> statements = parseStatementBlock();
        Trailer trailer = parseTrailer();
        return new Intent(name, params, statements, trailer.confidence(), trailer.coherence(), takePending(), Map.of());
    }

    private Map<String, String> parseParams() {
        expectSymbol("(");
        Map<String, String> params = new LinkedHashMap<>();
        while (!checkSymbol(")")) {
            Token keyToken = peek();
            String key = keyOf(keyToken);
            advance();
            expectSymbol(":");
            StringBuilder value = new StringBuilder();
            int depth = 0;
            while (!check(TokenType.EOF) && (depth > 0 || !(checkSymbol(",") || checkSymbol(")")))) {
                Token v = advance();
                if (v.isSymbol("(")) depth++;
                if (v.isSymbol(")")) depth--;
                value.append(v.is(TokenType.STRING) ? unquote(v) : v.value());
            }
            if (value.length() == 0) {
                throw new ParseException("Missing value for parameter '" + key + "'", peek());
            }
            params.put(key, value.toString());
            if (checkSymbol(",")) {
                advance();
            } else if (!checkSymbol(")")) {
                throw new ParseException("Expected ',' or ')' in parameter list", peek());
            }
        }
        expectSymbol(")");
        return params;
    }

    private RuleDefinition parseRule(Token ruleToken, Map<String, String> params) {
        IntentMetadata metadata = takePending();
        String id = params.getOrDefault("id", params.getOrDefault("name", metadata.identifier()));
        if (StringUtils.isBlank(id)) {
            throw new ParseException("Rule requires an id parameter", ruleToken);
        }
        expectSymbol("{");
        LogicalNode body = parseLogical();
        expectSymbol("}");
        Trailer trailer = parseTrailer();

        if (!(body instanceof LogicalExpression expr)
                || !(expr.is(LogicalOperator.IMPLIES) || expr.is(LogicalOperator.IFF))) {
            throw new ParseException("Rule '" + id + "' must be an implication or biconditional", ruleToken);
        }
        boolean bidirectional = expr.is(LogicalOperator.IFF) || "true".equalsIgnoreCase(params.get("bidirectional"));
        return new RuleDefinition(id, Optional.ofNullable(params.get("domain")), expr.left(), expr.right(),
                bidirectional, trailer.confidence().orElse(1.0));
    }

    private RelationshipNode parseRelationship(Token token, Map<String, String> params) {
        IntentMetadata metadata = takePending();
        RelationshipType type = RelationshipType.fromLabel(params.get("type"))
                .orElseThrow(() -> new ParseException("Relationship requires type temporal, causal or logical", token));
        String source = stripIdSigil(params.get("source"));
        String target = stripIdSigil(params.get("target"));
        if (source == null || target == null) {
            throw new ParseException("Relationship requires source and target", token);
        }
        List<Statement> statements = parseStatementBlock();
        Trailer trailer = parseTrailer();

        String relationName = params.get("relation");
        if (relationName == null && !statements.isEmpty()) {
            relationName = statements.get(0).relation().name();
        }
        boolean bidirectional = "true".equalsIgnoreCase(params.get("bidirectional"))
                || (relationName != null && SYMMETRIC_RELATIONS.contains(relationName.toLowerCase(Locale.ROOT)));

        Map<String, String> extra = new LinkedHashMap<>(params);
        extra.keySet().removeAll(List.of("type", "source", "target", "relation", "bidirectional"));
        if (metadata.identifier() != null) {
            extra.put("id", metadata.identifier());
        }
        return new RelationshipNode(type, source, target, relationName, statements, trailer.confidence(),
                bidirectional, extra);
    }

    private ExampleNode parseExample(Token token, Map<String, String> params) {
        IntentMetadata metadata = takePending();
        ExampleType type = params.containsKey("type")
                ? ExampleType.fromLabel(params.get("type"))
                    .orElseThrow(() -> new ParseException("Unknown example type '" + params.get("type") + "'", token))
                : ExampleType.CONCEPT;
        List<Statement> statements = parseStatementBlock();
        Trailer trailer = parseTrailer();

        Map<String, String> extra = new LinkedHashMap<>(params);
        extra.keySet().removeAll(List.of("type", "target", "context"));
        if (metadata.identifier() != null) {
            extra.put("id", metadata.identifier());
        }
        return new ExampleNode(type, params.get("target"), params.get("context"), statements, trailer.confidence(), extra);
    }

    private ExampleNode parseExampleMarker() {
        Token marker = advance();
        IntentMetadata metadata = takePending();
        Token target = peek();
        ExampleType type;
        String name;
        if (marker.is(TokenType.EXAMPLE_PATTERN)) {
            if (!target.is(TokenType.ID_MARKER) && !target.is(TokenType.IDENTIFIER)) {
                throw new ParseException("Expected a pattern reference after '#example_pattern:'", target);
            }
            type = ExampleType.PATTERN;
            name = stripIdSigil(target.value());
        } else if (target.is(TokenType.CONCEPT)) {
            type = ExampleType.CONCEPT;
            name = target.value();
        } else if (target.is(TokenType.RELATION)) {
            type = ExampleType.RELATION;
            name = relationOf(target).name();
        } else {
            throw new ParseException("Expected a concept or relation after '#example:'", target);
        }
        advance();
        List<Statement> statements = parseStatementBlock();
        Trailer trailer = parseTrailer();
        Map<String, String> extra = metadata.identifier() != null ? Map.of("id", metadata.identifier()) : Map.of();
        return new ExampleNode(type, name, null, statements, trailer.confidence(), extra);
    }

    private Trailer parseTrailer() {
        Optional<Double> confidence = Optional.empty();
        Optional<Double> coherence = Optional.empty();
        while (check(TokenType.CONFIDENCE) || check(TokenType.COHERENCE)) {
            Token t = advance();
            if (t.is(TokenType.CONFIDENCE)) {
                confidence = Optional.of(unitValue(t, t.value().substring(1), "Confidence"));
            } else {
                coherence = Optional.of(unitValue(t, t.value().substring(t.value().indexOf(':') + 1), "Coherence"));
            }
        }
        return new Trailer(confidence, coherence);
    }

    private static double unitValue(Token t, String text, String what) {
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ParseException(what + " value '" + text + "' is not a number", t, e);
        }
        if (value < 0.0 || value > 1.0) {
            throw new ParseException(what + " must be between 0 and 1", t);
        }
        return value;
    }

    private record Trailer(Optional<Double> confidence, Optional<Double> coherence) {}

    // ---------------------------------------------------------------- statements

    private List<Statement> parseStatementBlock() {
        expectSymbol("{");
        List<Statement> statements = new ArrayList<>();
        while (!checkSymbol("}")) {
            if (check(TokenType.EOF)) {
                throw new ParseException("Unclosed statement block", peek());
            }
            statements.add(parseStatement());
            if (checkSymbol(",")) {
                advance();
            }
        }
        expectSymbol("}");
        return statements;
    }

    private Statement parseStatement() {
        Expression subject = parseExpression();
        Token r = peek();
        Relation relation;
        if (r.is(TokenType.RELATION)) {
            relation = relationOf(advance());
        } else if (r.is(TokenType.ASSIGN)) {
            advance();
            relation = Relation.of("=");
        } else {
            throw new ParseException("Expected a relation after the statement subject", r);
        }
        Expression object = parseExpression();
        Map<String, Expression> attributes = checkSymbol("{") ? parseAttributes() : Map.of();
        return new Statement(subject, relation, object, attributes);
    }

    private static Relation relationOf(Token token) {
        String inner = token.value().substring(1, token.value().length() - 1).trim();
        Optional<Tense> tense = Optional.empty();
        int marker = inner.indexOf(TENSE_MARKER);
        if (marker >= 0) {
            String label = inner.substring(marker + TENSE_MARKER.length()).trim();
            tense = Optional.of(Tense.fromLabel(label)
                    .orElseThrow(() -> new ParseException("Unknown tense '" + label + "'", token)));
            inner = inner.substring(0, marker).trim();
        } else {
            int colon = inner.lastIndexOf(':');
            if (colon > 0) {
                Optional<Tense> suffix = Tense.fromLabel(inner.substring(colon + 1));
                if (suffix.isPresent()) {
                    tense = suffix;
                    inner = inner.substring(0, colon).trim();
                }
            }
        }
        if (inner.isEmpty()) {
            throw new ParseException("Relation name must not be empty", token);
        }
        return new Relation(inner, tense);
    }

    private Map<String, Expression> parseAttributes() {
        expectSymbol("{");
        Map<String, Expression> attributes = new LinkedHashMap<>();
        while (!checkSymbol("}")) {
            Token keyToken = peek();
            String key = keyOf(keyToken);
            advance();
            expectSymbol(":");
            Token op = peek();
            Expression value;
            if (op.type().isComparison()) {
                advance();
                value = new ComparisonExpression(new Identifier(key), comparisonOf(op), parseExpression());
            } else {
                value = parseExpression();
            }
            attributes.put(key, value);
            if (checkSymbol(",")) {
                advance();
            }
        }
        expectSymbol("}");
        return attributes;
    }

    private static String keyOf(Token t) {
        if (t.is(TokenType.STRING)) {
            return unquote(t);
        }
        if (t.is(TokenType.IDENTIFIER) || (t.category() != TokenCategory.PRIMITIVE && isWord(t.value()))) {
            return t.value();
        }
        throw new ParseException("Expected a key", t);
    }

    private static boolean isWord(String value) {
        return !value.isEmpty()
                && (Character.isLetter(value.charAt(0)) || value.charAt(0) == '_')
                && value.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    }

    // ---------------------------------------------------------------- expressions

    private Expression parseExpression() {
        Expression left = parseSet();
        while (peek().type().isComparison()) {
            ComparisonOperator op = comparisonOf(advance());
            left = new ComparisonExpression(left, op, parseSet());
        }
        return left;
    }

    private Expression parseSet() {
        Expression left = parseAdditive();
        while (check(TokenType.UNION) || check(TokenType.INTERSECT)) {
            SetOperator op = advance().is(TokenType.UNION) ? SetOperator.UNION : SetOperator.INTERSECT;
            left = new SetExpression(op, left, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            MathOperator op = advance().is(TokenType.PLUS) ? MathOperator.PLUS : MathOperator.MINUS;
            left = new MathExpression(op, left, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parsePower();
        while (check(TokenType.MULTIPLY) || check(TokenType.DIVIDE) || check(TokenType.MODULO)) {
            Token t = advance();
            MathOperator op = t.is(TokenType.MULTIPLY) ? MathOperator.MULTIPLY
                    : t.is(TokenType.DIVIDE) ? MathOperator.DIVIDE : MathOperator.MODULO;
            left = new MathExpression(op, left, parsePower());
        }
        return left;
    }

    private Expression parsePower() {
        Expression left = parseUnary();
        while (check(TokenType.POWER)) {
            advance();
            left = new MathExpression(MathOperator.POWER, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (check(TokenType.MINUS)) {
            advance();
            Expression operand = parseUnary();
            if (operand instanceof Literal literal && literal.isNumber()) {
                return Literal.of(-literal.asDouble());
            }
            return new UnaryExpression(UnaryOperator.NEGATE, operand);
        }
        if (check(TokenType.NOT)) {
            advance();
            return new UnaryExpression(UnaryOperator.NOT, parseUnary());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token t = peek();
        switch (t.type()) {
            case CONCEPT:
                advance();
                return new Concept(t.value());
            case NUMBER:
                advance();
                return Literal.of(number(t));
            case STRING:
                advance();
                return Literal.of(unquote(t));
            case TRUE:
            case FALSE:
                advance();
                return Literal.of(t.is(TokenType.TRUE));
            case PI:
                advance();
                return Literal.of(Math.PI);
            case EULER:
                advance();
                return Literal.of(Math.E);
            case INFINITY:
                advance();
                return Literal.of(Double.POSITIVE_INFINITY);
            case SUMMATION:
            case INTEGRAL:
                advance();
                if (checkSymbol("(")) {
                    return new FunctionApplication(t.value(), parseArguments("(", ")"));
                }
                return new Identifier(t.value());
            case LAMBDA:
                advance();
                return parseLambda();
            case IDENTIFIER:
                advance();
                if (t.value().equals("space") && checkSymbol(":")) {
                    return parseSpatial(t);
                }
                if (checkSymbol("(")) {
                    return new FunctionApplication(t.value(), parseArguments("(", ")"));
                }
                return new Identifier(t.value());
            case SYMBOL:
                if (t.value().equals("(")) {
                    advance();
                    Expression inner = parseExpression();
                    expectSymbol(")");
                    return inner;
                }
                if (t.value().equals("[")) {
                    return new FunctionApplication(FunctionApplication.LIST, parseArguments("[", "]"));
                }
                break;
            default:
                break;
        }
        throw new ParseException("Unexpected token in expression", t);
    }

    private List<Expression> parseArguments(String open, String close) {
        expectSymbol(open);
        List<Expression> args = new ArrayList<>();
        if (!checkSymbol(close)) {
            args.add(parseExpression());
            while (checkSymbol(",")) {
                advance();
                args.add(parseExpression());
            }
        }
        expectSymbol(close);
        return args;
    }

    private Expression parseLambda() {
        List<String> params = new ArrayList<>();
        do {
            if (!params.isEmpty()) {
                advance();
            }
            Token p = peek();
            if (!p.is(TokenType.IDENTIFIER)) {
                throw new ParseException("Expected a lambda parameter", p);
            }
            params.add(advance().value());
        } while (checkSymbol(","));
        expectSymbol(":");
        return new LambdaExpression(params, parseExpression());
    }

    private Expression parseSpatial(Token space) {
        expectSymbol(":");
        Token kind = peek();
        if (!kind.is(TokenType.IDENTIFIER)) {
            throw new ParseException("Expected 'literal' or 'variable' after 'space:'", kind);
        }
        advance();
        List<Expression> args = parseArguments("(", ")");
        if (kind.value().equals("literal")) {
            List<Double> coordinates = new ArrayList<>();
            for (Expression arg : args) {
                if (!(arg instanceof Literal literal) || !literal.isNumber()) {
                    throw new ParseException("Spatial literal coordinates must be numbers", space);
                }
                coordinates.add(literal.asDouble());
            }
            if (coordinates.isEmpty()) {
                throw new ParseException("Spatial literal requires coordinates", space);
            }
            return SpatialExpression.literal(coordinates);
        }
        if (kind.value().equals("variable")) {
            if (args.size() != 1 || !(args.get(0) instanceof Identifier || args.get(0) instanceof Concept)) {
                throw new ParseException("Spatial variable takes a single name", space);
            }
            return SpatialExpression.variable(AiqlPrinter.print(args.get(0)));
        }
        throw new ParseException("Unknown spatial form '" + kind.value() + "'", kind);
    }

    private static double number(Token t) {
        try {
            return Double.parseDouble(t.value());
        } catch (NumberFormatException e) {
            throw new ParseException("Malformed number", t, e);
        }
    }

    private static ComparisonOperator comparisonOf(Token t) {
        switch (t.type()) {
            case GT:
                return ComparisonOperator.GT;
            case LT:
                return ComparisonOperator.LT;
            case GTE:
                return ComparisonOperator.GTE;
            case LTE:
                return ComparisonOperator.LTE;
            case EQ:
                return ComparisonOperator.EQ;
            case NEQ:
                return ComparisonOperator.NEQ;
            default:
                throw new ParseException("Expected a comparison operator", t);
        }
    }

    // ---------------------------------------------------------------- provenance

    private static boolean provenanceSet(Provenance p, Token t) {
        switch (t.type()) {
            case VERSION:
                return p.version() != null;
            case ORIGIN:
                return p.origin() != null;
            default:
                return !p.citations().isEmpty();
        }
    }

    private static Provenance applyProvenance(Provenance p, Token t) {
        String raw = t.value().substring(t.value().indexOf(':') + 1);
        switch (t.type()) {
            case VERSION:
                return p.withVersion(unquote(raw));
            case ORIGIN:
                return p.withOrigin(unquote(raw));
            case CITE:
                List<String> citations = new ArrayList<>(p.citations());
                citations.addAll(citations(raw));
                return p.withCitations(citations);
            default:
                throw new ParseException("Not a provenance marker", t);
        }
    }

    static List<String> citations(String raw) {
        String body = raw.trim();
        if (!body.startsWith("[")) {
            return List.of(unquote(body));
        }
        body = StringUtils.removeEnd(StringUtils.removeStart(body, "["), "]");
        List<String> out = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && quoted && i + 1 < body.length()) {
                sb.append(c).append(body.charAt(++i));
            } else if (c == '"') {
                quoted = !quoted;
                sb.append(c);
            } else if (c == ',' && !quoted) {
                addCitation(out, sb);
            } else {
                sb.append(c);
            }
        }
        addCitation(out, sb);
        return out;
    }

    private static void addCitation(List<String> out, StringBuilder sb) {
        String value = sb.toString().trim();
        if (!value.isEmpty()) {
            out.add(unquote(value));
        }
        sb.setLength(0);
    }

    // ---------------------------------------------------------------- helpers

    private static boolean startsStatement(Token t) {
        return t.is(TokenType.CONCEPT) || t.is(TokenType.IDENTIFIER) || t.is(TokenType.STRING)
                || t.is(TokenType.NUMBER);
    }

    private static String stripIdSigil(String ref) {
        if (ref == null) {
            return null;
        }
        String stripped = StringUtils.removeStart(ref, "$");
        stripped = StringUtils.removeStart(stripped, "id:");
        return StringUtils.isBlank(stripped) ? null : stripped;
    }

    private static String unquote(Token t) {
        return unquote(t.value());
    }

    static String unquote(String raw) {
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return StringEscapeUtils.unescapeJava(raw.substring(1, raw.length() - 1));
        }
        return raw;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        Token t = tokens.get(current);
        if (!t.is(TokenType.EOF)) {
            current++;
        }
        return t;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean checkSymbol(String symbol) {
        return peek().isSymbol(symbol);
    }

    private void expectSymbol(String symbol) {
        if (!checkSymbol(symbol)) {
            throw new ParseException("Expected '" + symbol + "'", peek());
        }
        advance();
    }
}
