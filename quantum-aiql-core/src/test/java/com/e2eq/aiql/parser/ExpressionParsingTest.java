package com.e2eq.aiql.parser;

import com.e2eq.aiql.ast.*;
import com.e2eq.aiql.exceptions.ParseException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParsingTest {

    private static Statement statement(String source) {
        Intent intent = (Intent) AiqlParser.parse("!Assert { " + source + " }").body().get(0);
        return intent.statements().get(0);
    }

    private static Expression object(String source) {
        return statement("<A> = " + source).object();
    }

    @Test
    void testAssignmentUsesEqualsRelation() {
        Statement s = statement("<A> = 1 + 2");
        assertEquals("=", s.relation().name());
        assertEquals(new MathExpression(MathOperator.PLUS, Literal.of(1), Literal.of(2)), s.object());
    }

    @Test
    void testPrecedence() {
        Expression e = object("1 + 2 * 3 ^ 4");
        MathExpression plus = assertInstanceOf(MathExpression.class, e);
        assertEquals(MathOperator.PLUS, plus.operator());
        MathExpression times = assertInstanceOf(MathExpression.class, plus.right());
        assertEquals(MathOperator.MULTIPLY, times.operator());
        assertEquals(new MathExpression(MathOperator.POWER, Literal.of(3), Literal.of(4)), times.right());
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        Expression e = object("10 - 5 - 2");
        assertEquals(new MathExpression(MathOperator.MINUS,
                new MathExpression(MathOperator.MINUS, Literal.of(10), Literal.of(5)),
                Literal.of(2)), e);
        assertEquals("((10 - 5) - 2)", AiqlPrinter.print(e));
    }

    @Test
    void testDivisionAndModulo() {
        assertEquals(new MathExpression(MathOperator.MODULO,
                new MathExpression(MathOperator.DIVIDE, Literal.of(10), Literal.of(2)), Literal.of(3)),
                object("10 / 2 % 3"));
    }

    @Test
    void testUnaryMinus() {
        assertEquals(Literal.of(-5), object("-5"));
        assertEquals(new UnaryExpression(UnaryOperator.NEGATE, new Concept("<C>")), object("-<C>"));
        // unary minus binds tighter than '^'
        assertEquals(new MathExpression(MathOperator.POWER, Literal.of(-2), Literal.of(2)), object("-2 ^ 2"));
    }

    @Test
    void testParenthesesOverridePrecedence() {
        assertEquals(new MathExpression(MathOperator.MULTIPLY,
                new MathExpression(MathOperator.PLUS, Literal.of(1), Literal.of(2)), Literal.of(3)),
                object("(1 + 2) * 3"));
    }

    @Test
    void testScientificNotationAndConstants() {
        assertEquals(Literal.of(1.5e-10), object("1.5e-10"));
        assertEquals(Literal.of(2e5), object("2E+5"));
        assertEquals(Literal.of(Math.PI), object("pi"));
        assertEquals(Literal.of(Math.E), object("e"));
        assertEquals(Literal.of(Double.POSITIVE_INFINITY), object("infinity"));
    }

    @Test
    void testFunctionApplications() {
        FunctionApplication max = assertInstanceOf(FunctionApplication.class, object("max(<A>, <B>, 10)"));
        assertEquals("max", max.function());
        assertEquals(List.of(new Concept("<A>"), new Concept("<B>"), Literal.of(10)), max.arguments());

        FunctionApplication nested = assertInstanceOf(FunctionApplication.class, object("sqrt(sin(3.14) + 1)"));
        MathExpression arg = assertInstanceOf(MathExpression.class, nested.arguments().get(0));
        assertEquals(new FunctionApplication("sin", List.of(Literal.of(3.14))), arg.left());

        assertEquals(new FunctionApplication("sum", List.of(new Identifier("i"), Literal.of(1), Literal.of(10))),
                object("sum(i, 1, 10)"));
        assertEquals("integral", ((FunctionApplication) object("integral(x, 0, 1)")).function());
        assertEquals(new FunctionApplication("noargs", List.of()), object("noargs()"));
    }

    @Test
    void testListLiteral() {
        FunctionApplication list = assertInstanceOf(FunctionApplication.class, object("[1, 2, <C>]"));
        assertEquals(FunctionApplication.LIST, list.function());
        assertEquals(3, list.arguments().size());
    }

    @Test
    void testSetExpressionsAreLeftAssociative() {
        assertEquals(new SetExpression(SetOperator.INTERSECT,
                new SetExpression(SetOperator.UNION, new Concept("<A>"), new Concept("<B>")),
                new Concept("<C>")), object("<A> union <B> intersect <C>"));
    }

    @Test
    void testLambda() {
        LambdaExpression lambda = assertInstanceOf(LambdaExpression.class, object("lambda x, y: x + y"));
        assertEquals(List.of("x", "y"), lambda.parameters());
        assertEquals(new MathExpression(MathOperator.PLUS, new Identifier("x"), new Identifier("y")), lambda.body());
        assertThrows(ParseException.class, () -> object("lambda 1: 2"));
    }

    @Test
    void testSpatialExpressions() {
        assertEquals(SpatialExpression.literal(List.of(37.7749, -122.4194)),
                object("space:literal(37.7749, -122.4194)"));
        assertEquals(SpatialExpression.variable("sector_7"), object("space:variable(sector_7)"));
        assertThrows(ParseException.class, () -> object("space:literal(<A>)"));
        assertThrows(ParseException.class, () -> object("space:orbit(1)"));
    }

    @Test
    void testComparisonInObjectPosition() {
        assertEquals(new ComparisonExpression(Literal.of(3), ComparisonOperator.GT, Literal.of(2)), object("3 > 2"));
    }

    @Test
    void testStringsAreUnescaped() {
        assertEquals(Literal.of("say \"hi\"\n"), object("\"say \\\"hi\\\"\\n\""));
    }
}
