package com.e2eq.aiql.ast;

/**
 * Terms appearing in statement positions and attribute values. The set of
 * implementations is closed; consumers dispatch through {@link Visitor}.
 */
public interface Expression {
    ExpressionType type();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConcept(Concept concept);

        R visitLiteral(Literal literal);

        R visitIdentifier(Identifier identifier);

        R visitMath(MathExpression math);

        R visitSet(SetExpression set);

        R visitFunctionApplication(FunctionApplication application);

        R visitLambda(LambdaExpression lambda);

        R visitUnary(UnaryExpression unary);

        R visitComparison(ComparisonExpression comparison);

        R visitSpatial(SpatialExpression spatial);
    }
}
