package com.optmodeler.core.expression;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Application of a named solver-side function such as {@code exp} or {@code max}.
 *
 * @param name function name as the solver spells it
 * @param arguments arguments in call order
 */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        arguments.forEach(a -> a.collectSymbols(out));
    }

    @Override
    public boolean isLinear() {
        return arguments.stream().noneMatch(Expression::involvesDecision);
    }
}
