package com.optmodeler.core.expression;

import java.util.Map;

/**
 * Computes the numeric value of an expression from the values held by its symbols.
 */
final class Evaluator implements ExpressionVisitor<Double> {

    @Override
    public Double visitConstant(Constant constant) {
        return constant.value();
    }

    @Override
    public Double visitReference(Reference reference) {
        if (reference.key().isSymbolic()) {
            throw new IllegalStateException("Cannot evaluate symbolic reference " + reference);
        }
        Double value = reference.symbol().valueAt(reference.key());
        if (value == null) {
            throw new IllegalStateException("No value known for " + reference);
        }
        return value;
    }

    @Override
    public Double visitSum(Sum sum) {
        double total = sum.constant();
        for (Map.Entry<Expression, Double> term : sum.terms().entrySet()) {
            total += term.getValue() * term.getKey().accept(this);
        }
        return total;
    }

    @Override
    public Double visitProduct(Product product) {
        return product.left().accept(this) * product.right().accept(this);
    }

    @Override
    public Double visitQuotient(Quotient quotient) {
        return quotient.numerator().accept(this) / quotient.denominator().accept(this);
    }

    @Override
    public Double visitPower(Power power) {
        return StrictMath.pow(power.base().accept(this), power.exponent().accept(this));
    }

    @Override
    public Double visitFunctionCall(FunctionCall call) {
        MathFunction function = MathFunction.fromName(call.name())
                .orElseThrow(() -> new IllegalStateException("Cannot evaluate unknown function " + call.name()));
        double[] args = call.arguments().stream().mapToDouble(a -> a.accept(this)).toArray();
        return function.apply(args);
    }

    @Override
    public Double visitIteratedSum(IteratedSum sum) {
        throw new IllegalStateException("Iterated sums are evaluated by the solver, not the client");
    }
}
