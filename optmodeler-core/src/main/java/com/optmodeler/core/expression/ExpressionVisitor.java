package com.optmodeler.core.expression;

/**
 * Visitor over the closed set of expression node types.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

    R visitConstant(Constant constant);

    R visitReference(Reference reference);

    R visitSum(Sum sum);

    R visitProduct(Product product);

    R visitQuotient(Quotient quotient);

    R visitPower(Power power);

    R visitFunctionCall(FunctionCall call);

    R visitIteratedSum(IteratedSum sum);
}
