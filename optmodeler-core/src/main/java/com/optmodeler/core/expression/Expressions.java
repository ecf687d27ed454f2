package com.optmodeler.core.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Factory for expressions. All arithmetic on operands goes through here.
 *
 * <p>Linear operations always return canonical results: {@code add(x, x)} is {@code 2 * x},
 * {@code subtract(x, x)} is the constant {@code 0}, and constant operands are folded.
 * Products, quotients and powers of non-constant operands are kept as structural nodes,
 * except that scalar coefficients are pulled out of a product's factors.
 */
public final class Expressions {

    private Expressions() {
    }

    public static SumBuilder newSumBuilder() {
        return new SumBuilder();
    }

    public static Constant constant(double value) {
        return new Constant(value);
    }

    public static Reference ref(Symbol symbol) {
        return new Reference(symbol);
    }

    public static Reference ref(Symbol symbol, IndexKey key) {
        return new Reference(symbol, key);
    }

    public static Expression add(Operand a, Operand b) {
        return newSumBuilder().add(a).add(b).build();
    }

    public static Expression add(Operand a, double b) {
        return newSumBuilder().add(a).add(b).build();
    }

    public static Expression subtract(Operand a, Operand b) {
        return newSumBuilder().add(a).addTerm(b, -1).build();
    }

    public static Expression subtract(Operand a, double b) {
        return newSumBuilder().add(a).add(-b).build();
    }

    public static Expression subtract(double a, Operand b) {
        return newSumBuilder().add(a).addTerm(b, -1).build();
    }

    public static Expression negate(Operand a) {
        return scale(a, -1);
    }

    /**
     * Multiplies an operand by a scalar.
     *
     * @param a operand
     * @param factor scalar factor
     * @return canonical result; {@code 0} when the factor is zero
     */
    public static Expression scale(Operand a, double factor) {
        return newSumBuilder().addTerm(a, factor).build();
    }

    public static Expression multiply(double factor, Operand a) {
        return scale(a, factor);
    }

    public static Expression multiply(Operand a, double factor) {
        return scale(a, factor);
    }

    public static Expression multiply(Operand a, Operand b) {
        Expression left = a.toExpression();
        Expression right = b.toExpression();
        if (left instanceof Constant c) {
            return scale(right, c.value());
        }
        if (right instanceof Constant c) {
            return scale(left, c.value());
        }
        Scaled l = Scaled.of(left);
        Scaled r = Scaled.of(right);
        return scale(new Product(l.core(), r.core()), l.factor() * r.factor());
    }

    /**
     * Divides two operands.
     *
     * @param a numerator
     * @param b denominator
     * @return canonical result
     * @throws IllegalArgumentException when the denominator is the constant zero
     */
    public static Expression divide(Operand a, Operand b) {
        Expression numerator = a.toExpression();
        Expression denominator = b.toExpression();
        if (denominator instanceof Constant c) {
            if (c.value() == 0.0) {
                throw new IllegalArgumentException("Division by constant zero");
            }
            return scale(numerator, 1.0 / c.value());
        }
        if (numerator instanceof Constant c && c.value() == 0.0) {
            return Constant.ZERO;
        }
        return new Quotient(numerator, denominator);
    }

    public static Expression divide(Operand a, double b) {
        return divide(a, constant(b));
    }

    public static Expression power(Operand base, Operand exponent) {
        Expression b = base.toExpression();
        Expression e = exponent.toExpression();
        if (b instanceof Constant cb && e instanceof Constant ce) {
            return constant(StrictMath.pow(cb.value(), ce.value()));
        }
        if (e instanceof Constant ce) {
            if (ce.value() == 1.0) {
                return b;
            }
            if (ce.value() == 0.0) {
                return Constant.ONE;
            }
        }
        return new Power(b, e);
    }

    public static Expression power(Operand base, double exponent) {
        return power(base, constant(exponent));
    }

    /**
     * Applies a named function. Known functions are folded when all arguments are constant.
     *
     * @param name function name
     * @param arguments arguments
     * @return folded constant or a {@link FunctionCall}
     */
    public static Expression function(String name, Operand... arguments) {
        List<Expression> args = new ArrayList<>(arguments.length);
        for (Operand argument : arguments) {
            args.add(argument.toExpression());
        }
        Optional<MathFunction> known = MathFunction.fromName(name);
        if (known.isPresent() && !args.isEmpty() && args.stream().allMatch(Expression::isConstant)) {
            double[] values = args.stream().mapToDouble(x -> ((Constant) x).value()).toArray();
            double folded = known.get().apply(values);
            if (!Double.isNaN(folded)) {
                return constant(folded);
            }
        }
        return new FunctionCall(known.map(MathFunction::solverName).orElse(name), args);
    }

    public static Expression abs(Operand a) {
        return function(MathFunction.ABS.solverName(), a);
    }

    public static Expression exp(Operand a) {
        return function(MathFunction.EXP.solverName(), a);
    }

    public static Expression log(Operand a) {
        return function(MathFunction.LOG.solverName(), a);
    }

    public static Expression sqrt(Operand a) {
        return function(MathFunction.SQRT.solverName(), a);
    }

    public static Expression sin(Operand a) {
        return function(MathFunction.SIN.solverName(), a);
    }

    public static Expression cos(Operand a) {
        return function(MathFunction.COS.solverName(), a);
    }

    public static Expression max(Operand... a) {
        return function(MathFunction.MAX.solverName(), a);
    }

    public static Expression min(Operand... a) {
        return function(MathFunction.MIN.solverName(), a);
    }

    public static Expression sum(Iterable<? extends Operand> operands) {
        SumBuilder builder = newSumBuilder();
        for (Operand operand : operands) {
            builder.add(operand);
        }
        return builder.build();
    }

    public static Expression sum(Operand... operands) {
        return sum(Arrays.asList(operands));
    }

    /**
     * Builds {@code sum(coefficients[k] * operands[k])}.
     *
     * @param operands terms
     * @param coefficients coefficients, same size as operands
     * @return canonical linear expression
     */
    public static Expression weightedSum(List<? extends Operand> operands, List<? extends Number> coefficients) {
        if (operands.size() != coefficients.size()) {
            throw new IllegalArgumentException("operands and coefficients differ in size: "
                    + operands.size() + " vs " + coefficients.size());
        }
        SumBuilder builder = newSumBuilder();
        for (int i = 0; i < operands.size(); i++) {
            builder.addTerm(operands.get(i), coefficients.get(i).doubleValue());
        }
        return builder.build();
    }

    /**
     * Builds a solver-side summation {@code sum {i in I, ...} body}.
     *
     * @param iterators bound iterators
     * @param body summand
     * @return iterated sum node
     */
    public static Expression sumOver(List<? extends Symbol> iterators, Operand body) {
        return new IteratedSum(new ArrayList<>(iterators), body.toExpression());
    }

    /**
     * Evaluates an expression against the current values of its symbols.
     *
     * @param operand expression to evaluate
     * @return numeric value
     * @throws IllegalStateException if a referenced symbol has no known value
     */
    public static double evaluate(Operand operand) {
        return operand.toExpression().accept(new Evaluator());
    }

    private record Scaled(double factor, Expression core) {

        static Scaled of(Expression e) {
            if (e instanceof Sum sum && sum.constant() == 0.0 && sum.terms().size() == 1) {
                var only = sum.terms().entrySet().iterator().next();
                return new Scaled(only.getValue(), only.getKey());
            }
            return new Scaled(1.0, e);
        }
    }
}
