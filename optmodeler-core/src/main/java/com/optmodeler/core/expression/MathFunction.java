package com.optmodeler.core.expression;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Solver functions the client can fold when every argument is constant.
 */
public enum MathFunction {
    ABS(args -> StrictMath.abs(single(args))),
    EXP(args -> StrictMath.exp(single(args))),
    LOG(args -> StrictMath.log(single(args))),
    LOG10(args -> StrictMath.log10(single(args))),
    SQRT(args -> StrictMath.sqrt(single(args))),
    SIN(args -> StrictMath.sin(single(args))),
    COS(args -> StrictMath.cos(single(args))),
    TAN(args -> StrictMath.tan(single(args))),
    FLOOR(args -> StrictMath.floor(single(args))),
    CEIL(args -> StrictMath.ceil(single(args))),
    MAX(args -> Arrays.stream(args).max().orElseThrow(() -> new IllegalArgumentException("max needs arguments"))),
    MIN(args -> Arrays.stream(args).min().orElseThrow(() -> new IllegalArgumentException("min needs arguments")));

    private final ToDoubleFunction<double[]> evaluator;

    MathFunction(ToDoubleFunction<double[]> evaluator) {
        this.evaluator = evaluator;
    }

    public String solverName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public double apply(double... arguments) {
        return evaluator.applyAsDouble(arguments);
    }

    public static Optional<MathFunction> fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.solverName().equalsIgnoreCase(name))
                .findFirst();
    }

    private static double single(double[] args) {
        if (args.length != 1) {
            throw new IllegalArgumentException("Function expects exactly one argument, got " + args.length);
        }
        return args[0];
    }
}
