package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Reference;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.Objects;

/**
 * A scalar decision variable.
 *
 * <p>Bounds left unset take the type default: unbounded for continuous and integer
 * variables, {@code [0, 1]} for binaries. Only bounds that differ from the default are
 * written in the declaration.
 */
public class Variable extends AbstractEntity implements Symbol, Operand {

    private VariableType type;
    private Double lowerBound;
    private Double upperBound;
    private Double init;
    private Double value;
    private Double dual;

    public Variable(Container owner, RegisteredName name, VariableType type, Double lowerBound, Double upperBound, Double init) {
        super(owner, name);
        this.type = type == null ? VariableType.CONTINUOUS : type;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.init = init;
        checkBounds(effectiveLower(), effectiveUpper());
    }

    public VariableType getType() {
        return type;
    }

    public Variable setType(VariableType type) {
        checkMutable();
        this.type = Objects.requireNonNull(type, "type must not be null");
        return this;
    }

    /**
     * Returns the explicitly set lower bound.
     *
     * @return lower bound or null when the type default applies
     */
    public Double getLowerBound() {
        return lowerBound;
    }

    public Double getUpperBound() {
        return upperBound;
    }

    public Double getInit() {
        return init;
    }

    public Variable setLowerBound(Double lowerBound) {
        checkMutable();
        checkBounds(lowerBound, upperBound);
        this.lowerBound = lowerBound;
        return this;
    }

    public Variable setUpperBound(Double upperBound) {
        checkMutable();
        checkBounds(lowerBound, upperBound);
        this.upperBound = upperBound;
        return this;
    }

    public Variable setBounds(Double lowerBound, Double upperBound) {
        checkMutable();
        checkBounds(lowerBound, upperBound);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        return this;
    }

    public Variable setInit(Double init) {
        checkMutable();
        this.init = init;
        return this;
    }

    /**
     * Returns the solution value ingested from the solver.
     *
     * @return value or null before any solve
     */
    public Double getValue() {
        return value;
    }

    public Double getDual() {
        return dual;
    }

    /**
     * Stores a solution value. Allowed on sealed containers.
     *
     * @param value value reported by the solver
     */
    public void assignValue(double value) {
        this.value = value;
    }

    public void assignDual(double dual) {
        this.dual = dual;
    }

    @Override
    public int getArity() {
        return 0;
    }

    @Override
    public boolean isDecision() {
        return true;
    }

    @Override
    public Double valueAt(IndexKey key) {
        return key.isEmpty() ? value : null;
    }

    @Override
    public Expression toExpression() {
        return new Reference(this);
    }

    private Double effectiveLower() {
        return lowerBound != null ? lowerBound : (type == VariableType.BINARY ? Double.valueOf(0) : null);
    }

    private Double effectiveUpper() {
        return upperBound != null ? upperBound : (type == VariableType.BINARY ? Double.valueOf(1) : null);
    }

    static void checkBounds(Double lower, Double upper) {
        if (lower != null && lower.isNaN() || upper != null && upper.isNaN()) {
            throw new IllegalArgumentException("Bounds must not be NaN");
        }
        if (lower != null && upper != null && lower > upper) {
            throw new IllegalArgumentException("Lower bound " + lower + " exceeds upper bound " + upper);
        }
    }
}
