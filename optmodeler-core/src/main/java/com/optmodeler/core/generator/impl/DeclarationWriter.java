package com.optmodeler.core.generator.impl;

import com.optmodeler.core.entity.BoundOverride;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.ImplicitVariable;
import com.optmodeler.core.entity.IndexSet;
import com.optmodeler.core.entity.IndexSpace;
import com.optmodeler.core.entity.OptSet;
import com.optmodeler.core.entity.Parameter;
import com.optmodeler.core.entity.ParameterGroup;
import com.optmodeler.core.entity.SetInitializer;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.entity.VariableGroup;
import com.optmodeler.core.exception.RenderInconsistencyException;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.util.OptmodelLiterals;

import java.util.stream.Collectors;

/**
 * Renders entity declarations and member overrides.
 */
final class DeclarationWriter {

    private final NameScope scope;
    private final ExpressionWriter expressions;

    DeclarationWriter(NameScope scope, ExpressionWriter expressions) {
        this.scope = scope;
        this.expressions = expressions;
    }

    String declare(Entity entity) {
        if (entity instanceof OptSet set) {
            return declareSet(set);
        } else if (entity instanceof Parameter parameter) {
            return declareParameter(parameter);
        } else if (entity instanceof ParameterGroup group) {
            return declareParameterGroup(group);
        } else if (entity instanceof Variable variable) {
            return declareVariable(variable);
        } else if (entity instanceof VariableGroup group) {
            return declareVariableGroup(group);
        } else if (entity instanceof ImplicitVariable implicit) {
            return declareImplicitVariable(implicit);
        }
        throw new RenderInconsistencyException("No declaration form for " + entity.getClass().getSimpleName());
    }

    /**
     * Renders an override such as {@code x['a', 2].ub = 5;}.
     *
     * @param override override to render
     * @return statement text
     */
    String override(BoundOverride override) {
        Symbol target = override.target();
        String member = scope.symbol(target) + "[" + expressions.key(override.key()) + "]";
        String value = value(override.value());
        return switch (override.field()) {
            case LOWER_BOUND -> member + ".lb = " + value + ";";
            case UPPER_BOUND -> member + ".ub = " + value + ";";
            case INIT, VALUE -> member + " = " + value + ";";
        };
    }

    private String declareSet(OptSet set) {
        StringBuilder sb = new StringBuilder("set");
        if (set.getArity() > 1 || set.getElementTypes().contains(ValueType.STR)) {
            sb.append(" <")
                    .append(set.getElementTypes().stream().map(ValueType::keyword).collect(Collectors.joining(", ")))
                    .append(">");
        }
        sb.append(' ').append(scope.entity(set));
        SetInitializer initializer = set.getInitializer();
        if (initializer != null) {
            sb.append(set.isFixed() ? " = " : " init ").append(setValue(initializer));
        }
        return sb.append(';').toString();
    }

    private String declareParameter(Parameter parameter) {
        StringBuilder sb = new StringBuilder(parameter.getType().keyword()).append(' ').append(scope.entity(parameter));
        if (parameter.getFixedValue() != null) {
            sb.append(" = ").append(value(parameter.getFixedValue()));
        } else if (parameter.getInit() != null) {
            sb.append(" init ").append(value(parameter.getInit()));
        }
        return sb.append(';').toString();
    }

    private String declareParameterGroup(ParameterGroup group) {
        StringBuilder sb = new StringBuilder(group.getType().keyword())
                .append(' ').append(scope.entity(group))
                .append(' ').append(space(group.getSpace()));
        if (group.getInit() != null) {
            sb.append(" init ").append(value(group.getInit()));
        }
        return sb.append(';').toString();
    }

    private String declareVariable(Variable variable) {
        StringBuilder sb = new StringBuilder("var ").append(scope.entity(variable));
        appendAttributes(sb, variable.getType(), variable.getLowerBound(), variable.getUpperBound(), variable.getInit());
        return sb.append(';').toString();
    }

    private String declareVariableGroup(VariableGroup group) {
        StringBuilder sb = new StringBuilder("var ").append(scope.entity(group))
                .append(' ').append(space(group.getSpace()));
        appendAttributes(sb, group.getType(), group.getLowerBound(), group.getUpperBound(), group.getInit());
        return sb.append(';').toString();
    }

    private String declareImplicitVariable(ImplicitVariable implicit) {
        StringBuilder sb = new StringBuilder("impvar ").append(scope.entity(implicit));
        if (implicit.isIndexed()) {
            sb.append(" {").append(expressions.bindings(implicit.getIterators())).append('}');
        }
        return sb.append(" = ").append(expressions.write(implicit.getBody())).append(';').toString();
    }

    private void appendAttributes(StringBuilder sb, VariableType type, Double lower, Double upper, Double init) {
        double defaultLower = type == VariableType.BINARY ? 0 : Double.NEGATIVE_INFINITY;
        double defaultUpper = type == VariableType.BINARY ? 1 : Double.POSITIVE_INFINITY;
        switch (type) {
            case INTEGER -> sb.append(" integer");
            case BINARY -> sb.append(" binary");
            default -> { }
        }
        if (lower != null && lower != defaultLower) {
            sb.append(" >= ").append(expressions.number(lower));
        }
        if (upper != null && upper != defaultUpper) {
            sb.append(" <= ").append(expressions.number(upper));
        }
        if (init != null) {
            sb.append(" init ").append(expressions.number(init));
        }
    }

    private String space(IndexSpace space) {
        return "{" + space.getDimensions().stream().map(this::dimension).collect(Collectors.joining(", ")) + "}";
    }

    private String dimension(IndexSet dimension) {
        if (dimension.isAbstract()) {
            return scope.entity(dimension.getSet());
        }
        return "{" + dimension.getMembers().stream()
                .map(expressions::literalMember)
                .collect(Collectors.joining(",")) + "}";
    }

    private String setValue(SetInitializer initializer) {
        if (initializer.isRange()) {
            return expressions.factor(initializer.from()) + ".." + expressions.factor(initializer.to());
        }
        return "{" + initializer.members().stream()
                .map(expressions::literalMember)
                .collect(Collectors.joining(",")) + "}";
    }

    private String value(Object value) {
        if (value instanceof String text) {
            return OptmodelLiterals.quote(text);
        }
        if (value instanceof Number number) {
            return expressions.number(number.doubleValue());
        }
        if (value instanceof Expression expression) {
            return expressions.write(expression);
        }
        throw new RenderInconsistencyException("Unsupported value " + value);
    }
}
