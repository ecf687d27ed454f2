package com.optmodeler.core.definition;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.IndexSet;
import com.optmodeler.core.entity.OptSet;
import com.optmodeler.core.entity.Parameter;
import com.optmodeler.core.entity.ParameterGroup;
import com.optmodeler.core.entity.SetInitializer;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.entity.VariableGroup;
import com.optmodeler.core.exception.DefinitionException;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Expressions;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.SumBuilder;
import com.optmodeler.core.model.ConstraintDefinition;
import com.optmodeler.core.model.ModelDefinition;
import com.optmodeler.core.model.ObjectiveDefinition;
import com.optmodeler.core.model.ObjectiveSense;
import com.optmodeler.core.model.ParameterDefinition;
import com.optmodeler.core.model.RelationalOperator;
import com.optmodeler.core.model.SetDefinition;
import com.optmodeler.core.model.SolveDefinition;
import com.optmodeler.core.model.TermDefinition;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.model.VariableDefinition;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.statement.PrintStatement;
import com.optmodeler.core.statement.Relation;
import com.optmodeler.core.statement.SolveStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link Model} from a {@link ModelDefinition}.
 *
 * <p>Components are added in document order: sets, parameters, variables, constraints,
 * objective, solve and print. Member keys of parameter values are written as
 * comma-separated elements ({@code "a,1"}); numeric elements become numbers.
 */
public class ModelAssembler {

    private static final Logger log = LoggerFactory.getLogger(ModelAssembler.class);

    /**
     * Assembles a new model.
     *
     * @param definition model definition
     * @return populated, unsealed model
     * @throws DefinitionException if the definition refers to unknown components
     */
    public Model assemble(ModelDefinition definition) {
        Model model = new Model(definition.name());
        definition.sets().forEach(set -> addSet(model, set));
        definition.parameters().forEach(parameter -> addParameter(model, parameter));
        definition.variables().forEach(variable -> addVariable(model, variable));
        definition.constraints().forEach(constraint -> addConstraint(model, constraint));
        if (definition.objective() != null) {
            addObjective(model, definition.objective());
        }
        if (definition.solve() != null) {
            addSolve(model, definition.solve());
        }
        if (!definition.print().isEmpty()) {
            addPrint(model, definition.print());
        }
        log.debug("Assembled model '{}': {} entities, {} statements",
            model.getName(), model.getEntities().size(), model.getStatements().size());
        return model;
    }

    private void addSet(Model model, SetDefinition definition) {
        ValueType[] types = definition.types().stream().map(ModelAssembler::valueType).toArray(ValueType[]::new);
        OptSet set = model.addSet(definition.name(), types);
        if (!definition.values().isEmpty()) {
            set.setInit(SetInitializer.of(definition.values()));
        }
    }

    private void addParameter(Model model, ParameterDefinition definition) {
        ValueType type = definition.type() == null ? ValueType.NUM : valueType(definition.type());
        if (definition.over().isEmpty()) {
            Parameter parameter = model.addParameter(definition.name(), type);
            if (definition.init() != null) {
                parameter.setInit(definition.init());
            }
            if (!definition.values().isEmpty()) {
                throw new DefinitionException("Scalar parameter '" + definition.name() + "' cannot have member values");
            }
            return;
        }
        IndexSet[] dimensions = definition.over().stream().map(name -> dimension(model, name)).toArray(IndexSet[]::new);
        ParameterGroup group = model.addParameterGroup(definition.name(), type, dimensions);
        if (definition.init() != null) {
            group.setInit(definition.init());
        }
        for (Map.Entry<String, Object> value : definition.values().entrySet()) {
            group.get(parseKey(value.getKey())).setValue(value.getValue());
        }
    }

    private void addVariable(Model model, VariableDefinition definition) {
        VariableType type = definition.type() == null ? VariableType.CONTINUOUS : variableType(definition.type());
        if (definition.over().isEmpty()) {
            model.addVariable(definition.name(), type, definition.lb(), definition.ub(), definition.init());
            return;
        }
        IndexSet[] dimensions = definition.over().stream().map(over -> dimension(model, over)).toArray(IndexSet[]::new);
        VariableGroup group = model.addVariableGroup(definition.name(), type, definition.lb(), definition.ub(), dimensions);
        if (definition.init() != null) {
            group.setInit(definition.init());
        }
    }

    private void addConstraint(Model model, ConstraintDefinition definition) {
        Expression body = linear(model, definition.terms(), 0.0);
        if (definition.isRange()) {
            model.addRangeConstraint(definition.name(), definition.lower(), body, definition.upper());
        } else {
            model.addConstraint(definition.name(),
                Relation.of(body, operator(definition.sense()), Expressions.constant(definition.rhs())));
        }
    }

    private void addObjective(Model model, ObjectiveDefinition definition) {
        Expression expression = linear(model, definition.terms(), definition.constant());
        model.setObjective(definition.name(), expression, sense(definition.sense()));
    }

    private void addSolve(Model model, SolveDefinition definition) {
        SolveStatement solve = SolveStatement.with(definition.solver());
        for (Map.Entry<String, Object> option : definition.options().entrySet()) {
            solve = solve.withOption(option.getKey(), option.getValue());
        }
        model.addStatement(solve);
    }

    private void addPrint(Model model, List<String> names) {
        List<Object> items = new ArrayList<>();
        for (String name : names) {
            Entity entity = model.getEntity(name);
            // suffixed names such as c1.dual pass through as text
            items.add(entity != null ? entity : name);
        }
        model.addStatement(new PrintStatement(items));
    }

    private Expression linear(Model model, List<TermDefinition> terms, double constant) {
        SumBuilder builder = Expressions.newSumBuilder();
        for (TermDefinition term : terms) {
            builder.addTerm(operand(model, term), term.coefficient());
        }
        return builder.add(constant).build();
    }

    private Operand operand(Model model, TermDefinition term) {
        Entity entity = model.getVariable(term.variable());
        if (entity instanceof Variable variable) {
            if (!term.index().isEmpty()) {
                throw new DefinitionException("Variable '" + term.variable() + "' is not indexed");
            }
            return variable;
        }
        if (entity instanceof VariableGroup group) {
            return group.get(term.index().toArray());
        }
        throw new DefinitionException("Unknown variable '" + term.variable() + "'");
    }

    private IndexSet dimension(Model model, Object over) {
        if (over instanceof String name) {
            Entity entity = model.getEntity(name);
            if (entity instanceof OptSet set) {
                return IndexSet.over(set);
            }
            throw new DefinitionException("Unknown set '" + name + "'");
        }
        if (over instanceof List<?> members) {
            return IndexSet.of(members);
        }
        if (over instanceof Number count) {
            return IndexSet.range(count.intValue());
        }
        throw new DefinitionException("Cannot index over " + over);
    }

    private static Object[] parseKey(String key) {
        String[] parts = key.split(",");
        Object[] elements = new Object[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            elements[i] = parseElement(part);
        }
        return elements;
    }

    private static Object parseElement(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notLong) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException notNumber) {
                return text;
            }
        }
    }

    private static ValueType valueType(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "num", "number" -> ValueType.NUM;
            case "str", "string" -> ValueType.STR;
            default -> throw new DefinitionException("Unknown value type '" + text + "'");
        };
    }

    private static VariableType variableType(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "continuous", "real" -> VariableType.CONTINUOUS;
            case "integer", "int" -> VariableType.INTEGER;
            case "binary", "bin" -> VariableType.BINARY;
            default -> throw new DefinitionException("Unknown variable type '" + text + "'");
        };
    }

    private static RelationalOperator operator(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "<=", "le" -> RelationalOperator.LE;
            case ">=", "ge" -> RelationalOperator.GE;
            case "=", "==", "eq" -> RelationalOperator.EQ;
            default -> throw new DefinitionException("Unknown constraint sense '" + text + "'");
        };
    }

    private static ObjectiveSense sense(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "min", "minimize" -> ObjectiveSense.MINIMIZE;
            case "max", "maximize" -> ObjectiveSense.MAXIMIZE;
            default -> throw new DefinitionException("Unknown objective sense '" + text + "'");
        };
    }
}
