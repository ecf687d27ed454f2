package com.optmodeler.core.generator.impl;

import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.expression.Constant;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Expressions;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Sum;
import com.optmodeler.core.statement.Constraint;
import com.optmodeler.core.statement.ConstraintGroup;
import com.optmodeler.core.statement.CreateDataStatement;
import com.optmodeler.core.statement.DropStatement;
import com.optmodeler.core.statement.FixStatement;
import com.optmodeler.core.statement.LiteralStatement;
import com.optmodeler.core.statement.Objective;
import com.optmodeler.core.statement.PrintStatement;
import com.optmodeler.core.statement.ReadDataStatement;
import com.optmodeler.core.statement.Relation;
import com.optmodeler.core.statement.SolveStatement;
import com.optmodeler.core.statement.StatementVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders statements. Most statements produce one line; concrete constraint groups produce
 * one line per member.
 */
final class StatementWriter implements StatementVisitor<List<String>> {

    private final NameScope scope;
    private final ExpressionWriter expressions;

    StatementWriter(NameScope scope, ExpressionWriter expressions) {
        this.scope = scope;
        this.expressions = expressions;
    }

    @Override
    public List<String> visitConstraint(Constraint constraint) {
        return List.of(constraintLine(constraint));
    }

    @Override
    public List<String> visitConstraintGroup(ConstraintGroup group) {
        if (group.isAbstract()) {
            return List.of("con " + scope.local(group.getName())
                    + " {" + expressions.bindings(group.getIterators()) + "} : "
                    + relation(group.getRelation()) + ";");
        }
        List<String> lines = new ArrayList<>(group.getMembers().size());
        group.getMembers().values().forEach(member -> lines.add(constraintLine(member)));
        return lines;
    }

    @Override
    public List<String> visitObjective(Objective objective) {
        return List.of(objective.getSense().keyword() + " " + scope.local(objective.getName())
                + " = " + expressions.write(objective.getExpression()) + ";");
    }

    @Override
    public List<String> visitSolve(SolveStatement solve) {
        StringBuilder sb = new StringBuilder("solve");
        if (solve.solver() != null) {
            sb.append(" with ").append(solve.solver());
        }
        if (solve.objectives().size() == 1) {
            sb.append(" obj ").append(scope.local(solve.objectives().get(0).getName()));
        } else if (!solve.objectives().isEmpty()) {
            sb.append(" obj (")
                    .append(solve.objectives().stream().map(o -> scope.local(o.getName())).collect(Collectors.joining(" ")))
                    .append(')');
        }
        if (!solve.options().isEmpty()) {
            sb.append(" /");
            for (Map.Entry<String, Object> option : solve.options().entrySet()) {
                sb.append(' ').append(option.getKey()).append('=').append(optionValue(option.getValue()));
            }
        }
        return List.of(sb.append(';').toString());
    }

    @Override
    public List<String> visitPrint(PrintStatement print) {
        return List.of("print " + print.items().stream().map(this::printItem).collect(Collectors.joining(" ")) + ";");
    }

    @Override
    public List<String> visitReadData(ReadDataStatement read) {
        StringBuilder sb = new StringBuilder("read data ").append(read.table()).append(" into");
        if (read.keySet() != null) {
            sb.append(' ').append(scope.entity(read.keySet()))
                    .append("=[").append(String.join(" ", read.keyColumns())).append(']');
        }
        for (ReadDataStatement.Column column : read.columns()) {
            sb.append(' ').append(scope.entity(column.target()));
            if (column.column() != null) {
                sb.append('=').append(column.column());
            }
        }
        return List.of(sb.append(';').toString());
    }

    @Override
    public List<String> visitCreateData(CreateDataStatement create) {
        StringBuilder sb = new StringBuilder("create data ").append(create.table()).append(" from");
        if (!create.keys().isEmpty()) {
            sb.append(" [")
                    .append(create.keys().stream().map(SetIterator::getName)
                            .collect(Collectors.joining(" ")))
                    .append("]={").append(expressions.bindings(create.keys())).append('}');
        }
        for (CreateDataStatement.Column column : create.columns()) {
            sb.append(' ');
            if (column.name() != null) {
                sb.append(column.name()).append('=');
            }
            sb.append(expressions.factor(column.expression()));
        }
        return List.of(sb.append(';').toString());
    }

    @Override
    public List<String> visitDrop(DropStatement drop) {
        return List.of((drop.restore() ? "restore " : "drop ")
                + drop.constraints().stream().map(c -> scope.local(c.getName())).collect(Collectors.joining(" ")) + ";");
    }

    @Override
    public List<String> visitFix(FixStatement fix) {
        if (fix.isUnfix()) {
            return List.of("unfix " + expressions.write(fix.target()) + ";");
        }
        return List.of("fix " + expressions.write(fix.target()) + " = " + expressions.write(fix.value()) + ";");
    }

    @Override
    public List<String> visitLiteral(LiteralStatement literal) {
        return List.of(literal.text());
    }

    private String constraintLine(Constraint constraint) {
        return "con " + scope.local(constraint.getName()) + " : " + relation(constraint.getRelation()) + ";";
    }

    /**
     * Renders a relation with variables on the left and the constant part moved right:
     * {@code x + y >= 3} rather than {@code x + y - 3 >= 0}.
     *
     * @param relation relation to render
     * @return relation text
     */
    String relation(Relation relation) {
        if (relation.isRange()) {
            Expression body = relation.lhs();
            Expression lower = relation.rhs();
            Expression upper = relation.upper();
            if (body instanceof Sum sum && sum.constant() != 0.0) {
                double offset = sum.constant();
                body = Expressions.subtract(body, offset);
                lower = Expressions.subtract(lower, offset);
                upper = Expressions.subtract(upper, offset);
            }
            return expressions.write(lower) + " <= " + expressions.write(body) + " <= " + expressions.write(upper);
        }
        String operator = relation.operator().symbol();
        Expression difference = relation.difference();
        if (difference instanceof Sum sum) {
            Expression body = Expressions.subtract(sum, sum.constant());
            return expressions.write(body) + " " + operator + " " + expressions.number(-sum.constant());
        }
        if (difference instanceof Constant constant) {
            return "0 " + operator + " " + expressions.number(-constant.value());
        }
        return expressions.write(difference) + " " + operator + " 0";
    }

    private String printItem(Object item) {
        if (item instanceof Entity entity) {
            return scope.entity(entity);
        }
        if (item instanceof Operand operand) {
            return expressions.factor(operand.toExpression());
        }
        return item.toString();
    }

    private String optionValue(Object value) {
        if (value instanceof Number number) {
            return expressions.number(number.doubleValue());
        }
        return String.valueOf(value);
    }
}
