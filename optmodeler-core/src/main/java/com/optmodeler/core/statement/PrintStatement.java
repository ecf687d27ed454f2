package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.expression.Operand;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code print x y;}. Items are entities (printed by name), operands (printed as
 * expressions) or raw strings.
 *
 * @param items items to print
 */
public record PrintStatement(List<Object> items) implements Statement {

    public PrintStatement {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("print needs at least one item");
        }
        for (Object item : items) {
            if (!(item instanceof Entity || item instanceof Operand || item instanceof String)) {
                throw new IllegalArgumentException("Cannot print item of type "
                        + (item == null ? "null" : item.getClass().getName()));
            }
        }
        items = List.copyOf(items);
    }

    public static PrintStatement of(Object... items) {
        return new PrintStatement(Arrays.asList(items));
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        for (Object item : items) {
            if (item instanceof Entity entity) {
                out.add(entity);
            } else if (item instanceof Operand operand) {
                Dependencies.addTo(operand.toExpression(), out);
            }
        }
        return out;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }
}
