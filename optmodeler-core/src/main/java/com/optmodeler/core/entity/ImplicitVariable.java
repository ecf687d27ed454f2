package com.optmodeler.core.entity;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.exception.IndexArityException;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.expression.Reference;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.symbol.RegisteredName;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named expression evaluated by the solver: {@code impvar total = x + y;} or, indexed,
 * {@code impvar z {i in I} = 2 * x[i] + 2;}.
 */
public class ImplicitVariable extends AbstractEntity implements Symbol, Operand {

    private final List<SetIterator> iterators;
    private final Expression body;
    private final Map<IndexKey, Double> values = new HashMap<>();

    public ImplicitVariable(Container owner, RegisteredName name, List<SetIterator> iterators, Expression body) {
        super(owner, name);
        this.iterators = iterators == null ? List.of() : List.copyOf(iterators);
        this.body = body;
    }

    public List<SetIterator> getIterators() {
        return iterators;
    }

    public Expression getBody() {
        return body;
    }

    public boolean isIndexed() {
        return !iterators.isEmpty();
    }

    /**
     * Refers to one member of an indexed implicit variable.
     *
     * @param key key elements
     * @return reference expression
     */
    public Expression get(Object... key) {
        IndexKey indexKey = IndexKey.of(key);
        if (indexKey.arity() != iterators.size()) {
            throw new IndexArityException(getName(), iterators.size(), indexKey.arity());
        }
        return new Reference(this, indexKey);
    }

    public void assignValue(IndexKey key, double value) {
        values.put(key, value);
    }

    @Override
    public int getArity() {
        return iterators.size();
    }

    @Override
    public boolean isDecision() {
        return true;
    }

    @Override
    public Double valueAt(IndexKey key) {
        return values.get(key);
    }

    @Override
    public Expression toExpression() {
        if (isIndexed()) {
            throw new IndexArityException(getName(), iterators.size(), 0);
        }
        return new Reference(this);
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        Dependencies.addIterators(iterators, out);
        Dependencies.addTo(body, out);
        out.remove(this);
        return out;
    }
}
