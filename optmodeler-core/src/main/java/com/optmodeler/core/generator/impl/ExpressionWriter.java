package com.optmodeler.core.generator.impl;

import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.exception.RenderInconsistencyException;
import com.optmodeler.core.exception.UnboundReferenceException;
import com.optmodeler.core.expression.Constant;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.ExpressionVisitor;
import com.optmodeler.core.expression.FunctionCall;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.IteratedSum;
import com.optmodeler.core.expression.Power;
import com.optmodeler.core.expression.Product;
import com.optmodeler.core.expression.Quotient;
import com.optmodeler.core.expression.Reference;
import com.optmodeler.core.expression.Sum;
import com.optmodeler.core.expression.Symbol;
import com.optmodeler.core.util.OptmodelLiterals;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders expressions in OPTMODEL syntax.
 *
 * <p>Terms of a sum keep their insertion order, unit coefficients are omitted and the
 * constant comes last: {@code 3 * x - y + 2}. Sums used as factors are parenthesized, as are
 * compound denominators, compound power operands and iterated sums that are not standalone.
 */
final class ExpressionWriter implements ExpressionVisitor<String> {

    private final NameScope scope;
    private final int maxDigits;

    ExpressionWriter(NameScope scope, int maxDigits) {
        this.scope = scope;
        this.maxDigits = maxDigits;
    }

    String write(Expression expression) {
        return expression.accept(this);
    }

    String number(double value) {
        return OptmodelLiterals.formatNumber(value, maxDigits);
    }

    @Override
    public String visitConstant(Constant constant) {
        return number(constant.value());
    }

    @Override
    public String visitReference(Reference reference) {
        Entity entity = Dependencies.entityOf(reference.symbol());
        if (entity != null && !scope.current().isVisible(entity)) {
            throw new UnboundReferenceException("'" + entity.getName() + "' is not bound to container '"
                    + scope.current().getName() + "'");
        }
        String name = scope.symbol(reference.symbol());
        if (reference.key().isEmpty()) {
            return name;
        }
        return name + "[" + key(reference.key()) + "]";
    }

    @Override
    public String visitSum(Sum sum) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Expression, Double> entry : sum.terms().entrySet()) {
            Expression term = entry.getKey();
            double coefficient = entry.getValue();
            checkTerm(term, coefficient);
            boolean negative = coefficient < 0;
            String body = term(term, Math.abs(coefficient), negative && sb.length() == 0);
            if (sb.length() == 0) {
                sb.append(negative ? "-" : "").append(body);
            } else {
                sb.append(negative ? " - " : " + ").append(body);
            }
        }
        if (sum.constant() != 0.0) {
            sb.append(sum.constant() < 0 ? " - " : " + ").append(number(Math.abs(sum.constant())));
        }
        return sb.toString();
    }

    @Override
    public String visitProduct(Product product) {
        return factor(product.left()) + " * " + factor(product.right());
    }

    @Override
    public String visitQuotient(Quotient quotient) {
        Expression denominator = quotient.denominator();
        String right = isAtomic(denominator) ? write(denominator) : "(" + write(denominator) + ")";
        return factor(quotient.numerator()) + " / " + right;
    }

    @Override
    public String visitPower(Power power) {
        return powerOperand(power.base()) + " ^ " + powerOperand(power.exponent());
    }

    @Override
    public String visitFunctionCall(FunctionCall call) {
        return call.name() + "(" + call.arguments().stream().map(this::write).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String visitIteratedSum(IteratedSum sum) {
        Expression body = sum.body();
        String bodyText = body instanceof Sum || body instanceof IteratedSum ? "(" + write(body) + ")" : write(body);
        return "sum {" + bindings(sum.iterators()) + "} " + bodyText;
    }

    /**
     * Renders iterator bindings such as {@code i in I, <j, k> in S}.
     *
     * @param iterators iterators in binding order
     * @return binding list without braces
     */
    String bindings(List<? extends Symbol> iterators) {
        List<String> parts = new ArrayList<>();
        Set<Symbol> done = new HashSet<>();
        for (Symbol symbol : iterators) {
            if (!(symbol instanceof SetIterator iterator)) {
                throw new RenderInconsistencyException("Not an iterator: " + symbol.getName());
            }
            if (done.contains(iterator)) {
                continue;
            }
            List<SetIterator> tuple = iterator.getTuple();
            done.addAll(tuple);
            String setName = scope.entity(iterator.getSet());
            if (tuple.size() == 1) {
                parts.add(iterator.getName() + " in " + setName);
            } else {
                parts.add("<" + tuple.stream().map(SetIterator::getName).collect(Collectors.joining(", "))
                        + "> in " + setName);
            }
        }
        return String.join(", ", parts);
    }

    String key(IndexKey key) {
        return key.elements().stream().map(this::keyElement).collect(Collectors.joining(", "));
    }

    /**
     * Renders a literal member of an index set: {@code 1}, {@code 'a'} or {@code <'a',1>}.
     *
     * @param member member key
     * @return literal text
     */
    String literalMember(IndexKey member) {
        if (member.arity() == 1) {
            return OptmodelLiterals.formatElement(member.get(0), maxDigits);
        }
        return "<" + member.elements().stream()
                .map(e -> OptmodelLiterals.formatElement(e, maxDigits))
                .collect(Collectors.joining(",")) + ">";
    }

    /**
     * Renders an operand of a binary operator, parenthesizing sums.
     *
     * @param expression operand
     * @return text
     */
    String factor(Expression expression) {
        if (expression instanceof Sum || expression instanceof IteratedSum) {
            return "(" + write(expression) + ")";
        }
        if (expression instanceof Constant c && c.value() < 0) {
            return "(" + write(expression) + ")";
        }
        return write(expression);
    }

    private String keyElement(Object element) {
        if (element instanceof Symbol symbol) {
            return scope.symbol(symbol);
        }
        if (element instanceof Expression expression) {
            return write(expression);
        }
        return OptmodelLiterals.formatElement(element, maxDigits);
    }

    private String term(Expression term, double magnitude, boolean leadingMinus) {
        if (magnitude == 1.0) {
            return termFactor(term, leadingMinus);
        }
        return number(magnitude) + " * " + factor(term);
    }

    private String termFactor(Expression term, boolean leadingMinus) {
        if (term instanceof IteratedSum) {
            return "(" + write(term) + ")";
        }
        if (term instanceof Power && leadingMinus) {
            return "(" + write(term) + ")";
        }
        return write(term);
    }

    private String powerOperand(Expression expression) {
        if (expression instanceof Reference || expression instanceof FunctionCall) {
            return write(expression);
        }
        if (expression instanceof Constant c && c.value() >= 0) {
            return write(expression);
        }
        return "(" + write(expression) + ")";
    }

    private static boolean isAtomic(Expression expression) {
        return expression instanceof Reference || expression instanceof FunctionCall
                || expression instanceof Constant c && c.value() >= 0;
    }

    private static void checkTerm(Expression term, double coefficient) {
        if (term instanceof Sum || term instanceof Constant) {
            throw new RenderInconsistencyException("Unmerged term in sum: " + term);
        }
        if (coefficient == 0.0 || Double.isNaN(coefficient) || Double.isInfinite(coefficient)) {
            throw new RenderInconsistencyException("Invalid coefficient " + coefficient + " for term " + term);
        }
    }
}
