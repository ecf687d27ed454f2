package com.optmodeler.core.statement;

/**
 * Visitor over statement types.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

    R visitConstraint(Constraint constraint);

    R visitConstraintGroup(ConstraintGroup group);

    R visitObjective(Objective objective);

    R visitSolve(SolveStatement solve);

    R visitPrint(PrintStatement print);

    R visitReadData(ReadDataStatement read);

    R visitCreateData(CreateDataStatement create);

    R visitDrop(DropStatement drop);

    R visitFix(FixStatement fix);

    R visitLiteral(LiteralStatement literal);
}
