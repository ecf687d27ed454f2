package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Entity;

import java.util.Objects;
import java.util.Set;

/**
 * Raw statement text passed through unchanged, terminated with {@code ;} if missing.
 *
 * @param text statement text
 */
public record LiteralStatement(String text) implements Statement {

    public LiteralStatement {
        Objects.requireNonNull(text, "text must not be null");
        text = text.strip();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (!text.endsWith(";")) {
            text = text + ";";
        }
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        return Set.of();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
