package com.optmodeler.core.container;

import com.optmodeler.core.statement.Statement;

/**
 * One item in a workspace's body: either a workspace-level statement or a sub-model.
 *
 * @param statement workspace statement, or null
 * @param model sub-model, or null
 */
public record WorkspaceMember(Statement statement, Model model) {

    public WorkspaceMember {
        if ((statement == null) == (model == null)) {
            throw new IllegalArgumentException("Exactly one of statement and model must be set");
        }
    }

    public boolean isModel() {
        return model != null;
    }
}
