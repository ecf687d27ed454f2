package com.optmodeler.core.container;

/**
 * A single optimization problem: variables, constraints and objectives rendered as one
 * program, or as a named problem block inside a {@link Workspace}.
 */
public class Model extends Container {

    private final Workspace workspace;

    public Model(String name) {
        this(name, null);
    }

    Model(String name, Workspace workspace) {
        super(name);
        this.workspace = workspace;
    }

    /**
     * Returns the workspace this model was opened in.
     *
     * @return enclosing workspace, or null for a standalone model
     */
    public Workspace getWorkspace() {
        return workspace;
    }

    @Override
    public Container getParent() {
        return workspace;
    }

    @Override
    protected void checkRenderedName(String localName) {
        if (workspace != null) {
            workspace.checkRenderedClash(getName() + "_" + localName, this);
        }
    }
}
