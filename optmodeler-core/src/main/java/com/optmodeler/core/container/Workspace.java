package com.optmodeler.core.container;

import com.optmodeler.core.exception.DuplicateNameException;
import com.optmodeler.core.statement.Statement;
import com.optmodeler.core.symbol.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A session-level container holding shared data and several sub-models.
 *
 * <p>Workspace entities and statements render first; sub-models and workspace statements
 * then follow in insertion order. Each sub-model renders as {@code problem m;} and
 * {@code use problem m;} followed by its body, with its symbols prefixed by {@code m_}.
 * Sub-models may refer to workspace entities.
 *
 * <pre>{@code
 * Workspace ws = new Workspace("planning");
 * OptSet products = ws.addSet("PRODUCTS", ValueType.STR);
 * Model first = ws.openModel("stage1");
 * first.addVariableGroup("make", IndexSet.over(products));
 * }</pre>
 */
public class Workspace extends Container {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final List<WorkspaceMember> members = new ArrayList<>();

    public Workspace(String name) {
        super(name);
    }

    /**
     * Opens a new sub-model. Its name must be unique within the workspace.
     *
     * @param name problem name
     * @return new sub-model
     */
    public Model openModel(String name) {
        ensureMutable();
        String registered = claimName(name, SymbolKind.PROBLEM).name();
        Model model = new Model(registered, this);
        members.add(new WorkspaceMember(null, model));
        log.debug("Opened model '{}' in workspace '{}'", registered, getName());
        return model;
    }

    /**
     * Returns the sub-models in the order they were opened.
     *
     * @return sub-models
     */
    public List<Model> getModels() {
        return members.stream()
                .filter(WorkspaceMember::isModel)
                .map(WorkspaceMember::model)
                .collect(Collectors.toList());
    }

    public Model getModel(String name) {
        return getModels().stream().filter(m -> m.getName().equals(name)).findFirst().orElse(null);
    }

    /**
     * Returns statements and sub-models in insertion order.
     *
     * @return workspace body
     */
    public List<WorkspaceMember> getMembers() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public void seal() {
        super.seal();
        getModels().forEach(Model::seal);
    }

    @Override
    protected void checkRenderedName(String localName) {
        checkRenderedClash(localName, this);
    }

    /**
     * Rejects a rendered name already produced by the workspace itself or by another
     * sub-model's {@code <model>_<name>} prefix.
     *
     * @param rendered name as it appears in the generated program
     * @param requester container registering the name
     * @throws DuplicateNameException on a collision
     */
    void checkRenderedClash(String rendered, Container requester) {
        if (requester != this && getRegistry().isRegistered(rendered)) {
            throw new DuplicateNameException(rendered, getName());
        }
        for (Model model : getModels()) {
            String prefix = model.getName() + "_";
            if (model != requester && rendered.startsWith(prefix)
                    && model.getRegistry().isRegistered(rendered.substring(prefix.length()))) {
                throw new DuplicateNameException(rendered, getName());
            }
        }
    }

    @Override
    protected List<Container> scope() {
        List<Container> scope = new ArrayList<>();
        scope.add(this);
        scope.addAll(getModels());
        return scope;
    }

    @Override
    protected void statementAdded(Statement statement) {
        members.add(new WorkspaceMember(statement, null));
    }

    @Override
    protected void statementRemoved(Statement statement) {
        members.removeIf(m -> m.statement() == statement);
    }

    @Override
    protected void statementReplaced(Statement old, Statement replacement) {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).statement() == old) {
                members.set(i, new WorkspaceMember(replacement, null));
            }
        }
    }
}
