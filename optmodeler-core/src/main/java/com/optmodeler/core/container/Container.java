package com.optmodeler.core.container;

import com.optmodeler.core.entity.BoundOverride;
import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.ImplicitVariable;
import com.optmodeler.core.entity.IndexSet;
import com.optmodeler.core.entity.IndexSpace;
import com.optmodeler.core.entity.OptSet;
import com.optmodeler.core.entity.Parameter;
import com.optmodeler.core.entity.ParameterGroup;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.entity.VariableGroup;
import com.optmodeler.core.exception.DuplicateNameException;
import com.optmodeler.core.exception.EntityInUseException;
import com.optmodeler.core.exception.SealedContainerException;
import com.optmodeler.core.exception.UnboundReferenceException;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.IndexKey;
import com.optmodeler.core.expression.Operand;
import com.optmodeler.core.model.ObjectiveSense;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.statement.Constraint;
import com.optmodeler.core.statement.ConstraintGroup;
import com.optmodeler.core.statement.Objective;
import com.optmodeler.core.statement.Relation;
import com.optmodeler.core.statement.SolveStatement;
import com.optmodeler.core.statement.Statement;
import com.optmodeler.core.symbol.RegisteredName;
import com.optmodeler.core.symbol.SymbolKind;
import com.optmodeler.core.symbol.SymbolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owner of entities and statements, and the unit of rendering.
 *
 * <p>A container holds its own {@link SymbolRegistry}, its entities in creation order, its
 * statements in insertion order and the member overrides applied to its groups. Every
 * expression handed to a container is checked on entry: symbols must belong to this
 * container or, for a sub-model, to its workspace.
 *
 * <p>Rendering seals the container. After that any structural change throws
 * {@link SealedContainerException}; solution values can still be ingested.
 *
 * <pre>{@code
 * Model model = new Model("production");
 * Variable x = model.addVariable("x", VariableType.CONTINUOUS, 0.0, null);
 * model.addConstraint("c1", Relation.le(x, 10));
 * model.setObjective("obj", x, ObjectiveSense.MAXIMIZE);
 * }</pre>
 */
public abstract class Container {

    private static final Logger log = LoggerFactory.getLogger(Container.class);

    private final String name;
    private final SymbolRegistry registry;
    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final List<Statement> statements = new ArrayList<>();
    private final Map<BoundOverride.Slot, BoundOverride> overrides = new LinkedHashMap<>();
    private boolean sealed;

    protected Container(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name.trim().replace(' ', '_');
        this.registry = new SymbolRegistry(this.name);
    }

    public String getName() {
        return name;
    }

    public SymbolRegistry getRegistry() {
        return registry;
    }

    /**
     * Returns the enclosing container whose entities this one may reference.
     *
     * @return parent container, or null for a top-level container
     */
    public Container getParent() {
        return null;
    }

    // ---------------------------------------------------------------- sets and data

    public OptSet addSet(String name, ValueType... elementTypes) {
        ensureMutable();
        OptSet set = new OptSet(this, claimName(name, SymbolKind.SET), List.of(elementTypes));
        return register(set);
    }

    public Parameter addParameter(String name) {
        return addParameter(name, ValueType.NUM);
    }

    public Parameter addParameter(String name, ValueType type) {
        ensureMutable();
        return register(new Parameter(this, claimName(name, SymbolKind.PARAMETER), type));
    }

    /**
     * Adds a numeric parameter with an initial value.
     *
     * @param name parameter name, null to synthesize
     * @param init number or operand
     * @return new parameter
     */
    public Parameter addParameter(String name, Object init) {
        ValueType type = init instanceof CharSequence ? ValueType.STR : ValueType.NUM;
        Parameter parameter = addParameter(name, type);
        parameter.setInit(init);
        return parameter;
    }

    public ParameterGroup addParameterGroup(String name, IndexSet... dimensions) {
        return addParameterGroup(name, ValueType.NUM, dimensions);
    }

    public ParameterGroup addParameterGroup(String name, ValueType type, IndexSet... dimensions) {
        ensureMutable();
        IndexSpace space = bindSpace(dimensions);
        return register(new ParameterGroup(this, claimName(name, SymbolKind.PARAMETER), space, type));
    }

    // ---------------------------------------------------------------- variables

    public Variable addVariable(String name) {
        return addVariable(name, VariableType.CONTINUOUS, null, null, null);
    }

    public Variable addVariable(String name, VariableType type, Double lowerBound, Double upperBound) {
        return addVariable(name, type, lowerBound, upperBound, null);
    }

    public Variable addVariable(String name, VariableType type, Double lowerBound, Double upperBound, Double init) {
        ensureMutable();
        RegisteredName registered = claimName(name, SymbolKind.VARIABLE);
        try {
            return register(new Variable(this, registered, type, lowerBound, upperBound, init));
        } catch (IllegalArgumentException e) {
            registry.release(registered.name());
            throw e;
        }
    }

    public VariableGroup addVariableGroup(String name, IndexSet... dimensions) {
        return addVariableGroup(name, VariableType.CONTINUOUS, null, null, dimensions);
    }

    /**
     * Adds a variable group over the product of the given index sets.
     *
     * @param name group name, null to synthesize
     * @param type variable type
     * @param lowerBound group lower bound, null for the type default
     * @param upperBound group upper bound, null for the type default
     * @param dimensions one or more index sets
     * @return new group
     */
    public VariableGroup addVariableGroup(String name, VariableType type, Double lowerBound, Double upperBound,
                                          IndexSet... dimensions) {
        ensureMutable();
        IndexSpace space = bindSpace(dimensions);
        RegisteredName registered = claimName(name, SymbolKind.VARIABLE);
        try {
            return register(new VariableGroup(this, registered, space, type, lowerBound, upperBound, null));
        } catch (IllegalArgumentException e) {
            registry.release(registered.name());
            throw e;
        }
    }

    public ImplicitVariable addImplicitVariable(String name, Operand body) {
        return addImplicitVariable(name, List.of(), body);
    }

    /**
     * Adds an implicit variable, indexed when iterators are given.
     *
     * @param name implicit variable name, null to synthesize
     * @param iterators iterators of the index, empty for a scalar
     * @param body defining expression
     * @return new implicit variable
     */
    public ImplicitVariable addImplicitVariable(String name, List<SetIterator> iterators, Operand body) {
        ensureMutable();
        Objects.requireNonNull(body, "body must not be null");
        iterators.forEach(this::checkIterator);
        Expression expression = bind(body);
        return register(new ImplicitVariable(this, claimName(name, SymbolKind.IMPLICIT_VARIABLE),
                iterators, expression));
    }

    // ---------------------------------------------------------------- constraints

    public Constraint addConstraint(String name, Relation relation) {
        ensureMutable();
        Relation bound = bind(relation);
        Constraint constraint = new Constraint(this, claimName(name, SymbolKind.CONSTRAINT), bound);
        appendStatement(constraint);
        return constraint;
    }

    public Constraint addRangeConstraint(String name, double lower, Operand body, double upper) {
        return addConstraint(name, Relation.range(lower, body, upper));
    }

    public Constraint addRangeConstraint(String name, Operand lower, Operand body, Operand upper) {
        return addConstraint(name, Relation.range(lower, body, upper));
    }

    /**
     * Adds one solver-side constraint over iterators: {@code con c {i in I} : ...;}.
     *
     * @param name group name, null to synthesize
     * @param iterators iterators of the index
     * @param relation relation over the iterators
     * @return new group
     */
    public ConstraintGroup addConstraintGroup(String name, List<SetIterator> iterators, Relation relation) {
        ensureMutable();
        iterators.forEach(this::checkIterator);
        Relation bound = bind(relation);
        ConstraintGroup group = ConstraintGroup.overIterators(this,
                claimName(name, SymbolKind.CONSTRAINT), iterators, bound);
        appendStatement(group);
        return group;
    }

    /**
     * Adds a group of client-built constraints keyed by literal keys. Each member is named
     * {@code <name>_<key>} and renders as its own constraint.
     *
     * @param name group name, null to synthesize
     * @param relations relation per member key; tuple keys may be given as lists
     * @return new group
     */
    public ConstraintGroup addConstraints(String name, Map<?, Relation> relations) {
        ensureMutable();
        if (relations == null || relations.isEmpty()) {
            throw new IllegalArgumentException("addConstraints needs at least one relation");
        }
        Map<IndexKey, Relation> bound = new LinkedHashMap<>();
        relations.forEach((key, relation) -> bound.put(IndexKey.of(key), bind(relation)));

        RegisteredName groupName = claimName(name, SymbolKind.CONSTRAINT);
        Map<IndexKey, Constraint> members = new LinkedHashMap<>();
        List<String> registered = new ArrayList<>();
        try {
            for (Map.Entry<IndexKey, Relation> entry : bound.entrySet()) {
                RegisteredName memberName = claimName(memberName(groupName.name(), entry.getKey()),
                        SymbolKind.CONSTRAINT);
                registered.add(memberName.name());
                members.put(entry.getKey(), new Constraint(this, memberName, entry.getValue()));
            }
        } catch (RuntimeException e) {
            registered.forEach(registry::release);
            registry.release(groupName.name());
            throw e;
        }
        ConstraintGroup group = ConstraintGroup.ofMembers(this, groupName, members);
        appendStatement(group);
        return group;
    }

    /**
     * Replaces a constraint's relation, keeping its name and position.
     *
     * @param old constraint to replace
     * @param relation new relation
     * @return the replacement constraint
     */
    public Constraint replaceConstraint(Constraint old, Relation relation) {
        ensureMutable();
        int position = statements.indexOf(old);
        if (position < 0) {
            throw new UnboundReferenceException("Constraint '" + old.getName() + "' is not part of '" + name + "'");
        }
        Constraint replacement = new Constraint(this, old.getRegisteredName(), bind(relation));
        statements.set(position, replacement);
        statementReplaced(old, replacement);
        log.debug("Replaced constraint '{}' in '{}'", old.getName(), name);
        return replacement;
    }

    // ---------------------------------------------------------------- objectives and actions

    /**
     * Sets the primary objective, replacing any previous one in place.
     *
     * @param name objective name, null to synthesize
     * @param expression objective expression
     * @param sense optimization direction
     * @return new objective
     */
    public Objective setObjective(String name, Operand expression, ObjectiveSense sense) {
        ensureMutable();
        Expression bound = bind(expression);
        Objective previous = getPrimaryObjective();
        if (previous != null) {
            checkNotReferenced(previous);
            registry.release(previous.getName());
        }
        Objective objective;
        try {
            objective = new Objective(claimName(name, SymbolKind.OBJECTIVE), sense, bound, true);
        } catch (RuntimeException e) {
            if (previous != null) {
                registry.restore(previous.getRegisteredName());
            }
            throw e;
        }
        if (previous != null) {
            int position = statements.indexOf(previous);
            statements.set(position, objective);
            statementReplaced(previous, objective);
        } else {
            appendStatement(objective);
        }
        return objective;
    }

    /**
     * Adds a further objective without replacing the primary one, as used by
     * multi-objective solvers.
     *
     * @param name objective name, null to synthesize
     * @param expression objective expression
     * @param sense optimization direction
     * @return new objective
     */
    public Objective appendObjective(String name, Operand expression, ObjectiveSense sense) {
        ensureMutable();
        Expression bound = bind(expression);
        Objective objective = new Objective(claimName(name, SymbolKind.OBJECTIVE), sense, bound, false);
        appendStatement(objective);
        return objective;
    }

    /**
     * Adds an action statement such as solve, print or read data.
     *
     * @param statement action to append
     * @param <T> statement type
     * @return the statement
     */
    public <T extends Statement> T addStatement(T statement) {
        ensureMutable();
        Objects.requireNonNull(statement, "statement must not be null");
        if (statement instanceof Constraint || statement instanceof ConstraintGroup || statement instanceof Objective) {
            throw new IllegalArgumentException("Use the constraint and objective factories or add(...) for '"
                    + statement.getName() + "'");
        }
        checkBound(statement.getDependencies());
        for (Statement dependency : statement.getStatementDependencies()) {
            if (!statements.contains(dependency)) {
                throw new UnboundReferenceException("Statement '" + dependency.getName()
                        + "' is not part of '" + name + "'");
            }
        }
        appendStatement(statement);
        return statement;
    }

    public SolveStatement addSolve() {
        return addStatement(SolveStatement.defaults());
    }

    /**
     * Appends a pre-built statement. Constraints and objectives created by this container
     * and dropped earlier are re-admitted under their original name.
     *
     * @param statement statement to add
     * @param <T> statement type
     * @return the statement
     */
    public <T extends Statement> T add(T statement) {
        ensureMutable();
        Objects.requireNonNull(statement, "statement must not be null");
        if (statement instanceof Constraint constraint) {
            checkOwner(constraint.getOwner(), constraint.getName());
            checkBound(constraint.getDependencies());
            claimAll(List.of(constraint.getName()), SymbolKind.CONSTRAINT);
            appendStatement(constraint);
            return statement;
        }
        if (statement instanceof ConstraintGroup group) {
            checkOwner(group.getOwner(), group.getName());
            checkBound(group.getDependencies());
            List<String> names = new ArrayList<>();
            names.add(group.getName());
            group.getMembers().values().forEach(m -> names.add(m.getName()));
            claimAll(names, SymbolKind.CONSTRAINT);
            appendStatement(group);
            return statement;
        }
        if (statement instanceof Objective objective) {
            if (statements.contains(objective)) {
                throw new IllegalArgumentException("Objective '" + objective.getName() + "' is already present");
            }
            if (objective.isPrimary() && getPrimaryObjective() != null) {
                throw new IllegalArgumentException("A primary objective is already set; use setObjective");
            }
            checkBound(objective.getDependencies());
            claimName(objective.getName(), SymbolKind.OBJECTIVE);
            appendStatement(objective);
            return statement;
        }
        return addStatement(statement);
    }

    // ---------------------------------------------------------------- removal

    /**
     * Removes an entity and frees its name.
     *
     * @param entity entity to remove
     * @throws EntityInUseException if other entities or statements still reference it
     */
    public void drop(Entity entity) {
        ensureMutable();
        if (entity.getOwner() != this || !entities.containsKey(entity.getName())) {
            throw new UnboundReferenceException("Entity '" + entity.getName() + "' is not part of '" + name + "'");
        }
        List<String> dependents = new ArrayList<>();
        for (Container container : scope()) {
            container.entities.values().stream()
                    .filter(e -> e != entity && e.getDependencies().contains(entity))
                    .map(Entity::getName)
                    .forEach(dependents::add);
            container.statements.stream()
                    .filter(s -> s.getDependencies().contains(entity))
                    .map(Container::describe)
                    .forEach(dependents::add);
        }
        if (!dependents.isEmpty()) {
            throw new EntityInUseException(entity.getName(), dependents);
        }
        entities.remove(entity.getName());
        overrides.keySet().removeIf(slot -> slot.target() == entity);
        registry.release(entity.getName());
        log.debug("Dropped {} '{}' from '{}'", entity.getKind(), entity.getName(), name);
    }

    /**
     * Removes a statement and frees its name.
     *
     * @param statement statement to remove
     * @throws EntityInUseException if another statement refers to it
     */
    public void drop(Statement statement) {
        ensureMutable();
        if (!statements.contains(statement)) {
            throw new UnboundReferenceException("Statement '" + describe(statement) + "' is not part of '" + name + "'");
        }
        checkNotReferenced(statement);
        statements.remove(statement);
        statementRemoved(statement);
        if (statement.getName() != null) {
            registry.release(statement.getName());
        }
        if (statement instanceof ConstraintGroup group) {
            group.getMembers().values().forEach(m -> registry.release(m.getName()));
        }
        log.debug("Dropped statement '{}' from '{}'", describe(statement), name);
    }

    // ---------------------------------------------------------------- lookups

    /**
     * Returns all entities in creation order.
     *
     * @return unmodifiable entity list
     */
    public List<Entity> getEntities() {
        return List.copyOf(entities.values());
    }

    public Entity getEntity(String name) {
        return entities.get(name);
    }

    public boolean contains(Entity entity) {
        return entities.get(entity.getName()) == entity;
    }

    /**
     * Looks up a scalar variable or variable group by name.
     *
     * @param name variable name
     * @return the variable entity, or null if none has that name
     */
    public Entity getVariable(String name) {
        Entity entity = entities.get(name);
        return entity instanceof Variable || entity instanceof VariableGroup ? entity : null;
    }

    /**
     * Looks up a constraint or constraint group by name.
     *
     * @param name constraint name
     * @return the statement, or null if none has that name
     */
    public Statement getConstraint(String name) {
        return statements.stream()
                .filter(s -> s instanceof Constraint || s instanceof ConstraintGroup)
                .filter(s -> name.equals(s.getName()))
                .findFirst()
                .orElse(null);
    }

    public Statement getStatement(String name) {
        return statements.stream().filter(s -> name.equals(s.getName())).findFirst().orElse(null);
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public Objective getPrimaryObjective() {
        return statements.stream()
                .filter(s -> s instanceof Objective o && o.isPrimary())
                .map(Objective.class::cast)
                .findFirst()
                .orElse(null);
    }

    public List<Objective> getObjectives() {
        return statements.stream()
                .filter(Objective.class::isInstance)
                .map(Objective.class::cast)
                .collect(Collectors.toList());
    }

    /**
     * Returns the overrides of one group in first-application order.
     *
     * @param target group entity
     * @return overrides for the group
     */
    public List<BoundOverride> getOverrides(Entity target) {
        return overrides.values().stream()
                .filter(o -> o.target() == target)
                .collect(Collectors.toList());
    }

    public List<BoundOverride> getOverrides() {
        return List.copyOf(overrides.values());
    }

    // ---------------------------------------------------------------- sealing and binding

    public boolean isSealed() {
        return sealed || (getParent() != null && getParent().isSealed());
    }

    /**
     * Seals this container against structural changes. Called by generators.
     */
    public void seal() {
        if (!sealed) {
            sealed = true;
            log.debug("Sealed container '{}'", name);
        }
    }

    /**
     * Fails if the container is sealed.
     *
     * @throws SealedContainerException after rendering
     */
    public void ensureMutable() {
        if (isSealed()) {
            throw new SealedContainerException(name);
        }
    }

    /**
     * Records a member override; a repeated override of the same slot keeps its first position.
     *
     * @param override override to record
     */
    public void recordOverride(BoundOverride override) {
        ensureMutable();
        overrides.put(override.slot(), override);
    }

    /**
     * Converts an operand to an expression after checking that all its symbols are bound here.
     *
     * @param operand operand to bind
     * @return bound expression
     * @throws UnboundReferenceException if a symbol belongs to another container or was dropped
     */
    public Expression bind(Operand operand) {
        Objects.requireNonNull(operand, "operand must not be null");
        Expression expression = operand.toExpression();
        checkBound(Dependencies.of(expression));
        return expression;
    }

    /**
     * Returns whether an entity may be referenced from this container.
     *
     * @param entity entity to check
     * @return true for live entities of this container or of its parent
     */
    public boolean isVisible(Entity entity) {
        Container owner = entity.getOwner();
        if (owner != this && owner != getParent()) {
            return false;
        }
        return owner.contains(entity);
    }

    // ---------------------------------------------------------------- hooks

    /**
     * Returns this container and every container that may reference its entities.
     *
     * @return containers to search for dependents
     */
    protected List<Container> scope() {
        return List.of(this);
    }

    /**
     * Checks that a newly registered local name does not collide once rendered.
     *
     * @param localName name just registered in this container
     * @throws DuplicateNameException on a collision
     */
    protected void checkRenderedName(String localName) {
    }

    protected void statementAdded(Statement statement) {
    }

    protected void statementRemoved(Statement statement) {
    }

    protected void statementReplaced(Statement old, Statement replacement) {
    }

    // ---------------------------------------------------------------- internals

    private <T extends Entity> T register(T entity) {
        entities.put(entity.getName(), entity);
        log.trace("Added {} '{}' to '{}'", entity.getKind(), entity.getName(), name);
        return entity;
    }

    private void appendStatement(Statement statement) {
        statements.add(statement);
        statementAdded(statement);
        log.trace("Added statement '{}' to '{}'", describe(statement), name);
    }

    private Relation bind(Relation relation) {
        Objects.requireNonNull(relation, "relation must not be null");
        checkBound(relation.dependencies());
        return relation;
    }

    private IndexSpace bindSpace(IndexSet... dimensions) {
        IndexSpace space = new IndexSpace(List.of(dimensions));
        checkBound(space.getSets());
        return space;
    }

    private void checkIterator(SetIterator iterator) {
        checkBound(Set.of(iterator.getSet()));
    }

    private void checkBound(Set<Entity> referenced) {
        for (Entity entity : referenced) {
            if (!isVisible(entity)) {
                throw new UnboundReferenceException("'" + entity.getName() + "' is not bound to container '"
                        + name + "'");
            }
        }
    }

    private void checkNotReferenced(Statement statement) {
        List<String> dependents = statements.stream()
                .filter(s -> s != statement && s.getStatementDependencies().contains(statement))
                .map(Container::describe)
                .collect(Collectors.toList());
        if (!dependents.isEmpty()) {
            throw new EntityInUseException(describe(statement), dependents);
        }
    }

    private void checkOwner(Container owner, String statementName) {
        if (owner != this) {
            throw new UnboundReferenceException("'" + statementName + "' was created by container '"
                    + owner.getName() + "'");
        }
    }

    /**
     * Registers a name and checks it against the names rendered alongside this container.
     *
     * @param preferredName requested name, or null to synthesize one
     * @param kind component kind
     * @return registered name
     * @throws DuplicateNameException if the name is taken here or its rendered form is taken
     *     elsewhere in the enclosing workspace
     */
    protected RegisteredName claimName(String preferredName, SymbolKind kind) {
        RegisteredName registered = registry.register(preferredName, kind);
        try {
            checkRenderedName(registered.name());
        } catch (RuntimeException e) {
            registry.release(registered.name());
            throw e;
        }
        return registered;
    }

    private void claimAll(List<String> names, SymbolKind kind) {
        List<String> claimed = new ArrayList<>();
        try {
            for (String statementName : names) {
                claimed.add(claimName(statementName, kind).name());
            }
        } catch (RuntimeException e) {
            claimed.forEach(registry::release);
            throw e;
        }
    }

    private static String memberName(String groupName, IndexKey key) {
        StringBuilder sb = new StringBuilder(groupName);
        for (Object element : key.elements()) {
            sb.append('_').append(String.valueOf(element).replaceAll("[^A-Za-z0-9_]", "_"));
        }
        return sb.toString();
    }

    static String describe(Statement statement) {
        return statement.getName() != null ? statement.getName() : statement.getClass().getSimpleName();
    }
}
