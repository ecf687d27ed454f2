package com.optmodeler.core.generator.impl;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.container.Model;
import com.optmodeler.core.container.Workspace;
import com.optmodeler.core.container.WorkspaceMember;
import com.optmodeler.core.entity.BoundOverride;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.OptSet;
import com.optmodeler.core.generator.CodeGenerator;
import com.optmodeler.core.generator.GeneratedProgram;
import com.optmodeler.core.generator.GeneratorConfig;
import com.optmodeler.core.generator.RenderPhase;
import com.optmodeler.core.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generates SAS PROC OPTMODEL programs from models and workspaces.
 *
 * <h2>Program Layout</h2>
 * <ol>
 *   <li>Set declarations whose contents do not depend on other entities, in creation order</li>
 *   <li>All other declarations in creation order</li>
 *   <li>Member overrides ({@code x[1].ub = 5;}) in the order they were first applied</li>
 *   <li>Statements in insertion order; for a workspace, sub-models are rendered as
 *       {@code problem m;} / {@code use problem m;} blocks at the point they were opened</li>
 * </ol>
 *
 * <p>The whole program is wrapped in {@code proc optmodel;} ... {@code quit;} with each line
 * indented, unless {@link GeneratorConfig#wrapInProc()} is false.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Model model = new Model("demo");
 * Variable x = model.addVariable("x", VariableType.CONTINUOUS, 0.0, null);
 * model.addConstraint("c1", Relation.le(x, 10));
 * model.setObjective("obj", x, ObjectiveSense.MAXIMIZE);
 *
 * GeneratedProgram program = new OptmodelGenerator().generate(model, GeneratorConfig.defaults());
 * // proc optmodel;
 * //     var x >= 0;
 * //     con c1 : x <= 10;
 * //     max obj = x;
 * // quit;
 * }</pre>
 */
public class OptmodelGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OptmodelGenerator.class);

    private static final String GENERATOR_ID = "optmodel";
    private static final String GENERATOR_DISPLAY_NAME = "SAS PROC OPTMODEL Generator";
    private static final String FILE_EXTENSION = "sas";

    private static final String PROC_START = "proc optmodel;";
    private static final String PROC_END = "quit;";
    private static final String NEWLINE = "\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedProgram generate(Container container, GeneratorConfig config) {
        Objects.requireNonNull(container, "container must not be null");
        GeneratorConfig effective = config != null ? config : GeneratorConfig.defaults();

        Map<Container, String> prefixes = new HashMap<>();
        if (container instanceof Workspace workspace) {
            workspace.getModels().forEach(m -> prefixes.put(m, m.getName() + "_"));
        }
        NameScope scope = new NameScope(container, prefixes);
        List<String> body = render(container, scope, effective);

        StringBuilder sb = new StringBuilder();
        if (effective.wrapInProc()) {
            sb.append(PROC_START).append(NEWLINE);
            body.forEach(line -> sb.append(effective.indent()).append(line).append(NEWLINE));
            sb.append(PROC_END).append(NEWLINE);
        } else {
            body.forEach(line -> sb.append(line).append(NEWLINE));
        }

        container.seal();
        log.info("Generated {} statement(s) for '{}'", body.size(), container.getName());
        return new GeneratedProgram(container.getName(), sb.toString(), FILE_EXTENSION);
    }

    private List<String> render(Container container, NameScope scope, GeneratorConfig config) {
        log.debug("Rendering container '{}'", container.getName());
        ExpressionWriter expressions = new ExpressionWriter(scope, config.maxDigits());
        DeclarationWriter declarations = new DeclarationWriter(scope, expressions);
        StatementWriter statements = new StatementWriter(scope, expressions);
        ProgramSection section = new ProgramSection(container.getName());

        for (Entity entity : declarationOrder(container)) {
            section.declaration(declarations.declare(entity));
        }
        section.advance(RenderPhase.DECLARED);

        for (BoundOverride override : container.getOverrides()) {
            section.override(declarations.override(override));
        }
        section.advance(RenderPhase.OVERRIDES_EMITTED);

        if (container instanceof Workspace workspace) {
            for (WorkspaceMember member : workspace.getMembers()) {
                if (member.isModel()) {
                    section.statement(renderSubModel(member.model(), scope, config));
                } else {
                    section.statement(member.statement().accept(statements));
                }
            }
        } else {
            for (Statement statement : container.getStatements()) {
                section.statement(statement.accept(statements));
            }
        }
        section.advance(RenderPhase.STATEMENTS_EMITTED);
        section.advance(RenderPhase.SEALED);
        return section.lines();
    }

    private List<String> renderSubModel(Model model, NameScope scope, GeneratorConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("problem " + model.getName() + ";");
        lines.add("use problem " + model.getName() + ";");
        lines.addAll(render(model, scope.enter(model), config));
        return lines;
    }

    /**
     * Self-contained sets first, then every other entity in creation order.
     */
    private static List<Entity> declarationOrder(Container container) {
        List<Entity> ordered = new ArrayList<>();
        List<Entity> rest = new ArrayList<>();
        for (Entity entity : container.getEntities()) {
            if (entity instanceof OptSet set && set.getDependencies().isEmpty()) {
                ordered.add(entity);
            } else {
                rest.add(entity);
            }
        }
        ordered.addAll(rest);
        return ordered;
    }
}
