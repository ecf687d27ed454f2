package com.optmodeler.core.generator.impl;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.container.Workspace;
import com.optmodeler.core.entity.IndexSet;
import com.optmodeler.core.entity.OptSet;
import com.optmodeler.core.entity.Parameter;
import com.optmodeler.core.entity.ParameterGroup;
import com.optmodeler.core.entity.SetInitializer;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.entity.VariableGroup;
import com.optmodeler.core.exception.SealedContainerException;
import com.optmodeler.core.expression.Expressions;
import com.optmodeler.core.generator.GeneratedProgram;
import com.optmodeler.core.generator.GeneratorConfig;
import com.optmodeler.core.model.ObjectiveSense;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.statement.PrintStatement;
import com.optmodeler.core.statement.Relation;
import com.optmodeler.core.statement.SolveStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OptmodelGenerator}.
 */
class OptmodelGeneratorTest {

    private OptmodelGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new OptmodelGenerator();
    }

    @Test
    void getId_returnsOptmodel() {
        assertThat(generator.getId()).isEqualTo("optmodel");
        assertThat(generator.getDisplayName()).isEqualTo("SAS PROC OPTMODEL Generator");
        assertThat(generator.getFileExtension()).isEqualTo("sas");
    }

    @Test
    void generate_withNullContainer_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, GeneratorConfig.defaults()))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_basicModel_matchesGoldenFixture() throws IOException {
        Model model = new Model("basic");
        Variable x = model.addVariable("x", VariableType.CONTINUOUS, 0.0, null);
        model.addConstraint("c1", Relation.le(x, 10));
        model.setObjective("obj", x, ObjectiveSense.MAXIMIZE);

        GeneratedProgram program = generator.generate(model, GeneratorConfig.defaults());

        assertThat(program.name()).isEqualTo("basic");
        assertThat(program.fileExtension()).isEqualTo("sas");
        assertThat(program.content()).isEqualTo(golden("basic.sas"));
    }

    @Test
    void generate_cancellingTerms_omitsZeroCoefficientVariable() {
        Model model = new Model("cancel");
        Variable x = model.addVariable("x");
        Variable y = model.addVariable("y");
        model.addConstraint("c", Relation.le(Expressions.subtract(Expressions.add(x, y), x), 3));

        String content = generator.generate(model, GeneratorConfig.defaults()).content();

        assertThat(content).contains("    var x;").contains("    con c : y <= 3;");
        assertThat(content).doesNotContain("0 * x").doesNotContain("- x");
    }

    @Test
    void generate_transportModel_matchesGoldenFixture() throws IOException {
        assertThat(generator.generate(transport(), null).content()).isEqualTo(golden("transport.sas"));
    }

    @Test
    void generate_workspace_matchesGoldenFixture() throws IOException {
        Workspace workspace = new Workspace("planning");
        OptSet products = workspace.addSet("P", ValueType.STR).setInit(SetInitializer.of("a", "b"));
        ParameterGroup price = workspace.addParameterGroup("price", IndexSet.over(products)).setInit(2);
        SetIterator p = products.iterator("p");

        Model first = workspace.openModel("stage1");
        VariableGroup make = first.addVariableGroup("make", VariableType.CONTINUOUS, 0.0, null, IndexSet.over(products));
        first.setObjective("revenue",
            Expressions.sumOver(List.of(p), Expressions.multiply(price.get(p), make.get(p))), ObjectiveSense.MAXIMIZE);
        first.addSolve();

        Model second = workspace.openModel("stage2");
        VariableGroup buy = second.addVariableGroup("buy", VariableType.CONTINUOUS, 0.0, 5.0, IndexSet.over(products));
        second.setObjective("spend",
            Expressions.sumOver(List.of(p), Expressions.multiply(price.get(p), buy.get(p))), ObjectiveSense.MINIMIZE);
        second.addSolve();

        GeneratedProgram program = generator.generate(workspace, GeneratorConfig.defaults());

        assertThat(program.content()).isEqualTo(golden("workspace.sas"));
        assertThat(first.isSealed()).isTrue();
        assertThat(second.isSealed()).isTrue();
    }

    @Test
    void generate_sameModelTwice_producesIdenticalText() {
        String first = generator.generate(transport(), GeneratorConfig.defaults()).content();
        String second = generator.generate(transport(), GeneratorConfig.defaults()).content();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_sealedModel_rendersAgainIdentically() {
        Model model = transport();
        String first = generator.generate(model, GeneratorConfig.defaults()).content();

        assertThat(generator.generate(model, GeneratorConfig.defaults()).content()).isEqualTo(first);
    }

    @Test
    void generate_interleavedEntitiesAndStatements_groupsDeclarationsFirst() {
        Model model = new Model("order");
        Variable a = model.addVariable("a");
        model.addConstraint("b", Relation.ge(a, 1));
        model.addVariable("c");

        assertThat(lines(model)).containsExactly("var a;", "var c;", "con b : a >= 1;");
    }

    @Test
    void generate_setDependingOnParameter_keepsCreationPosition() {
        Model model = new Model("sets");
        Parameter n = model.addParameter("N", 4);
        model.addSet("K").setValue(SetInitializer.range(Expressions.constant(1), n));
        model.addSet("J", ValueType.STR);

        assertThat(lines(model)).containsExactly("set <str> J;", "num N init 4;", "set K = 1..N;");
    }

    @Test
    void generate_memberOverride_followsAllDeclarations() {
        Model model = new Model("overrides");
        VariableGroup x = model.addVariableGroup("x", IndexSet.of(1, 2, 3));
        x.get(2).setUpperBound(5);
        model.addVariable("y");
        x.get(1).setLowerBound(-1);
        x.get(2).setUpperBound(6);

        assertThat(lines(model)).containsExactly(
            "var x {{1,2,3}};",
            "var y;",
            "x[2].ub = 6;",
            "x[1].lb = -1;");
    }

    @Test
    void generate_abstractConstraintGroup_rendersOneIndexedStatement() {
        Model model = new Model("groups");
        OptSet items = model.addSet("I").setInit(SetInitializer.of(1, 2, 3));
        VariableGroup z = model.addVariableGroup("z", VariableType.INTEGER, 0.0, 10.0, IndexSet.over(items));
        SetIterator i = items.iterator("i");
        model.addConstraintGroup("cap", List.of(i), Relation.le(z.get(i), 4));
        model.setObjective("total", Expressions.sumOver(List.of(i), z.get(i)), ObjectiveSense.MINIMIZE);

        assertThat(lines(model)).containsExactly(
            "set I init {1,2,3};",
            "var z {I} integer >= 0 <= 10;",
            "con cap {i in I} : z[i] <= 4;",
            "min total = sum {i in I} z[i];");
    }

    @Test
    void generate_concreteConstraintGroup_rendersOneStatementPerMember() {
        Model model = new Model("members");
        VariableGroup x = model.addVariableGroup("x", IndexSet.of("a", "b"));
        Map<Object, Relation> relations = new LinkedHashMap<>();
        relations.put("a", Relation.le(x.get("a"), 1));
        relations.put("b", Relation.le(x.get("b"), 2));
        model.addConstraints("limit", relations);

        assertThat(lines(model)).containsExactly(
            "var x {{'a','b'}};",
            "con limit_a : x['a'] <= 1;",
            "con limit_b : x['b'] <= 2;");
    }

    @Test
    void generate_rangeAndNonlinearExpressions_rendersCanonicalText() {
        Model model = new Model("forms");
        Variable x = model.addVariable("x");
        Variable y = model.addVariable("y", VariableType.BINARY, null, null);
        model.addRangeConstraint("r", 1, Expressions.add(x, 2), 5);
        model.addConstraint("q", Relation.eq(Expressions.add(Expressions.scale(x, 2), Expressions.scale(x, 3)), y));
        model.setObjective("o", Expressions.power(Expressions.subtract(x, y), 2), ObjectiveSense.MINIMIZE);

        assertThat(lines(model)).containsExactly(
            "var x;",
            "var y binary;",
            "con r : -1 <= x <= 3;",
            "con q : 5 * x - y = 0;",
            "min o = (x - y) ^ 2;");
    }

    @Test
    void generate_actions_renderInInsertionOrder() {
        Model model = new Model("actions");
        Variable x = model.addVariable("x");
        model.addStatement(SolveStatement.with("nlp").withOption("tol", 0.001));
        model.addStatement(PrintStatement.of(x, "x.dual"));

        assertThat(lines(model)).containsExactly(
            "var x;",
            "solve with nlp / tol=0.001;",
            "print x x.dual;");
    }

    @Test
    void generate_withoutProcWrapper_omitsProcBlock() {
        Model model = new Model("bare");
        model.addVariable("x");

        GeneratorConfig config = new GeneratorConfig("", false, 12, Map.of());

        assertThat(generator.generate(model, config).content()).isEqualTo("var x;\n");
    }

    @Test
    void generate_withCustomIndent_indentsEveryStatement() {
        Model model = new Model("indent");
        model.addVariable("x");

        GeneratorConfig config = new GeneratorConfig("\t", true, 12, Map.of());

        assertThat(generator.generate(model, config).content()).isEqualTo("proc optmodel;\n\tvar x;\nquit;\n");
    }

    @Test
    void generate_sealsContainer() {
        Model model = new Model("sealed");
        Variable x = model.addVariable("x");

        generator.generate(model, GeneratorConfig.defaults());

        assertThat(model.isSealed()).isTrue();
        assertThatThrownBy(() -> model.addVariable("y")).isInstanceOf(SealedContainerException.class);
        assertThatThrownBy(() -> x.setUpperBound(3.0)).isInstanceOf(SealedContainerException.class);
    }

    private List<String> lines(Model model) {
        GeneratorConfig config = new GeneratorConfig("", false, GeneratorConfig.DEFAULT_MAX_DIGITS, Map.of());
        return List.of(generator.generate(model, config).content().split("\n"));
    }

    private static Model transport() {
        Model model = new Model("transport");
        OptSet plants = model.addSet("PLANTS", ValueType.STR).setInit(SetInitializer.of("north", "south"));
        OptSet markets = model.addSet("MARKETS", ValueType.STR).setInit(SetInitializer.of("east", "west"));
        ParameterGroup capacity = model.addParameterGroup("capacity", IndexSet.over(plants)).setInit(100);
        VariableGroup ship = model.addVariableGroup("ship", VariableType.CONTINUOUS, 0.0, null,
            IndexSet.over(plants), IndexSet.over(markets));
        ship.get("north", "east").setUpperBound(40);

        SetIterator p = plants.iterator("p");
        SetIterator m = markets.iterator("m");
        model.addConstraintGroup("supply", List.of(p),
            Relation.le(Expressions.sumOver(List.of(m), ship.get(p, m)), capacity.get(p)));
        model.addConstraint("demand_east",
            Relation.ge(Expressions.add(ship.get("north", "east"), ship.get("south", "east")), 50));
        model.addConstraint("demand_west",
            Relation.ge(Expressions.add(ship.get("north", "west"), ship.get("south", "west")), 30));
        model.setObjective("cost", Expressions.weightedSum(
            List.of(ship.get("north", "east"), ship.get("north", "west"),
                ship.get("south", "east"), ship.get("south", "west")),
            List.of(2, 3.5, 4, 1)), ObjectiveSense.MINIMIZE);
        model.addStatement(SolveStatement.with("lp").withOption("maxiter", 1000));
        model.addStatement(PrintStatement.of(ship));
        return model;
    }

    private static String golden(String name) throws IOException {
        try (InputStream in = OptmodelGeneratorTest.class.getResourceAsStream("/golden/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
