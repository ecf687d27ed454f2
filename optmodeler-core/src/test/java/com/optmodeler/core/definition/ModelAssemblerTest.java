package com.optmodeler.core.definition;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.entity.ParameterGroup;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.entity.VariableGroup;
import com.optmodeler.core.exception.DefinitionException;
import com.optmodeler.core.generator.GeneratorConfig;
import com.optmodeler.core.generator.impl.OptmodelGenerator;
import com.optmodeler.core.model.ObjectiveSense;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.statement.Objective;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ModelAssembler}.
 */
class ModelAssemblerTest {

    private ModelAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ModelAssembler();
    }

    @Test
    void assemble_transportDefinition_rendersProgram() {
        Model model = assembler.assemble(DefinitionLoader.parse("""
            name: transport
            sets:
              - name: PLANTS
                types: [str]
                values: [north, south]
              - name: MARKETS
                types: [str]
                values: [east, west]
            parameters:
              - name: capacity
                over: [PLANTS]
                init: 100
                values:
                  north: 80
            variables:
              - name: ship
                lb: 0
                over: [PLANTS, MARKETS]
            constraints:
              - name: demand_east
                terms:
                  - { variable: ship, index: [north, east] }
                  - { variable: ship, index: [south, east] }
                sense: ">="
                rhs: 50
            objective:
              name: cost
              sense: min
              terms:
                - { variable: ship, index: [north, east], coefficient: 2 }
                - { variable: ship, index: [south, west] }
            solve:
              solver: lp
              options:
                maxiter: 1000
            print: [ship]
            """));

        String program = new OptmodelGenerator().generate(model, GeneratorConfig.defaults()).content();

        assertThat(program).containsSubsequence(
            "set <str> PLANTS init {'north','south'};",
            "set <str> MARKETS init {'east','west'};",
            "num capacity {PLANTS} init 100;",
            "var ship {PLANTS, MARKETS} >= 0;",
            "capacity['north'] = 80;",
            "con demand_east : ship['north', 'east'] + ship['south', 'east'] >= 50;",
            "min cost = 2 * ship['north', 'east'] + ship['south', 'west'];",
            "solve with lp / maxiter=1000;",
            "print ship;",
            "quit;");
    }

    @Test
    void assemble_scalarComponents_createsEntities() {
        Model model = assembler.assemble(DefinitionLoader.parse("""
            name: small
            parameters:
              - name: budget
                init: 12.5
            variables:
              - name: x
                type: integer
                lb: 0
                ub: 8
            constraints:
              - name: cap
                terms: [{ variable: x, coefficient: 3 }]
                sense: le
                rhs: 9
            objective:
              sense: maximize
              terms: [{ variable: x }]
            """));

        assertThat(model.getName()).isEqualTo("small");
        Variable x = (Variable) model.getEntity("x");
        assertThat(x.getType()).isEqualTo(VariableType.INTEGER);
        assertThat(model.getEntity("budget")).isNotNull();
        assertThat(model.getStatement("cap")).isNotNull();
        Objective objective = model.getPrimaryObjective();
        assertThat(objective.getSense()).isEqualTo(ObjectiveSense.MAXIMIZE);
        assertThat(objective.getName()).isEqualTo("obj_1");
    }

    @Test
    void assemble_rangeConstraint_rendersBothBounds() {
        Model model = assembler.assemble(DefinitionLoader.parse("""
            name: ranged
            variables:
              - name: x
            constraints:
              - name: r
                terms: [{ variable: x }]
                lower: -1
                upper: 3
            """));

        String program = new OptmodelGenerator().generate(model, GeneratorConfig.defaults()).content();

        assertThat(program).contains("con r : -1 <= x <= 3;");
    }

    @Test
    void assemble_inlineAndRangeDimensions_createsConcreteGroups() {
        Model model = assembler.assemble(DefinitionLoader.parse("""
            name: inline
            variables:
              - name: pick
                type: binary
                over: [[a, b]]
              - name: level
                over: [3]
            """));

        VariableGroup pick = (VariableGroup) model.getEntity("pick");
        VariableGroup level = (VariableGroup) model.getEntity("level");
        assertThat(pick.getType()).isEqualTo(VariableType.BINARY);
        assertThat(pick.getArity()).isEqualTo(1);
        assertThat(level.getArity()).isEqualTo(1);
    }

    @Test
    void assemble_numericParameterKeys_parsesNumbers() {
        Model model = assembler.assemble(DefinitionLoader.parse("""
            name: keyed
            sets:
              - name: I
                values: [1, 2]
              - name: J
                types: [str]
                values: [a]
            parameters:
              - name: cost
                over: [J, I]
                values:
                  "a,2": 7
            """));

        ParameterGroup cost = (ParameterGroup) model.getEntity("cost");

        assertThat(cost.get("a", 2).getValue()).isEqualTo(7.0);
    }

    @Test
    void assemble_unknownVariable_throwsDefinitionException() {
        var definition = DefinitionLoader.parse("""
            name: broken
            constraints:
              - name: c
                terms: [{ variable: missing }]
                sense: "<="
                rhs: 1
            """);

        assertThatThrownBy(() -> assembler.assemble(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void assemble_unknownSet_throwsDefinitionException() {
        var definition = DefinitionLoader.parse("""
            name: broken
            variables:
              - name: x
                over: [NOWHERE]
            """);

        assertThatThrownBy(() -> assembler.assemble(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("NOWHERE");
    }

    @Test
    void assemble_unknownSense_throwsDefinitionException() {
        var definition = DefinitionLoader.parse("""
            name: broken
            variables:
              - name: x
            objective:
              sense: sideways
              terms: [{ variable: x }]
            """);

        assertThatThrownBy(() -> assembler.assemble(definition))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("sideways");
    }

    @Test
    void assemble_valuesOnScalarParameter_throwsDefinitionException() {
        var definition = DefinitionLoader.parse("""
            name: broken
            parameters:
              - name: p
                values:
                  a: 1
            """);

        assertThatThrownBy(() -> assembler.assemble(definition)).isInstanceOf(DefinitionException.class);
    }

    @Test
    void assemble_printSuffixedName_passesThroughAsText() {
        Model model = assembler.assemble(DefinitionLoader.parse("""
            name: duals
            variables:
              - name: x
                lb: 0
            constraints:
              - name: c1
                terms: [{ variable: x }]
                sense: "<="
                rhs: 10
            objective:
              sense: max
              terms: [{ variable: x }]
            solve: {}
            print: [x, c1.dual]
            """));

        String program = new OptmodelGenerator().generate(model, GeneratorConfig.defaults()).content();

        assertThat(program).containsSubsequence("solve;", "print x c1.dual;");
    }
}
