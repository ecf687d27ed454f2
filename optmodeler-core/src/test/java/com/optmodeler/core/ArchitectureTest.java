package com.optmodeler.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Definition models are implemented as immutable records</li>
 *   <li>The expression algebra stays independent of containers and rendering</li>
 *   <li>Generator implementations are reached only through the CodeGenerator SPI</li>
 *   <li>Outer layers (config, definition, session) are not used by the modeling core</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.optmodeler.core");
    }

    /**
     * Verifies all definition models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on containers, generators or renderers.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..container..", "..generator..", "..renderer..", "..session..");

        rule.check(classes);
    }

    /**
     * Verifies expressions are pure values that know nothing about entities or rendering.
     */
    @Test
    void expressions_shouldNotDependOnEntitiesOrGenerators() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.expression..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.entity..", "..core.container..", "..core.statement..", "..generator..");

        rule.check(classes);
    }

    /**
     * Verifies the concrete generator is only used through the CodeGenerator SPI.
     */
    @Test
    void generatorImplementations_shouldOnlyBeAccessedByGenerators() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .should().onlyBeAccessed().byAnyPackage("..generator..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes don't depend on containers or generators.
     */
    @Test
    void utilClasses_shouldNotDependOnContainers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..container..", "..generator..");

        rule.check(classes);
    }

    /**
     * Verifies the modeling core does not reach out to loaders or solver sessions.
     */
    @Test
    void modelingCore_shouldNotDependOnOuterLayers() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.entity..", "..core.statement..", "..core.container..",
                "..core.expression..", "..core.symbol..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.config..", "..core.definition..", "..core.session..", "..renderer..");

        rule.check(classes);
    }
}
