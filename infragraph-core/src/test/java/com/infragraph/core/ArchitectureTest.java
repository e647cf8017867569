package com.infragraph.core;

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
 *   <li>Parsers extend the shared base class</li>
 *   <li>Parser implementations are grouped by dialect</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Generators only see the layout-ready graph, never the parsers</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.infragraph.core");
    }

    /**
     * Verifies all dialect parsers extend AbstractParser.
     * Low-level readers in util packages (HCL, Bicep) are excluded.
     */
    @Test
    void parsers_shouldExtendAbstractParser() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser.impl..")
            .and().resideOutsideOfPackage("..util..")
            .and().haveSimpleNameEndingWith("Parser")
            .should().beAssignableTo("com.infragraph.core.parser.base.AbstractParser");

        rule.check(classes);
    }

    /**
     * Verifies parser implementations live in one package per dialect.
     */
    @Test
    void parsers_shouldBeInDialectPackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser.impl..")
            .and().haveSimpleNameEndingWith("Parser")
            .should().resideInAnyPackage("..terraform..", "..cloudformation..", "..bicep..", "..pulumi..");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
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

    @Test
    void baseParsers_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser.base..")
            .should().dependOnClassesThat().resideInAPackage("..parser.impl..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay free of pipeline stages.
     */
    @Test
    void utilClasses_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.infragraph.core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..graph..", "..cluster..", "..layout..", "..pipeline..", "..generator..");

        rule.check(classes);
    }

    /**
     * Verifies model layer has no dependencies on parsers, stages or generators.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..graph..", "..cluster..", "..layout..", "..pipeline..", "..generator..");

        rule.check(classes);
    }

    /**
     * Verifies generators render the layout-ready graph only.
     */
    @Test
    void generators_shouldNotDependOnParsersOrPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..generator..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..graph..", "..pipeline..");

        rule.check(classes);
    }
}
