package com.stg2va.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the compiler.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The pipeline stages only depend on earlier stages</li>
 *   <li>Generators and renderers are reached through their interfaces</li>
 *   <li>Every compile error shares one base class</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.stg2va.core");
    }

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
     * Verifies the net model knows nothing about the stages that consume it.
     */
    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..analysis..", "..logic..", "..generator..", "..renderer..",
                "..compiler..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies analysis and table derivation stay independent of text output.
     */
    @Test
    void analysisAndLogic_shouldNotDependOnOutput() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..parser..", "..analysis..", "..logic..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..generator..", "..renderer..", "..compiler..", "..config..");

        rule.check(classes);
    }

    @Test
    void generators_shouldImplementModelGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().areTopLevelClasses()
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement("com.stg2va.core.generator.ModelGenerator");

        rule.check(classes);
    }

    @Test
    void renderers_shouldNotDependOnGeneratorImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAPackage("..generator.impl..");

        rule.check(classes);
    }

    /**
     * Verifies every error reported by the pipeline can be caught through one type.
     */
    @Test
    void errors_shouldExtendStgCompilationException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..error..")
            .and().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo("com.stg2va.core.error.StgCompilationException");

        rule.check(classes);
    }
}
