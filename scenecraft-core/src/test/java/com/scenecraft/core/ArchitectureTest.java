package com.scenecraft.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The tree knows nothing about generation or the generative service</li>
 *   <li>The engine talks to the service only through its interface</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.scenecraft.core");
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

    /**
     * Verifies the model layer stays independent of everything built on top of it.
     */
    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..tree..", "..engine..", "..service..", "..output..", "..config..");

        rule.check(classes);
    }

    @Test
    void tree_shouldNotDependOnEngineOrService() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..tree..")
            .should().dependOnClassesThat().resideInAnyPackage("..engine..", "..service..", "..output..");

        rule.check(classes);
    }

    /**
     * Verifies the engine only sees the service interface, never a concrete client.
     */
    @Test
    void engine_shouldNotDependOnServiceImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..engine..")
            .should().dependOnClassesThat().resideInAPackage("..service.impl..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes have no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..model..", "..tree..", "..engine..");

        rule.check(classes);
    }
}
