package com.codegraph.core;

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
 *   <li>Extractors extend the shared base class and live in language packages</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Lower layers (util, model, extractor, store) do not reach up into the pipeline</li>
 *   <li>The engine does not depend on report generation or rendering</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codegraph.core");
    }

    /**
     * Verifies all extractor implementations extend AbstractExtractor, so every extractor
     * reports the module entity first and turns failures into parse errors.
     */
    @Test
    void extractors_shouldExtendAbstractExtractor() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor.impl..")
            .and().haveSimpleNameEndingWith("Extractor")
            .should().beAssignableTo("com.codegraph.core.extractor.base.AbstractExtractor");

        rule.check(classes);
    }

    @Test
    void extractors_shouldBeInLanguagePackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor.impl..")
            .should().resideInAnyPackage("..impl.java..", "..impl.python..", "..impl.javascript..",
                "..impl.swift..", "..impl.vue..");

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
    void baseExtractors_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor.base..")
            .should().dependOnClassesThat().resideInAPackage("..extractor.impl..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes have no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..model..", "..extractor..", "..normalize..",
                "..store..", "..query..", "..quality..", "..engine..", "..report..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..extractor..", "..normalize..", "..store..",
                "..query..", "..quality..", "..engine..", "..report..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies extractors only produce raw facts and never touch storage or later stages.
     */
    @Test
    void extractors_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor..")
            .should().dependOnClassesThat().resideInAnyPackage("..normalize..", "..store..", "..query..",
                "..quality..", "..engine..", "..report..");

        rule.check(classes);
    }

    @Test
    void store_shouldNotDependOnConsumers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..store..")
            .should().dependOnClassesThat().resideInAnyPackage("..query..", "..quality..", "..engine..",
                "..report..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void engine_shouldNotDependOnPresentation() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..engine..")
            .should().dependOnClassesThat().resideInAnyPackage("..report..", "..renderer..");

        rule.check(classes);
    }
}
