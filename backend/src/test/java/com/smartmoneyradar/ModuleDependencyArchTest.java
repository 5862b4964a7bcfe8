package com.smartmoneyradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common and domain at the bottom, api on top, alert and valuation unaware of how
 * transactions arrive.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.smartmoneyradar");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..",
                        "..api..", "..alert..", "..valuation..", "..store..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..", "..api..",
                        "..alert..", "..valuation..", "..store..");
        rule.check(classes);
    }

    @Test
    void store_must_not_depend_on_engines_or_ingestion() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..store..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..api..", "..alert..",
                        "..valuation..");
        rule.check(classes);
    }

    @Test
    void valuation_must_not_depend_on_alert_ingestion_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..valuation..")
                .should().dependOnClassesThat().resideInAnyPackage("..alert..", "..ingestion..", "..api..");
        rule.check(classes);
    }

    @Test
    void alert_must_not_depend_on_ingestion_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..alert..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..api..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.smartmoneyradar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void ingestion_pipeline_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.pipeline..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }
}
