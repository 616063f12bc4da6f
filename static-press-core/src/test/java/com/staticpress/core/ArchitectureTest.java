package com.staticpress.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate layering and SPI conventions.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Generators implement the SiteGenerator SPI</li>
 *   <li>Feed documents are immutable records</li>
 *   <li>Lower layers don't reach up into the build pipeline</li>
 *   <li>Every exception belongs to the SiteBuildException hierarchy</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.staticpress.core");
    }

    @Test
    void generators_shouldImplementSiteGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement("com.staticpress.core.generator.SiteGenerator");

        rule.check(classes);
    }

    /**
     * Feed documents are serialized by Jackson as-is, so they carry no behaviour.
     */
    @Test
    void feedDocuments_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..feed..")
            .and().areTopLevelClasses()
            .and().haveSimpleNameNotEndingWith("Builder")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..content..", "..template..", "..aggregate..", "..feed..",
                "..generator..", "..renderer..", "..build..");

        rule.check(classes);
    }

    @Test
    void lowerLayers_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..config..", "..url..", "..content..", "..template..",
                "..aggregate..", "..feed..", "..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..generator..", "..build..");

        rule.check(classes);
    }

    @Test
    void generators_shouldNotDependOnBuild() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..generator..")
            .should().dependOnClassesThat().resideInAPackage("..build..");

        rule.check(classes);
    }

    @Test
    void exceptions_shouldExtendSiteBuildException() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo(SiteBuildException.class);

        rule.check(classes);
    }
}
