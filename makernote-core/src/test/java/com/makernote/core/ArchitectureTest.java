package com.makernote.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.domain.JavaModifier;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Vendor resolvers extend the shared base class</li>
 *   <li>Vendor catalogs are constant holders</li>
 *   <li>Report models are immutable records</li>
 *   <li>Lower layers don't depend on vendor packages</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.makernote.core");
    }

    /**
     * Verifies every vendor resolver extends AbstractTagDescriptor, so unknown tags and
     * absent values fall back the same way everywhere.
     */
    @Test
    void descriptors_shouldExtendAbstractTagDescriptor() {
        ArchRule rule = classes()
            .that().resideInAPackage("..descriptor.impl..")
            .and().haveSimpleNameEndingWith("Descriptor")
            .should().beAssignableTo("com.makernote.core.descriptor.base.AbstractTagDescriptor")
            .andShould().haveModifier(JavaModifier.FINAL);

        rule.check(classes);
    }

    @Test
    void tagCatalogs_shouldBePublicFinal() {
        ArchRule rule = classes()
            .that().resideInAPackage("..descriptor.impl..")
            .and().haveSimpleNameEndingWith("Tags")
            .should().haveModifier(JavaModifier.FINAL)
            .andShould().bePublic();

        rule.check(classes);
    }

    /**
     * Verifies vendor packages don't reach into each other.
     */
    @Test
    void vendorPackages_shouldBeIndependent() {
        String[] vendors = {"apple", "casio", "dji", "kodak", "leica", "nikon", "olympus",
            "pentax", "reconyx", "ricoh", "samsung", "sanyo", "sigma", "sony"};
        for (String vendor : vendors) {
            String[] others = Arrays.stream(vendors)
                .filter(other -> !other.equals(vendor))
                .map(other -> "..descriptor.impl." + other + "..")
                .toArray(String[]::new);
            noClasses()
                .that().resideInAPackage("..descriptor.impl." + vendor + "..")
                .should().dependOnClassesThat().resideInAnyPackage(others)
                .check(classes);
        }
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
     * Verifies the base package doesn't depend on vendor implementations.
     */
    @Test
    void baseDescriptors_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..descriptor.base..")
            .should().dependOnClassesThat().resideInAPackage("..descriptor.impl..");

        rule.check(classes);
    }

    /**
     * Verifies value access and numeric types stay free of descriptor and report code.
     */
    @Test
    void valueLayer_shouldNotDependOnDescriptorsOrReports() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.tag..", "..core.lang..", "..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage("..descriptor..", "..report..", "..config..");

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCommandLine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.makernote.core..")
            .should().dependOnClassesThat().resideInAPackage("picocli..");

        rule.check(classes);
    }
}
