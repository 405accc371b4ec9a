package dev.pinakes.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.pinakes", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Core packages must not reach into the drivers that schedule them.
    @ArchTest
    static final ArchRule core_should_not_depend_on_drivers =
        noClasses().that().resideInAnyPackage(
                "..version..", "..module..", "..lock..", "..storage..", "..index..",
                "..latest..", "..symbol..", "..ingestion..", "..state.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..worker..", "..retention.."
            );

    // Drivers are independent of each other
    @ArchTest
    static final ArchRule drivers_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..worker..")
            .should().dependOnClassesThat().resideInAPackage("..retention..");

    // Version arithmetic stays free of persistence
    @ArchTest
    static final ArchRule version_should_be_pure =
        noClasses().that().resideInAPackage("..version..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "jakarta.persistence..", "org.springframework.."
            );

    // Config package should not depend on feature packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..ingestion..", "..state..", "..latest..", "..storage..", "..worker..",
                "..retention.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.pinakes.(*)..").should().beFreeOfCycles();
}
