package io.requestgate.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the core module: no dependency on the hosting server, no
 * reflection, and no mutable fields in handlers shared across requests.
 */
@AnalyzeClasses(
        packages = "io.requestgate.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noServerDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.javalin..", "org.eclipse.jetty..", "io.requestgate.standalone..")
            .because("core must stay embeddable in any HTTP server");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule modelDoesNotDependOnHandlers = noClasses()
            .that()
            .resideInAPackage("io.requestgate.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.requestgate.core.routing..",
                    "io.requestgate.core.shape..",
                    "io.requestgate.core.auth..",
                    "io.requestgate.core.render..",
                    "io.requestgate.core.spec..")
            .because("the model is shared by every layer and must not depend on any of them");

    @ArchTest
    static final ArchRule sharedHandlersHaveOnlyFinalFields = classes()
            .that()
            .implement("io.requestgate.core.spi.RequestHandler")
            .should()
            .haveOnlyFinalFields()
            .because("handlers are shared across concurrent requests; per-request state lives in the context");

    @ArchTest
    static final ArchRule filtersHaveOnlyFinalFields = classes()
            .that()
            .implement("io.requestgate.core.shape.Filter")
            .should()
            .haveOnlyFinalFields()
            .because("filters are evaluated concurrently");
}
