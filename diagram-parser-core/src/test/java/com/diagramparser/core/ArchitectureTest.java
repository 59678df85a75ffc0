package com.diagramparser.core;

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
 *   <li>Grammars extend the shared line grammar base class</li>
 *   <li>Syntax tree types are immutable records</li>
 *   <li>Base classes don't depend on grammar implementations</li>
 *   <li>The model has no dependencies on parsing code</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.diagramparser.core");
    }

    /**
     * Verifies all grammar implementations extend AbstractLineGrammar, which owns
     * input splitting and the empty-input check.
     */
    @Test
    void grammars_shouldExtendAbstractLineGrammar() {
        ArchRule rule = classes()
            .that().resideInAPackage("..grammar.impl..")
            .and().haveSimpleNameEndingWith("Grammar")
            .should().beAssignableTo("com.diagramparser.core.grammar.base.AbstractLineGrammar");

        rule.check(classes);
    }

    /**
     * Verifies syntax tree types are records. Enums and the {@code DiagramAst} interface are exempt.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void baseGrammar_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..grammar.base..")
            .should().dependOnClassesThat().resideInAPackage("..grammar.impl..");

        rule.check(classes);
    }

    @Test
    void grammars_shouldNotDependOnDispatcher() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..grammar..")
            .should().dependOnClassesThat().resideInAPackage("..dispatch..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay free of grammar code.
     */
    @Test
    void utilClasses_shouldNotDependOnGrammars() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAPackage("..grammar..");

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on grammars, dispatch or configuration,
     * so syntax trees can be consumed without the parser.
     */
    @Test
    void models_shouldNotDependOnParsing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..grammar..", "..dispatch..", "..config..");

        rule.check(classes);
    }
}
