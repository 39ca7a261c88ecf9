package com.blockforge.core.pattern;

import com.blockforge.core.pattern.base.AbstractPatternGenerator;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_FIELD_INJECTION;

/**
 * ArchUnit rules for pattern generators.
 *
 * <ul>
 *   <li>Generators live in the impl package and extend the base generator</li>
 *   <li>Generators are public for ServiceLoader discovery</li>
 *   <li>The pattern API does not depend on implementations</li>
 * </ul>
 */
class PatternArchitectureTest {

    private static JavaClasses patternClasses;

    @BeforeAll
    static void setUp() {
        patternClasses = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
            .importPackages("com.blockforge.core.pattern");
    }

    @Test
    void generatorImplementations_shouldExtendAbstractPatternGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..pattern.impl..")
            .and().haveSimpleNameEndingWith("PatternGenerator")
            .should().beAssignableTo(AbstractPatternGenerator.class)
            .because("every generator declares its layouts through the strategy table");

        rule.check(patternClasses);
    }

    @Test
    void generatorImplementations_shouldResideInImplPackageAndBePublic() {
        ArchRule rule = classes()
            .that().implement(PatternGenerator.class)
            .and().areNotInterfaces()
            .and().resideOutsideOfPackage("..pattern.base..")
            .should().resideInAPackage("..pattern.impl..")
            .andShould().bePublic()
            .because("generators are registered for ServiceLoader discovery");

        rule.check(patternClasses);
    }

    @Test
    void patternApi_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("com.blockforge.core.pattern", "..pattern.base..")
            .should().dependOnClassesThat().resideInAPackage("..pattern.impl..");

        rule.check(patternClasses);
    }

    @Test
    void generators_shouldNotUseFieldInjection() {
        NO_CLASSES_SHOULD_USE_FIELD_INJECTION.check(patternClasses);
    }
}
