package dev.folio.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.folio", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Retrieval code is wired by config and fed by indexing, never the other way round.
  @ArchTest
  static final ArchRule search_should_not_depend_on_wiring_or_indexing =
      noClasses()
          .that()
          .resideInAnyPackage("..search..", "..document..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..config..", "..indexing..");

  @ArchTest
  static final ArchRule exceptions_should_be_leaf_package =
      noClasses()
          .that()
          .resideInAPackage("dev.folio.exception..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "dev.folio.search..", "dev.folio.document..", "dev.folio.indexing..",
              "dev.folio.config..");

  @ArchTest
  static final ArchRule vector_should_not_depend_on_lexical =
      noClasses()
          .that()
          .resideInAPackage("..search.vector..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..search.lexical..");

  // Fusion sees adapters only through the model interfaces.
  @ArchTest
  static final ArchRule fusion_should_not_depend_on_later_stages =
      noClasses()
          .that()
          .resideInAPackage("..search.fusion..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..search.lexical..", "..search.rerank..", "..search.decompose..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.folio.(*)..").should().beFreeOfCycles();
}
