package io.eligian.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.eligian.core.ast.Document;
import io.eligian.core.library.DocumentIndex;
import io.eligian.core.parse.SourceParser;
import io.eligian.core.registry.OperationRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ProgramValidator")
class ProgramValidatorTest {

    private static final String TIMELINE = "timeline \"main\" in \"#app\" using raf { }\n";

    private final SourceParser parser = new SourceParser();

    private List<Diagnostic> validate(String source) {
        return validate(parser.parse(source, null));
    }

    private List<Diagnostic> validate(Document document, Document... libraries) {
        List<Document> all = new ArrayList<>();
        all.add(document);
        all.addAll(List.of(libraries));
        DocumentIndex index = new DocumentIndex();
        index.index(all);
        ValidationContext context = new ValidationContext(
                document, new OperationValidator(OperationRegistry.defaultRegistry()), index.link(document));
        return new ProgramValidator(ValidationRegistry.defaults()).validate(context);
    }

    private static List<String> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::code).toList();
    }

    @Test
    @DisplayName("a well-formed program has no diagnostics")
    void cleanProgram() {
        List<Diagnostic> diagnostics = validate("""
                const GREETING = "hello"

                endable action highlight(selector: string, cls) [
                  selectElement(selector)
                  addClass(cls)
                ] [
                  selectElement(selector)
                  removeClass(cls)
                ]

                timeline "main" in "#app" using raf {
                  at 0s..2s highlight("#title", "on")
                  at 2s..4s [
                    selectElement("#body")
                    for (item in ["a", "b"]) {
                      if (@@currentItem == "a") {
                        setElementContent(item)
                      }
                    }
                    log(GREETING)
                  ]
                }
                """);

        assertThat(diagnostics).isEmpty();
    }

    @Nested
    @DisplayName("Document structure")
    class Structure {

        @Test
        @DisplayName("a program needs exactly one timeline")
        void timelineCount() {
            assertThat(codes(validate("action a() [ log(1) ]"))).containsExactly("missing_timeline");
            assertThat(codes(validate(TIMELINE + TIMELINE))).containsExactly("multiple_timelines");
        }

        @Test
        @DisplayName("duplicate declarations are reported at the second occurrence")
        void duplicates() {
            List<Diagnostic> diagnostics = validate(TIMELINE + """
                    const A = 1
                    const A = 2
                    action go() [ log(1) ]
                    action go() [ log(2) ]
                    """);

            assertThat(diagnostics)
                    .extracting(Diagnostic::code, d -> d.location().line())
                    .containsExactly(
                            org.assertj.core.groups.Tuple.tuple("duplicate_constant", 3),
                            org.assertj.core.groups.Tuple.tuple("duplicate_action", 5));
        }

        @Test
        @DisplayName("an action may not take the name of a built-in operation")
        void shadowsOperation() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action log() [ wait(1) ]");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("action_shadows_operation");
                assertThat(d.message()).isEqualTo("Action 'log' conflicts with built-in operation 'log'");
            });
        }

        @Test
        @DisplayName("parameters must be unique and use known types")
        void parameters() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a(x: string, x: strng) [ log(x) ]");

            assertThat(codes(diagnostics)).containsExactly("duplicate_parameter", "unknown_type");
        }
    }

    @Nested
    @DisplayName("Timelines")
    class Timelines {

        @ParameterizedTest(name = "{0}")
        @CsvSource(
                delimiter = '|',
                value = {
                    "timeline \"t\" in \"#a\" using film { } | invalid_provider",
                    "timeline \"t\" in \"#a\" using video { } | missing_source",
                    "timeline \"t\" in \"#a\" using raf { at 5s..2s [ log(1) ] } | invalid_time_range",
                    "timeline \"t\" in \"#a\" using raf { at 1s-2s..3s [ log(1) ] } | negative_time",
                    "timeline \"t\" in \"#a\" using raf { at 0s..1s log(1) } | operation_in_event",
                })
        @DisplayName("timeline declarations are checked")
        void timelineChecks(String source, String code) {
            assertThat(codes(validate(source))).containsExactly(code);
        }

        @Test
        @DisplayName("an inverted range shows both times")
        void invertedRangeMessage() {
            List<Diagnostic> diagnostics = validate("timeline \"t\" in \"#a\" using raf { at 5s..2500ms [ log(1) ] }");

            assertThat(diagnostics.get(0).message()).isEqualTo("Event start time (5s) must be before its end time (2.5s)");
        }

        @Test
        @DisplayName("unknown actions in events suggest close names")
        void unknownAction() {
            List<Diagnostic> diagnostics = validate("""
                    action fadeIn() [ log(1) ]
                    timeline "t" in "#a" using raf { at 0s..1s fadIn() }
                    """);

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("unknown_action");
                assertThat(d.hint()).isEqualTo("Did you mean: fadeIn?");
            });
        }

        @Test
        @DisplayName("event arguments are checked against the action's typed parameters")
        void actionArguments() {
            List<Diagnostic> diagnostics = validate("""
                    action test(name: string) [ selectElement(name) ]
                    timeline "t" in "#a" using raf { at 0s..1s test(123) }
                    """);

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("parameter_type");
                assertThat(d.message()).contains("string").contains("number");
            });
        }
    }

    @Nested
    @DisplayName("Action bodies")
    class Bodies {

        @Test
        @DisplayName("an operation whose dependency was never produced is reported")
        void missingDependency() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ addClass(\"x\") ]");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("missing_dependency");
                assertThat(d.hint()).isEqualTo("Call selectElement first to provide 'selectedElement'");
            });
        }

        @Test
        @DisplayName("unknown operations are reported with suggestions")
        void unknownOperation() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ selectElemnt(\"#x\") ]");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("unknown_operation");
                assertThat(d.hint()).contains("selectElement");
            });
        }

        @Test
        @DisplayName("references must name a parameter, constant or local")
        void unknownReference() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a(label) [ log(labl) ]");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("unknown_reference");
                assertThat(d.hint()).isEqualTo("Did you mean: label?");
            });
        }

        @Test
        @DisplayName("locals are visible after their declaration only")
        void localScope() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ log(x) const x = 1 log(x) ]");

            assertThat(diagnostics).singleElement().satisfies(d -> assertThat(d.location().column()).isEqualTo(18));
        }

        @Test
        @DisplayName("break and continue are only allowed inside loops")
        void loopControl() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ break for (i in [1]) { continue } ]");

            assertThat(codes(diagnostics)).containsExactly("loop_control_outside_loop");
        }

        @Test
        @DisplayName("explicit control-flow operations must be paired")
        void pairing() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ when(true) log(1) ]");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("control_flow");
                assertThat(d.location().column()).isEqualTo(14);
            });
        }

        @Test
        @DisplayName("suspicious control flow produces warnings")
        void warnings() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ if (\"yes\") { } ]");

            assertThat(diagnostics)
                    .extracting(Diagnostic::code)
                    .containsExactlyInAnyOrder("non_boolean_condition", "empty_block");
            assertThat(diagnostics).noneMatch(Diagnostic::isError);
        }

        @ParameterizedTest(name = "for (i in {0})")
        @DisplayName("loops over scalar literals are errors")
        @ValueSource(strings = {"5", "\"abc\"", "true", "{ a: 1 }"})
        void invalidCollection(String collection) {
            assertThat(codes(validate(TIMELINE + "action a() [ for (i in " + collection + ") { log(i) } ]")))
                    .containsExactly("invalid_collection");
        }

        @Test
        @DisplayName("a string literal is not iterable")
        void stringCollection() {
            List<Diagnostic> diagnostics = validate(TIMELINE + "action a() [ for (i in \"abc\") { log(i) } ]");

            assertThat(diagnostics).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo("invalid_collection");
                assertThat(d.message()).isEqualTo("Loop collection must be an array, got string");
            });
        }
    }

    @Nested
    @DisplayName("Imports")
    class Imports {

        private final Document library = parser.parse(
                "library lib private action secret() [ log(1) ] action fadeIn() [ log(2) ]", "/p/lib.eligian");

        @Test
        @DisplayName("imported actions can be used in events")
        void resolved() {
            Document main = parser.parse(
                    "import { fadeIn } from \"./lib.eligian\"\n"
                            + "timeline \"t\" in \"#a\" using raf { at 0s..1s fadeIn() }",
                    "/p/main.eligian");

            assertThat(validate(main, library)).isEmpty();
        }

        @Test
        @DisplayName("private and misspelled imports are reported separately")
        void unresolved() {
            Document main = parser.parse(
                    "import { secret, fadIn } from \"./lib.eligian\"\n" + TIMELINE, "/p/main.eligian");

            List<Diagnostic> diagnostics = validate(main, library);

            assertThat(codes(diagnostics)).containsExactly("private_import", "unknown_import");
            assertThat(diagnostics.get(1).hint()).isEqualTo("Did you mean: fadeIn?");
        }

        @Test
        @DisplayName("imports of documents without a URI cannot be resolved")
        void noUri() {
            assertThat(codes(validate("import { x } from \"./lib.eligian\"\n" + TIMELINE)))
                    .containsExactly("unresolved_library");
        }

        @Test
        @DisplayName("importing the same name twice is an error")
        void duplicateImport() {
            Document main = parser.parse(
                    "import { fadeIn, fadeIn } from \"./lib.eligian\"\n" + TIMELINE, "/p/main.eligian");

            assertThat(codes(validate(main, library))).containsExactly("duplicate_import");
        }
    }
}
