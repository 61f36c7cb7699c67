package io.meld.core.directive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meld.core.engine.CircularityGuard;
import io.meld.core.engine.InterpreterService;
import io.meld.core.error.CircularImportException;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.error.DirectiveException;
import io.meld.core.error.DirectiveValidationException;
import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.parser.LineDocumentParser;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.spi.DirectiveValidator;
import io.meld.core.spi.FileSystemService;
import io.meld.core.state.StateService;
import io.meld.core.validation.SchemaDirectiveValidator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DirectiveService")
class DirectiveServiceTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final LineDocumentParser parser = new LineDocumentParser();
    private final FileSystemService fs = mock(FileSystemService.class);
    private DirectiveService directives;

    @BeforeEach
    void setUp() {
        directives = new DirectiveService(new SchemaDirectiveValidator());
        directives.initialize(new ResolutionService(), fs, parser, new CircularityGuard(), JSON);
        directives.bindInterpreter(new InterpreterService(directives, "/work"));
    }

    private DirectiveNode directive(String line) {
        return (DirectiveNode) parser.parse(line).get(0);
    }

    private static DirectiveContext contextFor(StateService state) {
        return new DirectiveContext(null, state, state.createChildState(), "/work");
    }

    private static DirectiveHandler handler(String kind, DirectiveResult result) {
        return new DirectiveHandler() {
            @Override
            public String kind() {
                return kind;
            }

            @Override
            public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
                return result;
            }
        };
    }

    private static DirectiveErrorCode codeOf(Throwable e) {
        return ((DirectiveException) e).code();
    }

    @Nested
    @DisplayName("registry")
    class Registry {

        @Test
        @DisplayName("initialize registers all seven kinds")
        void builtIns() {
            assertThat(directives.supportedKinds())
                    .containsExactlyInAnyOrder("text", "data", "path", "define", "run", "import", "embed");
            assertThat(directives.getHandler("run")).isPresent();
            assertThat(directives.hasHandler("shell")).isFalse();
        }

        @Test
        @DisplayName("registering before initialize fails")
        void beforeInitialize() {
            DirectiveService fresh = new DirectiveService(DirectiveValidator.NONE);

            assertThatThrownBy(() -> fresh.registerHandler(handler("x", null)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(DirectiveErrorCode.INITIALIZATION_FAILED));
        }

        @Test
        @DisplayName("a handler without a kind is rejected")
        void blankKind() {
            assertThatThrownBy(() -> directives.registerHandler(handler(" ", null)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(DirectiveErrorCode.VALIDATION_FAILED));
        }

        @Test
        @DisplayName("custom handlers replace built-ins")
        void replace() {
            StateService marker = new StateService();
            directives.registerHandler(handler("text", new DirectiveResult.StateOnly(marker)));

            DirectiveResult result = directives.handleDirective(
                    directive("@text a = \"b\""), contextFor(new StateService()));

            assertThat(result.state()).isSameAs(marker);
        }

        @Test
        @DisplayName("using the interpreter before it is bound fails")
        void unboundInterpreter() {
            DirectiveService fresh = new DirectiveService(DirectiveValidator.NONE);

            assertThatThrownBy(fresh::interpreter)
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(DirectiveErrorCode.INITIALIZATION_FAILED));
        }
    }

    @Nested
    @DisplayName("handleDirective")
    class HandleDirective {

        @Test
        @DisplayName("schema violations fail validation before the handler runs")
        void schemaViolation() {
            ObjectNode payload = JSON.createObjectNode().put("identifier", "1bad").put("value", "x");

            assertThatThrownBy(() -> directives.handleDirective(
                            new DirectiveNode("text", payload, null), contextFor(new StateService())))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(DirectiveErrorCode.VALIDATION_FAILED))
                    .hasCauseInstanceOf(DirectiveValidationException.class);
        }

        @Test
        @DisplayName("unknown kinds fail schema validation")
        void unknownKindValidated() {
            DirectiveNode node = new DirectiveNode("shell", JSON.createObjectNode(), null);

            assertThatThrownBy(() -> directives.handleDirective(node, contextFor(new StateService())))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(DirectiveErrorCode.VALIDATION_FAILED));
        }

        @Test
        @DisplayName("unknown kinds without validation have no handler")
        void unknownKindUnvalidated() {
            DirectiveService lenient = new DirectiveService(DirectiveValidator.NONE);
            lenient.initialize(new ResolutionService(), fs, parser, new CircularityGuard(), JSON);
            DirectiveNode node = new DirectiveNode("shell", JSON.createObjectNode(), null);

            assertThatThrownBy(() -> lenient.handleDirective(node, contextFor(new StateService())))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(DirectiveErrorCode.HANDLER_NOT_FOUND));
        }

        @Test
        @DisplayName("failures keep the directive kind and node")
        void failureCarriesNode() {
            DirectiveNode node = directive("@text x = ${missing}");

            assertThatThrownBy(() -> directives.handleDirective(node, contextFor(new StateService())))
                    .isInstanceOfSatisfying(DirectiveException.class, e -> {
                        assertThat(e.kind()).isEqualTo("text");
                        assertThat(e.node()).isEqualTo(node);
                        assertThat(e.getCause()).isInstanceOf(ResolutionException.class);
                    });
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("failures are classified by type and message")
        void byMessage() {
            assertThat(DirectiveService.classify(new IllegalStateException("File not found: a.md")))
                    .isEqualTo(DirectiveErrorCode.FILE_NOT_FOUND);
            assertThat(DirectiveService.classify(new IllegalStateException("ENOENT: no such file")))
                    .isEqualTo(DirectiveErrorCode.FILE_NOT_FOUND);
            assertThat(DirectiveService.classify(new IllegalStateException("Expected 2 parameters")))
                    .isEqualTo(DirectiveErrorCode.PARAMETER_MISMATCH);
            assertThat(DirectiveService.classify(new IllegalStateException("Invalid path: /etc")))
                    .isEqualTo(DirectiveErrorCode.INVALID_PATH);
            ResolutionException undefined =
                    new ResolutionException("Undefined variable: x", ResolutionErrorCode.UNDEFINED_VARIABLE, "x");
            assertThat(DirectiveService.classify(undefined)).isEqualTo(DirectiveErrorCode.RESOLUTION_FAILED);
            assertThat(DirectiveService.classify(new IllegalStateException("boom")))
                    .isEqualTo(DirectiveErrorCode.EXECUTION_FAILED);
        }

        @Test
        @DisplayName("a circular import anywhere in the cause chain wins")
        void circularCause() {
            RuntimeException wrapped = new IllegalStateException(
                    "Failed to interpret", new CircularImportException(List.of("/a", "/b", "/a")));

            assertThat(DirectiveService.classify(wrapped)).isEqualTo(DirectiveErrorCode.CIRCULAR_IMPORT);
        }
    }

    @Nested
    @DisplayName("processing without the interpreter")
    class Processing {

        @Test
        @DisplayName("processDirective returns a new state and leaves the input untouched")
        void processDirective() {
            StateService state = new StateService();

            StateService result = directives.processDirective(directive("@text a = \"1\""), state, null);

            assertThat(result.getTextVar("a")).isEqualTo("1");
            assertThat(state.getTextVar("a")).isNull();
        }

        @Test
        @DisplayName("processDirectives threads each result into the next directive")
        void processDirectives() {
            List<DirectiveNode> nodes = List.of(directive("@text a = \"1\""), directive("@text b = \"${a}2\""));

            List<DirectiveResult> results = directives.processDirectives(nodes, new StateService(), null);

            assertThat(results).hasSize(2);
            assertThat(results.get(1).state().getTextVar("b")).isEqualTo("12");
        }
    }
}
