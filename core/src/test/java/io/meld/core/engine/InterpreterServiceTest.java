package io.meld.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.meld.core.directive.DirectiveService;
import io.meld.core.error.InterpreterException;
import io.meld.core.error.StateException;
import io.meld.core.model.CommandOutput;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.InterpretOptions;
import io.meld.core.model.Node;
import io.meld.core.model.SourceLocation;
import io.meld.core.model.TextNode;
import io.meld.core.parser.LineDocumentParser;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.spi.FileSystemService;
import io.meld.core.state.StateService;
import io.meld.core.validation.SchemaDirectiveValidator;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("InterpreterService")
class InterpreterServiceTest {

    private final LineDocumentParser parser = new LineDocumentParser();
    private FileSystemService fs;
    private InterpreterService interpreter;

    @BeforeEach
    void setUp() {
        fs = mock(FileSystemService.class);
        DirectiveService directives = new DirectiveService(new SchemaDirectiveValidator());
        directives.initialize(new ResolutionService(), fs, parser, new CircularityGuard(), new ObjectMapper());
        interpreter = new InterpreterService(directives, "/work");
        directives.bindInterpreter(interpreter);
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    private List<Node> parse(String content) {
        return parser.parse(content);
    }

    @Test
    @DisplayName("nodes are recorded in order; comments are not")
    void recordsNodes() {
        StateService result = interpreter.interpret(
                parse("Intro\n>> note\n@text a = \"1\"\nOutro\n"), InterpretOptions.defaults());

        assertThat(result.getNodes()).extracting(Node::type).containsExactly("Text", "Directive", "Text");
        assertThat(result.getTextVar("a")).isEqualTo("1");
    }

    @Test
    @DisplayName("later directives see earlier definitions")
    void sequentialVisibility() {
        StateService result = interpreter.interpret(
                parse("@text a = \"one\"\n@text b = \"${a} two\"\n"), InterpretOptions.defaults());

        assertThat(result.getTextVar("b")).isEqualTo("one two");
    }

    @Nested
    @DisplayName("failure")
    class Failure {

        @Test
        @DisplayName("a failing node leaves the initial state untouched")
        void rollback() {
            StateService initial = new StateService();
            initial.setTextVar("kept", "yes");
            List<Node> nodes = parse("Text\n@text a = \"1\"\n@text b = ${missing}\n");

            assertThatThrownBy(() -> interpreter.interpret(nodes, InterpretOptions.into(initial)))
                    .isInstanceOfSatisfying(InterpreterException.class, e -> {
                        assertThat(e.getMessage()).startsWith("Failed to interpret Directive node at 3:1: ");
                        assertThat(e.nodeType()).isEqualTo("Directive");
                        assertThat(e.location()).isEqualTo(SourceLocation.of(3, 1, 3, 21));
                    });
            assertThat(initial.getTextVar("a")).isNull();
            assertThat(initial.getTextVar("kept")).isEqualTo("yes");
            assertThat(initial.getNodes()).isEmpty();
        }

        @Test
        @DisplayName("unknown node types are rejected")
        void unknownNode() {
            Node weird = new Node() {
                @Override
                public String type() {
                    return "Weird";
                }

                @Override
                public SourceLocation location() {
                    return null;
                }
            };

            assertThatThrownBy(() -> interpreter.interpret(List.of(weird), InterpretOptions.defaults()))
                    .isInstanceOf(InterpreterException.class)
                    .hasMessage("Unknown node type: Weird");
        }

        @Test
        @DisplayName("the file path of the failing state is reported")
        void filePath() {
            List<Node> nodes = parser.parseWithLocations("@text b = ${missing}\n", "/work/doc.meld");

            InterpretOptions options = InterpretOptions.defaults().withFilePath("/work/doc.meld");

            assertThatThrownBy(() -> interpreter.interpret(nodes, options))
                    .isInstanceOfSatisfying(InterpreterException.class, e -> {
                        assertThat(e.filePath()).isEqualTo("/work/doc.meld");
                        assertThat(e.getMessage()).contains("/work/doc.meld:1:1");
                    });
        }
    }

    @Nested
    @DisplayName("merge options")
    class MergeOptions {

        @Test
        @DisplayName("merging returns the initial state with its id")
        void mergeIntoInitial() {
            StateService initial = new StateService();
            String id = initial.getStateId();

            StateService result = interpreter.interpret(parse("@text a = \"1\"\n"), InterpretOptions.into(initial));

            assertThat(result).isSameAs(initial);
            assertThat(result.getStateId()).isEqualTo(id);
            assertThat(initial.getTextVar("a")).isEqualTo("1");
        }

        @Test
        @DisplayName("without merging the result is a separate immutable state")
        void isolated() {
            StateService initial = new StateService();
            initial.setTextVar("outer", "x");

            StateService result = interpreter.interpret(
                    parse("@text a = \"1\"\n"), InterpretOptions.into(initial).withMergeState(false));

            assertThat(result).isNotSameAs(initial);
            assertThat(result.getTextVar("a")).isEqualTo("1");
            assertThat(result.getTextVar("outer")).isNull();
            assertThat(initial.getTextVar("a")).isNull();
            assertThat(result.isImmutable()).isTrue();
            assertThatThrownBy(() -> result.setTextVar("b", "2")).isInstanceOf(StateException.class);
        }

        @Test
        @DisplayName("file path from the options wins")
        void filePath() {
            StateService result = interpreter.interpret(
                    parse("hello\n"), InterpretOptions.defaults().withFilePath("/work/x.meld"));

            assertThat(result.getCurrentFilePath()).isEqualTo("/work/x.meld");
        }
    }

    @Nested
    @DisplayName("transformation")
    class Transformation {

        @Test
        @DisplayName("run output replaces the directive only in the transformed list")
        void replacesRunOutput() throws IOException {
            when(fs.executeCommand("echo hi", "/work")).thenReturn(new CommandOutput("hi", ""));
            StateService initial = new StateService();
            initial.enableTransformation();

            StateService result = interpreter.interpret(
                    parse("Before\n@run [echo hi]\nAfter\n"), InterpretOptions.into(initial));

            assertThat(result.getNodes().get(1)).isInstanceOf(DirectiveNode.class);
            assertThat(result.getTransformedNodes())
                    .extracting(n -> ((TextNode) n).content())
                    .containsExactly("Before\n", "hi", "After\n");
        }

        @Test
        @DisplayName("the transformation flag of the initial state carries into isolated runs")
        void flagCarries() {
            StateService initial = new StateService();
            initial.enableTransformation();

            StateService result = interpreter.interpret(
                    parse("x\n"), InterpretOptions.into(initial).withMergeState(false));

            assertThat(result.isTransformationEnabled()).isTrue();
        }
    }

    @Test
    @DisplayName("MDC keys are restored after a run")
    void mdcRestored() {
        MDC.put(InterpreterService.MDC_FILE, "/outer.meld");

        interpreter.interpret(parse("x\n"), InterpretOptions.defaults().withFilePath("/inner.meld"));

        assertThat(MDC.get(InterpreterService.MDC_FILE)).isEqualTo("/outer.meld");
        assertThat(MDC.get(InterpreterService.MDC_STATE_ID)).isNull();
    }
}
