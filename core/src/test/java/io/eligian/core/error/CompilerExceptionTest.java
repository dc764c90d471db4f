package io.eligian.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.eligian.core.ast.SourceLocation;
import java.util.List;
import org.junit.jupiter.api.Test;

/** The closed set of compiler errors, their common fields and their rendering. */
class CompilerExceptionTest {

    private static final SourceLocation AT = new SourceLocation("main.eligian", 3, 7, 4);

    @Test
    void rootIsAbstractRuntimeException() {
        assertThat(CompilerException.class).isAbstract();
        assertThat(CompilerException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void everyKindHasExactlyOneException() {
        List<CompilerException> all = List.of(
                new ParseException("p", AT),
                new ValidationException("v", AT),
                new TypeCheckException("t", AT),
                new TransformException("x", AT),
                new OptimizationException("o", AT),
                new EmitException("e", AT));

        assertThat(all)
                .extracting(CompilerException::kind)
                .containsExactly(CompilerException.Kind.values());
    }

    @Test
    void commonFieldsAreExposed() {
        var cause = new IllegalStateException("root cause");
        var ex = new ValidationException("Unknown action 'fadIn'", AT, "Did you mean: fadeIn?", cause);

        assertThat(ex.detail()).isEqualTo("Unknown action 'fadIn'");
        assertThat(ex.location()).isEqualTo(AT);
        assertThat(ex.hint()).isEqualTo("Did you mean: fadeIn?");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void formatIncludesLocationAndHint() {
        var ex = new ParseException("Expected ')' but found '['", AT, "Close the parameter list");

        assertThat(ex.format())
                .isEqualTo("Parse error: Expected ')' but found '[' at main.eligian:3:7 (hint: Close the parameter list)");
    }

    @Test
    void formatWithoutLocationOrHint() {
        var ex = new EmitException("Failed to serialize configuration", null);

        assertThat(ex.format()).isEqualTo("Emit error: Failed to serialize configuration");
        assertThat(ex.location()).isNull();
        assertThat(ex.hint()).isNull();
    }

    @Test
    void inMemoryLocationsRenderWithPlaceholder() {
        var ex = new TypeCheckException("Timeline selector must not be blank", SourceLocation.start(null));

        assertThat(ex.format()).isEqualTo("Type error: Timeline selector must not be blank at <source>:1:1");
    }
}
