package io.eligian.core.validation;

import io.eligian.core.ast.Document;
import io.eligian.core.ast.Program;
import io.eligian.core.ast.VariableDeclaration;
import io.eligian.core.library.ActionScope;
import io.eligian.core.registry.OperationRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-document state shared by all checks: the operation validator, the actions visible from the
 * document, program constants and the collected diagnostics.
 *
 * <p>Not thread-safe. Created for one document of one compilation.
 */
public final class ValidationContext {

    private final Document document;
    private final OperationValidator operations;
    private final ActionScope actions;
    private final Set<String> constants;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ValidationContext(Document document, OperationValidator operations, ActionScope actions) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.operations = Objects.requireNonNull(operations, "operations must not be null");
        this.actions = Objects.requireNonNull(actions, "actions must not be null");
        this.constants = new LinkedHashSet<>();
        if (document instanceof Program program) {
            for (VariableDeclaration constant : program.constants()) {
                constants.add(constant.name());
            }
        }
    }

    public Document document() {
        return document;
    }

    public OperationValidator operations() {
        return operations;
    }

    public OperationRegistry registry() {
        return operations.registry();
    }

    public ActionScope actions() {
        return actions;
    }

    /** Names of program-level constants. */
    public Set<String> constants() {
        return constants;
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /** Diagnostics reported so far, in report order. */
    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
