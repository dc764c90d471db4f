package io.eligian.core.validation;

import io.eligian.core.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the registered checks over every node of a document and returns the diagnostics in
 * document order.
 */
public final class ProgramValidator {

    private final ValidationRegistry checks;

    public ProgramValidator(ValidationRegistry checks) {
        this.checks = Objects.requireNonNull(checks, "checks must not be null");
    }

    /**
     * Validates a document.
     *
     * @param context the per-document context; the document validated is {@link
     *     ValidationContext#document()}
     * @return all diagnostics, sorted by location
     */
    public List<Diagnostic> validate(ValidationContext context) {
        visit(context.document(), context);
        List<Diagnostic> sorted = new ArrayList<>(context.diagnostics());
        sorted.sort(Diagnostic.DOCUMENT_ORDER);
        return sorted;
    }

    private void visit(Node node, ValidationContext context) {
        checks.run(node, context);
        for (Node child : node.children()) {
            visit(child, context);
        }
    }
}
