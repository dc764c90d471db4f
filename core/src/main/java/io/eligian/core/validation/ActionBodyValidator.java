package io.eligian.core.validation;

import io.eligian.core.ast.BreakStatement;
import io.eligian.core.ast.ContinueStatement;
import io.eligian.core.ast.Expression;
import io.eligian.core.ast.ForStatement;
import io.eligian.core.ast.IfStatement;
import io.eligian.core.ast.Node;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.ast.Reference;
import io.eligian.core.ast.Statement;
import io.eligian.core.ast.VariableDeclaration;
import io.eligian.core.library.ResolvedAction;
import io.eligian.core.registry.DependencyInfo;
import io.eligian.core.registry.OperationSignature;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates the statements of one action body or inline event block in execution order: operation
 * calls, calls to other actions, value references, control-flow pairing, {@code break}/{@code
 * continue} placement and the availability of {@code operationData} values.
 *
 * <p>Each {@code if} branch and each loop body starts from a copy of the tracker state before the
 * block. Branch results are not merged afterwards and loop bodies are checked once.
 */
final class ActionBodyValidator {

    private final ValidationContext context;

    ActionBodyValidator(ValidationContext context) {
        this.context = context;
    }

    /**
     * Validates a body with a fresh tracker.
     *
     * @param body the statements
     * @param names parameter and constant names visible in the body
     */
    void validate(List<Statement> body, Set<String> names) {
        validateBlock(body, new LinkedHashSet<>(names), new OperationDataTracker(context.registry()), 0);
    }

    private void validateBlock(List<Statement> statements, Set<String> scope, OperationDataTracker tracker, int loops) {
        checkPairing(statements);
        Set<String> blockScope = new LinkedHashSet<>(scope);
        for (Statement statement : statements) {
            if (statement instanceof OperationCall call) {
                validateCall(call, blockScope, tracker);
            } else if (statement instanceof IfStatement ifStatement) {
                checkReferences(ifStatement.condition(), blockScope);
                validateBlock(ifStatement.thenBranch(), blockScope, tracker.copy(), loops);
                validateBlock(ifStatement.elseBranch(), blockScope, tracker.copy(), loops);
            } else if (statement instanceof ForStatement forStatement) {
                checkReferences(forStatement.collection(), blockScope);
                Set<String> loopScope = new LinkedHashSet<>(blockScope);
                loopScope.add(forStatement.itemName());
                validateBlock(forStatement.body(), loopScope, tracker.copy(), loops + 1);
            } else if (statement instanceof VariableDeclaration declaration) {
                checkReferences(declaration.value(), blockScope);
                blockScope.add(declaration.name());
            } else if (statement instanceof BreakStatement || statement instanceof ContinueStatement) {
                if (loops == 0) {
                    String keyword = statement instanceof BreakStatement ? "break" : "continue";
                    context.report(Diagnostic.error(
                            "loop_control_outside_loop",
                            "'" + keyword + "' can only be used inside a loop",
                            statement.location(),
                            "Move '" + keyword + "' into a for loop body"));
                }
            }
        }
    }

    private void validateCall(OperationCall call, Set<String> scope, OperationDataTracker tracker) {
        for (Expression arg : call.args()) {
            checkReferences(arg, scope);
        }

        String name = call.operationName();
        if (context.registry().contains(name)) {
            OperationValidationResult result = context.operations().validateCall(call);
            for (OperationValidationError error : result.errors()) {
                context.report(Diagnostic.of(error, call.location()));
            }
            reportMissing(result.signature(), tracker.processOperation(name), tracker, call);
            return;
        }

        Optional<ResolvedAction> action = context.actions().resolve(name);
        if (action.isPresent()) {
            for (OperationValidationError error : ActionCallValidator.validate(call, action.get().definition())) {
                context.report(Diagnostic.of(error, call.location()));
            }
            return;
        }

        for (OperationValidationError error : context.operations().validateOperation(name, null).errors()) {
            context.report(Diagnostic.of(error, call.location()));
        }
    }

    private void reportMissing(
            OperationSignature signature, Set<String> missing, OperationDataTracker tracker, OperationCall call) {
        for (DependencyInfo dependency : signature.dependencies()) {
            if (!missing.contains(dependency.name())) {
                continue;
            }
            OperationValidationError error = new OperationValidationError.MissingDependency(
                    signature.name(),
                    dependency.name(),
                    dependency.type(),
                    tracker.findErasurePoint(dependency.name()).orElse(null),
                    context.registry().providersOf(dependency.name()));
            context.report(Diagnostic.of(error, call.location()));
        }
    }

    private void checkPairing(List<Statement> statements) {
        List<OperationCall> calls = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof OperationCall call) {
                calls.add(call);
            }
        }
        List<String> names = new ArrayList<>();
        calls.forEach(call -> names.add(call.operationName()));
        for (OperationValidationError.ControlFlow error : ControlFlowPairingChecker.validatePairing(names)) {
            context.report(Diagnostic.of(error, calls.get(error.position()).location()));
        }
    }

    private void checkReferences(Node node, Set<String> scope) {
        if (node instanceof Reference.NameReference reference) {
            if (!scope.contains(reference.name())) {
                List<String> suggestions = EditDistance.suggestions(reference.name(), scope);
                context.report(Diagnostic.error(
                        "unknown_reference",
                        "Unknown reference '" + reference.name() + "'",
                        reference.location(),
                        suggestions.isEmpty()
                                ? "Declare '" + reference.name() + "' as a parameter or constant"
                                : "Did you mean: " + String.join(", ", suggestions) + "?"));
            }
            return;
        }
        for (Node child : node.children()) {
            checkReferences(child, scope);
        }
    }
}
