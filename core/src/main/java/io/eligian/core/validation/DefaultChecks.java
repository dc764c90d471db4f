package io.eligian.core.validation;

import io.eligian.core.ast.ActionDefinition;
import io.eligian.core.ast.Document;
import io.eligian.core.ast.Expression;
import io.eligian.core.ast.ForStatement;
import io.eligian.core.ast.IfStatement;
import io.eligian.core.ast.Library;
import io.eligian.core.ast.LibraryImport;
import io.eligian.core.ast.Literal;
import io.eligian.core.ast.Node;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.ast.Parameter;
import io.eligian.core.ast.Program;
import io.eligian.core.ast.Reference;
import io.eligian.core.ast.Timeline;
import io.eligian.core.ast.TimelineEvent;
import io.eligian.core.ast.VariableDeclaration;
import io.eligian.core.library.ResolvedAction;
import io.eligian.core.library.UnresolvedImport;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/** Built-in checks, registered by {@link ValidationRegistry#defaults()}. */
final class DefaultChecks {

    static final Set<String> TIMELINE_PROVIDERS = Set.of("video", "audio", "raf", "custom");

    private DefaultChecks() {}

    static void registerAll(ValidationRegistry.Builder builder) {
        builder.register(Program.class, DefaultChecks::checkTimelineCount)
                .register(Program.class, DefaultChecks::checkConstants)
                .register(Program.class, DefaultChecks::checkActionNames)
                .register(Library.class, DefaultChecks::checkActionNames)
                .register(LibraryImport.class, DefaultChecks::checkImport)
                .register(ActionDefinition.class, DefaultChecks::checkParameters)
                .register(ActionDefinition.class, DefaultChecks::checkActionBody)
                .register(Timeline.class, DefaultChecks::checkProvider)
                .register(TimelineEvent.class, DefaultChecks::checkEventTimes)
                .register(TimelineEvent.class, DefaultChecks::checkEventAction)
                .register(IfStatement.class, DefaultChecks::checkIf)
                .register(ForStatement.class, DefaultChecks::checkFor);
    }

    // --- Documents ---

    static void checkTimelineCount(Program program, ValidationContext ctx) {
        List<Timeline> timelines = program.timelines();
        if (timelines.isEmpty()) {
            ctx.report(Diagnostic.error(
                    "missing_timeline",
                    "A program must declare a timeline",
                    program.location(),
                    "Add: timeline \"main\" in \"#container\" using raf { ... }"));
            return;
        }
        for (Timeline extra : timelines.subList(1, timelines.size())) {
            ctx.report(Diagnostic.error(
                    "multiple_timelines",
                    "Only one timeline is allowed per program",
                    extra.location(),
                    "Merge the events of '" + extra.name() + "' into the first timeline"));
        }
    }

    static void checkConstants(Program program, ValidationContext ctx) {
        Set<String> seen = new HashSet<>();
        for (VariableDeclaration constant : program.constants()) {
            if (!seen.add(constant.name())) {
                ctx.report(Diagnostic.error(
                        "duplicate_constant",
                        "Duplicate constant '" + constant.name() + "'",
                        constant.location(),
                        "Rename or remove one of the declarations"));
            }
        }
    }

    static void checkActionNames(Document document, ValidationContext ctx) {
        Set<String> seen = new HashSet<>();
        Set<String> imported = new HashSet<>();
        for (LibraryImport libraryImport : document.libraryImports()) {
            for (String name : libraryImport.names()) {
                if (!imported.add(name)) {
                    ctx.report(Diagnostic.error(
                            "duplicate_import",
                            "Action '" + name + "' is imported more than once",
                            libraryImport.location(),
                            "Remove the duplicate import"));
                }
            }
        }
        for (ActionDefinition action : document.actions()) {
            String name = action.name();
            if (!seen.add(name)) {
                ctx.report(Diagnostic.error(
                        "duplicate_action",
                        "Duplicate action name '" + name + "'",
                        action.location(),
                        "Rename one of the actions"));
            } else if (imported.contains(name)) {
                ctx.report(Diagnostic.error(
                        "duplicate_action",
                        "Action '" + name + "' conflicts with an imported action",
                        action.location(),
                        "Rename the action or remove it from the import list"));
            }
            if (ctx.registry().contains(name)) {
                ctx.report(Diagnostic.error(
                        "action_shadows_operation",
                        "Action '" + name + "' conflicts with built-in operation '" + name + "'",
                        action.location(),
                        "Choose a different action name"));
            }
        }
    }

    static void checkImport(LibraryImport libraryImport, ValidationContext ctx) {
        for (UnresolvedImport unresolved : ctx.actions().unresolvedImports()) {
            if (!unresolved.location().equals(libraryImport.location())) {
                continue;
            }
            String name = unresolved.name();
            String path = unresolved.libraryPath();
            ctx.report(switch (unresolved.reason()) {
                case NOT_FOUND -> {
                    List<String> suggestions = EditDistance.suggestions(name, unresolved.candidates());
                    yield Diagnostic.error(
                            "unknown_import",
                            "Action '" + name + "' is not defined in library '" + path + "'",
                            libraryImport.location(),
                            !suggestions.isEmpty()
                                    ? "Did you mean: " + String.join(", ", suggestions) + "?"
                                    : unresolved.candidates().isEmpty()
                                            ? "The library has no public actions"
                                            : "Available actions: " + String.join(", ", unresolved.candidates()));
                }
                case PRIVATE -> Diagnostic.error(
                        "private_import",
                        "Cannot import private action '" + name + "' from '" + path + "'",
                        libraryImport.location(),
                        "Remove 'private' from the action in the library, or stop importing it");
                case LIBRARY_NOT_INDEXED -> Diagnostic.error(
                        "unresolved_library",
                        "Library '" + path + "' could not be resolved",
                        libraryImport.location(),
                        "Library imports are resolved relative to the importing file; compile it from disk");
            });
        }
    }

    // --- Actions ---

    static void checkParameters(ActionDefinition action, ValidationContext ctx) {
        Set<String> seen = new HashSet<>();
        for (Parameter parameter : action.parameters()) {
            if (!seen.add(parameter.name())) {
                ctx.report(Diagnostic.error(
                        "duplicate_parameter",
                        "Duplicate parameter '" + parameter.name() + "' in action '" + action.name() + "'",
                        parameter.location(),
                        "Rename one of the parameters"));
            }
            if (parameter.type() != null && !ActionCallValidator.PARAMETER_TYPES.contains(parameter.type())) {
                ctx.report(Diagnostic.error(
                        "unknown_type",
                        "Unknown type '" + parameter.type() + "' for parameter '" + parameter.name() + "'",
                        parameter.location(),
                        "Use one of: " + String.join(", ", new TreeSet<>(ActionCallValidator.PARAMETER_TYPES))));
            }
        }
    }

    static void checkActionBody(ActionDefinition action, ValidationContext ctx) {
        Set<String> names = new LinkedHashSet<>(ctx.constants());
        action.parameters().forEach(p -> names.add(p.name()));
        ActionBodyValidator bodies = new ActionBodyValidator(ctx);
        bodies.validate(action.startBody(), names);
        if (action.endable()) {
            bodies.validate(action.endBody(), names);
        }
    }

    // --- Timelines ---

    static void checkProvider(Timeline timeline, ValidationContext ctx) {
        String provider = timeline.provider();
        if (!TIMELINE_PROVIDERS.contains(provider)) {
            ctx.report(Diagnostic.error(
                    "invalid_provider",
                    "Invalid timeline provider '" + provider + "'",
                    timeline.location(),
                    "Use one of: audio, custom, raf, video"));
            return;
        }
        if ((provider.equals("video") || provider.equals("audio")) && timeline.source() == null) {
            ctx.report(Diagnostic.error(
                    "missing_source",
                    "A " + provider + " timeline requires a source",
                    timeline.location(),
                    "Add a media source: using " + provider + " from \"./media-file\""));
        }
    }

    static void checkEventTimes(TimelineEvent event, ValidationContext ctx) {
        Double start = constantSeconds(event.start());
        Double end = constantSeconds(event.end());
        if (start != null && start < 0) {
            ctx.report(Diagnostic.error(
                    "negative_time", "Start time cannot be negative", event.start().location(), null));
        }
        if (end != null && end < 0) {
            ctx.report(Diagnostic.error("negative_time", "End time cannot be negative", event.end().location(), null));
        }
        if (start != null && end != null && start >= end) {
            ctx.report(Diagnostic.error(
                    "invalid_time_range",
                    "Event start time (" + formatSeconds(start) + ") must be before its end time ("
                            + formatSeconds(end) + ")",
                    event.location(),
                    "Swap the times or extend the end time"));
        }
    }

    static void checkEventAction(TimelineEvent event, ValidationContext ctx) {
        if (event.isInline()) {
            ActionBodyValidator bodies = new ActionBodyValidator(ctx);
            bodies.validate(event.startBody(), ctx.constants());
            bodies.validate(event.endBody(), ctx.constants());
            return;
        }
        OperationCall call = event.actionCall();
        Optional<ResolvedAction> action = ctx.actions().resolve(call.operationName());
        if (action.isPresent()) {
            for (OperationValidationError error : ActionCallValidator.validate(call, action.get().definition())) {
                ctx.report(Diagnostic.of(error, call.location()));
            }
            checkEventArguments(call, ctx);
            return;
        }
        if (ctx.registry().contains(call.operationName())) {
            ctx.report(Diagnostic.error(
                    "operation_in_event",
                    "'" + call.operationName() + "' is an operation, not an action",
                    call.location(),
                    "Wrap operations in an inline block: at 0s..1s [ " + call.operationName() + "(...) ]"));
            return;
        }
        List<String> suggestions = EditDistance.suggestions(call.operationName(), ctx.actions().names());
        ctx.report(Diagnostic.error(
                "unknown_action",
                "Unknown action '" + call.operationName() + "'",
                call.location(),
                suggestions.isEmpty()
                        ? "Define the action or import it from a library"
                        : "Did you mean: " + String.join(", ", suggestions) + "?"));
    }

    private static void checkEventArguments(OperationCall call, ValidationContext ctx) {
        for (Expression arg : call.args()) {
            checkConstantReferences(arg, ctx);
        }
    }

    private static void checkConstantReferences(Node node, ValidationContext ctx) {
        if (node instanceof Reference.NameReference reference) {
            if (!ctx.constants().contains(reference.name())) {
                ctx.report(Diagnostic.error(
                        "unknown_reference",
                        "Unknown reference '" + reference.name() + "'",
                        reference.location(),
                        "Declare '" + reference.name() + "' as a constant"));
            }
            return;
        }
        for (Node child : node.children()) {
            checkConstantReferences(child, ctx);
        }
    }

    // --- Control flow ---

    static void checkIf(IfStatement statement, ValidationContext ctx) {
        ArgumentType conditionType = ArgumentType.infer(statement.condition());
        if (conditionType != ArgumentType.RUNTIME && conditionType != ArgumentType.BOOLEAN) {
            ctx.report(Diagnostic.warning(
                    "non_boolean_condition",
                    "Condition is a " + conditionType.label() + " literal, not a boolean",
                    statement.condition().location(),
                    "Use a comparison or a boolean value"));
        }
        if (statement.thenBranch().isEmpty()) {
            ctx.report(Diagnostic.warning(
                    "empty_block", "Empty 'if' block", statement.location(), "Add operations or remove the if"));
        }
    }

    static void checkFor(ForStatement statement, ValidationContext ctx) {
        ArgumentType collectionType = ArgumentType.infer(statement.collection());
        if (collectionType != ArgumentType.RUNTIME && collectionType != ArgumentType.ARRAY) {
            ctx.report(Diagnostic.error(
                    "invalid_collection",
                    "Loop collection must be an array, got " + collectionType.label(),
                    statement.collection().location(),
                    "Iterate over an array literal or a runtime array"));
        }
        if (statement.body().isEmpty()) {
            ctx.report(Diagnostic.warning(
                    "empty_block", "Empty loop body", statement.location(), "Add operations or remove the loop"));
        }
    }

    /** Value in seconds of a time expression built only from literals, otherwise {@code null}. */
    static Double constantSeconds(Expression expression) {
        if (expression instanceof Literal.NumberLiteral number) {
            return number.value();
        }
        if (expression instanceof Reference.BinaryExpression binary) {
            Double left = constantSeconds(binary.left());
            Double right = constantSeconds(binary.right());
            if (left == null || right == null) {
                return null;
            }
            return switch (binary.operator()) {
                case "+" -> left + right;
                case "-" -> left - right;
                default -> null;
            };
        }
        return null;
    }

    private static String formatSeconds(double seconds) {
        return (seconds == Math.rint(seconds) ? String.valueOf((long) seconds) : String.valueOf(seconds)) + "s";
    }
}
