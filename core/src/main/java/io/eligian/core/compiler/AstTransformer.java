package io.eligian.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eligian.core.ast.ActionDefinition;
import io.eligian.core.ast.AssetImport;
import io.eligian.core.ast.BreakStatement;
import io.eligian.core.ast.ContinueStatement;
import io.eligian.core.ast.Expression;
import io.eligian.core.ast.ForStatement;
import io.eligian.core.ast.IfStatement;
import io.eligian.core.ast.OperationCall;
import io.eligian.core.ast.Parameter;
import io.eligian.core.ast.Program;
import io.eligian.core.ast.SourceLocation;
import io.eligian.core.ast.Statement;
import io.eligian.core.ast.Timeline;
import io.eligian.core.ast.TimelineEvent;
import io.eligian.core.ast.VariableDeclaration;
import io.eligian.core.error.TransformException;
import io.eligian.core.ir.ActionIR;
import io.eligian.core.ir.ConfigurationIR;
import io.eligian.core.ir.EligiusIR;
import io.eligian.core.ir.LanguageIR;
import io.eligian.core.ir.OperationIR;
import io.eligian.core.ir.SourceMap;
import io.eligian.core.ir.TimelineActionIR;
import io.eligian.core.ir.TimelineIR;
import io.eligian.core.library.ActionScope;
import io.eligian.core.library.ResolvedAction;
import io.eligian.core.registry.OperationParameter;
import io.eligian.core.registry.OperationRegistry;
import io.eligian.core.registry.OperationSignature;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a validated program into the runtime configuration IR.
 *
 * <p>Operation calls become {@link OperationIR}s whose {@code operationData} is keyed by the
 * registry's parameter names. Calls to custom actions become a {@code requestAction} and {@code
 * startAction} pair, {@code if} and {@code for} become the runtime's {@code when} and {@code
 * forEach} blocks. Every action reachable from the program, directly or through library imports,
 * is emitted exactly once.
 */
final class AstTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(AstTransformer.class);

    static final String DSL_VERSION = "1.0.0";
    static final String COMPILER_VERSION = "0.1.0";
    static final String ENGINE_SYSTEM_NAME = "Eligius";
    static final String DEFAULT_LANGUAGE = "en-US";
    static final String DEFAULT_LAYOUT = "default";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final OperationRegistry registry;

    AstTransformer(OperationRegistry registry) {
        this.registry = registry;
    }

    EligiusIR transform(CompilationContext ctx) {
        Program program = ctx.program();
        if (program == null) {
            throw new TransformException("Nothing to transform: no program was parsed", null);
        }
        return new Lowering(ctx).run(program);
    }

    /** Runtime timeline type for a provider keyword. */
    static String timelineType(String provider, SourceLocation location) {
        return switch (provider) {
            case "raf" -> "animation";
            case "video", "audio" -> "mediaplayer";
            case "custom" -> "custom";
            default -> throw new TransformException(
                    "Unknown timeline provider '" + provider + "'", location, "Use one of: video, audio, raf, custom");
        };
    }

    /** State of a single lowering run. */
    private final class Lowering {

        private final CompilationContext ctx;
        private final Map<String, SourceLocation> locations = new LinkedHashMap<>();
        private final Map<String, ActionIR> emitted = new LinkedHashMap<>();
        private final Map<String, ResolvedAction> claimed = new HashMap<>();
        private final Deque<ResolvedAction> pending = new ArrayDeque<>();
        private ExpressionLowering expressions;

        Lowering(CompilationContext ctx) {
            this.ctx = ctx;
        }

        EligiusIR run(Program program) {
            expressions = new ExpressionLowering(constants(program));
            ActionScope programScope = ctx.scopeOf(program.uri());

            for (ActionDefinition action : program.actions()) {
                enqueue(new ResolvedAction(action, program.uri()));
            }
            List<TimelineIR> timelines = new ArrayList<>();
            for (Timeline timeline : program.timelines()) {
                timelines.add(timeline(timeline, programScope));
            }
            for (ResolvedAction imported : programScope.all()) {
                if (!sameDocument(imported.documentUri(), program.uri())) {
                    enqueue(imported);
                }
            }
            while (!pending.isEmpty()) {
                ResolvedAction next = pending.poll();
                emitted.put(next.definition().name(), action(next));
            }

            String configId = ctx.ids().next();
            locations.put(configId, program.location());
            ConfigurationIR config = new ConfigurationIR(
                    configId,
                    ENGINE_SYSTEM_NAME,
                    timelines.isEmpty() ? "body" : timelines.get(0).selector(),
                    DEFAULT_LANGUAGE,
                    ctx.layoutTemplate() == null ? DEFAULT_LAYOUT : ctx.layoutTemplate(),
                    List.of(new LanguageIR("en", "English")),
                    cssFiles(program),
                    List.copyOf(emitted.values()),
                    timelines);
            LOG.debug(
                    "Program transformed: source={}, actions={}, timelines={}",
                    ctx.sourceUri(),
                    emitted.size(),
                    timelines.size());
            return new EligiusIR(
                    config,
                    new SourceMap(program.location(), locations),
                    new EligiusIR.Metadata(DSL_VERSION, COMPILER_VERSION, ctx.sourceUri()));
        }

        private Map<String, JsonNode> constants(Program program) {
            Map<String, JsonNode> values = new LinkedHashMap<>();
            ExpressionLowering partial = new ExpressionLowering(values);
            for (VariableDeclaration constant : program.constants()) {
                values.put(constant.name(), partial.toValue(constant.value(), ExpressionLowering.Names.empty()));
            }
            return values;
        }

        private List<String> cssFiles(Program program) {
            List<String> css = new ArrayList<>(ctx.cssFiles());
            if (css.isEmpty()) {
                for (AssetImport asset : program.assetImports()) {
                    if (asset.form() == AssetImport.Form.STYLES) {
                        css.add(asset.path());
                    }
                }
            }
            return css;
        }

        private void enqueue(ResolvedAction action) {
            String name = action.definition().name();
            ResolvedAction previous = claimed.putIfAbsent(name, action);
            if (previous == null) {
                pending.add(action);
            } else if (!previous.definition().equals(action.definition())
                    || !sameDocument(previous.documentUri(), action.documentUri())) {
                throw new TransformException(
                        "Action '" + name + "' is defined in more than one document",
                        action.definition().location(),
                        "Rename one of the actions so every emitted action name is unique");
            }
        }

        private ActionIR action(ResolvedAction resolved) {
            ActionDefinition definition = resolved.definition();
            ActionScope scope = ctx.scopeOf(resolved.documentUri());
            Set<String> parameters = new LinkedHashSet<>();
            for (Parameter parameter : definition.parameters()) {
                parameters.add(parameter.name());
            }
            ExpressionLowering.Names names =
                    new ExpressionLowering.Names(Set.copyOf(parameters), Set.of(), Set.of());
            String id = ctx.ids().next();
            locations.put(id, definition.location());
            return new ActionIR(
                    id,
                    definition.name(),
                    statements(definition.startBody(), names, scope),
                    statements(definition.endBody(), names, scope));
        }

        private TimelineIR timeline(Timeline timeline, ActionScope scope) {
            List<TimelineActionIR> actions = new ArrayList<>();
            for (TimelineEvent event : timeline.events()) {
                actions.add(event(event, scope));
            }
            String id = ctx.ids().next();
            locations.put(id, timeline.location());
            TimelineIR lowered = new TimelineIR(
                    id,
                    timeline.source(),
                    timelineType(timeline.provider(), timeline.location()),
                    0,
                    false,
                    timeline.containerSelector(),
                    List.of());
            return lowered.withActions(actions);
        }

        private TimelineActionIR event(TimelineEvent event, ActionScope scope) {
            double start = seconds(event.start());
            double end = seconds(event.end());
            ExpressionLowering.Names names = ExpressionLowering.Names.empty();
            List<OperationIR> startOps;
            List<OperationIR> endOps;
            String name;
            if (event.isInline()) {
                name = "timeline-action-" + formatSeconds(start) + "-" + formatSeconds(end);
                startOps = statements(event.startBody(), names, scope);
                endOps = statements(event.endBody(), names, scope);
            } else {
                OperationCall call = event.actionCall();
                ResolvedAction target = resolveAction(call, scope);
                name = call.operationName();
                startOps = new ArrayList<>();
                invokeAction(call, target, names, startOps, "startAction");
                endOps = new ArrayList<>();
                if (target.definition().endable()) {
                    invokeAction(call, target, names, endOps, "endAction");
                }
            }
            String id = ctx.ids().next();
            locations.put(id, event.location());
            return new TimelineActionIR(id, name, start, end, startOps, endOps);
        }

        private double seconds(Expression time) {
            Optional<JsonNode> value = expressions.fold(time);
            if (value.isEmpty() || !value.get().isNumber()) {
                throw new TransformException("Timeline event times must be constant numbers", time.location());
            }
            return value.get().doubleValue();
        }

        private List<OperationIR> statements(
                List<Statement> body, ExpressionLowering.Names names, ActionScope scope) {
            List<OperationIR> out = new ArrayList<>();
            ExpressionLowering.Names current = names;
            for (Statement statement : body) {
                current = statement(statement, current, scope, out);
            }
            return out;
        }

        /** Appends the operations for one statement and returns the names visible after it. */
        private ExpressionLowering.Names statement(
                Statement statement, ExpressionLowering.Names names, ActionScope scope, List<OperationIR> out) {
            if (statement instanceof OperationCall operationCall) {
                call(operationCall, names, scope, out);
                return names;
            }
            if (statement instanceof IfStatement branch) {
                ObjectNode data = NODES.objectNode();
                data.set("expression", expressions.toValue(branch.condition(), names));
                out.add(operation("when", data, statement.location()));
                out.addAll(statements(branch.thenBranch(), names, scope));
                if (!branch.elseBranch().isEmpty()) {
                    out.add(operation("otherwise", NODES.objectNode(), statement.location()));
                    out.addAll(statements(branch.elseBranch(), names, scope));
                }
                out.add(operation("endWhen", NODES.objectNode(), statement.location()));
                return names;
            }
            if (statement instanceof ForStatement loop) {
                ObjectNode data = NODES.objectNode();
                data.set("collection", expressions.toValue(loop.collection(), names));
                out.add(operation("forEach", data, statement.location()));
                out.addAll(statements(loop.body(), names.withLoopItem(loop.itemName()), scope));
                out.add(operation("endForEach", NODES.objectNode(), statement.location()));
                return names;
            }
            if (statement instanceof VariableDeclaration local) {
                ObjectNode data = NODES.objectNode();
                data.put("name", local.name());
                data.set("value", expressions.toValue(local.value(), names));
                out.add(operation("setVariable", data, statement.location()));
                return names.withLocal(local.name());
            }
            if (statement instanceof BreakStatement) {
                out.add(operation("breakForEach", NODES.objectNode(), statement.location()));
                return names;
            }
            if (statement instanceof ContinueStatement) {
                out.add(operation("continueForEach", NODES.objectNode(), statement.location()));
                return names;
            }
            throw new TransformException(
                    "Unsupported statement: " + statement.getClass().getSimpleName(), statement.location());
        }

        private void call(
                OperationCall call, ExpressionLowering.Names names, ActionScope scope, List<OperationIR> out) {
            Optional<ResolvedAction> custom = scope.resolve(call.operationName());
            if (custom.isPresent()) {
                enqueue(custom.get());
                invokeAction(call, custom.get(), names, out, "startAction");
                return;
            }
            OperationSignature signature = registry.find(call.operationName())
                    .orElseThrow(() -> new TransformException(
                            "Unknown operation or action: " + call.operationName(), call.location()));
            out.add(operation(signature.name(), operationData(signature, call, names), call.location()));
        }

        private ObjectNode operationData(
                OperationSignature signature, OperationCall call, ExpressionLowering.Names names) {
            ObjectNode data = NODES.objectNode();
            List<OperationParameter> parameters = signature.parameters();
            List<Expression> args = call.args();
            if (args.size() > parameters.size()) {
                throw new TransformException(
                        "Operation '" + signature.name() + "' takes at most " + parameters.size()
                                + " argument(s), got " + args.size(),
                        call.location());
            }
            for (int i = 0; i < parameters.size(); i++) {
                OperationParameter parameter = parameters.get(i);
                if (i < args.size()) {
                    data.set(parameter.name(), expressions.toValue(args.get(i), names));
                } else if (parameter.defaultValue() != null) {
                    data.set(parameter.name(), parameter.defaultValue().deepCopy());
                }
            }
            return data;
        }

        private ResolvedAction resolveAction(OperationCall call, ActionScope scope) {
            Optional<ResolvedAction> resolved = scope.resolve(call.operationName());
            if (resolved.isEmpty()) {
                throw new TransformException(
                        "Unknown action: " + call.operationName(),
                        call.location(),
                        "Define the action or import it from a library");
            }
            enqueue(resolved.get());
            return resolved.get();
        }

        /** {@code requestAction} followed by {@code startAction} or {@code endAction}. */
        private void invokeAction(
                OperationCall call,
                ResolvedAction target,
                ExpressionLowering.Names names,
                List<OperationIR> out,
                String lifecycleOperation) {
            ActionDefinition definition = target.definition();
            List<Parameter> parameters = definition.parameters();
            if (call.args().size() != parameters.size()) {
                throw new TransformException(
                        "Action '" + definition.name() + "' expects " + parameters.size()
                                + " argument(s), got " + call.args().size(),
                        call.location());
            }
            ObjectNode request = NODES.objectNode();
            request.put("systemName", definition.name());
            out.add(operation("requestAction", request, call.location()));

            ObjectNode data = NODES.objectNode();
            if (!parameters.isEmpty()) {
                ObjectNode actionData = NODES.objectNode();
                for (int i = 0; i < parameters.size(); i++) {
                    actionData.set(parameters.get(i).name(), expressions.toValue(call.args().get(i), names));
                }
                data.set("actionOperationData", actionData);
            }
            out.add(operation(lifecycleOperation, data, call.location()));
        }

        private OperationIR operation(String systemName, ObjectNode data, SourceLocation location) {
            String id = ctx.ids().next();
            locations.put(id, location);
            return new OperationIR(id, systemName, data);
        }
    }

    private static boolean sameDocument(String left, String right) {
        return left == null ? right == null : left.equals(right);
    }

    static String formatSeconds(double seconds) {
        return seconds == Math.rint(seconds) ? Long.toString((long) seconds) : Double.toString(seconds);
    }
}
