package dev.workflows.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflows.model.ConditionOperator;
import dev.workflows.model.IdGenerator;
import dev.workflows.model.JsonText;
import dev.workflows.model.Step;
import dev.workflows.model.StepKind;
import dev.workflows.model.Trigger;
import dev.workflows.model.TriggerKind;
import dev.workflows.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads and writes the transport form of a workflow definition:
 *
 * <pre>
 * { "trigger": { "type": "runtime_record_created", "entity_logical_name": "contact" },
 *   "steps": [ { "id": "s1", "type": "log_message", "message": "hi" }, ... ] }
 * </pre>
 *
 * Step {@code data} and condition {@code value} travel as embedded JSON. A step
 * without an {@code id} gets a fresh one on read. Anything structurally wrong
 * fails with {@link WorkflowFormatException}.
 */
public final class WorkflowCodec {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String DEFAULT_THEN_LABEL = "Yes";
    private static final String DEFAULT_ELSE_LABEL = "No";

    private WorkflowCodec() {}

    /**
     * Load a definition from a JSON file.
     */
    public static WorkflowDefinition loadFromFile(Path path, IdGenerator ids) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        WorkflowDefinition definition = fromTree(root, ids);
        log.info("Loaded workflow from {} ({} steps)", path, StepTree.count(definition.steps()));
        return definition;
    }

    /**
     * Load a definition from a JSON string.
     */
    public static WorkflowDefinition loadFromString(String json, IdGenerator ids) throws IOException {
        return fromTree(MAPPER.readTree(json), ids);
    }

    public static WorkflowDefinition fromTree(JsonNode root, IdGenerator ids) {
        if (root == null || !root.isObject()) {
            throw new WorkflowFormatException("$", "workflow definition must be a JSON object");
        }
        Trigger trigger = parseTrigger(requireObject(root, "trigger", "$"), "trigger");
        JsonNode stepsNode = requireArray(root, "steps", "$");
        List<Step> steps = parseSteps(stepsNode, "steps", unusedIds(stepsNode, ids));
        return new WorkflowDefinition(trigger, steps);
    }

    public static void writeToFile(WorkflowDefinition definition, Path path) throws IOException {
        Files.writeString(path, writeToString(definition));
        log.info("Wrote workflow to {} ({} steps)", path, StepTree.count(definition.steps()));
    }

    public static String writeToString(WorkflowDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(definition));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render workflow definition", e);
        }
    }

    public static ObjectNode toTree(WorkflowDefinition definition) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode trigger = root.putObject("trigger");
        trigger.put("type", definition.trigger().kind().wireName());
        if (definition.trigger().kind().requiresTarget() || !definition.trigger().target().isEmpty()) {
            trigger.put("entity_logical_name", definition.trigger().target());
        } else {
            trigger.putNull("entity_logical_name");
        }
        root.set("steps", writeSteps(definition.steps(), "steps"));
        return root;
    }

    // --- reading ---

    private static Trigger parseTrigger(JsonNode node, String at) {
        TriggerKind kind = parseEnum(requireText(node, "type", at), at + ".type", TriggerKind::fromWire);
        JsonNode target = node.get("entity_logical_name");
        if (target != null && !target.isNull() && !target.isTextual()) {
            throw new WorkflowFormatException(at + ".entity_logical_name", "must be a string");
        }
        return new Trigger(kind, target == null || target.isNull() ? "" : target.asText());
    }

    private static List<Step> parseSteps(JsonNode array, String at, IdGenerator ids) {
        var steps = new ArrayList<Step>(array.size());
        for (int i = 0; i < array.size(); i++) {
            steps.add(parseStep(array.get(i), at + "[" + i + "]", ids));
        }
        return steps;
    }

    private static Step parseStep(JsonNode node, String at, IdGenerator ids) {
        if (!node.isObject()) {
            throw new WorkflowFormatException(at, "step must be a JSON object");
        }
        StepKind kind = parseEnum(requireText(node, "type", at), at + ".type", StepKind::fromWire);
        String id = parseId(node, at, ids);

        switch (kind) {
            case LOG_MESSAGE:
                return new Step.LogStep(id, requireText(node, "message", at));
            case CREATE_RUNTIME_RECORD:
                JsonNode data = node.get("data");
                if (data == null) {
                    throw new WorkflowFormatException(at, "missing required field 'data'");
                }
                return new Step.CreateRecordStep(id, requireText(node, "entity_logical_name", at), JsonText.of(data));
            case CONDITION:
                ConditionOperator operator = parseEnum(
                    requireText(node, "operator", at), at + ".operator", ConditionOperator::fromWire);
                JsonNode value = node.get("value");
                JsonText valueText = !operator.usesValue() || value == null
                    ? JsonText.nullValue()
                    : JsonText.of(value);
                return new Step.ConditionStep(
                    id,
                    requireText(node, "field_path", at),
                    operator,
                    valueText,
                    optionalText(node, "then_label", DEFAULT_THEN_LABEL, at),
                    optionalText(node, "else_label", DEFAULT_ELSE_LABEL, at),
                    parseSteps(requireArray(node, "then_steps", at), at + ".then_steps", ids),
                    parseSteps(requireArray(node, "else_steps", at), at + ".else_steps", ids));
            default:
                throw new WorkflowFormatException(at, "unsupported step type " + kind);
        }
    }

    /**
     * Wraps {@code ids} so generated ids never repeat an id already written in
     * the document.
     */
    private static IdGenerator unusedIds(JsonNode stepsNode, IdGenerator ids) {
        Set<String> taken = new HashSet<>();
        collectIds(stepsNode, taken);
        return () -> {
            String id = ids.nextId();
            while (!taken.add(id)) {
                log.debug("Generated id {} is already used in the document; drawing another", id);
                id = ids.nextId();
            }
            return id;
        };
    }

    private static void collectIds(JsonNode steps, Set<String> taken) {
        for (JsonNode step : steps) {
            JsonNode id = step.get("id");
            if (id != null && id.isTextual()) {
                taken.add(id.asText());
            }
            for (String branch : List.of("then_steps", "else_steps")) {
                JsonNode nested = step.get(branch);
                if (nested != null && nested.isArray()) {
                    collectIds(nested, taken);
                }
            }
        }
    }

    private static String parseId(JsonNode node, String at, IdGenerator ids) {
        JsonNode id = node.get("id");
        if (id == null || id.isNull()) {
            return ids.nextId();
        }
        if (!id.isTextual() || id.asText().isEmpty()) {
            throw new WorkflowFormatException(at + ".id", "step id must be a non-empty string");
        }
        return id.asText();
    }

    private static <T> T parseEnum(String wireName, String at, Function<String, T> parser) {
        try {
            return parser.apply(wireName);
        } catch (IllegalArgumentException e) {
            throw new WorkflowFormatException(at, e.getMessage(), e);
        }
    }

    private static JsonNode requireObject(JsonNode node, String field, String at) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new WorkflowFormatException(at, "missing required object '" + field + "'");
        }
        return value;
    }

    private static JsonNode requireArray(JsonNode node, String field, String at) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new WorkflowFormatException(at, "missing required array '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, String at) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new WorkflowFormatException(at, "missing required string '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field, String fallback, String at) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isTextual()) {
            throw new WorkflowFormatException(at + "." + field, "must be a string");
        }
        return value.asText();
    }

    // --- writing ---

    private static ArrayNode writeSteps(List<Step> steps, String at) {
        ArrayNode array = MAPPER.createArrayNode();
        for (int i = 0; i < steps.size(); i++) {
            array.add(writeStep(steps.get(i), at + "[" + i + "]"));
        }
        return array;
    }

    private static ObjectNode writeStep(Step step, String at) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", step.id());
        node.put("type", step.kind().wireName());
        step.accept(new Step.Visitor<Void>() {
            @Override
            public Void visitLog(Step.LogStep logStep) {
                node.put("message", logStep.message());
                return null;
            }

            @Override
            public Void visitCreateRecord(Step.CreateRecordStep create) {
                node.put("entity_logical_name", create.entityLogicalName());
                node.set("data", embedded(create.data(), at + ".data"));
                return null;
            }

            @Override
            public Void visitCondition(Step.ConditionStep condition) {
                node.put("field_path", condition.fieldPath());
                node.put("operator", condition.operator().wireName());
                node.set("value", condition.operator().usesValue()
                    ? embedded(condition.value(), at + ".value")
                    : NullNode.getInstance());
                node.put("then_label", condition.thenLabel());
                node.put("else_label", condition.elseLabel());
                node.set("then_steps", writeSteps(condition.thenSteps(), at + ".then_steps"));
                node.set("else_steps", writeSteps(condition.elseSteps(), at + ".else_steps"));
                return null;
            }
        });
        return node;
    }

    private static JsonNode embedded(JsonText text, String at) {
        return text.node().orElseThrow(() -> new WorkflowFormatException(
            at, "not valid JSON: " + text.parseError().orElse("unparseable")));
    }
}
