package dev.workflows.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflows.engine.CanvasLayoutEngine;
import dev.workflows.engine.StepPathIndexer;
import dev.workflows.engine.StepSummaries;
import dev.workflows.engine.TemplateCatalog;
import dev.workflows.engine.TokenResolver;
import dev.workflows.engine.WorkflowCodec;
import dev.workflows.engine.WorkflowFormatException;
import dev.workflows.engine.WorkflowValidator;
import dev.workflows.model.CanvasLayout;
import dev.workflows.model.CanvasPosition;
import dev.workflows.model.FlowTemplate;
import dev.workflows.model.LayoutConfig;
import dev.workflows.model.SequentialIdGenerator;
import dev.workflows.model.StepPathIndex;
import dev.workflows.model.TemplateCategory;
import dev.workflows.model.TokenOption;
import dev.workflows.model.ValidationIssue;
import dev.workflows.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI entry point for workflow-studio: inspects a workflow definition file.
 */
@Command(
    name = "workflow-studio",
    mixinStandardHelpOptions = true,
    description = "Validate, lay out and inspect branching workflow definitions."
)
public class WorkflowStudioCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStudioCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_UNREADABLE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Workflow definition JSON file")
    private Path file;

    @Option(names = "--validate", description = "Report validation issues (default when no other view is chosen)")
    private boolean validate;

    @Option(names = "--layout", description = "Print canvas node positions and edges as JSON")
    private boolean layout;

    @Option(names = "--paths", description = "Print the step path of every step as JSON")
    private boolean paths;

    @Option(names = "--outline", description = "Print an indented outline of the flow")
    private boolean outline;

    @Option(names = "--tokens-for", paramLabel = "STEP_ID",
        description = "List interpolation tokens visible from the given step")
    private String tokensFor;

    @Option(names = "--payload-field", paramLabel = "PATH",
        description = "Known trigger payload field offered as a token (repeatable)")
    private List<String> payloadFields = new ArrayList<>();

    @Option(names = "--templates", arity = "0..1", fallbackValue = "", paramLabel = "QUERY",
        description = "Search the template catalog (no file needed)")
    private String templateQuery;

    @Option(names = "--category", description = "Restrict template search: trigger, logic, integration, data, operations")
    private String category;

    @Option(names = "--lane-width", description = "Horizontal distance between canvas lanes")
    private Integer laneWidth;

    @Option(names = "--row-height", description = "Vertical distance between canvas rows")
    private Integer rowHeight;

    @Option(names = "--verbose", description = "Log engine activity at debug level")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.workflows")).setLevel(Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (templateQuery != null) {
            return listTemplates(out, err);
        }

        if (file == null) {
            err.println("Error: workflow file required. Use --templates to browse templates.");
            return EXIT_INVALID;
        }

        LayoutConfig layoutConfig;
        try {
            layoutConfig = layoutConfig();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        }

        WorkflowDefinition definition;
        try {
            definition = WorkflowCodec.loadFromFile(file, new SequentialIdGenerator("step"));
        } catch (WorkflowFormatException e) {
            err.println("Malformed workflow definition: " + e.getMessage());
            return EXIT_UNREADABLE;
        } catch (IOException e) {
            log.debug("Failed to read {}", file, e);
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        int exitCode = EXIT_OK;
        boolean anyView = layout || paths || outline || tokensFor != null;
        if (outline) {
            out.print(StepSummaries.outline(definition));
        }
        if (paths) {
            out.println(json(pathsJson(StepPathIndexer.index(definition.steps()))));
        }
        if (layout) {
            out.println(json(layoutJson(CanvasLayoutEngine.layout(definition.steps(), layoutConfig))));
        }
        if (tokensFor != null) {
            for (TokenOption token : TokenResolver.tokensForStep(definition.steps(), tokensFor, payloadFields)) {
                out.println(token.token() + "\t" + token.label());
            }
        }
        if (validate || !anyView) {
            exitCode = report(definition, out);
        }
        out.flush();
        return exitCode;
    }

    private int report(WorkflowDefinition definition, PrintWriter out) {
        List<ValidationIssue> issues = WorkflowValidator.validate(definition);
        if (issues.isEmpty()) {
            out.println("OK: no issues found");
            return EXIT_OK;
        }
        StepPathIndex index = StepPathIndexer.index(definition.steps());
        for (ValidationIssue issue : issues) {
            String where = issue.stepId() == null
                ? "workflow"
                : issue.stepId() + " @ " + index.pathOf(issue.stepId()).orElse("?");
            out.printf("%s [%s] %s%n", issue.level().wireName().toUpperCase(Locale.ROOT), where, issue.message());
        }
        return WorkflowValidator.hasErrors(issues) ? EXIT_INVALID : EXIT_OK;
    }

    private int listTemplates(PrintWriter out, PrintWriter err) {
        TemplateCategory filter = null;
        if (category != null && !"all".equals(category)) {
            try {
                filter = TemplateCategory.fromWire(category);
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_INVALID;
            }
        }
        List<FlowTemplate> templates = TemplateCatalog.search(templateQuery, filter);
        if (templates.isEmpty()) {
            out.println("No templates match.");
        }
        for (FlowTemplate template : templates) {
            out.printf("%-28s %-12s %s%n", template.id(), template.category().wireName(), template.label());
        }
        out.flush();
        return EXIT_OK;
    }

    private LayoutConfig layoutConfig() {
        LayoutConfig defaults = LayoutConfig.defaults();
        return new LayoutConfig(
            defaults.baseOffset(),
            laneWidth != null ? laneWidth : defaults.laneWidth(),
            rowHeight != null ? rowHeight : defaults.rowHeight());
    }

    private static ObjectNode pathsJson(StepPathIndex index) {
        ObjectNode node = MAPPER.createObjectNode();
        index.idToPath().forEach((id, path) -> node.put(id, path));
        return node;
    }

    private static ObjectNode layoutJson(CanvasLayout canvas) {
        ObjectNode root = MAPPER.createObjectNode();
        point(root.putObject("trigger"), canvas.trigger());
        ObjectNode positions = root.putObject("positions");
        canvas.positions().forEach((id, position) -> point(positions.putObject(id), position));
        ArrayNode edges = root.putArray("edges");
        canvas.edges().forEach(edge -> {
            ObjectNode node = edges.addObject();
            if (edge.startsAtTrigger()) {
                node.putNull("from");
            } else {
                node.put("from", edge.from());
            }
            node.put("to", edge.to());
            if (edge.label() != null) {
                node.put("label", edge.label());
            }
        });
        root.put("rows", canvas.rowCount());
        return root;
    }

    private static void point(ObjectNode node, CanvasPosition position) {
        node.put("x", position.x());
        node.put("y", position.y());
    }

    private static String json(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render output", e);
        }
    }
}
