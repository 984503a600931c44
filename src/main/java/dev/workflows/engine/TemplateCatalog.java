package dev.workflows.engine;

import dev.workflows.model.ConditionOperator;
import dev.workflows.model.FlowTemplate;
import dev.workflows.model.IdGenerator;
import dev.workflows.model.JsonText;
import dev.workflows.model.Step;
import dev.workflows.model.TemplateCategory;
import dev.workflows.model.TemplateTarget;
import dev.workflows.model.Trigger;
import dev.workflows.model.TriggerKind;
import dev.workflows.model.TriggerTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The built-in trigger and step templates, with free-text search.
 */
public final class TemplateCatalog {

    public static final String DEFAULT_STEP_TEMPLATE = "condition_equals";

    private static final int EXACT_SCORE = 120;
    private static final int PREFIX_SCORE = 90;
    private static final int SUBSTRING_SCORE = 45;
    private static final int CHARACTERS_SCORE = 15;
    private static final int ALL_TOKENS_BONUS = 60;

    private static final List<FlowTemplate> TEMPLATES = List.of(
        trigger("manual_trigger", "Manual Trigger",
            "Starts this flow from manual run in the canvas toolbar.",
            "trigger", "manual", "start"),
        trigger("record_created_trigger", "Record Created Trigger",
            "Starts when a runtime record is created in the selected entity.",
            "trigger", "record", "created", "event", "start"),
        trigger("webhook_trigger", "Webhook Event Trigger",
            "Starts when a webhook_event runtime record is created.",
            "trigger", "webhook", "event", "start"),
        trigger("inbound_email_trigger", "Inbound Email Trigger",
            "Starts when an inbound_email runtime record is captured.",
            "trigger", "email", "inbound", "mailbox", "start"),
        trigger("form_submission_trigger", "Form Submission Trigger",
            "Starts when a form_submission runtime record is created.",
            "trigger", "form", "submission", "event", "start"),
        trigger("schedule_hourly_trigger", "Hourly Schedule Trigger",
            "Starts when a schedule_hourly runtime tick record is created.",
            "trigger", "schedule", "hourly", "timer", "cron"),
        trigger("schedule_daily_trigger", "Daily Schedule Trigger",
            "Starts when a schedule_daily runtime tick record is created.",
            "trigger", "schedule", "daily", "timer", "cron"),
        trigger("approval_requested_trigger", "Approval Requested Trigger",
            "Starts when an approval_request runtime record is created.",
            "trigger", "approval", "review", "request", "start"),
        step("condition_equals", "If Equals", TemplateCategory.LOGIC,
            "Branch execution when a payload field equals a value.",
            "if", "branch", "equals", "condition"),
        step("condition_exists", "If Exists", TemplateCategory.LOGIC,
            "Branch execution when a payload field exists.",
            "if", "exists", "condition", "branch"),
        step("http_request", "HTTP Request", TemplateCategory.INTEGRATION,
            "Queue an outbound HTTP dispatch record for an integration worker.",
            "http", "request", "api", "integration"),
        step("transform_payload", "Transform Payload", TemplateCategory.INTEGRATION,
            "Map input values into a structured integration payload record.",
            "transform", "map", "payload", "integration"),
        step("delay_step", "Delay", TemplateCategory.INTEGRATION,
            "Insert a wait/delay semantic step for downstream processing.",
            "delay", "wait", "timer"),
        step("send_email_notification", "Send Email Notification", TemplateCategory.INTEGRATION,
            "Create an email_outbox record for downstream mail delivery.",
            "email", "notification", "message", "integration"),
        step("send_slack_notification", "Send Slack Notification", TemplateCategory.INTEGRATION,
            "Create a chat_notification record for Slack/Teams relays.",
            "slack", "teams", "chat", "notification", "integration"),
        step("dispatch_webhook", "Dispatch Webhook", TemplateCategory.INTEGRATION,
            "Create a webhook_dispatch record for outbound webhook delivery.",
            "webhook", "dispatch", "http", "integration"),
        step("create_task", "Create Task Record", TemplateCategory.DATA,
            "Create a task runtime record with follow-up defaults.",
            "create", "record", "task", "data"),
        step("create_note", "Create Note Record", TemplateCategory.DATA,
            "Create a note runtime record for activity capture.",
            "create", "record", "note", "data"),
        step("create_followup_task", "Create Follow-up Task", TemplateCategory.DATA,
            "Create a task assigned for next-step follow-up work.",
            "task", "follow-up", "assign", "work"),
        step("assign_record_owner", "Assign Record Owner", TemplateCategory.DATA,
            "Create a record_assignment event for ownership routing.",
            "assign", "owner", "routing", "queue"),
        step("create_approval_request", "Create Approval Request", TemplateCategory.DATA,
            "Create an approval_request record for human approval flow.",
            "approval", "review", "request", "workflow"),
        step("create_incident_ticket", "Create Incident Ticket", TemplateCategory.DATA,
            "Create an incident_ticket record for operations handling.",
            "incident", "ticket", "ops", "support"),
        step("upsert_contact_profile", "Upsert Contact Profile", TemplateCategory.DATA,
            "Create a contact_upsert_queue record for profile syncing.",
            "contact", "crm", "profile", "sync", "upsert"),
        step("log_info", "Log Info", TemplateCategory.OPERATIONS,
            "Write an informational trace message.",
            "log", "message", "trace", "ops"),
        step("log_warning", "Log Warning", TemplateCategory.OPERATIONS,
            "Write a warning trace message.",
            "log", "warning", "message", "ops"),
        step("post_feed_update", "Post Feed Update", TemplateCategory.OPERATIONS,
            "Create a team_feed_event record for activity timelines.",
            "feed", "activity", "post", "timeline"),
        step("create_audit_entry", "Create Audit Entry", TemplateCategory.OPERATIONS,
            "Create a workflow_audit_log record for compliance tracing.",
            "audit", "compliance", "trace", "log")
    );

    private static final Map<String, List<String>> SYNONYMS = Map.ofEntries(
        Map.entry("condition", List.of("if", "branch", "rule", "decision")),
        Map.entry("if", List.of("condition", "branch", "rule", "decision")),
        Map.entry("branch", List.of("condition", "if", "rule")),
        Map.entry("decision", List.of("condition", "if", "branch")),
        Map.entry("webhook", List.of("http", "event", "trigger")),
        Map.entry("email", List.of("mail", "notification", "message", "inbound")),
        Map.entry("slack", List.of("teams", "chat", "message", "notification")),
        Map.entry("schedule", List.of("timer", "cron", "daily", "hourly")),
        Map.entry("approval", List.of("review", "signoff", "request")),
        Map.entry("incident", List.of("ticket", "alert", "ops")),
        Map.entry("owner", List.of("assign", "routing", "queue")),
        Map.entry("webhook_dispatch", List.of("webhook", "http", "integration")),
        Map.entry("trigger", List.of("start", "when", "event")),
        Map.entry("action", List.of("step", "task", "operation")),
        Map.entry("task", List.of("todo", "work item", "follow-up")),
        Map.entry("note", List.of("comment", "activity", "log")),
        Map.entry("delay", List.of("wait", "pause", "sleep")),
        Map.entry("wait", List.of("delay", "timer", "pause")),
        Map.entry("transform", List.of("map", "shape", "convert")),
        Map.entry("map", List.of("transform", "convert", "shape")),
        Map.entry("http", List.of("api", "request", "webhook")),
        Map.entry("record", List.of("row", "entity", "data")),
        Map.entry("create", List.of("add", "insert", "new")),
        Map.entry("exists", List.of("present", "has", "available")),
        Map.entry("equals", List.of("is", "match", "same"))
    );

    private TemplateCatalog() {}

    public static List<FlowTemplate> all() {
        return TEMPLATES;
    }

    public static Optional<FlowTemplate> find(String templateId) {
        return TEMPLATES.stream().filter(template -> template.id().equals(templateId)).findFirst();
    }

    /**
     * Rank templates against a free-text query.
     *
     * @param query    whitespace separated terms; blank lists every template
     * @param category restrict to one category, or null for all
     * @return matching templates, best first, ties by label
     */
    public static List<FlowTemplate> search(String query, TemplateCategory category) {
        List<String> queryTokens = tokenize(query == null ? "" : query);
        List<String> expanded = expand(queryTokens);

        var scored = new ArrayList<Scored>();
        for (FlowTemplate template : TEMPLATES) {
            if (category != null && template.category() != category) {
                continue;
            }
            if (queryTokens.isEmpty()) {
                scored.add(new Scored(template, 0));
                continue;
            }
            int score = score(template, queryTokens, expanded);
            if (score > 0) {
                scored.add(new Scored(template, score));
            }
        }

        scored.sort(Comparator.comparingInt(Scored::score).reversed()
            .thenComparing(entry -> entry.template().label(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(entry -> entry.template().label()));
        return scored.stream().map(Scored::template).toList();
    }

    private record Scored(FlowTemplate template, int score) {}

    private static int score(FlowTemplate template, List<String> queryTokens, List<String> expanded) {
        List<String> haystacks = haystacks(template);
        int score = 0;
        for (String token : expanded) {
            for (String haystack : haystacks) {
                if (haystack.equals(token)) {
                    score += EXACT_SCORE;
                } else if (haystack.startsWith(token)) {
                    score += PREFIX_SCORE;
                } else if (haystack.contains(token)) {
                    score += SUBSTRING_SCORE;
                } else if (token.chars().allMatch(ch -> haystack.indexOf(ch) >= 0)) {
                    score += CHARACTERS_SCORE;
                }
            }
        }
        if (queryTokens.size() > 1) {
            boolean allPresent = queryTokens.stream()
                .allMatch(token -> haystacks.stream().anyMatch(haystack -> haystack.contains(token)));
            if (allPresent) {
                score += ALL_TOKENS_BONUS;
            }
        }
        return score;
    }

    private static List<String> haystacks(FlowTemplate template) {
        var haystacks = new ArrayList<String>();
        haystacks.add(template.label().toLowerCase(Locale.ROOT));
        haystacks.add(template.description().toLowerCase(Locale.ROOT));
        template.keywords().forEach(keyword -> haystacks.add(keyword.toLowerCase(Locale.ROOT)));
        return haystacks;
    }

    private static List<String> tokenize(String query) {
        return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
            .filter(token -> !token.isEmpty())
            .toList();
    }

    private static List<String> expand(List<String> tokens) {
        Set<String> expanded = new LinkedHashSet<>(tokens);
        for (String token : tokens) {
            expanded.addAll(SYNONYMS.getOrDefault(token, List.of()));
        }
        return List.copyOf(expanded);
    }

    /**
     * The trigger a trigger template applies; empty for step templates.
     */
    public static Optional<TriggerTemplate> triggerConfig(String templateId) {
        switch (templateId) {
            case "manual_trigger":
                return triggerTemplate(TriggerKind.MANUAL, "", "Manual");
            case "record_created_trigger":
                return triggerTemplate(TriggerKind.RECORD_CREATED, "contact", "Record Created");
            case "webhook_trigger":
                return triggerTemplate(TriggerKind.RECORD_CREATED, "webhook_event", "Webhook Event");
            case "inbound_email_trigger":
                return triggerTemplate(TriggerKind.RECORD_CREATED, "inbound_email", "Inbound Email");
            case "form_submission_trigger":
                return triggerTemplate(TriggerKind.RECORD_CREATED, "form_submission", "Form Submission");
            case "schedule_hourly_trigger":
                return triggerTemplate(TriggerKind.SCHEDULE_TICK, "hourly", "Hourly Schedule");
            case "schedule_daily_trigger":
                return triggerTemplate(TriggerKind.SCHEDULE_TICK, "daily", "Daily Schedule");
            case "approval_requested_trigger":
                return triggerTemplate(TriggerKind.RECORD_CREATED, "approval_request", "Approval Requested");
            default:
                return Optional.empty();
        }
    }

    /**
     * The step a template stands for. Trigger templates yield a placeholder log
     * step; unknown ids fall back to {@value #DEFAULT_STEP_TEMPLATE}.
     */
    public static Step createStep(String templateId, IdGenerator ids) {
        if (triggerConfig(templateId).isPresent()) {
            return StepFactory.log(ids, "trigger template applied");
        }
        switch (templateId) {
            case "log_info":
                return StepFactory.log(ids, "[INFO] flow step executed");
            case "log_warning":
                return StepFactory.log(ids, "[WARN] requires attention");
            case "post_feed_update":
                return StepFactory.createRecord(ids, "team_feed_event", """
                    {
                      "title": "Workflow update",
                      "body": "Processed {{trigger.payload.record_id}} in run {{run.id}}",
                      "visibility": "team"
                    }""");
            case "create_audit_entry":
                return StepFactory.createRecord(ids, "workflow_audit_log", """
                    {
                      "run_id": "{{run.id}}",
                      "event": "workflow_step_completed",
                      "source_record_id": "{{trigger.payload.record_id}}"
                    }""");
            case "create_task":
                return StepFactory.createRecord(ids, "task", """
                    {
                      "title": "Follow-up",
                      "priority": "normal"
                    }""");
            case "create_note":
                return StepFactory.createRecord(ids, "note", """
                    {
                      "title": "Activity Note",
                      "body": "auto generated"
                    }""");
            case "create_followup_task":
                return StepFactory.createRecord(ids, "task", """
                    {
                      "title": "Follow up on {{trigger.payload.record_id}}",
                      "status": "open",
                      "priority": "normal",
                      "source": "workflow"
                    }""");
            case "assign_record_owner":
                return StepFactory.createRecord(ids, "record_assignment", """
                    {
                      "source_record_id": "{{trigger.payload.record_id}}",
                      "source_entity": "{{trigger.payload.entity_logical_name}}",
                      "owner_id": "triage_queue",
                      "reason": "auto routing"
                    }""");
            case "create_approval_request":
                return StepFactory.createRecord(ids, "approval_request", """
                    {
                      "request_type": "record_change",
                      "source_record_id": "{{trigger.payload.record_id}}",
                      "requested_by": "{{trigger.payload.triggered_by}}",
                      "status": "pending"
                    }""");
            case "create_incident_ticket":
                return StepFactory.createRecord(ids, "incident_ticket", """
                    {
                      "title": "Automation incident for {{trigger.payload.record_id}}",
                      "severity": "medium",
                      "source": "workflow",
                      "status": "open"
                    }""");
            case "upsert_contact_profile":
                return StepFactory.createRecord(ids, "contact_upsert_queue", """
                    {
                      "external_id": "{{trigger.payload.record_id}}",
                      "source": "workflow",
                      "payload": {
                        "email": "{{trigger.payload.email}}",
                        "name": "{{trigger.payload.name}}"
                      }
                    }""");
            case "http_request":
                return StepFactory.createRecord(ids, "integration_http_request", """
                    {
                      "method": "POST",
                      "url": "https://api.example.com/hooks/workflow",
                      "headers": {
                        "content-type": "application/json"
                      },
                      "body": {
                        "run_id": "{{run.id}}",
                        "record_id": "{{trigger.payload.record_id}}"
                      }
                    }""");
            case "transform_payload":
                return StepFactory.createRecord(ids, "integration_payload", """
                    {
                      "source": "trigger",
                      "transformed": true,
                      "mapping_version": "v1"
                    }""");
            case "delay_step":
                return StepFactory.createRecord(ids, "workflow_delay_request", """
                    {
                      "duration": "PT5M",
                      "reason": "downstream consistency wait",
                      "run_id": "{{run.id}}"
                    }""");
            case "send_email_notification":
                return StepFactory.createRecord(ids, "email_outbox", """
                    {
                      "to": "ops@example.com",
                      "subject": "Workflow alert: {{trigger.payload.record_id}}",
                      "body": "Flow {{run.id}} processed {{trigger.payload.record_id}}.",
                      "channel": "email"
                    }""");
            case "send_slack_notification":
                return StepFactory.createRecord(ids, "chat_notification", """
                    {
                      "provider": "slack",
                      "channel": "#ops-alerts",
                      "message": "Workflow {{run.id}} handled {{trigger.payload.record_id}}"
                    }""");
            case "dispatch_webhook":
                return StepFactory.createRecord(ids, "webhook_dispatch", """
                    {
                      "endpoint": "https://example.org/workflow-callback",
                      "event": "workflow.completed",
                      "payload": {
                        "run_id": "{{run.id}}",
                        "trigger_record_id": "{{trigger.payload.record_id}}"
                      }
                    }""");
            case "condition_exists": {
                String conditionId = ids.nextId();
                return new Step.ConditionStep(
                    conditionId, "contact.email", ConditionOperator.EXISTS, JsonText.nullValue(), "Found", "Missing",
                    List.of(StepFactory.log(ids, "email found")),
                    List.of(StepFactory.createRecord(ids, "task", """
                        {
                          "title": "Collect missing email"
                        }""")));
            }
            case "condition_equals":
            default: {
                String conditionId = ids.nextId();
                return new Step.ConditionStep(
                    conditionId, "status", ConditionOperator.EQUALS, JsonText.of("\"open\""), "Open", "Closed",
                    List.of(StepFactory.log(ids, "status is open")),
                    List.of(StepFactory.log(ids, "status is not open")));
            }
        }
    }

    private static Optional<TriggerTemplate> triggerTemplate(TriggerKind kind, String target, String statusLabel) {
        return Optional.of(new TriggerTemplate(new Trigger(kind, target), statusLabel));
    }

    private static FlowTemplate trigger(String id, String label, String description, String... keywords) {
        return new FlowTemplate(id, label, description, TemplateCategory.TRIGGER, List.of(keywords),
            TemplateTarget.TRIGGER);
    }

    private static FlowTemplate step(String id, String label, TemplateCategory category, String description,
                                     String... keywords) {
        return new FlowTemplate(id, label, description, category, List.of(keywords), TemplateTarget.STEP);
    }
}
