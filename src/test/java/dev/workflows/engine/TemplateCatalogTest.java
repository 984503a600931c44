package dev.workflows.engine;

import dev.workflows.model.ConditionOperator;
import dev.workflows.model.FlowTemplate;
import dev.workflows.model.SequentialIdGenerator;
import dev.workflows.model.Step;
import dev.workflows.model.TemplateCategory;
import dev.workflows.model.TemplateTarget;
import dev.workflows.model.Trigger;
import dev.workflows.model.TriggerKind;
import dev.workflows.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateCatalogTest {

    private static List<String> ids(List<FlowTemplate> templates) {
        return templates.stream().map(FlowTemplate::id).toList();
    }

    @Test
    void catalogHasUniqueIds() {
        assertThat(TemplateCatalog.all()).hasSize(27);
        assertThat(ids(TemplateCatalog.all())).doesNotHaveDuplicates();
        assertThat(TemplateCatalog.all()).filteredOn(t -> t.target() == TemplateTarget.TRIGGER).hasSize(8);
    }

    @Test
    void blankQueryListsCategorySortedByLabel() {
        assertThat(ids(TemplateCatalog.search("  ", TemplateCategory.LOGIC)))
            .containsExactly("condition_equals", "condition_exists");
        assertThat(TemplateCatalog.search(null, null)).hasSize(27);
    }

    @Test
    void exactKeywordRanksFirst() {
        assertThat(ids(TemplateCatalog.search("slack", null)).get(0)).isEqualTo("send_slack_notification");
    }

    @Test
    void synonymsReachConditionTemplates() {
        List<String> found = ids(TemplateCatalog.search("decision", null));

        assertThat(found.subList(0, 2)).containsExactlyInAnyOrder("condition_equals", "condition_exists");
    }

    @Test
    void categoryFilterRestrictsResults() {
        List<FlowTemplate> found = TemplateCatalog.search("webhook", TemplateCategory.TRIGGER);

        assertThat(found).isNotEmpty().allMatch(t -> t.category() == TemplateCategory.TRIGGER);
        assertThat(found.get(0).id()).isEqualTo("webhook_trigger");
    }

    @Test
    void unmatchedQueryFindsNothing() {
        assertThat(TemplateCatalog.search("zebra", null)).isEmpty();
    }

    @Test
    void searchIsCaseInsensitive() {
        assertThat(TemplateCatalog.search("SLACK", null)).isEqualTo(TemplateCatalog.search("slack", null));
    }

    @Test
    void triggerTemplatesCarryTheirTrigger() {
        assertThat(TemplateCatalog.triggerConfig("schedule_daily_trigger"))
            .map(t -> t.trigger())
            .contains(Trigger.of(TriggerKind.SCHEDULE_TICK, "daily"));
        assertThat(TemplateCatalog.triggerConfig("manual_trigger"))
            .map(t -> t.trigger())
            .contains(Trigger.manual());
        assertThat(TemplateCatalog.triggerConfig("log_info")).isEmpty();
    }

    @Test
    void createsLogStepsFromOperationsTemplates() {
        Step step = TemplateCatalog.createStep("log_warning", new SequentialIdGenerator("s"));

        assertThat(step).isEqualTo(new Step.LogStep("s_1", "[WARN] requires attention"));
    }

    @Test
    void createsRecordStepsWithObjectPayloads() {
        var ids = new SequentialIdGenerator("s");
        for (String templateId : List.of("create_task", "http_request", "upsert_contact_profile", "delay_step")) {
            Step step = TemplateCatalog.createStep(templateId, ids);

            assertThat(step).isInstanceOf(Step.CreateRecordStep.class);
            assertThat(((Step.CreateRecordStep) step).data().isObject()).isTrue();
        }
    }

    @Test
    void existsTemplateBuildsBothBranches() {
        Step.ConditionStep step = (Step.ConditionStep) TemplateCatalog.createStep(
            "condition_exists", new SequentialIdGenerator("s"));

        assertThat(step.id()).isEqualTo("s_1");
        assertThat(step.operator()).isEqualTo(ConditionOperator.EXISTS);
        assertThat(step.fieldPath()).isEqualTo("contact.email");
        assertThat(step.thenLabel()).isEqualTo("Found");
        assertThat(step.thenSteps()).extracting(Step::id).containsExactly("s_2");
        assertThat(step.elseSteps()).extracting(Step::id).containsExactly("s_3");
    }

    @Test
    void unknownTemplateFallsBackToEqualsCondition() {
        Step.ConditionStep step = (Step.ConditionStep) TemplateCatalog.createStep(
            "no_such_template", new SequentialIdGenerator("s"));

        assertThat(step.operator()).isEqualTo(ConditionOperator.EQUALS);
        assertThat(step.fieldPath()).isEqualTo("status");
        assertThat(step.thenLabel()).isEqualTo("Open");
        assertThat(step.elseLabel()).isEqualTo("Closed");
    }

    @Test
    void everyTemplateProducesAValidStep() {
        var ids = new SequentialIdGenerator("s");
        for (FlowTemplate template : TemplateCatalog.all()) {
            Step step = TemplateCatalog.createStep(template.id(), ids);

            assertThat(WorkflowValidator.validate(new WorkflowDefinition(Trigger.manual(), List.of(step))))
                .as(template.id())
                .isEmpty();
        }
    }
}
