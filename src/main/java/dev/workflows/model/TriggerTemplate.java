package dev.workflows.model;

/**
 * The trigger a trigger template applies, with the status text shown after.
 */
public record TriggerTemplate(Trigger trigger, String statusLabel) {}
