package dev.workflows.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SequentialIdGeneratorTest {

    @Test
    void issuesPrefixedCounter() {
        var ids = new SequentialIdGenerator("step");

        assertThat(ids.nextId()).isEqualTo("step_1");
        assertThat(ids.nextId()).isEqualTo("step_2");
    }

    @Test
    void resumesAfterLastIssued() {
        assertThat(new SequentialIdGenerator("step", 41).nextId()).isEqualTo("step_42");
    }

    @Test
    void uuidIdsAreDistinct() {
        var ids = new UuidIdGenerator();

        assertThat(ids.nextId()).isNotEqualTo(ids.nextId());
    }
}
