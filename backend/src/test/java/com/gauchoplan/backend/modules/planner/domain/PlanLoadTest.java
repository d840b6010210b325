package com.gauchoplan.backend.modules.planner.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PlanLoadTest {

    @Test
    void classifyAgainstDefaultThresholds() {
        assertThat(PlanLoad.classify(0, 12, 16, 20)).isEqualTo(PlanLoad.UNDER_LOAD);
        assertThat(PlanLoad.classify(11, 12, 16, 20)).isEqualTo(PlanLoad.UNDER_LOAD);
        assertThat(PlanLoad.classify(12, 12, 16, 20)).isEqualTo(PlanLoad.LIGHT);
        assertThat(PlanLoad.classify(15, 12, 16, 20)).isEqualTo(PlanLoad.LIGHT);
        assertThat(PlanLoad.classify(16, 12, 16, 20)).isEqualTo(PlanLoad.TYPICAL);
        assertThat(PlanLoad.classify(19, 12, 16, 20)).isEqualTo(PlanLoad.TYPICAL);
        assertThat(PlanLoad.classify(20, 12, 16, 20)).isEqualTo(PlanLoad.HEAVY);
        assertThat(PlanLoad.classify(24, 12, 16, 20)).isEqualTo(PlanLoad.HEAVY);
    }
}
