package com.specsync.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentStatus}.
 */
class ComponentStatusTest {

    @Test
    void nextAction_withoutSpec_isCreateSpec() {
        ComponentStatus status = status(false, false, false, TestStatus.NOT_RUN);

        assertThat(status.nextAction()).isEqualTo(NextAction.CREATE_SPEC);
        assertThat(status.readyForWork()).isTrue();
        assertThat(status.fullySatisfied()).isFalse();
    }

    @Test
    void nextAction_followsSpecCodeTestOrder() {
        assertThat(status(true, false, false, TestStatus.NOT_RUN).nextAction()).isEqualTo(NextAction.IMPLEMENT_CODE);
        assertThat(status(true, true, false, TestStatus.NOT_RUN).nextAction()).isEqualTo(NextAction.WRITE_TESTS);
        assertThat(status(true, true, true, TestStatus.FAILING).nextAction()).isEqualTo(NextAction.FIX_TESTS);
        assertThat(status(true, true, true, TestStatus.PASSING).nextAction()).isEqualTo(NextAction.COMPLETE);
    }

    @Test
    void readyForWork_withPassingTests_isFalse() {
        ComponentStatus status = status(true, true, true, TestStatus.PASSING);

        assertThat(status.readyForWork()).isFalse();
        assertThat(status.fullySatisfied()).isTrue();
    }

    @Test
    void readyForWork_withTestsNotRun_isFalseButNotSatisfied() {
        ComponentStatus status = status(true, true, true, TestStatus.NOT_RUN);

        assertThat(status.readyForWork()).isFalse();
        assertThat(status.fullySatisfied()).isFalse();
    }

    @Test
    void unknown_hasNoFilesAndTestsNotRun() {
        ComponentStatus status = ComponentStatus.unknown();

        assertThat(status.specExists()).isFalse();
        assertThat(status.testStatus()).isEqualTo(TestStatus.NOT_RUN);
        assertThat(status.expectedFile(FileKind.SPEC)).isNull();
    }

    private static ComponentStatus status(boolean spec, boolean code, boolean test, TestStatus testStatus) {
        return new ComponentStatus(spec, code, test, false, false, testStatus,
            Map.of(FileKind.SPEC, "docs/spec/shop.spec.md"), List.of(), null);
    }
}
