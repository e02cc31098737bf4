package com.specsync.core.checker;

import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentStatus;
import com.specsync.core.registry.RequirementDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Checks that a component's tests exist and passed in the latest run.
 */
public class TestStatusChecker implements RequirementChecker {

    private static final Logger log = LoggerFactory.getLogger(TestStatusChecker.class);

    @Override
    public CheckerKind kind() {
        return CheckerKind.TEST_STATUS;
    }

    @Override
    public CheckResult check(CheckContext context, RequirementDefinition definition, Component component,
                             Map<String, Object> options) {
        ComponentStatus status = component.status();
        if (!status.computed()) {
            log.warn("Status of {} was never computed", component.moduleName());
            return CheckResult.failed("Component status unavailable");
        }
        if (!status.testExists()) {
            return CheckResult.failed("Test file missing");
        }
        return switch (status.testStatus()) {
            case PASSING -> CheckResult.ok(Map.of("status", "Tests passing"));
            case FAILING -> CheckResult.failed(Map.of(
                "reason", "Tests failing",
                "failing_tests", status.failingTests()));
            case NOT_RUN -> CheckResult.failed("Tests not run");
        };
    }
}
