package com.specsync.core.report;

import com.specsync.core.SyncFixtures;
import com.specsync.core.model.ArtifactType;
import com.specsync.core.model.CheckerKind;
import com.specsync.core.model.Component;
import com.specsync.core.model.ComponentStatus;
import com.specsync.core.model.ComponentType;
import com.specsync.core.model.Requirement;
import com.specsync.core.model.TestStatus;

import java.util.List;
import java.util.Map;

/**
 * Two synced components: a complete context and one missing its implementation.
 */
final class ReportFixtures {

    private ReportFixtures() {
        // Utility class
    }

    static List<Component> components() {
        ComponentStatus complete = new ComponentStatus(true, true, true, false, false,
            TestStatus.PASSING, Map.of(), List.of(), SyncFixtures.NOW);
        ComponentStatus missingCode = new ComponentStatus(true, false, false, false, false,
            TestStatus.NOT_RUN, Map.of(), List.of(), SyncFixtures.NOW);

        Component accounts = Component.of("accounts", "Shop.Accounts", ComponentType.CONTEXT, null)
            .withStatus(complete)
            .withRequirements(List.of(specFile("accounts")));
        Component orders = Component.of("orders", "Shop.Orders", ComponentType.CONTEXT, null)
            .withStatus(missingCode)
            .withRequirements(List.of(specFile("orders"),
                new Requirement("implementation_file", ArtifactType.CODE, "Implementation exists",
                    CheckerKind.FILE_EXISTENCE, 0.0, false,
                    Map.of("status", "missing", "reason", "Missing lib/shop/orders.ex"),
                    SyncFixtures.NOW, "orders")));
        return List.of(accounts, orders);
    }

    private static Requirement specFile(String componentId) {
        return new Requirement("spec_file", ArtifactType.SPECIFICATION, "Specification exists",
            CheckerKind.FILE_EXISTENCE, 1.0, true, Map.of("status", "exists"), SyncFixtures.NOW, componentId);
    }
}
