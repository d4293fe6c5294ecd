package com.tandem.process;

import java.util.List;
import java.util.Map;

/**
 * Routes every worker type to {@code sh -c <payload>}, so tests drive real processes with shell snippets.
 */
final class ProcessTestSupport {

    private ProcessTestSupport() {}

    static TandemProperties shellProperties() {
        var properties = new TandemProperties();
        properties.getWorker().getRoutes().put(TandemProperties.DEFAULT_ROUTE,
                new TandemProperties.Route(List.of("sh", "-c", "{payload}"), Map.of()));
        return properties;
    }

    static WorkerLauncher shellLauncher() {
        return new CommandLineWorkerLauncher(shellProperties());
    }
}
