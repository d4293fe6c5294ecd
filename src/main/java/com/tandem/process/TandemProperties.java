package com.tandem.process;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "tandem")
public class TandemProperties {

    /** Route key used for worker types without a route of their own. */
    public static final String DEFAULT_ROUTE = "default";

    private Enforcer enforcer = new Enforcer();
    private Worker worker = new Worker();

    // -- Enforcer accessors (delegate to nested) --
    public Duration getParallelWindow() { return Duration.ofMillis(enforcer.parallelWindowMs); }
    public boolean isStrict() { return enforcer.strict; }

    // -- Worker accessors (delegate to nested) --
    public Duration getCancelGracePeriod() { return Duration.ofSeconds(worker.cancelGraceSeconds); }
    public Duration getOutputTimeout() { return Duration.ofSeconds(worker.outputTimeoutSeconds); }

    /**
     * Route for a worker tag, falling back to the {@value #DEFAULT_ROUTE} route.
     *
     * @return the route, or null if neither is configured
     */
    public Route getRoute(String workerTag) {
        Route route = worker.routes.get(workerTag);
        return route != null ? route : worker.routes.get(DEFAULT_ROUTE);
    }

    public Enforcer getEnforcer() { return enforcer; }
    public void setEnforcer(Enforcer enforcer) { this.enforcer = enforcer; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }

    public static class Enforcer {
        private long parallelWindowMs = 500;
        private boolean strict = true;

        public long getParallelWindowMs() { return parallelWindowMs; }
        public void setParallelWindowMs(long parallelWindowMs) { this.parallelWindowMs = parallelWindowMs; }
        public boolean isStrict() { return strict; }
        public void setStrict(boolean strict) { this.strict = strict; }
    }

    public static class Worker {
        private int cancelGraceSeconds = 5;
        private int outputTimeoutSeconds = 300;
        private String workingDirectory = "";
        private Map<String, Route> routes = new LinkedHashMap<>();

        public int getCancelGraceSeconds() { return cancelGraceSeconds; }
        public void setCancelGraceSeconds(int cancelGraceSeconds) { this.cancelGraceSeconds = cancelGraceSeconds; }
        public int getOutputTimeoutSeconds() { return outputTimeoutSeconds; }
        public void setOutputTimeoutSeconds(int outputTimeoutSeconds) { this.outputTimeoutSeconds = outputTimeoutSeconds; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
        public Map<String, Route> getRoutes() { return routes; }
        public void setRoutes(Map<String, Route> routes) { this.routes = routes; }
    }

    /**
     * How to launch one worker type: a command template and extra environment.
     * Command arguments may contain {@code {payload}}, {@code {workerType}} and {@code {agentTaskId}}.
     */
    public static class Route {
        private List<String> command = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();

        public Route() {}

        public Route(List<String> command, Map<String, String> env) {
            this.command = new ArrayList<>(command);
            this.env = new LinkedHashMap<>(env);
        }

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
    }
}
