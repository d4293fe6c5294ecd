package com.tandem.core.orchestration;

import com.tandem.core.enforcer.DelegationEnforcer;
import com.tandem.core.events.EventBus;
import com.tandem.core.graph.TaskGraph;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.process.TandemProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Year;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens orchestration sessions, each with its own {@link DelegationEnforcer}.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final TaskDispatcher dispatcher;
    private final Duration parallelWindow;
    private final boolean strict;
    private final EventBus eventBus;
    private final TandemMetrics metrics;
    private final Clock clock;

    @Autowired
    public OrchestrationService(TaskDispatcher dispatcher, TandemProperties properties, EventBus eventBus,
                                @Autowired(required = false) TandemMetrics metrics) {
        this(dispatcher, properties.getParallelWindow(), properties.isStrict(), eventBus, metrics, Clock.systemUTC());
    }

    OrchestrationService(TaskDispatcher dispatcher, Duration parallelWindow, boolean strict,
                         EventBus eventBus, TandemMetrics metrics, Clock clock) {
        this.dispatcher = dispatcher;
        this.parallelWindow = parallelWindow;
        this.strict = strict;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public OrchestrationSession open(TaskGraph graph) {
        return open(graph, parallelWindow, strict);
    }

    public OrchestrationSession open(TaskGraph graph, Duration parallelWindow, boolean strict) {
        String sessionId = generateSessionId();
        var enforcer = new DelegationEnforcer(graph, parallelWindow, strict, sessionId, eventBus, metrics, clock);
        log.info("Opened session {}: {} tasks in {} waves, window {}ms, {}", sessionId, graph.size(),
                graph.waveCount(), parallelWindow.toMillis(), strict ? "strict" : "lenient");
        return new OrchestrationSession(sessionId, enforcer, dispatcher);
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public String generateSessionId() {
        int year = Year.now(clock).getValue();
        int count = SESSION_COUNTER.incrementAndGet();
        return String.format("TNDM-%d-%04d", year, count);
    }
}
