package com.folio.worker;

import com.folio.bootstrap.ReadyPipeline;
import com.folio.routes.Request;
import com.folio.routes.RouteDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Builds a batch of requests one after another and reports progress after each. A failing request is
 * recorded and counted; it never stops the batch. Build time per request goes to the
 * {@value #TIMER_NAME} timer, tagged by route and outcome.
 */
public final class WorkerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkerDispatcher.class);

    public static final String TIMER_NAME = "folio.request.build";

    private final MeterRegistry registry;

    public WorkerDispatcher(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public List<RequestTimings> dispatch(ReadyPipeline pipeline, List<Request> requests, PageRenderer renderer,
                                         ProgressChannel channel) {
        channel.send(new ProgressEvent.Started(requests.size()));
        List<RequestTimings> out = new ArrayList<>(requests.size());
        int completed = 0;
        int failed = 0;
        for (Request request : requests) {
            RequestTimings result = buildOne(pipeline, request, renderer);
            out.add(result);
            completed++;
            if (result.succeeded()) {
                channel.send(ProgressEvent.Completed.success(completed, failed));
            } else {
                failed++;
                channel.send(ProgressEvent.Completed.failure(completed, failed, request, result.errors()));
            }
        }
        if (failed > 0) {
            log.warn("Built {} request(s), {} with errors", requests.size(), failed);
        } else {
            log.info("Built {} request(s)", requests.size());
        }
        return out;
    }

    private RequestTimings buildOne(ReadyPipeline pipeline, Request request, PageRenderer renderer) {
        long start = System.nanoTime();
        List<RequestError> errors = new ArrayList<>();
        List<Timing> timings = List.of();
        RouteDefinition route = request.getRoute() != null ? pipeline.getRoute(request.getRoute()) : null;
        if (route == null) {
            errors.add(new RequestError(request.getPermalink(), "Unknown route: " + request.getRoute()));
        } else {
            try {
                PageResult result = renderer.render(request, route, pipeline);
                if (result != null) {
                    errors.addAll(result.errors());
                    timings = result.timings();
                }
            } catch (Exception e) {
                log.warn("Failed to build {}: {}", request.getPermalink(), e.getMessage(), e);
                errors.add(RequestError.of(request.getPermalink(), e));
            }
        }
        long elapsed = System.nanoTime() - start;
        Timer.builder(TIMER_NAME)
                .tag("route", request.getRoute() != null ? request.getRoute() : "unknown")
                .tag("outcome", errors.isEmpty() ? "success" : "error")
                .register(registry)
                .record(elapsed, TimeUnit.NANOSECONDS);
        return new RequestTimings(request, timings, elapsed, errors);
    }
}
