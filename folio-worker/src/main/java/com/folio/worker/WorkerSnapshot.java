package com.folio.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.folio.bootstrap.ReadyPipeline;
import com.folio.errors.FolioException;
import com.folio.routes.Request;

import java.util.List;
import java.util.Map;

/**
 * The part of a ready pipeline a worker in another process needs: settings, data, custom props and the
 * requests to build. Route functions and hooks are not included; the worker process loads those itself.
 */
public record WorkerSnapshot(Map<String, Object> settings, Map<String, Object> data,
                             Map<String, Object> customProps, List<Request> requests) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static WorkerSnapshot of(ReadyPipeline pipeline) {
        return of(pipeline, pipeline.getRequests());
    }

    public static WorkerSnapshot of(ReadyPipeline pipeline, List<Request> requests) {
        return new WorkerSnapshot(pipeline.getSettings().toMap(), pipeline.getContext().getData(),
                pipeline.getContext().getCustomProps(), List.copyOf(requests));
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new FolioException("Pipeline data cannot be serialized for a worker: " + e.getOriginalMessage(), e);
        }
    }
}
