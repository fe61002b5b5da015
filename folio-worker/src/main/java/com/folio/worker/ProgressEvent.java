package com.folio.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.folio.routes.Request;

import java.util.List;

/**
 * Worker progress: one {@link Started} with the request count, then one {@link Completed} per request,
 * in order.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProgressEvent.Started.class, name = "start"),
        @JsonSubTypes.Type(value = ProgressEvent.Completed.class, name = "html")
})
public interface ProgressEvent {

    record Started(int total) implements ProgressEvent {
    }

    /**
     * Sent after each request.
     *
     * @param completed  requests finished so far in this batch, starting at 1
     * @param errorCount requests in this batch that have failed so far
     * @param detail     the failed request and its errors; set only when this request failed
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Completed(int completed, int errorCount, Failure detail) implements ProgressEvent {

        static Completed success(int completed, int errorCount) {
            return new Completed(completed, errorCount, null);
        }

        static Completed failure(int completed, int errorCount, Request request, List<RequestError> errors) {
            return new Completed(completed, errorCount, new Failure(request, List.copyOf(errors)));
        }
    }

    record Failure(Request request, List<RequestError> errors) {
    }
}
