package com.folio.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A failure while building one request.
 */
public record RequestError(String permalink, String message) {

    @JsonCreator
    public RequestError(@JsonProperty("permalink") String permalink, @JsonProperty("message") String message) {
        this.permalink = permalink;
        this.message = message != null ? message : "";
    }

    static RequestError of(String permalink, Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return new RequestError(permalink, message);
    }
}
