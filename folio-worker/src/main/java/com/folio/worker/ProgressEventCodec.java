package com.folio.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.folio.errors.FolioException;

/**
 * JSON form of progress events for crossing a process boundary:
 * {@code {"version":1,"event":{"kind":"html","index":3,"errorCount":0}}}.
 * Decoding rejects unknown versions.
 */
public final class ProgressEventCodec {

    public static final int VERSION = 1;

    public record Envelope(int version, ProgressEvent event) {
    }

    private final ObjectMapper mapper;

    public ProgressEventCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ProgressEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(ProgressEvent event) {
        try {
            return mapper.writeValueAsString(new Envelope(VERSION, event));
        } catch (JsonProcessingException e) {
            throw new FolioException("Cannot encode progress event " + event, e);
        }
    }

    public ProgressEvent decode(String json) {
        Envelope envelope;
        try {
            envelope = mapper.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new FolioException("Cannot decode progress event: " + e.getOriginalMessage(), e);
        }
        if (envelope.version() != VERSION) {
            throw new FolioException("Unsupported progress event version " + envelope.version() + " (expected " + VERSION + ")");
        }
        if (envelope.event() == null) {
            throw new FolioException("Progress event envelope has no event: " + json);
        }
        return envelope.event();
    }
}
