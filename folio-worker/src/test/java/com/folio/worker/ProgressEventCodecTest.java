package com.folio.worker;

import com.folio.config.BuildContext;
import com.folio.errors.FolioException;
import com.folio.routes.Request;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressEventCodecTest {

    private final ProgressEventCodec codec = new ProgressEventCodec();

    @Test
    void encode_writesVersionAndKind() {
        String json = codec.encode(new ProgressEvent.Started(3));

        assertTrue(json.contains("\"version\":1"), json);
        assertTrue(json.contains("\"kind\":\"start\""), json);
        assertTrue(json.contains("\"total\":3"), json);
    }

    @Test
    void decode_readsFailedCompletionWithDetail() {
        Request request = Request.of("b", Map.of("id", 7)).withRoute("pages").withPermalink("/b")
                .withType(BuildContext.BUILD);
        ProgressEvent event = ProgressEvent.Completed.failure(2, 1, request,
                List.of(new RequestError("/b", "template crashed")));

        ProgressEvent decoded = codec.decode(codec.encode(event));

        assertEquals(event, decoded);
    }

    @Test
    void encode_omitsDetailForSuccessfulCompletion() {
        String json = codec.encode(ProgressEvent.Completed.success(3, 1));

        assertEquals("{\"version\":1,\"event\":{\"kind\":\"html\",\"completed\":3,\"errorCount\":1}}", json);
    }

    @Test
    void decode_rejectsOtherVersions() {
        String json = """
                {"version":2,"event":{"kind":"start","total":1}}
                """;

        FolioException e = assertThrows(FolioException.class, () -> codec.decode(json));

        assertTrue(e.getMessage().contains("version 2"));
    }

    @Test
    void decode_rejectsMalformedJson() {
        assertThrows(FolioException.class, () -> codec.decode("{not json"));
    }
}
