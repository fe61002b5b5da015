package com.folio.worker;

import com.folio.bootstrap.BootstrapState;
import com.folio.bootstrap.ReadyPipeline;
import com.folio.config.BuildContext;
import com.folio.config.FolioSettings;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;
import com.folio.hooks.HookSlot;
import com.folio.routes.DuplicatePermalinkException;
import com.folio.routes.Request;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FolioPipelineTest {

    @Test
    void workerBuildsEveryRequestOnceReady() {
        FolioPipeline pipeline = FolioPipeline.builder(FolioSettings.builder().context(BuildContext.BUILD).build())
                .route("pages", TestRoutes.pages(List.of(Request.of("a"), Request.of("b"))))
                .hooks(List.of())
                .create();
        BlockingQueueProgressChannel channel = new BlockingQueueProgressChannel();

        List<RequestTimings> out = pipeline.worker((request, route, ready) -> PageResult.ok(), channel);

        assertEquals(2, out.size());
        assertEquals(BootstrapState.READY, pipeline.getState());
        assertEquals(3, channel.drain().size());
    }

    @Test
    void workerRethrowsBootstrapFailure() {
        FolioPipeline pipeline = FolioPipeline.builder(FolioSettings.builder().build())
                .route("blog", TestRoutes.pages(List.of(Request.of("x"))))
                .route("pages", TestRoutes.pages(List.of(Request.of("x"))))
                .hooks(List.of())
                .create();

        assertThrows(DuplicatePermalinkException.class,
                () -> pipeline.worker(List.of(), (request, route, ready) -> PageResult.ok(), null));
    }

    @Test
    void buildReturnsConfiguredOrchestrator() throws Exception {
        BuildOrchestrator orchestrator = ready -> CompletableFuture.completedFuture(null);
        FolioPipeline withBuild = FolioPipeline.builder(FolioSettings.builder().build())
                .hooks(List.of())
                .buildOrchestrator(orchestrator)
                .create();
        FolioPipeline withoutBuild = FolioPipeline.builder(FolioSettings.builder().build()).hooks(List.of()).create();

        assertSame(orchestrator, withBuild.build().orElseThrow());
        assertFalse(withoutBuild.build().isPresent());
        withBuild.build().orElseThrow().build(withBuild.cluster().get(10, TimeUnit.SECONDS)).get(10, TimeUnit.SECONDS);
    }

    @Test
    void usesSuppliedMeterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FolioPipeline pipeline = FolioPipeline.builder(FolioSettings.builder().build())
                .route("pages", TestRoutes.pages(List.of(Request.of("a"))))
                .hooks(List.of())
                .meterRegistry(registry)
                .create();

        pipeline.worker((request, route, ready) -> PageResult.ok(), ProgressChannel.discarding());

        assertSame(registry, pipeline.getMeterRegistry());
        assertEquals(1, registry.find(WorkerDispatcher.TIMER_NAME).timer().count());
    }

    @Test
    void snapshotCarriesDataAndRequests() throws Exception {
        HookDeclaration seed = HookDeclaration.builder()
                .hook(HookInterface.BOOTSTRAP)
                .name("seed")
                .description("seeds data")
                .mutates(HookSlot.DATA)
                .run(ctx -> HookPatch.data(Map.of("title", "Folio")))
                .build();
        ReadyPipeline ready = FolioPipeline.builder(FolioSettings.builder().build())
                .route("pages", TestRoutes.pages(List.of(Request.of("a"))))
                .hooks(List.of(seed))
                .create()
                .cluster()
                .get(10, TimeUnit.SECONDS);

        String json = WorkerSnapshot.of(ready).toJson();

        assertTrue(json.contains("\"title\":\"Folio\""), json);
        assertTrue(json.contains("\"permalink\":\"/a\""), json);
    }
}
