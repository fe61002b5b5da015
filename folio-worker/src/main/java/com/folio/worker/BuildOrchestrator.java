package com.folio.worker;

import com.folio.bootstrap.ReadyPipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Full static build (splitting requests across workers, writing output). Provided from outside the core
 * and handed to {@link FolioPipeline.Builder#buildOrchestrator}.
 */
@FunctionalInterface
public interface BuildOrchestrator {

    CompletableFuture<Void> build(ReadyPipeline pipeline);
}
