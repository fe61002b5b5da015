/**
 * Pipeline bootstrap: loading ({@link com.folio.bootstrap.PipelineLoader}) and the staged sequence
 * ({@link com.folio.bootstrap.BootstrapSequencer}) that ends in a {@link com.folio.bootstrap.ReadyPipeline}.
 */
package com.folio.bootstrap;
