/**
 * Public entry point ({@link com.folio.worker.FolioPipeline}), request building and progress reporting.
 */
package com.folio.worker;
