package com.folio.worker;

/**
 * One named phase of building a page, as reported by the renderer.
 */
public record Timing(String name, double durationMs) {
}
