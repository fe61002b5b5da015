package com.folio.internal.hooks;

import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookError;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;
import com.folio.hooks.PipelineContext;
import com.folio.hooks.Provenance;
import com.folio.routes.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hooks folio contributes itself. They run at the lowest priority so they see what project and plugin
 * hooks produced, and they only report: none of them changes the context.
 */
public final class InternalHooks {

    private static final Logger log = LoggerFactory.getLogger(InternalHooks.class);

    public static final String REPORT_BOOTSTRAP_ERRORS = "folioReportBootstrapErrors";
    public static final String SUMMARIZE_REQUESTS = "folioSummarizeRequests";

    private InternalHooks() {
    }

    /** All internal hooks, tagged {@link Provenance#internal()}. */
    public static List<HookDeclaration> all() {
        return List.of(reportBootstrapErrors(), summarizeRequests());
    }

    static HookDeclaration reportBootstrapErrors() {
        return HookDeclaration.builder()
                .hook(HookInterface.BOOTSTRAP)
                .name(REPORT_BOOTSTRAP_ERRORS)
                .description("Logs errors recorded by hooks up to the end of bootstrap.")
                .priority(HookDeclaration.MIN_PRIORITY)
                .run(InternalHooks::logErrors)
                .provenance(Provenance.internal())
                .build();
    }

    static HookDeclaration summarizeRequests() {
        return HookDeclaration.builder()
                .hook(HookInterface.ALL_REQUESTS_HOOK)
                .name(SUMMARIZE_REQUESTS)
                .description("Logs how many requests each route produced.")
                .priority(HookDeclaration.MIN_PRIORITY)
                .run(InternalHooks::logRequestCounts)
                .provenance(Provenance.internal())
                .build();
    }

    private static HookPatch logErrors(PipelineContext context) {
        for (HookError error : context.getErrors()) {
            log.warn("Hook {} reported an error in '{}': {}", error.hookName(), error.hookPoint(), error.message());
        }
        return HookPatch.none();
    }

    private static HookPatch logRequestCounts(PipelineContext context) {
        Map<String, Integer> perRoute = new TreeMap<>();
        for (Request request : context.getAllRequests()) {
            perRoute.merge(String.valueOf(request.getRoute()), 1, Integer::sum);
        }
        log.info("{} request(s) across {} route(s): {}", context.getAllRequests().size(), perRoute.size(), perRoute);
        return HookPatch.none();
    }
}
