package com.folio.plugin;

import com.folio.config.FolioSettings;
import com.folio.config.SettingsView;
import com.folio.hooks.HookDeclaration;
import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;
import com.folio.hooks.PipelineContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PluginHookAdapterTest {

    private final PipelineContext context = PipelineContext.builder()
            .settings(SettingsView.of(FolioSettings.builder().build()))
            .build();

    @Test
    void invocationSeesInstanceStoredByPreviousInvocation() throws Exception {
        PluginStateStore store = new PluginStateStore();
        store.put(new PluginInstance("counter", Map.of(), null, Map.of("count", 0), Map.of()));
        List<Object> seen = new ArrayList<>();
        PluginHookDeclaration hook = PluginHookDeclaration.builder()
                .hook(HookInterface.BOOTSTRAP).name("count").description("counts")
                .run((plugin, ctx) -> {
                    int count = (Integer) plugin.getProp("count");
                    seen.add(count);
                    return PluginHookResult.of(HookPatch.data(Map.of("count", count + 1)),
                            plugin.withProp("count", count + 1));
                })
                .build();

        HookDeclaration adapted = new PluginHookAdapter(store).adapt("counter", hook);
        for (int i = 0; i < 3; i++) {
            adapted.getRun().run(context);
        }

        assertEquals(List.of(0, 1, 2), seen);
        assertEquals(3, store.get("counter").getProp("count"));
    }

    @Test
    void resultWithoutInstanceKeepsCurrentState() throws Exception {
        PluginStateStore store = new PluginStateStore();
        PluginInstance initial = new PluginInstance("p", Map.of(), null, Map.of("k", "v"), Map.of());
        store.put(initial);
        PluginHookDeclaration hook = PluginHookDeclaration.builder()
                .hook(HookInterface.BOOTSTRAP).name("noop").description("noop")
                .run((plugin, ctx) -> PluginHookResult.unchanged())
                .build();

        new PluginHookAdapter(store).adapt("p", hook).getRun().run(context);

        assertEquals(initial, store.get("p"));
    }

    @Test
    void instanceForAnotherPluginIsRejected() {
        PluginStateStore store = new PluginStateStore();
        store.put(new PluginInstance("p", Map.of(), null, Map.of(), Map.of()));
        PluginHookDeclaration hook = PluginHookDeclaration.builder()
                .hook(HookInterface.BOOTSTRAP).name("swap").description("swap")
                .run((plugin, ctx) -> PluginHookResult.of(HookPatch.none(),
                        new PluginInstance("other", Map.of(), null, Map.of(), Map.of())))
                .build();
        HookDeclaration adapted = new PluginHookAdapter(store).adapt("p", hook);

        assertThrows(IllegalStateException.class, () -> adapted.getRun().run(context));
    }
}
