package com.folio.plugin;

import com.folio.hooks.HookInterface;
import com.folio.hooks.HookPatch;

import java.util.List;
import java.util.Map;

/**
 * Installed through META-INF/services for the classpath lookup tests.
 */
public class SamplePluginProvider implements PluginProvider {

    @Override
    public String getName() {
        return "sample";
    }

    @Override
    public PluginDefinition createDefinition() {
        return PluginDefinition.builder()
                .name("sample")
                .config(Map.of("greeting", "hello"))
                .hooks(List.of(PluginHookDeclaration.builder()
                        .hook(HookInterface.BOOTSTRAP)
                        .name("sampleBootstrap")
                        .description("Does nothing")
                        .run((plugin, ctx) -> PluginHookResult.of(HookPatch.none()))
                        .build()))
                .build();
    }
}
