package com.folio.bootstrap;

import com.folio.hooks.HookDeclaration;

import java.util.List;

/**
 * SPI for a project's own hooks file. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.folio.bootstrap.ProjectHooks) when no hooks are passed in explicitly.
 */
public interface ProjectHooks {

    List<HookDeclaration> hooks();
}
