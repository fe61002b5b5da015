package com.folio.plugin;

import com.folio.config.FolioSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TieredPluginCatalogLoaderTest {

    @TempDir
    Path root;

    @Test
    void load_fallsBackToInstalledProvider() throws Exception {
        // a plugin folder without jars does not stop the lookup
        Files.createDirectories(root.resolve("src/plugins/sample"));
        FolioSettings settings = FolioSettings.builder().plugin("sample", Map.of()).build();

        PluginCatalog catalog = new TieredPluginCatalogLoader(root).load(settings);

        assertEquals(PluginSource.CLASSPATH, catalog.get("sample").source());
        assertTrue(catalog.get("sample").provider() instanceof SamplePluginProvider);
    }

    @Test
    void load_releasesLoaderOfDirectoryWithoutMatchingProvider() throws Exception {
        Path dir = Files.createDirectories(root.resolve("src/plugins/sample"));
        try (JarOutputStream jar = new JarOutputStream(Files.newOutputStream(dir.resolve("empty.jar")))) {
            jar.putNextEntry(new JarEntry("readme.txt"));
            jar.write("no providers here".getBytes(StandardCharsets.UTF_8));
            jar.closeEntry();
        }
        FolioSettings settings = FolioSettings.builder().plugin("sample", Map.of()).build();
        TieredPluginCatalogLoader loader = new TieredPluginCatalogLoader(root);

        PluginCatalog catalog = loader.load(settings);

        assertEquals(PluginSource.CLASSPATH, catalog.get("sample").source());
        assertEquals(0, loader.retainedLoaderCount());
    }

    @Test
    void load_unknownPluginListsSearchedLocations() {
        FolioSettings settings = FolioSettings.builder()
                .buildFolder("dist")
                .plugin("nowhere", Map.of())
                .build();

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> new TieredPluginCatalogLoader(root).load(settings));

        assertEquals("nowhere", e.getPluginName());
        assertEquals(4, e.getSearched().size());
        assertEquals(root.resolve("src/plugins/nowhere").toString(), e.getSearched().get(0));
        assertEquals(root.resolve("dist/plugins/nowhere").toString(), e.getSearched().get(1));
        assertEquals("classpath", e.getSearched().get(3));
    }

    @Test
    void load_skipsBuildTierWithoutBuildFolder() {
        FolioSettings settings = FolioSettings.builder().plugin("nowhere", Map.of()).build();

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> new TieredPluginCatalogLoader(root).load(settings));

        assertEquals(3, e.getSearched().size());
    }

    @Test
    void catalog_rejectsDuplicateNames() {
        PluginCatalog catalog = PluginCatalog.of(new SamplePluginProvider());

        assertThrows(IllegalArgumentException.class, () -> catalog.register(new SamplePluginProvider()));
    }
}
