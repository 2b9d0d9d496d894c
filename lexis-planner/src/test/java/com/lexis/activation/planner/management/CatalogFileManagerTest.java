package com.lexis.activation.planner.management;

import com.lexis.activation.api.model.EvaluationOutcome;
import com.lexis.activation.api.model.VerdictCacheKey;
import com.lexis.activation.compiler.CompiledCatalog;
import com.lexis.activation.compiler.InMemoryModuleCatalogProvider;
import com.lexis.activation.compiler.ModuleCatalogLoader;
import com.lexis.activation.compiler.RuleTreeParser;
import com.lexis.activation.infra.cache.CaffeineVerdictCache;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogFileManagerTest {

    private static final String V1 = """
            {"document_type": "contestacao", "modules": [
                {"id": "cabecalho", "activation_mode": "always"}
            ]}
            """;

    private static final String V2 = """
            {"document_type": "contestacao", "modules": [
                {"id": "cabecalho", "activation_mode": "always"},
                {"id": "preliminar", "activation_mode": "llm", "activation_condition": "Ilegitimidade passiva"}
            ]}
            """;

    private static final VerdictCacheKey KEY = new VerdictCacheKey("contestacao", "abc");

    @TempDir
    Path tempDir;

    private Path catalogPath;
    private Tracer tracer;
    private ModuleCatalogLoader loader;
    private InMemoryModuleCatalogProvider provider;
    private CaffeineVerdictCache cache;

    @BeforeEach
    void setUp() throws IOException {
        catalogPath = tempDir.resolve("contestacao.json");
        Files.writeString(catalogPath, V1);
        tracer = OpenTelemetry.noop().getTracer("test");
        loader = new ModuleCatalogLoader(new RuleTreeParser(), MetricsRegistry.noop(), tracer);
        provider = new InMemoryModuleCatalogProvider();
        cache = CaffeineVerdictCache.builder().maxSize(100).ttl(Duration.ofMinutes(60)).executor(Runnable::run).build();
    }

    private void rewrite(String json) throws IOException {
        FileTime before = Files.getLastModifiedTime(catalogPath);
        Files.writeString(catalogPath, json);
        Files.setLastModifiedTime(catalogPath, FileTime.fromMillis(before.toMillis() + 10_000));
    }

    @Test
    void shouldRegisterCatalogOnConstruction() throws IOException {
        CatalogFileManager manager = new CatalogFileManager(catalogPath, loader, provider, cache, tracer);

        assertThat(manager.getActiveCatalog().catalog().modules()).hasSize(1);
        assertThat(provider.catalogFor("contestacao").modules()).hasSize(1);
    }

    @Test
    void shouldFailFastWhenInitialLoadFails() {
        assertThatThrownBy(() -> new CatalogFileManager(tempDir.resolve("missing.json"), loader, provider, cache, tracer))
                .isInstanceOf(IOException.class);
    }

    @Test
    void shouldReloadChangedFileAndDropCachedVerdicts() throws IOException {
        // Given
        CatalogFileManager manager = new CatalogFileManager(catalogPath, loader, provider, cache, tracer);
        cache.put(KEY, Map.of("cabecalho", EvaluationOutcome.ACTIVATE)).join();
        List<CompiledCatalog> notified = new ArrayList<>();
        manager.setReloadListener(notified::add);

        // When
        rewrite(V2);
        manager.checkForUpdates();

        // Then
        assertThat(provider.catalogFor("contestacao").modules()).hasSize(2);
        assertThat(cache.get(KEY).join()).isEmpty();
        assertThat(notified).hasSize(2);
        assertThat(notified.get(1).catalog().find("preliminar")).isPresent();
    }

    @Test
    void shouldKeepPreviousCatalogWhenReloadFails() throws IOException {
        // Given
        CatalogFileManager manager = new CatalogFileManager(catalogPath, loader, provider, cache, tracer);
        cache.put(KEY, Map.of("cabecalho", EvaluationOutcome.ACTIVATE)).join();

        // When
        rewrite("{\"document_type\": \"contestacao\", \"modules\": [");
        manager.checkForUpdates();

        // Then
        assertThat(provider.catalogFor("contestacao").modules()).hasSize(1);
        assertThat(manager.getActiveCatalog().catalog().modules()).hasSize(1);
        assertThat(cache.get(KEY).join()).isPresent();
    }

    @Test
    void shouldIgnoreUnchangedFile() throws IOException {
        // Given
        CatalogFileManager manager = new CatalogFileManager(catalogPath, loader, provider, cache, tracer);
        cache.put(KEY, Map.of("cabecalho", EvaluationOutcome.ACTIVATE)).join();

        // When
        manager.checkForUpdates();

        // Then
        assertThat(cache.get(KEY).join()).isPresent();
    }
}
