package com.lexis.activation.planner.management;

import com.lexis.activation.compiler.CompiledCatalog;
import com.lexis.activation.compiler.InMemoryModuleCatalogProvider;
import com.lexis.activation.compiler.ModuleCatalogLoader;
import com.lexis.activation.infra.cache.VerdictCache;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps one document type's catalog in sync with its JSON file.
 *
 * <p>On every successful load the new catalog replaces the old one in the provider and
 * the verdict cache entries of that document type are dropped, since cached verdicts
 * were given for module definitions that may have changed. A load that fails keeps the
 * previous catalog active.
 */
public class CatalogFileManager {
    private static final Logger logger = Logger.getLogger(CatalogFileManager.class.getName());

    private final Path catalogPath;
    private final ModuleCatalogLoader loader;
    private final InMemoryModuleCatalogProvider provider;
    private final VerdictCache cache;
    private final Tracer tracer;
    private final ScheduledExecutorService monitoringExecutor;

    private final AtomicReference<CompiledCatalog> active = new AtomicReference<>();
    private volatile long lastModifiedTime = -1;
    private volatile Consumer<CompiledCatalog> reloadListener;

    /**
     * Loads the file once; a catalog that cannot be loaded at startup fails fast.
     */
    public CatalogFileManager(Path catalogPath, ModuleCatalogLoader loader, InMemoryModuleCatalogProvider provider,
                              VerdictCache cache, Tracer tracer) throws IOException {
        this.catalogPath = catalogPath;
        this.loader = loader;
        this.provider = provider;
        this.cache = cache;
        this.tracer = tracer;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Catalog-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reload();
    }

    public CompiledCatalog getActiveCatalog() {
        return active.get();
    }

    /**
     * Called after each successful load, e.g. to hand conditional variables to the planner.
     */
    public void setReloadListener(Consumer<CompiledCatalog> listener) {
        this.reloadListener = listener;
        CompiledCatalog current = active.get();
        if (listener != null && current != null) {
            listener.accept(current);
        }
    }

    public void start(long periodSeconds) {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, periodSeconds, periodSeconds, TimeUnit.SECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-catalog-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("catalogFile", catalogPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(catalogPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in " + catalogPath + ". Attempting to reload...");
                reload();
            }
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Failed to reload " + catalogPath + ". Previous catalog remains active.", e);
        } finally {
            span.end();
        }
    }

    /**
     * Loads the file now, regardless of its modification time.
     */
    public void reload() throws IOException {
        Span span = tracer.spanBuilder("reload-catalog").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(catalogPath).toMillis();
            CompiledCatalog compiled = loader.load(catalogPath);
            String documentType = compiled.catalog().documentType();

            CompiledCatalog previous = active.getAndSet(compiled);
            provider.register(compiled);
            this.lastModifiedTime = modifiedTime;
            if (previous != null) {
                cache.invalidateDocumentType(documentType).join();
                if (!previous.catalog().documentType().equals(documentType)) {
                    cache.invalidateDocumentType(previous.catalog().documentType()).join();
                }
            }
            span.setAttribute("documentType", documentType);
            span.setAttribute("moduleCount", compiled.catalog().modules().size());
            logger.info("Catalog '" + documentType + "' active with " + compiled.catalog().modules().size() + " modules");

            Consumer<CompiledCatalog> listener = reloadListener;
            if (listener != null) {
                listener.accept(compiled);
            }
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
