package im.arun.contenttree.export;

import im.arun.contenttree.config.ContentTreeConfig;
import im.arun.contenttree.model.ContentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for the three serializers. Exports run on the caller's thread
 * or, through {@link #exportAsync}, on a pool of daemon threads owned by this
 * pipeline. The pool is started by the first background export and stopped
 * by {@link #close()}.
 */
public class ExportPipeline implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExportPipeline.class);
    private static final int MAX_EXPORT_THREADS = 8;

    private final Map<ExportFormat, BatchedExporter> exporters = new EnumMap<>(ExportFormat.class);
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final Object poolLock = new Object();
    private ExecutorService exportPool;
    private boolean closed;

    public ExportPipeline(ContentTreeConfig config) {
        TreeFlattener flattener = new TreeFlattener(config.getUntitledLabel());
        String separator = config.getBreadcrumbSeparator();
        int batchSize = config.getExportBatchSize();

        register(new CsvExporter(flattener, separator, batchSize));
        register(new SemanticJsonExporter(flattener, separator, batchSize, config.isPrettyJson()));
        register(new LineTextExporter(flattener, separator, batchSize));
    }

    private void register(BatchedExporter exporter) {
        exporters.put(exporter.getFormat(), exporter);
    }

    public String exportCsv(ContentNode root, ExportProgressListener listener) {
        return export(ExportFormat.CSV, root, listener, new CancellationToken());
    }

    public String exportSemanticJson(ContentNode root, ExportProgressListener listener) {
        return export(ExportFormat.JSON, root, listener, new CancellationToken());
    }

    public String exportLineText(ContentNode root, ExportProgressListener listener) {
        return export(ExportFormat.TEXT, root, listener, new CancellationToken());
    }

    public String export(ExportFormat format, ContentNode root, ExportProgressListener listener,
                         CancellationToken token) {
        logger.info("Starting {} export", format);
        long started = System.nanoTime();
        String payload = exporters.get(format).export(root, listener, token);
        logger.info("Finished {} export: {} chars in {} ms", format, payload.length(),
            (System.nanoTime() - started) / 1_000_000);
        return payload;
    }

    /**
     * Runs the export on the shared pool. Cancelling {@code token} makes the
     * future complete exceptionally with {@link ExportCancelledException}.
     */
    public CompletableFuture<String> exportAsync(ExportFormat format, ContentNode root,
                                                 ExportProgressListener listener, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> export(format, root, listener, token), exportPool());
    }

    private ExecutorService exportPool() {
        synchronized (poolLock) {
            if (closed) {
                throw new IllegalStateException("Export pipeline is closed");
            }
            if (exportPool == null) {
                int poolSize = Math.max(2, Math.min(Runtime.getRuntime().availableProcessors(), MAX_EXPORT_THREADS));
                logger.debug("Starting export pool with {} threads", poolSize);
                exportPool = Executors.newFixedThreadPool(poolSize, task -> {
                    Thread thread = new Thread(task, "content-tree-export-" + threadCounter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
            }
            return exportPool;
        }
    }

    /**
     * Stops accepting background exports. Exports already queued still run.
     */
    @Override
    public void close() {
        synchronized (poolLock) {
            closed = true;
            if (exportPool != null) {
                exportPool.shutdown();
                exportPool = null;
            }
        }
    }
}
