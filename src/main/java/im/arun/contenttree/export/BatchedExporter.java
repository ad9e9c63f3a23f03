package im.arun.contenttree.export;

import im.arun.contenttree.model.ContentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Template for the serializers: flatten once, then feed the entries to
 * an {@link ExportSession} in fixed-size batches. Between batches the exporter reports
 * cumulative progress, checks for cancellation and yields the thread.
 */
public abstract class BatchedExporter {
    private static final Logger logger = LoggerFactory.getLogger(BatchedExporter.class);

    protected final TreeFlattener flattener;
    protected final String breadcrumbSeparator;
    private final int batchSize;

    protected BatchedExporter(TreeFlattener flattener, String breadcrumbSeparator, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.flattener = flattener;
        this.breadcrumbSeparator = breadcrumbSeparator;
        this.batchSize = batchSize;
    }

    public abstract ExportFormat getFormat();

    public String export(ContentNode root) {
        return export(root, ExportProgressListener.NONE, new CancellationToken());
    }

    public String export(ContentNode root, ExportProgressListener listener, CancellationToken token) {
        Objects.requireNonNull(root, "root");
        ExportProgressListener progress = listener != null ? listener : ExportProgressListener.NONE;
        CancellationToken cancellation = token != null ? token : new CancellationToken();

        List<ExportEntry> entries = flattener.flatten(root);
        int total = entries.size();
        logger.debug("Exporting {} nodes as {} in batches of {}", total, getFormat(), batchSize);

        ExportSession session = begin(total);
        for (int start = 0; start < total; start += batchSize) {
            cancellation.throwIfCancelled();
            int end = Math.min(start + batchSize, total);
            for (ExportEntry entry : entries.subList(start, end)) {
                session.accept(entry);
            }
            progress.onProgress((int) Math.round(end * 100.0 / total));
            Thread.yield();
        }
        if (total == 0) {
            progress.onProgress(100);
        }
        return session.finish();
    }

    protected String breadcrumb(List<String> names) {
        return String.join(breadcrumbSeparator, names);
    }

    /**
     * Per-export mutable state. Exporter instances stay stateless so one
     * instance can serve concurrent exports.
     */
    protected abstract ExportSession begin(int totalEntries);

    protected interface ExportSession {
        void accept(ExportEntry entry);

        String finish();
    }
}
