package im.arun.contenttree.export;

/**
 * Cooperative cancellation flag checked by exporters between batches.
 */
public class CancellationToken {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new ExportCancelledException("Export cancelled");
        }
    }
}
