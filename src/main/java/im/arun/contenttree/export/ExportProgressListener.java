package im.arun.contenttree.export;

/**
 * Receives the cumulative percentage (0-100) after every export batch.
 */
@FunctionalInterface
public interface ExportProgressListener {

    ExportProgressListener NONE = percent -> { };

    void onProgress(int percent);
}
