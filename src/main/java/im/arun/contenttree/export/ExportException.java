package im.arun.contenttree.export;

/**
 * Raised when a serializer cannot produce its payload.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
