package im.arun.contenttree.export;

public class ExportCancelledException extends RuntimeException {

    public ExportCancelledException(String message) {
        super(message);
    }
}
