package im.arun.contenttree.export;

import java.util.Locale;

public enum ExportFormat {
    CSV("csv"),
    JSON("json"),
    TEXT("txt");

    private final String fileExtension;

    ExportFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public static ExportFormat fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
