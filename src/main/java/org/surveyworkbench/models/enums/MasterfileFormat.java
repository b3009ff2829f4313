package org.surveyworkbench.models.enums;

import java.nio.file.Path;
import java.util.Locale;

public enum MasterfileFormat {
    CSV("csv"),
    XLS("xls"),
    XLSX("xlsx");

    private final String extension;

    MasterfileFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public boolean isSpreadsheet() {
        return this != CSV;
    }

    public static MasterfileFormat fromPath(Path path) {
        String filename = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String extension = dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (MasterfileFormat format : values()) {
            if (format.extension.equals(extension)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported file format! Please use .csv, .xls, or .xlsx");
    }
}
