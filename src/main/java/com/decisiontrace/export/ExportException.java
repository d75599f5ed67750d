package com.decisiontrace.export;

/**
 * A specific exporter failed to durably append (or flush, or close).
 * Raised per exporter; it never stops delivery to the other exporters of a scope.
 */
public class ExportException extends Exception {

    private final String exporterName;

    public ExportException(String exporterName, String message) {
        super(exporterName + ": " + message);
        this.exporterName = exporterName;
    }

    public ExportException(String exporterName, String message, Throwable cause) {
        super(exporterName + ": " + message, cause);
        this.exporterName = exporterName;
    }

    public String getExporterName() {
        return exporterName;
    }
}
