package com.decisiontrace.tracer;

import com.decisiontrace.export.ExportException;

/**
 * One exporter that did not durably accept a record.
 */
public record ExportFailure(
    String exporterName,
    String message,
    Exception cause
) {

    static ExportFailure of(ExportException ex) {
        return new ExportFailure(ex.getExporterName(), ex.getMessage(), ex);
    }
}
