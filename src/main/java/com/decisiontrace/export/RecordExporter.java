package com.decisiontrace.export;

import com.decisiontrace.contract.DecisionRecord;

/**
 * Append-only sink for finalized decision records.
 *
 * Implementations serialize concurrent {@link #append} calls themselves so a
 * sink never observes an interleaved partial record. For file-backed sinks a
 * record is durable once {@code append} returns.
 */
public interface RecordExporter extends AutoCloseable {

    /** Stable name used in delivery reports and logs. */
    String name();

    void append(DecisionRecord record) throws ExportException;

    void flush() throws ExportException;

    @Override
    void close() throws ExportException;
}
