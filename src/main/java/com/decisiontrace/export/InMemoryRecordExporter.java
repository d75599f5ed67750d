package com.decisiontrace.export;

import com.decisiontrace.contract.DecisionRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every appended record in memory, in append order. Backs the HTTP read
 * endpoints and the tests.
 */
public class InMemoryRecordExporter implements RecordExporter {

    private final String name;
    private final CopyOnWriteArrayList<DecisionRecord> records = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public InMemoryRecordExporter() {
        this("in-memory");
    }

    public InMemoryRecordExporter(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void append(DecisionRecord record) throws ExportException {
        if (closed) {
            throw new ExportException(name, "exporter is closed");
        }
        records.add(record);
    }

    @Override
    public void flush() {
        // nothing buffered
    }

    @Override
    public void close() {
        closed = true;
    }

    /** Snapshot of the records appended so far. */
    public List<DecisionRecord> records() {
        return List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
