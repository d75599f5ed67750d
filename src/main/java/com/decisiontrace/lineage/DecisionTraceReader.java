package com.decisiontrace.lineage;

import com.decisiontrace.contract.DecisionRecord;
import com.decisiontrace.export.RecordCodec;
import com.decisiontrace.export.RecordFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a line-delimited JSON trace. Lines that cannot be decoded are returned
 * as {@link LoadError}s instead of being skipped; blank lines are ignored.
 */
public class DecisionTraceReader {

    private static final Logger log = LoggerFactory.getLogger(DecisionTraceReader.class);

    private final RecordCodec codec;

    public DecisionTraceReader(RecordCodec codec) {
        this.codec = codec;
    }

    public LoadResult read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /** Reads several trace files as one corpus. */
    public LoadResult readAll(List<Path> paths) throws IOException {
        List<DecisionRecord> records = new ArrayList<>();
        List<LoadError> errors = new ArrayList<>();
        for (Path path : paths) {
            LoadResult result = read(path);
            records.addAll(result.records());
            errors.addAll(result.errors());
        }
        return new LoadResult(records, errors);
    }

    public LoadResult parse(String content, String source) {
        try {
            return read(new StringReader(content), source);
        } catch (IOException ex) {
            // StringReader does not fail
            throw new IllegalStateException(ex);
        }
    }

    public LoadResult read(Reader input, String source) throws IOException {
        BufferedReader reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);
        List<DecisionRecord> records = new ArrayList<>();
        List<LoadError> errors = new ArrayList<>();

        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(codec.decode(line));
            } catch (RecordFormatException ex) {
                errors.add(new LoadError(source, lineNumber, ex.getMessage(), line));
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Loaded {} record(s) from {}; excluded {} malformed line(s)",
                records.size(), source, errors.size());
        } else {
            log.debug("Loaded {} record(s) from {}", records.size(), source);
        }
        return new LoadResult(records, errors);
    }
}
