package com.decisiontrace.export;

import com.decisiontrace.TestRecords;
import com.decisiontrace.contract.DecisionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonlFileExporterTest {

    @TempDir
    Path dir;

    private RecordCodec codec;

    @BeforeEach
    void setUp() {
        codec = new RecordCodec();
    }

    @Test
    @DisplayName("Each append is readable as one line immediately")
    void append_writesOneLinePerRecord() throws Exception {
        Path file = dir.resolve("nested/trace.jsonl");
        JsonlFileExporter exporter = new JsonlFileExporter(file, codec, true);

        exporter.append(TestRecords.record("d-1", TestRecords.T0));
        exporter.append(TestRecords.record("d-2", TestRecords.T0.plusSeconds(1), "d-1"));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("d-2", codec.decode(lines.get(1)).decisionId());
        exporter.close();
    }

    @Test
    @DisplayName("Concurrent appends never interleave")
    void concurrentAppends_produceWholeLines() throws Exception {
        Path file = dir.resolve("trace.jsonl");
        JsonlFileExporter exporter = new JsonlFileExporter(file, codec, false);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String id = "d-" + i;
            futures.add(pool.submit(() -> {
                exporter.append(TestRecords.record(id, TestRecords.T0));
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();
        exporter.close();

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(200, lines.size());
        Set<String> ids = new HashSet<>();
        for (String line : lines) {
            DecisionRecord record = codec.decode(line);
            ids.add(record.decisionId());
        }
        assertEquals(200, ids.size());
    }

    @Test
    void appendAfterClose_fails() throws Exception {
        JsonlFileExporter exporter = new JsonlFileExporter(dir.resolve("trace.jsonl"), codec, false);
        exporter.append(TestRecords.record("d-1", TestRecords.T0));
        exporter.close();
        exporter.close();

        ExportException ex = assertThrows(ExportException.class,
            () -> exporter.append(TestRecords.record("d-2", TestRecords.T0)));
        assertEquals(exporter.name(), ex.getExporterName());
    }

    @Test
    void existingFile_isAppendedTo() throws Exception {
        Path file = dir.resolve("trace.jsonl");
        Files.writeString(file, codec.encode(TestRecords.record("d-0", TestRecords.T0)) + "\n");

        JsonlFileExporter exporter = new JsonlFileExporter(file, codec, false);
        exporter.append(TestRecords.record("d-1", TestRecords.T0));
        exporter.flush();
        exporter.close();

        assertEquals(2, Files.readAllLines(file).size());
    }
}
