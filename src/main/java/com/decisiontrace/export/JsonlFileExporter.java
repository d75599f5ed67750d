package com.decisiontrace.export;

import com.decisiontrace.contract.DecisionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends one JSON line per record to a file.
 *
 * Each line is written in full through a {@link FileChannel} while holding the
 * exporter lock, so concurrent appends never interleave and nothing sits in a
 * user-space buffer after {@code append} returns. With {@code syncOnAppend} the
 * channel is also forced to the storage device on every append; without it the
 * loss window is whatever the OS has not yet written back.
 */
public class JsonlFileExporter implements RecordExporter {

    private static final Logger log = LoggerFactory.getLogger(JsonlFileExporter.class);

    private final Path path;
    private final RecordCodec codec;
    private final boolean syncOnAppend;
    private final ReentrantLock lock = new ReentrantLock();

    private FileChannel channel;
    private boolean closed;

    public JsonlFileExporter(Path path, RecordCodec codec, boolean syncOnAppend) {
        this.path = path;
        this.codec = codec;
        this.syncOnAppend = syncOnAppend;
    }

    @Override
    public String name() {
        return "jsonl:" + path;
    }

    public Path path() {
        return path;
    }

    @Override
    public void append(DecisionRecord record) throws ExportException {
        String line;
        try {
            line = codec.encode(record) + "\n";
        } catch (RecordFormatException ex) {
            throw new ExportException(name(), ex.getMessage(), ex);
        }
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));

        lock.lock();
        try {
            FileChannel out = openChannel();
            while (buffer.hasRemaining()) {
                out.write(buffer);
            }
            if (syncOnAppend) {
                out.force(false);
            }
        } catch (IOException ex) {
            throw new ExportException(name(), "append of decision " + record.decisionId() + " failed", ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() throws ExportException {
        lock.lock();
        try {
            if (channel != null && channel.isOpen()) {
                channel.force(false);
            }
        } catch (IOException ex) {
            throw new ExportException(name(), "flush failed", ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() throws ExportException {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (channel != null) {
                channel.force(false);
                channel.close();
                log.info("Closed decision trace sink {}", path);
            }
        } catch (IOException ex) {
            throw new ExportException(name(), "close failed", ex);
        } finally {
            lock.unlock();
        }
    }

    private FileChannel openChannel() throws IOException, ExportException {
        if (closed) {
            throw new ExportException(name(), "exporter is closed");
        }
        if (channel == null) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            log.info("Opened decision trace sink {}", path);
        }
        return channel;
    }
}
