package com.raidxp.service.ingestion;

import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tails one growing text file.
 *
 * <p>The cursor starts at the end of the file as it is when the tailer opens;
 * earlier content is never replayed. Only newline-terminated lines are returned;
 * a trailing partial line waits until its newline arrives. If the file shrinks
 * below the cursor, or the path now names a different file, the cursor is reset
 * to the current end of the file. Lines lost that way are not recovered.
 *
 * <p>Not thread-safe; owned by a single ingestion worker.
 */
public class FileTailer implements LineSource {
    private static final Logger logger = Logger.getLogger(FileTailer.class.getName());

    private static final int CHUNK_SIZE = 8192;

    private final Path path;
    private final Counter resets;

    private RandomAccessFile file;
    private Object fileKey;
    private long position;
    private long pendingLength = -1;

    /**
     * Opens the file, creating it if missing, with the cursor at its end.
     */
    public FileTailer(Path path, MetricsRegistry metrics) throws IOException {
        this.path = path;
        this.resets = metrics.counter("source_resets_total");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!Files.exists(path)) {
            Files.createFile(path);
        }
        open();
        logger.info("Tailing " + path + " from offset " + position);
    }

    @Override
    public Optional<String> poll() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        if (discontinuity()) {
            long previous = position;
            reopen();
            resets.increment();
            logger.warning(String.format("Log source %s was truncated or replaced; cursor reset from %d to %d",
                    path, previous, position));
            return Optional.empty();
        }
        return readLine();
    }

    @Override
    public void acknowledge() {
        if (pendingLength >= 0) {
            position += pendingLength;
            pendingLength = -1;
        }
    }

    /** Byte offset of the cursor. */
    public long position() {
        return position;
    }

    @Override
    public void close() throws IOException {
        if (file != null) {
            file.close();
            file = null;
        }
    }

    private boolean discontinuity() throws IOException {
        Object currentKey = Files.readAttributes(path, BasicFileAttributes.class).fileKey();
        if (currentKey != null && fileKey != null && !Objects.equals(currentKey, fileKey)) {
            return true;
        }
        return Files.size(path) < position;
    }

    private Optional<String> readLine() throws IOException {
        long length = file.length();
        if (length <= position) {
            return Optional.empty();
        }

        ByteArrayOutputStream line = new ByteArrayOutputStream();
        byte[] chunk = new byte[CHUNK_SIZE];
        long offset = position;
        file.seek(offset);
        while (offset < length) {
            int read = file.read(chunk, 0, (int) Math.min(chunk.length, length - offset));
            if (read < 0) {
                break;
            }
            for (int i = 0; i < read; i++) {
                if (chunk[i] == '\n') {
                    line.write(chunk, 0, i);
                    pendingLength = offset - position + i + 1;
                    return Optional.of(decode(line.toByteArray()));
                }
            }
            line.write(chunk, 0, read);
            offset += read;
        }
        // partial line, wait for its terminator
        pendingLength = -1;
        return Optional.empty();
    }

    private static String decode(byte[] bytes) {
        int end = bytes.length;
        if (end > 0 && bytes[end - 1] == '\r') {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    private void open() throws IOException {
        file = new RandomAccessFile(path.toFile(), "r");
        fileKey = Files.readAttributes(path, BasicFileAttributes.class).fileKey();
        position = file.length();
        pendingLength = -1;
    }

    private void reopen() throws IOException {
        try {
            close();
        } catch (IOException e) {
            logger.log(Level.FINE, "Failed to close replaced log source " + path, e);
        }
        open();
    }
}
