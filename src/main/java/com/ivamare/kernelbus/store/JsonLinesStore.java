package com.ivamare.kernelbus.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.kernelbus.exception.AuditStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only store of JSON records, one per line.
 *
 * <p>Each append writes a complete line (record + newline) in one call and
 * forces it to disk before returning. Readers ignore a trailing line that has
 * no newline yet, so a read racing an append sees either the old or the new
 * tail, never a half-written record. A trailing line left by an interrupted
 * write is truncated before the next append. The file and its parent
 * directories are created owner-only.
 *
 * @param <T> record type
 */
public class JsonLinesStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Class<T> recordType;

    public JsonLinesStore(Path path, ObjectMapper objectMapper, Class<T> recordType) {
        this.path = Objects.requireNonNull(path, "path");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.recordType = Objects.requireNonNull(recordType, "recordType");
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Append one record.
     *
     * @param record The record
     * @throws AuditStorageException if the record cannot be serialized or written
     */
    public synchronized void append(T record) {
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new AuditStorageException(path, "Cannot serialize " + recordType.getSimpleName(), e);
        }

        try {
            createIfMissing();
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                truncateIncompleteTail(channel);
                channel.position(channel.size());
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new AuditStorageException(path, "Cannot append to store", e);
        }
    }

    /**
     * Read every complete record.
     *
     * @return records in file order; empty if the file does not exist
     * @throws AuditStorageException if the file cannot be read or a line cannot be parsed
     */
    public List<T> readAll() {
        if (!Files.exists(path)) {
            return List.of();
        }

        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AuditStorageException(path, "Cannot read store", e);
        }

        String[] lines = content.split("\n", -1);
        // The last element is either "" (content ends with a newline) or an unterminated line
        int complete = lines.length - 1;
        if (!lines[complete].isEmpty()) {
            log.debug("Ignoring unterminated trailing line in {}", path);
        }

        List<T> records = new ArrayList<>(complete);
        for (int i = 0; i < complete; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, recordType));
            } catch (JsonProcessingException e) {
                throw new AuditStorageException(path, "Corrupt record at line " + (i + 1), e);
            }
        }
        return records;
    }

    /**
     * Cut the file back to the end of its last complete line.
     */
    private void truncateIncompleteTail(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0 || byteAt(channel, size - 1) == '\n') {
            return;
        }

        long end = size - 1;
        while (end > 0 && byteAt(channel, end - 1) != '\n') {
            end--;
        }
        log.warn("Truncating {} bytes of an incomplete record at the end of {}", size - end, path);
        channel.truncate(end);
        channel.force(true);
    }

    private static byte byteAt(FileChannel channel, long position) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(1);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, position + buffer.position()) < 0) {
                throw new EOFException("Unexpected end of file at " + position);
            }
        }
        return buffer.get(0);
    }

    /**
     * Create missing parent directories owner-only (where the file system supports POSIX permissions).
     */
    public static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.createDirectories(parent, PosixFilePermissions.asFileAttribute(
                PosixFilePermissions.fromString("rwx------")));
        } else {
            Files.createDirectories(parent);
        }
    }

    private void createIfMissing() throws IOException {
        if (Files.exists(path)) {
            return;
        }
        createParentDirectories(path);
        try {
            if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.createFile(path, PosixFilePermissions.asFileAttribute(
                    PosixFilePermissions.fromString("rw-------")));
            } else {
                Files.createFile(path);
            }
            log.info("Created store {}", path);
        } catch (FileAlreadyExistsException e) {
            log.debug("Store {} created concurrently", path);
        }
    }
}
