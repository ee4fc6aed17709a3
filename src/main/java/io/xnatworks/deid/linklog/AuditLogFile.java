/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Human-auditable TSV projection of the link log, one {@link LinkLogEntry} per line.
 *
 * <p>Appends are fsynced one entry at a time. A final line without its newline is
 * a torn append from a crash and is dropped on load; {@link #rewrite(List)} then
 * replaces the file through a temp file and an atomic rename.</p>
 */
class AuditLogFile {
    private static final Logger log = LoggerFactory.getLogger(AuditLogFile.class);

    private final Path path;
    private boolean tornTail;

    AuditLogFile(Path path) {
        this.path = path;
    }

    Path getPath() {
        return path;
    }

    /**
     * True if the last {@link #load()} dropped an incomplete final line.
     */
    boolean hadTornTail() {
        return tornTail;
    }

    /**
     * Read every complete entry.
     *
     * @throws CorruptLogException if a complete line is not a valid entry
     */
    List<LinkLogEntry> load() {
        tornTail = false;
        List<LinkLogEntry> entries = new ArrayList<>();
        if (!Files.exists(path)) {
            return entries;
        }

        String content;
        try {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorruptLogException("Cannot read link log " + path + ": " + e.getMessage(), e);
        }

        int lineNumber = 0;
        int start = 0;
        while (start < content.length()) {
            int end = content.indexOf('\n', start);
            if (end < 0) {
                log.warn("Discarding incomplete final line of {} (interrupted write)", path);
                tornTail = true;
                break;
            }
            lineNumber++;
            String line = content.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            start = end + 1;
            if (line.isBlank()) {
                continue;
            }
            LinkLogEntry entry = LinkLogEntry.parse(line);
            if (entry == null) {
                throw new CorruptLogException("Malformed link log line " + lineNumber + " in " + path);
            }
            entries.add(entry);
        }
        return entries;
    }

    /**
     * Append one entry and force it to disk.
     */
    synchronized void append(LinkLogEntry entry) throws IOException {
        byte[] bytes = entry.toLine().getBytes(StandardCharsets.UTF_8);
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    /**
     * Replace the whole file with the given entries.
     */
    synchronized void rewrite(List<LinkLogEntry> entries) throws IOException {
        StringBuilder content = new StringBuilder();
        for (LinkLogEntry entry : entries) {
            content.append(entry.toLine());
        }

        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(temp,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content.toString().getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }

        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        tornTail = false;
    }
}
