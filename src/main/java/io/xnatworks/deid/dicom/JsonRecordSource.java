/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.dicom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Record codec for JSON tag files: one JSON object per record, keyed by DICOM
 * keyword. Arrays are read as multi-valued attributes and joined with the DICOM
 * backslash delimiter. Nested objects (sequences) are not carried.
 *
 * <p>Writes go to a temp file in the target directory first and are then linked
 * into place, so a crash never leaves a truncated record under the final name and
 * an existing record is never replaced.</p>
 */
public class JsonRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordSource.class);

    public static final String EXTENSION = ".json";
    static final String TEMP_PREFIX = ".deid-";

    private final ObjectMapper mapper;

    public JsonRecordSource() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public boolean accepts(Path path) {
        String name = path.getFileName().toString();
        return !name.startsWith(".") && name.toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    @Override
    public RecordTags readTags(Path path) throws UnreadableRecordException {
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UnreadableRecordException(path, "Not a readable record: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new UnreadableRecordException(path, "Record is not a JSON object");
        }

        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (node.isNull()) {
                continue;
            }
            if (node.isArray()) {
                List<String> parts = new ArrayList<>();
                for (JsonNode element : node) {
                    parts.add(element.isNull() ? "" : element.asText());
                }
                values.put(field.getKey(), String.join("\\", parts));
            } else if (node.isValueNode()) {
                values.put(field.getKey(), node.asText());
            } else {
                log.debug("Ignoring nested attribute {} in {}", field.getKey(), path);
            }
        }
        return new RecordTags(values);
    }

    @Override
    public long writeRecord(Path target, Map<String, String> attributes) throws IOException {
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        byte[] bytes = serialize(attributes);

        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(TEMP_PREFIX + UUID.randomUUID() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW)) {
                out.write(bytes);
            }
            publish(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        return bytes.length;
    }

    /**
     * Move a completed temp file to its final name without ever replacing an existing file.
     */
    private void publish(Path temp, Path target) throws IOException {
        try {
            Files.createLink(target, temp);
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (UnsupportedOperationException | FileSystemException e) {
            log.debug("Hard link unavailable for {}, using rename", target);
            Files.move(temp, target);
        }
    }

    @Override
    public long estimateSize(Map<String, String> attributes) {
        return serialize(attributes).length;
    }

    @Override
    public String getFileExtension() {
        return EXTENSION;
    }

    private byte[] serialize(Map<String, String> attributes) {
        try {
            return mapper.writeValueAsBytes(attributes);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
