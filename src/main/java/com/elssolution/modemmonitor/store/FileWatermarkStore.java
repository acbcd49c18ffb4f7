package com.elssolution.modemmonitor.store;

import com.elssolution.modemmonitor.domain.Watermark;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Watermark as a small JSON document:
 * <pre>{"timestamp":"2024-03-05T14:02:11","index":42}</pre>
 * Writes go to a sibling temp file first and are then moved over the target.
 */
@Slf4j
public class FileWatermarkStore implements WatermarkStore {

    private final Path file;
    private final ObjectMapper mapper;

    public FileWatermarkStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public Optional<Watermark> load() {
        String body;
        try {
            body = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.info("watermark_file_absent path={}; starting cold", file);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("watermark_file_unreadable path={} err={}; starting cold", file, e.toString());
            return Optional.empty();
        }

        try {
            JsonNode root = mapper.readTree(body);
            JsonNode ts = root == null ? null : root.get("timestamp");
            JsonNode idx = root == null ? null : root.get("index");
            if (ts == null || !ts.isTextual() || idx == null || !idx.canConvertToLong()) {
                log.warn("watermark_file_corrupt path={} content='{}'; starting cold", file, abbreviate(body));
                return Optional.empty();
            }
            Watermark w = new Watermark(LocalDateTime.parse(ts.asText()), idx.asLong());
            log.debug("watermark_loaded {}", w);
            return Optional.of(w);
        } catch (IOException | DateTimeParseException e) {
            log.warn("watermark_file_corrupt path={} err={}; starting cold", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void save(Watermark watermark) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        ObjectNode node = mapper.createObjectNode();
        node.put("timestamp", watermark.timestamp().toString());
        node.put("index", watermark.index());

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, mapper.writeValueAsString(node), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("watermark_saved {} path={}", watermark, file);
    }

    @Override public String describe() { return "file " + file.toAbsolutePath(); }

    private static String abbreviate(String s) {
        String t = s.strip();
        return t.length() <= 80 ? t : t.substring(0, 80) + "...";
    }
}
