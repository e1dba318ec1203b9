package org.politia.warehouse.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.politia.warehouse.error.UnitProcessingException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Shared plumbing for readers whose units are single JSON files in a directory.
 */
@Slf4j
public abstract class AbstractJsonSourceReader {

    private static final String UNIT_EXTENSION = ".json";

    protected final ObjectMapper objectMapper;

    protected AbstractJsonSourceReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Lists the unit files of a directory in name order. A missing or unreadable directory yields
     * no units.
     */
    public List<Path> discover(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("{} data path not found: {}", sourceName(), directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(UNIT_EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Could not list {} data path {}", sourceName(), directory, e);
            return List.of();
        }
    }

    /**
     * Unit identity used in logs and events: the file name without its extension.
     */
    public String unitId(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(UNIT_EXTENSION) ? name.substring(0, name.length() - UNIT_EXTENSION.length()) : name;
    }

    protected JsonNode readTree(Path file) {
        try {
            return objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new UnitProcessingException(unitId(file), "Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UnitProcessingException(unitId(file), "Could not read " + file, e);
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").strip();
    }

    protected abstract String sourceName();
}
