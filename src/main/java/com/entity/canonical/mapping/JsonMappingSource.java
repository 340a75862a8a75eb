package com.entity.canonical.mapping;

import com.entity.canonical.core.MappingLoadException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Reads mappings from {@code <root>/<entityType>/mapping.json}, each file a
 * JSON array of record objects:
 *
 * <pre>
 * [
 *   {"id": "city_1", "cname": "Seattle", "whitelist": ["SEA", "Emerald City"]},
 *   {"id": "city_2", "cname": "Portland"}
 * ]
 * </pre>
 */
public class JsonMappingSource implements MappingSource {
    private static final Logger log = LoggerFactory.getLogger(JsonMappingSource.class);

    public static final String MAPPING_FILE = "mapping.json";

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final Path root;
    private final ObjectMapper objectMapper;

    public JsonMappingSource(Path root) {
        this(root, new ObjectMapper());
    }

    public JsonMappingSource(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MappingLoadException if the type does not name a directory directly under the root
     */
    public Path mappingFile(String entityType) {
        Path dir = root.resolve(entityType).normalize();
        if (!root.equals(dir.getParent())) {
            throw new MappingLoadException("Invalid entity type '" + entityType + "'");
        }
        return dir.resolve(MAPPING_FILE);
    }

    @Override
    public List<Map<String, Object>> load(String entityType) {
        Path file = mappingFile(entityType);
        if (!Files.isRegularFile(file)) {
            throw new MappingLoadException("Mapping file not found for entity type '" + entityType + "': " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            List<Map<String, Object>> records = objectMapper.readValue(in, RECORDS);
            if (records == null) {
                throw new MappingLoadException("Mapping file is empty: " + file);
            }
            log.debug("mapping.loaded type={} records={} file={}", entityType, records.size(), file);
            return records;
        } catch (IOException e) {
            throw new MappingLoadException("Cannot read mapping for entity type '" + entityType + "': "
                    + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> entityTypes() {
        if (!Files.isDirectory(root)) {
            return Set.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            Set<String> types = new TreeSet<>();
            children.filter(dir -> Files.isRegularFile(dir.resolve(MAPPING_FILE)))
                    .forEach(dir -> types.add(dir.getFileName().toString()));
            return Collections.unmodifiableSet(types);
        } catch (IOException e) {
            throw new MappingLoadException("Cannot list mapping directory " + root, e);
        }
    }
}
