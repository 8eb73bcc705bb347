package com.session.pooling.config;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link ConfigStore} keeping one JSON document per target in a directory.
 *
 * <p>Files are named {@code <encoded-target>.json}; the target is URL-safe encoded so
 * identifiers containing path separators stay inside the directory. Writes go to a
 * temporary file first and are moved into place.</p>
 *
 * <pre>
 * {
 *   "enabled" : true,
 *   "strategy" : "round_robin",
 *   "min_size" : 1,
 *   "max_size" : 10,
 *   "target_size" : 2,
 *   "acquire_timeout" : "PT30S",
 *   ...
 * }
 * </pre>
 */
public class JsonFileConfigStore implements ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileConfigStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileConfigStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot create config directory " + directory, e);
        }
    }

    @Override
    public Optional<PoolConfig> load(String target) {
        Path file = fileFor(target);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public synchronized void save(String target, PoolConfig config) {
        Path file = fileFor(target);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.write(tmp, objectMapper.writeValueAsBytes(config));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved pool config for target {} to {}", target, file);
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot save config for target " + target, e);
        }
    }

    @Override
    public synchronized void delete(String target) {
        try {
            Files.deleteIfExists(fileFor(target));
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot delete config for target " + target, e);
        }
    }

    @Override
    public Map<String, PoolConfig> loadAll() {
        Map<String, PoolConfig> result = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .forEach(p -> result.put(decode(p.getFileName().toString()), read(p)));
        } catch (IOException | UncheckedIOException e) {
            throw new ConfigStoreException("Cannot list configs in " + directory, e);
        }
        return result;
    }

    private PoolConfig read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), PoolConfig.class);
        } catch (JsonMappingException e) {
            if (e.getCause() instanceof ConfigValidationException cve) {
                throw cve;
            }
            throw new ConfigStoreException("Malformed pool config " + file, e);
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot read pool config " + file, e);
        }
    }

    private Path fileFor(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be null or blank");
        }
        return directory.resolve(encode(target) + SUFFIX);
    }

    private static String encode(String target) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(target.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(String fileName) {
        String encoded = fileName.substring(0, fileName.length() - SUFFIX.length());
        return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    }
}
