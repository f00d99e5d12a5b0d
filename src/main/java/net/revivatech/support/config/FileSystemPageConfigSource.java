package net.revivatech.support.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.exception.PageConfigReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Page configurations edited on disk, consulted before the bundled ones. Inactive when
 * {@code pages.config-directory} is blank.
 */
@Component
@Order(10)
public class FileSystemPageConfigSource implements PageConfigSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemPageConfigSource.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };
    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;
    private final Path directory;

    @Autowired
    public FileSystemPageConfigSource(ObjectMapper objectMapper, PageEngineProperties properties) {
        this(objectMapper, StringUtils.hasText(properties.getConfigDirectory())
            ? Path.of(properties.getConfigDirectory())
            : null);
    }

    public FileSystemPageConfigSource(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory == null ? null : directory.toAbsolutePath().normalize();
        if (this.directory != null) {
            log.info("Reading page configurations from {}", this.directory);
        }
    }

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public Mono<Map<String, Object>> read(String path) {
        if (directory == null) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
                Path file = directory.resolve(path + EXTENSION).normalize();
                if (!file.startsWith(directory) || !Files.isRegularFile(file)) {
                    return null;
                }
                try (InputStream input = Files.newInputStream(file)) {
                    return objectMapper.readValue(input, JSON_OBJECT);
                } catch (IOException | JacksonException readFailure) {
                    throw new PageConfigReadException(path, readFailure);
                }
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<String> listPaths() {
        if (directory == null || !Files.isDirectory(directory)) {
            return Flux.empty();
        }
        return Mono.fromCallable(this::scan)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapMany(Flux::fromIterable);
    }

    private List<String> scan() throws IOException {
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                .filter(Files::isRegularFile)
                .map(file -> directory.relativize(file).toString().replace('\\', '/'))
                .filter(relative -> relative.endsWith(EXTENSION))
                .map(relative -> relative.substring(0, relative.length() - EXTENSION.length()))
                .toList();
        }
    }
}
