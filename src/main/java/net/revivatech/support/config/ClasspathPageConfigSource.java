package net.revivatech.support.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.exception.PageConfigReadException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Page configurations bundled under {@code <config-location>/<path>.json} on the classpath.
 */
@Component
@Order(20)
public class ClasspathPageConfigSource implements PageConfigSource {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };
    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resourceResolver;
    private final String location;

    @Autowired
    public ClasspathPageConfigSource(ObjectMapper objectMapper, PageEngineProperties properties) {
        this(objectMapper, new PathMatchingResourcePatternResolver(), properties.getConfigLocation());
    }

    public ClasspathPageConfigSource(ObjectMapper objectMapper, ResourcePatternResolver resourceResolver, String location) {
        this.objectMapper = objectMapper;
        this.resourceResolver = resourceResolver;
        this.location = location;
    }

    @Override
    public String name() {
        return "classpath";
    }

    @Override
    public Mono<Map<String, Object>> read(String path) {
        return Mono.fromCallable(() -> {
                Resource resource = resourceResolver.getResource("classpath:" + location + "/" + path + EXTENSION);
                if (!resource.exists()) {
                    return null;
                }
                try (InputStream input = resource.getInputStream()) {
                    return objectMapper.readValue(input, JSON_OBJECT);
                } catch (IOException | JacksonException readFailure) {
                    throw new PageConfigReadException(path, readFailure);
                }
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<String> listPaths() {
        return Mono.fromCallable(this::scan)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapMany(Flux::fromIterable);
    }

    private List<String> scan() throws IOException {
        String marker = "/" + location + "/";
        List<String> paths = new ArrayList<>();
        for (Resource resource : resourceResolver.getResources("classpath*:" + location + "/**/*" + EXTENSION)) {
            String url = resource.getURL().getPath();
            int start = url.lastIndexOf(marker);
            if (start < 0) {
                continue;
            }
            String relative = url.substring(start + marker.length());
            paths.add(relative.substring(0, relative.length() - EXTENSION.length()));
        }
        return paths;
    }
}
