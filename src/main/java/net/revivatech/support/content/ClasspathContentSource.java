package net.revivatech.support.content;

import com.github.benmanes.caffeine.cache.Cache;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import net.revivatech.config.CacheFactory;
import net.revivatech.domain.content.ContentEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Content bundled with the application under {@code content/<locale>/<file>.json}.
 *
 * <p>The first key segment names the file, the remaining segments walk the JSON
 * object: {@code home.hero.title} reads {@code hero.title} from {@code home.json}.
 * Parsed locales are cached. Locales that are not plain language tags such as
 * {@code en} or {@code pt-br} never reach the resource resolver and hold no content.
 */
@Component
@Order(20)
public class ClasspathContentSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathContentSource.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private static final Pattern LOCALE_TAG = Pattern.compile("[a-z]{2,3}(-[a-z]{2})?");
    private static final int MAX_CACHED_LOCALES = 16;
    private static final Duration LOCALE_TREE_TTL = Duration.ofHours(12);

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resourceResolver;
    private final String baseLocation;
    private final Cache<String, Map<String, Object>> localeTrees;

    @Autowired
    public ClasspathContentSource(ObjectMapper objectMapper, CacheFactory cacheFactory) {
        this(objectMapper, new PathMatchingResourcePatternResolver(), "content", cacheFactory);
    }

    public ClasspathContentSource(ObjectMapper objectMapper, ResourcePatternResolver resourceResolver,
                                  String baseLocation, CacheFactory cacheFactory) {
        this.objectMapper = objectMapper;
        this.resourceResolver = resourceResolver;
        this.baseLocation = baseLocation;
        this.localeTrees = cacheFactory.createCache("classpathContent", MAX_CACHED_LOCALES, LOCALE_TREE_TTL);
    }

    static boolean isLocaleTag(String locale) {
        return locale != null && LOCALE_TAG.matcher(locale).matches();
    }

    @Override
    public String name() {
        return "classpath";
    }

    @Override
    public Mono<Boolean> exists(String key, String locale) {
        return tree(locale).map(tree -> ContentTrees.lookup(tree, key) != null);
    }

    @Override
    public Mono<ContentEntry> load(String key, String locale) {
        return tree(locale).flatMap(tree -> Mono.justOrEmpty(ContentTrees.lookup(tree, key)))
            .map(ContentEntry::fromRaw);
    }

    @Override
    public Mono<Map<String, Object>> loadNamespace(String namespace, String locale) {
        return tree(locale).map(tree -> {
            if (namespace == null || namespace.isEmpty()) {
                return tree;
            }
            Object subtree = ContentTrees.lookup(tree, namespace);
            return ContentTrees.asMap(subtree);
        });
    }

    private Mono<Map<String, Object>> tree(String locale) {
        if (!isLocaleTag(locale)) {
            log.debug("Ignoring content lookup for malformed locale {}", locale);
            return Mono.just(Map.of());
        }
        Map<String, Object> cached = localeTrees.getIfPresent(locale);
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.fromCallable(() -> readLocale(locale))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(tree -> localeTrees.put(locale, tree));
    }

    private Map<String, Object> readLocale(String locale) throws IOException {
        Resource[] resources = resourceResolver.getResources("classpath*:" + baseLocation + "/" + locale + "/*.json");
        Map<String, Object> tree = new LinkedHashMap<>();
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null) {
                continue;
            }
            try (InputStream input = resource.getInputStream()) {
                tree.put(filename.substring(0, filename.length() - ".json".length()), objectMapper.readValue(input, JSON_OBJECT));
            }
        }
        log.debug("Loaded {} content files for locale {}", tree.size(), locale);
        return Collections.unmodifiableMap(tree);
    }
}
