package net.revivatech.support.content;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import net.revivatech.domain.content.ContentEntry;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Editable content held in memory. Consulted before bundled files so edits made at
 * runtime override them.
 */
@Component
@Order(10)
public class InMemoryContentSource implements ContentSource {

    private final Map<String, Map<String, Object>> valuesByLocale = new ConcurrentHashMap<>();

    public void put(String key, String locale, Object value) {
        valuesByLocale.computeIfAbsent(locale, ignored -> new ConcurrentHashMap<>()).put(key, value);
    }

    public void remove(String key, String locale) {
        Map<String, Object> values = valuesByLocale.get(locale);
        if (values != null) {
            values.remove(key);
        }
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Mono<Boolean> exists(String key, String locale) {
        return Mono.just(valuesByLocale.getOrDefault(locale, Map.of()).containsKey(key));
    }

    @Override
    public Mono<ContentEntry> load(String key, String locale) {
        return Mono.justOrEmpty(valuesByLocale.getOrDefault(locale, Map.of()).get(key))
            .map(ContentEntry::fromRaw);
    }

    /**
     * Entries whose key starts with {@code namespace.}, keyed by the remaining suffix.
     */
    @Override
    public Mono<Map<String, Object>> loadNamespace(String namespace, String locale) {
        String prefix = namespace == null || namespace.isEmpty() ? "" : namespace + ".";
        Map<String, Object> result = new LinkedHashMap<>();
        valuesByLocale.getOrDefault(locale, Map.of()).forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                result.put(key.substring(prefix.length()), value);
            }
        });
        return Mono.just(result);
    }
}
