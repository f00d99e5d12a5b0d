package net.revivatech.application.render;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.support.content.ContentLoader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Section props pipeline. Stages always run in this order:
 * <ol>
 *   <li>content: string values {@code content:<key>} are replaced by localized content,
 *       recursively through lists and maps; unresolved references stay literal</li>
 *   <li>conditional: {@code then:<c>} is promoted to {@code <c>} when {@code if:<c>} is
 *       active; both keys are always removed</li>
 *   <li>responsive: {@code <name>:<device>} is promoted to {@code <name>} for the
 *       context's device; every device variant is removed</li>
 *   <li>theme: {@code <name>_<theme>} is promoted for the active theme; every
 *       variant of a known theme is removed</li>
 * </ol>
 */
@Component
public class PropsTransformer {

    static final String CONTENT_PREFIX = "content:";
    static final String IF_PREFIX = "if:";
    static final String THEN_PREFIX = "then:";

    private final ContentLoader contentLoader;
    private final Set<String> themes;

    @Autowired
    public PropsTransformer(ContentLoader contentLoader, PageEngineProperties properties) {
        this(contentLoader, properties.getThemes());
    }

    public PropsTransformer(ContentLoader contentLoader, List<String> themes) {
        this.contentLoader = contentLoader;
        this.themes = Set.copyOf(themes);
    }

    public Mono<Map<String, Object>> transform(Map<String, Object> props, RenderContext context) {
        return substituteContent(props, context)
            .map(withContent -> applySynchronousStages(withContent, context));
    }

    /**
     * Same pipeline using only content that is already cached.
     */
    public Map<String, Object> transformSync(Map<String, Object> props, RenderContext context) {
        Map<String, Object> withContent = substitute(props,
            key -> contentLoader.peek(key, context.locale()).orElse(null));
        return applySynchronousStages(withContent, context);
    }

    /**
     * Resolves every content reference in {@code props}. Content system failures propagate.
     */
    public Mono<Map<String, Object>> substituteContent(Map<String, Object> props, RenderContext context) {
        Set<String> keys = new LinkedHashSet<>();
        collectContentKeys(props, keys);
        if (keys.isEmpty()) {
            return Mono.just(props);
        }
        return Flux.fromIterable(keys)
            .flatMap(key -> contentLoader.load(key, context.locale()).map(value -> Map.entry(key, value)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .map(resolved -> substitute(props, resolved::get));
    }

    public Map<String, Object> applyConditionals(Map<String, Object> props, RenderContext context) {
        Map<String, Object> result = new LinkedHashMap<>();
        Map<String, Object> promoted = new LinkedHashMap<>();
        props.forEach((key, value) -> {
            if (key.startsWith(IF_PREFIX)) {
                String condition = key.substring(IF_PREFIX.length());
                String thenKey = THEN_PREFIX + condition;
                if (isActive(condition, context) && props.containsKey(thenKey)) {
                    promoted.put(condition, props.get(thenKey));
                }
            } else if (!key.startsWith(THEN_PREFIX)) {
                result.put(key, value);
            }
        });
        result.putAll(promoted);
        return result;
    }

    public Map<String, Object> resolveResponsive(Map<String, Object> props, DeviceType device) {
        Map<String, Object> result = new LinkedHashMap<>();
        Map<String, Object> promoted = new LinkedHashMap<>();
        props.forEach((key, value) -> {
            int separator = key.lastIndexOf(':');
            if (separator > 0 && DeviceType.fromValue(key.substring(separator + 1)).isPresent()) {
                if (DeviceType.fromValue(key.substring(separator + 1)).get() == device) {
                    promoted.put(key.substring(0, separator), value);
                }
            } else {
                result.put(key, value);
            }
        });
        result.putAll(promoted);
        return result;
    }

    public Map<String, Object> applyTheme(Map<String, Object> props, String theme) {
        Map<String, Object> result = new LinkedHashMap<>();
        Map<String, Object> promoted = new LinkedHashMap<>();
        props.forEach((key, value) -> {
            int separator = key.lastIndexOf('_');
            if (separator > 0 && themes.contains(key.substring(separator + 1))) {
                if (key.substring(separator + 1).equals(theme)) {
                    promoted.put(key.substring(0, separator), value);
                }
            } else {
                result.put(key, value);
            }
        });
        result.putAll(promoted);
        return result;
    }

    private Map<String, Object> applySynchronousStages(Map<String, Object> props, RenderContext context) {
        Map<String, Object> conditioned = applyConditionals(props, context);
        Map<String, Object> responsive = resolveResponsive(conditioned, context.deviceType());
        return applyTheme(responsive, context.theme());
    }

    private static boolean isActive(String condition, RenderContext context) {
        if (context.features().contains(condition)) {
            return true;
        }
        if ("authenticated".equals(condition)) {
            return context.user() != null;
        }
        return "preview".equals(condition) && context.preview();
    }

    private static void collectContentKeys(Object value, Set<String> keys) {
        if (value instanceof String text && text.startsWith(CONTENT_PREFIX)) {
            keys.add(text.substring(CONTENT_PREFIX.length()));
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(nested -> collectContentKeys(nested, keys));
        } else if (value instanceof List<?> list) {
            list.forEach(nested -> collectContentKeys(nested, keys));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> substitute(Map<String, Object> props, Function<String, String> lookup) {
        return (Map<String, Object>) substituteValue(props, lookup);
    }

    private static Object substituteValue(Object value, Function<String, String> lookup) {
        if (value instanceof String text && text.startsWith(CONTENT_PREFIX)) {
            String resolved = lookup.apply(text.substring(CONTENT_PREFIX.length()));
            return resolved != null ? resolved : text;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(String.valueOf(key), substituteValue(nested, lookup)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(substituteValue(nested, lookup)));
            return copy;
        }
        return value;
    }
}
