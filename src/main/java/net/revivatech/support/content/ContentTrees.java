package net.revivatech.support.content;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dotted-key navigation over parsed JSON objects.
 */
final class ContentTrees {

    private ContentTrees() {
    }

    static Object lookup(Map<String, Object> tree, String dottedKey) {
        if (dottedKey == null || dottedKey.isEmpty()) {
            return null;
        }
        Object current = tree;
        for (String segment : dottedKey.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    static Map<String, Object> asMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, nested) -> result.put(String.valueOf(key), nested));
        }
        return result;
    }
}
