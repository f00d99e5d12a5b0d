package net.revivatech.util;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifiers for authoring previews.
 */
public final class IdGenerator {

    private static final String PREVIEW_PREFIX = "preview-";
    private static final int PREVIEW_SUFFIX_LENGTH = 9;

    private IdGenerator() {
    }

    /**
     * {@code preview-<epochMillis>-<suffix>}, where the suffix is nine lowercase base36
     * characters. Ids sort by creation time as long as they share a millisecond width.
     */
    public static String previewId(Instant createdAt) {
        return PREVIEW_PREFIX + createdAt.toEpochMilli() + "-" + base36Suffix(PREVIEW_SUFFIX_LENGTH);
    }

    private static String base36Suffix(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(length);
        while (suffix.length() < length) {
            suffix.append(Character.forDigit(random.nextInt(Character.MAX_RADIX), Character.MAX_RADIX));
        }
        return suffix.toString();
    }
}
