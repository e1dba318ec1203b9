package org.politia.warehouse.merge;

import org.politia.warehouse.entity.Chamber;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic identity keys for the canonical entities. The same raw input always yields the same
 * key, which is what makes reruns idempotent.
 *
 * <ul>
 *   <li>profile person: {@code op_<nativeId>}</li>
 *   <li>placeholder person: {@code unknown_<md5(normalized name), 16 hex>}</li>
 *   <li>session: {@code session_<legislature>_<chamber code>_<number>}</li>
 *   <li>topic: {@code <sessionId>_topic_<md5(normalized title), 8 hex>}</li>
 *   <li>speech: {@code <topicId>_speech_<md5(topicId|ordinal|normalized speaker), 12 hex>}</li>
 * </ul>
 */
public final class CanonicalIds {

    public static final String PROFILE_PREFIX = "op_";
    public static final String PLACEHOLDER_PREFIX = "unknown_";
    public static final String OPENPARLAMENTO_SOURCE = "openparlamento";
    public static final String SLUG_SOURCE = "slug";

    private CanonicalIds() {
    }

    public static String profilePersonId(String nativeId) {
        return PROFILE_PREFIX + nativeId;
    }

    public static String openParlamentoSourceId(String nativeId) {
        return "p" + nativeId;
    }

    public static String placeholderPersonId(String normalizedName) {
        return PLACEHOLDER_PREFIX + md5(normalizedName, 16);
    }

    public static String sessionId(int legislature, Chamber chamber, int sessionNumber) {
        return "session_" + legislature + "_" + chamber.getCode() + "_" + sessionNumber;
    }

    public static String topicId(String sessionId, String normalizedTitle) {
        return sessionId + "_topic_" + md5(normalizedTitle, 8);
    }

    public static String speechId(String topicId, int ordinal, String normalizedSpeaker) {
        return topicId + "_speech_" + md5(topicId + "|" + ordinal + "|" + normalizedSpeaker, 12);
    }

    private static String md5(String value, int length) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8)).substring(0, length);
    }
}
