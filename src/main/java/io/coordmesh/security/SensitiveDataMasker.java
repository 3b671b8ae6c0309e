package io.coordmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.coordmesh.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts secret-looking keys and values before they reach the event log.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "private_key"
    );
    // Identifiers written by the coordinator itself; only the key check applies to them.
    private static final Set<String> IDENTIFIER_KEYS = Set.of(
            "holder", "capabilities", "to", "from", "released_by", "message_id", "reply_to", "kind", "status"
    );
    private static final Set<String> SECRET_PREFIXES = Set.of("sk-", "ghp_", "gho_", "xoxb-", "xoxp-", "bearer ");
    // Unbroken mixed-case base64 runs; ids with separators (msg_<uuid>, ISO instants) do not match.
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=]{32,}$");

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> maskedDetail(Map<String, Object> detail) {
        if (detail == null || detail.isEmpty()) {
            return Map.of();
        }
        JsonNode masked = masked(Jsons.mapper().valueToTree(detail));
        @SuppressWarnings("unchecked")
        Map<String, Object> out = Jsons.mapper().convertValue(masked, LinkedHashMap.class);
        return out;
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else if (IDENTIFIER_KEYS.contains(entry.getKey())) {
                    out.set(entry.getKey(), entry.getValue());
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().getNodeFactory().textNode(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        String lower = v.toLowerCase(Locale.ROOT);
        for (String prefix : SECRET_PREFIXES) {
            if (lower.startsWith(prefix) && v.length() >= prefix.length() + 16) {
                return true;
            }
        }
        return OPAQUE_TOKEN.matcher(v).matches()
                && v.chars().anyMatch(Character::isDigit)
                && v.chars().anyMatch(Character::isUpperCase);
    }
}
