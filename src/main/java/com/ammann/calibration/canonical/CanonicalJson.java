/* (C)2026 */
package com.ammann.calibration.canonical;

import com.ammann.calibration.exception.SomeThingWentWrongException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

/**
 * Canonical JSON serialization and digests used for manifest hashing.
 *
 * <p>The canonical form is compact JSON with object keys sorted lexicographically at
 * every level. Floating-point numbers are written as plain decimals of their shortest
 * round-trip representation without trailing zeros, so {@code 1.0} and {@code 1} are
 * the same token and no exponent notation appears. Logically identical inputs
 * therefore serialize to identical strings regardless of map iteration order.
 *
 * <p>Non-finite numbers have no canonical form and are rejected.
 */
public final class CanonicalJson {

    /** Hex digest used as the predecessor of the first chained entry. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final ObjectMapper MAPPER =
            JsonMapper.builder().enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN).build();

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CanonicalJson() {}

    /**
     * Serializes a value to its canonical JSON string.
     *
     * @param value a {@link CanonicalForm}, map, collection, string, number, boolean,
     *     enum, instant, optional or {@code null}
     * @return compact canonical JSON
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            throw new SomeThingWentWrongException("Failed to serialize canonical form", e);
        }
    }

    /**
     * SHA-256 digest of the canonical form of {@code value}, as 64 lowercase hex characters.
     */
    public static String digest(Object value) {
        return sha256Hex(write(value));
    }

    /** SHA-256 over the UTF-8 bytes of {@code text}. */
    public static String sha256Hex(String text) {
        return DigestUtils.sha256Hex(text);
    }

    /** HMAC-SHA256 over the UTF-8 bytes of {@code message}, hex encoded. */
    public static String hmacSha256Hex(String key, String message) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmacHex(message);
    }

    static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.instance;
        }
        if (value instanceof CanonicalForm form) {
            return toNode(form.canonicalForm());
        }
        if (value instanceof Optional<?> optional) {
            return toNode(optional.orElse(null));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = keyOf(entry.getKey());
                if (sorted.put(key, entry.getValue()) != null) {
                    throw new IllegalArgumentException("Duplicate canonical key: " + key);
                }
            }
            ObjectNode node = NODES.objectNode();
            sorted.forEach((k, v) -> node.set(k, toNode(v)));
            return node;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode node = NODES.arrayNode();
            collection.forEach(item -> node.add(toNode(item)));
            return node;
        }
        if (value instanceof Double || value instanceof Float) {
            return decimal(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal bd) {
            return DecimalNode.valueOf(normalize(bd));
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return LongNode.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) {
            return DecimalNode.valueOf(new BigDecimal(bi));
        }
        if (value instanceof Boolean b) {
            return BooleanNode.valueOf(b);
        }
        if (value instanceof Enum<?> e) {
            return TextNode.valueOf(e.name());
        }
        if (value instanceof Instant instant) {
            return TextNode.valueOf(instant.toString());
        }
        if (value instanceof CharSequence text) {
            return TextNode.valueOf(text.toString());
        }
        throw new IllegalArgumentException(
                "No canonical form for " + value.getClass().getName());
    }

    private static String keyOf(Object key) {
        if (key instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(key);
    }

    private static JsonNode decimal(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Non-finite number has no canonical form: " + value);
        }
        return DecimalNode.valueOf(normalize(BigDecimal.valueOf(value)));
    }

    private static BigDecimal normalize(BigDecimal value) {
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return value.stripTrailingZeros();
    }
}
