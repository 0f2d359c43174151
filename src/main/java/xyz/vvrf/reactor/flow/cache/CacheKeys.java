package xyz.vvrf.reactor.flow.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * 缓存键工具。请求指纹对参数做键排序后的 JSON 序列化再取 SHA-256，
 * 参数顺序不同但内容相同的请求得到同一个键。
 *
 * @author ruifeng.wen
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private CacheKeys() {
    }

    /**
     * 以冒号拼接键的各段，例如 {@code key("mutation", "EGFR", "L858R")} 得到 {@code mutation:EGFR:L858R}。
     */
    public static String key(String... parts) {
        return String.join(":", parts);
    }

    /**
     * @return {@code namespace:<sha256 hex>}
     */
    public static String fingerprint(String namespace, Map<String, ?> params) {
        String canonical;
        try {
            canonical = CANONICAL.writeValueAsString(params == null ? new TreeMap<>() : new TreeMap<>(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("请求参数无法序列化为 JSON: " + e.getOriginalMessage(), e);
        }
        return namespace + ":" + sha256Hex(canonical);
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
