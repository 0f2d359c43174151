package xyz.vvrf.reactor.flow.cache;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 缓存键匹配模式。支持 glob 通配符 {@code *} 与 {@code ?}；不含通配符时按前缀匹配。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode(of = "glob")
public final class KeyPattern {

    private final String glob;
    private final Pattern regex;

    private KeyPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob));
    }

    public static KeyPattern of(String pattern) {
        Objects.requireNonNull(pattern, "匹配模式不能为空");
        boolean wildcard = pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
        return new KeyPattern(wildcard ? pattern : pattern + "*");
    }

    public boolean matches(String key) {
        return key != null && regex.matcher(key).matches();
    }

    /**
     * 在前面加上命名空间前缀，得到后端存储层使用的模式。
     */
    public KeyPattern withPrefix(String prefix) {
        return prefix == null || prefix.isEmpty() ? this : new KeyPattern(prefix + glob);
    }

    @Override
    public String toString() {
        return glob;
    }

    private static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }
}
