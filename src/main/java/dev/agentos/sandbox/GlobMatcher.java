package dev.agentos.sandbox;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Matches project-relative paths against manifest globs using the JDK glob syntax.
 * A leading {@code **}{@code /} also matches files at the project root.
 */
public final class GlobMatcher {

    private static final Map<String, PathMatcher> CACHE = new ConcurrentHashMap<>();

    private GlobMatcher() {}

    public static boolean matches(String glob, String relativePath) {
        Path path = Path.of(relativePath);
        if (matcher(glob).matches(path)) {
            return true;
        }
        return glob.startsWith("**/") && matcher(glob.substring(3)).matches(path);
    }

    public static boolean matchesAny(List<String> globs, String relativePath) {
        for (String glob : globs) {
            if (matches(glob, relativePath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when {@code glob} contains no wildcard and therefore names one file.
     */
    public static boolean isLiteral(String glob) {
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether two write targets can name the same file: equal, or one is a glob matching the other.
     */
    public static boolean overlaps(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        if (isLiteral(a) && !isLiteral(b)) {
            return matches(b, a);
        }
        if (isLiteral(b) && !isLiteral(a)) {
            return matches(a, b);
        }
        return false;
    }

    private static PathMatcher matcher(String glob) {
        return CACHE.computeIfAbsent(glob, g -> FileSystems.getDefault().getPathMatcher("glob:" + g));
    }
}
