package behaviors.pathexpr;

import java.util.Objects;
import java.util.logging.Logger;

/// Resolves dotted path expressions such as `originalSource.items[0].title` against any object.
///
/// Usage:
/// ```java
/// Object title = PathExpressions.resolvePath(eventArgs, "originalSource.items[0].title");
///
/// PathResolution r = PathExpressions.tryResolve(sender, "selectedItem");
/// if (r.found()) { ... r.value() may still be null ... }
/// ```
///
/// Member names are matched exactly against public readable properties. Malformed paths, unknown
/// members, non-indexable values and out of range indexes never throw; they resolve to a miss.
/// Tokenized paths are memoized in [PathTokenCache#shared()].
public final class PathExpressions {

    private static final Logger LOG = Logger.getLogger(PathExpressions.class.getName());

    private PathExpressions() {
    }

    /// Resolves a path and reports whether it could be followed.
    /// @param root the object to start from, may be null
    /// @param path the path expression, may be null
    /// @return [PathResolution#MISS] for a null root, a blank path or an unresolvable path
    /// @throws PathAccessException if a matched getter throws
    public static PathResolution tryResolve(Object root, String path) {
        return tryResolve(root, path, PathTokenCache.shared());
    }

    /// Resolves a path using the given token cache.
    /// @throws NullPointerException if cache is null
    /// @throws PathAccessException if a matched getter throws
    public static PathResolution tryResolve(Object root, String path, PathTokenCache cache) {
        Objects.requireNonNull(cache, "cache must not be null");
        if (root == null || path == null || path.isBlank()) {
            LOG.finer(() -> "Nothing to resolve: root=" + (root == null ? "null" : root.getClass().getName()) + ", path=" + path);
            return PathResolution.MISS;
        }
        return PathEvaluator.evaluate(root, cache.tokens(path), path);
    }

    /// Resolves a path, collapsing "not found" and "found null" into null.
    /// @param root the object to start from, may be null
    /// @param path the path expression, may be null
    /// @return the resolved value or null
    /// @throws PathAccessException if a matched getter throws
    public static Object resolvePath(Object root, String path) {
        return tryResolve(root, path).valueOrNull();
    }
}
