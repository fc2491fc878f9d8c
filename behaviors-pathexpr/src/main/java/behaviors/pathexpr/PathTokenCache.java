package behaviors.pathexpr;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Memoizes tokenized paths keyed by the exact raw path string.
///
/// The shared instance is unbounded unless the system property
/// `behaviors.pathexpr.cache.maxEntries` holds a positive integer, in which case least recently
/// used entries are evicted once the bound is reached. Path strings normally come from
/// configuration or markup, so the unbounded default stays small.
///
/// Concurrent first use of the same key may race; every caller still receives a complete token
/// list because tokenization is a pure function of the key.
public final class PathTokenCache {

    private static final Logger LOG = Logger.getLogger(PathTokenCache.class.getName());

    /// System property naming the bound of the shared cache.
    public static final String MAX_ENTRIES_PROPERTY = "behaviors.pathexpr.cache.maxEntries";

    private static final PathTokenCache SHARED = new PathTokenCache(maxEntriesFromSystemProperty());

    private final int maxEntries;
    private final Map<String, List<PathToken>> entries;
    private final AtomicLong tokenizations = new AtomicLong();

    /// Creates a cache.
    /// @param maxEntries the maximum number of entries, or 0 for no bound
    /// @throws IllegalArgumentException if maxEntries is negative
    public PathTokenCache(int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must not be negative: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = maxEntries == 0 ? new ConcurrentHashMap<>() : new LruMap(maxEntries);
        LOG.fine(() -> "Created path token cache, maxEntries=" + (maxEntries == 0 ? "unbounded" : maxEntries));
    }

    /// Returns the process-wide cache used by [PathExpressions].
    public static PathTokenCache shared() {
        return SHARED;
    }

    /// Returns the tokens for a path, tokenizing it on first use.
    /// @param path the raw path expression, used verbatim as the key
    /// @return the cached immutable token list
    /// @throws NullPointerException if path is null
    public List<PathToken> tokens(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (maxEntries == 0) {
            return entries.computeIfAbsent(path, this::tokenize);
        }
        synchronized (entries) {
            return entries.computeIfAbsent(path, this::tokenize);
        }
    }

    /// Number of times a path was actually tokenized rather than served from the cache.
    public long tokenizations() {
        return tokenizations.get();
    }

    /// Number of cached paths.
    public int size() {
        if (maxEntries == 0) {
            return entries.size();
        }
        synchronized (entries) {
            return entries.size();
        }
    }

    /// The configured bound, 0 meaning unbounded.
    public int maxEntries() {
        return maxEntries;
    }

    private List<PathToken> tokenize(String path) {
        tokenizations.incrementAndGet();
        return PathTokenizer.tokenize(path);
    }

    static int maxEntriesFromSystemProperty() {
        final var value = System.getProperty(MAX_ENTRIES_PROPERTY);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            final int parsed = Integer.parseInt(value.strip());
            if (parsed >= 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Ignoring " + MAX_ENTRIES_PROPERTY + "=" + value + ": " + e.getMessage());
            return 0;
        }
        LOG.warning(() -> "Ignoring negative " + MAX_ENTRIES_PROPERTY + "=" + value);
        return 0;
    }

    /// Access-ordered map; callers hold its monitor.
    private static final class LruMap extends LinkedHashMap<String, List<PathToken>> {

        private static final long serialVersionUID = 1L;

        private final int maxEntries;

        LruMap(int maxEntries) {
            super(16, 0.75f, true);
            this.maxEntries = maxEntries;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, List<PathToken>> eldest) {
            final boolean evict = size() > maxEntries;
            if (evict) {
                LOG.finer(() -> "Evicting cached path: " + eldest.getKey());
            }
            return evict;
        }
    }
}
