package behaviors.pathexpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits a dotted path expression into [PathToken]s.
///
/// Supported syntax:
/// - `name` : public readable property
/// - `a.b.c` : chained properties, surrounding whitespace and empty segments are ignored
/// - `name[n]` : property followed by a non-negative integer indexer
///
/// A segment whose indexer does not parse (`Tags[`, `Tags[abc]`, `Tags[-1]`, `Tags[1.5]`) is kept
/// verbatim as a plain member name. No input makes the tokenizer throw.
final class PathTokenizer {

    private static final Logger LOG = Logger.getLogger(PathTokenizer.class.getName());

    private PathTokenizer() {
    }

    /// Tokenizes a path expression.
    /// @param path the raw path expression
    /// @return the tokens in path order, immutable, possibly empty
    /// @throws NullPointerException if path is null
    static List<PathToken> tokenize(String path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Tokenizing path: " + path);

        final var tokens = new ArrayList<PathToken>();
        for (final var part : path.split("\\.")) {
            final var segment = part.strip();
            if (segment.isEmpty()) {
                continue;
            }
            final var token = parseSegment(segment);
            LOG.finer(() -> "Parsed token: " + token);
            tokens.add(token);
        }
        return List.copyOf(tokens);
    }

    private static PathToken parseSegment(String segment) {
        final int open = segment.indexOf('[');
        if (open < 0 || !segment.endsWith("]")) {
            return PathToken.member(segment);
        }

        final var content = segment.substring(open + 1, segment.length() - 1).strip();
        final int index = parseIndex(content);
        if (index < 0) {
            LOG.finer(() -> "Malformed indexer kept as member name: " + segment);
            return PathToken.member(segment);
        }
        return new PathToken(segment.substring(0, open), index);
    }

    /// Parses a base-10 non-negative integer, returning -1 when the text is anything else.
    private static int parseIndex(String content) {
        if (content.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < content.length(); i++) {
            final char c = content.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Integer.parseInt(content);
        } catch (NumberFormatException overflow) {
            LOG.finer(() -> "Indexer out of int range: " + content);
            return -1;
        }
    }
}
