package behaviors.pathexpr;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Walks an object graph following a token sequence.
///
/// For each token: a member hop when the token has a name, then an indexer hop when it has an
/// index. Arrays (object and primitive) and [List]s are indexable, nothing else is. A null
/// intermediate value ends the walk as a found null. Any other irregularity is a miss.
final class PathEvaluator {

    private static final Logger LOG = Logger.getLogger(PathEvaluator.class.getName());

    private PathEvaluator() {
    }

    /// Applies tokens to a root object.
    /// @param root   the starting object, may be null
    /// @param tokens the tokens to apply in order
    /// @param path   the source path, used for diagnostics only
    /// @return the resolution, never null
    /// @throws PathAccessException if a matched getter throws
    static PathResolution evaluate(Object root, List<PathToken> tokens, String path) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (root == null) {
            return PathResolution.MISS;
        }

        Object current = root;
        for (int i = 0; i < tokens.size() && current != null; i++) {
            final var token = tokens.get(i);
            final int step = i;
            LOG.finer(() -> "Evaluating token " + step + ": " + token);

            if (token.hasName()) {
                final var member = readMember(current, token.name(), path);
                if (!member.found()) {
                    return PathResolution.MISS;
                }
                current = member.value();
            }

            if (token.hasIndex() && current != null) {
                final var element = readIndex(current, token.index(), path);
                if (!element.found()) {
                    return PathResolution.MISS;
                }
                current = element.value();
            }
        }
        return PathResolution.of(current);
    }

    private static PathResolution readMember(Object target, String name, String path) {
        if (target instanceof PathResolvable resolvable) {
            final var result = resolvable.resolveMember(name);
            if (result == null || !result.found()) {
                LOG.finer(() -> "Member '" + name + "' not resolved by " + target.getClass().getName() + " in path: " + path);
                return PathResolution.MISS;
            }
            return result;
        }

        final var reader = MemberAccessors.reader(target.getClass(), name);
        if (reader == null) {
            LOG.finer(() -> "No public readable property '" + name + "' on " + target.getClass().getName() + " in path: " + path);
            return PathResolution.MISS;
        }
        try {
            return PathResolution.of(reader.invoke(target));
        } catch (IllegalAccessException e) {
            LOG.finer(() -> "Property '" + name + "' on " + target.getClass().getName() + " is not accessible: " + e.getMessage());
            return PathResolution.MISS;
        } catch (InvocationTargetException e) {
            throw new PathAccessException(path, name, e.getCause());
        }
    }

    private static PathResolution readIndex(Object target, int index, String path) {
        if (target instanceof List<?>) {
            final var list = (List<?>) target;
            return inBounds(index, list.size(), path) ? PathResolution.of(list.get(index)) : PathResolution.MISS;
        }
        if (target.getClass().isArray()) {
            return inBounds(index, Array.getLength(target), path) ? PathResolution.of(Array.get(target, index)) : PathResolution.MISS;
        }
        LOG.finer(() -> "Value of type " + target.getClass().getName() + " is not indexable in path: " + path);
        return PathResolution.MISS;
    }

    private static boolean inBounds(int index, int length, String path) {
        if (index >= 0 && index < length) {
            return true;
        }
        LOG.finer(() -> "Index " + index + " out of bounds for length " + length + " in path: " + path);
        return false;
    }
}
