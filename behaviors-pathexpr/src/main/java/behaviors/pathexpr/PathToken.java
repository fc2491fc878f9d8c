package behaviors.pathexpr;

import java.util.Objects;

/// One segment of a path expression: a member name with an optional trailing integer index.
///
/// `Items[0]` becomes `PathToken("Items", 0)`, `Title` becomes `PathToken("Title", null)`.
/// The name may be empty (`[2]` indexes the current value without a member hop).
///
/// @param name  the member name, never null, possibly empty
/// @param index the non-negative index, or null when the segment has no indexer
public record PathToken(String name, Integer index) {

    public PathToken {
        Objects.requireNonNull(name, "name must not be null");
        if (index != null && index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
    }

    /// Creates a token without an indexer.
    public static PathToken member(String name) {
        return new PathToken(name, null);
    }

    /// Returns true when this token carries an indexer hop.
    public boolean hasIndex() {
        return index != null;
    }

    /// Returns true when this token performs a member lookup before any indexer hop.
    public boolean hasName() {
        return !name.isEmpty();
    }

    @Override
    public String toString() {
        return hasIndex() ? name + "[" + index + "]" : name;
    }
}
