package behaviors.pathexpr;

/// Outcome of resolving a path against an object graph.
///
/// `found == false` means the path could not be followed (missing member, bad index, value not
/// indexable, null root, blank path). `found == true` with a null value means every hop succeeded
/// or the walk stopped at a null intermediate value.
///
/// @param found whether the path resolved
/// @param value the resolved value, always null when not found
public record PathResolution(boolean found, Object value) {

    /// The single "not found" result.
    public static final PathResolution MISS = new PathResolution(false, null);

    public PathResolution {
        if (!found && value != null) {
            throw new IllegalArgumentException("a miss cannot carry a value");
        }
    }

    /// A successful resolution, the value may be null.
    public static PathResolution of(Object value) {
        return new PathResolution(true, value);
    }

    /// Returns the value when found, otherwise null.
    public Object valueOrNull() {
        return found ? value : null;
    }
}
