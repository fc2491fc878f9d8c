package behaviors.pathexpr;

/// Capability for objects that answer member lookups themselves instead of through reflection.
///
/// When a value on the path implements this interface its answer is authoritative: reflection is
/// not consulted for it. Indexer hops are unaffected; they apply to whatever value is returned.
public interface PathResolvable {

    /// Looks up a member by exact name.
    /// @param name the member name, never null or empty
    /// @return the member value wrapped with [PathResolution#of], or [PathResolution#MISS]
    PathResolution resolveMember(String name);
}
