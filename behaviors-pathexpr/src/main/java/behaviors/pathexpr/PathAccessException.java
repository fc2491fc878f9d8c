package behaviors.pathexpr;

/// Thrown when a public property getter matched by a path throws.
///
/// Missing members and bad indexes are never reported this way; they resolve to a miss. This
/// exception only surfaces failures raised by the inspected object's own code.
public class PathAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final String member;

    public PathAccessException(String path, String member, Throwable cause) {
        super(formatMessage(path, member, cause), cause);
        this.path = path;
        this.member = member;
    }

    /// Returns the path being resolved.
    public String path() {
        return path;
    }

    /// Returns the member whose getter failed.
    public String member() {
        return member;
    }

    private static String formatMessage(String path, String member, Throwable cause) {
        final var sb = new StringBuilder();
        sb.append("Getter for '").append(member).append("' failed");
        if (path != null) {
            sb.append(" in path: ").append(path);
        }
        if (cause != null && cause.getMessage() != null) {
            sb.append(" (").append(cause.getMessage()).append(')');
        }
        return sb.toString();
    }
}
