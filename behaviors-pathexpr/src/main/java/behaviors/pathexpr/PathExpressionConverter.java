package behaviors.pathexpr;

import java.util.Locale;

/// [ValueConverter] that extracts a value from its input using a path expression passed as the
/// converter parameter.
///
/// One way only: [#convertBack] always throws.
public final class PathExpressionConverter implements ValueConverter {

    public static final PathExpressionConverter INSTANCE = new PathExpressionConverter();

    /// Returns null when the value is null or the parameter is not a string, otherwise the value
    /// at the path, or null on any miss.
    @Override
    public Object convert(Object value, Class<?> targetType, Object parameter, Locale locale) {
        if (value == null || !(parameter instanceof String path)) {
            return null;
        }
        return convert(value, path);
    }

    @Override
    public Object convertBack(Object value, Class<?> targetType, Object parameter, Locale locale) {
        throw new UnsupportedOperationException("convertBack is not supported by " + getClass().getSimpleName());
    }

    /// Resolves a path against a source object.
    /// @return the resolved value, or null when not found
    public Object convert(Object source, String path) {
        return PathExpressions.resolvePath(source, path);
    }
}
