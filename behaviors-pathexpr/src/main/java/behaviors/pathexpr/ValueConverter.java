package behaviors.pathexpr;

import java.util.Locale;

/// Two-way value transform applied at a binding boundary.
///
/// A converter takes a source value plus an external parameter and produces the value handed to
/// the target. Converters that cannot run in reverse throw [UnsupportedOperationException] from
/// [#convertBack].
public interface ValueConverter {

    /// Converts a source value for the target.
    /// @param value      the source value, may be null
    /// @param targetType the type the target expects
    /// @param parameter  converter specific parameter, may be null
    /// @param locale     the locale to convert in
    /// @return the converted value, may be null
    Object convert(Object value, Class<?> targetType, Object parameter, Locale locale);

    /// Converts a target value back to the source.
    /// @throws UnsupportedOperationException if the converter is one way
    Object convertBack(Object value, Class<?> targetType, Object parameter, Locale locale);
}
