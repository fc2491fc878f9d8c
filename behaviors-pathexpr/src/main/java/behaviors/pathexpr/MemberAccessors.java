package behaviors.pathexpr;

import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Public readable property lookup by exact name, cached per runtime class.
///
/// A property is readable when it has a public instance read method: a JavaBean getter
/// (`getTitle()` / `isActive()`, named as [Introspector] reports them) or a public record component
/// accessor. Fields, non-public methods, static methods and `getClass()` are never exposed.
final class MemberAccessors {

    private static final Logger LOG = Logger.getLogger(MemberAccessors.class.getName());

    private static final ClassValue<Map<String, Method>> READERS = new ClassValue<>() {
        @Override
        protected Map<String, Method> computeValue(Class<?> type) {
            return discover(type);
        }
    };

    private MemberAccessors() {
    }

    /// Returns the public read method for a property, or null when the type has none.
    static Method reader(Class<?> type, String name) {
        return READERS.get(type).get(name);
    }

    private static Map<String, Method> discover(Class<?> type) {
        final var readers = new HashMap<String, Method>();
        try {
            for (PropertyDescriptor pd : Introspector.getBeanInfo(type).getPropertyDescriptors()) {
                final var read = pd.getReadMethod();
                if (read != null && !"class".equals(pd.getName()) && isPublicInstance(read)) {
                    final var invocable = invocable(type, read);
                    if (invocable != null) {
                        readers.put(pd.getName(), invocable);
                    }
                }
            }
        } catch (IntrospectionException e) {
            LOG.warning(() -> "Cannot introspect " + type.getName() + ", exposing no bean properties: " + e.getMessage());
        }
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                final var accessor = component.getAccessor();
                if (isPublicInstance(accessor) && !readers.containsKey(component.getName())) {
                    final var invocable = invocable(type, accessor);
                    if (invocable != null) {
                        readers.put(component.getName(), invocable);
                    }
                }
            }
        }
        LOG.finest(() -> "Readable properties of " + type.getName() + ": " + readers.keySet());
        return Map.copyOf(readers);
    }

    /// Returns a form of a public getter that can be invoked from this package, or null.
    ///
    /// A getter on a non-public class is first looked up on a public supertype. Failing that it
    /// is made accessible, which only works where the declaring module is open to us.
    private static Method invocable(Class<?> type, Method method) {
        if (Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            return method;
        }
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            final var found = declaredPublicly(c, method.getName());
            if (found != null) {
                return found;
            }
        }
        if (method.trySetAccessible()) {
            return method;
        }
        LOG.finest(() -> "Getter " + method + " cannot be made accessible");
        return null;
    }

    private static Method declaredPublicly(Class<?> type, String name) {
        if (Modifier.isPublic(type.getModifiers())) {
            try {
                final var found = type.getMethod(name);
                if (!Modifier.isStatic(found.getModifiers())
                        && Modifier.isPublic(found.getDeclaringClass().getModifiers())) {
                    return found;
                }
            } catch (NoSuchMethodException e) {
                LOG.finest(() -> type.getName() + " does not declare " + name + "()");
            }
        }
        for (Class<?> iface : type.getInterfaces()) {
            final var found = declaredPublicly(iface, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static boolean isPublicInstance(Method method) {
        final int modifiers = method.getModifiers();
        return Modifier.isPublic(modifiers) && !Modifier.isStatic(modifiers) && method.getParameterCount() == 0;
    }
}
