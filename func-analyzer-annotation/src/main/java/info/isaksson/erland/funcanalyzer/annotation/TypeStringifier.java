package info.isaksson.erland.funcanalyzer.annotation;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;

/**
 * Converts a non-textual annotation value into the text the normalizer understands.
 *
 * <p>Java reflection types are written in the bracketed expression syntax, fully qualified,
 * e.g. {@code java.util.Map[java.lang.String, java.util.List[java.lang.Integer]]}, so that the
 * normalizer can strip the packages. Other values go through {@link String#valueOf(Object)}.</p>
 */
public final class TypeStringifier {

    private TypeStringifier() {}

    public static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof CharSequence cs) return cs.toString();
        if (value instanceof Type t) return typeToString(t);
        return String.valueOf(value);
    }

    static String typeToString(Type type) {
        if (type instanceof Class<?> c) {
            if (c.isArray()) return typeToString(c.getComponentType()) + "[]";
            return c.getName().replace('$', '.');
        }
        if (type instanceof ParameterizedType p) {
            StringBuilder sb = new StringBuilder(typeToString(p.getRawType())).append('[');
            Type[] args = p.getActualTypeArguments();
            for (int i = 0; i < args.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeToString(args[i]));
            }
            return sb.append(']').toString();
        }
        if (type instanceof GenericArrayType g) {
            return typeToString(g.getGenericComponentType()) + "[]";
        }
        if (type instanceof WildcardType w) {
            Type[] lower = w.getLowerBounds();
            if (lower.length > 0) return "? super " + typeToString(lower[0]);
            Type[] upper = w.getUpperBounds();
            if (upper.length > 0 && upper[0] != Object.class) return "? extends " + typeToString(upper[0]);
            return "?";
        }
        if (type instanceof TypeVariable<?> v) {
            return v.getName();
        }
        return type.getTypeName();
    }
}
