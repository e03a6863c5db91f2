package info.isaksson.erland.funcanalyzer.core;

/**
 * An already-enumerated function parameter.
 *
 * @param name         parameter name
 * @param annotation   raw annotation: a string, a {@link java.lang.reflect.Type} or any value; null when absent
 * @param required     false when the parameter has a default
 * @param defaultValue default value as source text, null when there is none
 */
public record ParameterInput(String name, Object annotation, boolean required, String defaultValue) {

    public ParameterInput {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("parameter name must not be blank");
    }

    public static ParameterInput of(String name, Object annotation) {
        return new ParameterInput(name, annotation, true, null);
    }

    public static ParameterInput withDefault(String name, Object annotation, String defaultValue) {
        return new ParameterInput(name, annotation, false, defaultValue);
    }
}
