package info.isaksson.erland.funcanalyzer.core;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A parameter with its canonical type and docstring description ("" when undocumented). */
public record ParameterSummary(
        String name,
        String type,
        String description,
        boolean required,
        @JsonInclude(JsonInclude.Include.NON_NULL) String defaultValue
) {}
