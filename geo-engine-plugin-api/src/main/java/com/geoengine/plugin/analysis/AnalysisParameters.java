package com.geoengine.plugin.analysis;

import com.geoengine.plugin.ValidationResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Helpers for working with declared analysis parameters. */
public final class AnalysisParameters {

    private AnalysisParameters() {
    }

    /** Applies each declaration's rules and rejects names that are not declared. */
    public static ValidationResult validate(List<AnalysisParameter> declared, Map<String, Object> supplied) {
        Map<String, Object> values = supplied != null ? supplied : Map.of();
        List<String> errors = new ArrayList<>();
        Set<String> known = declared.stream().map(AnalysisParameter::getName).collect(Collectors.toSet());
        for (String name : values.keySet()) {
            if (!known.contains(name)) {
                errors.add("Unknown parameter: " + name);
            }
        }
        for (AnalysisParameter p : declared) {
            String error = p.check(values.get(p.getName()));
            if (error != null) {
                errors.add(error);
            }
        }
        return ValidationResult.of(errors);
    }

    /** Supplied values with declared defaults filled in for absent names. */
    public static Map<String, Object> withDefaults(List<AnalysisParameter> declared, Map<String, Object> supplied) {
        Map<String, Object> out = new HashMap<>();
        for (AnalysisParameter p : declared) {
            if (p.getDefaultValue() != null) {
                out.put(p.getName(), p.getDefaultValue());
            }
        }
        if (supplied != null) {
            out.putAll(supplied);
        }
        return out;
    }
}
