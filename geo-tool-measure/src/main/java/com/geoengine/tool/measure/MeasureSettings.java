package com.geoengine.tool.measure;

import com.geoengine.plugin.JsonPluginSettings;

import java.util.List;
import java.util.Map;

/** Display unit of the measure tool: a label and how many of it make one map unit. */
public final class MeasureSettings extends JsonPluginSettings {

    static final String UNIT = "unit";
    static final String UNITS_PER_MAP_UNIT = "unitsPerMapUnit";

    public MeasureSettings() {
        super(Map.of(UNIT, "m", UNITS_PER_MAP_UNIT, 1.0));
    }

    public String getUnit() {
        return getString(UNIT, "m");
    }

    public double getUnitsPerMapUnit() {
        return getDouble(UNITS_PER_MAP_UNIT, 1.0);
    }

    @Override
    protected void collectErrors(List<String> errors) {
        if (getUnit().isBlank()) {
            errors.add("unit must be non-blank");
        }
        double factor = getUnitsPerMapUnit();
        if (!(factor > 0) || Double.isInfinite(factor)) {
            errors.add("unitsPerMapUnit must be a positive number");
        }
    }
}
