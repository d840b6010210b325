package com.gauchoplan.backend.modules.planner.domain;

/**
 * How heavy a quarter is, judged by its planned units.
 */
public enum PlanLoad {
    UNDER_LOAD,
    LIGHT,
    TYPICAL,
    // usually needs approval
    HEAVY;

    public static PlanLoad classify(int units, int lightUnits, int typicalUnits, int heavyUnits) {
        if (units >= heavyUnits) {
            return HEAVY;
        }
        if (units >= typicalUnits) {
            return TYPICAL;
        }
        if (units >= lightUnits) {
            return LIGHT;
        }
        return UNDER_LOAD;
    }
}
