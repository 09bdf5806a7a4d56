package by.greenmobile.productionplan.entity;

/**
 * Closed set of plant technologies the cost model knows how to price.
 */
public enum PlantType {
    GAS_FIRED("gasfired"),
    TURBOJET("turbojet"),
    WIND_TURBINE("windturbine");

    private final String code;

    PlantType(String code) {
        this.code = code;
    }

    /** Code used on the wire ("gasfired", "turbojet", "windturbine"). */
    public String getCode() {
        return code;
    }

    public boolean isThermal() {
        return this != WIND_TURBINE;
    }

    public static PlantType fromCode(String code) {
        if (code == null) return null;
        for (PlantType t : values()) {
            if (t.code.equalsIgnoreCase(code.trim())) return t;
        }
        return null;
    }
}
