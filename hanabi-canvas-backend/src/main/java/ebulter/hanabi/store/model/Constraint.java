package ebulter.hanabi.store.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class Constraint {
    @JsonProperty("type")
    private ConstraintType type;

    @JsonProperty("intValue")
    private int intValue;

    @JsonProperty("floatValue")
    private float floatValue;

    @JsonProperty("boolValue")
    private boolean boolValue;

    private Constraint() {
    }

    public Constraint(ConstraintType type, int intValue, float floatValue, boolean boolValue) {
        this.type = type;
        this.intValue = intValue;
        this.floatValue = floatValue;
        this.boolValue = boolValue;
    }

    public static Constraint colorLimit(int maxColors) {
        return new Constraint(ConstraintType.COLOR_LIMIT, maxColors, 0f, false);
    }

    public static Constraint timeLimit(float seconds) {
        return new Constraint(ConstraintType.TIME_LIMIT, 0, seconds, false);
    }

    public static Constraint symmetryRequired() {
        return new Constraint(ConstraintType.SYMMETRY_REQUIRED, 0, 0f, true);
    }

    public static Constraint pixelLimit(int maxPixels) {
        return new Constraint(ConstraintType.PIXEL_LIMIT, maxPixels, 0f, false);
    }

    public ConstraintType getType() {
        return type;
    }

    public int getIntValue() {
        return intValue;
    }

    public float getFloatValue() {
        return floatValue;
    }

    public boolean getBoolValue() {
        return boolValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Constraint that = (Constraint) o;
        return intValue == that.intValue
                && Float.compare(floatValue, that.floatValue) == 0
                && boolValue == that.boolValue
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, intValue, floatValue, boolValue);
    }
}
