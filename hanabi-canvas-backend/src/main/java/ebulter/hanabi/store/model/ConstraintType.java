package ebulter.hanabi.store.model;

/**
 * Kinds of drawing constraints a challenge request can impose
 */
public enum ConstraintType {
    COLOR_LIMIT,        // max unique colors, intValue
    TIME_LIMIT,         // seconds, floatValue
    SYMMETRY_REQUIRED,  // boolValue
    PIXEL_LIMIT,        // max filled pixels, intValue
    PALETTE_RESTRICTION
}
