package org.tuscan.features;

/**
 * The two trained model families and their feature layouts.
 */
public enum ScoringMode {

    /** Predicts a continuous activity score; 63 columns. */
    REGRESSION("Regression", new FeatureLayout(
        FeatureTables.REGRESSION_DINUCLEOTIDES,
        FeatureTables.REGRESSION_BASES,
        FeatureTables.REGRESSION_DINUCLEOTIDE_POSITIONS,
        1,
        FeatureTables.REGRESSION_PAM_TAIL)),

    /** Predicts an active/inactive label; 46 columns. */
    CLASSIFICATION("Classification", new FeatureLayout(
        FeatureTables.CLASSIFICATION_DINUCLEOTIDES,
        FeatureTables.CLASSIFICATION_BASES,
        FeatureTables.CLASSIFICATION_DINUCLEOTIDE_POSITIONS,
        0,
        null));

    private final String displayName;
    private final FeatureLayout layout;

    ScoringMode(String displayName, FeatureLayout layout) {
        this.displayName = displayName;
        this.layout = layout;
    }

    /** @return the name used on the command line and in model files. */
    public String displayName() {
        return displayName;
    }

    public FeatureLayout layout() {
        return layout;
    }

    /**
     * Parses a mode name, ignoring case.
     *
     * @param name {@code Regression} or {@code Classification}.
     * @return the matching mode.
     * @throws IllegalArgumentException if the name matches neither mode.
     */
    public static ScoringMode fromName(String name) {
        for (ScoringMode mode : values()) {
            if (mode.displayName.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
            "Invalid model type '" + name + "', must be Classification or Regression");
    }
}
