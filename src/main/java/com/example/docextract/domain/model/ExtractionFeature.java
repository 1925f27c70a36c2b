package com.example.docextract.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Collections an extraction run can produce.
 * Lets callers skip work they do not need, such as image decoding.
 */
public enum ExtractionFeature {
    TEXT,
    LINKS,
    IMAGES,
    TABLES;

	/**
	 * Builds an {@link EnumSet} containing every feature value.
	 *
	 * @return enum set with all defined features
	 */
    public static EnumSet<ExtractionFeature> allFeatures() {
        return EnumSet.allOf(ExtractionFeature.class);
    }

	/**
	 * Converts raw request values into an {@link EnumSet} of features.
	 * Unknown values are ignored; an empty or fully invalid input selects every feature.
	 *
	 * @param rawValues feature names supplied by the caller
	 * @return parsed feature set or {@link #allFeatures()} when empty/invalid
	 */
    public static EnumSet<ExtractionFeature> fromStrings(List<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return allFeatures();
        }
        EnumSet<ExtractionFeature> features = EnumSet.noneOf(ExtractionFeature.class);
        for (String value : rawValues) {
            ExtractionFeature feature = fromString(value);
            if (feature != null) {
                features.add(feature);
            }
        }
        if (features.isEmpty()) {
            return allFeatures();
        }
        return features;
    }

    private static ExtractionFeature fromString(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return ExtractionFeature.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
