package com.folautech.metric.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed catalog of physiological measurement kinds the engine knows about.
 */
public enum MetricKind {
    WEIGHT("Weight", "kg"),
    HEIGHT("Height", "cm"),
    BMI("Body Mass Index", "kg/m2"),
    BLOOD_PRESSURE_SYSTOLIC("Blood Pressure (Systolic)", "mmHg"),
    BLOOD_PRESSURE_DIASTOLIC("Blood Pressure (Diastolic)", "mmHg"),
    BLOOD_GLUCOSE_FASTING("Blood Glucose (Fasting)", "mg/dL"),
    BLOOD_GLUCOSE_RANDOM("Blood Glucose (Random)", "mg/dL"),
    BLOOD_GLUCOSE_POST_MEAL("Blood Glucose (Post-Meal)", "mg/dL"),
    TEMPERATURE("Body Temperature", "°C"),
    OXYGEN_SATURATION("Oxygen Saturation", "%"),
    HEART_RATE("Heart Rate", "bpm"),
    RESPIRATORY_RATE("Respiratory Rate", "breaths/min"),
    CHOLESTEROL_TOTAL("Total Cholesterol", "mg/dL"),
    CHOLESTEROL_LDL("LDL Cholesterol", "mg/dL"),
    CHOLESTEROL_HDL("HDL Cholesterol", "mg/dL"),
    TRIGLYCERIDES("Triglycerides", "mg/dL"),
    HBA1C("HbA1c", "%");

    private final String label;
    private final String unit;

    MetricKind(String label, String unit) {
        this.label = label;
        this.unit = unit;
    }

    public String getLabel() {
        return label;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * Resolve a wire name such as {@code "heart_rate"} to a kind.
     * @param name metric type name, case-insensitive
     * @return the kind, or empty when the name is blank or not in the catalog
     */
    public static Optional<MetricKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
