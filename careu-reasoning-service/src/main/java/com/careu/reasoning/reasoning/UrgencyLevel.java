package com.careu.reasoning.reasoning;

import com.careu.reasoning.model.Condition;
import com.careu.reasoning.model.SeverityTier;

public enum UrgencyLevel {

    EMERGENCY,
    URGENT,
    ROUTINE;

    /** Conditions that must be treated within this many hours count as emergencies. */
    public static final int EMERGENCY_WINDOW_HOURS = 6;

    /** Routine findings above this confidence are raised to urgent for high-risk ages. */
    public static final double AGE_ESCALATION_CONFIDENCE = 0.4;

    public static final int YOUNG_CHILD_AGE_LIMIT = 5;
    public static final int ELDERLY_AGE_LIMIT = 65;

    private static final int URGENT_FOLLOW_UP_HOURS = 24;

    public static UrgencyLevel of(Condition condition) {
        if (condition.tier() == SeverityTier.CRITICAL) return EMERGENCY;
        Integer hours = condition.timeSensitiveHours();
        if (hours != null && hours <= EMERGENCY_WINDOW_HOURS) return EMERGENCY;
        if (condition.tier() == SeverityTier.URGENT) return URGENT;
        return ROUTINE;
    }

    /**
     * Urgency for a patient: a routine condition held with more than
     * {@link #AGE_ESCALATION_CONFIDENCE} confidence becomes urgent for a patient
     * under {@link #YOUNG_CHILD_AGE_LIMIT} or over {@link #ELDERLY_AGE_LIMIT}.
     */
    public static UrgencyLevel of(Condition condition, double confidence, Integer age) {
        UrgencyLevel base = of(condition);
        if (base == ROUTINE && isHighRiskAge(age) && confidence > AGE_ESCALATION_CONFIDENCE) {
            return URGENT;
        }
        return base;
    }

    public static boolean isHighRiskAge(Integer age) {
        return age != null && (age < YOUNG_CHILD_AGE_LIMIT || age > ELDERLY_AGE_LIMIT);
    }

    public String recommendedAction(boolean redFlagsPresent) {
        return switch (this) {
            case EMERGENCY -> redFlagsPresent
                    ? "Call emergency services or go to the emergency department immediately. Red flags detected."
                    : "Seek immediate medical attention at the emergency department.";
            case URGENT -> "Arrange a medical appointment within 24 hours.";
            case ROUTINE -> "Schedule an appointment with a primary care physician.";
        };
    }

    /** When the patient should next be seen; a recorded treatment window shortens the urgent default. */
    public String followUp(Integer timeSensitiveHours) {
        return switch (this) {
            case EMERGENCY -> "Immediate (emergency department visit required)";
            case URGENT -> timeSensitiveHours != null && timeSensitiveHours <= URGENT_FOLLOW_UP_HOURS
                    ? "Within " + timeSensitiveHours + " hours"
                    : "Within " + URGENT_FOLLOW_UP_HOURS + " hours";
            case ROUTINE -> "1-2 weeks, or sooner if symptoms worsen";
        };
    }
}
