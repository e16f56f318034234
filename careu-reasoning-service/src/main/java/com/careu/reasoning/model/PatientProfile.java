package com.careu.reasoning.model;

import com.careu.reasoning.exception.InvalidQueryException;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Patient attributes the safety validator reasons over.
 * <p>
 * Built from an open key/value map. Only the keys below are recognised; any
 * other key is kept in {@link #ignoredAttributes()} and has no effect.
 */
public record PatientProfile(
        Set<String> allergies,
        Set<String> conditions,
        Set<String> medications,
        Integer age,
        boolean pregnant,
        boolean renalImpairment,
        boolean hepaticImpairment,
        Set<String> ignoredAttributes
) {

    public static final String ALLERGIES = "allergies";
    public static final String CONDITIONS = "conditions";
    public static final String MEDICATIONS = "medications";
    public static final String AGE = "age";
    public static final String PREGNANT = "pregnant";
    public static final String RENAL_IMPAIRMENT = "renal-impairment";
    public static final String HEPATIC_IMPAIRMENT = "hepatic-impairment";

    private static final PatientProfile EMPTY =
            new PatientProfile(Set.of(), Set.of(), Set.of(), null, false, false, false, Set.of());

    public PatientProfile {
        allergies = Set.copyOf(allergies);
        conditions = Set.copyOf(conditions);
        medications = Set.copyOf(medications);
        ignoredAttributes = Set.copyOf(ignoredAttributes);
    }

    public static PatientProfile empty() {
        return EMPTY;
    }

    public static PatientProfile from(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return EMPTY;
        }
        Set<String> ignored = new TreeSet<>();
        for (String key : attributes.keySet()) {
            if (!isRecognised(key)) ignored.add(key);
        }
        return new PatientProfile(
                readIds(attributes, ALLERGIES),
                readIds(attributes, CONDITIONS),
                readIds(attributes, MEDICATIONS),
                readAge(attributes.get(AGE)),
                readFlag(attributes, PREGNANT),
                readFlag(attributes, RENAL_IMPAIRMENT),
                readFlag(attributes, HEPATIC_IMPAIRMENT),
                ignored
        );
    }

    public boolean hasAllergy(String id) {
        return allergies.contains(id);
    }

    public boolean hasCondition(String id) {
        return conditions.contains(id);
    }

    public boolean takes(String medicationId) {
        return medications.contains(medicationId);
    }

    private static boolean isRecognised(String key) {
        return switch (key) {
            case ALLERGIES, CONDITIONS, MEDICATIONS, AGE, PREGNANT, RENAL_IMPAIRMENT, HEPATIC_IMPAIRMENT -> true;
            default -> false;
        };
    }

    private static Set<String> readIds(Map<String, ?> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null) return Set.of();
        Set<String> ids = new TreeSet<>();
        if (value instanceof Collection<?> values) {
            for (Object item : values) {
                ids.add(requireId(key, item));
            }
        } else {
            ids.add(requireId(key, value));
        }
        return ids;
    }

    private static String requireId(String key, Object item) {
        if (!(item instanceof String id) || id.isBlank()) {
            throw new InvalidQueryException("Profile attribute '" + key + "' must list non-blank identifiers", key);
        }
        if (!Identifiers.isCanonical(id)) {
            throw new InvalidQueryException("Profile attribute '" + key + "' has malformed identifier '" + id
                    + "', expected lowercase hyphenated tokens", key);
        }
        return id;
    }

    private static Integer readAge(Object value) {
        if (value == null) return null;
        int age;
        if (value instanceof Number number) {
            age = wholeNumber(number);
        } else {
            try {
                age = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidQueryException("Profile attribute 'age' is not a whole number: " + value, AGE);
            }
        }
        if (age < 0 || age > 150) {
            throw new InvalidQueryException("Profile attribute 'age' is out of range: " + age, AGE);
        }
        return age;
    }

    private static int wholeNumber(Number number) {
        BigDecimal exact;
        try {
            exact = new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("Profile attribute 'age' is not a whole number: " + number, AGE);
        }
        if (exact.stripTrailingZeros().scale() > 0) {
            throw new InvalidQueryException("Profile attribute 'age' is not a whole number: " + number, AGE);
        }
        try {
            return exact.intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidQueryException("Profile attribute 'age' is out of range: " + number, AGE);
        }
    }

    private static boolean readFlag(Map<String, ?> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null) return false;
        if (value instanceof Boolean flag) return flag;
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) return true;
        if (text.equalsIgnoreCase("false")) return false;
        throw new InvalidQueryException("Profile attribute '" + key + "' must be true or false: " + value, key);
    }
}
