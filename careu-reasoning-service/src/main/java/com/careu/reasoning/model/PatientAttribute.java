package com.careu.reasoning.model;

public record PatientAttribute(
        String id,
        String name,
        AttributeKind kind,
        Integer minAge,
        Integer maxAge
) {

    public boolean coversAge(int age) {
        if (minAge != null && age < minAge) return false;
        return maxAge == null || age <= maxAge;
    }
}
