package com.careu.reasoning.model;

import com.careu.reasoning.exception.InvalidQueryException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PatientProfileTest {

    @Test
    void readsRecognisedKeys() {
        PatientProfile profile = PatientProfile.from(Map.of(
                "allergies", List.of("penicillin"),
                "conditions", List.of("kidney-disease"),
                "medications", "warfarin",
                "age", "67",
                "hepatic-impairment", true));

        assertThat(profile.hasAllergy("penicillin")).isTrue();
        assertThat(profile.hasCondition("kidney-disease")).isTrue();
        assertThat(profile.takes("warfarin")).isTrue();
        assertThat(profile.age()).isEqualTo(67);
        assertThat(profile.hepaticImpairment()).isTrue();
        assertThat(profile.pregnant()).isFalse();
        assertThat(profile.ignoredAttributes()).isEmpty();
    }

    @Test
    void unknownKeys_areIgnored() {
        PatientProfile profile = PatientProfile.from(Map.of("favourite-colour", "blue", "age", 30));

        assertThat(profile.ignoredAttributes()).containsExactly("favourite-colour");
        assertThat(profile.age()).isEqualTo(30);
    }

    @Test
    void nullOrEmptyMap_isEmptyProfile() {
        assertThat(PatientProfile.from(null)).isEqualTo(PatientProfile.empty());
        assertThat(PatientProfile.from(new HashMap<>())).isEqualTo(PatientProfile.empty());
    }

    @Test
    void unparseableAge_isInvalidQuery() {
        assertThatThrownBy(() -> PatientProfile.from(Map.of("age", "old")))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("age");
        assertThatThrownBy(() -> PatientProfile.from(Map.of("age", -3)))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void nonBooleanFlag_isInvalidQuery() {
        assertThatThrownBy(() -> PatientProfile.from(Map.of("pregnant", "maybe")))
                .isInstanceOf(InvalidQueryException.class)
                .extracting(e -> ((InvalidQueryException) e).getIdentifier())
                .isEqualTo("pregnant");
    }

    @Test
    void blankIdentifier_isInvalidQuery() {
        assertThatThrownBy(() -> PatientProfile.from(Map.of("medications", List.of(" "))))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void nonCanonicalIdentifier_isInvalidQuery() {
        assertThatThrownBy(() -> PatientProfile.from(Map.of("conditions", List.of("Bleeding-Disorder"))))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("malformed identifier 'Bleeding-Disorder'")
                .extracting(e -> ((InvalidQueryException) e).getIdentifier())
                .isEqualTo("conditions");
        assertThatThrownBy(() -> PatientProfile.from(Map.of("medications", List.of("Warfarin "))))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> PatientProfile.from(Map.of("allergies", "penicillin allergy")))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void integralNumericAge_isAccepted() {
        assertThat(PatientProfile.from(Map.of("age", 42L)).age()).isEqualTo(42);
        assertThat(PatientProfile.from(Map.of("age", 42.0)).age()).isEqualTo(42);
    }

    @Test
    void fractionalAge_isInvalidQuery() {
        assertThatThrownBy(() -> PatientProfile.from(Map.of("age", 17.9)))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("not a whole number");
        assertThatThrownBy(() -> PatientProfile.from(Map.of("age", Double.NaN)))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void ageBeyondIntRange_isNotWrapped() {
        assertThatThrownBy(() -> PatientProfile.from(Map.of("age", 4294967313L)))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("out of range");
    }
}
