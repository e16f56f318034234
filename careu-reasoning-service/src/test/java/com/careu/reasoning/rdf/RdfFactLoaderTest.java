package com.careu.reasoning.rdf;

import com.careu.reasoning.TestFacts;
import com.careu.reasoning.exception.FactStoreLoadException;
import com.careu.reasoning.model.Fact;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.repository.FactStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RdfFactLoaderTest {

    private static final String MINIMAL = """
            id:flu a kb:Condition ;
                schema:name "Flu" ;
                kb:has-urgency "common" ;
                kb:has-symptom id:fever, id:cough ;
                kb:red-flag-symptom id:cough ;
                kb:has-treatment id:rest .
            id:fever a kb:Symptom .
            id:cough a kb:Symptom .
            id:rest a kb:Treatment ;
                schema:name "Rest" .
            """;

    @Test
    void loadsMinimalSource_intoIndexedStore() {
        FactStore store = TestFacts.fromTurtle(MINIMAL);

        assertThat(store.generation()).isEqualTo(1);
        assertThat(store.source()).isEqualTo("fixture");
        assertThat(store.conditions()).extracting(c -> c.id()).containsExactly("flu");
        assertThat(store.findFact("flu|has-urgency|\"common\"")).isPresent();
        assertThat(store.bySubjectAndRelation("flu", Relation.HAS_SYMPTOM))
                .extracting(Fact::object)
                .containsExactly("cough", "fever");
    }

    @Test
    void loadsBundledKnowledgeBase() {
        FactStore store = TestFacts.bundled();

        assertThat(store.conditions()).hasSize(14);
        assertThat(store.findTreatment("aspirin")).isPresent();
        assertThat(store.size()).isGreaterThan(400);
    }

    @Test
    void rejectsUnknownRelation() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "id:flu kb:cures id:rest ."))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("Unknown relation");
    }

    @Test
    void rejectsDanglingSymptom() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "id:flu kb:has-symptom id:headache ."))
                .isInstanceOf(FactStoreLoadException.class);
    }

    @Test
    void rejectsDanglingInteractionPartner() {
        String source = MINIMAL + """
                id:rest kb:drug-interaction id:ix-rest-coffee .
                id:ix-rest-coffee a kb:DrugInteractionRule ;
                    kb:interacts-with id:coffee ;
                    kb:rule-severity "minor" ;
                    kb:guidance "Avoid before sleeping." .
                """;

        assertThatThrownBy(() -> TestFacts.fromTurtle(source))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("undeclared entity coffee")
                .extracting(e -> ((FactStoreLoadException) e).getIdentifier())
                .isEqualTo("coffee");
    }

    @Test
    void rejectsRedFlagOutsideSymptomSet() {
        String source = MINIMAL + """
                id:rash a kb:Symptom .
                id:flu kb:red-flag-symptom id:rash .
                """;

        assertThatThrownBy(() -> TestFacts.fromTurtle(source))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("is not one of its symptoms");
    }

    @Test
    void rejectsTreatmentNoConditionReferences() {
        String source = MINIMAL + """
                id:surgery a kb:Treatment ;
                    schema:name "Surgery" .
                """;

        assertThatThrownBy(() -> TestFacts.fromTurtle(source))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("surgery is not linked to any condition");
    }

    @Test
    void rejectsMalformedTurtle() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "id:flu schema:name \"Flu ."))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("Malformed fact source fixture");
        assertThatThrownBy(() -> TestFacts.fromTurtle("id:flu a kb:Condition ;; kb:x"))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("Malformed fact source");
    }

    @Test
    void rejectsBlankNodeSubject() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "[] kb:has-urgency \"common\" ."))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("Blank node");
    }

    @Test
    void rejectsEntityOutsideKnownNamespace() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "<http://other.example/x> a kb:Symptom ."))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("outside the entity namespace");
    }

    @Test
    void rejectsNonCanonicalIdentifier() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "id:Fever a kb:Symptom ."))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("canonical");
    }

    @Test
    void rejectsRelationOnWrongSubjectType() {
        assertThatThrownBy(() -> TestFacts.fromTurtle(MINIMAL + "id:fever kb:has-treatment id:rest ."))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("does not apply to Symptom fever");
    }

    @Test
    void rejectsRuleSharedByTwoTreatments() {
        String source = MINIMAL + """
                id:flu kb:has-treatment id:fluids .
                id:fluids a kb:Treatment ;
                    schema:name "Fluids" ;
                    kb:requires-dose-adjustment id:da-shared .
                id:rest kb:requires-dose-adjustment id:da-shared .
                id:elderly a kb:PatientAttribute ;
                    kb:attribute-kind "age-band" ;
                    kb:min-age 65 .
                id:da-shared a kb:DoseAdjustmentRule ;
                    kb:triggered-by id:elderly ;
                    kb:guidance "Halve it." .
                """;

        assertThatThrownBy(() -> TestFacts.fromTurtle(source))
                .isInstanceOf(FactStoreLoadException.class)
                .hasMessageContaining("exactly one treatment, found 2");
    }
}
