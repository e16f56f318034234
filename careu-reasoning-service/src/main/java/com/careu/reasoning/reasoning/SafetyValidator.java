package com.careu.reasoning.reasoning;

import com.careu.reasoning.exception.UnknownTreatmentException;
import com.careu.reasoning.model.ContraindicationRule;
import com.careu.reasoning.model.DoseAdjustmentRule;
import com.careu.reasoning.model.DrugInteractionRule;
import com.careu.reasoning.model.PatientAttribute;
import com.careu.reasoning.model.PatientProfile;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.model.RuleSeverity;
import com.careu.reasoning.model.Treatment;
import com.careu.reasoning.repository.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a proposed treatment against a patient profile.
 * <p>
 * Absolute contraindications block the treatment. Caution-level
 * contraindications, drug interactions and the treatment's general safety
 * warnings are reported as warnings, and matched dose-adjustment rules are
 * reported separately. Lists are ordered by rule severity, then rule id.
 */
public class SafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(SafetyValidator.class);

    private static final String ALLERGY_SUFFIX = "-allergy";

    public SafetyResult validate(String treatmentId, PatientProfile profile, FactStore store) {
        Treatment treatment = store.findTreatment(treatmentId)
                .orElseThrow(() -> new UnknownTreatmentException(treatmentId));
        if (!profile.ignoredAttributes().isEmpty()) {
            log.debug("Ignoring unrecognised profile attributes {}", profile.ignoredAttributes());
        }

        List<SafetyFinding> contraindications = new ArrayList<>();
        List<SafetyFinding> warnings = new ArrayList<>();
        List<SafetyFinding> doseAdjustments = new ArrayList<>();

        for (ContraindicationRule rule : treatment.contraindications()) {
            PatientAttribute trigger = attribute(store, rule.triggerId());
            if (!applies(trigger, profile)) continue;
            SafetyFinding finding = new SafetyFinding(
                    rule.id(),
                    FindingKind.CONTRAINDICATION,
                    rule.severity(),
                    trigger.id(),
                    (rule.isBlocking() ? "Contraindicated: " : "Use with caution: ")
                            + treatment.name() + " with " + trigger.name()
                            + (rule.guidance() == null ? "" : ". " + rule.guidance()),
                    List.of(
                            store.requireFact(treatment.id(), Relation.CONTRAINDICATION, rule.id()).id(),
                            store.requireFact(rule.id(), Relation.TRIGGERED_BY, trigger.id()).id(),
                            store.requireLiteralFact(rule.id(), Relation.RULE_SEVERITY, rule.severity().token()).id()
                    ));
            (rule.isBlocking() ? contraindications : warnings).add(finding);
        }

        for (DrugInteractionRule rule : store.interactionsInvolving(treatment.id())) {
            String counterpart = rule.counterpartOf(treatment.id());
            if (counterpart == null || !profile.takes(counterpart)) continue;
            warnings.add(new SafetyFinding(
                    rule.id(),
                    FindingKind.DRUG_INTERACTION,
                    rule.severity(),
                    counterpart,
                    "Interaction between " + treatment.name() + " and " + store.displayName(counterpart)
                            + ": " + rule.guidance(),
                    List.of(
                            store.requireFact(rule.treatmentId(), Relation.DRUG_INTERACTION, rule.id()).id(),
                            store.requireFact(rule.id(), Relation.INTERACTS_WITH, rule.partnerId()).id()
                    )));
        }

        for (DoseAdjustmentRule rule : treatment.doseAdjustments()) {
            PatientAttribute trigger = attribute(store, rule.triggerId());
            if (!applies(trigger, profile)) continue;
            doseAdjustments.add(new SafetyFinding(
                    rule.id(),
                    FindingKind.DOSE_ADJUSTMENT,
                    rule.severity(),
                    trigger.id(),
                    "Adjust " + treatment.name() + " dose for " + trigger.name() + ": " + rule.guidance(),
                    List.of(
                            store.requireFact(treatment.id(), Relation.REQUIRES_DOSE_ADJUSTMENT, rule.id()).id(),
                            store.requireFact(rule.id(), Relation.TRIGGERED_BY, trigger.id()).id()
                    )));
        }

        for (String advisory : treatment.safetyWarnings()) {
            warnings.add(new SafetyFinding(
                    treatment.id(),
                    FindingKind.ADVISORY,
                    RuleSeverity.MINOR,
                    null,
                    advisory,
                    List.of(store.requireLiteralFact(treatment.id(), Relation.SAFETY_WARNING, advisory).id())
            ));
        }

        contraindications.sort(SafetyFinding.ORDER);
        warnings.sort(SafetyFinding.ORDER);
        doseAdjustments.sort(SafetyFinding.ORDER);

        boolean blocked = !contraindications.isEmpty();
        if (blocked) {
            log.info("Treatment {} blocked by {}", treatment.id(),
                    contraindications.stream().map(SafetyFinding::ruleId).toList());
        }
        return new SafetyResult(treatment.id(), treatment.name(), blocked, contraindications, warnings, doseAdjustments);
    }

    boolean applies(PatientAttribute attribute, PatientProfile profile) {
        String id = attribute.id();
        return switch (attribute.kind()) {
            case ALLERGY -> profile.hasAllergy(id)
                    || profile.allergies().stream().anyMatch(allergen -> id.equals(allergen + ALLERGY_SUFFIX));
            case CONDITION -> profile.hasCondition(id);
            case AGE_BAND -> profile.age() != null && attribute.coversAge(profile.age());
            case PREGNANCY -> profile.pregnant() || profile.hasCondition(id);
            case RENAL -> profile.renalImpairment() || profile.hasCondition(id);
            case HEPATIC -> profile.hepaticImpairment() || profile.hasCondition(id);
        };
    }

    private static PatientAttribute attribute(FactStore store, String id) {
        return store.findAttribute(id)
                .orElseThrow(() -> new IllegalStateException("Rule trigger " + id + " is not a patient attribute"));
    }
}
