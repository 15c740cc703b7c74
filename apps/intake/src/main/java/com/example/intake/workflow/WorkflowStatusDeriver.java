package com.example.intake.workflow;

import com.example.intake.classification.DocumentBundle;
import com.example.intake.classification.DocumentType;
import com.example.intake.pipeline.ExtractedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes a patient's workflow status from their reconciled documents and side data.
 * Stateless; every call recomputes from its arguments. Only matched documents count,
 * so documents still awaiting review never advance the workflow.
 */
@Slf4j
@Component
public class WorkflowStatusDeriver {

    @NonNull
    public WorkflowStatus deriveStatus(@Nullable Collection<ExtractedDocument> documents) {
        return assess(documents, WorkflowSideData.none()).status();
    }

    @NonNull
    public WorkflowStatus deriveStatus(@Nullable Collection<ExtractedDocument> documents,
                                       @Nullable WorkflowSideData sideData) {
        return assess(documents, sideData).status();
    }

    @NonNull
    public WorkflowAssessment assess(@Nullable Collection<ExtractedDocument> documents,
                                     @Nullable WorkflowSideData sideData) {
        WorkflowSideData facts = sideData == null ? WorkflowSideData.none() : sideData;
        Set<DocumentType> present = presentTypes(documents);

        Set<DocumentBundle> completed = EnumSet.noneOf(DocumentBundle.class);
        Map<DocumentBundle, Set<DocumentType>> missing = new EnumMap<>(DocumentBundle.class);
        List<String> warnings = new ArrayList<>();

        for (DocumentBundle bundle : DocumentBundle.values()) {
            Set<DocumentType> required = bundle.getRequiredTypes();
            Set<DocumentType> absent = EnumSet.copyOf(required);
            absent.removeAll(present);
            if (absent.isEmpty()) {
                completed.add(bundle);
            } else if (absent.size() < required.size()) {
                missing.put(bundle, Collections.unmodifiableSet(absent));
                warnings.add("Eksik belgeler (" + bundle.getCode() + "): " + absent.stream()
                        .map(DocumentType::getLabel)
                        .collect(Collectors.joining(", ")));
            }
        }

        WorkflowStatus status = resolve(facts, present, completed);
        log.debug("Derived workflow status {} from {} document types, {} complete bundles",
                status, present.size(), completed.size());

        return new WorkflowAssessment(
                status,
                status.getLabel(),
                Collections.unmodifiableSet(completed),
                Collections.unmodifiableMap(missing),
                List.copyOf(warnings));
    }

    private static WorkflowStatus resolve(WorkflowSideData facts,
                                          Set<DocumentType> present,
                                          Set<DocumentBundle> completed) {
        if (facts.rejected()) {
            return WorkflowStatus.REDDEDILEN;
        }
        if (facts.paymentReceived()) {
            return WorkflowStatus.ODEMESI_ALINDI;
        }
        if (facts.invoiced()) {
            return WorkflowStatus.FATURALANDI;
        }
        if (!completed.isEmpty()) {
            return WorkflowStatus.BELGELER_YUKLENDI;
        }
        if (facts.materialDelivered()) {
            return WorkflowStatus.MALZEME_TESLIM_EDILDI;
        }
        if (facts.prescriptionRegistered() || present.stream().anyMatch(DocumentType::isPrescription)) {
            return WorkflowStatus.RECETE_KAYDEDILDI;
        }
        if (facts.eligibilityQueried()) {
            return WorkflowStatus.SORGULANDI;
        }
        return WorkflowStatus.BEKLEYEN;
    }

    private static Set<DocumentType> presentTypes(@Nullable Collection<ExtractedDocument> documents) {
        Set<DocumentType> present = EnumSet.noneOf(DocumentType.class);
        if (documents == null) {
            return present;
        }
        for (ExtractedDocument document : documents) {
            if (document == null || document.getStatus() == null || !document.getStatus().isMatched()) {
                continue;
            }
            if (document.getClassification() != null && document.getClassification().type() != null) {
                present.add(document.getClassification().type());
            }
        }
        return present;
    }
}
