package com.example.intake.workflow;

import com.example.intake.classification.DocumentBundle;
import com.example.intake.classification.DocumentType;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derived workflow view of one patient.
 *
 * @param status           highest stage reached
 * @param statusLabel      Turkish display label of {@code status}
 * @param completedBundles bundles with every required document present
 * @param missingDocuments per started but incomplete bundle, the document types still missing
 * @param warnings         human-readable notes about missing documents
 */
public record WorkflowAssessment(
        WorkflowStatus status,
        String statusLabel,
        Set<DocumentBundle> completedBundles,
        Map<DocumentBundle, Set<DocumentType>> missingDocuments,
        List<String> warnings
) {
}
