package com.example.intake.controller;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.controller.dto.DocumentListResponse;
import com.example.intake.controller.dto.DocumentSummary;
import com.example.intake.controller.dto.PatientAssignmentRequest;
import com.example.intake.storage.DocumentRepository;
import com.example.intake.storage.StoredDocument;
import com.example.intake.workflow.WorkflowAssessment;
import com.example.intake.workflow.WorkflowSideData;
import com.example.intake.workflow.WorkflowStatusDeriver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/intake")
@RequiredArgsConstructor
public class PatientDocumentController {

    private final DocumentRepository documentRepository;
    private final WorkflowStatusDeriver workflowStatusDeriver;

    @GetMapping("/patients/{patientId}/documents")
    public Mono<DocumentListResponse> patientDocuments(@PathVariable String patientId) {
        validateId(patientId, "patient");
        log.debug("GET /patients/{}/documents", StringSanitizer.forLog(patientId));
        return documentRepository.findPatientDocuments(patientId)
                .map(DocumentListResponse::from);
    }

    /**
     * Workflow status of a patient's SGK case, derived from the stored documents plus the
     * externally tracked steps in the body.
     */
    @PostMapping("/patients/{patientId}/workflow")
    public Mono<WorkflowAssessment> workflow(
            @PathVariable String patientId,
            @RequestBody(required = false) WorkflowSideData sideData) {
        validateId(patientId, "patient");
        log.debug("POST /patients/{}/workflow", StringSanitizer.forLog(patientId));
        WorkflowSideData side = sideData == null ? WorkflowSideData.none() : sideData;
        return documentRepository.findPatientDocuments(patientId)
                .map(documents -> workflowStatusDeriver.assess(
                        documents.stream().map(StoredDocument::toExtractedDocument).toList(), side));
    }

    @GetMapping("/triage")
    public Mono<DocumentListResponse> triage() {
        log.debug("GET /triage");
        return documentRepository.findTriageDocuments()
                .map(DocumentListResponse::from);
    }

    @DeleteMapping("/documents/{documentId}")
    public Mono<ResponseEntity<Void>> deleteDocument(@PathVariable String documentId) {
        validateId(documentId, "document");
        log.debug("DELETE /documents/{}", StringSanitizer.forLog(documentId));
        return documentRepository.deleteDocument(documentId)
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    /**
     * Manual reconciliation of a document to a patient.
     */
    @PutMapping("/documents/{documentId}/patient")
    public Mono<DocumentSummary> assignPatient(
            @PathVariable String documentId,
            @Valid @RequestBody PatientAssignmentRequest request) {
        validateId(documentId, "document");
        log.debug("PUT /documents/{}/patient - patientId: {}",
                StringSanitizer.forLog(documentId), StringSanitizer.forLog(request.patientId()));
        return documentRepository.assignToPatient(documentId, request.patientId(), request.patientName())
                .map(DocumentSummary::from)
                .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Document not found")));
    }

    private static void validateId(String id, String kind) {
        if (!StringSanitizer.isValidSafeId(id)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid " + kind + " ID");
        }
    }
}
