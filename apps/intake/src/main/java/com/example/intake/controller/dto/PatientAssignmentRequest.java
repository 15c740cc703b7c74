package com.example.intake.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record PatientAssignmentRequest(
        @NotBlank(message = "Patient ID is required")
        @Pattern(regexp = "^[a-zA-Z0-9_.:-]{1,128}$", message = "Patient ID contains invalid characters")
        String patientId,

        @Size(max = 200, message = "Patient name must not exceed 200 characters")
        String patientName
) {}
