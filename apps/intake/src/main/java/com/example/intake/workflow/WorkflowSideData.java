package com.example.intake.workflow;

/**
 * Facts about a patient's SGK case that are not carried by documents, reported by other
 * subsystems (eligibility query, sales, invoicing).
 */
public record WorkflowSideData(
        boolean eligibilityQueried,
        boolean prescriptionRegistered,
        boolean materialDelivered,
        boolean invoiced,
        boolean paymentReceived,
        boolean rejected
) {
    public static WorkflowSideData none() {
        return new WorkflowSideData(false, false, false, false, false, false);
    }
}
