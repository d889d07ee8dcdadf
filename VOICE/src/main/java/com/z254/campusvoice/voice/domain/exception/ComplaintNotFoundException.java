package com.z254.campusvoice.voice.domain.exception;

public class ComplaintNotFoundException extends RuntimeException {

    private final String complaintId;

    public ComplaintNotFoundException(String complaintId) {
        super("Complaint not found: " + complaintId);
        this.complaintId = complaintId;
    }

    public String getComplaintId() {
        return complaintId;
    }
}
