package com.z254.campusvoice.voice.domain.service;

import com.z254.campusvoice.voice.domain.model.Complaint;

import java.util.List;

public record ComplaintPage(List<Complaint> complaints, long total, int limit, int offset) {
}
