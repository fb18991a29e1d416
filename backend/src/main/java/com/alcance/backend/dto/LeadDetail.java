package com.alcance.backend.dto;

import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.domain.Lead;

import java.util.List;

public record LeadDetail(
    Lead lead,
    List<EmailLog> emailLogs
) {}
