package com.xendex.backend.services.sequence;

import java.util.List;

public record BulkApprovalResult(int approved, int failed, List<ApprovalResult> results) {
}
