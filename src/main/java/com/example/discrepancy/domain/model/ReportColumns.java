package com.example.discrepancy.domain.model;

import java.util.List;

/**
 * Header names the pipeline works with.
 * The first three must be present in every uploaded report; {@code discrepancy} is added to the output.
 */
public record ReportColumns(
        String materialId,
        String requestedQuantity,
        String receivedQuantity,
        String discrepancy
) {

    public List<String> required() {
        return List.of(materialId, requestedQuantity, receivedQuantity);
    }
}
