package com.example.discrepancy.interfaces.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * API-layer DTO returned after a successful upload.
 */
public record TaskHandleResponse(@JsonProperty("task_id") String taskId) {
}
