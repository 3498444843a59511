package com.example.discrepancy.interfaces.api;

import com.example.discrepancy.TestWorkbooks;
import com.example.discrepancy.application.exception.ReportQueueFullException;
import com.example.discrepancy.application.service.ReportTaskService;
import com.example.discrepancy.domain.exception.MissingColumnsException;
import com.example.discrepancy.domain.exception.ResultNotAvailableException;
import com.example.discrepancy.domain.exception.TaskNotFoundException;
import com.example.discrepancy.domain.exception.UnsupportedReportFormatException;
import com.example.discrepancy.domain.model.ReportTask;
import com.example.discrepancy.infrastructure.exception.ReportStorageException;
import com.example.discrepancy.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.model;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = DiscrepancyReportController.class)
@Import(GlobalExceptionHandler.class)
class DiscrepancyReportControllerApiTests {

    private static final String TASK_ID = "3f1c2b7e-0000-4000-8000-000000000001";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportTaskService reportTaskService;

    @TempDir
    Path tempDir;

    /**
     * Verifies that an accepted upload returns the task handle.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void uploadReturnsTaskId() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willReturn(ReportTask.pending(TASK_ID, Path.of("out.xlsx"), Instant.now()));

        mockMvc.perform(multipart("/upload").file(reportFile("report.xlsx")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value(TASK_ID));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unsupportedFormatMappedToBadRequest() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willThrow(new UnsupportedReportFormatException("report.csv", "Only .xlsx reports are supported"));

        mockMvc.perform(multipart("/upload").file(reportFile("report.csv")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"))
                .andExpect(jsonPath("$.message").value("Only .xlsx reports are supported: report.csv"))
                .andExpect(jsonPath("$.details.fileName").value("report.csv"))
                .andExpect(jsonPath("$.path").value("/upload"));
    }

    /**
     * Verifies that a request without the file part is rejected before reaching the service.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingFilePartMappedToBadRequest() throws Exception {
        mockMvc.perform(multipart("/upload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("FILE_REQUIRED"))
                .andExpect(jsonPath("$.details.part").value("file"));
    }

    /**
     * Verifies that a saturated worker pool translates to HTTP 503.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void fullQueueMappedToServiceUnavailable() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willThrow(new ReportQueueFullException(TASK_ID, new RejectedExecutionException("full")));

        mockMvc.perform(multipart("/upload").file(reportFile("report.xlsx")))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("REPORT_QUEUE_FULL"))
                .andExpect(jsonPath("$.details.taskId").value(TASK_ID));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void storageFailureMappedToServerError() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willThrow(new ReportStorageException("Unable to store", Path.of("temp", "x_input.xlsx"), new IOException("disk full")));

        mockMvc.perform(multipart("/upload").file(reportFile("report.xlsx")))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies that an upload above the multipart limit translates to HTTP 413.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void oversizedUploadMappedToPayloadTooLarge() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willThrow(new MaxUploadSizeExceededException(20L * 1024 * 1024));

        mockMvc.perform(multipart("/upload").file(reportFile("report.xlsx")))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error").value("FILE_TOO_LARGE"))
                .andExpect(jsonPath("$.details.maxUploadSize").value(20 * 1024 * 1024));
    }

    /**
     * Verifies that requests for unmapped paths keep their 404 status instead of becoming server errors.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownPathMappedToNotFound() throws Exception {
        mockMvc.perform(get("/favicon.ico"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/favicon.ico"));

        mockMvc.perform(get("/status/"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void unsupportedMethodMappedToMethodNotAllowed() throws Exception {
        mockMvc.perform(delete("/status/{taskId}", TASK_ID))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string(HttpHeaders.ALLOW, containsString("GET")))
                .andExpect(jsonPath("$.error").value("METHOD_NOT_ALLOWED"));
    }

    @Test
    void pendingStatusHasNoError() throws Exception {
        BDDMockito.given(reportTaskService.status(TASK_ID))
                .willReturn(ReportTask.pending(TASK_ID, Path.of("out.xlsx"), Instant.now()));

        mockMvc.perform(get("/status/{taskId}", TASK_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value(TASK_ID))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.error").value(nullValue()));
    }

    @Test
    void failedStatusCarriesReason() throws Exception {
        String reason = "Report processing failed: " + new MissingColumnsException(List.of("Requested quantity")).getMessage();
        BDDMockito.given(reportTaskService.status(TASK_ID))
                .willReturn(ReportTask.pending(TASK_ID, Path.of("out.xlsx"), Instant.now()).failed(reason, Instant.now()));

        mockMvc.perform(get("/status/{taskId}", TASK_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value(reason));
    }

    /**
     * Verifies that unknown task ids translate to HTTP 404 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownTaskMappedToNotFound() throws Exception {
        BDDMockito.given(reportTaskService.status("nope")).willThrow(new TaskNotFoundException("nope"));

        mockMvc.perform(get("/status/{taskId}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("TASK_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Task not found: nope"));
    }

    @Test
    void unfinishedResultMappedToNotFound() throws Exception {
        BDDMockito.given(reportTaskService.result(TASK_ID))
                .willThrow(new ResultNotAvailableException(TASK_ID, "Task is not finished or has failed: " + TASK_ID));

        mockMvc.perform(get("/result/{taskId}", TASK_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("RESULT_NOT_AVAILABLE"));
    }

    /**
     * Verifies that a finished result is served as an xlsx attachment named after the task.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void resultDownloadedAsAttachment() throws Exception {
        Path output = Files.write(tempDir.resolve(TASK_ID + "_output.xlsx"), TestWorkbooks.sampleReport());
        BDDMockito.given(reportTaskService.result(TASK_ID)).willReturn(output);

        mockMvc.perform(get("/result/{taskId}", TASK_ID))
                .andExpect(status().isOk())
                .andExpect(content().contentType(TestWorkbooks.XLSX_CONTENT_TYPE))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("result_" + TASK_ID + ".xlsx")))
                .andExpect(content().bytes(Files.readAllBytes(output)));
    }

    @Test
    void uploadPageRenders() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("upload"));
    }

    /**
     * Verifies that the HTML form shows the new task handle.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void formSubmissionShowsTask() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willReturn(ReportTask.pending(TASK_ID, Path.of("out.xlsx"), Instant.now()));

        mockMvc.perform(multipart("/submit").file(reportFile("report.xlsx")))
                .andExpect(status().isOk())
                .andExpect(view().name("upload"))
                .andExpect(model().attributeExists("task"))
                .andExpect(content().string(containsString("/status/" + TASK_ID)));
    }

    /**
     * Verifies that the HTML form shows validation errors instead of failing the request.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void formSubmissionShowsError() throws Exception {
        BDDMockito.given(reportTaskService.submit(BDDMockito.any(MultipartFile.class)))
                .willThrow(new UnsupportedReportFormatException("report.csv", "Only .xlsx reports are supported"));

        mockMvc.perform(multipart("/submit").file(reportFile("report.csv")))
                .andExpect(status().isOk())
                .andExpect(model().attribute("error", "Only .xlsx reports are supported: report.csv"));
    }

    private static MockMultipartFile reportFile(String fileName) {
        return new MockMultipartFile("file", fileName, TestWorkbooks.XLSX_CONTENT_TYPE, TestWorkbooks.sampleReport());
    }
}
