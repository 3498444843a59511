package com.example.discrepancy.interfaces.api;

import com.example.discrepancy.application.exception.ApplicationException;
import com.example.discrepancy.application.service.ReportTaskService;
import com.example.discrepancy.domain.exception.DomainException;
import com.example.discrepancy.domain.model.ReportTask;
import com.example.discrepancy.infrastructure.exception.InfrastructureException;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;

/**
 * Interfaces-layer controller exposing the upload, status and result endpoints for procurement reports,
 * plus a small HTML upload page.
 */
@Controller
public class DiscrepancyReportController {

    static final MediaType XLSX_MEDIA_TYPE =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ReportTaskService reportTaskService;

    /**
     * Creates the controller with the required application service.
     *
     * @param reportTaskService service running the report workflow
     */
    public DiscrepancyReportController(ReportTaskService reportTaskService) {
        this.reportTaskService = reportTaskService;
    }

    /**
     * Renders the upload page.
     *
     * @param model model used to expose attributes to the Thymeleaf view
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model) {
        model.addAttribute("task", null);
        model.addAttribute("error", null);
        return "upload";
    }

    /**
     * Handles form submissions from the upload page.
     *
     * @param file  uploaded workbook
     * @param model model used for view rendering
     * @return upload view name populated with the new task or an error
     */
    @PostMapping("/submit")
    public String handleFormUpload(@RequestParam("file") MultipartFile file, Model model) {
        try {
            ReportTask task = reportTaskService.submit(file);
            model.addAttribute("task", task);
            model.addAttribute("error", null);
        } catch (DomainException | ApplicationException ex) {
            model.addAttribute("task", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            model.addAttribute("task", null);
            model.addAttribute("error", "We couldn't store that report. Please try again.");
        }
        return "upload";
    }

    /**
     * Accepts a report and starts processing it in the background.
     *
     * @param file uploaded {@code .xlsx} workbook
     * @return the handle to poll
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<TaskHandleResponse> upload(@RequestParam("file") MultipartFile file) {
        ReportTask task = reportTaskService.submit(file);
        return ResponseEntity.ok(new TaskHandleResponse(task.taskId()));
    }

    /**
     * Reports the state of a task.
     *
     * @param taskId handle returned by the upload
     * @return status payload
     */
    @GetMapping(value = "/status/{taskId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<TaskStatusResponse> status(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskStatusResponse.from(reportTaskService.status(taskId)));
    }

    /**
     * Streams the result workbook of a successful task.
     *
     * @param taskId handle returned by the upload
     * @return workbook download
     */
    @GetMapping("/result/{taskId}")
    @ResponseBody
    public ResponseEntity<Resource> result(@PathVariable String taskId) {
        Path output = reportTaskService.result(taskId);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename("result_" + taskId + ".xlsx")
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(XLSX_MEDIA_TYPE)
                .body(new FileSystemResource(output));
    }
}
