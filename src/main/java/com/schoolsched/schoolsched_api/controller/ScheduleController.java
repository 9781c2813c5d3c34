package com.schoolsched.schoolsched_api.controller;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.Principal;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.schoolsched.schoolsched_api.dto.ApiResponse;
import com.schoolsched.schoolsched_api.dto.ConflictDetail;
import com.schoolsched.schoolsched_api.dto.DeleteResponse;
import com.schoolsched.schoolsched_api.dto.FeasibilityReport;
import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.PreviewResponse;
import com.schoolsched.schoolsched_api.dto.PublishRequest;
import com.schoolsched.schoolsched_api.dto.PublishResponse;
import com.schoolsched.schoolsched_api.dto.ScheduleStatistics;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.service.ConflictResolverService;
import com.schoolsched.schoolsched_api.service.ExcelExportService;
import com.schoolsched.schoolsched_api.service.GenerationState;
import com.schoolsched.schoolsched_api.service.ScheduleDeletionService;
import com.schoolsched.schoolsched_api.service.SchedulePreview;
import com.schoolsched.schoolsched_api.service.ScheduleQueryService;
import com.schoolsched.schoolsched_api.service.ScheduleStatisticsService;
import com.schoolsched.schoolsched_api.service.ScheduleWorkflowService;

import jakarta.servlet.http.HttpServletResponse;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleWorkflowService workflowService;
    private final ScheduleDeletionService deletionService;
    private final ConflictResolverService conflictResolverService;
    private final ScheduleQueryService queryService;
    private final ExcelExportService excelExportService;
    private final ScheduleStatisticsService statisticsService;

    public ScheduleController(ScheduleWorkflowService workflowService, ScheduleDeletionService deletionService,
                              ConflictResolverService conflictResolverService, ScheduleQueryService queryService,
                              ExcelExportService excelExportService, ScheduleStatisticsService statisticsService) {
        this.workflowService = workflowService;
        this.deletionService = deletionService;
        this.conflictResolverService = conflictResolverService;
        this.queryService = queryService;
        this.excelExportService = excelExportService;
        this.statisticsService = statisticsService;
    }

    @PostMapping("/validate")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<FeasibilityReport>> validate(@RequestBody GenerateScheduleRequest request) {
        logger.info(">>> Received /validate request: {}", request);
        FeasibilityReport report = workflowService.validateFeasibility(request);
        return ResponseEntity.ok(ApiResponse.ok(report, report.feasible()
                ? "Class can be scheduled."
                : report.obstructions().size() + " obstruction(s) prevent scheduling."));
    }

    @PostMapping("/preview")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<PreviewResponse>> preview(@RequestBody GenerateScheduleRequest request,
                                                                Principal principal) {
        logger.info(">>> Received /preview request from {}: {}", principal.getName(), request);
        SchedulePreview preview = workflowService.generatePreview(request, principal.getName());
        return ResponseEntity.ok(ApiResponse.ok(workflowService.toResponse(preview), "Preview ready."));
    }

    @GetMapping("/preview/{token}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<PreviewResponse>> getPreview(@PathVariable String token) {
        logger.debug(">>> Received preview lookup for token: {}", token);
        return ResponseEntity.ok(ApiResponse.ok(workflowService.toResponse(workflowService.getPreview(token))));
    }

    @GetMapping("/status/{token}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getStatus(@PathVariable String token) {
        logger.debug(">>> Received status check request for token: {}", token);
        GenerationState state = workflowService.getState(token);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("previewToken", token, "state", state.name(),
                "terminal", state.isTerminal())));
    }

    @DeleteMapping("/preview/{token}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<Map<String, Object>>> discardPreview(@PathVariable String token) {
        logger.info(">>> Received request to discard preview {}", token);
        workflowService.discard(token);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("previewToken", token, "state", GenerationState.DISCARDED.name()),
                "Preview discarded."));
    }

    @PostMapping("/publish")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<PublishResponse>> publish(@RequestBody PublishRequest request,
                                                                Principal principal) {
        logger.info(">>> Received /publish request from {} (token: {}, name: {})", principal.getName(),
                request.previewToken(), request.name());
        PublishResponse response = workflowService.publish(request, principal.getName());
        return ResponseEntity.ok(ApiResponse.ok(response, "Published " + response.publishedCount() + " cell(s)."));
    }

    @DeleteMapping("/class-schedule")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<DeleteResponse>> deleteClassSchedule(@RequestParam String academicYearId,
                                                                           @RequestParam SessionType sessionType,
                                                                           @RequestParam String classId,
                                                                           @RequestParam String section) {
        logger.warn(">>> Received request to DELETE schedule of class {} section {} ({}, year {})",
                classId, section, sessionType.getValue(), academicYearId);
        DeleteResponse response = deletionService.deleteClassSchedule(academicYearId, sessionType, classId, section);
        return ResponseEntity.ok(ApiResponse.ok(response, "Schedule deleted successfully."));
    }

    @GetMapping("/conflicts/{classId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<List<ConflictDetail>>> resolveConflicts(@PathVariable String classId) {
        logger.info(">>> Received conflict scan request for class {}", classId);
        List<ConflictDetail> conflicts = conflictResolverService.resolveConflicts(classId);
        return ResponseEntity.ok(ApiResponse.ok(conflicts, conflicts.isEmpty()
                ? "No conflicts found." : conflicts.size() + " conflict(s) found."));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<List<ScheduleEntry>>> getSchedule(@RequestParam String academicYearId,
                                                                       @RequestParam SessionType sessionType,
                                                                       @RequestParam String classId,
                                                                       @RequestParam(required = false) String section) {
        logger.info(">>> Received schedule request for class {} section {}", classId, section);
        return ResponseEntity.ok(ApiResponse.ok(
                queryService.getPublishedCells(academicYearId, sessionType, classId, section)));
    }

    @GetMapping("/statistics")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<ScheduleStatistics>> getStatistics(@RequestParam String academicYearId,
                                                                        @RequestParam SessionType sessionType,
                                                                        @RequestParam String classId,
                                                                        @RequestParam(required = false) String section) {
        logger.info(">>> Received statistics request for class {} section {}", classId, section);
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getStatistics(academicYearId, sessionType, classId, section)));
    }

    @GetMapping("/export")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public void exportSchedule(@RequestParam String academicYearId, @RequestParam SessionType sessionType,
                               @RequestParam String classId, @RequestParam String section,
                               HttpServletResponse response) throws IOException {
        logger.info(">>> Received request to export schedule of class {} section {}", classId, section);
        ByteArrayInputStream bis = excelExportService.generateScheduleExcel(academicYearId, sessionType, classId, section);
        String filename = excelExportService.getExcelFilename(academicYearId, sessionType, classId, section);

        response.setContentType("application/vnd.ms-excel");
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"");
        bis.transferTo(response.getOutputStream());
        response.flushBuffer();
        logger.info(">>> Successfully exported schedule of class {} section {}", classId, section);
    }
}
