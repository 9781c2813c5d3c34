package com.schoolsched.schoolsched_api.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.schoolsched.schoolsched_api.dto.ApiResponse;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.service.ConstraintService;

@RestController
@RequestMapping("/api/schedule-constraints")
public class ConstraintController {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintController.class);

    private final ConstraintService constraintService;

    public ConstraintController(ConstraintService constraintService) {
        this.constraintService = constraintService;
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<List<ScheduleConstraint>>> getConstraints(@RequestParam String academicYearId) {
        logger.debug(">>> Received constraint list request for year {}", academicYearId);
        return ResponseEntity.ok(ApiResponse.ok(constraintService.getConstraints(academicYearId)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<ScheduleConstraint>> getConstraint(@PathVariable String id) {
        logger.debug(">>> Received request for constraint {}", id);
        return ResponseEntity.ok(ApiResponse.ok(constraintService.getConstraint(id)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ScheduleConstraint>> createConstraint(@RequestBody ScheduleConstraint constraint) {
        logger.info(">>> Received request to create {} constraint", constraint.getConstraintType());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(constraintService.createConstraint(constraint), "Constraint created."));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ScheduleConstraint>> updateConstraint(@PathVariable String id,
                                                                           @RequestBody ScheduleConstraint constraint) {
        logger.info(">>> Received request to update constraint {}", id);
        return ResponseEntity.ok(ApiResponse.ok(constraintService.updateConstraint(id, constraint),
                "Constraint updated."));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteConstraint(@PathVariable String id) {
        logger.warn(">>> Received request to DELETE constraint {}", id);
        constraintService.deleteConstraint(id);
        return ResponseEntity.ok(ApiResponse.ok(null, "Constraint deleted."));
    }
}
