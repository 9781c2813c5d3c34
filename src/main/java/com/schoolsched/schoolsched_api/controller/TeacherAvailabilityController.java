package com.schoolsched.schoolsched_api.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.schoolsched.schoolsched_api.dto.ApiResponse;
import com.schoolsched.schoolsched_api.dto.AvailabilityDeclaration;
import com.schoolsched.schoolsched_api.dto.AvailabilityView;
import com.schoolsched.schoolsched_api.dto.ClassAvailabilitySummary;
import com.schoolsched.schoolsched_api.service.ClassAvailabilityService;
import com.schoolsched.schoolsched_api.service.TeacherAvailabilityService;

@RestController
@RequestMapping("/api/teachers")
public class TeacherAvailabilityController {

    private static final Logger logger = LoggerFactory.getLogger(TeacherAvailabilityController.class);

    private final TeacherAvailabilityService availabilityService;
    private final ClassAvailabilityService classAvailabilityService;

    public TeacherAvailabilityController(TeacherAvailabilityService availabilityService,
                                         ClassAvailabilityService classAvailabilityService) {
        this.availabilityService = availabilityService;
        this.classAvailabilityService = classAvailabilityService;
    }

    @GetMapping("/{teacherId}/availability")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<AvailabilityView>> getAvailability(@PathVariable String teacherId) {
        logger.debug(">>> Received availability request for teacher {}", teacherId);
        return ResponseEntity.ok(ApiResponse.ok(availabilityService.getAvailability(teacherId)));
    }

    @PutMapping("/{teacherId}/availability")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<AvailabilityView>> declareAvailability(@PathVariable String teacherId,
                                                                             @RequestBody AvailabilityDeclaration declaration) {
        logger.info(">>> Received availability declaration for teacher {}", teacherId);
        return ResponseEntity.ok(ApiResponse.ok(availabilityService.declare(teacherId, declaration),
                "Availability updated."));
    }

    @GetMapping("/availability/class/{classId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SCHEDULER')")
    public ResponseEntity<ApiResponse<ClassAvailabilitySummary>> getClassAvailability(
            @PathVariable String classId, @RequestParam(required = false) String section) {
        logger.debug(">>> Received teacher sufficiency request for class {} section {}", classId, section);
        return ResponseEntity.ok(ApiResponse.ok(classAvailabilityService.summarize(classId, section)));
    }
}
