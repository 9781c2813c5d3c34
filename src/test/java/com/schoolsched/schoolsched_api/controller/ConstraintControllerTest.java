package com.schoolsched.schoolsched_api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.security.JwtService;
import com.schoolsched.schoolsched_api.security.SecurityConfig;
import com.schoolsched.schoolsched_api.service.ConstraintService;

@WebMvcTest(ConstraintController.class)
@Import({ SecurityConfig.class, JwtService.class })
class ConstraintControllerTest {

    private static final String FORBIDDEN_BODY = "{\"academicYearId\":\"2025-2026\",\"constraintType\":\"FORBIDDEN\","
            + "\"subjectId\":\"A-S1\",\"dayOfWeek\":4,\"sessionType\":\"evening\",\"priorityLevel\":3}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConstraintService constraintService;

    @Test
    @WithMockUser(roles = "ADMIN")
    void adminCreatesConstraint() throws Exception {
        when(constraintService.createConstraint(any(ScheduleConstraint.class))).thenAnswer(inv -> {
            ScheduleConstraint constraint = inv.getArgument(0);
            constraint.setId("c1");
            return constraint;
        });

        mockMvc.perform(post("/api/schedule-constraints").contentType(MediaType.APPLICATION_JSON).content(FORBIDDEN_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value("c1"))
                .andExpect(jsonPath("$.data.sessionType").value("evening"));
        verify(constraintService).createConstraint(argThat(c -> c.getConstraintType() == ConstraintType.FORBIDDEN
                && c.getSessionType() == SessionType.EVENING && c.getPriorityLevel() == 3));
    }

    @Test
    @WithMockUser(roles = "SCHEDULER")
    void schedulerCannotCreateConstraint() throws Exception {
        mockMvc.perform(post("/api/schedule-constraints").contentType(MediaType.APPLICATION_JSON).content(FORBIDDEN_BODY))
                .andExpect(status().isForbidden());
        verify(constraintService, never()).createConstraint(any(ScheduleConstraint.class));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void invalidConstraintIsBadRequest() throws Exception {
        when(constraintService.createConstraint(any(ScheduleConstraint.class)))
                .thenThrow(new IllegalArgumentException("priorityLevel must be between 1 and 4, got 9"));

        mockMvc.perform(post("/api/schedule-constraints").contentType(MediaType.APPLICATION_JSON).content(FORBIDDEN_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }

    @Test
    @WithMockUser(roles = "SCHEDULER")
    void schedulerReadsOneConstraint() throws Exception {
        ScheduleConstraint constraint = new ScheduleConstraint("2025-2026", ConstraintType.FORBIDDEN);
        constraint.setId("c1");
        when(constraintService.getConstraint("c1")).thenReturn(constraint);

        mockMvc.perform(get("/api/schedule-constraints/c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.constraintType").value("FORBIDDEN"));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void adminUpdatesConstraint() throws Exception {
        when(constraintService.updateConstraint(eq("c1"), any(ScheduleConstraint.class)))
                .thenAnswer(inv -> inv.getArgument(1));

        mockMvc.perform(put("/api/schedule-constraints/c1").contentType(MediaType.APPLICATION_JSON).content(FORBIDDEN_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Constraint updated."))
                .andExpect(jsonPath("$.data.priorityLevel").value(3));
    }

    @Test
    @WithMockUser(roles = "SCHEDULER")
    void schedulerCannotUpdateConstraint() throws Exception {
        mockMvc.perform(put("/api/schedule-constraints/c1").contentType(MediaType.APPLICATION_JSON).content(FORBIDDEN_BODY))
                .andExpect(status().isForbidden());
        verify(constraintService, never()).updateConstraint(any(), any());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void deletingUnknownConstraintIsNotFound() throws Exception {
        doThrow(new NoSuchElementException("Constraint with ID x not found."))
                .when(constraintService).deleteConstraint("x");

        mockMvc.perform(delete("/api/schedule-constraints/x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }
}
