package com.schoolsched.schoolsched_api.service;

import java.time.Instant;
import java.util.List;

import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.solver.ScheduleGrid;

/**
 * A validated, unpersisted batch of grids held in memory until it is published or discarded.
 */
public class SchedulePreview {

    private final String token;
    private final GenerateScheduleRequest request;
    private final String classDisplayName;
    private final List<ScheduleGrid> grids;
    private final String requestedBy;
    private final Instant createdAt;
    private final Instant expiresAt;

    public SchedulePreview(String token, GenerateScheduleRequest request, String classDisplayName,
                           List<ScheduleGrid> grids, String requestedBy, Instant createdAt, Instant expiresAt) {
        this.token = token;
        this.request = request;
        this.classDisplayName = classDisplayName;
        this.grids = List.copyOf(grids);
        this.requestedBy = requestedBy;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getToken() { return token; }
    public GenerateScheduleRequest getRequest() { return request; }
    public String getClassDisplayName() { return classDisplayName; }
    public List<ScheduleGrid> getGrids() { return grids; }
    public String getRequestedBy() { return requestedBy; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }

    public int getCellCount() {
        return grids.stream().mapToInt(ScheduleGrid::getFilledCount).sum();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
