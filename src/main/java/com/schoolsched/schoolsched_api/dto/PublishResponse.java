package com.schoolsched.schoolsched_api.dto;

import java.util.List;

public record PublishResponse(int publishedCount, List<PublishedGrid> schedules) {

    public record PublishedGrid(String id, String name, String section, int cellCount) {
    }
}
