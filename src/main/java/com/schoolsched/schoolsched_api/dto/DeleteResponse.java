package com.schoolsched.schoolsched_api.dto;

import java.util.List;

public record DeleteResponse(long deletedCount, List<String> restoredTeachers) {
}
