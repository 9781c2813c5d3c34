package com.schoolsched.schoolsched_api.exception;

import java.util.List;

import com.schoolsched.schoolsched_api.dto.FeasibilityReport;
import com.schoolsched.schoolsched_api.dto.ObstructionDetail;

/**
 * Generation refused before any work was done. Always fixable by changing the inputs.
 */
public class FeasibilityException extends SchedulingException {

    private final FeasibilityReport report;

    public FeasibilityException(FeasibilityReport report) {
        super("FEASIBILITY_FAILED", "Schedule cannot be generated: " + report.obstructions().size()
                + " obstruction(s) found for class " + report.classId());
        this.report = report;
    }

    public FeasibilityReport getReport() {
        return report;
    }

    public List<ObstructionDetail> getObstructions() {
        return report.obstructions();
    }

    @Override
    public Object getDetails() {
        return report.obstructions();
    }
}
