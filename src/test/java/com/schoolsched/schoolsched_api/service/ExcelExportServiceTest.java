package com.schoolsched.schoolsched_api.service;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.SESSION;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.YEAR;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.fullWeek;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.PublishRequest;
import com.schoolsched.schoolsched_api.exception.ScheduleNotFoundException;

class ExcelExportServiceTest {

    private InMemorySchoolData data;
    private ExcelExportService exportService;

    @BeforeEach
    void setUp() {
        data = new InMemorySchoolData();
        exportService = new ExcelExportService(data.entryRepository, data.publishedScheduleRepository);
        data.add(fullWeek("A"));
    }

    @Test
    void writesOneRowPerPeriodAndOneColumnPerDay() throws Exception {
        publish(null);

        ByteArrayInputStream in = exportService.generateScheduleExcel(YEAR, SESSION, "A", "1");

        try (HSSFWorkbook workbook = new HSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet("Schedule");
            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Grade 7 - section 1 (morning)");
            assertThat(sheet.getRow(2).getCell(0).getStringCellValue()).isEqualTo("Period");
            assertThat(sheet.getRow(2).getCell(1).getStringCellValue()).isEqualTo("Sunday");
            assertThat(sheet.getRow(2).getCell(5).getStringCellValue()).isEqualTo("Thursday");
            assertThat(sheet.getRow(3).getCell(0).getStringCellValue()).isEqualTo("Period 1");
            assertThat(sheet.getRow(3).getCell(1).getStringCellValue()).isEqualTo("Subject 1\nTeacher 1");
            assertThat(sheet.getRow(8).getCell(5).getStringCellValue()).isEqualTo("Subject 6\nTeacher 6");
            assertThat(sheet.getLastRowNum()).isEqualTo(8);
        }
    }

    @Test
    void filenameFollowsTheScheduleName() {
        publish(null);

        assertThat(exportService.getExcelFilename(YEAR, SESSION, "A", "1"))
                .isEqualTo("Schedule_Grade_7_-_section_1_morning.xls");
    }

    @Test
    void filenameFallsBackToClassAndSection() {
        assertThat(exportService.getExcelFilename(YEAR, SESSION, "A", "1")).isEqualTo("Schedule_A_1-morning.xls");
    }

    @Test
    void unpublishedGridCannotBeExported() {
        assertThatThrownBy(() -> exportService.generateScheduleExcel(YEAR, SESSION, "A", "1"))
                .isInstanceOf(ScheduleNotFoundException.class);
    }

    private void publish(String name) {
        ScheduleWorkflowService workflow = data.workflow();
        SchedulePreview preview = workflow.generatePreview(new GenerateScheduleRequest(YEAR, SESSION, "A", null),
                "scheduler");
        workflow.publish(new PublishRequest(preview.getToken(), name, null), "admin");
    }
}
