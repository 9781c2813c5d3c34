package com.schoolsched.schoolsched_api.service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.exception.ScheduleNotFoundException;
import com.schoolsched.schoolsched_api.model.PublishedSchedule;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.WeekGrid;
import com.schoolsched.schoolsched_api.repository.PublishedScheduleRepository;
import com.schoolsched.schoolsched_api.repository.ScheduleEntryRepository;
import com.schoolsched.schoolsched_api.solver.ScheduleCell;
import com.schoolsched.schoolsched_api.solver.ScheduleGrid;

/**
 * Weekly grid of one published class/section as an .xls workbook: one row per period, one column per day.
 */
@Service
public class ExcelExportService {

    private static final Logger logger = LoggerFactory.getLogger(ExcelExportService.class);

    private final ScheduleEntryRepository entryRepository;
    private final PublishedScheduleRepository publishedScheduleRepository;

    public ExcelExportService(ScheduleEntryRepository entryRepository,
                              PublishedScheduleRepository publishedScheduleRepository) {
        this.entryRepository = entryRepository;
        this.publishedScheduleRepository = publishedScheduleRepository;
    }

    public String getExcelFilename(String academicYearId, SessionType sessionType, String classId, String section) {
        Optional<PublishedSchedule> header = publishedScheduleRepository
                .findByAcademicYearIdAndSessionTypeAndClassIdAndSection(academicYearId, sessionType, classId, section);
        if (header.isPresent()) {
            return String.format("Schedule_%s.xls", sanitize(header.get().getName().replace(' ', '_')));
        }
        logger.warn("No schedule header for class {} section {}. Using default filename.", classId, section);
        return String.format("Schedule_%s_%s-%s.xls", sanitize(classId), sanitize(section), sessionType.getValue());
    }

    public ByteArrayInputStream generateScheduleExcel(String academicYearId, SessionType sessionType, String classId,
                                                      String section) throws IOException {
        logger.info("Generating Excel schedule for class {} section {} ({}, year {})", classId, section,
                sessionType.getValue(), academicYearId);

        List<ScheduleEntry> entries = entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassIdAndSection(
                academicYearId, sessionType, classId, section);
        if (entries.isEmpty()) {
            logger.warn("No published schedule for class {} section {}", classId, section);
            throw new ScheduleNotFoundException(new ScheduleKey(academicYearId, sessionType, classId, section));
        }
        ScheduleGrid grid = ScheduleGrid.fromEntries(classId, section, entries);
        String title = publishedScheduleRepository
                .findByAcademicYearIdAndSessionTypeAndClassIdAndSection(academicYearId, sessionType, classId, section)
                .map(PublishedSchedule::getName)
                .orElse("Class " + classId + " - section " + section + " (" + sessionType.getValue() + ")");

        try (Workbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Schedule");
            sheet.setDefaultColumnWidth(22);

            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle boldStyle = createBoldStyle(workbook);
            CellStyle wrappedStyle = createWrappedStyle(workbook);

            Row titleRow = sheet.createRow(0);
            Cell titleCell = titleRow.createCell(0);
            titleCell.setCellValue(title);
            CellStyle titleStyle = workbook.createCellStyle();
            Font titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 14);
            titleStyle.setFont(titleFont);
            titleStyle.setAlignment(HorizontalAlignment.CENTER);
            titleCell.setCellStyle(titleStyle);
            sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, WeekGrid.DAYS));

            Row headerRow = sheet.createRow(2);
            Cell corner = headerRow.createCell(0);
            corner.setCellValue("Period");
            corner.setCellStyle(headerStyle);
            for (int day = 0; day < WeekGrid.DAYS; day++) {
                Cell cell = headerRow.createCell(day + 1);
                cell.setCellValue(WeekGrid.dayName(day));
                cell.setCellStyle(headerStyle);
            }

            for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
                Row row = sheet.createRow(period + 3);
                row.setHeightInPoints(32);
                Cell periodCell = row.createCell(0);
                periodCell.setCellValue("Period " + (period + 1));
                periodCell.setCellStyle(boldStyle);
                for (int day = 0; day < WeekGrid.DAYS; day++) {
                    Cell cell = row.createCell(day + 1);
                    ScheduleCell scheduled = grid.cellAt(day, period);
                    cell.setCellValue(scheduled == null ? "" : scheduled.subjectName() + "\n"
                            + (scheduled.teacherName() != null ? scheduled.teacherName() : "N/A"));
                    cell.setCellStyle(wrappedStyle);
                }
            }

            workbook.write(out);
            logger.info("Excel file generated for class {} section {} ({} cells)", classId, section, entries.size());
            return new ByteArrayInputStream(out.toByteArray());
        } catch (IOException e) {
            logger.error("Error generating Excel for class {} section {}: {}", classId, section, e.getMessage());
            throw e;
        }
    }

    private static String sanitize(String value) {
        return value == null ? "" : value.replaceAll("[^a-zA-Z0-9\\-_]", "");
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.SEA_GREEN.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private CellStyle createBoldStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    // Subject on the first line, teacher on the second
    private CellStyle createWrappedStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setWrapText(true);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.TOP);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private void setBorder(CellStyle style, BorderStyle borderStyle) {
        style.setBorderBottom(borderStyle);
        style.setBorderTop(borderStyle);
        style.setBorderLeft(borderStyle);
        style.setBorderRight(borderStyle);
    }
}
