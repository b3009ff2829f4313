package org.surveyworkbench.service.masterfile;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.surveyworkbench.models.entity.ParticipantRecord;
import org.surveyworkbench.models.enums.MasterfileFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Spreadsheet masterfile. Rows are keyed by the participant id in column A of the data sheet;
 * results are always saved as a legacy {@code .xls} workbook.
 */
@Slf4j
@Component
public class SpreadsheetMasterfileWriter implements MasterfileWriter {

    public static final String DEFAULT_DATA_SHEET = "Data";

    private final String dataSheetName;
    private final int duplicateScanLastRow;
    private final DataFormatter formatter = new DataFormatter();

    public SpreadsheetMasterfileWriter(@Value("${workbench.masterfile.data-sheet:" + DEFAULT_DATA_SHEET + "}") String dataSheetName,
                                       @Value("${workbench.masterfile.duplicate-scan-last-row:1000}") int duplicateScanLastRow) {
        this.dataSheetName = dataSheetName;
        this.duplicateScanLastRow = duplicateScanLastRow;
    }

    @Override
    public boolean supports(MasterfileFormat format) {
        return format.isSpreadsheet();
    }

    @Override
    public boolean containsParticipant(Path masterfile, String participantId) throws IOException {
        if (!Files.exists(masterfile)) {
            return false;
        }
        try (Workbook workbook = open(masterfile)) {
            if (workbook.getNumberOfSheets() == 0) {
                return false;
            }
            Sheet sheet = dataSheet(workbook);
            // rows 2..duplicateScanLastRow, the first row holds the header
            for (int rowIndex = 1; rowIndex < duplicateScanLastRow; rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                if (row == null) {
                    continue;
                }
                String value = formatter.formatCellValue(row.getCell(0)).trim();
                if (!value.isEmpty() && value.equals(participantId)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public Path append(Path masterfile, ParticipantRecord record) throws IOException {
        MasterfileFormat format = MasterfileFormat.fromPath(masterfile);
        try (Workbook workbook = Files.exists(masterfile) ? open(masterfile) : create(format)) {
            if (workbook.getNumberOfSheets() == 0) {
                workbook.createSheet(dataSheetName);
            }
            Sheet sheet = dataSheet(workbook);
            int rowIndex = firstEmptyRow(sheet);

            Map<String, String> sorted = new TreeMap<>(record.getFields());
            sorted.remove(ParticipantRecord.PARTICIPANT_ID);
            if (rowIndex == 0) {
                writeRow(sheet, rowIndex, ParticipantRecord.PARTICIPANT_ID, List.copyOf(sorted.keySet()));
                rowIndex++;
            }
            writeRow(sheet, rowIndex, record.getParticipantId(), List.copyOf(sorted.values()));
            log.info("Wrote participant {} to row {} of sheet '{}' in {}",
                    record.getParticipantId(), rowIndex + 1, sheet.getSheetName(), masterfile);

            if (format == MasterfileFormat.XLS) {
                save(workbook, masterfile);
                return masterfile;
            }
            Path legacyPath = legacyPath(masterfile);
            try (Workbook legacy = toLegacy(workbook)) {
                save(legacy, legacyPath);
            }
            log.info("Saved legacy copy {}; later extractions target it", legacyPath);
            return legacyPath;
        }
    }

    static Path legacyPath(Path masterfile) {
        String filename = masterfile.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String base = dot < 0 ? filename : filename.substring(0, dot);
        return masterfile.resolveSibling(base + "." + MasterfileFormat.XLS.getExtension());
    }

    private Workbook open(Path masterfile) throws IOException {
        try (InputStream in = Files.newInputStream(masterfile)) {
            return WorkbookFactory.create(in);
        }
    }

    private Workbook create(MasterfileFormat format) {
        return format == MasterfileFormat.XLS ? new HSSFWorkbook() : new XSSFWorkbook();
    }

    private Sheet dataSheet(Workbook workbook) {
        Sheet named = workbook.getSheet(dataSheetName);
        return named != null ? named : workbook.getSheetAt(0);
    }

    private int firstEmptyRow(Sheet sheet) {
        int rowIndex = 0;
        while (!isBlank(sheet.getRow(rowIndex))) {
            rowIndex++;
        }
        return rowIndex;
    }

    private boolean isBlank(Row row) {
        if (row == null) {
            return true;
        }
        Cell cell = row.getCell(0);
        return cell == null || cell.getCellType() == CellType.BLANK;
    }

    private void writeRow(Sheet sheet, int rowIndex, String first, List<String> rest) {
        int maxColumns = sheet.getWorkbook().getSpreadsheetVersion().getMaxColumns();
        if (rest.size() + 1 > maxColumns) {
            throw new IllegalStateException("Record has " + (rest.size() + 1)
                    + " columns, the workbook allows " + maxColumns);
        }
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            row = sheet.createRow(rowIndex);
        }
        row.createCell(0).setCellValue(first);
        for (int i = 0; i < rest.size(); i++) {
            row.createCell(i + 1).setCellValue(rest.get(i));
        }
    }

    private Workbook toLegacy(Workbook source) {
        HSSFWorkbook legacy = new HSSFWorkbook();
        SpreadsheetVersion version = SpreadsheetVersion.EXCEL97;
        for (int s = 0; s < source.getNumberOfSheets(); s++) {
            Sheet from = source.getSheetAt(s);
            Sheet to = legacy.createSheet(from.getSheetName());
            for (Row row : from) {
                if (row.getRowNum() > version.getLastRowIndex()) {
                    throw new IllegalStateException("Sheet '" + from.getSheetName() + "' exceeds "
                            + version.getMaxRows() + " rows and cannot be saved as .xls");
                }
                Row copy = to.createRow(row.getRowNum());
                for (Cell cell : row) {
                    if (cell.getColumnIndex() > version.getLastColumnIndex()) {
                        throw new IllegalStateException("Sheet '" + from.getSheetName() + "' exceeds "
                                + version.getMaxColumns() + " columns and cannot be saved as .xls");
                    }
                    copyValue(cell, copy.createCell(cell.getColumnIndex()));
                }
            }
        }
        return legacy;
    }

    private void copyValue(Cell from, Cell to) {
        CellType type = from.getCellType() == CellType.FORMULA ? from.getCachedFormulaResultType() : from.getCellType();
        switch (type) {
            case STRING -> to.setCellValue(from.getStringCellValue());
            case NUMERIC -> to.setCellValue(from.getNumericCellValue());
            case BOOLEAN -> to.setCellValue(from.getBooleanCellValue());
            default -> to.setBlank();
        }
    }

    private void save(Workbook workbook, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            workbook.write(out);
        }
    }
}
