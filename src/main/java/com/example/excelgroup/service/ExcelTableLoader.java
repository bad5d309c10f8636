package com.example.excelgroup.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 读取 xlsx/xls 的指定 sheet。所有单元格按显示文本读成字符串，避免长编号丢精度；
 * 日期格式的数值单元格直接读成日期文本。
 */
@Slf4j
@Component
public class ExcelTableLoader {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final short GENERAL_FORMAT = 0;

    public List<String> listSheets(InputStream input) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        }
    }

    /**
     * @param sheetName 为空时读第一个 sheet
     * @param headerRow 表头行，1 开始
     */
    public LoadedTable load(InputStream input, String fileName, String sheetName, int headerRow) throws IOException {
        if (headerRow < 1) {
            throw new IllegalArgumentException("表头行必须从 1 开始：" + headerRow);
        }
        try (Workbook workbook = WorkbookFactory.create(input)) {
            Sheet sheet = resolveSheet(workbook, sheetName);
            int headerIndex = headerRow - 1;
            Row header = sheet.getRow(headerIndex);
            if (header == null || header.getLastCellNum() <= 0) {
                throw new IllegalStateException("表头行为空，请检查表头行设置：第 " + headerRow + " 行");
            }

            DataFormatter fmt = new DataFormatter();
            fmt.setUseCachedValuesForFormulaCells(true);
            int width = header.getLastCellNum();
            List<String> headers = readHeaders(header, width, fmt);

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                Map<String, String> values = new LinkedHashMap<>();
                for (int c = 0; c < width; c++) {
                    Cell cell = row == null ? null : row.getCell(c);
                    values.put(headers.get(c), readCell(cell, fmt));
                }
                rows.add(Collections.unmodifiableMap(values));
            }
            log.info("读取 {} / {}：表头第 {} 行，{} 列，{} 行数据", fileName, sheet.getSheetName(),
                    headerRow, headers.size(), rows.size());
            return new LoadedTable(fileName, sheet.getSheetName(), headerRow, headers, rows);
        }
    }

    private Sheet resolveSheet(Workbook workbook, String sheetName) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new IllegalStateException("文件中没有 sheet。");
        }
        if (sheetName == null || sheetName.isBlank()) {
            return workbook.getSheetAt(0);
        }
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw new IllegalArgumentException("找不到 sheet：" + sheetName);
        }
        return sheet;
    }

    private List<String> readHeaders(Row header, int width, DataFormatter fmt) {
        List<String> headers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int c = 0; c < width; c++) {
            Cell cell = header.getCell(c);
            String name = cell == null ? "" : fmt.formatCellValue(cell).trim();
            if (name.isBlank()) {
                name = "Unnamed: " + c;
            }
            if (!seen.add(name)) {
                throw new GroupingConfigException("表头列重复：" + name);
            }
            headers.add(name);
        }
        return headers;
    }

    private String readCell(Cell cell, DataFormatter fmt) {
        if (cell == null) {
            return "";
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (cellType == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime value = cell.getLocalDateTimeCellValue();
            if (value != null) {
                return value.toLocalTime().equals(LocalTime.MIDNIGHT) ? value.format(DATE) : value.format(DATE_TIME);
            }
        }
        // 常规格式的长编号会被显示成 1.23457E+11，按原始数值输出
        if (cellType == CellType.NUMERIC && cell.getCellStyle().getDataFormat() == GENERAL_FORMAT) {
            return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
        }
        return fmt.formatCellValue(cell);
    }
}
