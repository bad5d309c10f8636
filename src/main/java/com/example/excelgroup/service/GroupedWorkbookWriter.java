package com.example.excelgroup.service;

import com.example.excelgroup.config.ExcelGroupProperties;
import lombok.RequiredArgsConstructor;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 输出分组后的 xlsx：每个明细行一行，Key 列每行都写值，再按合并区域合并居中。
 * 布局为 [序号] + Key 列 + 明细列，表头在第一行。
 */
@Component
@RequiredArgsConstructor
public class GroupedWorkbookWriter {

    public static final int HEADER_ROW_INDEX = 0;
    private static final int MAX_COLUMN_CHARS = 60;

    private final ExcelGroupProperties properties;
    private final DetailValueConverter detailValueConverter;

    public List<String> headers(GroupedTable table) {
        List<String> headers = new ArrayList<>();
        if (properties.hasSerialColumn()) {
            headers.add(properties.serialColumnHeader());
        }
        headers.addAll(table.keyColumns());
        for (String column : table.detailColumns()) {
            headers.add(properties.outputName(column));
        }
        return headers;
    }

    /**
     * 需要合并的列：序号列（如有）和全部 Key 列。明细列从不合并。
     */
    public List<Integer> mergeColumnIndexes(GroupedTable table) {
        List<Integer> indexes = new ArrayList<>();
        int offset = 0;
        if (properties.hasSerialColumn()) {
            indexes.add(0);
            offset = 1;
        }
        for (int i = 0; i < table.keyColumns().size(); i++) {
            indexes.add(offset + i);
        }
        return indexes;
    }

    public byte[] write(GroupedTable table, List<MergeRange> mergeRanges) {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(properties.sheetTitle());
            CellStyle centered = workbook.createCellStyle();
            centered.setAlignment(HorizontalAlignment.CENTER);
            centered.setVerticalAlignment(VerticalAlignment.CENTER);

            List<String> headers = headers(table);
            Row header = sheet.createRow(HEADER_ROW_INDEX);
            for (int i = 0; i < headers.size(); i++) {
                header.createCell(i).setCellValue(headers.get(i));
            }

            int keyOffset = properties.hasSerialColumn() ? 1 : 0;
            int detailOffset = keyOffset + table.keyColumns().size();
            int rowIndex = HEADER_ROW_INDEX + 1;
            int groupIndex = 1;
            for (RowGroup group : table.groups()) {
                for (Map<String, String> values : group.rows()) {
                    Row row = sheet.createRow(rowIndex++);
                    if (keyOffset > 0) {
                        Cell serial = row.createCell(0);
                        serial.setCellValue(groupIndex);
                        serial.setCellStyle(centered);
                    }
                    List<String> keyValues = group.key().values();
                    for (int k = 0; k < keyValues.size(); k++) {
                        Cell cell = row.createCell(keyOffset + k);
                        cell.setCellValue(keyValues.get(k));
                        cell.setCellStyle(centered);
                    }
                    for (int d = 0; d < table.detailColumns().size(); d++) {
                        String column = table.detailColumns().get(d);
                        Object value = detailValueConverter.convert(properties.outputName(column), values.get(column));
                        writeDetail(row.createCell(detailOffset + d), value);
                    }
                }
                groupIndex++;
            }

            for (MergeRange range : mergeRanges) {
                sheet.addMergedRegion(range.toCellRange());
            }

            for (int c = 0; c < headers.size(); c++) {
                sheet.setColumnWidth(c, columnWidth(sheet, c));
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("导出失败：" + e.getMessage(), e);
        }
    }

    // autoSizeColumn 依赖字体环境，服务器上按字符数估算列宽
    private int columnWidth(Sheet sheet, int column) {
        int maxUnits = 8;
        for (Row row : sheet) {
            Cell cell = row.getCell(column);
            if (cell == null) {
                continue;
            }
            String text = cell.getCellType() == CellType.NUMERIC
                    ? BigDecimal.valueOf(cell.getNumericCellValue()).toPlainString()
                    : cell.getStringCellValue();
            int units = 0;
            for (int i = 0; i < text.length(); i++) {
                units += text.charAt(i) > 0xFF ? 2 : 1;
            }
            maxUnits = Math.max(maxUnits, units + 2);
        }
        return Math.min(maxUnits, MAX_COLUMN_CHARS) * 256;
    }

    private void writeDetail(Cell cell, Object value) {
        if (value instanceof Long number) {
            cell.setCellValue(number.doubleValue());
        } else if (value instanceof BigDecimal decimal) {
            cell.setCellValue(decimal.doubleValue());
        } else {
            cell.setCellValue(String.valueOf(value));
        }
    }
}
