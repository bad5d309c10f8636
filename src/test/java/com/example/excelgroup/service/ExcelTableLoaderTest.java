package com.example.excelgroup.service;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExcelTableLoaderTest {

    private final ExcelTableLoader loader = new ExcelTableLoader();

    @Test
    public void testListsSheets() throws Exception {
        List<String> sheets = loader.listSheets(new ByteArrayInputStream(ExcelTestWorkbooks.waybillWorkbook()));

        assertEquals(List.of("明细", "说明"), sheets);
    }

    @Test
    public void testLoadsStringCellsFromHeaderRow() throws Exception {
        LoadedTable table = loader.load(new ByteArrayInputStream(ExcelTestWorkbooks.waybillWorkbook()),
                "运单.xlsx", "", 2);

        assertEquals("明细", table.sheetName());
        assertEquals(2, table.headerRow());
        assertEquals(List.of("运单号码", "日期", "到件地区", "费用(元)", "备注"), table.headers());
        assertEquals(4, table.rows().size());

        Map<String, String> first = table.rows().get(0);
        assertEquals("SF1001", first.get("运单号码"));
        assertEquals("2023-10-21", first.get("日期"));
        assertEquals("12.5", first.get("费用(元)"));
        assertEquals("", first.get("备注"));

        assertEquals("2023/10/21", table.rows().get(1).get("日期"));
        assertEquals("8", table.rows().get(1).get("费用(元)"));
        assertTrue(table.rows().get(2).values().stream().allMatch(String::isEmpty));
        assertEquals("45938", table.rows().get(3).get("日期"));
    }

    @Test
    public void testGeneralFormatNumbersKeepFullPrecision() throws Exception {
        byte[] bytes;
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("运单号码");
            header.createCell(1).setCellValue("重量");
            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(123456789012d);
            first.createCell(1).setCellValue(12.25);
            Row second = sheet.createRow(2);
            second.createCell(0).setCellValue(123456789013d);
            second.createCell(1).setCellValue(3d);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            bytes = out.toByteArray();
        }

        LoadedTable table = loader.load(new ByteArrayInputStream(bytes), "ids.xlsx", null, 1);

        assertEquals("123456789012", table.rows().get(0).get("运单号码"));
        assertEquals("123456789013", table.rows().get(1).get("运单号码"));
        assertEquals("12.25", table.rows().get(0).get("重量"));
        assertEquals("3", table.rows().get(1).get("重量"));
        CellNormalizer normalizer = new CellNormalizer();
        assertEquals("123456789012", normalizer.normalize(table.rows().get(0).get("运单号码")));
    }

    @Test
    public void testUnknownSheetFails() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(
                new ByteArrayInputStream(ExcelTestWorkbooks.waybillWorkbook()), "运单.xlsx", "不存在", 2));
    }

    @Test
    public void testEmptyHeaderRowFails() {
        assertThrows(IllegalStateException.class, () -> loader.load(
                new ByteArrayInputStream(ExcelTestWorkbooks.waybillWorkbook()), "运单.xlsx", "明细", 30));
        assertThrows(IllegalArgumentException.class, () -> loader.load(
                new ByteArrayInputStream(ExcelTestWorkbooks.waybillWorkbook()), "运单.xlsx", "明细", 0));
    }

    @Test
    public void testBlankAndDuplicateHeaders() throws Exception {
        byte[] blankHeader = workbookWithHeader("运单号码", "", "备注");
        LoadedTable table = loader.load(new ByteArrayInputStream(blankHeader), "a.xlsx", null, 1);
        assertEquals(List.of("运单号码", "Unnamed: 1", "备注"), table.headers());

        byte[] duplicateHeader = workbookWithHeader("运单号码", "备注", "备注");
        assertThrows(GroupingConfigException.class,
                () -> loader.load(new ByteArrayInputStream(duplicateHeader), "b.xlsx", null, 1));
    }

    private static byte[] workbookWithHeader(String... headers) throws Exception {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            Row row = sheet.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                row.createCell(i).setCellValue(headers[i]);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
