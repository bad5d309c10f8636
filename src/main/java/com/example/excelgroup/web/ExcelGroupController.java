package com.example.excelgroup.web;

import com.example.excelgroup.service.ExcelGroupService;
import com.example.excelgroup.service.ExportFile;
import com.example.excelgroup.service.GroupResult;
import com.example.excelgroup.service.TableInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/excel")
@RequiredArgsConstructor
public class ExcelGroupController {

    private final ExcelGroupService excelGroupService;

    @PostMapping("/sheets")
    public List<String> listSheets(@RequestParam("file") MultipartFile file) {
        return excelGroupService.listSheets(file);
    }

    @PostMapping("/load")
    public TableInfo load(@RequestParam("file") MultipartFile file,
                          @RequestParam(value = "sheet", required = false) String sheet,
                          @RequestParam(value = "headerRow", required = false) Integer headerRow) {
        return excelGroupService.load(file, sheet, headerRow);
    }

    @PostMapping("/group")
    public GroupResult group(@RequestBody GroupRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("请求内容不能为空。");
        }
        return excelGroupService.group(request.keyColumns(), request.detailColumns());
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> exportWorkbook() {
        return download(excelGroupService.exportWorkbook());
    }

    @GetMapping("/export/json")
    public ResponseEntity<byte[]> exportJson() {
        return download(excelGroupService.exportJson());
    }

    private ResponseEntity<byte[]> download(ExportFile file) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(file.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(file.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(file.content());
    }
}
