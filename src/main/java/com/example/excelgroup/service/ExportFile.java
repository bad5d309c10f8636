package com.example.excelgroup.service;

public record ExportFile(String fileName, String contentType, byte[] content) {
}
