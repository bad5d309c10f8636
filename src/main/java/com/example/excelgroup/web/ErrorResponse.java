package com.example.excelgroup.web;

public record ErrorResponse(
        String error,
        String message
) {
}
