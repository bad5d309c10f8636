package com.example.excelgroup.web;

import java.util.List;

public record GroupRequest(
        List<String> keyColumns,
        List<String> detailColumns
) {
}
