package com.example.excelgroup.service;

import java.util.List;

public record CompositeKey(List<String> values) {

    public CompositeKey {
        values = List.copyOf(values);
    }

    public static CompositeKey of(String... values) {
        return new CompositeKey(List.of(values));
    }

    public String join(String delimiter) {
        return String.join(delimiter, values);
    }
}
