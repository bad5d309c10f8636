package com.example.excelgroup.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

public class DateNormalizerTest {

    private final DateNormalizer normalizer = new DateNormalizer();

    @Test
    public void testSerialDayConversion() {
        assertEquals("2025-10-02", normalizer.normalize("45932"));
        assertEquals("2025-10-02", normalizer.normalize("45932.75"));
        assertEquals("2025-10-02", normalizer.normalize(45932));
        assertEquals("2025-10-02", normalizer.normalize(45932.0d));
        assertEquals("2025-10-08", normalizer.normalize("45938"));
        assertEquals("1900-03-01", normalizer.normalize("61"));
    }

    @Test
    public void testReformatsDateStrings() {
        assertEquals("2023-10-21", normalizer.normalize("2023-10-21"));
        assertEquals("2023-10-21", normalizer.normalize("2023/10/21"));
        assertEquals("2023-01-05", normalizer.normalize("2023/1/5"));
        assertEquals("2023-01-05", normalizer.normalize("2023.1.5"));
        assertEquals("2023-10-21", normalizer.normalize("20231021"));
        assertEquals("2023-10-21", normalizer.normalize("2023年10月21日"));
        assertEquals("2023-10-21", normalizer.normalize("2023-10-21 08:30:00"));
        assertEquals("2023-10-21", normalizer.normalize("2023-10-21T08:30"));
    }

    @Test
    public void testFormatsDateObjects() {
        assertEquals("2023-10-21", normalizer.normalize(LocalDate.of(2023, 10, 21)));
        assertEquals("2023-10-21", normalizer.normalize(LocalDateTime.of(2023, 10, 21, 23, 59)));
        Date date = Date.from(LocalDate.of(2023, 10, 21).atStartOfDay(ZoneId.systemDefault()).toInstant());
        assertEquals("2023-10-21", normalizer.normalize(date));
    }

    @Test
    public void testMalformedValuesPassThrough() {
        assertEquals("待定", normalizer.normalize("待定"));
        assertEquals("2023-02-30", normalizer.normalize("2023-02-30"));
        assertEquals("N/A", normalizer.normalize("N/A"));
        assertEquals("99999999", normalizer.normalize("99999999"));
        assertEquals("NaN", normalizer.normalize(Double.NaN));
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    public void testIdempotent() {
        Object[] inputs = {"45932", "2023/1/5", "20231021", "2023年10月21日", "待定", "2023-02-30",
                "99999999", "-5", "2023-10-21 08:30:00", " ", LocalDate.of(2020, 2, 29), 45932.5d};
        for (Object input : inputs) {
            String once = normalizer.normalize(input);
            assertEquals(once, normalizer.normalize(once), String.valueOf(input));
        }
    }
}
