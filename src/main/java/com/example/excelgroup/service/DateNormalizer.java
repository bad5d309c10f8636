package com.example.excelgroup.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 日期列格式化，统一输出 yyyy-MM-dd。
 * <p>
 * 依次尝试：日期字符串、日期对象、Excel 序列号（以 1899-12-30 为基准加整数天）。
 * 都失败时原样返回，不抛异常。对自身输出再次调用结果不变。
 */
@Slf4j
@Component
public class DateNormalizer {

    static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);
    // 9999-12-31 对应的序列号
    private static final BigDecimal MAX_SERIAL = BigDecimal.valueOf(2_958_465L);

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final Pattern NUMERIC_PATTERN = Pattern.compile("^[-+]?\\d+(\\.\\d+)?([eE][-+]?\\d+)?$");
    // 日期后面可能跟着时间部分："2023-10-21 08:30:00" / "2023-10-21T08:30"
    private static final Pattern TIME_SUFFIX_PATTERN = Pattern.compile("^(\\S+?)(?:[ T]\\d{1,2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?)?$");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("uuuuMMdd"),
            strict("uuuu年M月d日")
    );

    public String normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate().format(CANONICAL);
        }
        if (value instanceof LocalDate date) {
            return date.format(CANONICAL);
        }
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate().format(CANONICAL);
        }
        if (value instanceof Number number) {
            String converted = fromSerial(number);
            return converted != null ? converted : String.valueOf(value);
        }
        return normalizeText(String.valueOf(value));
    }

    private String normalizeText(String raw) {
        String text = raw.strip();
        if (text.isEmpty()) {
            return raw;
        }
        LocalDate parsed = parseDateString(text);
        if (parsed != null) {
            return parsed.format(CANONICAL);
        }
        if (NUMERIC_PATTERN.matcher(text).matches()) {
            String converted = fromSerial(new BigDecimal(text));
            if (converted != null) {
                return converted;
            }
        }
        log.debug("日期无法识别，保留原值：{}", raw);
        return raw;
    }

    LocalDate parseDateString(String text) {
        Matcher matcher = TIME_SUFFIX_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        String datePart = matcher.group(1).replace('/', '-').replace('.', '-');
        for (DateTimeFormatter fmt : DATE_FORMATS) {
            LocalDate date = tryParse(datePart, fmt);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private LocalDate tryParse(String text, DateTimeFormatter fmt) {
        try {
            return LocalDate.parse(text, fmt);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String fromSerial(Number number) {
        try {
            return fromSerial(new BigDecimal(number.toString()));
        } catch (NumberFormatException e) {
            log.debug("非有限数值，无法转换为日期：{}", number);
            return null;
        }
    }

    private String fromSerial(BigDecimal serial) {
        if (serial.abs().compareTo(MAX_SERIAL) > 0) {
            return null;
        }
        try {
            long days = serial.setScale(0, RoundingMode.FLOOR).longValueExact();
            LocalDate date = EXCEL_EPOCH.plusDays(days);
            if (date.getYear() < 1 || date.getYear() > 9999) {
                return null;
            }
            return date.format(CANONICAL);
        } catch (ArithmeticException | DateTimeException e) {
            log.debug("Excel 序列号超出范围：{}", serial);
            return null;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
