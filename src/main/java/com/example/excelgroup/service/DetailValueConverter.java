package com.example.excelgroup.service;

import com.example.excelgroup.config.ExcelGroupProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * 明细值类型转换：纯数字转为数值，便于 JSON 输出和 Excel 计算。
 * 带前导零、正负号或其他字符的值保持字符串。
 */
@Component
@RequiredArgsConstructor
public class DetailValueConverter {

    private static final Pattern PLAIN_DECIMAL_PATTERN = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern LEADING_ZERO_PATTERN = Pattern.compile("^0\\d+.*$");
    // Excel 数值只有 15 位有效数字
    private static final int MAX_NUMERIC_DIGITS = 15;

    private final ExcelGroupProperties properties;

    /**
     * @param outputColumn 输出列名（已做列名映射）
     */
    public Object convert(String outputColumn, String value) {
        if (value == null || !PLAIN_DECIMAL_PATTERN.matcher(value).matches()) {
            return value == null ? "" : value;
        }
        if (LEADING_ZERO_PATTERN.matcher(value).matches()) {
            return value;
        }
        boolean integral = value.indexOf('.') < 0;
        if (properties.floatColumns().contains(outputColumn)) {
            BigDecimal decimal = new BigDecimal(value);
            return integral ? decimal.setScale(1) : decimal;
        }
        if (integral) {
            // 超过 15 位的长编号按原文输出，Excel 与 JSON 保持一致
            if (value.length() > MAX_NUMERIC_DIGITS) {
                return value;
            }
            return Long.parseLong(value);
        }
        return new BigDecimal(value);
    }
}
