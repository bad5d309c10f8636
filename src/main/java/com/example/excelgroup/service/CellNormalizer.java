package com.example.excelgroup.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * 单元格清洗：去首尾空白、还原科学计数法显示的整数、去掉整数值多余的 ".0"。
 * 无法清洗的值原样返回。
 */
@Slf4j
@Component
public class CellNormalizer {

    private static final Pattern SCIENTIFIC_PATTERN = Pattern.compile("^[-+]?\\d+(\\.\\d+)?[eE][-+]?\\d+$");
    private static final Pattern TRAILING_ZERO_DECIMAL_PATTERN = Pattern.compile("^[-+]?\\d+\\.0$");
    private static final int MAX_INTEGER_DIGITS = 64;

    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.strip();
        if (value.isEmpty()) {
            return "";
        }
        if (TRAILING_ZERO_DECIMAL_PATTERN.matcher(value).matches()) {
            return value.substring(0, value.indexOf('.'));
        }
        if (SCIENTIFIC_PATTERN.matcher(value).matches()) {
            return repairScientific(value);
        }
        return value;
    }

    // 只还原整数；1.5E-3 这类真小数保持原样
    private String repairScientific(String value) {
        try {
            BigDecimal decimal = new BigDecimal(value);
            if (decimal.signum() == 0) {
                return "0";
            }
            BigDecimal stripped = decimal.stripTrailingZeros();
            if (stripped.scale() > 0 || stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
                return value;
            }
            return decimal.toBigIntegerExact().toString();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("科学计数法还原失败，保留原值：{}", value);
            return value;
        }
    }
}
