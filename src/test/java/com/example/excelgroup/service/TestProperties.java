package com.example.excelgroup.service;

import com.example.excelgroup.config.ExcelGroupProperties;

import java.util.List;
import java.util.Map;

final class TestProperties {

    private TestProperties() {
    }

    static ExcelGroupProperties defaults() {
        return withSerialColumn("序号");
    }

    static ExcelGroupProperties withSerialColumn(String serialColumnHeader) {
        return new ExcelGroupProperties(
                List.of("日期", "时间", "Date", "Time"),
                "_",
                List.of("日期", "清美出库日期", "运单号码", "清美系统订单号",
                        "寄件地区", "到件地区", "对方公司名称", "箱数", "计费重量", "产品类型"),
                Map.of("费用(元)", "费用"),
                List.of("费用", "单票折扣", "应付金额"),
                2,
                "处理结果",
                serialColumnHeader,
                50
        );
    }
}
