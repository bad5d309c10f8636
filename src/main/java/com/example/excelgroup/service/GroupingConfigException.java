package com.example.excelgroup.service;

/**
 * 列角色配置与实际表头不符，分组前即中止。
 */
public class GroupingConfigException extends IllegalArgumentException {

    public GroupingConfigException(String message) {
        super(message);
    }
}
