package com.example.excelgroup.service;

import java.util.List;
import java.util.Map;

/**
 * JSON 导出内容。
 *
 * @param data       组合键字符串 -> 明细列表，按首次出现顺序
 * @param collisions 拼接后与前面某组相同、发生覆盖的组合键字符串
 */
public record JsonExport(Map<String, List<Map<String, Object>>> data, List<String> collisions) {
}
