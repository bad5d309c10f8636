package com.example.excelgroup.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 计算每组在各 Key 列上的合并区域。
 * 各组按顺序占用连续的行块，第一块从表头下一行开始；只有一行的组不产生合并。
 */
@Component
public class MergeRangeCalculator {

    /**
     * @param table          分组结果
     * @param headerRowIndex 表头所在行（0 开始）
     * @param keyColumnIndexes 需要合并的列（0 开始），按输出顺序
     */
    public List<MergeRange> calculate(GroupedTable table, int headerRowIndex, List<Integer> keyColumnIndexes) {
        if (headerRowIndex < 0) {
            throw new IllegalArgumentException("表头行下标不能为负：" + headerRowIndex);
        }
        List<MergeRange> ranges = new ArrayList<>();
        int startRow = headerRowIndex + 1;
        for (RowGroup group : table.groups()) {
            int endRow = startRow + group.size() - 1;
            if (endRow > startRow) {
                for (Integer column : keyColumnIndexes) {
                    ranges.add(new MergeRange(column, startRow, endRow));
                }
            }
            startRow = endRow + 1;
        }
        return ranges;
    }
}
