package com.example.excelgroup.service;

import org.apache.poi.ss.util.CellRangeAddress;

/**
 * 单列上需要合并居中的连续行，行列均为 0 开始的 sheet 下标。
 */
public record MergeRange(int column, int firstRow, int lastRow) {

    public MergeRange {
        if (column < 0 || firstRow < 0) {
            throw new IllegalArgumentException("合并区域下标不能为负：" + column + "," + firstRow);
        }
        if (lastRow <= firstRow) {
            throw new IllegalArgumentException("合并区域至少跨两行：" + firstRow + "-" + lastRow);
        }
    }

    public CellRangeAddress toCellRange() {
        return new CellRangeAddress(firstRow, lastRow, column, column);
    }
}
