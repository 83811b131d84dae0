package com.yhy.cutplan.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消耗的一根原料及其切割模式
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class StockAssignment {
    private String stockOptionId;
    /** 同一规格内从 1 开始编号 */
    private int unitNumber;
    private double stockLength;
    private Pattern pattern;
    private double kerfLoss;
    private double leftover;
}
