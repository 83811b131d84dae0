package com.yhy.cutplan.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个任务的结果。失败时 plan 为空、error 不为空。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class JobResult {
    private String jobId;
    private String materialId;
    private JobStatus status;
    private CuttingPlan plan;
    private JobError error;
    /** 按规格声明顺序 */
    @Builder.Default
    private Map<String, Integer> stockUnitsByOption = new LinkedHashMap<>();
    private int totalStockUnits;
    private double totalWaste;
    private double consumedLength;
    private double usedLength;
    private double utilizationPercent;
    /** LP 松弛下界，未计算时为空 */
    private Integer stockUnitsLowerBound;
    private long elapsedMillis;
}
