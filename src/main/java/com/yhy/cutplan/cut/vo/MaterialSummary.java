package com.yhy.cutplan.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class MaterialSummary {
    private String materialId;
    private int jobs;
    @Builder.Default
    private Map<String, Integer> stockUnitsByOption = new LinkedHashMap<>();
    private int totalStockUnits;
    private double totalWaste;
    private double consumedLength;
}
