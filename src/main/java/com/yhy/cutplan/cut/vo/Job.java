package com.yhy.cutplan.cut.vo;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 一个下料任务：一种材料 + 需求清单 + 可用原料规格。
 * 列表在构建时即被复制为不可变集合，优化开始后不再变化。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Job {
    String id;
    Material material;
    @Singular
    List<CutRequest> requests;
    @Singular
    List<StockOption> stockOptions;

    public double kerf() {
        return material == null ? 0.0 : material.getKerf();
    }

    public String materialId() {
        return material == null ? null : material.getId();
    }
}
