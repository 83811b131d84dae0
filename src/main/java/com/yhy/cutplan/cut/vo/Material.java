package com.yhy.cutplan.cut.vo;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 原材料种类：编号 + 锯缝宽度（每刀损耗）
 */
@Value
@Builder
@Jacksonized
public class Material {
    String id;
    double kerf;
}
