package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.Material;
import com.yhy.cutplan.cut.vo.StockOption;

final class JobFixtures {

    private JobFixtures() {
    }

    static Job.JobBuilder job(String id, String material, double kerf) {
        return Job.builder()
                .id(id)
                .material(Material.builder().id(material).kerf(kerf).build());
    }

    static CutRequest piece(double length, int quantity) {
        return piece(length, quantity, null);
    }

    static CutRequest piece(double length, int quantity, String label) {
        return CutRequest.builder().length(length).quantity(quantity).label(label).build();
    }

    static StockOption unlimited(String id, double length) {
        return StockOption.builder().id(id).length(length).build();
    }

    static StockOption limited(String id, double length, int available) {
        return StockOption.builder().id(id).length(length).available(available).build();
    }

    static StockOption weighted(String id, double length, double costWeight) {
        return StockOption.builder().id(id).length(length).costWeight(costWeight).build();
    }
}
