package com.yhy.cutplan.cut.service;

import cn.hutool.core.util.StrUtil;
import com.yhy.cutplan.cut.exception.InvalidInputException;
import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.StockOption;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 优化开始前的领域校验：正数长度与数量、锯缝小于最短件、原料编号不重复。
 */
@Service
public class JobInputValidator {

    public void check(Job job) {
        if (job == null) {
            throw new InvalidInputException(null, List.of("job is missing"));
        }
        List<String> problems = new ArrayList<>();

        if (job.getMaterial() == null) {
            problems.add("material is missing");
        } else {
            if (StrUtil.isBlank(job.getMaterial().getId())) {
                problems.add("material id is blank");
            }
            double kerf = job.getMaterial().getKerf();
            if (!Double.isFinite(kerf) || kerf < 0) {
                problems.add("kerf must be >= 0: " + kerf);
            }
        }

        double shortest = Double.POSITIVE_INFINITY;
        List<CutRequest> requests = job.getRequests();
        for (int i = 0; i < requests.size(); i++) {
            CutRequest r = requests.get(i);
            if (r == null) {
                problems.add("request " + i + " is missing");
                continue;
            }
            if (!isPositive(r.getLength())) {
                problems.add("request " + i + " length must be > 0: " + r.getLength());
            } else {
                shortest = Math.min(shortest, r.getLength());
            }
            if (r.getQuantity() <= 0) {
                problems.add("request " + i + " quantity must be > 0: " + r.getQuantity());
            }
        }
        if (job.getMaterial() != null && shortest != Double.POSITIVE_INFINITY && job.kerf() >= shortest) {
            problems.add("kerf " + job.kerf() + " must be smaller than the shortest piece " + shortest);
        }

        Set<String> ids = new HashSet<>();
        List<StockOption> options = job.getStockOptions();
        for (int k = 0; k < options.size(); k++) {
            StockOption o = options.get(k);
            if (o == null) {
                problems.add("stock option " + k + " is missing");
                continue;
            }
            if (StrUtil.isBlank(o.getId())) {
                problems.add("stock option " + k + " has a blank id");
            } else if (!ids.add(o.getId())) {
                problems.add("duplicate stock option id " + o.getId());
            }
            if (!isPositive(o.getLength())) {
                problems.add("stock option " + o.getId() + " length must be > 0: " + o.getLength());
            }
            if (o.getAvailable() < 0 && !o.isUnlimited()) {
                problems.add("stock option " + o.getId() + " available must be >= 0 or unlimited: " + o.getAvailable());
            }
            if (o.getCostWeight() != null && !isPositive(o.getCostWeight())) {
                problems.add("stock option " + o.getId() + " cost weight must be > 0: " + o.getCostWeight());
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidInputException(job.getId(), problems);
        }
    }

    private boolean isPositive(double v) {
        return Double.isFinite(v) && v > 0;
    }
}
