package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.CuttingPlan;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.Pattern;
import com.yhy.cutplan.cut.vo.PatternItem;
import com.yhy.cutplan.cut.vo.PlanStatus;
import com.yhy.cutplan.cut.vo.Shortage;
import com.yhy.cutplan.cut.vo.StockAssignment;
import com.yhy.cutplan.cut.vo.StockOption;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 独立于排料过程校验计划的可行性，返回违规描述列表（为空表示通过）。
 * <ul>
 *     <li>每根原料上的件长之和加锯缝不超过原料长度</li>
 *     <li>每种原料的使用次数不超过库存</li>
 *     <li>完整计划中每个需求行的件数恰好等于需求数量</li>
 *     <li>部分计划中记录的缺口等于需求与已完成数量之差</li>
 * </ul>
 * 发现问题只报告，不做修正。
 */
@Service
public class PlanValidator {

    private static final double EPS = 1e-6;

    public List<String> validate(Job job, CuttingPlan plan) {
        List<String> violations = new ArrayList<>();
        if (job == null) {
            violations.add("job is missing");
            return violations;
        }
        if (plan == null) {
            violations.add("plan is missing");
            return violations;
        }
        if (plan.getStatus() == null) {
            violations.add("plan has no status");
        }

        List<CutRequest> requests = job.getRequests();
        for (int i = 0; i < requests.size(); i++) {
            if (requests.get(i) == null) {
                violations.add("request " + i + " is missing");
            }
        }
        Map<String, StockOption> options = new HashMap<>();
        List<StockOption> stockOptions = job.getStockOptions();
        for (int k = 0; k < stockOptions.size(); k++) {
            StockOption option = stockOptions.get(k);
            if (option == null) {
                violations.add("stock option " + k + " is missing");
                continue;
            }
            options.put(option.getId(), option);
        }

        int[] fulfilled = new int[requests.size()];
        Map<String, Integer> usage = new LinkedHashMap<>();
        List<StockAssignment> assignments = plan.getAssignments() == null ? List.of() : plan.getAssignments();
        for (int a = 0; a < assignments.size(); a++) {
            if (assignments.get(a) == null) {
                violations.add("assignment " + a + " is missing");
                continue;
            }
            checkAssignment(job, a, assignments.get(a), options, fulfilled, usage, violations);
        }

        for (Map.Entry<String, Integer> e : usage.entrySet()) {
            StockOption option = options.get(e.getKey());
            if (!option.isUnlimited() && e.getValue() > option.getAvailable()) {
                violations.add("stock option " + e.getKey() + " used " + e.getValue()
                        + " times but only " + option.getAvailable() + " available");
            }
        }

        checkDemand(requests, plan, fulfilled, violations);
        return violations;
    }

    private void checkAssignment(Job job, int a, StockAssignment assignment, Map<String, StockOption> options,
                                 int[] fulfilled, Map<String, Integer> usage, List<String> violations) {
        String where = "assignment " + a;
        StockOption option = options.get(assignment.getStockOptionId());
        if (option == null) {
            violations.add(where + " references unknown stock option " + assignment.getStockOptionId());
            return;
        }
        usage.merge(option.getId(), 1, Integer::sum);

        if (Math.abs(assignment.getStockLength() - option.getLength()) > EPS) {
            violations.add(where + " reports stock length " + assignment.getStockLength()
                    + " but option " + option.getId() + " is " + option.getLength());
        }

        Pattern pattern = assignment.getPattern();
        if (pattern == null || pattern.getItems() == null || pattern.getItems().isEmpty()) {
            violations.add(where + " has an empty pattern");
            return;
        }

        List<CutRequest> requests = job.getRequests();
        int pieces = 0;
        double piecesLength = 0;
        for (PatternItem item : pattern.getItems()) {
            if (item == null) {
                violations.add(where + " has a missing pattern item");
                continue;
            }
            int idx = item.getRequestIndex();
            if (idx < 0 || idx >= requests.size()) {
                violations.add(where + " references unknown request " + idx);
                continue;
            }
            if (requests.get(idx) == null) {
                violations.add(where + " references missing request " + idx);
                continue;
            }
            if (item.getQuantity() <= 0) {
                violations.add(where + " has non-positive quantity " + item.getQuantity() + " for request " + idx);
                continue;
            }
            double length = requests.get(idx).getLength();
            if (Math.abs(item.getLength() - length) > EPS) {
                violations.add(where + " cuts length " + item.getLength() + " for request " + idx
                        + " which asks for " + length);
            }
            fulfilled[idx] += item.getQuantity();
            pieces += item.getQuantity();
            piecesLength += length * item.getQuantity();
        }
        if (pieces == 0) {
            violations.add(where + " cuts no pieces");
            return;
        }

        double used = piecesLength + job.kerf() * (pieces - 1);
        if (used > option.getLength() + EPS) {
            violations.add(where + " needs " + used + " (pieces + kerf) but stock " + option.getId()
                    + " is only " + option.getLength());
        }
        double leftover = option.getLength() - used;
        if (Math.abs(assignment.getLeftover() - leftover) > EPS) {
            violations.add(where + " reports leftover " + assignment.getLeftover() + " but computed " + leftover);
        }
    }

    private void checkDemand(List<CutRequest> requests, CuttingPlan plan, int[] fulfilled, List<String> violations) {
        Map<Integer, Shortage> shortages = new HashMap<>();
        List<Shortage> recorded = plan.getShortages() == null ? List.of() : plan.getShortages();
        for (Shortage s : recorded) {
            if (s == null) {
                violations.add("plan records a missing shortage entry");
                continue;
            }
            if (s.getRequestIndex() < 0 || s.getRequestIndex() >= requests.size()) {
                violations.add("shortage references unknown request " + s.getRequestIndex());
            } else if (shortages.put(s.getRequestIndex(), s) != null) {
                violations.add("request " + s.getRequestIndex() + " has more than one shortage entry");
            }
        }

        boolean complete = plan.getStatus() == PlanStatus.COMPLETE;
        if (complete && !recorded.isEmpty()) {
            violations.add("complete plan records " + recorded.size() + " shortages");
        }
        if (plan.getStatus() == PlanStatus.PARTIAL && recorded.isEmpty()) {
            violations.add("partial plan records no shortage");
        }

        for (int i = 0; i < requests.size(); i++) {
            if (requests.get(i) == null) continue;
            int required = requests.get(i).getQuantity();
            if (fulfilled[i] > required) {
                violations.add("request " + i + " over-fulfilled: " + fulfilled[i] + " > " + required);
                continue;
            }
            if (complete) {
                if (fulfilled[i] != required) {
                    violations.add("request " + i + " fulfilled " + fulfilled[i] + " of " + required + " in a complete plan");
                }
                continue;
            }
            Shortage s = shortages.get(i);
            int missing = s == null ? 0 : s.getMissing();
            if (fulfilled[i] + missing != required) {
                violations.add("request " + i + " fulfilled " + fulfilled[i] + " + missing " + missing
                        + " != required " + required);
            }
            if (s != null && (s.getMissing() <= 0 || s.getRequired() != required || s.getFulfilled() != fulfilled[i])) {
                violations.add("shortage for request " + i + " is inconsistent: required " + s.getRequired()
                        + ", fulfilled " + s.getFulfilled() + ", missing " + s.getMissing());
            }
        }
    }
}
