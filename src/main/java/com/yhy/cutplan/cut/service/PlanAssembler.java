package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.config.CuttingProperties;
import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.CuttingPlan;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.Pattern;
import com.yhy.cutplan.cut.vo.PatternItem;
import com.yhy.cutplan.cut.vo.PlanStatus;
import com.yhy.cutplan.cut.vo.Shortage;
import com.yhy.cutplan.cut.vo.ShortageReason;
import com.yhy.cutplan.cut.vo.StockAssignment;
import com.yhy.cutplan.cut.vo.StockOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 排料：每轮对每种尚有库存的原料取最优模式，按加权废料评分选出一组提交，
 * 直到需求全部满足或无法继续。
 * <p>
 * 评分 = 废料长度 × 成本权重 / 原料长度（越小越好）；
 * 相同时依次比较：成本权重低者、模式中最长件更长者、原料编号。
 * <p>
 * 有限库存的原料还会在更小的库存上限下重新排料，取其中最好的计划（完整优先，其次废料最少、根数最少），
 * 因此增加任一原料的库存不会让完整计划的废料变多。只需对实际用到的原料逐一把上限降到“用量 - 1”，
 * 上限不低于用量的组合与原计划完全相同。
 * <p>
 * 件长超过所有有库存原料规格的需求在开始前记为 INFEASIBLE 缺口，不参与搜索；
 * 其余无法放置的需求记为 STOCK_EXHAUSTED 缺口，计划标记为 PARTIAL。
 */
@Service
public class PlanAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanAssembler.class);

    /** 默认最多尝试的库存上限组合数 */
    static final int DEFAULT_MAX_VARIANTS = 1024;

    enum State { PENDING_DEMAND, SELECTING_PATTERN, COMMIT, SATISFIED, STOCK_EXHAUSTED }

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble(Candidate::score)
            .thenComparingDouble(c -> c.option.effectiveCostWeight())
            .thenComparing(Comparator.comparingDouble((Candidate c) -> c.pattern.getLongestPiece()).reversed())
            .thenComparing(c -> c.option.getId());

    private final PatternGenerator patternGenerator;
    private final int maxVariants;

    @Autowired
    public PlanAssembler(PatternGenerator patternGenerator, CuttingProperties properties) {
        this(patternGenerator, properties.getAssembly().getMaxVariants());
    }

    public PlanAssembler(PatternGenerator patternGenerator) {
        this(patternGenerator, DEFAULT_MAX_VARIANTS);
    }

    PlanAssembler(PatternGenerator patternGenerator, int maxVariants) {
        this.patternGenerator = patternGenerator;
        this.maxVariants = Math.max(1, maxVariants);
    }

    public CuttingPlan assemble(Job job) {
        return assemble(job, CancellationToken.create());
    }

    public CuttingPlan assemble(Job job, CancellationToken token) {
        List<CutRequest> requests = job.getRequests();
        List<StockOption> options = job.getStockOptions();

        int[] demand = requests.stream().mapToInt(CutRequest::getQuantity).toArray();
        boolean[] infeasible = markInfeasible(requests, options, demand);
        int[] caps = options.stream().mapToInt(StockOption::getAvailable).toArray();

        LOGGER.debug("job {} 开始排料，需求 {}", job.getId(), Arrays.toString(demand));

        Deque<int[]> pending = new ArrayDeque<>();
        Set<List<Integer>> visited = new HashSet<>();
        pending.push(caps);
        visited.add(key(caps));
        Run best = null;
        int runs = 0;
        while (!pending.isEmpty()) {
            if (runs == maxVariants) {
                LOGGER.warn("job {} 库存上限组合超过 {}，使用已找到的最好计划", job.getId(), maxVariants);
                break;
            }
            int[] limit = pending.pop();
            Run run = run(job, demand, limit, token);
            runs++;
            if (best == null || run.isBetterThan(best)) {
                best = run;
            }
            if (best.missing == 0 && best.waste <= PatternGenerator.EPS) {
                break; // 无废料的完整计划
            }
            // 只降低实际用到的有限库存，其余上限组合与本次结果相同
            for (int k = options.size() - 1; k >= 0; k--) {
                if (options.get(k).isUnlimited() || run.used[k] == 0) continue;
                int[] lower = limit.clone();
                lower[k] = run.used[k] - 1;
                if (visited.add(key(lower))) {
                    pending.push(lower);
                }
            }
        }

        List<Shortage> shortages = collectShortages(requests, best.remaining, infeasible);
        PlanStatus status = shortages.isEmpty() ? PlanStatus.COMPLETE : PlanStatus.PARTIAL;
        LOGGER.info("job {} 排料结束: {}，尝试 {} 组库存上限，使用原料 {} 根，缺口 {} 项",
                job.getId(), best.state, runs, best.assignments.size(), shortages.size());

        return CuttingPlan.builder()
                .jobId(job.getId())
                .status(status)
                .assignments(best.assignments)
                .shortages(shortages)
                .build();
    }

    /**
     * 在给定库存上限下做一次贪心排料，计数器均为本次私有。
     */
    private Run run(Job job, int[] demand, int[] caps, CancellationToken token) {
        List<CutRequest> requests = job.getRequests();
        List<StockOption> options = job.getStockOptions();
        double kerf = job.kerf();

        int[] remaining = demand.clone();
        int[] stockLeft = caps.clone();
        int[] unitCounter = new int[options.size()];

        List<StockAssignment> assignments = new ArrayList<>();
        State state = State.PENDING_DEMAND;

        while (Arrays.stream(remaining).anyMatch(r -> r > 0)) {
            token.checkpoint();
            state = State.SELECTING_PATTERN;

            DemandSnapshot snapshot = DemandSnapshot.of(requests, remaining);
            Candidate best = null;
            for (int k = 0; k < options.size(); k++) {
                if (stockLeft[k] == 0) continue;
                StockOption option = options.get(k);
                Optional<Pattern> pattern = patternGenerator.best(option.getLength(), kerf, snapshot);
                if (pattern.isEmpty()) continue;
                Candidate c = new Candidate(k, option, pattern.get());
                if (best == null || CANDIDATE_ORDER.compare(c, best) < 0) {
                    best = c;
                }
            }

            if (best == null) {
                state = State.STOCK_EXHAUSTED;
                break;
            }

            state = State.COMMIT;
            for (PatternItem item : best.pattern.getItems()) {
                remaining[item.getRequestIndex()] -= item.getQuantity();
            }
            if (!best.option.isUnlimited()) {
                stockLeft[best.index]--;
            }
            unitCounter[best.index]++;
            assignments.add(StockAssignment.builder()
                    .stockOptionId(best.option.getId())
                    .unitNumber(unitCounter[best.index])
                    .stockLength(best.option.getLength())
                    .pattern(best.pattern)
                    .kerfLoss(best.pattern.getKerfLoss())
                    .leftover(best.pattern.getWaste())
                    .build());
            LOGGER.debug("job {} 提交 {}#{}: {} 段，余料 {}", job.getId(), best.option.getId(),
                    unitCounter[best.index], best.pattern.getPieceCount(), best.pattern.getWaste());
        }
        if (state != State.STOCK_EXHAUSTED) {
            state = State.SATISFIED;
        }
        return new Run(state, assignments, remaining, unitCounter);
    }

    private static List<Integer> key(int[] caps) {
        return Arrays.stream(caps).boxed().toList();
    }

    /**
     * 件长超过所有有库存原料长度的需求直接记为不可行，并从剩余需求中移除。
     * 库存为 0 的原料不计入；没有任何有库存的原料时全部需求均不可行。
     */
    private boolean[] markInfeasible(List<CutRequest> requests, List<StockOption> options, int[] remaining) {
        double longest = options.stream()
                .filter(o -> o.getAvailable() != 0)
                .mapToDouble(StockOption::getLength)
                .max()
                .orElse(0.0);
        boolean[] infeasible = new boolean[requests.size()];
        for (int i = 0; i < requests.size(); i++) {
            if (requests.get(i).getLength() > longest + PatternGenerator.EPS) {
                infeasible[i] = true;
                remaining[i] = 0;
                LOGGER.warn("需求 {} 长度 {} 超过最长原料 {}，无法切出", label(requests, i), requests.get(i).getLength(), longest);
            }
        }
        return infeasible;
    }

    private List<Shortage> collectShortages(List<CutRequest> requests, int[] remaining, boolean[] infeasible) {
        List<Shortage> shortages = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            CutRequest request = requests.get(i);
            int missing = infeasible[i] ? request.getQuantity() : remaining[i];
            if (missing <= 0) continue;
            shortages.add(Shortage.builder()
                    .requestIndex(i)
                    .label(request.getLabel())
                    .length(request.getLength())
                    .required(request.getQuantity())
                    .fulfilled(request.getQuantity() - missing)
                    .missing(missing)
                    .reason(infeasible[i] ? ShortageReason.INFEASIBLE : ShortageReason.STOCK_EXHAUSTED)
                    .build());
        }
        return shortages;
    }

    private String label(List<CutRequest> requests, int i) {
        String label = requests.get(i).getLabel();
        return label == null ? "#" + i : label;
    }

    private static final class Run {
        final State state;
        final List<StockAssignment> assignments;
        final int[] remaining;
        final int[] used;
        final int missing;
        final double waste;

        Run(State state, List<StockAssignment> assignments, int[] remaining, int[] used) {
            this.state = state;
            this.assignments = assignments;
            this.remaining = remaining;
            this.used = used;
            this.missing = Arrays.stream(remaining).sum();
            this.waste = assignments.stream().mapToDouble(StockAssignment::getLeftover).sum();
        }

        /** 缺件少者优先，其次废料少、根数少；完全相同时保留先找到的 */
        boolean isBetterThan(Run other) {
            if (missing != other.missing) {
                return missing < other.missing;
            }
            if (Math.abs(waste - other.waste) > PatternGenerator.EPS) {
                return waste < other.waste;
            }
            return assignments.size() < other.assignments.size();
        }
    }

    private static final class Candidate {
        final int index;
        final StockOption option;
        final Pattern pattern;
        final double score;

        Candidate(int index, StockOption option, Pattern pattern) {
            this.index = index;
            this.option = option;
            this.pattern = pattern;
            this.score = pattern.getWaste() * option.effectiveCostWeight() / option.getLength();
        }

        double score() {
            return score;
        }
    }
}
