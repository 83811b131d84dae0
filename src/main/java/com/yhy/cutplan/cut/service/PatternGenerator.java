package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.config.CuttingProperties;
import com.yhy.cutplan.cut.vo.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 单根原料的切割模式生成（有界背包枚举）。
 * <p>
 * 每种长度的件数不超过剩余需求，且满足 Σ m·L + kerf·(Σm − 1) ≤ 原料长度。
 * 变换为 Σ m·(L + kerf) ≤ 原料长度 + kerf 后按长度降序做深度优先枚举，
 * 件数从大到小尝试，因此枚举顺序即为多重度向量的字典序降序。
 * <p>
 * 访问的组合节点数受 {@code cutting.pattern.max-combinations} 限制，
 * 触发上限时追加“贪心填充”模式（重复能放下的最长件）保证有进展。
 */
@Service
public class PatternGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatternGenerator.class);

    static final double EPS = 1e-9;
    /** 利用长度比较精度 1e-6 */
    private static final double KEY_SCALE = 1e6;

    private final int maxCombinations;

    @Autowired
    public PatternGenerator(CuttingProperties properties) {
        this(properties.getPattern().getMaxCombinations());
    }

    public PatternGenerator(int maxCombinations) {
        if (maxCombinations <= 0) {
            throw new IllegalArgumentException("maxCombinations must be positive: " + maxCombinations);
        }
        this.maxCombinations = maxCombinations;
    }

    public int getMaxCombinations() {
        return maxCombinations;
    }

    /**
     * 按利用长度降序返回全部可行模式（同长度时按多重度字典序降序）。
     * 没有任何一件放得下时返回空列表。
     */
    public List<Pattern> generate(double stockLength, double kerf, DemandSnapshot demand) {
        Space space = new Space(stockLength, kerf, demand);
        if (space.nothingFits()) {
            return List.of();
        }

        Enumeration e = new Enumeration(space);
        e.walk(0, space.capacity, new int[space.types]);
        if (e.truncated) {
            LOGGER.debug("模式枚举达到上限 {}，原料 {}，需求 {}，追加贪心填充模式", maxCombinations, stockLength, demand);
            int[] greedy = space.greedyFill();
            if (e.found.stream().noneMatch(v -> Arrays.equals(v, greedy))) {
                e.found.add(greedy);
            }
        }

        e.found.sort(space.ranking());
        List<Pattern> patterns = new ArrayList<>(e.found.size());
        for (int[] counts : e.found) {
            patterns.add(space.toPattern(counts));
        }
        return patterns;
    }

    /**
     * 最优模式（与 {@link #generate} 的首项一致），用分支定界剪枝。
     */
    public Optional<Pattern> best(double stockLength, double kerf, DemandSnapshot demand) {
        Space space = new Space(stockLength, kerf, demand);
        if (space.nothingFits()) {
            return Optional.empty();
        }

        BranchAndBound b = new BranchAndBound(space);
        b.walk(0, space.capacity, 0.0, new int[space.types]);
        int[] winner = b.best;
        if (b.truncated) {
            LOGGER.debug("最优模式搜索达到上限 {}，原料 {}，需求 {}", maxCombinations, stockLength, demand);
            int[] greedy = space.greedyFill();
            if (winner == null || space.ranking().compare(greedy, winner) < 0) {
                winner = greedy;
            }
        }
        return winner == null ? Optional.empty() : Optional.of(space.toPattern(winner));
    }

    // ===== 搜索空间 =====
    private static final class Space {
        final double stockLength;
        final double kerf;
        final DemandSnapshot demand;
        final int types;
        final double capacity;  // 原料长度 + kerf
        final double[] w;       // 件长 + kerf
        final int[] maxCount;   // 单根原料上各类型最多件数
        final double[] suffix;  // suffix[t] = Σ_{j≥t} maxCount[j]·w[j]

        Space(double stockLength, double kerf, DemandSnapshot demand) {
            this.stockLength = stockLength;
            this.kerf = kerf;
            this.demand = demand;
            this.types = demand.types();
            this.capacity = stockLength + kerf;
            this.w = new double[types];
            this.maxCount = new int[types];
            this.suffix = new double[types + 1];
            for (int t = 0; t < types; t++) {
                w[t] = demand.length(t) + kerf;
                int fit = (int) Math.floor((capacity + EPS) / w[t]);
                maxCount[t] = Math.max(0, Math.min(demand.count(t), fit));
            }
            for (int t = types - 1; t >= 0; t--) {
                suffix[t] = suffix[t + 1] + maxCount[t] * w[t];
            }
        }

        boolean nothingFits() {
            for (int m : maxCount) if (m > 0) return false;
            return true;
        }

        double used(int[] counts) {
            double s = 0;
            for (int t = 0; t < types; t++) s += counts[t] * w[t];
            return s - kerf;
        }

        long key(double used) {
            return Math.round(used * KEY_SCALE);
        }

        int limit(int t, double remCap) {
            int fit = (int) Math.floor((remCap + EPS) / w[t]);
            return Math.max(0, Math.min(maxCount[t], fit));
        }

        /** 利用长度降序，再按多重度字典序降序 */
        Comparator<int[]> ranking() {
            return (a, b) -> {
                int c = Long.compare(key(used(b)), key(used(a)));
                if (c != 0) return c;
                for (int t = 0; t < types; t++) {
                    if (a[t] != b[t]) return Integer.compare(b[t], a[t]);
                }
                return 0;
            };
        }

        int[] greedyFill() {
            int[] counts = new int[types];
            for (int t = 0; t < types; t++) {
                if (maxCount[t] > 0) {
                    counts[t] = maxCount[t];
                    break;
                }
            }
            return counts;
        }

        Pattern toPattern(int[] counts) {
            return Pattern.builder()
                    .stockLength(stockLength)
                    .kerf(kerf)
                    .items(demand.distribute(counts))
                    .build();
        }
    }

    // ===== 全量枚举 =====
    private final class Enumeration {
        final Space space;
        final List<int[]> found = new ArrayList<>();
        long nodes;
        boolean truncated;

        Enumeration(Space space) {
            this.space = space;
        }

        void walk(int t, double remCap, int[] current) {
            if (t == space.types) {
                if (Arrays.stream(current).sum() > 0) found.add(current.clone());
                return;
            }
            for (int n = space.limit(t, remCap); n >= 0; n--) {
                if (++nodes > maxCombinations) {
                    truncated = true;
                    break;
                }
                current[t] = n;
                walk(t + 1, remCap - n * space.w[t], current);
                if (truncated) break;
            }
            current[t] = 0;
        }
    }

    // ===== 分支定界 =====
    private final class BranchAndBound {
        final Space space;
        int[] best;
        long bestKey;
        long nodes;
        boolean truncated;

        BranchAndBound(Space space) {
            this.space = space;
        }

        void walk(int t, double remCap, double partial, int[] current) {
            if (t == space.types) {
                if (Arrays.stream(current).sum() == 0) return;
                long k = space.key(space.used(current));
                if (best == null || k > bestKey) {
                    best = current.clone();
                    bestKey = k;
                }
                return;
            }
            if (best != null) {
                double bound = partial + Math.min(remCap, space.suffix[t]) - space.kerf;
                if (space.key(bound) <= bestKey) return;
            }
            for (int n = space.limit(t, remCap); n >= 0; n--) {
                if (++nodes > maxCombinations) {
                    truncated = true;
                    break;
                }
                current[t] = n;
                walk(t + 1, remCap - n * space.w[t], partial + n * space.w[t], current);
                if (truncated) break;
            }
            current[t] = 0;
        }
    }
}
