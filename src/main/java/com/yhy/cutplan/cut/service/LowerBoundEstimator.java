package com.yhy.cutplan.cut.service;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.yhy.cutplan.cut.config.CuttingProperties;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.StockOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * 原料根数下界：列生成求解 LP 松弛（GLOP），收敛后向上取整。
 * <p>
 * 主问题：min Σx_p，s.t. 每种长度 Σ a_tp·x_p ≥ 需求，有限库存的规格 Σ x_p ≤ 库存。
 * 子问题：对每种规格做有界背包定价，约化成本为负则加入新列。
 * 定价搜索触达组合上限或 LP 未达最优时不给出下界。
 */
@Service
public class LowerBoundEstimator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LowerBoundEstimator.class);

    private static final Object NATIVE_LOCK = new Object();
    private static volatile Boolean nativeLoaded;

    private final CuttingProperties.LowerBoundProps props;
    private final int pricingNodeLimit;

    public LowerBoundEstimator(CuttingProperties properties) {
        this.props = properties.getLowerBound();
        this.pricingNodeLimit = properties.getPattern().getMaxCombinations();
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    /** OR-Tools 本地库是否可用 */
    public boolean isAvailable() {
        if (nativeLoaded == null) {
            synchronized (NATIVE_LOCK) {
                if (nativeLoaded == null) {
                    try {
                        Loader.loadNativeLibraries();
                        nativeLoaded = Boolean.TRUE;
                    } catch (RuntimeException | LinkageError e) {
                        LOGGER.warn("OR-Tools 本地库加载失败，不计算下界: {}", e.getMessage());
                        nativeLoaded = Boolean.FALSE;
                    }
                }
            }
        }
        return nativeLoaded;
    }

    public OptionalInt estimate(Job job) {
        if (!props.isEnabled() || !isAvailable()) {
            return OptionalInt.empty();
        }
        DemandSnapshot demand = DemandSnapshot.of(job.getRequests());
        if (demand.isEmpty()) {
            return OptionalInt.of(0);
        }

        MPSolver master = MPSolver.createSolver("GLOP");
        if (master == null) {
            LOGGER.warn("GLOP not available");
            return OptionalInt.empty();
        }
        try {
            return solve(master, job, demand);
        } finally {
            master.delete();
        }
    }

    private OptionalInt solve(MPSolver master, Job job, DemandSnapshot demand) {
        List<StockOption> options = job.getStockOptions();
        double kerf = job.kerf();
        master.setTimeLimit(props.getTimeLimit().toMillis());

        MPObjective obj = master.objective();
        obj.setMinimization();

        MPConstraint[] dem = new MPConstraint[demand.types()];
        for (int t = 0; t < demand.types(); t++) {
            dem[t] = master.makeConstraint(demand.count(t), MPSolver.infinity(), "dem_" + t);
        }
        MPConstraint[] avail = new MPConstraint[options.size()];
        for (int k = 0; k < options.size(); k++) {
            if (!options.get(k).isUnlimited()) {
                avail[k] = master.makeConstraint(-MPSolver.infinity(), options.get(k).getAvailable(), "avail_" + k);
            }
        }

        // 初始列：每种规格上单一长度的满填充
        Set<String> seen = new HashSet<>();
        int columns = 0;
        for (int k = 0; k < options.size(); k++) {
            if (options.get(k).getAvailable() == 0) continue;
            double capacity = options.get(k).getLength() + kerf;
            for (int t = 0; t < demand.types(); t++) {
                int fit = (int) Math.floor((capacity + PatternGenerator.EPS) / (demand.length(t) + kerf));
                int n = Math.min(demand.count(t), fit);
                if (n <= 0) continue;
                int[] col = new int[demand.types()];
                col[t] = n;
                if (seen.add(k + ":" + Arrays.toString(col))) {
                    addColumn(master, obj, dem, avail, k, col, columns++);
                }
            }
        }

        for (int it = 0; it < props.getMaxIterations(); it++) {
            MPSolver.ResultStatus status = master.solve();
            if (status != MPSolver.ResultStatus.OPTIMAL) {
                LOGGER.warn("job {} 下界 LP 未达最优: {}", job.getId(), status);
                return OptionalInt.empty();
            }

            double[] dual = new double[demand.types()];
            for (int t = 0; t < demand.types(); t++) dual[t] = dem[t].dualValue();

            boolean added = false;
            for (int k = 0; k < options.size(); k++) {
                StockOption option = options.get(k);
                if (option.getAvailable() == 0) continue;
                int[] col = price(option.getLength(), kerf, demand, dual);
                if (col == null) {
                    LOGGER.warn("job {} 定价搜索达到上限，放弃下界", job.getId());
                    return OptionalInt.empty();
                }
                double value = 0;
                for (int t = 0; t < col.length; t++) value += col[t] * dual[t];
                double mu = avail[k] == null ? 0.0 : avail[k].dualValue();
                if (1.0 - value - mu < -1e-9 && seen.add(k + ":" + Arrays.toString(col))) {
                    addColumn(master, obj, dem, avail, k, col, columns++);
                    added = true;
                }
            }

            if (!added) {
                double lp = obj.value();
                LOGGER.debug("job {} 列生成第 {} 轮收敛，LP = {}，列数 {}", job.getId(), it, lp, columns);
                return OptionalInt.of((int) Math.ceil(lp - 1e-6));
            }
        }
        LOGGER.warn("job {} 列生成 {} 轮未收敛", job.getId(), props.getMaxIterations());
        return OptionalInt.empty();
    }

    private void addColumn(MPSolver master, MPObjective obj, MPConstraint[] dem, MPConstraint[] avail,
                           int option, int[] col, int index) {
        MPVariable x = master.makeNumVar(0.0, MPSolver.infinity(), "col_" + index);
        obj.setCoefficient(x, 1.0);
        for (int t = 0; t < col.length; t++) {
            if (col[t] > 0) dem[t].setCoefficient(x, col[t]);
        }
        if (avail[option] != null) {
            avail[option].setCoefficient(x, 1.0);
        }
    }

    /**
     * 有界背包定价：max Σ dual_t·c_t，s.t. Σ c_t·(L_t + kerf) ≤ 原料长度 + kerf，c_t ≤ 需求。
     * 搜索被截断时返回 null。
     */
    private int[] price(double stockLength, double kerf, DemandSnapshot demand, double[] dual) {
        Pricing p = new Pricing(stockLength, kerf, demand, dual);
        p.walk(0, p.capacity, 0.0, new int[p.types]);
        return p.truncated ? null : p.best;
    }

    private final class Pricing {
        final int types;
        final double capacity;
        final double[] w;
        final double[] dual;
        final int[] maxCount;
        final double[] suffixRatio; // suffixRatio[t] = max_{j≥t} dual_j / w_j
        final double[] suffixValue; // suffixValue[t] = Σ_{j≥t} dual_j · maxCount_j
        int[] best;
        double bestValue = 0.0;
        long nodes;
        boolean truncated;

        Pricing(double stockLength, double kerf, DemandSnapshot demand, double[] dual) {
            this.types = demand.types();
            this.capacity = stockLength + kerf;
            this.dual = dual;
            this.w = new double[types];
            this.maxCount = new int[types];
            this.suffixRatio = new double[types + 1];
            this.suffixValue = new double[types + 1];
            this.best = new int[types];
            for (int t = 0; t < types; t++) {
                w[t] = demand.length(t) + kerf;
                int fit = (int) Math.floor((capacity + PatternGenerator.EPS) / w[t]);
                maxCount[t] = dual[t] > 0 ? Math.max(0, Math.min(demand.count(t), fit)) : 0;
            }
            for (int t = types - 1; t >= 0; t--) {
                double ratio = maxCount[t] > 0 ? dual[t] / w[t] : 0.0;
                suffixRatio[t] = Math.max(suffixRatio[t + 1], ratio);
                suffixValue[t] = suffixValue[t + 1] + (maxCount[t] > 0 ? dual[t] * maxCount[t] : 0.0);
            }
        }

        void walk(int t, double remCap, double value, int[] current) {
            if (t == types) {
                if (value > bestValue + 1e-12) {
                    bestValue = value;
                    best = current.clone();
                }
                return;
            }
            double bound = value + Math.min(remCap * suffixRatio[t], suffixValue[t]);
            if (bound <= bestValue + 1e-12) return;
            int limit = Math.max(0, Math.min(maxCount[t], (int) Math.floor((remCap + PatternGenerator.EPS) / w[t])));
            for (int n = limit; n >= 0; n--) {
                if (++nodes > pricingNodeLimit) {
                    truncated = true;
                    break;
                }
                current[t] = n;
                walk(t + 1, remCap - n * w[t], value + n * dual[t], current);
                if (truncated) break;
            }
            current[t] = 0;
        }
    }
}
