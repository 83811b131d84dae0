package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.PatternItem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 剩余需求的只读快照。
 * 相同长度的需求行聚合为一个类型，类型按长度降序排列；
 * 模式中某类型的件数按需求行顺序依次分配。
 */
public final class DemandSnapshot {

    private final List<CutRequest> requests;
    private final int[] remaining;       // 每个需求行的剩余数量
    private final double[] lengths;      // 不同长度（降序）
    private final int[] counts;          // 各长度对应的剩余总数
    private final int[][] typeToRequest; // 每个类型的需求行下标（升序）
    private final int[] requestToType;   // 需求行 -> 类型，剩余为 0 时为 -1

    private DemandSnapshot(List<CutRequest> requests, int[] remaining) {
        this.requests = requests;
        this.remaining = Arrays.copyOf(remaining, remaining.length);
        this.requestToType = new int[remaining.length];
        Arrays.fill(requestToType, -1);

        Map<Double, List<Integer>> byLength = new TreeMap<>(Comparator.reverseOrder());
        for (int i = 0; i < requests.size(); i++) {
            if (this.remaining[i] > 0) {
                byLength.computeIfAbsent(requests.get(i).getLength(), k -> new ArrayList<>()).add(i);
            }
        }

        int types = byLength.size();
        this.lengths = new double[types];
        this.counts = new int[types];
        this.typeToRequest = new int[types][];
        int t = 0;
        for (Map.Entry<Double, List<Integer>> e : byLength.entrySet()) {
            lengths[t] = e.getKey();
            typeToRequest[t] = e.getValue().stream().mapToInt(Integer::intValue).toArray();
            for (int idx : typeToRequest[t]) {
                counts[t] += this.remaining[idx];
                requestToType[idx] = t;
            }
            t++;
        }
    }

    public static DemandSnapshot of(List<CutRequest> requests, int[] remaining) {
        if (requests.size() != remaining.length) {
            throw new IllegalArgumentException("remaining counts do not match requests: "
                    + remaining.length + " != " + requests.size());
        }
        return new DemandSnapshot(requests, remaining);
    }

    /** 全部需求尚未满足时的快照 */
    public static DemandSnapshot of(List<CutRequest> requests) {
        int[] quantities = requests.stream().mapToInt(CutRequest::getQuantity).toArray();
        return new DemandSnapshot(requests, quantities);
    }

    public int types() {
        return lengths.length;
    }

    public double length(int type) {
        return lengths[type];
    }

    public int count(int type) {
        return counts[type];
    }

    public boolean isEmpty() {
        return lengths.length == 0;
    }

    public int typeOf(int requestIndex) {
        return requestToType[requestIndex];
    }

    /**
     * 把按类型计的件数展开成按需求行计的模式条目，顺序为长度降序、需求行升序。
     */
    public List<PatternItem> distribute(int[] typeCounts) {
        List<PatternItem> items = new ArrayList<>();
        for (int t = 0; t < typeCounts.length; t++) {
            int left = typeCounts[t];
            for (int idx : typeToRequest[t]) {
                if (left <= 0) break;
                int take = Math.min(left, remaining[idx]);
                CutRequest request = requests.get(idx);
                items.add(PatternItem.builder()
                        .requestIndex(idx)
                        .label(request.getLabel())
                        .length(request.getLength())
                        .quantity(take)
                        .build());
                left -= take;
            }
            if (left > 0) {
                throw new IllegalArgumentException("count " + typeCounts[t] + " exceeds remaining demand "
                        + counts[t] + " for length " + lengths[t]);
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "DemandSnapshot{lengths=" + Arrays.toString(lengths) + ", counts=" + Arrays.toString(counts) + "}";
    }
}
