package com.yhy.cutplan.cut.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 下料优化参数（前缀 cutting）
 */
@Data
@ConfigurationProperties(prefix = "cutting")
public class CuttingProperties {

    private PatternProps pattern = new PatternProps();

    private AssemblyProps assembly = new AssemblyProps();

    private BatchProps batch = new BatchProps();

    private LowerBoundProps lowerBound = new LowerBoundProps();

    @Data
    public static class PatternProps {
        /** 每次模式搜索最多访问的组合节点数，超出后追加贪心填充模式 */
        private int maxCombinations = 200_000;
    }

    @Data
    public static class AssemblyProps {
        /** 有限库存原料最多尝试的库存上限组合数（含原始库存） */
        private int maxVariants = 1024;
    }

    @Data
    public static class BatchProps {
        /** 并行线程数 */
        private int parallelism = Runtime.getRuntime().availableProcessors();
        /** 单个任务超时，超时后协作式取消 */
        private Duration jobTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class LowerBoundProps {
        private boolean enabled = true;
        private Duration timeLimit = Duration.ofSeconds(5);
        /** 列生成最大迭代次数 */
        private int maxIterations = 300;
    }
}
