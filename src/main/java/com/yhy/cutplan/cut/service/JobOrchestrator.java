package com.yhy.cutplan.cut.service;

import cn.hutool.core.util.IdUtil;
import com.yhy.cutplan.cut.config.CuttingProperties;
import com.yhy.cutplan.cut.exception.InvalidInputException;
import com.yhy.cutplan.cut.exception.PlanCancelledException;
import com.yhy.cutplan.cut.vo.BatchReport;
import com.yhy.cutplan.cut.vo.CuttingPlan;
import com.yhy.cutplan.cut.vo.ErrorKind;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.JobError;
import com.yhy.cutplan.cut.vo.JobResult;
import com.yhy.cutplan.cut.vo.JobStatus;
import com.yhy.cutplan.cut.vo.MaterialSummary;
import com.yhy.cutplan.cut.vo.StockAssignment;
import com.yhy.cutplan.cut.vo.StockOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 批量执行下料任务。
 * <p>
 * 每个任务在工作线程上独立完成“输入校验 → 排料 → 计划校验 → 统计”，任务之间不共享可变状态；
 * 结果在全部任务结束后按输入顺序汇总（唯一的同步点）。单个任务失败不会中断整个批次。
 */
@Service
public class JobOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobOrchestrator.class);

    private final JobInputValidator inputValidator;
    private final PlanAssembler assembler;
    private final PlanValidator validator;
    private final LowerBoundEstimator lowerBound;
    private final ExecutorService executor;
    private final Duration jobTimeout;

    public JobOrchestrator(JobInputValidator inputValidator,
                           PlanAssembler assembler,
                           PlanValidator validator,
                           LowerBoundEstimator lowerBound,
                           ExecutorService cuttingExecutor,
                           CuttingProperties properties) {
        this.inputValidator = inputValidator;
        this.assembler = assembler;
        this.validator = validator;
        this.lowerBound = lowerBound;
        this.executor = cuttingExecutor;
        this.jobTimeout = properties.getBatch().getJobTimeout();
    }

    public BatchReport runBatch(List<Job> jobs) {
        return runBatch(jobs, CancellationToken.create());
    }

    public BatchReport runBatch(List<Job> jobs, CancellationToken token) {
        String batchId = IdUtil.simpleUUID();
        LOGGER.info("批次 {} 开始，任务数 {}", batchId, jobs.size());

        List<Job> named = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            named.add(withId(jobs.get(i), i));
        }

        List<Future<JobResult>> futures = new ArrayList<>(named.size());
        for (Job job : named) {
            futures.add(executor.submit(() -> runJob(job, token)));
        }

        List<JobResult> results = new ArrayList<>(named.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), named.get(i), token));
        }

        BatchReport report = aggregate(batchId, results, token.isCancelled());
        LOGGER.info("批次 {} 结束，原料 {} 根，废料 {}，失败任务 {}", batchId,
                report.getTotalStockUnits(), report.getTotalWaste(), report.getFailedJobs());
        return report;
    }

    /**
     * 执行单个任务，所有错误均转为结构化结果返回。
     */
    public JobResult runJob(Job job, CancellationToken batchToken) {
        long start = System.nanoTime();
        if (job == null) {
            return failed(null, ErrorKind.INVALID_INPUT, "job is missing", List.of(), start);
        }
        if (batchToken.isCancelled()) {
            return failed(job, ErrorKind.CANCELLED, "batch cancelled before job started", List.of(), start);
        }

        try {
            inputValidator.check(job);
        } catch (InvalidInputException e) {
            LOGGER.warn("job {} 输入不合法: {}", job.getId(), e.getProblems());
            return failed(job, ErrorKind.INVALID_INPUT, e.getMessage(), e.getProblems(), start);
        }

        CuttingPlan plan;
        try {
            plan = assembler.assemble(job, batchToken.withTimeout(jobTimeout));
        } catch (PlanCancelledException e) {
            LOGGER.warn("job {} 已取消: {}", job.getId(), e.getMessage());
            return failed(job, ErrorKind.CANCELLED, e.getMessage(), List.of(), start);
        } catch (RuntimeException e) {
            LOGGER.error("job {} 排料异常", job.getId(), e);
            return failed(job, ErrorKind.INTERNAL_INCONSISTENCY, "assembler failed: " + e.getMessage(), List.of(), start);
        }

        List<String> violations = validator.validate(job, plan);
        if (!violations.isEmpty()) {
            LOGGER.error("job {} 计划校验失败（内部不一致）: {}", job.getId(), violations);
            return failed(job, ErrorKind.INTERNAL_INCONSISTENCY, "plan failed validation", violations, start);
        }

        JobResult result = summarize(job, plan);
        if (plan.isComplete() && lowerBound.isEnabled()) {
            OptionalInt bound = lowerBound.estimate(job);
            if (bound.isPresent()) {
                result.setStockUnitsLowerBound(bound.getAsInt());
            }
        }
        if (!plan.isComplete()) {
            LOGGER.warn("job {} 原料不足，缺口 {}", job.getId(), plan.getShortages());
        }
        result.setElapsedMillis(elapsedMillis(start));
        return result;
    }

    private JobResult await(Future<JobResult> future, Job job, CancellationToken token) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            future.cancel(true);
            return failed(job, ErrorKind.CANCELLED, "interrupted while waiting for job", List.of(), System.nanoTime());
        } catch (CancellationException e) {
            return failed(job, ErrorKind.CANCELLED, "job cancelled", List.of(), System.nanoTime());
        } catch (ExecutionException e) {
            LOGGER.error("job {} 执行异常", job.getId(), e.getCause());
            return failed(job, ErrorKind.INTERNAL_INCONSISTENCY, String.valueOf(e.getCause()), List.of(), System.nanoTime());
        }
    }

    private JobResult summarize(Job job, CuttingPlan plan) {
        Map<String, Integer> units = new LinkedHashMap<>();
        for (StockOption option : job.getStockOptions()) {
            units.put(option.getId(), 0);
        }
        double waste = 0;
        double consumed = 0;
        double used = 0;
        for (StockAssignment a : plan.getAssignments()) {
            units.merge(a.getStockOptionId(), 1, Integer::sum);
            waste += a.getLeftover();
            consumed += a.getStockLength();
            used += a.getPattern().getPiecesLength();
        }
        return JobResult.builder()
                .jobId(job.getId())
                .materialId(job.materialId())
                .status(plan.isComplete() ? JobStatus.COMPLETE : JobStatus.PARTIAL)
                .plan(plan)
                .stockUnitsByOption(units)
                .totalStockUnits(plan.getAssignments().size())
                .totalWaste(waste)
                .consumedLength(consumed)
                .usedLength(used)
                .utilizationPercent(consumed > 0 ? round2(used / consumed * 100) : 0.0)
                .build();
    }

    private BatchReport aggregate(String batchId, List<JobResult> results, boolean cancelled) {
        Map<String, MaterialSummary> materials = new LinkedHashMap<>();
        int units = 0;
        double waste = 0;
        int failed = 0;
        for (JobResult r : results) {
            if (r.getStatus() == JobStatus.FAILED) failed++;
            String key = r.getMaterialId() == null ? "" : r.getMaterialId();
            MaterialSummary m = materials.computeIfAbsent(key, id -> MaterialSummary.builder().materialId(r.getMaterialId()).build());
            m.setJobs(m.getJobs() + 1);
            r.getStockUnitsByOption().forEach((id, n) -> m.getStockUnitsByOption().merge(id, n, Integer::sum));
            m.setTotalStockUnits(m.getTotalStockUnits() + r.getTotalStockUnits());
            m.setTotalWaste(m.getTotalWaste() + r.getTotalWaste());
            m.setConsumedLength(m.getConsumedLength() + r.getConsumedLength());
            units += r.getTotalStockUnits();
            waste += r.getTotalWaste();
        }
        return BatchReport.builder()
                .batchId(batchId)
                .results(results)
                .materials(new ArrayList<>(materials.values()))
                .totalStockUnits(units)
                .totalWaste(waste)
                .failedJobs(failed)
                .cancelled(cancelled)
                .build();
    }

    private JobResult failed(Job job, ErrorKind kind, String message, List<String> violations, long start) {
        return JobResult.builder()
                .jobId(job == null ? null : job.getId())
                .materialId(job == null ? null : job.materialId())
                .status(JobStatus.FAILED)
                .error(JobError.builder()
                        .kind(kind)
                        .message(message)
                        .violations(new ArrayList<>(violations))
                        .build())
                .elapsedMillis(elapsedMillis(start))
                .build();
    }

    private Job withId(Job job, int index) {
        if (job == null || (job.getId() != null && !job.getId().isBlank())) {
            return job;
        }
        return job.toBuilder().id("job-" + (index + 1)).build();
    }

    private long elapsedMillis(long start) {
        return Duration.ofNanos(System.nanoTime() - start).toMillis();
    }

    private double round2(double v) {
        return new BigDecimal(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
