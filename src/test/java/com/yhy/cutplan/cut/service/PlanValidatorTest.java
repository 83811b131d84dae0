package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.vo.CuttingPlan;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.Pattern;
import com.yhy.cutplan.cut.vo.PatternItem;
import com.yhy.cutplan.cut.vo.PlanStatus;
import com.yhy.cutplan.cut.vo.Shortage;
import com.yhy.cutplan.cut.vo.ShortageReason;
import com.yhy.cutplan.cut.vo.StockAssignment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.yhy.cutplan.cut.service.JobFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PlanValidatorTest {

    private final PlanValidator validator = new PlanValidator();

    private final Job job = job("v1", "rod", 0)
            .request(piece(30, 2))
            .request(piece(40, 1))
            .stockOption(limited("rod-100", 100, 1))
            .stockOption(unlimited("rod-50", 50))
            .build();

    @Test
    void acceptsCorrectCompletePlan() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE,
                unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1)));

        assertEquals(List.of(), validator.validate(job, plan));
    }

    @Test
    void rejectsPatternLongerThanStock() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE,
                unit("rod-50", 50, 1, item(0, 30, 1), item(1, 40, 1)),
                unit("rod-50", 50, 2, item(0, 30, 1)));

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.contains("(pieces + kerf)"));
    }

    @Test
    void kerfPushesPatternOverTheEdge() {
        Job tight = job("v2", "rod", 2)
                .request(piece(50, 2))
                .stockOption(unlimited("rod-100", 100))
                .build();
        CuttingPlan plan = plan(PlanStatus.COMPLETE, unit("rod-100", 100, 1, item(0, 50, 2)));

        assertThat(validator.validate(tight, plan)).anyMatch(v -> v.contains("needs 102.0"));
    }

    @Test
    void rejectsStockUsedBeyondAvailability() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE,
                unit("rod-100", 100, 1, item(0, 30, 2)),
                unit("rod-100", 100, 2, item(1, 40, 1)));

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.contains("used 2 times but only 1 available"));
    }

    @Test
    void rejectsCompletePlanMissingPieces() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE, unit("rod-100", 100, 1, item(0, 30, 2)));

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.contains("fulfilled 0 of 1 in a complete plan"));
    }

    @Test
    void rejectsOverFulfilment() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE,
                unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1)),
                unit("rod-50", 50, 1, item(0, 30, 1)));

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.contains("over-fulfilled"));
    }

    @Test
    void acceptsPartialPlanWithMatchingShortage() {
        CuttingPlan plan = plan(PlanStatus.PARTIAL, unit("rod-100", 100, 1, item(0, 30, 2)));
        plan.getShortages().add(shortage(1, 40, 1, 0, 1));

        assertEquals(List.of(), validator.validate(job, plan));
    }

    @Test
    void rejectsShortageThatDoesNotAddUp() {
        CuttingPlan plan = plan(PlanStatus.PARTIAL, unit("rod-100", 100, 1, item(0, 30, 1)));
        plan.getShortages().add(shortage(1, 40, 1, 0, 1));

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.startsWith("request 0 fulfilled 1 + missing 0"));
    }

    @Test
    void rejectsPartialPlanWithoutShortage() {
        CuttingPlan plan = plan(PlanStatus.PARTIAL, unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1)));

        assertThat(validator.validate(job, plan)).contains("partial plan records no shortage");
    }

    @Test
    void rejectsUnknownStockOption() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE, unit("rod-999", 100, 1, item(0, 30, 2), item(1, 40, 1)));

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.contains("unknown stock option rod-999"));
    }

    @Test
    void rejectsWrongLeftover() {
        StockAssignment a = unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1));
        a.setLeftover(10);
        CuttingPlan plan = plan(PlanStatus.COMPLETE, a);

        assertThat(validator.validate(job, plan)).anyMatch(v -> v.contains("reports leftover 10.0"));
    }

    @Test
    void rejectsMissingPlan() {
        assertEquals(List.of("plan is missing"), validator.validate(job, null));
    }

    @Test
    void reportsMissingStockOptionInsteadOfFailing() {
        Job withGap = job("v3", "rod", 0)
                .request(piece(30, 2))
                .request(piece(40, 1))
                .stockOptions(Arrays.asList(unlimited("rod-100", 100), null))
                .build();
        CuttingPlan plan = plan(PlanStatus.COMPLETE, unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1)));

        assertEquals(List.of("stock option 1 is missing"), validator.validate(withGap, plan));
    }

    @Test
    void reportsMissingRequestInsteadOfFailing() {
        Job withGap = job("v4", "rod", 0)
                .requests(Arrays.asList(piece(30, 2), null))
                .stockOption(unlimited("rod-100", 100))
                .build();
        CuttingPlan plan = plan(PlanStatus.COMPLETE, unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1)));

        assertThat(validator.validate(withGap, plan))
                .contains("request 1 is missing", "assignment 0 references missing request 1")
                .noneMatch(v -> v.contains("fulfilled"));
    }

    @Test
    void reportsMissingAssignmentEntry() {
        CuttingPlan plan = plan(PlanStatus.COMPLETE, unit("rod-100", 100, 1, item(0, 30, 2), item(1, 40, 1)));
        plan.getAssignments().add(null);

        assertEquals(List.of("assignment 1 is missing"), validator.validate(job, plan));
    }

    private static PatternItem item(int request, double length, int quantity) {
        return PatternItem.builder().requestIndex(request).length(length).quantity(quantity).build();
    }

    private StockAssignment unit(String option, double length, int number, PatternItem... items) {
        Pattern pattern = Pattern.builder().stockLength(length).kerf(job.kerf()).items(List.of(items)).build();
        return StockAssignment.builder()
                .stockOptionId(option)
                .unitNumber(number)
                .stockLength(length)
                .pattern(pattern)
                .kerfLoss(pattern.getKerfLoss())
                .leftover(pattern.getWaste())
                .build();
    }

    private static CuttingPlan plan(PlanStatus status, StockAssignment... units) {
        return CuttingPlan.builder()
                .jobId("v1")
                .status(status)
                .assignments(new ArrayList<>(List.of(units)))
                .shortages(new ArrayList<>())
                .build();
    }

    private static Shortage shortage(int request, double length, int required, int fulfilled, int missing) {
        return Shortage.builder()
                .requestIndex(request)
                .length(length)
                .required(required)
                .fulfilled(fulfilled)
                .missing(missing)
                .reason(ShortageReason.STOCK_EXHAUSTED)
                .build();
    }
}
