package com.yhy.cutplan.cut.controller;

import com.yhy.cutplan.cut.service.JobOrchestrator;
import com.yhy.cutplan.cut.service.PlanValidator;
import com.yhy.cutplan.cut.vo.BatchReport;
import com.yhy.cutplan.cut.vo.BatchRequest;
import com.yhy.cutplan.cut.vo.R;
import com.yhy.cutplan.cut.vo.ValidateRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;


@RestController()
@RequestMapping(value = "api/cut")
public class CutController {

    private final JobOrchestrator orchestrator;
    private final PlanValidator validator;

    public CutController(JobOrchestrator orchestrator,
                         PlanValidator validator) {
        this.orchestrator = orchestrator;
        this.validator = validator;
    }

    @PostMapping(value = "batch")
    public R<BatchReport> batch(@Valid @RequestBody BatchRequest request) {
        return R.ok(orchestrator.runBatch(request.getJobs()));
    }


    @PostMapping(value = "validate")
    public R<List<String>> validate(@Valid @RequestBody ValidateRequest request) {
        List<String> violations = validator.validate(request.getJob(), request.getPlan());
        return violations.isEmpty() ? R.ok(violations) : R.failed(violations, "计划校验未通过");
    }


}
