package com.yhy.cutplan;

import com.yhy.cutplan.cut.service.JobOrchestrator;
import com.yhy.cutplan.cut.vo.BatchReport;
import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.Job;
import com.yhy.cutplan.cut.vo.JobStatus;
import com.yhy.cutplan.cut.vo.Material;
import com.yhy.cutplan.cut.vo.StockOption;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
class CutPlanApplicationTests {

	@Autowired
	private JobOrchestrator orchestrator;

	@Test
	void runsBatchThroughWiredServices() {
		Job job = Job.builder()
				.id("ctx")
				.material(Material.builder().id("steel-rod").kerf(0).build())
				.request(CutRequest.builder().length(30).quantity(3).build())
				.request(CutRequest.builder().length(40).quantity(1).build())
				.stockOption(StockOption.builder().id("rod-100").length(100).build())
				.build();

		BatchReport report = orchestrator.runBatch(List.of(job));

		assertEquals(JobStatus.COMPLETE, report.getResults().get(0).getStatus());
		assertEquals(2, report.getTotalStockUnits());
		assertEquals(70.0, report.getTotalWaste(), 1e-9);
	}

}
