package com.yhy.cutplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CutPlanApplication {

	public static void main(String[] args) {
		SpringApplication.run(CutPlanApplication.class, args);
	}

}
