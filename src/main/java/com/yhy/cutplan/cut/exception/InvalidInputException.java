package com.yhy.cutplan.cut.exception;

import java.util.List;

/**
 * 任务输入不合法，在优化开始前抛出
 */
public class InvalidInputException extends RuntimeException {

    private final List<String> problems;

    public InvalidInputException(String jobId, List<String> problems) {
        super("job " + jobId + " has invalid input: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
