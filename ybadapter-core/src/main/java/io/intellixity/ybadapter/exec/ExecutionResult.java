package io.intellixity.ybadapter.exec;

public record ExecutionResult(AdapterResponse response, ResultTable table) {}
