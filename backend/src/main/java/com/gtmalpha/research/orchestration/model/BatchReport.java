package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;
import java.util.List;

public record BatchReport(int batchNumber, List<TaskReport> tasks, BigDecimal batchCost) {}
