package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record CostReport(
    BigDecimal totalSpend,
    Map<String, BigDecimal> spendByCostClass,
    long deliveredEntities,
    BigDecimal averagePerDeliveredEntity,
    double cheapestTierShare,
    String suggestion,
    List<String> warnings
) {
}
