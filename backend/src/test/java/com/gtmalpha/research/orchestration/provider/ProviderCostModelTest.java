package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.config.ResearchProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCostModelTest {

    @Test
    void perTokenPricingEstimatesFromResponseSize() {
        ProviderCostModel model = new ProviderCostModel(
            ResearchProperties.CostModel.PER_TOKEN,
            BigDecimal.ZERO,
            new BigDecimal("15.00")
        );

        assertThat(model.cost(null, 4_000)).isEqualByComparingTo("0.015");
        assertThat(model.cost(null, 0)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void reportedCostWinsOverConfiguredModel() {
        ProviderCostModel model = new ProviderCostModel(ResearchProperties.CostModel.FLAT, new BigDecimal("0.01"), null);

        assertThat(model.cost(new BigDecimal("0.25"), 10)).isEqualByComparingTo("0.25");
        assertThat(model.cost(new BigDecimal("-1"), 10)).isEqualByComparingTo("0.01");
        assertThat(model.cost(null, 10)).isEqualByComparingTo("0.01");
    }

    @Test
    void missingModelDefaultsToFlat() {
        ProviderCostModel model = new ProviderCostModel(null, null, null);

        assertThat(model.cost(null, 1_000_000)).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
