package com.auditeng.backend.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelCostTableTest {

    private final ModelCostTable costTable = new ModelCostTable();

    @Test
    void shouldPriceTokensAndHighDetailImages() {
        double cost = costTable.estimate("gpt-4o", 1000, 500, 1, VisionDetail.HIGH);

        assertEquals(0.0025 + 0.005 + 0.00765, cost, 1e-9);
    }

    @Test
    void shouldUseBaseImageRateBelowHighDetail() {
        double cost = costTable.estimate("gpt-4o-mini", 0, 0, 2, VisionDetail.LOW);

        assertEquals(2 * 0.001275, cost, 1e-9);
    }

    @Test
    void shouldPriceUnknownModelAsDefault() {
        assertEquals(costTable.estimate("gpt-4o", 1200, 300, 2, VisionDetail.HIGH),
                costTable.estimate("some-new-model", 1200, 300, 2, VisionDetail.HIGH), 1e-12);
    }
}
