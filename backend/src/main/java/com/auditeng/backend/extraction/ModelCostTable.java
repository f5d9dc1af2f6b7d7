package com.auditeng.backend.extraction;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * USD pricing of the supported vision models. Unknown models are priced as gpt-4o.
 */
@Component
public class ModelCostTable {

    static final String DEFAULT_MODEL = "gpt-4o";

    private static final Map<String, Rates> RATES = Map.of(
            "gpt-4o", new Rates(0.0025 / 1000, 0.01 / 1000, 0.00255, 0.00765),
            "gpt-4o-mini", new Rates(0.00015 / 1000, 0.0006 / 1000, 0.001275, 0.005525),
            "gpt-4-turbo", new Rates(0.01 / 1000, 0.03 / 1000, 0.00255, 0.00765));

    public double estimate(String model, int inputTokens, int outputTokens, int imageCount, VisionDetail detail) {
        Rates rates = ratesFor(model);
        double imageRate = detail == VisionDetail.HIGH ? rates.imageHigh() : rates.imageBase();
        return inputTokens * rates.input() + outputTokens * rates.output() + imageCount * imageRate;
    }

    public Rates ratesFor(String model) {
        return RATES.getOrDefault(model, RATES.get(DEFAULT_MODEL));
    }

    /**
     * Per-token and per-image prices.
     */
    public record Rates(double input, double output, double imageBase, double imageHigh) {
    }
}
