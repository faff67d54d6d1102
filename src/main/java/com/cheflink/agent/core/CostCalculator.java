package com.cheflink.agent.core;

import com.cheflink.agent.model.ModelCompletion;

/**
 * Prices a model call from its reported token usage.
 * A cost reported by the provider itself wins over the computed one.
 */
public class CostCalculator {

    private final double inputCostPer1k;
    private final double outputCostPer1k;

    public CostCalculator(double inputCostPer1k, double outputCostPer1k) {
        this.inputCostPer1k = inputCostPer1k;
        this.outputCostPer1k = outputCostPer1k;
    }

    public double cost(ModelCompletion completion) {
        if (completion.getReportedCost() != null) {
            return completion.getReportedCost();
        }
        return (completion.getPromptTokens() * inputCostPer1k
                + completion.getCompletionTokens() * outputCostPer1k) / 1000.0;
    }
}
