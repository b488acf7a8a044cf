package com.nursery.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Totals derived from one owner's received, dead, discarded and produced streams.
 * {@code totalInNursery} is not clamped and goes negative when losses exceed inputs.
 */
public record DashboardStats(
    @JsonProperty("total_received") long totalReceived,
    @JsonProperty("total_dead") long totalDead,
    @JsonProperty("total_discarded") long totalDiscarded,
    @JsonProperty("total_produced") long totalProduced,
    @JsonProperty("survival_rate") double survivalRate,
    @JsonProperty("total_in_nursery") long totalInNursery
) {

    public static DashboardStats of(long totalReceived, long totalDead, long totalDiscarded, long totalProduced) {
        long totalInNursery = totalReceived + totalProduced - totalDead - totalDiscarded;
        long totalInput = totalReceived + totalProduced;
        double survivalRate = totalInput > 0
            ? BigDecimal.valueOf(totalInNursery * 100.0 / totalInput).setScale(2, RoundingMode.HALF_UP).doubleValue()
            : 0;
        return new DashboardStats(totalReceived, totalDead, totalDiscarded, totalProduced, survivalRate, totalInNursery);
    }
}
