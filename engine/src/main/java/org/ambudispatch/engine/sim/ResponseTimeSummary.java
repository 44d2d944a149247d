package org.ambudispatch.engine.sim;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Distribution figures for a set of response times. Percentiles use the
 * nearest-rank method. All values are NaN when there are no samples.
 */
public final class ResponseTimeSummary {

    private final int count;
    private final double mean;
    private final double median;
    private final double p90;
    private final double max;

    private ResponseTimeSummary(int count, double mean, double median, double p90, double max) {
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.p90 = p90;
        this.max = max;
    }

    public static ResponseTimeSummary of(Collection<Double> samples) {
        List<Double> sorted = new ArrayList<>(samples);
        if (sorted.isEmpty()) {
            return new ResponseTimeSummary(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        Collections.sort(sorted);
        double sum = 0;
        for (double sample : sorted) {
            sum += sample;
        }
        return new ResponseTimeSummary(sorted.size(), sum / sorted.size(),
                percentile(sorted, 50), percentile(sorted, 90), sorted.get(sorted.size() - 1));
    }

    static double percentile(List<Double> sorted, int percent) {
        int rank = (int) Math.ceil(percent / 100.0 * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getP90() {
        return p90;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("n=%d mean=%.2f median=%.2f p90=%.2f max=%.2f", count, mean, median, p90, max);
    }
}
