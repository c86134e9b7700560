package com.scriptvideo.api.service.compose;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 장면 가중치 → 장면별 표시 시간(ms)
 * 최대 잉여 배분(largest remainder)으로 합계가 목표 길이와 정확히 일치한다.
 */
public final class TimelinePlanner {

    /** 목표 길이가 허용하면 장면 하나는 최소 이만큼 표시 */
    static final long MIN_SCENE_MILLIS = 500;

    private TimelinePlanner() {
    }

    public static List<Long> allocate(List<Double> weights, long totalMillis) {
        int n = weights.size();
        if (n == 0) {
            return List.of();
        }
        if (totalMillis <= 0) {
            throw new IllegalArgumentException("totalMillis must be positive: " + totalMillis);
        }

        double sum = 0;
        for (Double w : weights) {
            if (w == null || !(w > 0)) {
                throw new IllegalArgumentException("weights must be positive: " + weights);
            }
            sum += w;
        }

        long[] result = new long[n];
        double[] remainders = new double[n];
        long assigned = 0;
        for (int i = 0; i < n; i++) {
            double exact = totalMillis * weights.get(i) / sum;
            result[i] = (long) Math.floor(exact);
            remainders[i] = exact - result[i];
            assigned += result[i];
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> remainders[i]).reversed()
                .thenComparing(i -> i));
        long leftover = totalMillis - assigned;
        for (int k = 0; leftover > 0; k = (k + 1) % n, leftover--) {
            result[order.get(k)]++;
        }

        if (totalMillis >= MIN_SCENE_MILLIS * n) {
            raiseToMinimum(result);
        }

        List<Long> durations = new ArrayList<>(n);
        for (long d : result) {
            durations.add(d);
        }
        return durations;
    }

    /**
     * 최소 길이 미만 장면을 올리고 그만큼 가장 긴 장면에서 뺀다
     */
    private static void raiseToMinimum(long[] result) {
        for (int i = 0; i < result.length; i++) {
            while (result[i] < MIN_SCENE_MILLIS) {
                int longest = 0;
                for (int j = 1; j < result.length; j++) {
                    if (result[j] > result[longest]) {
                        longest = j;
                    }
                }
                long take = Math.min(MIN_SCENE_MILLIS - result[i], result[longest] - MIN_SCENE_MILLIS);
                if (take <= 0) {
                    return;
                }
                result[longest] -= take;
                result[i] += take;
            }
        }
    }
}
