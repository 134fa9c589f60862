package uk.gegc.assessment.features.analytics.application;

import uk.gegc.assessment.features.analytics.api.dto.ScoreBucketDto;
import uk.gegc.assessment.features.analytics.api.dto.WeeklyTrendPointDto;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Arithmetic behind the analytics rollups. Stateless; every method is total over empty input.
 */
public final class ScoreStatistics {

    public static final int BUCKET_COUNT = 10;

    private ScoreStatistics() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static int roundedMean(Collection<Integer> scores) {
        if (scores.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (int s : scores) {
            sum += s;
        }
        return (int) Math.round(sum / scores.size());
    }

    /**
     * Middle value of the sorted scores; the mean of the two middle values for an even count.
     */
    public static double median(Collection<Integer> scores) {
        if (scores.isEmpty()) {
            return 0;
        }
        List<Integer> sorted = scores.stream().sorted().toList();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 != 0) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    public static int percentage(long part, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(100.0 * part / total);
    }

    /**
     * Share of scores at or above {@code passScore}, as a rounded percentage.
     */
    public static int passRate(Collection<Integer> scores, int passScore) {
        long passed = scores.stream().filter(s -> s >= passScore).count();
        return percentage(passed, scores.size());
    }

    public static int bucketIndex(int score) {
        return Math.max(0, Math.min(score / 10, BUCKET_COUNT - 1));
    }

    public static List<ScoreBucketDto> distribution(Collection<Integer> scores) {
        long[] counts = new long[BUCKET_COUNT];
        for (int s : scores) {
            counts[bucketIndex(s)]++;
        }
        List<ScoreBucketDto> buckets = new ArrayList<>(BUCKET_COUNT);
        for (int i = 0; i < BUCKET_COUNT; i++) {
            String range = i == 0 ? "0-10" : (i * 10 + 1) + "-" + (i + 1) * 10;
            buckets.add(new ScoreBucketDto(i, range, counts[i]));
        }
        return buckets;
    }

    public static int scoreOrZero(AssessmentSession session) {
        return session.getScore() != null ? session.getScore() : 0;
    }

    /**
     * Highest scores first. {@code List.sort} is stable, so ties keep their input order.
     */
    public static <T> List<T> top(List<T> items, ToIntFunction<T> score, int limit) {
        List<T> copy = new ArrayList<>(items);
        copy.sort(Comparator.comparingInt(score).reversed());
        return copy.subList(0, Math.min(limit, copy.size()));
    }

    public static <T> List<T> bottom(List<T> items, ToIntFunction<T> score, int limit) {
        List<T> copy = new ArrayList<>(items);
        copy.sort(Comparator.comparingInt(score));
        return copy.subList(0, Math.min(limit, copy.size()));
    }

    /**
     * A finished attempt as seen by the weekly trend.
     */
    public record Completion(Instant completedAt, Integer score) {
    }

    /**
     * Exactly {@code weeks} consecutive weeks ending with the current one, oldest first. Weeks open on
     * the local Sunday in {@code zone}; a week without completions reports an average of 0.
     */
    public static List<WeeklyTrendPointDto> weeklyTrend(Collection<Completion> completions, Instant now,
                                                        ZoneId zone, int weeks) {
        LocalDate currentWeekStart = LocalDate.ofInstant(now, zone)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        List<WeeklyTrendPointDto> trend = new ArrayList<>(weeks);
        for (int w = weeks - 1; w >= 0; w--) {
            LocalDate weekStart = currentWeekStart.minusWeeks(w);
            Instant from = weekStart.atStartOfDay(zone).toInstant();
            Instant to = weekStart.plusWeeks(1).atStartOfDay(zone).toInstant();

            long count = 0;
            List<Integer> scores = new ArrayList<>();
            for (Completion c : completions) {
                if (c.completedAt() == null || c.completedAt().isBefore(from) || !c.completedAt().isBefore(to)) {
                    continue;
                }
                count++;
                if (c.score() != null) {
                    scores.add(c.score());
                }
            }
            String label = weekStart.getMonthValue() + "/" + weekStart.getDayOfMonth();
            trend.add(new WeeklyTrendPointDto(weekStart, label, count, roundedMean(scores)));
        }
        return trend;
    }
}
