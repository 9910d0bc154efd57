package com.catalog.quality.aggregate;

import java.time.Duration;

/**
 * Fan-out and deadline settings for project aggregation.
 *
 * @param concurrency         databases one aggregation reads at the same time
 * @param baseDeadline        deadline for a project with no databases
 * @param perDatabaseDeadline added to the deadline for every database
 * @param maxDeadline         upper bound of the deadline
 */
public record AggregatorConfig(int concurrency, Duration baseDeadline, Duration perDatabaseDeadline,
                               Duration maxDeadline) {

    public AggregatorConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (baseDeadline == null || baseDeadline.isNegative() || baseDeadline.isZero()) {
            throw new IllegalArgumentException("baseDeadline must be positive");
        }
        if (perDatabaseDeadline == null || perDatabaseDeadline.isNegative()) {
            throw new IllegalArgumentException("perDatabaseDeadline must be >= 0");
        }
        if (maxDeadline == null || maxDeadline.compareTo(baseDeadline) < 0) {
            throw new IllegalArgumentException("maxDeadline must be >= baseDeadline");
        }
    }

    public static AggregatorConfig defaults() {
        return new AggregatorConfig(5, Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(120));
    }

    public Duration deadlineFor(int databases) {
        Duration deadline = baseDeadline.plus(perDatabaseDeadline.multipliedBy(databases));
        return deadline.compareTo(maxDeadline) > 0 ? maxDeadline : deadline;
    }
}
