package com.cube.orchestrator.domain.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Time partitioning of a pre-aggregation. Boundaries are computed in the
 * time zone the partition is planned for.
 */
public enum PartitionGranularity {

    HOUR(Duration.ofHours(1)) {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.truncatedTo(ChronoUnit.HOURS);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime start) {
            return start.plusHours(1);
        }
    },
    DAY(Duration.ofHours(25)) {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.truncatedTo(ChronoUnit.DAYS);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime start) {
            return start.plusDays(1);
        }
    },
    WEEK(Duration.ofDays(7).plusHours(1)) {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public ZonedDateTime next(ZonedDateTime start) {
            return start.plusWeeks(1);
        }
    },
    MONTH(Duration.ofDays(31).plusHours(1)) {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime start) {
            return start.plusMonths(1);
        }
    },
    QUARTER(Duration.ofDays(92).plusHours(1)) {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            int firstMonth = (time.getMonthValue() - 1) / 3 * 3 + 1;
            return time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).withMonth(firstMonth);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime start) {
            return start.plusMonths(3);
        }
    },
    YEAR(Duration.ofDays(366).plusHours(1)) {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime start) {
            return start.plusYears(1);
        }
    };

    private final Duration maxLength;

    PartitionGranularity(Duration maxLength) {
        this.maxLength = maxLength;
    }

    public abstract ZonedDateTime truncate(ZonedDateTime time);

    public abstract ZonedDateTime next(ZonedDateTime start);

    /**
     * Upper bound of the length of one partition in any time zone, DST transitions included.
     */
    public Duration getMaxLength() {
        return maxLength;
    }
}
