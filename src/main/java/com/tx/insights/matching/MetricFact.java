package com.tx.insights.matching;

/**
 * One performance observation for a subject (URL, product id or GTIN) over a date range.
 *
 * <p>Impressions, clicks, conversions, revenue and sessions are additive. The average search
 * position is not, so it contributes through {@link #positionWeight()}, which is additive.
 *
 * @param subjectKey  URL, product id or GTIN the source reported
 * @param source      origin of the numbers
 * @param dateRange   inclusive date range
 * @param impressions search or shopping impressions
 * @param clicks      clicks from those impressions
 * @param conversions transactions
 * @param revenue     revenue in account currency
 * @param sessions    analytics sessions
 * @param position    average search position, 0 when the source does not report one
 */
public record MetricFact(
    String subjectKey,
    MetricSource source,
    DateRange dateRange,
    long impressions,
    long clicks,
    long conversions,
    double revenue,
    long sessions,
    double position
) {

    public MetricFact {
        if (source == null) {
            throw new IllegalArgumentException("Metric source must not be null");
        }
        if (dateRange == null) {
            throw new IllegalArgumentException("Date range must not be null");
        }
        if (impressions < 0 || clicks < 0 || conversions < 0 || sessions < 0) {
            throw new IllegalArgumentException("Metric counts must be non-negative: " + subjectKey);
        }
        if (revenue < 0 || Double.isNaN(revenue) || Double.isInfinite(revenue)) {
            throw new IllegalArgumentException("Revenue must be a non-negative number: " + subjectKey);
        }
        if (position < 0 || Double.isNaN(position)) {
            throw new IllegalArgumentException("Position must be non-negative: " + subjectKey);
        }
    }

    public static Builder builder(String subjectKey, MetricSource source, DateRange dateRange) {
        return new Builder(subjectKey, source, dateRange);
    }

    /**
     * Key identifying the fact within a batch.
     */
    public String key() {
        return source + "|" + subjectKey + "|" + dateRange.start() + "|" + dateRange.end();
    }

    public boolean hasPosition() {
        return position > 0 && impressions > 0;
    }

    /**
     * Position multiplied by impressions, so averages are derived from summed totals.
     */
    public double positionWeight() {
        return hasPosition() ? position * impressions : 0.0;
    }

    public long positionedImpressions() {
        return hasPosition() ? impressions : 0L;
    }

    public static final class Builder {
        private final String subjectKey;
        private final MetricSource source;
        private final DateRange dateRange;
        private long impressions;
        private long clicks;
        private long conversions;
        private double revenue;
        private long sessions;
        private double position;

        private Builder(String subjectKey, MetricSource source, DateRange dateRange) {
            this.subjectKey = subjectKey;
            this.source = source;
            this.dateRange = dateRange;
        }

        public Builder impressions(long impressions) {
            this.impressions = impressions;
            return this;
        }

        public Builder clicks(long clicks) {
            this.clicks = clicks;
            return this;
        }

        public Builder conversions(long conversions) {
            this.conversions = conversions;
            return this;
        }

        public Builder revenue(double revenue) {
            this.revenue = revenue;
            return this;
        }

        public Builder sessions(long sessions) {
            this.sessions = sessions;
            return this;
        }

        public Builder position(double position) {
            this.position = position;
            return this;
        }

        public MetricFact build() {
            return new MetricFact(subjectKey, source, dateRange, impressions, clicks, conversions,
                revenue, sessions, position);
        }
    }
}
