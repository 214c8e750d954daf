package org.dbreport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat summary metrics of one database's load-test run.
 * 
 * <p><b>Fields:</b>
 * <ul>
 *   <li><b>targetUsers / maxUsersReached / userAchievementRate</b>: configured load,
 *       peak concurrent users from the history, and their ratio as a percentage</li>
 *   <li><b>totalRequests / requestsPerSec</b>: request count and throughput of the aggregate row</li>
 *   <li><b>avg/median/min/maxResponseTime, p50, p90, p95, p99</b>: latencies in milliseconds</li>
 *   <li><b>totalFailures / failureRate</b>: failure count and its share of requests as a percentage</li>
 *   <li><b>throughputPerUser</b>: requests per second per sustained user</li>
 *   <li><b>throughputStdDev / throughputCV / latencyStdDev</b>: variability of the
 *       per-second history, ignoring samples with zero throughput</li>
 * </ul>
 * 
 * <p>Every ratio is zero when its denominator is zero. Instances are immutable;
 * use {@link #builder(String)} to create one.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class MetricsRecord {
    private final String database;
    private final long targetUsers;
    private final long maxUsersReached;
    private final double userAchievementRate;
    private final long totalRequests;
    private final double requestsPerSec;
    private final double avgResponseTime;
    private final double medianResponseTime;
    private final double minResponseTime;
    private final double maxResponseTime;
    private final double p50;
    private final double p90;
    private final double p95;
    private final double p99;
    private final long totalFailures;
    private final double failureRate;
    private final double throughputPerUser;
    private final double throughputStdDev;
    private final double throughputCV;
    private final double latencyStdDev;
    private final int failureLogRows;
    private final int exceptionLogRows;

    private MetricsRecord(Builder b) {
        this.database = b.database;
        this.targetUsers = b.targetUsers;
        this.maxUsersReached = b.maxUsersReached;
        this.userAchievementRate = b.userAchievementRate;
        this.totalRequests = b.totalRequests;
        this.requestsPerSec = b.requestsPerSec;
        this.avgResponseTime = b.avgResponseTime;
        this.medianResponseTime = b.medianResponseTime;
        this.minResponseTime = b.minResponseTime;
        this.maxResponseTime = b.maxResponseTime;
        this.p50 = b.p50;
        this.p90 = b.p90;
        this.p95 = b.p95;
        this.p99 = b.p99;
        this.totalFailures = b.totalFailures;
        this.failureRate = b.failureRate;
        this.throughputPerUser = b.throughputPerUser;
        this.throughputStdDev = b.throughputStdDev;
        this.throughputCV = b.throughputCV;
        this.latencyStdDev = b.latencyStdDev;
        this.failureLogRows = b.failureLogRows;
        this.exceptionLogRows = b.exceptionLogRows;
    }

    public static Builder builder(String database) {
        return new Builder(database);
    }

    public String getDatabase() { return database; }
    public long getTargetUsers() { return targetUsers; }
    public long getMaxUsersReached() { return maxUsersReached; }
    public double getUserAchievementRate() { return userAchievementRate; }
    public long getTotalRequests() { return totalRequests; }
    public double getRequestsPerSec() { return requestsPerSec; }
    public double getAvgResponseTime() { return avgResponseTime; }
    public double getMedianResponseTime() { return medianResponseTime; }
    public double getMinResponseTime() { return minResponseTime; }
    public double getMaxResponseTime() { return maxResponseTime; }
    public double getP50() { return p50; }
    public double getP90() { return p90; }
    public double getP95() { return p95; }
    public double getP99() { return p99; }
    public long getTotalFailures() { return totalFailures; }
    public double getFailureRate() { return failureRate; }
    public double getThroughputPerUser() { return throughputPerUser; }
    public double getThroughputStdDev() { return throughputStdDev; }
    public double getThroughputCV() { return throughputCV; }
    public double getLatencyStdDev() { return latencyStdDev; }

    /**
     * Number of rows in the failures log, or -1 when the run left no failures file.
     */
    public int getFailureLogRows() { return failureLogRows; }

    /**
     * Number of rows in the exceptions log, or -1 when the run left no exceptions file.
     */
    public int getExceptionLogRows() { return exceptionLogRows; }

    /**
     * Returns the numeric fields as an ordered name-to-value map for renderers.
     * 
     * @return Unmodifiable map in declaration order, starting with {@code targetUsers}
     */
    public Map<String, Number> toMap() {
        Map<String, Number> m = new LinkedHashMap<>();
        m.put("targetUsers", targetUsers);
        m.put("maxUsersReached", maxUsersReached);
        m.put("userAchievementRate", userAchievementRate);
        m.put("totalRequests", totalRequests);
        m.put("requestsPerSec", requestsPerSec);
        m.put("avgResponseTime", avgResponseTime);
        m.put("medianResponseTime", medianResponseTime);
        m.put("minResponseTime", minResponseTime);
        m.put("maxResponseTime", maxResponseTime);
        m.put("p50", p50);
        m.put("p90", p90);
        m.put("p95", p95);
        m.put("p99", p99);
        m.put("totalFailures", totalFailures);
        m.put("failureRate", failureRate);
        m.put("throughputPerUser", throughputPerUser);
        m.put("throughputStdDev", throughputStdDev);
        m.put("throughputCV", throughputCV);
        m.put("latencyStdDev", latencyStdDev);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return "MetricsRecord{" + database + " " + toMap() + "}";
    }

    /**
     * Mutable builder for {@link MetricsRecord}. Unset fields are zero.
     */
    public static final class Builder {
        private final String database;
        private long targetUsers;
        private long maxUsersReached;
        private double userAchievementRate;
        private long totalRequests;
        private double requestsPerSec;
        private double avgResponseTime;
        private double medianResponseTime;
        private double minResponseTime;
        private double maxResponseTime;
        private double p50;
        private double p90;
        private double p95;
        private double p99;
        private long totalFailures;
        private double failureRate;
        private double throughputPerUser;
        private double throughputStdDev;
        private double throughputCV;
        private double latencyStdDev;
        private int failureLogRows = -1;
        private int exceptionLogRows = -1;

        private Builder(String database) {
            this.database = database;
        }

        public Builder targetUsers(long v) { this.targetUsers = v; return this; }
        public Builder maxUsersReached(long v) { this.maxUsersReached = v; return this; }
        public Builder userAchievementRate(double v) { this.userAchievementRate = v; return this; }
        public Builder totalRequests(long v) { this.totalRequests = v; return this; }
        public Builder requestsPerSec(double v) { this.requestsPerSec = v; return this; }
        public Builder avgResponseTime(double v) { this.avgResponseTime = v; return this; }
        public Builder medianResponseTime(double v) { this.medianResponseTime = v; return this; }
        public Builder minResponseTime(double v) { this.minResponseTime = v; return this; }
        public Builder maxResponseTime(double v) { this.maxResponseTime = v; return this; }
        public Builder p50(double v) { this.p50 = v; return this; }
        public Builder p90(double v) { this.p90 = v; return this; }
        public Builder p95(double v) { this.p95 = v; return this; }
        public Builder p99(double v) { this.p99 = v; return this; }
        public Builder totalFailures(long v) { this.totalFailures = v; return this; }
        public Builder failureRate(double v) { this.failureRate = v; return this; }
        public Builder throughputPerUser(double v) { this.throughputPerUser = v; return this; }
        public Builder throughputStdDev(double v) { this.throughputStdDev = v; return this; }
        public Builder throughputCV(double v) { this.throughputCV = v; return this; }
        public Builder latencyStdDev(double v) { this.latencyStdDev = v; return this; }
        public Builder failureLogRows(int v) { this.failureLogRows = v; return this; }
        public Builder exceptionLogRows(int v) { this.exceptionLogRows = v; return this; }

        public MetricsRecord build() {
            return new MetricsRecord(this);
        }
    }
}
