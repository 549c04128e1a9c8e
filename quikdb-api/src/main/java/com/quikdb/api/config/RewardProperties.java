package com.quikdb.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reward engine configuration bound from {@code quikdb.rewards}.
 *
 * Economic values only seed the persisted reward policy on first start.
 * After that the policy changes through time-locked admin commands.
 */
@Configuration
@ConfigurationProperties(prefix = "quikdb.rewards")
public class RewardProperties {

    private static final BigInteger ONE_TOKEN = BigInteger.TEN.pow(18);

    private BigInteger minRewardAmount = BigInteger.TEN.pow(15); // 0.001 token
    private BigInteger maxRewardAmount = ONE_TOKEN.multiply(BigInteger.valueOf(1_000));
    private BigInteger maxDailyRewards = ONE_TOKEN.multiply(BigInteger.valueOf(5_000));
    private BigInteger maxMonthlyRewards = ONE_TOKEN.multiply(BigInteger.valueOf(100_000));
    private long minRewardIntervalSeconds = 3_600;
    private int slashingThreshold = 70;
    private int maxSlashingPercentage = 50;
    private long slashingCooldownSeconds = 86_400;
    private int maxBatchSize = 100;
    private List<String> admins = new ArrayList<>();
    private Map<String, RateLimit> rateLimits = new HashMap<>(Map.of(
            "rewardCalculation", new RateLimit(100, 3_600),
            "rewardDistribution", new RateLimit(100, 3_600),
            "slashing", new RateLimit(10, 3_600)));
    private TimeLock timelock = new TimeLock();

    public RateLimit rateLimitFor(String operation) {
        RateLimit limit = rateLimits.get(operation);
        if (limit != null) {
            return limit;
        }
        // relaxed binding may have normalized the key
        String wanted = normalize(operation);
        return rateLimits.entrySet().stream()
                .filter(e -> normalize(e.getKey()).equals(wanted))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No rate limit configured for operation: " + operation));
    }

    private static String normalize(String key) {
        return key.replace("-", "").toLowerCase(Locale.ROOT);
    }

    public BigInteger getMinRewardAmount() { return minRewardAmount; }
    public void setMinRewardAmount(BigInteger value) { this.minRewardAmount = value; }
    public BigInteger getMaxRewardAmount() { return maxRewardAmount; }
    public void setMaxRewardAmount(BigInteger value) { this.maxRewardAmount = value; }
    public BigInteger getMaxDailyRewards() { return maxDailyRewards; }
    public void setMaxDailyRewards(BigInteger value) { this.maxDailyRewards = value; }
    public BigInteger getMaxMonthlyRewards() { return maxMonthlyRewards; }
    public void setMaxMonthlyRewards(BigInteger value) { this.maxMonthlyRewards = value; }
    public long getMinRewardIntervalSeconds() { return minRewardIntervalSeconds; }
    public void setMinRewardIntervalSeconds(long value) { this.minRewardIntervalSeconds = value; }
    public int getSlashingThreshold() { return slashingThreshold; }
    public void setSlashingThreshold(int value) { this.slashingThreshold = value; }
    public int getMaxSlashingPercentage() { return maxSlashingPercentage; }
    public void setMaxSlashingPercentage(int value) { this.maxSlashingPercentage = value; }
    public long getSlashingCooldownSeconds() { return slashingCooldownSeconds; }
    public void setSlashingCooldownSeconds(long value) { this.slashingCooldownSeconds = value; }
    public int getMaxBatchSize() { return maxBatchSize; }
    public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
    public List<String> getAdmins() { return admins; }
    public void setAdmins(List<String> admins) { this.admins = admins; }
    public Map<String, RateLimit> getRateLimits() { return rateLimits; }
    public void setRateLimits(Map<String, RateLimit> rateLimits) { this.rateLimits = rateLimits; }
    public TimeLock getTimelock() { return timelock; }
    public void setTimelock(TimeLock timelock) { this.timelock = timelock; }

    public static class RateLimit {
        private int maxCalls;
        private long windowSeconds;

        public RateLimit() {}

        public RateLimit(int maxCalls, long windowSeconds) {
            this.maxCalls = maxCalls;
            this.windowSeconds = windowSeconds;
        }

        public int getMaxCalls() { return maxCalls; }
        public void setMaxCalls(int maxCalls) { this.maxCalls = maxCalls; }
        public long getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(long windowSeconds) { this.windowSeconds = windowSeconds; }
    }

    public static class TimeLock {
        private long minDelaySeconds = 3_600;
        private long maxDelaySeconds = 30L * 86_400;

        public long getMinDelaySeconds() { return minDelaySeconds; }
        public void setMinDelaySeconds(long value) { this.minDelaySeconds = value; }
        public long getMaxDelaySeconds() { return maxDelaySeconds; }
        public void setMaxDelaySeconds(long value) { this.maxDelaySeconds = value; }
    }
}
