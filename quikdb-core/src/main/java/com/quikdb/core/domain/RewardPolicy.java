package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Economic parameters of the reward engine.
 * Seeded from configuration once; afterwards changed only by time-locked admin commands.
 */
@Entity
@Table(name = "reward_policies")
public class RewardPolicy {

    public static final String DEFAULT_ID = "default";

    @Id
    @Column(name = "policy_id", length = 32)
    private String id;

    @NotNull
    @Column(name = "min_reward_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger minRewardAmount;

    @NotNull
    @Column(name = "max_reward_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger maxRewardAmount;

    @NotNull
    @Column(name = "max_daily_rewards", nullable = false, precision = 38, scale = 0)
    private BigInteger maxDailyRewards;

    @NotNull
    @Column(name = "max_monthly_rewards", nullable = false, precision = 38, scale = 0)
    private BigInteger maxMonthlyRewards;

    @Column(name = "min_reward_interval_seconds", nullable = false)
    private long minRewardIntervalSeconds;

    @Column(name = "slashing_threshold", nullable = false)
    private int slashingThreshold;

    @Column(name = "max_slashing_percentage", nullable = false)
    private int maxSlashingPercentage;

    @Column(name = "slashing_cooldown_seconds", nullable = false)
    private long slashingCooldownSeconds;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected RewardPolicy() {}

    public static RewardPolicy seed(
            BigInteger minRewardAmount,
            BigInteger maxRewardAmount,
            BigInteger maxDailyRewards,
            BigInteger maxMonthlyRewards,
            long minRewardIntervalSeconds,
            int slashingThreshold,
            int maxSlashingPercentage,
            long slashingCooldownSeconds,
            Instant now) {
        var policy = new RewardPolicy();
        policy.id = DEFAULT_ID;
        policy.minRewardAmount = minRewardAmount;
        policy.maxRewardAmount = maxRewardAmount;
        policy.maxDailyRewards = maxDailyRewards;
        policy.maxMonthlyRewards = maxMonthlyRewards;
        policy.minRewardIntervalSeconds = minRewardIntervalSeconds;
        policy.slashingThreshold = slashingThreshold;
        policy.maxSlashingPercentage = maxSlashingPercentage;
        policy.slashingCooldownSeconds = slashingCooldownSeconds;
        policy.updatedAt = now;
        policy.checkConsistency();
        return policy;
    }

    public void updateMinRewardAmount(BigInteger value, Instant now) {
        this.minRewardAmount = value;
        touch(now);
    }

    public void updateMaxRewardAmount(BigInteger value, Instant now) {
        this.maxRewardAmount = value;
        touch(now);
    }

    public void updateMaxDailyRewards(BigInteger value, Instant now) {
        this.maxDailyRewards = value;
        touch(now);
    }

    public void updateMaxMonthlyRewards(BigInteger value, Instant now) {
        this.maxMonthlyRewards = value;
        touch(now);
    }

    public void updateMinRewardInterval(long seconds, Instant now) {
        this.minRewardIntervalSeconds = seconds;
        touch(now);
    }

    public void updateSlashing(int threshold, int maxPercentage, long cooldownSeconds, Instant now) {
        this.slashingThreshold = threshold;
        this.maxSlashingPercentage = maxPercentage;
        this.slashingCooldownSeconds = cooldownSeconds;
        touch(now);
    }

    private void touch(Instant now) {
        checkConsistency();
        this.updatedAt = now;
    }

    private void checkConsistency() {
        if (minRewardAmount.signum() <= 0) {
            throw new IllegalArgumentException("Minimum reward amount must be positive");
        }
        if (maxRewardAmount.compareTo(minRewardAmount) < 0) {
            throw new IllegalArgumentException("Maximum reward amount below minimum");
        }
        if (maxDailyRewards.compareTo(maxRewardAmount) < 0) {
            throw new IllegalArgumentException("Daily cap below maximum reward amount");
        }
        if (maxMonthlyRewards.compareTo(maxDailyRewards) < 0) {
            throw new IllegalArgumentException("Monthly cap below daily cap");
        }
        if (minRewardIntervalSeconds < 0 || slashingCooldownSeconds < 0) {
            throw new IllegalArgumentException("Intervals must not be negative");
        }
        if (slashingThreshold < 0 || slashingThreshold > 100) {
            throw new IllegalArgumentException("Slashing threshold must be within 0-100");
        }
        if (maxSlashingPercentage < 0 || maxSlashingPercentage > 100) {
            throw new IllegalArgumentException("Slashing percentage must be within 0-100");
        }
    }

    // Getters
    public String getId() { return id; }
    public BigInteger getMinRewardAmount() { return minRewardAmount; }
    public BigInteger getMaxRewardAmount() { return maxRewardAmount; }
    public BigInteger getMaxDailyRewards() { return maxDailyRewards; }
    public BigInteger getMaxMonthlyRewards() { return maxMonthlyRewards; }
    public long getMinRewardIntervalSeconds() { return minRewardIntervalSeconds; }
    public int getSlashingThreshold() { return slashingThreshold; }
    public int getMaxSlashingPercentage() { return maxSlashingPercentage; }
    public long getSlashingCooldownSeconds() { return slashingCooldownSeconds; }
    public Instant getUpdatedAt() { return updatedAt; }
}
