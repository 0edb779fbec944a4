package net.tollgate.core.config;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * 라우터 코어가 인식하는 설정값. 불변; {@link #builder()}로 만든다.
 */
public final class RouterSettings {
    private final String routerId;
    private final Duration blacklistBackoffBaseTime;
    private final Duration maxBlacklistTime;
    private final boolean blacklistInUseAllowed;
    private final Duration offerHelpInterval;
    private final Duration reserveTimeout;
    private final Duration schedulerSyncerInterval;
    private final int mailboxCapacity;
    private final Duration queryTimeout;
    private final Duration blacklistTimeout;
    private final int defaultInterstitialSecs;
    private final int defaultMaxQueueLength;
    private final int defaultConcurrencyLevel;

    private RouterSettings(Builder b) {
        this.routerId = b.routerId;
        this.blacklistBackoffBaseTime = b.blacklistBackoffBaseTime;
        this.maxBlacklistTime = b.maxBlacklistTime;
        this.blacklistInUseAllowed = b.blacklistInUseAllowed;
        this.offerHelpInterval = b.offerHelpInterval;
        this.reserveTimeout = b.reserveTimeout;
        this.schedulerSyncerInterval = b.schedulerSyncerInterval;
        this.mailboxCapacity = b.mailboxCapacity;
        this.queryTimeout = b.queryTimeout;
        this.blacklistTimeout = b.blacklistTimeout;
        this.defaultInterstitialSecs = b.defaultInterstitialSecs;
        this.defaultMaxQueueLength = b.defaultMaxQueueLength;
        this.defaultConcurrencyLevel = b.defaultConcurrencyLevel;
    }

    public static Builder builder() { return new Builder(); }

    public static RouterSettings defaults() { return builder().build(); }

    public String routerId() { return routerId; }
    public Duration blacklistBackoffBaseTime() { return blacklistBackoffBaseTime; }
    public Duration maxBlacklistTime() { return maxBlacklistTime; }
    public boolean blacklistInUseAllowed() { return blacklistInUseAllowed; }
    public Duration offerHelpInterval() { return offerHelpInterval; }
    public Duration reserveTimeout() { return reserveTimeout; }
    public Duration schedulerSyncerInterval() { return schedulerSyncerInterval; }
    public int mailboxCapacity() { return mailboxCapacity; }
    public Duration queryTimeout() { return queryTimeout; }
    public Duration blacklistTimeout() { return blacklistTimeout; }
    public int defaultInterstitialSecs() { return defaultInterstitialSecs; }
    public int defaultMaxQueueLength() { return defaultMaxQueueLength; }
    public int defaultConcurrencyLevel() { return defaultConcurrencyLevel; }

    public Builder toBuilder() {
        return new Builder()
                .routerId(routerId)
                .blacklistBackoffBaseTime(blacklistBackoffBaseTime)
                .maxBlacklistTime(maxBlacklistTime)
                .blacklistInUseAllowed(blacklistInUseAllowed)
                .offerHelpInterval(offerHelpInterval)
                .reserveTimeout(reserveTimeout)
                .schedulerSyncerInterval(schedulerSyncerInterval)
                .mailboxCapacity(mailboxCapacity)
                .queryTimeout(queryTimeout)
                .blacklistTimeout(blacklistTimeout)
                .defaultInterstitialSecs(defaultInterstitialSecs)
                .defaultMaxQueueLength(defaultMaxQueueLength)
                .defaultConcurrencyLevel(defaultConcurrencyLevel);
    }

    @Override public String toString() {
        return "RouterSettings{" +
                "routerId='" + routerId + '\'' +
                ", blacklistBackoffBaseTime=" + blacklistBackoffBaseTime +
                ", maxBlacklistTime=" + maxBlacklistTime +
                ", blacklistInUseAllowed=" + blacklistInUseAllowed +
                ", offerHelpInterval=" + offerHelpInterval +
                ", reserveTimeout=" + reserveTimeout +
                ", schedulerSyncerInterval=" + schedulerSyncerInterval +
                ", mailboxCapacity=" + mailboxCapacity +
                ", queryTimeout=" + queryTimeout +
                ", blacklistTimeout=" + blacklistTimeout +
                '}';
    }

    public static final class Builder {
        private String routerId = "router-" + UUID.randomUUID();
        private Duration blacklistBackoffBaseTime = Duration.ofSeconds(10);
        private Duration maxBlacklistTime = Duration.ofMinutes(5);
        private boolean blacklistInUseAllowed = false;
        private Duration offerHelpInterval = Duration.ofMillis(100);
        private Duration reserveTimeout = Duration.ofMillis(1000);
        private Duration schedulerSyncerInterval = Duration.ofSeconds(5);
        private int mailboxCapacity = 1024;
        private Duration queryTimeout = Duration.ofSeconds(10);
        private Duration blacklistTimeout = Duration.ofSeconds(30);
        private int defaultInterstitialSecs = 0;
        private int defaultMaxQueueLength = 100;
        private int defaultConcurrencyLevel = 1;

        private Builder() { }

        public Builder routerId(String routerId) { this.routerId = Objects.requireNonNull(routerId); return this; }
        public Builder blacklistBackoffBaseTime(Duration d) { this.blacklistBackoffBaseTime = positive(d, "blacklistBackoffBaseTime"); return this; }
        public Builder maxBlacklistTime(Duration d) { this.maxBlacklistTime = positive(d, "maxBlacklistTime"); return this; }
        public Builder blacklistInUseAllowed(boolean allowed) { this.blacklistInUseAllowed = allowed; return this; }
        public Builder offerHelpInterval(Duration d) { this.offerHelpInterval = positive(d, "offerHelpInterval"); return this; }
        public Builder reserveTimeout(Duration d) { this.reserveTimeout = positive(d, "reserveTimeout"); return this; }
        public Builder schedulerSyncerInterval(Duration d) { this.schedulerSyncerInterval = positive(d, "schedulerSyncerInterval"); return this; }
        public Builder queryTimeout(Duration d) { this.queryTimeout = positive(d, "queryTimeout"); return this; }
        public Builder blacklistTimeout(Duration d) { this.blacklistTimeout = positive(d, "blacklistTimeout"); return this; }

        public Builder mailboxCapacity(int capacity) {
            if (capacity < 1) throw new IllegalArgumentException("mailboxCapacity must be >= 1");
            this.mailboxCapacity = capacity;
            return this;
        }

        public Builder defaultInterstitialSecs(int secs) {
            if (secs < 0) throw new IllegalArgumentException("defaultInterstitialSecs must be >= 0");
            this.defaultInterstitialSecs = secs;
            return this;
        }

        public Builder defaultMaxQueueLength(int length) {
            if (length < 0) throw new IllegalArgumentException("defaultMaxQueueLength must be >= 0");
            this.defaultMaxQueueLength = length;
            return this;
        }

        public Builder defaultConcurrencyLevel(int level) {
            if (level < 1) throw new IllegalArgumentException("defaultConcurrencyLevel must be >= 1");
            this.defaultConcurrencyLevel = level;
            return this;
        }

        public RouterSettings build() {
            if (maxBlacklistTime.compareTo(blacklistBackoffBaseTime) < 0) {
                throw new IllegalArgumentException("maxBlacklistTime must not be shorter than blacklistBackoffBaseTime");
            }
            return new RouterSettings(this);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be positive");
            return d;
        }
    }
}
