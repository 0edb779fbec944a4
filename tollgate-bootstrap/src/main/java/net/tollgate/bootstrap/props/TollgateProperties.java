package net.tollgate.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("tollgate")
public class TollgateProperties {
    private String routerId;
    private Blacklist blacklist = new Blacklist();
    private WorkStealing workStealing = new WorkStealing();
    private Scheduler scheduler = new Scheduler();
    private Responder responder = new Responder();
    private Defaults defaults = new Defaults();
    private Catalog catalog = new Catalog();

    public String getRouterId() {
        return routerId;
    }

    public void setRouterId(String routerId) {
        this.routerId = routerId;
    }

    public Blacklist getBlacklist() {
        return blacklist;
    }

    public void setBlacklist(Blacklist blacklist) {
        this.blacklist = blacklist;
    }

    public WorkStealing getWorkStealing() {
        return workStealing;
    }

    public void setWorkStealing(WorkStealing workStealing) {
        this.workStealing = workStealing;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Responder getResponder() {
        return responder;
    }

    public void setResponder(Responder responder) {
        this.responder = responder;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Blacklist {
        private long backoffBaseTimeMs = 10000;
        private long maxBlacklistTimeMs = 300000;
        private boolean allowInUse = false;

        public long getBackoffBaseTimeMs() {
            return backoffBaseTimeMs;
        }

        public void setBackoffBaseTimeMs(long backoffBaseTimeMs) {
            this.backoffBaseTimeMs = backoffBaseTimeMs;
        }

        public long getMaxBlacklistTimeMs() {
            return maxBlacklistTimeMs;
        }

        public void setMaxBlacklistTimeMs(long maxBlacklistTimeMs) {
            this.maxBlacklistTimeMs = maxBlacklistTimeMs;
        }

        public boolean isAllowInUse() {
            return allowInUse;
        }

        public void setAllowInUse(boolean allowInUse) {
            this.allowInUse = allowInUse;
        }
    }

    public static class WorkStealing {
        private long offerHelpIntervalMs = 100;
        private long reserveTimeoutMs = 1000;

        public long getOfferHelpIntervalMs() {
            return offerHelpIntervalMs;
        }

        public void setOfferHelpIntervalMs(long offerHelpIntervalMs) {
            this.offerHelpIntervalMs = offerHelpIntervalMs;
        }

        public long getReserveTimeoutMs() {
            return reserveTimeoutMs;
        }

        public void setReserveTimeoutMs(long reserveTimeoutMs) {
            this.reserveTimeoutMs = reserveTimeoutMs;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long syncerIntervalSecs = 5;
        private long maintenanceDelayMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getSyncerIntervalSecs() {
            return syncerIntervalSecs;
        }

        public void setSyncerIntervalSecs(long syncerIntervalSecs) {
            this.syncerIntervalSecs = syncerIntervalSecs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }
    }

    public static class Responder {
        private int mailboxCapacity = 1024;
        private long queryTimeoutMs = 10000;
        private long blacklistTimeoutMs = 30000;

        public int getMailboxCapacity() {
            return mailboxCapacity;
        }

        public void setMailboxCapacity(int mailboxCapacity) {
            this.mailboxCapacity = mailboxCapacity;
        }

        public long getQueryTimeoutMs() {
            return queryTimeoutMs;
        }

        public void setQueryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
        }

        public long getBlacklistTimeoutMs() {
            return blacklistTimeoutMs;
        }

        public void setBlacklistTimeoutMs(long blacklistTimeoutMs) {
            this.blacklistTimeoutMs = blacklistTimeoutMs;
        }
    }

    public static class Defaults {
        private int interstitialSecs = 0;
        private int maxQueueLength = 100;
        private int concurrencyLevel = 1;

        public int getInterstitialSecs() {
            return interstitialSecs;
        }

        public void setInterstitialSecs(int interstitialSecs) {
            this.interstitialSecs = interstitialSecs;
        }

        public int getMaxQueueLength() {
            return maxQueueLength;
        }

        public void setMaxQueueLength(int maxQueueLength) {
            this.maxQueueLength = maxQueueLength;
        }

        public int getConcurrencyLevel() {
            return concurrencyLevel;
        }

        public void setConcurrencyLevel(int concurrencyLevel) {
            this.concurrencyLevel = concurrencyLevel;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ServiceDef> services = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ServiceDef> getServices() {
            return services;
        }

        public void setServices(List<ServiceDef> services) {
            this.services = services;
        }
    }

    /** 값이 없는 항목은 defaults를 따른다 */
    public static class ServiceDef {
        private String serviceId;
        private Integer interstitialSecs;
        private Integer maxQueueLength;
        private Integer concurrencyLevel;
        private String distributionScheme = "balanced";

        public String getServiceId() {
            return serviceId;
        }

        public void setServiceId(String serviceId) {
            this.serviceId = serviceId;
        }

        public Integer getInterstitialSecs() {
            return interstitialSecs;
        }

        public void setInterstitialSecs(Integer interstitialSecs) {
            this.interstitialSecs = interstitialSecs;
        }

        public Integer getMaxQueueLength() {
            return maxQueueLength;
        }

        public void setMaxQueueLength(Integer maxQueueLength) {
            this.maxQueueLength = maxQueueLength;
        }

        public Integer getConcurrencyLevel() {
            return concurrencyLevel;
        }

        public void setConcurrencyLevel(Integer concurrencyLevel) {
            this.concurrencyLevel = concurrencyLevel;
        }

        public String getDistributionScheme() {
            return distributionScheme;
        }

        public void setDistributionScheme(String distributionScheme) {
            this.distributionScheme = distributionScheme;
        }

        @Override
        public String toString() {
            return "ServiceDef{" +
                    "serviceId='" + serviceId + '\'' +
                    ", interstitialSecs=" + interstitialSecs +
                    ", maxQueueLength=" + maxQueueLength +
                    ", concurrencyLevel=" + concurrencyLevel +
                    ", distributionScheme='" + distributionScheme + '\'' +
                    '}';
        }
    }
}
