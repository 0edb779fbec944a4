package net.tollgate.core.responder;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.description.ServiceDescriptionLookup;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.MetricsSink;

import java.util.Comparator;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * 서비스별 Responder 생성기. 모든 Responder가 공유하는 의존성을 들고 있다.
 */
public final class ResponderFactory {
    private final RouterSettings settings;
    private final ServiceDescriptionLookup descriptions;
    private final Clock clock;
    private final MetricsSink metrics;
    private final InstanceOwnership ownership;
    private final BlacklistPolicy blacklistPolicy;
    private final Comparator<PendingRequest> pendingOrder;
    private final Executor executor;

    public ResponderFactory(RouterSettings settings,
                            ServiceDescriptionLookup descriptions,
                            Clock clock,
                            MetricsSink metrics,
                            InstanceOwnership ownership,
                            Comparator<PendingRequest> pendingOrder,
                            Executor executor) {
        this.settings = settings;
        this.descriptions = descriptions;
        this.clock = clock;
        this.metrics = metrics;
        this.ownership = ownership;
        this.blacklistPolicy = BlacklistPolicy.exponential(settings.blacklistBackoffBaseTime(), settings.maxBlacklistTime());
        this.pendingOrder = pendingOrder;
        this.executor = executor;
    }

    public RouterSettings settings() { return settings; }

    public Clock clock() { return clock; }

    /**
     * @param onTerminated  액터가 종료된 뒤 한 번 호출
     * @param onUndelivered 종료 시점에 처리되지 못한 메시지마다 호출
     */
    public Responder create(String serviceId, Consumer<Responder> onTerminated, Consumer<ResponderMessage> onUndelivered) {
        return new Responder(serviceId, settings, descriptions, clock, metrics, ownership, blacklistPolicy,
                pendingOrder, executor, onTerminated, onUndelivered);
    }
}
