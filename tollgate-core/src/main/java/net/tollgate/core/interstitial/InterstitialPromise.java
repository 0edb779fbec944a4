package net.tollgate.core.interstitial;

import net.tollgate.core.model.InterstitialResolution;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 서비스별 1회성 준비 신호. 처음 들어온 resolution만 남고 이후 resolve는 무시된다.
 */
public final class InterstitialPromise {
    private final String serviceId;
    private final Instant createdAt;
    private final CompletableFuture<InterstitialResolution> resolution = new CompletableFuture<>();

    InterstitialPromise(String serviceId, Instant createdAt) {
        this.serviceId = serviceId;
        this.createdAt = createdAt;
    }

    public String serviceId() { return serviceId; }

    public Instant createdAt() { return createdAt; }

    /** @return 이번 호출이 결과를 정했으면 true */
    boolean resolve(InterstitialResolution r) {
        return resolution.complete(r);
    }

    public boolean resolved() {
        return resolution.isDone();
    }

    public Optional<InterstitialResolution> resolution() {
        return Optional.ofNullable(resolution.getNow(null));
    }

    public boolean healthyInstanceFound() {
        return resolution.getNow(null) == InterstitialResolution.HEALTHY_INSTANCE_FOUND;
    }

    /** 읽기 전용 뷰. 외부에서 완료시킬 수 없다. */
    public CompletableFuture<InterstitialResolution> future() {
        return resolution.copy();
    }

    /** 아직 안 정해졌으면 "not-realized" */
    public String describe() {
        return resolution().map(InterstitialResolution::code).orElse(InterstitialGate.NOT_REALIZED);
    }

    @Override public String toString() {
        return "InterstitialPromise{" + serviceId + ", " + describe() + "}";
    }
}
