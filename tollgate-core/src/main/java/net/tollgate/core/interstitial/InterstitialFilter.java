package net.tollgate.core.interstitial;

import net.tollgate.core.description.ServiceDescriptionLookup;
import net.tollgate.core.metrics.MetricNames;
import net.tollgate.core.spi.MetricsSink;

import java.util.Map;

/**
 * 서비스가 준비되기 전 HTML 요청을 대기 페이지로 돌린다.
 * 대기 페이지는 bypass 파라미터를 마지막에 붙여 원래 요청을 다시 보낸다.
 */
public final class InterstitialFilter {
    public static final String BYPASS_PARAM = "x-tollgate-bypass-interstitial=1";
    public static final String INTERSTITIAL_HEADER = "x-tollgate-interstitial";
    public static final String INTERSTITIAL_PATH_PREFIX = "/tollgate-interstitial";

    private final InterstitialGate gate;
    private final ServiceDescriptionLookup descriptions;
    private final MetricsSink metrics;

    public InterstitialFilter(InterstitialGate gate, ServiceDescriptionLookup descriptions, MetricsSink metrics) {
        this.gate = gate;
        this.descriptions = descriptions;
        this.metrics = metrics;
    }

    public InterstitialDecision decide(InterstitialRequest request) {
        String query = request.query();
        // bypass 파라미터는 항상 마지막이어야 한다
        boolean bypass = query != null && query.endsWith(BYPASS_PARAM);
        if (bypass) {
            return new InterstitialDecision.Proceed(stripBypass(query));
        }
        int interstitialSecs = descriptions.describe(request.serviceId()).interstitialSecs();
        if (request.onTheFly()
                || interstitialSecs == 0
                || request.accept() == null || !request.accept().contains("text/html")
                || !gate.initialized()
                || gate.ensure(request.serviceId(), interstitialSecs).healthyInstanceFound()) {
            return new InterstitialDecision.Proceed(query);
        }

        String location = INTERSTITIAL_PATH_PREFIX + request.uri() + (query == null || query.isBlank() ? "" : "?" + query);
        metrics.incrementCounter(MetricNames.serviceCounter(request.serviceId(), "request-counts", "interstitial"));
        metrics.markMeter(MetricNames.routerMeter("interstitial", "redirect"));
        return new InterstitialDecision.Redirect(location, Map.of("location", location, INTERSTITIAL_HEADER, "true"));
    }

    /** 대기 페이지가 재시도할 URL. bypass 파라미터가 마지막에 붙는다. */
    public static String interstitialTarget(String path, String query) {
        StringBuilder sb = new StringBuilder();
        if (path == null || !path.startsWith("/")) sb.append('/');
        if (path != null) sb.append(path);
        sb.append('?');
        if (query != null && !query.isBlank()) sb.append(query).append('&');
        return sb.append(BYPASS_PARAM).toString();
    }

    static String stripBypass(String query) {
        // 앞의 '&'까지 제거
        int end = Math.max(0, query.length() - BYPASS_PARAM.length() - 1);
        return query.substring(0, end);
    }
}
