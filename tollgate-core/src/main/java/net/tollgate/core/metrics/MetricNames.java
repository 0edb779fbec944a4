package net.tollgate.core.metrics;

import java.util.StringJoiner;

/**
 * 메트릭 이름 규칙.
 * services.&lt;service-id&gt;.counters.slots-available, tollgate.interstitial.counters.promise.total 등.
 */
public final class MetricNames {
    private MetricNames() { }

    public static String serviceCounter(String serviceId, String... path) {
        return join("services", serviceId, "counters", path);
    }

    public static String serviceMeter(String serviceId, String... path) {
        return join("services", serviceId, "meters", path);
    }

    public static String serviceTimer(String serviceId, String... path) {
        return join("services", serviceId, "timers", path);
    }

    public static String routerCounter(String classifier, String... path) {
        return join("tollgate", classifier, "counters", path);
    }

    public static String routerMeter(String classifier, String... path) {
        return join("tollgate", classifier, "meters", path);
    }

    public static String routerTimer(String classifier, String... path) {
        return join("tollgate", classifier, "timers", path);
    }

    private static String join(String root, String id, String kind, String... path) {
        var j = new StringJoiner(".");
        j.add(root).add(id).add(kind);
        for (String p : path) j.add(p);
        return j.toString();
    }
}
