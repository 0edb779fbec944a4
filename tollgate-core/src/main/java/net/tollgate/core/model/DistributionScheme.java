package net.tollgate.core.model;

public enum DistributionScheme {
    BALANCED, SIMPLE;

    public static DistributionScheme from(String s) {
        if (s == null) return BALANCED;
        try { return DistributionScheme.valueOf(s.trim().toUpperCase()); } catch (IllegalArgumentException e) { return BALANCED; }
    }
    public String code() { return name().toLowerCase(); }
}
