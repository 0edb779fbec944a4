package net.tollgate.core.model;

public enum BlacklistResult {
    BLACKLISTED, IN_USE, NO_SUCH_INSTANCE;

    public String code() { return name().toLowerCase().replace('_', '-'); }
}
