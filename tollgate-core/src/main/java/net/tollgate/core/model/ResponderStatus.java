package net.tollgate.core.model;

public enum ResponderStatus {
    ACTIVE, DRAINING, TERMINATED;

    public String code() { return name().toLowerCase(); }
}
