package net.tollgate.core.model;

public enum OfferResponse {
    ACCEPTED, DECLINED, TIMEOUT;

    public String code() { return name().toLowerCase(); }
}
