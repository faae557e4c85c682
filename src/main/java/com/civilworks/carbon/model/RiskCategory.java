package com.civilworks.carbon.model;

public enum RiskCategory {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Tier for an estimate in tonnes of CO2e. */
    public static RiskCategory forCo2eTonnes(double co2eTonnes) {
        if (co2eTonnes >= 1000) return CRITICAL;
        if (co2eTonnes >= 250) return HIGH;
        if (co2eTonnes >= 50) return MEDIUM;
        return LOW;
    }
}
