package com.alcance.backend.domain.enums;

public enum LeadCategory {
    HEALTH(100),
    PARENTING(80),
    BEAUTY(70),
    LIFESTYLE(60),
    FOOD(50),
    LIVING(40),
    TRAVEL(30),
    IT(20),
    FINANCE(20),
    OTHER(30);

    // Relevância base da categoria para o nosso público
    private final int baseRelevance;

    LeadCategory(int baseRelevance) {
        this.baseRelevance = baseRelevance;
    }

    public int getBaseRelevance() {
        return baseRelevance;
    }
}
