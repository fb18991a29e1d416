package com.alcance.backend.domain.enums;

public enum LeadGrade {
    A(80),  // Prioridade máxima
    B(60),
    C(40),
    D(0);   // Abaixo de 40

    private final double minScore;

    LeadGrade(double minScore) {
        this.minScore = minScore;
    }

    public double getMinScore() {
        return minScore;
    }

    /**
     * Faixa derivada somente do score composto (função pura).
     */
    public static LeadGrade fromScore(double score) {
        for (LeadGrade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }
        return D;
    }
}
