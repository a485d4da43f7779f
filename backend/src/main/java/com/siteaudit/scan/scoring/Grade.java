package com.siteaudit.scan.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Grade {
    A_PLUS("A+", 90, "Exceptional! Your website meets the highest standards across all pillars."),
    A("A", 85, "Excellent! Your website performs very well with only minor improvements needed."),
    A_MINUS("A-", 80, "Very Good! Your website is well-optimized with a few areas for enhancement."),
    B_PLUS("B+", 75, "Good! Your website performs well but has room for improvement."),
    B("B", 70, "Above Average. Your website meets many standards but needs attention in key areas."),
    B_MINUS("B-", 65, "Satisfactory. Your website has a solid foundation with several improvement opportunities."),
    C_PLUS("C+", 60, "Fair. Your website meets basic requirements but needs significant improvements."),
    C("C", 55, "Average. Your website has notable issues that should be addressed."),
    C_MINUS("C-", 50, "Below Average. Your website needs considerable work across multiple areas."),
    D_PLUS("D+", 45, "Poor. Your website has serious issues affecting user experience and compliance."),
    D("D", 40, "Very Poor. Your website requires major improvements to meet basic standards."),
    F("F", 0, "Critical. Your website has severe issues requiring immediate attention.");

    private final String label;
    private final int minScore;
    private final String explanation;

    Grade(String label, int minScore, String explanation) {
        this.label = label;
        this.minScore = minScore;
        this.explanation = explanation;
    }

    /**
     * Bands are declared highest first, so the first band the score reaches wins.
     */
    public static Grade forScore(int score) {
        for (Grade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }
        return F;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int minScore() {
        return minScore;
    }

    public String explanation() {
        return explanation;
    }
}
