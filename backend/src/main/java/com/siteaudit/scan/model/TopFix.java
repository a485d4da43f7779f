package com.siteaudit.scan.model;

public record TopFix(
    String title,
    String description,
    Impact impact,
    Impact effort,
    String pillar,
    double priority
) {
}
