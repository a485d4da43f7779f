package com.siteaudit.scan.robots;

public record RobotsReport(
    String robotsUrl,
    boolean found,
    int statusCode,
    String errorCode,
    RobotsRules rules
) {
    public static RobotsReport missing(String robotsUrl, int statusCode, String errorCode) {
        return new RobotsReport(robotsUrl, false, statusCode, errorCode, RobotsRules.empty());
    }
}
