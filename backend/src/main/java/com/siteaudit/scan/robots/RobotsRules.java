package com.siteaudit.scan.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt for the wildcard user agent. The scanner never enforces these rules;
 * they are reported and their sitemap hints are reused.
 */
public class RobotsRules {
    private final List<Rule> rules;
    private final List<String> sitemapUrls;
    private final boolean wellFormed;

    public RobotsRules(List<Rule> rules, List<String> sitemapUrls, boolean wellFormed) {
        this.rules = List.copyOf(rules);
        this.sitemapUrls = List.copyOf(sitemapUrls);
        this.wellFormed = wellFormed;
    }

    public static RobotsRules empty() {
        return new RobotsRules(List.of(), List.of(), false);
    }

    public List<String> getSitemapUrls() {
        return sitemapUrls;
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * True when the file declared at least one user-agent group.
     */
    public boolean isWellFormed() {
        return wellFormed;
    }

    public boolean disallowsRoot() {
        return !isAllowed("/");
    }

    public boolean isAllowed(String pathAndQuery) {
        String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
        Rule winner = null;
        for (Rule rule : rules) {
            if (!rule.matches(subject)) {
                continue;
            }
            if (winner == null
                || rule.path().length() > winner.path().length()
                || (rule.path().length() == winner.path().length() && rule.allow() && !winner.allow())) {
                winner = rule;
            }
        }
        return winner == null || winner.allow();
    }

    public static RobotsRules parse(String robotsText) {
        if (robotsText == null || robotsText.isBlank()) {
            return empty();
        }

        List<String> sitemaps = new ArrayList<>();
        List<Rule> wildcardRules = new ArrayList<>();
        boolean sawUserAgent = false;
        boolean inWildcardGroup = false;
        boolean previousWasUserAgent = false;

        for (String rawLine : robotsText.split("\\R")) {
            int hash = rawLine.indexOf('#');
            String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (key) {
                case "user-agent" -> {
                    sawUserAgent = true;
                    boolean wildcard = "*".equals(value);
                    inWildcardGroup = previousWasUserAgent ? inWildcardGroup || wildcard : wildcard;
                    previousWasUserAgent = true;
                }
                case "sitemap" -> {
                    previousWasUserAgent = false;
                    if (!value.isBlank()) {
                        sitemaps.add(value);
                    }
                }
                case "allow", "disallow" -> {
                    previousWasUserAgent = false;
                    if (inWildcardGroup && !value.isBlank()) {
                        wildcardRules.add(new Rule(value, "allow".equals(key)));
                    }
                }
                default -> previousWasUserAgent = false;
            }
        }
        return new RobotsRules(wildcardRules, sitemaps, sawUserAgent);
    }

    public record Rule(String path, boolean allow) {
        public boolean matches(String testPath) {
            String normalized = path.startsWith("/") ? path : "/" + path;
            if (normalized.indexOf('*') < 0 && normalized.indexOf('$') < 0) {
                return testPath.startsWith(normalized);
            }
            StringBuilder regex = new StringBuilder("^");
            for (char c : normalized.toCharArray()) {
                if (c == '*') {
                    regex.append(".*");
                } else if (c == '$') {
                    regex.append('$');
                } else {
                    regex.append(Pattern.quote(String.valueOf(c)));
                }
            }
            return Pattern.compile(regex.toString()).matcher(testPath).find();
        }
    }
}
