package com.abroadhelper.resources.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed robots exclusion policy. Rules are matched longest-path-first; on a tie an allow rule
 * beats a disallow rule.
 */
public class RobotsRules {
    private static final String WILDCARD_AGENT = "*";

    private final List<Group> groups;
    private final List<String> sitemapUrls;

    public RobotsRules(List<Group> groups, List<String> sitemapUrls) {
        this.groups = List.copyOf(groups);
        this.sitemapUrls = List.copyOf(sitemapUrls);
    }

    public static RobotsRules allowAll() {
        return new RobotsRules(List.of(), List.of());
    }

    public static RobotsRules disallowAll() {
        return new RobotsRules(List.of(new Group(List.of(WILDCARD_AGENT), List.of(new Rule("/", false)))), List.of());
    }

    public List<String> getSitemapUrls() {
        return sitemapUrls;
    }

    boolean isAllowed(String pathAndQuery) {
        return isAllowed(WILDCARD_AGENT, pathAndQuery);
    }

    public boolean isAllowed(String userAgent, String pathAndQuery) {
        List<Rule> rules = rulesFor(userAgent);
        if (rules.isEmpty()) {
            return true;
        }

        Rule bestMatch = null;
        int bestMatchLength = -1;
        String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
        for (Rule rule : rules) {
            if (!rule.matches(subject)) {
                continue;
            }
            int length = rule.path().length();
            if (length > bestMatchLength) {
                bestMatch = rule;
                bestMatchLength = length;
            } else if (length == bestMatchLength
                && bestMatch != null
                && rule.allow()
                && !bestMatch.allow()) {
                bestMatch = rule;
            }
        }
        return bestMatch == null || bestMatch.allow();
    }

    /**
     * Rules of every group naming the agent's product token, or of the {@code *} groups when none
     * does.
     */
    List<Rule> rulesFor(String userAgent) {
        String token = productToken(userAgent);
        List<Rule> specific = new ArrayList<>();
        List<Rule> fallback = new ArrayList<>();
        for (Group group : groups) {
            boolean named = false;
            boolean wildcard = false;
            for (String agent : group.agents()) {
                if (WILDCARD_AGENT.equals(agent)) {
                    wildcard = true;
                } else if (!token.isEmpty() && token.contains(agent)) {
                    named = true;
                }
            }
            if (named) {
                specific.addAll(group.rules());
            } else if (wildcard) {
                fallback.addAll(group.rules());
            }
        }
        return specific.isEmpty() ? fallback : specific;
    }

    public static RobotsRules parse(String robotsText) {
        if (robotsText == null || robotsText.isBlank()) {
            return allowAll();
        }

        List<String> sitemaps = new ArrayList<>();
        List<Group> parsedGroups = new ArrayList<>();

        List<String> currentAgents = new ArrayList<>();
        List<Rule> currentRules = new ArrayList<>();
        boolean lastDirectiveWasUserAgent = false;

        String[] lines = robotsText.split("\\R");
        for (String rawLine : lines) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) {
                if (rawLine.trim().isEmpty()) {
                    closeGroup(parsedGroups, currentAgents, currentRules);
                    currentAgents = new ArrayList<>();
                    currentRules = new ArrayList<>();
                    lastDirectiveWasUserAgent = false;
                }
                continue;
            }
            int colonIdx = line.indexOf(':');
            if (colonIdx <= 0) {
                continue;
            }

            String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colonIdx + 1).trim();

            if ("user-agent".equals(key)) {
                if (!lastDirectiveWasUserAgent) {
                    closeGroup(parsedGroups, currentAgents, currentRules);
                    currentAgents = new ArrayList<>();
                    currentRules = new ArrayList<>();
                }
                currentAgents.add(value.toLowerCase(Locale.ROOT));
                lastDirectiveWasUserAgent = true;
                continue;
            }

            lastDirectiveWasUserAgent = false;
            if ("sitemap".equals(key)) {
                if (!value.isBlank()) {
                    sitemaps.add(value);
                }
                continue;
            }

            if (currentAgents.isEmpty()) {
                continue;
            }
            if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
                currentRules.add(new Rule(value, "allow".equals(key)));
            }
        }
        closeGroup(parsedGroups, currentAgents, currentRules);

        return new RobotsRules(parsedGroups, sitemaps);
    }

    private static void closeGroup(List<Group> groups, List<String> agents, List<Rule> rules) {
        if (!agents.isEmpty()) {
            groups.add(new Group(agents, rules));
        }
    }

    private static String productToken(String userAgent) {
        if (userAgent == null) {
            return "";
        }
        String trimmed = userAgent.trim();
        int end = trimmed.length();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '/' || Character.isWhitespace(c)) {
                end = i;
                break;
            }
        }
        return trimmed.substring(0, end).toLowerCase(Locale.ROOT);
    }

    private static String stripComment(String line) {
        int idx = line.indexOf('#');
        return idx >= 0 ? line.substring(0, idx) : line;
    }

    public record Group(List<String> agents, List<Rule> rules) {
        public Group {
            agents = List.copyOf(agents);
            rules = List.copyOf(rules);
        }
    }

    public record Rule(String path, boolean allow) {
        public boolean matches(String testPath) {
            String normalizedPath = path.startsWith("/") ? path : "/" + path;
            if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
                return testPath.startsWith(normalizedPath);
            }
            StringBuilder regex = new StringBuilder("^");
            for (int i = 0; i < normalizedPath.length(); i++) {
                char c = normalizedPath.charAt(i);
                if (c == '*') {
                    regex.append(".*");
                } else if (c == '$') {
                    regex.append("$");
                } else {
                    regex.append(Pattern.quote(Character.toString(c)));
                }
            }
            return Pattern.compile(regex.toString()).matcher(testPath).find();
        }
    }
}
