package com.tarantula.crawl.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class RobotsRules {
  private static final String ANY_AGENT = "*";

  private final Map<String, Group> groups;
  private final List<String> sitemapUrls;

  public RobotsRules(Map<String, Group> groups, List<String> sitemapUrls) {
    this.groups = groups;
    this.sitemapUrls = sitemapUrls;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(Map.of(), List.of());
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public boolean isAllowed(String pathAndQuery, String userAgent) {
    Group group = groupFor(userAgent);
    if (group == null || group.rules().isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : group.rules()) {
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

  public Optional<Duration> crawlDelay(String userAgent) {
    Group group = groupFor(userAgent);
    return group == null ? Optional.empty() : Optional.ofNullable(group.crawlDelay());
  }

  /**
   * Group whose agent token is the longest one contained in the user agent, else the "*" group.
   */
  Group groupFor(String userAgent) {
    String subject = userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
    Group best = null;
    int bestLength = -1;
    for (Map.Entry<String, Group> entry : groups.entrySet()) {
      String agent = entry.getKey();
      if (ANY_AGENT.equals(agent) || !subject.contains(agent)) {
        continue;
      }
      if (agent.length() > bestLength) {
        best = entry.getValue();
        bestLength = agent.length();
      }
    }
    return best != null ? best : groups.get(ANY_AGENT);
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    List<String> sitemaps = new ArrayList<>();
    Map<String, GroupBuilder> builders = new LinkedHashMap<>();
    List<GroupBuilder> current = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
      String line = stripComment(rawLine).trim();
      int colonIdx = line.indexOf(':');
      if (line.isEmpty() || colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          current.clear();
        }
        String agent = value.toLowerCase(Locale.ROOT);
        if (!agent.isEmpty()) {
          current.add(builders.computeIfAbsent(agent, ignored -> new GroupBuilder()));
        }
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

      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        Rule rule = new Rule(value, "allow".equals(key));
        current.forEach(builder -> builder.rules.add(rule));
      } else if ("crawl-delay".equals(key)) {
        Duration delay = parseDelay(value);
        if (delay != null) {
          current.forEach(builder -> builder.crawlDelay = delay);
        }
      }
    }

    Map<String, Group> groups = new LinkedHashMap<>();
    builders.forEach((agent, builder) -> groups.put(agent, builder.build()));
    return new RobotsRules(groups, List.copyOf(sitemaps));
  }

  private static Duration parseDelay(String value) {
    try {
      double seconds = Double.parseDouble(value);
      if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
        return null;
      }
      return Duration.ofMillis(Math.round(seconds * 1000));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  private static final class GroupBuilder {
    private final List<Rule> rules = new ArrayList<>();
    private Duration crawlDelay;

    Group build() {
      return new Group(List.copyOf(rules), crawlDelay);
    }
  }

  public record Group(List<Rule> rules, Duration crawlDelay) {
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") || path.startsWith("*") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$' && i == normalizedPath.length() - 1) {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
