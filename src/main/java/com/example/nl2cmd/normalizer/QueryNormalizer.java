package com.example.nl2cmd.normalizer;

import com.example.nl2cmd.model.ParameterNames;
import com.example.nl2cmd.model.ProcessedQuery;
import com.example.nl2cmd.util.PatternRule;
import com.example.nl2cmd.util.PatternRules;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenizes a raw query into categorized keywords and extracts literal parameters.
 *
 * <p>Keyword derivation works on the stripped, lowercased text; parameter extraction works on the
 * original text so that quoted values, paths and dotted names survive.
 */
@Component
public class QueryNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from",
            "has", "he", "in", "is", "it", "its", "of", "on", "that", "the",
            "to", "was", "will", "with", "i", "you", "we", "they", "can",
            "could", "would", "should", "do", "does", "did", "have", "had"
    );

    static final Set<String> ACTION_KEYWORDS = Set.of(
            "list", "show", "get", "find", "search", "display", "view",
            "kill", "stop", "terminate", "end", "close",
            "start", "run", "execute", "launch", "open",
            "delete", "remove", "erase", "clear", "clean",
            "copy", "move", "rename", "change",
            "create", "make", "add", "new",
            "install", "update", "upgrade", "download",
            "check", "verify", "test", "ping",
            "shutdown", "reboot", "restart", "logout"
    );

    static final Set<String> TARGET_KEYWORDS = Set.of(
            "file", "files", "directory", "folder", "path",
            "process", "processes", "task", "service", "services",
            "user", "users", "group", "groups",
            "network", "ip", "port", "ports", "connection",
            "disk", "memory", "cpu", "system", "info", "information",
            "package", "program", "application", "app",
            "firewall", "security", "permission", "permissions",
            "temp", "temporary", "cache", "log", "logs",
            "hidden", "all", "recursive"
    );

    // Ordered pattern families; within a family the first successful pattern wins.
    private static final Map<String, List<PatternRule<String>>> PARAMETER_FAMILIES = new LinkedHashMap<>();

    static {
        PARAMETER_FAMILIES.put(ParameterNames.FILENAME, List.of(
                PatternRule.group(
                        "(?<![/.@\\w])([\\w-]+\\.[A-Za-z][\\w]*)\\b(?![/@\\w]|\\.\\w)", 1)
        ));
        PARAMETER_FAMILIES.put(ParameterNames.URL, List.of(
                PatternRule.group("(https?://[\\w.-]+(?:/[\\w.-]*)*)", 1)
        ));
        PARAMETER_FAMILIES.put(ParameterNames.IP, List.of(
                PatternRule.group("\\b((?:\\d{1,3}\\.){3}\\d{1,3})\\b", 1)
        ));
        PARAMETER_FAMILIES.put(ParameterNames.NUMBER, List.of(
                PatternRule.group("\\b(\\d+)\\b", 1)
        ));
        PARAMETER_FAMILIES.put(ParameterNames.PORT, List.of(
                PatternRule.group1("\\bport\\s+(\\d+)"),
                PatternRule.group1(":(\\d{2,5})\\b")
        ));
        PARAMETER_FAMILIES.put(ParameterNames.PATH, List.of(
                PatternRule.group1("\\b(?:in|to|at|from)\\s+[\"']([A-Za-z]:[\\\\/][^\"']+)[\"']"),
                PatternRule.group1("\\b(?:in|to|at|from)\\s+[\"']([/~][^\"']*)[\"']"),
                PatternRule.group1("\\b(?:in|to|at|from)\\s+([A-Za-z]:[\\\\/]\\S*)"),
                PatternRule.group1("\\b(?:in|to|at|from)\\s+([/~]\\S*)")
        ));
        PARAMETER_FAMILIES.put(ParameterNames.EXTENSION, List.of(
                PatternRule.group1("\\.(\\w+)\\s+files?\\b"),
                PatternRule.group1("\\bfiles?\\s+with\\s+\\.(\\w+)"),
                PatternRule.group1("\\bfiles?\\s+with\\s+(\\w+)\\s+extension")
        ));
        PARAMETER_FAMILIES.put(ParameterNames.CONTENT, List.of(
                PatternRule.group1("\\bwith\\s+content\\s+[\"'](.+?)[\"']"),
                PatternRule.group1("\\bcontaining\\s+[\"'](.+?)[\"']"),
                PatternRule.group1("\\btext\\s+[\"'](.+?)[\"']")
        ));
    }

    public ProcessedQuery normalize(String text) {
        if (text == null || text.isBlank()) {
            return ProcessedQuery.invalid(text);
        }

        String normalized = normalizeText(text);
        ProcessedQuery.ProcessedQueryBuilder builder = ProcessedQuery.builder()
                .original(text)
                .normalized(normalized);

        for (String keyword : keywords(normalized)) {
            builder.keyword(keyword);
            if (ACTION_KEYWORDS.contains(keyword)) {
                builder.action(keyword);
            } else if (TARGET_KEYWORDS.contains(keyword)) {
                builder.target(keyword);
            } else {
                builder.modifier(keyword);
            }
        }

        builder.parameters(PatternRules.extractAll(PARAMETER_FAMILIES, text));
        return builder.build();
    }

    /** Lowercase, strip punctuation except hyphens, collapse whitespace. Idempotent. */
    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String s = text.toLowerCase(Locale.ROOT).trim();
        s = NON_WORD.matcher(s).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    private static List<String> keywords(String normalized) {
        List<String> out = new ArrayList<>();
        if (normalized.isEmpty()) {
            return out;
        }
        for (String token : normalized.split(" ")) {
            if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }
}
