package com.example.nl2cmd.service;

import com.example.nl2cmd.model.ArbitrationDecision;
import com.example.nl2cmd.model.CommandChain;
import com.example.nl2cmd.model.CommandSegment;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.model.ResolutionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits compound requests into ordered segments, carries a freshly created folder into later
 * segments that refer to it and chains the segment commands.
 */
@Slf4j
@Service
public class MultiCommandOrchestrator {

    static final Set<String> ACTION_VERBS = Set.of(
            "create", "make", "delete", "remove", "copy", "move",
            "list", "show", "find", "kill", "stop", "start", "run",
            "open", "close", "install", "update", "rename", "change"
    );

    private static final Pattern CONJUNCTION = Pattern.compile("\\b(?:and then|then|and|also|after that|next)\\b");

    private static final List<Pattern> SEPARATORS = List.of(
            Pattern.compile("[,;]\\s+"),
            Pattern.compile("\\s+and\\s+then\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+then\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+also\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+after\\s+that\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+next\\s+", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern DIRECTORY_CREATION = Pattern.compile(
            "\\b(?:mkdir|md)\\s+(?:-p\\s+)?([^\\s&|;]+)", Pattern.CASE_INSENSITIVE);

    private static final String REFERENCE =
            "(?:inside\\s+(?:the\\s+|that\\s+)?folder|in\\s+(?:the\\s+|that\\s+)?folder|inside\\s+it|inside\\s+there|in\\s+it)\\b";

    private static final Pattern REFERENCE_PHRASE = Pattern.compile("\\b" + REFERENCE, Pattern.CASE_INSENSITIVE);

    private static final Pattern NAMED_FILE_WITH_REFERENCE = Pattern.compile(
            "(file\\s+(?:named?|called)\\s+)(\\S+)(\\s+" + REFERENCE + ")", Pattern.CASE_INSENSITIVE);

    private final ResolutionArbitrator arbitrator;

    public MultiCommandOrchestrator(ResolutionArbitrator arbitrator) {
        this.arbitrator = arbitrator;
    }

    /** At least two action verbs and at least one conjunction marker. */
    public boolean isMultiCommand(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        int actions = 0;
        for (String token : lower.trim().split("\\s+")) {
            if (ACTION_VERBS.contains(token)) {
                actions++;
            }
        }
        return actions >= 2 && CONJUNCTION.matcher(lower).find();
    }

    /** Splits on the first separator that yields more than one non-empty segment. */
    public List<String> split(String query) {
        for (Pattern separator : SEPARATORS) {
            List<String> parts = new ArrayList<>();
            for (String part : separator.split(query)) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    parts.add(trimmed);
                }
            }
            if (parts.size() > 1) {
                return List.copyOf(parts);
            }
        }
        return List.of(query.trim());
    }

    /**
     * Rewrites "file named X inside it" style references so that X lives in the folder created by
     * the most recent directory-creation command among {@code previousCommands}.
     */
    public String resolveContext(String segment, List<String> previousCommands, OsFamily os) {
        if (previousCommands == null || previousCommands.isEmpty()) {
            return segment;
        }
        String folder = lastCreatedDirectory(previousCommands);
        if (folder == null || !REFERENCE_PHRASE.matcher(segment).find()) {
            return segment;
        }

        Matcher m = NAMED_FILE_WITH_REFERENCE.matcher(segment);
        if (!m.find()) {
            return segment;
        }
        String replacement = m.group(1) + folder + os.pathSeparator() + m.group(2) + m.group(3);
        return segment.substring(0, m.start()) + replacement + segment.substring(m.end());
    }

    public CommandChain process(String query, OsFamily os) {
        return process(query, os, null);
    }

    public CommandChain process(String query, OsFamily os, ResolutionMethod forcedMethod) {
        if (!isMultiCommand(query)) {
            ArbitrationDecision decision = arbitrator.resolve(query, os, forcedMethod);
            return new CommandChain(query, false, List.of(new CommandSegment(1, query, decision)));
        }

        List<String> parts = split(query);
        List<CommandSegment> segments = new ArrayList<>();
        List<String> resolvedCommands = new ArrayList<>();
        int order = 1;
        for (String part : parts) {
            String text = order > 1 ? resolveContext(part, resolvedCommands, os) : part;
            if (!text.equals(part)) {
                log.debug("Segment {} rewritten with context: '{}' -> '{}'", order, part, text);
            }
            ArbitrationDecision decision = arbitrator.resolve(text, os, forcedMethod);
            if (decision.isSuccess()) {
                resolvedCommands.add(decision.getCommand());
            }
            segments.add(new CommandSegment(order++, text, decision));
        }

        CommandChain chain = new CommandChain(query, true, segments);
        log.debug("Multi-command '{}' -> {} segments, success={}", query, segments.size(), chain.isSuccess());
        return chain;
    }

    private static String lastCreatedDirectory(List<String> previousCommands) {
        for (int i = previousCommands.size() - 1; i >= 0; i--) {
            String command = previousCommands.get(i);
            if (command == null) {
                continue;
            }
            Matcher m = DIRECTORY_CREATION.matcher(command);
            if (m.find()) {
                return stripQuotes(m.group(1));
            }
        }
        return null;
    }

    private static String stripQuotes(String value) {
        String out = value;
        if (out.length() > 1 && (out.startsWith("\"") || out.startsWith("'"))) {
            out = out.substring(1);
        }
        if (out.length() > 1 && (out.endsWith("\"") || out.endsWith("'"))) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
