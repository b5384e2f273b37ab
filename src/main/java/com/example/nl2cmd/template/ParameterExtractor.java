package com.example.nl2cmd.template;

import com.example.nl2cmd.model.CommandAnalysis;
import com.example.nl2cmd.model.NestedOperation;
import com.example.nl2cmd.model.ParameterNames;
import com.example.nl2cmd.util.PatternRule;
import com.example.nl2cmd.util.PatternRules;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives intent, action, targets, literal parameters and nested folder/file operations from a
 * raw query. Every table is ordered and the first hit wins.
 */
@Component
public class ParameterExtractor {

    private static final String GIT_ACTION = "git";

    private static final Map<String, List<PatternRule<String>>> GIT_INTENTS = new LinkedHashMap<>();
    private static final Map<String, List<String>> ACTION_VERBS = new LinkedHashMap<>();
    private static final Map<String, List<String>> TARGET_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<PatternRule<String>>> PARAMETERS = new LinkedHashMap<>();
    private static final List<PatternRule<NestedOperation>> NESTED = List.of(
            new PatternRule<>(Pattern.compile(
                    "(?:folder|directory)\\s+(?:named?\\s+|called\\s+)?[\"']?([\\w\\-.]+)[\"']?\\s+"
                            + "(?:with|containing|and)\\s+(?:a\\s+)?file\\s+(?:named?\\s+|called\\s+)?[\"']?([\\w\\-.]+)[\"']?",
                    Pattern.CASE_INSENSITIVE),
                    m -> NestedOperation.folderWithFile(m.group(1), m.group(2))),
            new PatternRule<>(Pattern.compile(
                    "file\\s+(?:named?\\s+|called\\s+)?[\"']?([\\w\\-.]+)[\"']?\\s+(?:in|inside)\\s+"
                            + "(?:folder|directory)\\s+(?:named?\\s+|called\\s+)?[\"']?([\\w\\-.]+)[\"']?",
                    Pattern.CASE_INSENSITIVE),
                    m -> NestedOperation.folderWithFile(m.group(2), m.group(1)))
    );

    static {
        git("git_status", "\\b(git\\s+status|check\\s+git\\s+status|show\\s+git\\s+status|see\\s+git\\s+changes)\\b");
        git("git_init", "\\b(git\\s+init|initialize\\s+git|create\\s+git\\s+repo|start\\s+git)\\b");
        git("git_add_all", "\\b(git\\s+add\\s+all|stage\\s+all|add\\s+everything\\s+to\\s+git|git\\s+add\\s+\\.|add\\s+all\\s+files\\s+to\\s+git)\\b");
        git("git_commit", "\\b(commit\\s+(the\\s+)?changes|git\\s+commit|make\\s+a\\s+commit|save\\s+changes\\s+to\\s+git|commit\\s+all)\\b");
        git("git_push", "\\b(git\\s+push|push\\s+to\\s+github|push\\s+changes|upload\\s+to\\s+github|push\\s+to\\s+remote)\\b");
        git("git_pull", "\\b(git\\s+pull|pull\\s+from\\s+github|pull\\s+changes|get\\s+latest|sync\\s+with\\s+github)\\b");
        git("git_clone", "\\b(git\\s+clone|clone\\s+repo|download\\s+repo|copy\\s+repository)\\b");
        git("git_create_branch", "\\b(create\\s+(a\\s+)?(new\\s+)?branch|make\\s+(a\\s+)?(new\\s+)?branch|add\\s+(a\\s+)?branch|new\\s+branch)\\b");
        git("git_checkout", "\\b(switch\\s+branch|change\\s+branch|checkout\\s+branch|go\\s+to\\s+branch)\\b");
        git("git_list_branches", "\\b(list\\s+branches|show\\s+(all\\s+)?branches|see\\s+branches|git\\s+branch$)");
        git("git_merge", "\\b(merge\\s+branch|git\\s+merge|combine\\s+branches)\\b");
        git("git_log", "\\b(git\\s+log|show\\s+commit\\s+history|view\\s+commit\\s+log|see\\s+git\\s+history)\\b");
        git("git_diff", "\\b(git\\s+diff|show\\s+file\\s+changes|see\\s+differences|what\\s+changed)\\b");
        git("git_stash", "\\b(git\\s+stash|stash\\s+changes|save\\s+work\\s+in\\s+progress)\\b");
        git("git_fetch", "\\b(git\\s+fetch|fetch\\s+from\\s+remote|get\\s+remote\\s+changes)\\b");
        git("git_list_remotes", "\\b(list\\s+remotes|show\\s+remote\\s+repositories|git\\s+remote\\s+-v)");

        ACTION_VERBS.put("create", List.of("create", "make", "new", "add", "generate"));
        ACTION_VERBS.put("delete", List.of("delete", "remove", "del", "rm", "erase"));
        ACTION_VERBS.put("rename", List.of("rename", "move", "mv"));
        ACTION_VERBS.put("copy", List.of("copy", "cp", "duplicate"));
        ACTION_VERBS.put("list", List.of("list", "show", "display", "ls", "dir"));
        ACTION_VERBS.put("find", List.of("find", "search", "locate"));
        ACTION_VERBS.put("kill", List.of("kill", "stop", "terminate", "close"));
        ACTION_VERBS.put("start", List.of("start", "run", "launch", "open"));
        ACTION_VERBS.put("modify", List.of("edit", "modify", "change", "update"));

        TARGET_KEYWORDS.put("file", List.of("file", "document", "doc"));
        TARGET_KEYWORDS.put("folder", List.of("folder", "directory", "dir"));
        TARGET_KEYWORDS.put("process", List.of("process", "program", "application", "app"));
        TARGET_KEYWORDS.put("service", List.of("service", "daemon"));
        TARGET_KEYWORDS.put("user", List.of("user", "account"));

        PARAMETERS.put(ParameterNames.FILENAME, List.of(
                PatternRule.group1("file\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("file\\s+named?\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("file\\s+called\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("file\\s+named?\\s+([\\w\\-.\\\\/]+)"),
                PatternRule.group1("file\\s+called\\s+([\\w\\-.\\\\/]+)"),
                PatternRule.group1("([\\w\\-]+\\.\\w+)\\s+file")
        ));
        PARAMETERS.put(ParameterNames.FOLDERNAME, List.of(
                PatternRule.group1("folder\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("directory\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("folder\\s+named?\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("folder\\s+called\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("(?:folder|directory)\\s+named?\\s+([\\w\\-]+)"),
                PatternRule.group1("(?:folder|directory)\\s+called\\s+([\\w\\-]+)")
        ));
        PARAMETERS.put(ParameterNames.PROCESS, List.of(
                PatternRule.group1("process\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("program\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("application\\s+[\"']([^\"']+)[\"']"),
                PatternRule.group1("(?:kill|stop|close|terminate)\\s+(?:process\\s+)?[\"']?(\\w+)[\"']?(?:\\s+process)?")
        ));
        PARAMETERS.put(ParameterNames.PATH, List.of(
                PatternRule.group1("(?:in|to|at)\\s+[\"']([A-Za-z]:[\\\\/].+?)[\"']"),
                PatternRule.group1("(?:in|to|at)\\s+[\"']([/~].+?)[\"']"),
                PatternRule.group1("(?:in|to|at)\\s+([A-Za-z]:[\\\\/]\\S+)"),
                PatternRule.group1("(?:in|to|at)\\s+([/~]\\S+)")
        ));
        PARAMETERS.put(ParameterNames.PORT, List.of(
                PatternRule.group1("port\\s+(\\d+)"),
                PatternRule.group1(":(\\d+)")
        ));
        PARAMETERS.put(ParameterNames.IP, List.of(
                PatternRule.group1("(\\d+\\.\\d+\\.\\d+\\.\\d+)")
        ));
        PARAMETERS.put(ParameterNames.EXTENSION, List.of(
                PatternRule.group1("\\.(\\w+)\\s+files?"),
                PatternRule.group1("files?\\s+with\\s+\\.(\\w+)"),
                PatternRule.group1("(\\w+)\\s+files?")
        ));
        PARAMETERS.put(ParameterNames.NUMBER, List.of(
                PatternRule.group1("(\\d+)\\s+(?:files?|items?|processes?)"),
                PatternRule.group1("top\\s+(\\d+)"),
                PatternRule.group1("last\\s+(\\d+)"),
                PatternRule.group1("first\\s+(\\d+)")
        ));
        PARAMETERS.put(ParameterNames.CONTENT, List.of(
                PatternRule.group1("with\\s+content\\s+[\"'](.+?)[\"']"),
                PatternRule.group1("containing\\s+[\"'](.+?)[\"']"),
                PatternRule.group1("text\\s+[\"'](.+?)[\"']")
        ));
        PARAMETERS.put(ParameterNames.URL, List.of(
                PatternRule.group1("(https?://\\S+)"),
                PatternRule.group1("(git@[\\w.-]+:\\S+)")
        ));
        PARAMETERS.put(ParameterNames.BRANCHNAME, List.of(
                PatternRule.group1("branch\\s+(?:named?\\s+|called\\s+)?[\"']([^\"']+)[\"']"),
                PatternRule.group1("branch\\s+(?:named?|called)\\s+([\\w\\-./]+)"),
                PatternRule.group1("(?:to|into)\\s+branch\\s+([\\w\\-./]+)")
        ));
        PARAMETERS.put(ParameterNames.MESSAGE, List.of(
                PatternRule.group1("(?:message|msg)\\s+[\"'](.+?)[\"']"),
                PatternRule.group1("commit\\s+(?:\\w+\\s+)*?with\\s+[\"'](.+?)[\"']")
        ));
    }

    public CommandAnalysis analyze(String query) {
        String text = query == null ? "" : query;
        String lower = text.toLowerCase(Locale.ROOT);

        CommandAnalysis.CommandAnalysisBuilder builder = CommandAnalysis.builder()
                .query(text)
                .parameters(PatternRules.extractAll(PARAMETERS, text))
                .nestedOperation(PatternRules.firstMatch(NESTED, text).orElse(null));

        Optional<String> gitIntent = PatternRules.firstMatchingKey(GIT_INTENTS, lower);
        if (gitIntent.isPresent()) {
            return builder.intent(gitIntent.get())
                    .action(GIT_ACTION)
                    .target(GIT_ACTION)
                    .build();
        }

        outer:
        for (Map.Entry<String, List<String>> entry : ACTION_VERBS.entrySet()) {
            for (String verb : entry.getValue()) {
                if (containsWord(lower, verb)) {
                    builder.intent(entry.getKey()).action(verb);
                    break outer;
                }
            }
        }

        for (Map.Entry<String, List<String>> entry : TARGET_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(keyword -> containsWord(lower, keyword))) {
                builder.target(entry.getKey());
            }
        }
        return builder.build();
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }

    private static void git(String intent, String regex) {
        GIT_INTENTS.put(intent, List.of(PatternRule.constant(regex, intent)));
    }
}
