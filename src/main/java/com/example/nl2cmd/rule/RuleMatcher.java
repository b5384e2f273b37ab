package com.example.nl2cmd.rule;

import com.example.nl2cmd.model.OsFamily;

/** Deterministic last-resort matcher. Never returns null. */
public interface RuleMatcher {

    /** Returned when no rule applies. */
    String NO_MATCH_PLACEHOLDER = "echo Command not recognized";

    String match(String query, OsFamily os);

    /** Blank output or an {@code echo} stand-in means the matcher found nothing. */
    static boolean isNoOpPlaceholder(String command) {
        return command == null || command.isBlank() || command.strip().startsWith("echo ");
    }
}
