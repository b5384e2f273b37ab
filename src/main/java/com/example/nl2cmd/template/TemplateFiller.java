package com.example.nl2cmd.template;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Substitutes {@code {name}} placeholders. A placeholder without a value fails the whole fill. */
public final class TemplateFiller {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private TemplateFiller() {}

    public static Optional<String> fill(String template, Map<String, String> variables) {
        if (template == null) {
            return Optional.empty();
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            String value = variables == null ? null : variables.get(matcher.group(1));
            if (value == null) {
                return Optional.empty();
            }
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(buffer);
        return Optional.of(buffer.toString());
    }
}
