package com.example.nl2cmd.template;

import com.example.nl2cmd.config.Nl2CmdProperties;
import com.example.nl2cmd.model.OsFamily;
import com.example.nl2cmd.util.JsonResources;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory catalog of command templates keyed by OS family and template key.
 *
 * <p>Templates listed under {@code common} apply to every OS family unless the family overrides the
 * key. When the configured resource is missing or unreadable a built-in table is used instead.
 */
@Slf4j
@Component
public class CommandTemplateCatalog {

    private final Map<OsFamily, Map<String, List<String>>> templates;

    @Autowired
    public CommandTemplateCatalog(ResourceLoader resourceLoader, Nl2CmdProperties properties) {
        this(loadTemplates(resourceLoader, properties.getDataset().getTemplates()));
    }

    private CommandTemplateCatalog(TemplateBundle bundle) {
        Map<OsFamily, Map<String, List<String>>> byOs = new EnumMap<>(OsFamily.class);
        byOs.put(OsFamily.WINDOWS, merge(bundle.common, bundle.windows));
        byOs.put(OsFamily.LINUX, merge(bundle.common, bundle.linux));
        this.templates = Collections.unmodifiableMap(byOs);
    }

    public static CommandTemplateCatalog of(Map<String, List<String>> common,
                                            Map<String, List<String>> windows,
                                            Map<String, List<String>> linux) {
        TemplateBundle bundle = new TemplateBundle();
        bundle.common = common;
        bundle.windows = windows;
        bundle.linux = linux;
        return new CommandTemplateCatalog(bundle);
    }

    public static CommandTemplateCatalog builtIn() {
        return new CommandTemplateCatalog(BuiltInTemplates.bundle());
    }

    /** First template for {@code key} on {@code os}. */
    public Optional<String> find(String key, OsFamily os) {
        if (key == null || key.isBlank() || os == null) {
            return Optional.empty();
        }
        List<String> candidates = templates.get(os).get(key.toLowerCase(Locale.ROOT));
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(0));
    }

    public int size(OsFamily os) {
        return templates.get(os).size();
    }

    private static Map<String, List<String>> merge(Map<String, List<String>> common,
                                                   Map<String, List<String>> specific) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        copyInto(out, common);
        copyInto(out, specific);
        return Collections.unmodifiableMap(out);
    }

    private static void copyInto(Map<String, List<String>> target, Map<String, List<String>> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, list) -> {
            if (key != null && list != null && !list.isEmpty()) {
                target.put(key.toLowerCase(Locale.ROOT), List.copyOf(list));
            }
        });
    }

    private static TemplateBundle loadTemplates(ResourceLoader resourceLoader, String location) {
        try {
            Optional<TemplateBundle> bundle = JsonResources.read(resourceLoader, location, TemplateBundle.class);
            if (bundle.isPresent() && !bundle.get().isEmpty()) {
                log.info("Loaded command templates from {}", location);
                return bundle.get();
            }
        } catch (IOException ex) {
            log.warn("Failed to load command templates from {}: {}", location, ex.getMessage());
        }
        log.info("Command template catalog initialized with built-in templates");
        return BuiltInTemplates.bundle();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TemplateBundle {
        public Map<String, List<String>> common;
        public Map<String, List<String>> windows;
        public Map<String, List<String>> linux;

        boolean isEmpty() {
            return isNullOrEmpty(common) && isNullOrEmpty(windows) && isNullOrEmpty(linux);
        }

        private static boolean isNullOrEmpty(Map<?, ?> map) {
            return map == null || map.isEmpty();
        }
    }
}
