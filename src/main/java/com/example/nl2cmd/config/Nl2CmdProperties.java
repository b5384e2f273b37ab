package com.example.nl2cmd.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "nl2cmd")
@Validated
public class Nl2CmdProperties {

    /** {@code windows}, {@code linux} or {@code auto} (derived from {@code os.name}). */
    private String osFamily = "auto";
    private final Resolver resolver = new Resolver();
    private final Matcher matcher = new Matcher();
    private final Classifier classifier = new Classifier();
    private final Dataset dataset = new Dataset();
    private final Input input = new Input();

    public String getOsFamily() {
        return osFamily;
    }

    public void setOsFamily(String osFamily) {
        this.osFamily = osFamily;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public Matcher getMatcher() {
        return matcher;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public Input getInput() {
        return input;
    }

    public static final class Resolver {
        private double classifierThreshold = 0.6;
        private double templateThreshold = 0.90;
        private double fuzzyThreshold = 0.75;

        public double getClassifierThreshold() {
            return classifierThreshold;
        }

        public void setClassifierThreshold(double classifierThreshold) {
            this.classifierThreshold = classifierThreshold;
        }

        public double getTemplateThreshold() {
            return templateThreshold;
        }

        public void setTemplateThreshold(double templateThreshold) {
            this.templateThreshold = templateThreshold;
        }

        public double getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
        }
    }

    public static final class Matcher {
        private boolean enabled = true;
        private int searchThreshold = 60;
        private int searchLimit = 5;
        private int highConfidenceScore = 85;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getSearchThreshold() {
            return searchThreshold;
        }

        public void setSearchThreshold(int searchThreshold) {
            this.searchThreshold = searchThreshold;
        }

        public int getSearchLimit() {
            return searchLimit;
        }

        public void setSearchLimit(int searchLimit) {
            this.searchLimit = searchLimit;
        }

        public int getHighConfidenceScore() {
            return highConfidenceScore;
        }

        public void setHighConfidenceScore(int highConfidenceScore) {
            this.highConfidenceScore = highConfidenceScore;
        }
    }

    public static final class Classifier {
        /** {@code none} disables stage 1; {@code tfidf} builds the in-process classifier. */
        private String type = "none";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static final class Dataset {
        private String commands = "classpath:dataset/commands.json";
        private String problems = "classpath:dataset/problems.json";
        private String templates = "classpath:dataset/command_templates.json";
        private String rules = "classpath:dataset/rules.json";

        public String getCommands() {
            return commands;
        }

        public void setCommands(String commands) {
            this.commands = commands;
        }

        public String getProblems() {
            return problems;
        }

        public void setProblems(String problems) {
            this.problems = problems;
        }

        public String getTemplates() {
            return templates;
        }

        public void setTemplates(String templates) {
            this.templates = templates;
        }

        public String getRules() {
            return rules;
        }

        public void setRules(String rules) {
            this.rules = rules;
        }
    }

    public static final class Input {
        private int maxChars = 300;

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }
    }
}
