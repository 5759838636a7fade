package com.provider.linkage.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to organization names. Rules run in priority order; a rule marked
 * {@code repeatUntilStable} is re-applied until it stops changing its input, which is how
 * stacked legal suffixes such as "Co., Inc." are removed.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;
    private final boolean repeatUntilStable;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
        this.repeatUntilStable = builder.repeatUntilStable;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isRepeatUntilStable() {
        return repeatUntilStable;
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        String result = pattern.matcher(input).replaceAll(replacement);
        if (!repeatUntilStable) {
            return result;
        }
        // repeatable rules must shrink their input on every effective replacement
        String previous = input;
        while (!result.equals(previous)) {
            previous = result;
            result = pattern.matcher(result).replaceAll(replacement);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                ", repeatUntilStable=" + repeatUntilStable +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private int priority = 100;
        private boolean repeatUntilStable;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder repeatUntilStable(boolean repeatUntilStable) {
            this.repeatUntilStable = repeatUntilStable;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
