package com.catalog.quality.violation;

import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.Severity;
import com.catalog.quality.core.model.ViolationCategory;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One entry of the rule catalogue. Templates may use {@code {field}} and {@code {value}}.
 */
public final class ViolationRule {
    private final String name;
    private final ViolationCategory category;
    private final Severity severity;
    private final String field;
    private final Predicate<NormalizedRecord> violatedBy;
    private final String messageTemplate;
    private final String recommendationTemplate;

    private ViolationRule(Builder builder) {
        this.name = builder.name;
        this.category = builder.category;
        this.severity = builder.severity;
        this.field = builder.field;
        this.violatedBy = builder.violatedBy;
        this.messageTemplate = builder.messageTemplate;
        this.recommendationTemplate = builder.recommendationTemplate;
    }

    public String getName() {
        return name;
    }

    public ViolationCategory getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getField() {
        return field;
    }

    public boolean isViolatedBy(NormalizedRecord record) {
        return violatedBy.test(record);
    }

    public String message(String value) {
        return render(messageTemplate, value);
    }

    public String recommendation(String value) {
        return render(recommendationTemplate, value);
    }

    private String render(String template, String value) {
        return template.replace("{field}", field).replace("{value}", value == null ? "" : value);
    }

    @Override
    public String toString() {
        return "ViolationRule{" + name + ", " + category.wireName() + ", " + severity.wireName() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private ViolationCategory category;
        private Severity severity;
        private String field;
        private Predicate<NormalizedRecord> violatedBy;
        private String messageTemplate;
        private String recommendationTemplate = "";

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(ViolationCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder violatedBy(Predicate<NormalizedRecord> violatedBy) {
            this.violatedBy = violatedBy;
            return this;
        }

        public Builder message(String messageTemplate) {
            this.messageTemplate = messageTemplate;
            return this;
        }

        public Builder recommendation(String recommendationTemplate) {
            this.recommendationTemplate = recommendationTemplate;
            return this;
        }

        public ViolationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(category, "category is required");
            Objects.requireNonNull(severity, "severity is required");
            Objects.requireNonNull(field, "field is required");
            Objects.requireNonNull(violatedBy, "predicate is required");
            Objects.requireNonNull(messageTemplate, "message is required");
            return new ViolationRule(this);
        }
    }
}
