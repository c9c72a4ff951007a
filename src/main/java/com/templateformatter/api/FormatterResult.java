package com.templateformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;

/**
 * Result of formatting, linting or fixing one template.
 */
public class FormatterResult {
    private final boolean successful;
    private final boolean ignored;
    private final String originalCode;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<AppliedFix> appliedFixes;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.ignored = builder.ignored;
        this.originalCode = builder.originalCode;
        this.formattedCode = builder.formattedCode;
        this.errors = builder.errors;
        this.appliedFixes = builder.appliedFixes;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Whether the template opted out through an ignore directive.
     */
    public boolean isIgnored() {
        return ignored;
    }

    public String getOriginalCode() {
        return originalCode;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public boolean isChanged() {
        return formattedCode != null && !formattedCode.equals(originalCode);
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public boolean hasErrorsAtLeast(Severity severity) {
        for (FormatterError error : errors) {
            if (error.getSeverity().compareTo(severity) <= 0) {
                return true;
            }
        }
        return false;
    }

    public List<AppliedFix> getAppliedFixes() {
        return appliedFixes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private boolean ignored;
        private String originalCode;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private List<AppliedFix> appliedFixes = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder ignored(boolean ignored) {
            this.ignored = ignored;
            return this;
        }

        public Builder originalCode(String originalCode) {
            this.originalCode = originalCode;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder addAppliedFix(AppliedFix fix) {
            this.appliedFixes.add(fix);
            return this;
        }

        public Builder appliedFixes(List<AppliedFix> fixes) {
            this.appliedFixes = new ArrayList<>(fixes);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
