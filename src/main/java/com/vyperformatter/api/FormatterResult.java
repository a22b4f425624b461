package com.vyperformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;

/**
 * Result of formatting one source.
 * <p>
 * When {@code successful} is false, {@code formattedCode} holds the untouched source
 * (or null when it could not be read) and {@code changed} is false.
 */
public class FormatterResult {
    private final boolean successful;
    private final boolean changed;
    private final String formattedCode;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.changed = builder.changed;
        this.formattedCode = builder.formattedCode;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    public boolean isSuccessful() {
        return successful;
    }

    public boolean isChanged() {
        return changed;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public boolean hasErrorsOf(Severity severity) {
        return errors.stream().anyMatch(e -> e.getSeverity() == severity);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A failed result that hands back the original source with a single diagnostic.
     */
    public static FormatterResult failure(String sourceCode, FormatterError error) {
        return builder()
                .successful(false)
                .formattedCode(sourceCode)
                .addError(error)
                .build();
    }

    public static class Builder {
        private boolean successful;
        private boolean changed;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
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

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
