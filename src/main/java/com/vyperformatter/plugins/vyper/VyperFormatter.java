package com.vyperformatter.plugins.vyper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.vyperformatter.api.FormatterPlugin;
import com.vyperformatter.api.FormatterResult;
import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;
import com.vyperformatter.config.ConfigurationLoader;
import com.vyperformatter.config.FormatterConfig;
import com.vyperformatter.plugins.vyper.formatting.BracketMatchException;
import com.vyperformatter.plugins.vyper.formatting.TreeFormatter;
import com.vyperformatter.plugins.vyper.formatting.UnsupportedConstructException;
import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.ParseException;
import com.vyperformatter.plugins.vyper.parsing.Tokenizer;
import com.vyperformatter.plugins.vyper.safety.SafetyCheck;
import com.vyperformatter.plugins.vyper.safety.SafetyOracle;
import com.vyperformatter.plugins.vyper.safety.TokenStreamComparator;
import com.vyperformatter.plugins.vyper.safety.UnsafeFormattingException;
import com.vyperformatter.util.LoggerUtil;

/**
 * Formats Vyper contracts and interface files.
 * <p>
 * The source is tokenized, laid out by {@link TreeFormatter} and, unless disabled,
 * checked against the original by a {@link SafetyOracle}. Every failure is reported as
 * a diagnostic on the result with the original source handed back.
 */
public class VyperFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(VyperFormatter.class);

    private final SafetyCheck safety;
    private int lineLength = ConfigurationLoader.DEFAULT_LINE_LENGTH;
    private boolean safetyCheck = true;
    private boolean fallbackToOriginal = true;

    public VyperFormatter() {
        this(new TokenStreamComparator());
    }

    public VyperFormatter(SafetyOracle oracle) {
        this.safety = new SafetyCheck(oracle);
    }

    @Override
    public void initialize(FormatterConfig config) {
        this.lineLength = config.getLineLength();
        this.safetyCheck = config.isSafetyCheck();
        this.fallbackToOriginal = config.isFallbackToOriginal();
        logger.fine("Vyper formatter initialized: lineLength=" + lineLength + ", safetyCheck=" + safetyCheck);
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        List<Leaf> leaves;
        try {
            leaves = Tokenizer.tokenize(sourceCode);
        } catch (ParseException e) {
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.FATAL, "Cannot parse source: " + e.getMessage(), e.getLine(), e.getColumn(),
                    "Fix the syntax error and format again"));
        }

        TreeFormatter.Result formatted;
        try {
            formatted = createTreeFormatter(lineLength).format(leaves);
        } catch (UnsupportedConstructException e) {
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.ERROR, "Unsupported construct: " + e.getMessage(), e.getLine(), 1));
        } catch (BracketMatchException e) {
            logger.log(Level.SEVERE, "Internal error formatting " + filePath, e);
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.FATAL, "Internal error: " + e.getMessage(), 1, 1,
                    "Please report this file to the formatter maintainers"));
        }

        String result = formatted.getText();
        if (safetyCheck) {
            try {
                safety.verify(sourceCode, result);
            } catch (UnsafeFormattingException e) {
                logger.warning("Unsafe formatting in " + filePath + " at line " + e.getLine() + ": " + e.getMessage());
                FormatterError error = new FormatterError(
                        Severity.ERROR, e.getMessage(), e.getLine(), 1,
                        "Run with safetyCheck disabled to inspect the output");
                if (fallbackToOriginal) {
                    return FormatterResult.failure(sourceCode, error);
                }
                return FormatterResult.builder()
                        .successful(false)
                        .formattedCode(null)
                        .addError(error)
                        .build();
            }
        }

        List<FormatterError> warnings = new ArrayList<>();
        for (TreeFormatter.Overflow overflow : formatted.getOverflows()) {
            warnings.add(new FormatterError(Severity.WARNING,
                    "Line is " + overflow.getWidth() + " characters long, limit is " + lineLength,
                    overflow.getOutputLine(), lineLength + 1));
        }

        return FormatterResult.builder()
                .successful(true)
                .changed(!result.equals(sourceCode))
                .formattedCode(result)
                .errors(warnings)
                .build();
    }

    protected TreeFormatter createTreeFormatter(int lineLength) {
        return new TreeFormatter(lineLength);
    }

    public int getLineLength() {
        return lineLength;
    }
}
