package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.vyperformatter.plugins.vyper.parsing.Leaf;

/**
 * Turns the token stream of a file into formatted text: logical lines are generated,
 * separated by the blank lines {@link EmptyLineTracker} asks for and split to fit the
 * line length.
 */
public class TreeFormatter {
    private final int lineLength;

    public TreeFormatter(int lineLength) {
        this.lineLength = lineLength;
    }

    public Result format(List<Leaf> leaves) {
        LineGenerator generator = new LineGenerator(lineLength);
        EmptyLineTracker emptyLines = new EmptyLineTracker();
        LineSplitter splitter = new LineSplitter(lineLength);

        StringBuilder text = new StringBuilder();
        List<Overflow> overflows = new ArrayList<>();
        int outputLine = 0;
        int after = 0;
        for (Line line : generator.generate(leaves)) {
            int[] blankLines = emptyLines.maybeEmptyLines(line);
            int before = after + blankLines[0];
            text.append("\n".repeat(before));
            outputLine += before;
            after = blankLines[1];

            for (Line split : splitter.split(line)) {
                String rendered = split.toString();
                outputLine++;
                int width = Strings.width(rendered);
                if (rendered.indexOf('\n') < 0 && width > lineLength) {
                    int sourceLine = split.isEmpty() ? 0 : split.getLeaves().get(0).getLine();
                    overflows.add(new Overflow(outputLine, sourceLine, width));
                }
                outputLine += (int) rendered.chars().filter(c -> c == '\n').count();
                text.append(rendered).append('\n');
            }
        }
        return new Result(text.toString(), overflows);
    }

    /**
     * Formatted text and the lines that still exceed the line length.
     */
    public static final class Result {
        private final String text;
        private final List<Overflow> overflows;

        Result(String text, List<Overflow> overflows) {
            this.text = text;
            this.overflows = Collections.unmodifiableList(overflows);
        }

        public String getText() { return text; }
        public List<Overflow> getOverflows() { return overflows; }
    }

    /**
     * A formatted line no split could bring under the line length.
     */
    public static final class Overflow {
        private final int outputLine;
        private final int sourceLine;
        private final int width;

        Overflow(int outputLine, int sourceLine, int width) {
            this.outputLine = outputLine;
            this.sourceLine = sourceLine;
            this.width = width;
        }

        public int getOutputLine() { return outputLine; }
        public int getSourceLine() { return sourceLine; }
        public int getWidth() { return width; }
    }
}
