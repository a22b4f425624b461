package com.vyperformatter.api.error;

public enum Severity {
    FATAL,   // Source could not be read or tokenized, or the formatter hit an internal error
    ERROR,   // File left untouched: unsupported construct or unsafe result
    WARNING, // Formatted, but some lines still exceed the line length
    INFO
}
