package dev.markdown2pdf.config;

/**
 * Where the Markdown input comes from.
 */
public enum SourceType {
    PATH,
    URL,
    STRING
}
