package dev.markdown2pdf.document;

/**
 * One entry of the flat output sequence handed to a renderer.
 */
public interface StyledElement {
}
