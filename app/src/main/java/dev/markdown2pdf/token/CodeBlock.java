package dev.markdown2pdf.token;

import java.util.Objects;
import java.util.Optional;

/**
 * Verbatim fenced code. The content keeps its line breaks and is never tokenized.
 */
public record CodeBlock(Optional<String> language, String content) implements Token {

    public CodeBlock {
        language = language == null ? Optional.empty() : language.filter(value -> !value.isBlank());
        Objects.requireNonNull(content, "content");
    }

    @Override
    public TokenKind kind() {
        return TokenKind.CODE_BLOCK;
    }

    @Override
    public String kindKey() {
        return "code-block";
    }
}
