package io.github.eutro.qdebug.parsing;

/**
 * A top-level brace-delimited block, removed from the text by the {@link Sanitizer}.
 */
public final class SourceBlock {
    /**
     * The offset in the sanitized text the block was removed at.
     */
    public final int position;
    /**
     * The text between the braces.
     */
    public final String content;
    /**
     * The offset of the opening brace in the original program text.
     */
    public final int originalOpen;
    /**
     * The offset of the closing brace in the original program text.
     */
    public final int originalClose;

    public SourceBlock(int position, String content, int originalOpen, int originalClose) {
        this.position = position;
        this.content = content;
        this.originalOpen = originalOpen;
        this.originalClose = originalClose;
    }

    /**
     * Get the block as it was written, braces included.
     *
     * @return The block text.
     */
    public String literal() {
        return "{" + content + "}";
    }

    @Override
    public String toString() {
        return "block@" + position + literal();
    }
}
