package io.github.eutro.qdebug.parsing;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Strips comments and top-level blocks from program text, keeping track of where everything
 * was in the original.
 */
public class Sanitizer {
    private Sanitizer() {
    }

    /**
     * Replace every {@code //} comment with spaces, up to (not including) the end of its line.
     * <p>
     * The result has the same length as the input, with newlines in the same places.
     *
     * @param code The code.
     * @return The code without comments.
     */
    @Contract(pure = true)
    @NotNull
    public static String removeComments(String code) {
        char[] chars = code.toCharArray();
        int i = 0;
        while (i + 1 < chars.length) {
            if (chars[i] == '/' && chars[i + 1] == '/') {
                while (i < chars.length && chars[i] != '\n') {
                    chars[i++] = ' ';
                }
            } else {
                i++;
            }
        }
        return new String(chars);
    }

    /**
     * Sanitize a piece of program text: remove comments, then sweep out top-level blocks.
     * <p>
     * Nested braces are kept verbatim in the content of the outermost block. A stray closing
     * brace is ignored, and an opening brace that is never closed is left in the text.
     *
     * @param code The code.
     * @param base The offset of {@code code} in the original program text.
     * @return The sanitized source.
     */
    @NotNull
    public static SanitizedSource sanitize(String code, int base) {
        String commentFree = removeComments(code);
        StringBuilder text = new StringBuilder(commentFree.length());
        List<SourceBlock> blocks = new ArrayList<>();
        SourceMap.Builder map = new SourceMap.Builder(base);

        int level = 0;
        int start = 0;
        int copied = 0;
        for (int pos = 0; pos < commentFree.length(); pos++) {
            char c = commentFree.charAt(pos);
            if (c == '{') {
                if (level == 0) start = pos;
                level++;
            } else if (c == '}') {
                if (level == 0) continue;
                if (--level == 0) {
                    text.append(commentFree, copied, start);
                    int at = text.length();
                    blocks.add(new SourceBlock(
                            at,
                            commentFree.substring(start + 1, pos),
                            base + start,
                            base + pos
                    ));
                    map.removed(at, pos + 1 - start);
                    copied = pos + 1;
                }
            }
        }
        text.append(commentFree, copied, commentFree.length());
        return new SanitizedSource(commentFree, text.toString(), blocks, map.build());
    }

    @NotNull
    public static SanitizedSource sanitize(String code) {
        return sanitize(code, 0);
    }
}
