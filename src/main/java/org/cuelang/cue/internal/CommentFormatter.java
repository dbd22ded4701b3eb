package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Comment;
import org.cuelang.cue.ast.CommentGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds comment groups from free text, for syntax trees generated by code
 * rather than parsed from source.
 *
 * Each line of the text is reflowed on word boundaries so that, counting the
 * {@code //} marker, it stays within {@value #MAX_RUNES_PER_LINE} characters.
 * Words are never split; a single word longer than the budget gets a line of
 * its own.
 */
public final class CommentFormatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommentFormatter.class);

    public static final int MAX_RUNES_PER_LINE = 66;

    private static final String MARKER = "//";

    // ASCII whitespace, Unicode space separators and NEL
    private static final Pattern WORD_SEPARATORS = Pattern.compile("[\\s\\p{Z}\\u0085]+");

    private CommentFormatter() {
    }

    /**
     * Creates a comment group from the given text.
     *
     * @param isDoc true for a documentation comment placed before its node,
     *              false for a trailing comment on the line of its node
     * @param text  Comment text without markers
     * @return The comment group, or empty if {@code text} is empty
     */
    public static Optional<CommentGroup> newComment(boolean isDoc, String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        List<Comment> lines = new ArrayList<>();
        for (String line : splitLines(text)) {
            reflow(line, lines);
        }
        int last = lines.size() - 1;
        if (last >= 0 && lines.get(last).text().equals(MARKER)) {
            lines.remove(last);
        }

        CommentGroup cg = new CommentGroup(lines);
        cg.setDoc(isDoc);
        if (!isDoc) {
            cg.setLine(true);
            cg.setPosition(CommentGroup.AFTER_NODE);
        }
        LOGGER.trace("Formatted {} comment of {} line(s)", isDoc ? "doc" : "line", lines.size());
        return Optional.of(cg);
    }

    private static void reflow(String line, List<Comment> out) {
        int count = MARKER.length();
        StringBuilder buf = new StringBuilder(MARKER);
        for (String word : WORD_SEPARATORS.split(line)) {
            if (word.isEmpty()) {
                continue;
            }
            int n = word.codePointCount(0, word.length()) + 1;
            if (count + n > MAX_RUNES_PER_LINE && count > MARKER.length() + 1) {
                out.add(new Comment(buf.toString()));
                // continuation lines are counted one column further in
                count = MARKER.length() + 1;
                buf.setLength(0);
                buf.append(MARKER);
            }
            buf.append(' ').append(word);
            count += n;
        }
        out.add(new Comment(buf.toString()));
    }

    /**
     * Splits on newlines, dropping a carriage return before each newline. A
     * final newline does not start another line.
     */
    private static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl;
            String line = text.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            start = end + 1;
        }
        return lines;
    }
}
