package com.tyron.nanodata.core.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text at Unicode line boundaries: {@code \n}, {@code \r\n}, {@code \r}, vertical tab,
 * form feed, the file/group/record separators, NEL, and the line and paragraph separators.
 */
public final class LineSplitter {

    private LineSplitter() {
    }

    public static boolean isLineBreak(char c) {
        switch (c) {
            case '\n':
            case '\r':
            case '\u000b':
            case '\u000c':
            case '\u001c':
            case '\u001d':
            case '\u001e':
            case '\u0085':
            case '\u2028':
            case '\u2029':
                return true;
            default:
                return false;
        }
    }

    /**
     * @return true if {@code line} is terminated by a line break.
     */
    public static boolean endsWithLineBreak(CharSequence line) {
        return line.length() > 0 && isLineBreak(line.charAt(line.length() - 1));
    }

    /**
     * Splits {@code text} into lines. A trailing terminator does not produce an empty last line,
     * and an empty string has no lines.
     */
    public static List<String> splitLines(String text, boolean keepEnds) {
        List<String> lines = new ArrayList<>();
        int n = text.length();
        int start = 0;
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (!isLineBreak(c)) {
                i++;
                continue;
            }
            int end = i + 1;
            if (c == '\r' && end < n && text.charAt(end) == '\n') {
                end++;
            }
            lines.add(keepEnds ? text.substring(start, end) : text.substring(start, i));
            start = end;
            i = end;
        }
        if (start < n) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
