package com.myorg.specdiff.service.processing;

import com.myorg.specdiff.model.Content;
import com.myorg.specdiff.model.Segment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits directive-bearing text into content tokens.
 * <ul>
 *   <li>{@code {{name}}} becomes a CALL</li>
 *   <li>{@code {{name|} opens a directive; inside it {@code |} is an ARGSEP and {@code }}} closes it</li>
 *   <li>literal text is split into word runs, whitespace runs and single punctuation characters</li>
 * </ul>
 * Concatenating the rendered tokens gives back the input.
 */
@Slf4j
public final class ContentTokenizer {

    private static final Pattern DIRECTIVE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private ContentTokenizer() {}

    public static Content toContent(String text) {
        return new Content(tokenize(text));
    }

    public static List<Segment> tokenize(String text) {
        List<Segment> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        Deque<String> open = new ArrayDeque<>();
        Matcher name = DIRECTIVE_NAME.matcher(text);
        int n = text.length();
        int i = 0;
        while (i < n) {
            if (text.startsWith("{{", i)) {
                name.region(i + 2, n);
                if (name.lookingAt()) {
                    int end = name.end();
                    if (text.startsWith("}}", end)) {
                        out.add(Segment.call(name.group()));
                        i = end + 2;
                        continue;
                    }
                    if (text.startsWith("|", end)) {
                        out.add(Segment.open(name.group()));
                        open.push(name.group());
                        i = end + 1;
                        continue;
                    }
                }
            }
            if (!open.isEmpty()) {
                if (text.startsWith("}}", i)) {
                    out.add(Segment.close(open.pop()));
                    i += 2;
                    continue;
                }
                if (text.charAt(i) == '|') {
                    out.add(Segment.ARGSEP);
                    i++;
                    continue;
                }
            }
            int end = endOfText(text, i);
            out.add(Segment.text(text.substring(i, end)));
            i = end;
        }
        if (!open.isEmpty()) {
            log.debug("unclosed directives {} in {}", open, abbreviate(text));
        }
        return out;
    }

    private static int endOfText(String text, int start) {
        char c = text.charAt(start);
        int i = start + 1;
        if (Character.isWhitespace(c)) {
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        } else if (isWordChar(c)) {
            while (i < text.length() && isWordChar(text.charAt(i))) i++;
        }
        return i;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static String abbreviate(String s) {
        return s.length() <= 60 ? s : s.substring(0, 57) + "...";
    }
}
