package com.myorg.specdiff.service.processing;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Neutralizes directive syntax inside a directive argument.
 */
public final class DirectiveEscaper {

    /** Understood by the expansion engine as "not directive syntax". */
    public static final String ESCAPE = "\\|";

    private static final Pattern DIRECTIVE_SYNTAX = Pattern.compile("\\{\\{|}}|\\|");

    private DirectiveEscaper() {}

    public static String escape(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        return DIRECTIVE_SYNTAX.matcher(raw).replaceAll(Matcher.quoteReplacement(ESCAPE));
    }
}
