package com.di.docsync.sync;

import com.di.docsync.util.InputValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides which discovered tables a run touches.
 */
public final class TableFilter {

    private final List<Pattern> include;
    private final List<Pattern> exclude;

    private TableFilter(List<Pattern> include, List<Pattern> exclude) {
        this.include = include;
        this.exclude = exclude;
    }

    public static TableFilter of(List<String> defaultExcludes, List<String> include, List<String> exclude) {
        List<Pattern> excluded = new ArrayList<>(compile(defaultExcludes));
        excluded.addAll(compile(exclude));
        return new TableFilter(compile(include), List.copyOf(excluded));
    }

    /**
     * An empty include list means every table; exclusions win over inclusions.
     */
    public boolean accepts(String table) {
        if (!include.isEmpty() && include.stream().noneMatch(p -> p.matcher(table).matches())) {
            return false;
        }
        return exclude.stream().noneMatch(p -> p.matcher(table).matches());
    }

    private static List<Pattern> compile(List<String> globs) {
        if (globs == null) {
            return List.of();
        }
        return globs.stream()
                .filter(g -> g != null && !g.isBlank())
                .map(InputValidator::validateTablePattern)
                .map(TableFilter::toRegex)
                .toList();
    }

    static Pattern toRegex(String glob) {
        return Pattern.compile(Arrays.stream(glob.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*")));
    }
}
