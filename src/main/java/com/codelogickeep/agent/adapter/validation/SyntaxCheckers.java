package com.codelogickeep.agent.adapter.validation;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Syntax checkers by language name. Java, C++, C# and Python are registered out of the box;
 * embedders register checkers for anything else.
 */
public class SyntaxCheckers {
    private final Map<String, SyntaxChecker> checkers = new ConcurrentHashMap<>();

    public SyntaxCheckers() {
        register(JavaParserSyntaxChecker.LANGUAGE, new JavaParserSyntaxChecker());
        TreeSitterSyntaxChecker treeSitter = new TreeSitterSyntaxChecker();
        for (String language : TreeSitterSyntaxChecker.languages()) {
            register(language, treeSitter);
        }
    }

    /**
     * A registry with nothing registered.
     */
    public static SyntaxCheckers empty() {
        SyntaxCheckers checkers = new SyntaxCheckers();
        checkers.checkers.clear();
        return checkers;
    }

    public SyntaxCheckers register(String language, SyntaxChecker checker) {
        checkers.put(normalize(language), checker);
        return this;
    }

    public Optional<SyntaxChecker> forLanguage(String language) {
        return Optional.ofNullable(checkers.get(normalize(language)));
    }

    private static String normalize(String language) {
        return language.toLowerCase(Locale.ROOT);
    }
}
