package com.codelogickeep.agent.adapter.validation;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxChecker} for Java source backed by JavaParser.
 */
@Slf4j
public class JavaParserSyntaxChecker implements SyntaxChecker {
    public static final String LANGUAGE = "java";

    @Override
    public SyntaxTree parse(byte[] source, String language) {
        if (!LANGUAGE.equals(language)) {
            throw new IllegalArgumentException("JavaParser cannot parse language '" + language + "'");
        }
        // JavaParser instances are not thread-safe.
        ParseResult<CompilationUnit> result = new JavaParser().parse(new String(source, StandardCharsets.UTF_8));
        log.debug("JavaParser finished with {} problem(s)", result.getProblems().size());
        return new JavaTree(result);
    }

    @Override
    public boolean hasErrors(SyntaxTree tree) {
        return !asJavaTree(tree).result().isSuccessful();
    }

    @Override
    public List<LineRange> errorRanges(SyntaxTree tree) {
        List<LineRange> ranges = new ArrayList<>();
        for (Problem problem : asJavaTree(tree).result().getProblems()) {
            Optional<Range> range = problem.getLocation().flatMap(TokenRange::toRange);
            if (range.isPresent()) {
                int start = Math.max(1, range.get().begin.line);
                int end = Math.max(start, range.get().end.line);
                ranges.add(new LineRange(start, end));
            } else {
                ranges.add(new LineRange(1, 1));
            }
        }
        return ranges;
    }

    private static JavaTree asJavaTree(SyntaxTree tree) {
        if (tree instanceof JavaTree javaTree) {
            return javaTree;
        }
        throw new IllegalArgumentException("Not a JavaParser tree: " + tree);
    }

    record JavaTree(ParseResult<CompilationUnit> result) implements SyntaxTree {
        @Override
        public String language() {
            return LANGUAGE;
        }
    }
}
