package com.codelogickeep.agent.adapter.validation;

import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link SyntaxChecker} backed by tree-sitter grammars for C++, C# and Python.
 * <p>
 * Error spans are the ERROR and MISSING nodes of the concrete syntax tree.
 */
@Slf4j
public class TreeSitterSyntaxChecker implements SyntaxChecker {
    public static final String CPP = "cpp";
    public static final String CSHARP = "csharp";
    public static final String PYTHON = "python";

    private static final Map<String, Supplier<TSLanguage>> GRAMMARS = Map.of(
            CPP, TreeSitterCpp::new,
            CSHARP, TreeSitterCSharp::new,
            PYTHON, TreeSitterPython::new);

    public static Set<String> languages() {
        return GRAMMARS.keySet();
    }

    @Override
    public SyntaxTree parse(byte[] source, String language) {
        Supplier<TSLanguage> grammar = GRAMMARS.get(language.toLowerCase(Locale.ROOT));
        if (grammar == null) {
            throw new IllegalArgumentException("No tree-sitter grammar for language '" + language + "'");
        }
        TSParser parser;
        try {
            // Parsers hold native state and are not shared between threads.
            parser = new TSParser();
            if (!parser.setLanguage(grammar.get())) {
                throw new IllegalStateException("tree-sitter rejected the grammar for '" + language + "'");
            }
        } catch (LinkageError e) {
            throw new IllegalStateException("tree-sitter grammar for '" + language + "' could not be loaded", e);
        }
        TSTree tree = parser.parseString(null, new String(source, StandardCharsets.UTF_8));
        log.debug("tree-sitter parsed {} bytes of {}", source.length, language);
        return new TreeSitterTree(language, tree);
    }

    @Override
    public boolean hasErrors(SyntaxTree tree) {
        return asTreeSitterTree(tree).tree().getRootNode().hasError();
    }

    @Override
    public List<LineRange> errorRanges(SyntaxTree tree) {
        List<LineRange> ranges = new ArrayList<>();
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(asTreeSitterTree(tree).tree().getRootNode());
        while (!pending.isEmpty()) {
            TSNode node = pending.pop();
            if (node.isError() || node.isMissing()) {
                int start = node.getStartPoint().getRow() + 1;
                int end = Math.max(start, node.getEndPoint().getRow() + 1);
                ranges.add(new LineRange(start, end));
            }
            if (!node.hasError()) {
                continue;
            }
            // Reverse push keeps source order.
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                pending.push(node.getChild(i));
            }
        }
        return ranges;
    }

    private static TreeSitterTree asTreeSitterTree(SyntaxTree tree) {
        if (tree instanceof TreeSitterTree treeSitterTree) {
            return treeSitterTree;
        }
        throw new IllegalArgumentException("Not a tree-sitter tree: " + tree);
    }

    record TreeSitterTree(String language, TSTree tree) implements SyntaxTree {
    }
}
