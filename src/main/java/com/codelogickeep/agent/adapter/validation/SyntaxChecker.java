package com.codelogickeep.agent.adapter.validation;

import java.util.List;

/**
 * External grammar-based parser used to validate candidate test source without running it.
 */
public interface SyntaxChecker {

    SyntaxTree parse(byte[] source, String language);

    boolean hasErrors(SyntaxTree tree);

    List<LineRange> errorRanges(SyntaxTree tree);
}
