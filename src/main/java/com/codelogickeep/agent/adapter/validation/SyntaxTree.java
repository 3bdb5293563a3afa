package com.codelogickeep.agent.adapter.validation;

/**
 * Opaque parse tree handed back by a {@link SyntaxChecker}. Only the checker that produced it
 * knows how to inspect it.
 */
public interface SyntaxTree {

    String language();
}
