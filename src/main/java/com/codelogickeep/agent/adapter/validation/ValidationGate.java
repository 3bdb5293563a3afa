package com.codelogickeep.agent.adapter.validation;

import com.codelogickeep.agent.adapter.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rejects candidate test source that does not parse. Code is never compiled or executed.
 */
@Slf4j
public class ValidationGate {
    private final SyntaxCheckers checkers;

    public ValidationGate(SyntaxCheckers checkers) {
        this.checkers = checkers;
    }

    public ValidationResult validate(String source, String language) {
        Optional<SyntaxChecker> checker = checkers.forLanguage(language);
        if (checker.isEmpty()) {
            log.warn("No syntax checker registered for {}", language);
            return ValidationResult.ok(List.of("No syntax checker available for language '" + language + "'"));
        }
        byte[] bytes = (source != null ? source : "").getBytes(StandardCharsets.UTF_8);
        List<String> errors = new ArrayList<>();
        try {
            SyntaxTree tree = checker.get().parse(bytes, language);
            if (!checker.get().hasErrors(tree)) {
                return ValidationResult.ok();
            }
            for (LineRange range : checker.get().errorRanges(tree)) {
                errors.add("Syntax error at line " + range.startLine() + "-" + range.endLine());
            }
        } catch (RuntimeException e) {
            // Fail closed.
            log.error("Syntax checker for {} failed", language, e);
            return ValidationResult.invalid(List.of("Syntax check failed for language '" + language + "': " + e.getMessage()));
        }
        if (errors.isEmpty()) {
            errors.add("Syntax error");
        }
        return ValidationResult.invalid(errors);
    }
}
