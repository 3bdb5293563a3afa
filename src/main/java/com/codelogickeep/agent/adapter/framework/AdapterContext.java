package com.codelogickeep.agent.adapter.framework;

import com.codelogickeep.agent.adapter.config.AdapterConfig;
import com.codelogickeep.agent.adapter.detect.ProjectScanner;
import com.codelogickeep.agent.adapter.process.CommandRunner;
import com.codelogickeep.agent.adapter.validation.SyntaxCheckers;

/**
 * Shared collaborators handed to every adapter.
 */
public record AdapterContext(AdapterConfig config, CommandRunner commandRunner, ProjectScanner scanner,
                             SyntaxCheckers syntaxCheckers) {

    public static AdapterContext defaults() {
        return from(new AdapterConfig());
    }

    public static AdapterContext from(AdapterConfig config) {
        return new AdapterContext(config, new CommandRunner(), new ProjectScanner(config.getDetection()),
                new SyntaxCheckers());
    }

    public AdapterContext withCommandRunner(CommandRunner runner) {
        return new AdapterContext(config, runner, scanner, syntaxCheckers);
    }

    public AdapterContext withSyntaxCheckers(SyntaxCheckers checkers) {
        return new AdapterContext(config, commandRunner, scanner, checkers);
    }
}
