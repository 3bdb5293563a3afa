package com.codelogickeep.agent.adapter.model;

import com.codelogickeep.agent.adapter.util.TemplateLoader;

/**
 * Handle on a framework's test-generation prompt. The adapter layer only passes it through;
 * prompt construction happens elsewhere.
 */
public record PromptTemplate(String name, String language, String resourcePath) {

    public static PromptTemplate forFramework(String framework, String language) {
        return new PromptTemplate(framework, language, "prompts/" + framework + ".md");
    }

    public String load() {
        return TemplateLoader.loadTemplate(resourcePath);
    }
}
