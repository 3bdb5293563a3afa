package com.codelogickeep.agent.adapter.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads text templates from the classpath.
 */
public final class TemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private TemplateLoader() {
    }

    /**
     * Returns the template text, or an empty string when it is missing or unreadable.
     */
    public static String loadTemplate(String templatePath) {
        if (templatePath == null) {
            log.warn("Template path is null");
            return "";
        }
        try (InputStream is = TemplateLoader.class.getClassLoader().getResourceAsStream(templatePath)) {
            if (is == null) {
                log.warn("Template not found: {}", templatePath);
                return "";
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templatePath, e);
            return "";
        }
    }
}
