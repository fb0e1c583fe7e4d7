package com.menuvo.menuImport.guard.service;

import com.menuvo.menuImport.guard.model.SanitizationResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Neutralizes prompt injection attempts in untrusted text before it is embedded in a model prompt.
 *
 * Matches are replaced in place so the surrounding menu text keeps its layout.
 * Compiled patterns are immutable; each call gets its own {@link Matcher}, so one instance
 * is safe to share between concurrent jobs.
 */
@Service
public class PromptSanitizer {

    public static final String PLACEHOLDER = "[FILTERED]";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(all\\s+)?(previous|above|prior|earlier)\\s+instructions?", FLAGS),
            Pattern.compile("disregard\\s+(all\\s+)?(previous|above|prior|earlier)\\s+instructions?", FLAGS),
            Pattern.compile("forget\\s+(everything|all|your|the\\s+previous)", FLAGS),
            Pattern.compile("system\\s*:", FLAGS),
            Pattern.compile("assistant\\s*:", FLAGS),
            Pattern.compile("\\[INST]", FLAGS),
            Pattern.compile("<<SYS>>", FLAGS),
            Pattern.compile("<\\|im_start\\|>", FLAGS),
            Pattern.compile("<\\|im_end\\|>", FLAGS),
            Pattern.compile("you\\s+are\\s+now\\s+(a|an)", FLAGS),
            Pattern.compile("new\\s+(role|instructions?|task)\\s*:", FLAGS),
            Pattern.compile("from\\s+now\\s+on", FLAGS),
            Pattern.compile("pretend\\s+(you|to\\s+be)", FLAGS),
            Pattern.compile("act\\s+as\\s+(if|a|an)", FLAGS),
            Pattern.compile("roleplay\\s+as", FLAGS),
            Pattern.compile("override\\s+(previous|all|your)", FLAGS),
            Pattern.compile("do\\s+not\\s+follow\\s+(the|your|previous)", FLAGS),
            // Tags the user prompt is built from; menu text must not open or close them.
            Pattern.compile("<\\s*/?\\s*(menu_content|existing_categories|existing_items)\\s*>", FLAGS)
    );

    /**
     * Replaces every injection pattern in the text with {@link #PLACEHOLDER}.
     *
     * @param text Untrusted text, may be null
     * @return Sanitized text and whether anything was replaced
     */
    public SanitizationResult sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return new SanitizationResult(text == null ? "" : text, false);
        }

        String sanitized = text;
        boolean suspicious = false;

        for (Pattern pattern : INJECTION_PATTERNS) {
            Matcher matcher = pattern.matcher(sanitized);
            if (matcher.find()) {
                suspicious = true;
                sanitized = matcher.replaceAll(Matcher.quoteReplacement(PLACEHOLDER));
            }
        }

        return new SanitizationResult(sanitized, suspicious);
    }
}
