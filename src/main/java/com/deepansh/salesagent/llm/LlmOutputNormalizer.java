package com.deepansh.salesagent.llm;

import java.util.Arrays;

/**
 * Cleans raw model output down to the JSON object it is supposed to contain.
 *
 * Models wrap JSON in prose ("Sure! Here's the plan:") and markdown fences
 * despite being told not to. Steps, in order:
 * <ol>
 *   <li>drop every line before the first one that starts with '{' or a code fence</li>
 *   <li>if a fence is now leading, drop that line, and the last line when it is a closing fence</li>
 *   <li>cut everything after the last '}'</li>
 *   <li>trim</li>
 * </ol>
 * Never throws; garbage in, (shorter) garbage out — the JSON decoder decides.
 */
public final class LlmOutputNormalizer {

    private static final String FENCE = "```";

    private LlmOutputNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) return "";

        String text = raw.strip();
        String[] lines = text.split("\\R", -1);

        int start = -1;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.startsWith("{") || line.startsWith(FENCE)) {
                start = i;
                break;
            }
        }
        if (start > 0) {
            text = String.join("\n", Arrays.copyOfRange(lines, start, lines.length)).strip();
        }

        if (text.startsWith(FENCE)) {
            String[] fenced = text.split("\\R", -1);
            int end = fenced.length;
            if (end > 1 && fenced[end - 1].strip().startsWith(FENCE)) {
                end--;
            }
            text = end > 1
                    ? String.join("\n", Arrays.copyOfRange(fenced, 1, end))
                    : "";
        }

        int lastBrace = text.lastIndexOf('}');
        if (lastBrace >= 0) {
            text = text.substring(0, lastBrace + 1);
        }
        return text.strip();
    }
}
