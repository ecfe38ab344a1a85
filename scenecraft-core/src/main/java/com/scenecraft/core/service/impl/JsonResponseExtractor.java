package com.scenecraft.core.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenecraft.core.service.ServiceException;

/**
 * Pulls a JSON object out of a chat model reply.
 *
 * <p>Models often wrap JSON in markdown fences or surround it with prose. The
 * extractor strips a fence if present, then takes the first balanced object,
 * ignoring braces inside string literals.
 */
public final class JsonResponseExtractor {

    private static final int PREVIEW_LENGTH = 200;

    private final ObjectMapper mapper;

    public JsonResponseExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses the JSON object contained in a reply.
     *
     * @param reply raw model reply
     * @return parsed object
     * @throws ServiceException if no JSON object can be parsed
     */
    public JsonNode extract(String reply) throws ServiceException {
        if (reply == null || reply.isBlank()) {
            throw new ServiceException("Empty reply from model");
        }
        String json = extractJson(reply);
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new ServiceException("Reply is not a JSON object: " + preview(reply));
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ServiceException("Could not parse JSON reply: " + preview(reply), e);
        }
    }

    static String extractJson(String reply) {
        String trimmed = reply.trim();

        int fenceStart = trimmed.indexOf("```json");
        if (fenceStart < 0) {
            fenceStart = trimmed.indexOf("```JSON");
        }
        if (fenceStart < 0) {
            fenceStart = trimmed.indexOf("```");
        }
        if (fenceStart >= 0) {
            int contentStart = trimmed.indexOf('\n', fenceStart);
            if (contentStart >= 0) {
                contentStart++;
                int fenceEnd = trimmed.indexOf("```", contentStart);
                if (fenceEnd > contentStart) {
                    trimmed = trimmed.substring(contentStart, fenceEnd).trim();
                }
            }
        }

        int braceStart = trimmed.indexOf('{');
        if (braceStart < 0) {
            return trimmed;
        }

        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = braceStart; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (escape) {
                escape = false;
            } else if (c == '\\' && inString) {
                escape = true;
            } else if (c == '"') {
                inString = !inString;
            } else if (!inString && c == '{') {
                depth++;
            } else if (!inString && c == '}') {
                depth--;
                if (depth == 0) {
                    return trimmed.substring(braceStart, i + 1);
                }
            }
        }

        // unbalanced: first { to last }
        int braceEnd = trimmed.lastIndexOf('}');
        return braceEnd > braceStart ? trimmed.substring(braceStart, braceEnd + 1) : trimmed;
    }

    private static String preview(String reply) {
        return reply.length() <= PREVIEW_LENGTH ? reply : reply.substring(0, PREVIEW_LENGTH) + "...";
    }
}
