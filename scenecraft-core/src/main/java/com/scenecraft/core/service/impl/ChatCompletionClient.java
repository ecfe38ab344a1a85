package com.scenecraft.core.service.impl;

import com.scenecraft.core.service.ServiceException;

/**
 * Sends one system/user message pair to a chat model and returns the reply text.
 */
@FunctionalInterface
public interface ChatCompletionClient {

    /**
     * Requests a completion.
     *
     * @param systemPrompt system message
     * @param userPrompt user message
     * @return content of the first choice
     * @throws ServiceException on transport failure, non-success status or malformed reply
     */
    String complete(String systemPrompt, String userPrompt) throws ServiceException;
}
