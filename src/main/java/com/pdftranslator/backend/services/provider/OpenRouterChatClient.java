package com.pdftranslator.backend.services.provider;

import org.springframework.stereotype.Component;

import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.pdftranslator.backend.exceptions.ProviderException;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class OpenRouterChatClient {

    private final OpenRouterClientFactory clientFactory;

    public ChatReply complete(ChatCompletionCreateParams params) {
        ChatCompletion completion = clientFactory.getClient().chat().completions().create(params);

        if (completion == null || completion.choices().isEmpty()) {
            throw ProviderException.transientFailure(OpenRouterClientFactory.PROVIDER, "Completion has no choices", null);
        }

        ChatCompletion.Choice choice = completion.choices().get(0);
        String content = choice.message().content().orElse("").trim();
        if (content.isEmpty()) {
            throw ProviderException.transientFailure(OpenRouterClientFactory.PROVIDER, "Completion returned empty content", null);
        }

        boolean truncated = ChatCompletion.Choice.FinishReason.LENGTH.equals(choice.finishReason());
        return new ChatReply(content, truncated);
    }
}
