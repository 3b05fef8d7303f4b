package com.lexcoach.orchestration.service;

import com.lexcoach.orchestration.api.LanguageModelClient;
import com.lexcoach.orchestration.exception.ProviderTimeoutException;
import com.lexcoach.orchestration.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Language-model collaborator backed by a Spring AI {@link ChatClient}.
 */
@Service
@Slf4j
public class ChatClientLanguageModelClient implements LanguageModelClient {

    private final ChatClient chatClient;
    private final AtomicLong llmRequestCount = new AtomicLong();

    public ChatClientLanguageModelClient(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String complete(String purpose, String instruction, String context) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}). Total requests={}.", count, purpose, count);
        try {
            return chatClient.prompt()
                    .system(instruction)
                    .user(context)
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            if (isTimeout(ex)) {
                throw new ProviderTimeoutException("Language model timed out during " + purpose + ".", ex);
            }
            throw new ProviderUnavailableException("Language model unavailable during " + purpose + ": " + ex.getMessage(), ex);
        }
    }

    private boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
