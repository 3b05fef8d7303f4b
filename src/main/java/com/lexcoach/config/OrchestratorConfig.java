package com.lexcoach.config;

import com.lexcoach.orchestration.api.CheckpointStore;
import com.lexcoach.orchestration.api.MemoryStore;
import com.lexcoach.orchestration.service.InMemoryCheckpointStore;
import com.lexcoach.orchestration.service.InMemoryMemoryStore;
import com.lexcoach.orchestration.service.JpaCheckpointStore;
import com.lexcoach.orchestration.service.JpaMemoryStore;
import com.lexcoach.orchestration.service.JsonProcessingService;
import com.lexcoach.repository.ConversationTurnRepository;
import com.lexcoach.repository.ResolvedRunRepository;
import com.lexcoach.repository.RunCheckpointRepository;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ChatClient chatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor(CoachProperties properties) {
        return Executors.newFixedThreadPool(properties.getTools().getConcurrency());
    }

    @Bean
    public CheckpointStore checkpointStore(CoachProperties properties,
                                           RunCheckpointRepository checkpointRepository,
                                           ResolvedRunRepository resolvedRunRepository,
                                           JsonProcessingService jsonProcessingService) {
        if (properties.getCheckpoint().getStore() == CoachProperties.CheckpointStoreType.MEMORY) {
            return new InMemoryCheckpointStore();
        }
        return new JpaCheckpointStore(checkpointRepository, resolvedRunRepository, jsonProcessingService);
    }

    @Bean
    public MemoryStore memoryStore(CoachProperties properties, ConversationTurnRepository turnRepository) {
        if (properties.getCheckpoint().getStore() == CoachProperties.CheckpointStoreType.MEMORY) {
            return new InMemoryMemoryStore();
        }
        return new JpaMemoryStore(turnRepository);
    }
}
