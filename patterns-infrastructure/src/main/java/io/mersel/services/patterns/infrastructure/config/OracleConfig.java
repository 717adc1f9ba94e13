package io.mersel.services.patterns.infrastructure.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.mersel.services.patterns.application.interfaces.IExtractionOracle;
import io.mersel.services.patterns.infrastructure.diagnostics.PatternMetrics;
import io.mersel.services.patterns.infrastructure.oracle.BackoffPolicy;
import io.mersel.services.patterns.infrastructure.oracle.LangChain4jExtractionOracle;
import io.mersel.services.patterns.infrastructure.oracle.OracleResponseParser;
import io.mersel.services.patterns.infrastructure.oracle.ResilientExtractionOracle;
import io.mersel.services.patterns.infrastructure.oracle.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Extraction oracle bean'leri.
 * <p>
 * {@link ChatModel} OpenAI uyumlu bir uç noktaya bağlanır ({@code base-url} boşsa
 * varsayılan OpenAI). Motor bileşenleri dayanıklı sarmalayıcıyı ({@code @Primary}) kullanır.
 */
@Configuration
public class OracleConfig {

    @Bean
    public ChatModel oracleChatModel(OracleProperties props) {
        var builder = OpenAiChatModel.builder()
                .apiKey(props.getApiKey() == null || props.getApiKey().isBlank() ? "not-configured" : props.getApiKey())
                .modelName(props.getModelName())
                .temperature(props.getTemperature())
                .maxTokens(props.getMaxOutputTokens())
                .timeout(Duration.ofMillis(props.getTimeoutMs()))
                .maxRetries(0);
        if (props.getBaseUrl() != null && !props.getBaseUrl().isBlank()) {
            builder.baseUrl(props.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    public LangChain4jExtractionOracle langChain4jExtractionOracle(ChatModel oracleChatModel) {
        return new LangChain4jExtractionOracle(oracleChatModel, new OracleResponseParser());
    }

    @Bean
    @Primary
    public IExtractionOracle extractionOracle(LangChain4jExtractionOracle delegate,
                                              OracleProperties props,
                                              PatternMetrics metrics) {
        return new ResilientExtractionOracle(delegate, BackoffPolicy.from(props), props.getTimeoutMs(),
                Sleeper.threadSleep(), metrics);
    }
}
