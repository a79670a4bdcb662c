package it.aw.paperindex.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configura i bean LangChain4j.
 *
 * EmbeddingModel:     AllMiniLM-L6-v2 quantizzato, gira in locale, senza API key.
 * ChatLanguageModel:  modello OpenAI-compatibile usato per l'estrazione dei metadati.
 *                     Timeout e retry sono gestiti dal client: una chiamata scaduta
 *                     viene ritentata fino a {@code openai.max-retries} volte.
 * L'indice vettoriale è gestito da ContentAddressedStore e caricato da StoreLifecycle.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${openai.chat-model:gpt-4-turbo}")
    private String chatModelName;

    @Value("${openai.temperature:0}")
    private double temperature;

    @Value("${openai.timeout-seconds:60}")
    private long timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Bean
    public EmbeddingModel embeddingModel() {
        log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean
    public ChatLanguageModel chatLanguageModel() {
        log.info("Inizializzazione ChatLanguageModel: {} su {}", chatModelName, baseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(chatModelName)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .build();
    }
}
