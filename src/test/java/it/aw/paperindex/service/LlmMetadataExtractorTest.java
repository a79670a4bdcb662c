package it.aw.paperindex.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import it.aw.paperindex.model.DocumentMetadata;
import it.aw.paperindex.registry.PromptRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmMetadataExtractorTest {

    private ChatLanguageModel chatModel;
    private PromptRegistry promptRegistry;
    private LlmMetadataExtractor extractor;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatLanguageModel.class);
        promptRegistry = mock(PromptRegistry.class);
        when(promptRegistry.get(PromptRegistry.DOCUMENT_METADATA, 0))
                .thenReturn(Optional.of("Extract metadata as JSON.\nInput Text: {{document}}"));
        extractor = new LlmMetadataExtractor(chatModel, promptRegistry, new ObjectMapper());
    }

    @Test
    @DisplayName("compila il prompt con lo snippet e interpreta la risposta JSON")
    void parsesJsonAnswer() {
        when(chatModel.generate(anyString())).thenReturn("""
                {"Title": "Dunes on Mars",
                 "Authors": ["Smith, J.", "Doe, A."],
                 "Year": 2020,
                 "Citation": "Smith, J., & Doe, A. (2020). Dunes on Mars. Icarus."}
                """);

        DocumentMetadata metadata = extractor.extract("Dunes on Mars\nJ. Smith, A. Doe");

        assertThat(metadata.title()).isEqualTo("Dunes on Mars");
        assertThat(metadata.authors()).containsExactly("Smith, J.", "Doe, A.");
        assertThat(metadata.year()).isEqualTo("2020");
        assertThat(metadata.citation()).isEqualTo("Smith, J., & Doe, A. (2020). Dunes on Mars. Icarus.");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).generate(prompt.capture());
        assertThat(prompt.getValue())
                .isEqualTo("Extract metadata as JSON.\nInput Text: Dunes on Mars\nJ. Smith, A. Doe");
    }

    @Test
    @DisplayName("accetta JSON in un blocco di codice e chiavi minuscole")
    void fencedLowercaseAnswer() {
        when(chatModel.generate(anyString())).thenReturn(
                "```json\n{\"title\": \"Ripples\", \"authors\": \"Doe, A.\", \"year\": \"2021\", \"citation\": null}\n```");

        DocumentMetadata metadata = extractor.extract("Ripples");

        assertThat(metadata.title()).isEqualTo("Ripples");
        assertThat(metadata.authors()).containsExactly("Doe, A.");
        assertThat(metadata.year()).isEqualTo("2021");
        assertThat(metadata.citation()).isNull();
    }

    @Test
    @DisplayName("un errore del modello diventa MetadataExtractionException")
    void modelFailure() {
        RuntimeException cause = new RuntimeException("timeout");
        when(chatModel.generate(anyString())).thenThrow(cause);

        assertThatThrownBy(() -> extractor.extract("text"))
                .isInstanceOf(MetadataExtractionException.class)
                .hasCause(cause);
    }

    @Test
    @DisplayName("rifiuta risposte non JSON, non oggetto o senza campi")
    void invalidAnswers() {
        when(chatModel.generate(anyString())).thenReturn("Sorry, I cannot help.", "[1, 2]", "{\"Other\": 1}", "  ");

        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> extractor.extract("text"))
                    .isInstanceOf(MetadataExtractionException.class);
        }
    }

    @Test
    @DisplayName("senza template non interroga il modello")
    void missingTemplate() {
        when(promptRegistry.get(PromptRegistry.DOCUMENT_METADATA, 0)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> extractor.extract("text"))
                .isInstanceOf(MetadataExtractionException.class)
                .hasMessageContaining("document_metadata");
        verify(chatModel, never()).generate(anyString());
    }
}
