package it.aw.paperindex.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.input.PromptTemplate;
import it.aw.paperindex.model.DocumentMetadata;
import it.aw.paperindex.registry.PromptRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estrae i metadati bibliografici interrogando un LLM sulla prima pagina dell'articolo.
 * <p>
 * Il prompt è il template 0 della categoria {@code document_metadata} del {@link PromptRegistry},
 * con la variabile {@code {{document}}}. La risposta attesa è un oggetto JSON con i campi
 * {@code Title}, {@code Authors}, {@code Year}, {@code Citation} (nomi case-insensitive),
 * eventualmente racchiuso in un blocco di codice Markdown.
 */
@Service
public class LlmMetadataExtractor implements MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmMetadataExtractor.class);

    private static final Pattern CODE_FENCE = Pattern.compile(
            "^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ChatLanguageModel chatModel;
    private final PromptRegistry promptRegistry;
    private final ObjectMapper objectMapper;

    public LlmMetadataExtractor(ChatLanguageModel chatModel,
                                PromptRegistry promptRegistry,
                                ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.promptRegistry = promptRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public DocumentMetadata extract(String snippet) {
        String template = promptRegistry.get(PromptRegistry.DOCUMENT_METADATA, 0)
                .orElseThrow(() -> new MetadataExtractionException(
                        "Nessun template nella categoria '" + PromptRegistry.DOCUMENT_METADATA + "'"));

        String answer;
        try {
            String prompt = PromptTemplate.from(template)
                    .apply(Map.of("document", snippet == null ? "" : snippet))
                    .text();
            answer = chatModel.generate(prompt);
        } catch (RuntimeException e) {
            throw new MetadataExtractionException("Errore durante l'estrazione dei metadati: " + e.getMessage(), e);
        }
        DocumentMetadata metadata = parse(answer);
        log.debug("Metadati estratti: titolo='{}', {} autori, anno={}",
                metadata.title(), metadata.authors().size(), metadata.year());
        return metadata;
    }

    DocumentMetadata parse(String answer) {
        if (answer == null || answer.isBlank()) {
            throw new MetadataExtractionException("Risposta vuota dal modello");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(answer.strip()));
        } catch (JsonProcessingException e) {
            throw new MetadataExtractionException("Risposta del modello non in formato JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MetadataExtractionException("La risposta del modello non è un oggetto JSON");
        }

        String title = text(field(root, "title"));
        List<String> authors = authors(field(root, "authors"));
        String year = text(field(root, "year"));
        String citation = text(field(root, "citation"));
        if (title == null && authors.isEmpty() && year == null && citation == null) {
            throw new MetadataExtractionException("Nessun metadato riconosciuto nella risposta del modello");
        }
        return new DocumentMetadata(title, authors, year, citation);
    }

    private static String stripCodeFence(String answer) {
        Matcher m = CODE_FENCE.matcher(answer);
        return m.matches() ? m.group(1) : answer;
    }

    private static JsonNode field(JsonNode root, String name) {
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        String value = node.asText().strip();
        return value.isEmpty() ? null : value;
    }

    private static List<String> authors(JsonNode node) {
        List<String> authors = new ArrayList<>();
        if (node == null || node.isNull()) return authors;
        if (node.isArray()) {
            for (JsonNode a : node) {
                String name = text(a);
                if (name != null) authors.add(name);
            }
        } else {
            String name = text(node);
            if (name != null) authors.add(name);
        }
        return authors;
    }
}
