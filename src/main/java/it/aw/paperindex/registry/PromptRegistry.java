package it.aw.paperindex.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro dei template di prompt, organizzati per categoria in liste indicizzate
 * e persistiti in un file YAML:
 * <pre>
 * document_metadata:
 *   - template: "..."
 * </pre>
 * All'avvio carica il file configurato; se non esiste parte dal file {@code prompts.yaml}
 * del classpath e, in mancanza anche di quello, da una categoria {@code document_metadata} vuota.
 * Ogni modifica riscrive il file. L'accesso è sincronizzato.
 */
@Component
public class PromptRegistry {

    private static final Logger log = LoggerFactory.getLogger(PromptRegistry.class);

    public static final String DOCUMENT_METADATA = "document_metadata";

    private static final String CLASSPATH_PROMPTS = "prompts.yaml";

    private static final TypeReference<LinkedHashMap<String, List<PromptEntry>>> PROMPTS_TYPE =
            new TypeReference<>() {};

    /** Singolo template memorizzato. */
    public record PromptEntry(String template) {}

    private final Path path;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private Map<String, List<PromptEntry>> prompts = new LinkedHashMap<>();

    public PromptRegistry(@Value("${prompts.file}") String promptsFile) {
        this.path = Paths.get(promptsFile);
    }

    @PostConstruct
    synchronized void init() throws IOException {
        Map<String, List<PromptEntry>> loaded = null;
        if (Files.exists(path)) {
            loaded = yaml.readValue(path.toFile(), PROMPTS_TYPE);
            log.info("PromptRegistry: template caricati da {}", path.toAbsolutePath());
        } else {
            ClassPathResource resource = new ClassPathResource(CLASSPATH_PROMPTS);
            if (resource.exists()) {
                try (InputStream is = resource.getInputStream()) {
                    loaded = yaml.readValue(is, PROMPTS_TYPE);
                }
                log.info("PromptRegistry: file {} non trovato, uso i template del classpath", path.toAbsolutePath());
            }
        }
        prompts = new LinkedHashMap<>();
        if (loaded != null) {
            loaded.forEach((category, entries) ->
                    prompts.put(category, entries == null ? new ArrayList<>() : new ArrayList<>(entries)));
        }
        prompts.putIfAbsent(DOCUMENT_METADATA, new ArrayList<>());
    }

    public synchronized List<String> list(String category) {
        return prompts.getOrDefault(category, List.of()).stream()
                .map(PromptEntry::template)
                .toList();
    }

    public synchronized Optional<String> get(String category, int index) {
        List<PromptEntry> entries = prompts.get(category);
        if (entries == null || index < 0 || index >= entries.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(index).template());
    }

    public synchronized void add(String category, String template) throws IOException {
        prompts.computeIfAbsent(category, c -> new ArrayList<>()).add(new PromptEntry(template));
        save();
        log.info("Prompt aggiunto alla categoria '{}'", category);
    }

    public synchronized void edit(String category, int index, String template) throws IOException {
        entriesFor(category, index).set(index, new PromptEntry(template));
        save();
        log.info("Prompt {} della categoria '{}' modificato", index, category);
    }

    public synchronized void delete(String category, int index) throws IOException {
        entriesFor(category, index).remove(index);
        save();
        log.info("Prompt {} rimosso dalla categoria '{}'", index, category);
    }

    private List<PromptEntry> entriesFor(String category, int index) {
        List<PromptEntry> entries = prompts.get(category);
        if (entries == null || index < 0 || index >= entries.size()) {
            throw new IllegalArgumentException(
                    "Nessun prompt all'indice " + index + " nella categoria '" + category + "'");
        }
        return entries;
    }

    private void save() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        yaml.writeValue(path.toFile(), prompts);
    }
}
