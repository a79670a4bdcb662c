package it.aw.paperindex.config;

import it.aw.paperindex.store.ContentAddressedStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Gestisce il ciclo di vita dell'indice configurato ({@code store.index.name}):
 * caricamento all'avvio se esiste un salvataggio, altrimenti partenza da indice vuoto;
 * salvataggio su disco allo shutdown dell'applicazione.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final ContentAddressedStore store;
    private final String indexName;

    public StoreLifecycle(ContentAddressedStore store,
                          @Value("${store.index.name:papers}") String indexName) {
        this.store = store;
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }

    @PostConstruct
    public void load() throws IOException {
        if (store.exists(indexName)) {
            store.load(indexName);
        } else {
            log.info("Indice '{}' non trovato, partenza da zero.", indexName);
        }
    }

    /** Salva l'indice configurato; gli errori di I/O si propagano al chiamante. */
    public void persist() throws IOException {
        store.save(indexName);
    }

    @PreDestroy
    public void save() {
        log.info("Shutdown: salvataggio indice '{}' su disco...", indexName);
        try {
            persist();
        } catch (IOException e) {
            log.error("Impossibile salvare l'indice '{}': {}", indexName, e.getMessage(), e);
        }
    }
}
