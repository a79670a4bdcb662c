package it.aw.paperindex.store;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedding deterministico per i test: frequenza delle lettere a-z più un contatore
 * per tutti gli altri caratteri.
 */
class CharacterEmbeddingModel implements EmbeddingModel {

    int embeddedTexts;

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        List<Embedding> embeddings = new ArrayList<>(segments.size());
        for (TextSegment segment : segments) {
            embeddings.add(Embedding.from(vector(segment.text())));
            embeddedTexts++;
        }
        return Response.from(embeddings);
    }

    static float[] vector(String text) {
        float[] v = new float[27];
        for (char c : text.toLowerCase().toCharArray()) {
            if (c >= 'a' && c <= 'z') v[c - 'a']++;
            else v[26]++;
        }
        return v;
    }
}
