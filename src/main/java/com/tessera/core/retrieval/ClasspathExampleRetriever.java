package com.tessera.core.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tessera.core.config.TesseraProperties;
import com.tessera.core.llm.JsonResponseReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ranks a JSON example catalog by Jaccard overlap of word tokens (three letters or more).
 * The catalog is read once; a missing catalog yields no examples.
 */
@Component
public class ClasspathExampleRetriever implements ExampleRetriever {

    private static final Logger log = LoggerFactory.getLogger(ClasspathExampleRetriever.class);

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private final List<ActivityExample> catalog;
    private final List<Set<String>> catalogTokens;

    @Autowired
    public ClasspathExampleRetriever(ResourceLoader resourceLoader, TesseraProperties properties,
                                     JsonResponseReader reader) {
        this(load(resourceLoader.getResource(properties.getExamples().getLocation()), reader));
    }

    public ClasspathExampleRetriever(List<ActivityExample> catalog) {
        this.catalog = List.copyOf(catalog);
        this.catalogTokens = new ArrayList<>();
        for (var example : this.catalog) {
            catalogTokens.add(tokens(example.title() + " " + example.description() + " "
                    + String.join(" ", example.tags())));
        }
    }

    @Override
    public List<RankedExample> findSimilar(String text, int k) {
        if (k <= 0 || text == null || text.isBlank() || catalog.isEmpty()) {
            return List.of();
        }
        Set<String> query = tokens(text);
        if (query.isEmpty()) {
            return List.of();
        }
        var ranked = new ArrayList<RankedExample>();
        for (int i = 0; i < catalog.size(); i++) {
            double score = jaccard(query, catalogTokens.get(i));
            if (score > 0) {
                ranked.add(new RankedExample(catalog.get(i), score));
            }
        }
        ranked.sort(Comparator.comparingDouble(RankedExample::score).reversed());
        List<RankedExample> top = ranked.subList(0, Math.min(k, ranked.size()));
        log.debug("Example retrieval: {} candidates, returning {}", ranked.size(), top.size());
        return List.copyOf(top);
    }

    public int size() {
        return catalog.size();
    }

    static Set<String> tokens(String text) {
        var out = new HashSet<String>();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            if (m.group().length() >= MIN_TOKEN_LENGTH) {
                out.add(m.group());
            }
        }
        return out;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : a) {
            if (b.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    private static List<ActivityExample> load(Resource resource, JsonResponseReader reader) {
        if (!resource.exists()) {
            log.warn("Example catalog {} not found, retrieval disabled", resource.getDescription());
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<ActivityExample> examples = reader.mapper().readValue(in, new TypeReference<List<ActivityExample>>() {});
            log.info("Loaded {} activity examples from {}", examples.size(), resource.getDescription());
            return examples;
        } catch (IOException e) {
            log.warn("Could not read example catalog {}: {}", resource.getDescription(), e.getMessage());
            return List.of();
        }
    }
}
