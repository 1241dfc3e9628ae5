package dev.autoresume.ai.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.autoresume.model.RankedRepository;
import dev.autoresume.model.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ranking of a fixed candidate set. A valid answer names every candidate
 * exactly once; the result is renumbered 1..N with equal ranks kept in
 * candidate order.
 */
public class RankingSchema implements OutputSchema<List<RankedRepository>> {

    private static final JsonNode SCHEMA = SchemaSupport.parse("""
            {
              "type": "object",
              "properties": {
                "ranked_repositories": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "rank": { "type": "integer", "description": "1 is the most relevant" },
                      "name": { "type": "string", "description": "Repository name exactly as listed" },
                      "rationale": { "type": "string", "description": "Why this repository fits the job" }
                    },
                    "required": ["rank", "name", "rationale"]
                  }
                }
              },
              "required": ["ranked_repositories"]
            }
            """);

    private final List<Repository> candidates;
    private final Map<String, Integer> exactIndex = new HashMap<>();
    private final Map<String, Integer> caseInsensitiveIndex = new HashMap<>();

    public RankingSchema(List<Repository> candidates) {
        this.candidates = List.copyOf(candidates);
        for (int i = 0; i < this.candidates.size(); i++) {
            String name = this.candidates.get(i).name();
            exactIndex.putIfAbsent(name, i);
            caseInsensitiveIndex.putIfAbsent(name.toLowerCase(Locale.ROOT), i);
        }
    }

    @Override
    public String name() {
        return "repository ranking";
    }

    @Override
    public JsonNode jsonSchema() {
        return SCHEMA;
    }

    @Override
    public List<RankedRepository> validate(JsonNode answer) {
        SchemaSupport.requireObject(answer, "answer");
        JsonNode entries = SchemaSupport.requireArray(answer, "ranked_repositories", "ranking");

        List<Entry> parsed = new ArrayList<>();
        Set<Integer> seen = new LinkedHashSet<>();
        int position = 0;
        for (JsonNode node : entries) {
            position++;
            String where = "ranking entry " + position;
            SchemaSupport.requireObject(node, where);
            String name = SchemaSupport.requireText(node, "name", where);
            Integer index = indexOf(name);
            if (index == null) {
                throw SchemaSupport.invalid("%s references unknown repository '%s'", where, name);
            }
            if (!seen.add(index)) {
                throw SchemaSupport.invalid("repository '%s' is ranked more than once", name);
            }
            JsonNode rank = node.get("rank");
            if (rank == null || !rank.canConvertToInt() || !rank.isIntegralNumber() || rank.asInt() < 1) {
                throw SchemaSupport.invalid("%s: 'rank' must be a positive integer", where);
            }
            String rationale = SchemaSupport.requireText(node, "rationale", where);
            parsed.add(new Entry(rank.asInt(), index, rationale));
        }

        if (seen.size() != candidates.size()) {
            List<String> missing = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                if (!seen.contains(i)) {
                    missing.add(candidates.get(i).name());
                }
            }
            throw SchemaSupport.invalid("ranking omits %d repositories: %s", missing.size(), String.join(", ", missing));
        }

        parsed.sort(Comparator.comparingInt(Entry::rank).thenComparingInt(Entry::inputIndex));
        List<RankedRepository> ranked = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            Entry entry = parsed.get(i);
            ranked.add(new RankedRepository(candidates.get(entry.inputIndex()), i + 1, entry.rationale()));
        }
        return List.copyOf(ranked);
    }

    private Integer indexOf(String name) {
        Integer index = exactIndex.get(name);
        return index != null ? index : caseInsensitiveIndex.get(name.toLowerCase(Locale.ROOT));
    }

    private record Entry(int rank, int inputIndex, String rationale) {
    }
}
