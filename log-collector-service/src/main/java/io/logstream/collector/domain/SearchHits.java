package io.logstream.collector.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

public record SearchHits(long totalHits, Map<String, Map<String, Long>> facets, List<JsonNode> hits) {

  public SearchHits {
    facets = facets == null ? Map.of() : facets;
    hits = hits == null ? List.of() : List.copyOf(hits);
  }
}
