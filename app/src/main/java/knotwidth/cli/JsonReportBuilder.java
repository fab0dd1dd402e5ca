package knotwidth.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import knotwidth.core.Crossing;
import knotwidth.core.KnotDiagram;
import knotwidth.core.Strand;
import knotwidth.core.StrandLabels;
import knotwidth.search.SearchResult;
import knotwidth.search.SearchRun;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String build(String name, SearchResult result) {
    return gson.toJson(report(name, result));
  }

  String buildBatch(List<Map<String, Object>> entries) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    root.put("results", entries);
    return gson.toJson(root);
  }

  Map<String, Object> report(String name, SearchResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    if (name != null) {
      root.put("name", name);
    }
    root.put("bound", result.value());
    root.put("strand_count", result.diagram().strandCount());
    root.put("crossing_count", result.diagram().crossingCount());
    root.put("strands", strands(result.diagram()));
    root.put("search", search(result.run()));
    return root;
  }

  Map<String, Object> failure(String name, String message) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("name", name);
    entry.put("error", message);
    return entry;
  }

  private List<Map<String, Object>> strands(KnotDiagram diagram) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (Strand strand : diagram.strands()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("label", strand.label());
      map.put("entries", strand.entries());
      List<List<String>> over = new ArrayList<>();
      for (Crossing crossing : diagram.crossingsOver(strand.index())) {
        String start = StrandLabels.label(crossing.startUnder());
        over.add(List.of(start, StrandLabels.label(crossing.endUnder())));
      }
      map.put("over", over);
      list.add(map);
    }
    return list;
  }

  private Map<String, Object> search(SearchRun run) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("seed_sets_examined", run.seedSetsExamined());
    map.put("multicolored_seed_sets", run.multicoloredSeedSets());
    map.put("extension_trials", run.extensionTrials());
    map.put("propagations", run.propagations());
    map.put("time_ms", run.elapsedMillis());
    int[] covering = run.coveringSeeds();
    if (covering != null) {
      List<String> labels = new ArrayList<>(covering.length);
      for (int seed : covering) {
        labels.add(StrandLabels.label(seed));
      }
      map.put("covering_seeds", labels);
    }
    return map;
  }
}
