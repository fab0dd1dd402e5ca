package knotwidth.cli;

import knotwidth.core.SearchOptions;

record CliOptions(String code, String file, boolean parallel, int parallelism, boolean json) {

  CliOptions {
    if (parallelism < 0) {
      throw new IllegalArgumentException("--parallelism must be non-negative");
    }
  }

  boolean hasCode() {
    return code != null && !code.isBlank();
  }

  boolean hasFile() {
    return file != null && !file.isBlank();
  }

  SearchOptions searchOptions() {
    return SearchOptions.normalize(new SearchOptions(parallel, parallelism));
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String code;
    private String file;
    private boolean parallel;
    private int parallelism;
    private boolean json;

    Builder code(String code) {
      this.code = code;
      return this;
    }

    Builder file(String file) {
      this.file = file;
      return this;
    }

    Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    CliOptions build(boolean allowInlineCode) {
      int sources = 0;
      if (code != null && !code.isBlank()) sources++;
      if (file != null && !file.isBlank()) sources++;
      if (!allowInlineCode && code != null) {
        throw new IllegalArgumentException("--code is not supported here; use --file");
      }
      if (sources == 0) {
        throw new IllegalArgumentException(
            allowInlineCode ? "Provide exactly one of --code or --file" : "Provide --file");
      }
      if (sources > 1) {
        throw new IllegalArgumentException("Provide at most one of --code or --file");
      }
      return new CliOptions(code, file, parallel, parallelism, json);
    }
  }
}
