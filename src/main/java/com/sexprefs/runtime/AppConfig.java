package com.sexprefs.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private SearchConfig search = new SearchConfig();

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int progressInterval = 10;
        private int parallelism = 1;
        private boolean skipMalformedFiles = false;
        private List<String> extensions = List.of(".el", ".el.gz");
        private List<String> excludedDirectories = List.of(".git", ".cask", ".eldev");

        public int getProgressInterval() {
            return progressInterval;
        }

        public void setProgressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public boolean isSkipMalformedFiles() {
            return skipMalformedFiles;
        }

        public void setSkipMalformedFiles(boolean skipMalformedFiles) {
            this.skipMalformedFiles = skipMalformedFiles;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null ? List.of(".el", ".el.gz") : List.copyOf(extensions);
        }

        public List<String> getExcludedDirectories() {
            return excludedDirectories;
        }

        public void setExcludedDirectories(List<String> excludedDirectories) {
            this.excludedDirectories = excludedDirectories == null ? List.of() : List.copyOf(excludedDirectories);
        }

        public void validate() {
            if (progressInterval < 1) {
                throw new IllegalArgumentException("search.progressInterval must be at least 1, was " + progressInterval);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("search.parallelism must be at least 1, was " + parallelism);
            }
            if (extensions.isEmpty()) {
                throw new IllegalArgumentException("search.extensions must not be empty");
            }
        }
    }
}
