package com.chunkr.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import okhttp3.HttpUrl;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private static final Set<String> DISTANCES = Set.of("Cosine", "Dot", "Euclid", "Manhattan");
    private static final Set<String> PROVIDERS = Set.of("ollama", "openai");

    private LoggingConfig logging = new LoggingConfig();
    private PathsConfig paths = new PathsConfig();
    private InsertConfig insert = new InsertConfig();

    public LoggingConfig getLogging() {
        return logging;
    }

    public void setLogging(LoggingConfig logging) {
        this.logging = logging == null ? new LoggingConfig() : logging;
    }

    public PathsConfig getPaths() {
        return paths;
    }

    public void setPaths(PathsConfig paths) {
        this.paths = paths == null ? new PathsConfig() : paths;
    }

    public InsertConfig getInsert() {
        return insert;
    }

    public void setInsert(InsertConfig insert) {
        this.insert = insert == null ? new InsertConfig() : insert;
    }

    /**
     * Checks every field the insertion pipeline depends on and reports all problems at once.
     *
     * @throws ConfigurationException when at least one field is missing or out of range
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        requireText(problems, "paths.chunkRoot", paths.getChunkRoot());
        requireText(problems, "paths.stateDir", paths.getStateDir());

        requirePositive(problems, "insert.batchSize", insert.getBatchSize());
        requireNonNegative(problems, "insert.retryMax", insert.getRetryMax());
        requireNonNegative(problems, "insert.retryBackoffMs", insert.getRetryBackoffMs());
        requireNonNegative(problems, "insert.maxBackoffMs", insert.getMaxBackoffMs());
        requirePositive(problems, "insert.maxParallelFiles", insert.getMaxParallelFiles());

        QdrantConfig qdrant = insert.getQdrant();
        requireUrl(problems, "insert.qdrant.url", qdrant.getUrl());
        requireText(problems, "insert.qdrant.collection", qdrant.getCollection());
        requirePositive(problems, "insert.qdrant.vectorSize", qdrant.getVectorSize());
        requirePositive(problems, "insert.qdrant.requestTimeoutSeconds", qdrant.getRequestTimeoutSeconds());
        if (!DISTANCES.contains(qdrant.getDistance())) {
            problems.add("insert.qdrant.distance must be one of " + DISTANCES + " but was " + qdrant.getDistance());
        }

        QuickwitConfig quickwit = insert.getQuickwit();
        requireUrl(problems, "insert.quickwit.url", quickwit.getUrl());
        requireText(problems, "insert.quickwit.indexId", quickwit.getIndexId());
        requirePositive(problems, "insert.quickwit.requestTimeoutSeconds", quickwit.getRequestTimeoutSeconds());
        requireNonNegative(problems, "insert.quickwit.commitTimeoutSeconds", quickwit.getCommitTimeoutSeconds());
        if (quickwit.getCommitMode() == null) {
            problems.add("insert.quickwit.commitMode is required");
        }

        EmbeddingsConfig embeddings = insert.getEmbeddings();
        requireUrl(problems, "insert.embeddings.baseUrl", embeddings.getBaseUrl());
        requireText(problems, "insert.embeddings.model", embeddings.getModel());
        if (embeddings.getProvider() == null
                || !PROVIDERS.contains(embeddings.getProvider().toLowerCase(Locale.ROOT))) {
            problems.add("insert.embeddings.provider must be one of " + PROVIDERS + " but was " + embeddings.getProvider());
        }
        requirePositive(problems, "insert.embeddings.requestTimeoutSeconds", embeddings.getRequestTimeoutSeconds());
        requirePositive(problems, "insert.embeddings.maxConcurrency", embeddings.getMaxConcurrency());
        requirePositive(problems, "insert.embeddings.maxInputChars", embeddings.getMaxInputChars());
        requirePositive(problems, "insert.embeddings.globalMaxConcurrency", embeddings.getGlobalMaxConcurrency());
        requirePositive(problems, "insert.embeddings.requestBatchSize", embeddings.getRequestBatchSize());
        requirePositive(problems, "insert.embeddings.cacheMaxEntries", embeddings.getCacheMaxEntries());

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private static void requireText(List<String> problems, String field, String value) {
        if (value == null || value.isBlank()) {
            problems.add(field + " is required");
        }
    }

    private static void requireUrl(List<String> problems, String field, String value) {
        if (value == null || value.isBlank()) {
            problems.add(field + " is required");
        } else if (HttpUrl.parse(value) == null) {
            problems.add(field + " must be an absolute http(s) URL but was " + value);
        }
    }

    private static void requirePositive(List<String> problems, String field, long value) {
        if (value <= 0) {
            problems.add(field + " must be > 0 but was " + value);
        }
    }

    private static void requireNonNegative(List<String> problems, String field, long value) {
        if (value < 0) {
            problems.add(field + " must be >= 0 but was " + value);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoggingConfig {
        private String level = "info";

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PathsConfig {
        private String chunkRoot = "data/chunked";
        private String stateDir = ".chunkr";

        public String getChunkRoot() {
            return chunkRoot;
        }

        public void setChunkRoot(String chunkRoot) {
            this.chunkRoot = chunkRoot;
        }

        public String getStateDir() {
            return stateDir;
        }

        public void setStateDir(String stateDir) {
            this.stateDir = stateDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InsertConfig {
        private int batchSize = 64;
        private int retryMax = 5;
        private long retryBackoffMs = 500;
        private long maxBackoffMs = 30000;
        private int maxParallelFiles = 2;
        private MetadataConfig metadata = new MetadataConfig();
        private QdrantConfig qdrant = new QdrantConfig();
        private QuickwitConfig quickwit = new QuickwitConfig();
        private EmbeddingsConfig embeddings = new EmbeddingsConfig();

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getRetryMax() {
            return retryMax;
        }

        public void setRetryMax(int retryMax) {
            this.retryMax = retryMax;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getMaxParallelFiles() {
            return maxParallelFiles;
        }

        public void setMaxParallelFiles(int maxParallelFiles) {
            this.maxParallelFiles = maxParallelFiles;
        }

        public MetadataConfig getMetadata() {
            return metadata;
        }

        public void setMetadata(MetadataConfig metadata) {
            this.metadata = metadata == null ? new MetadataConfig() : metadata;
        }

        public QdrantConfig getQdrant() {
            return qdrant;
        }

        public void setQdrant(QdrantConfig qdrant) {
            this.qdrant = qdrant == null ? new QdrantConfig() : qdrant;
        }

        public QuickwitConfig getQuickwit() {
            return quickwit;
        }

        public void setQuickwit(QuickwitConfig quickwit) {
            this.quickwit = quickwit == null ? new QuickwitConfig() : quickwit;
        }

        public EmbeddingsConfig getEmbeddings() {
            return embeddings;
        }

        public void setEmbeddings(EmbeddingsConfig embeddings) {
            this.embeddings = embeddings == null ? new EmbeddingsConfig() : embeddings;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetadataConfig {
        private boolean includeSourcePath = true;
        private boolean includeCalibreId = true;
        private boolean includeTitle = true;
        private boolean includeAuthors = true;
        private boolean includePublished = true;
        private boolean includeLanguage = true;

        public boolean isIncludeSourcePath() {
            return includeSourcePath;
        }

        public void setIncludeSourcePath(boolean includeSourcePath) {
            this.includeSourcePath = includeSourcePath;
        }

        public boolean isIncludeCalibreId() {
            return includeCalibreId;
        }

        public void setIncludeCalibreId(boolean includeCalibreId) {
            this.includeCalibreId = includeCalibreId;
        }

        public boolean isIncludeTitle() {
            return includeTitle;
        }

        public void setIncludeTitle(boolean includeTitle) {
            this.includeTitle = includeTitle;
        }

        public boolean isIncludeAuthors() {
            return includeAuthors;
        }

        public void setIncludeAuthors(boolean includeAuthors) {
            this.includeAuthors = includeAuthors;
        }

        public boolean isIncludePublished() {
            return includePublished;
        }

        public void setIncludePublished(boolean includePublished) {
            this.includePublished = includePublished;
        }

        public boolean isIncludeLanguage() {
            return includeLanguage;
        }

        public void setIncludeLanguage(boolean includeLanguage) {
            this.includeLanguage = includeLanguage;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QdrantConfig {
        private String url = "http://localhost:6333";
        private String collection = "chunks";
        private String distance = "Cosine";
        private int vectorSize = 768;
        private boolean createCollection = true;
        private String apiKey;
        private int requestTimeoutSeconds = 30;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public String getDistance() {
            return distance;
        }

        public void setDistance(String distance) {
            this.distance = distance;
        }

        public int getVectorSize() {
            return vectorSize;
        }

        public void setVectorSize(int vectorSize) {
            this.vectorSize = vectorSize;
        }

        public boolean isCreateCollection() {
            return createCollection;
        }

        public void setCreateCollection(boolean createCollection) {
            this.createCollection = createCollection;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }
    }

    public enum CommitMode {
        IMMEDIATE,
        DEFERRED
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuickwitConfig {
        private String url = "http://localhost:7280";
        private String indexId = "chunks";
        private CommitMode commitMode = CommitMode.IMMEDIATE;
        private int commitTimeoutSeconds = 30;
        private int requestTimeoutSeconds = 60;
        private boolean replaceExisting = true;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getIndexId() {
            return indexId;
        }

        public void setIndexId(String indexId) {
            this.indexId = indexId;
        }

        public CommitMode getCommitMode() {
            return commitMode;
        }

        public void setCommitMode(CommitMode commitMode) {
            this.commitMode = commitMode;
        }

        public int getCommitTimeoutSeconds() {
            return commitTimeoutSeconds;
        }

        public void setCommitTimeoutSeconds(int commitTimeoutSeconds) {
            this.commitTimeoutSeconds = commitTimeoutSeconds;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public boolean isReplaceExisting() {
            return replaceExisting;
        }

        public void setReplaceExisting(boolean replaceExisting) {
            this.replaceExisting = replaceExisting;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingsConfig {
        private String provider = "ollama";
        private String baseUrl = "http://localhost:11434";
        private String model = "nomic-embed-text";
        private String apiKey;
        private int requestTimeoutSeconds = 60;
        private int maxConcurrency = 4;
        private int maxInputChars = 8000;
        private int globalMaxConcurrency = 4;
        private int requestBatchSize = 16;
        private int cacheMaxEntries = 50000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getMaxInputChars() {
            return maxInputChars;
        }

        public void setMaxInputChars(int maxInputChars) {
            this.maxInputChars = maxInputChars;
        }

        public int getGlobalMaxConcurrency() {
            return globalMaxConcurrency;
        }

        public void setGlobalMaxConcurrency(int globalMaxConcurrency) {
            this.globalMaxConcurrency = globalMaxConcurrency;
        }

        public int getRequestBatchSize() {
            return requestBatchSize;
        }

        public void setRequestBatchSize(int requestBatchSize) {
            this.requestBatchSize = requestBatchSize;
        }

        public int getCacheMaxEntries() {
            return cacheMaxEntries;
        }

        public void setCacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
        }
    }
}
