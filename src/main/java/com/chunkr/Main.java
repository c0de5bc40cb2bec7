package com.chunkr;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chunkr.embed.EmbeddingCache;
import com.chunkr.embed.EmbeddingClient;
import com.chunkr.embed.EmbeddingProvider;
import com.chunkr.embed.EmbeddingProviders;
import com.chunkr.embed.InFlightEmbeddings;
import com.chunkr.ingest.ChunkFiles;
import com.chunkr.ingest.ChunkRecordParser;
import com.chunkr.ingest.JsonlChunkSource;
import com.chunkr.ingest.MetadataPolicy;
import com.chunkr.pipeline.FileReport;
import com.chunkr.pipeline.InsertPipeline;
import com.chunkr.pipeline.RunReport;
import com.chunkr.pipeline.RunStateStore;
import com.chunkr.retry.RetryPolicy;
import com.chunkr.retry.Sleeper;
import com.chunkr.runtime.AppConfig;
import com.chunkr.runtime.ConfigurationException;
import com.chunkr.runtime.LoggingConfigurator;
import com.chunkr.sink.DualSinkWriter;
import com.chunkr.sink.QdrantVectorStore;
import com.chunkr.sink.QuickwitSearchIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "chunkr",
        mixinStandardHelpOptions = true,
        version = "chunkr 0.1.0",
        description = "Embeds pre-chunked JSONL text and writes it to Qdrant and Quickwit.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ABANDONED = 1;
    static final int EXIT_CONFIG = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "insert")
    Mode mode;

    @Option(names = "--chunk-root", description = "Directory scanned for *.jsonl chunk files (overrides paths.chunkRoot)")
    Path chunkRoot;

    @Option(names = "--retry-abandoned", description = "Only re-submit the chunks recorded as abandoned by earlier runs", defaultValue = "false")
    boolean retryAbandoned;

    @Parameters(arity = "0..*", description = "Chunk files to insert instead of scanning the chunk root")
    List<Path> files = new ArrayList<>();

    private final OkHttpClient httpClient = new OkHttpClient();
    private final Sleeper sleeper;

    enum Mode {
        insert,
        check
    }

    public Main() {
        this(Sleeper.SYSTEM);
    }

    Main(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = loadConfig(Path.of(configPath));
            config.validate();
        } catch (IOException e) {
            log.error("config.unreadable path={} cause={}", configPath, e.getMessage());
            return EXIT_CONFIG;
        } catch (ConfigurationException e) {
            e.problems().forEach(problem -> log.error("config.invalid {}", problem));
            return EXIT_CONFIG;
        }
        LoggingConfigurator.apply(config.getLogging());
        log.info("Starting chunkr in {} mode", mode);
        log.info("Using config file: {}", configPath);

        AppConfig.InsertConfig insert = config.getInsert();
        RetryPolicy retryPolicy = new RetryPolicy(
                insert.getRetryMax(),
                Duration.ofMillis(insert.getRetryBackoffMs()),
                Duration.ofMillis(insert.getMaxBackoffMs()),
                cause -> true);
        DualSinkWriter writer;
        EmbeddingProvider provider;
        try {
            writer = new DualSinkWriter(
                    qdrant(insert.getQdrant()),
                    quickwit(insert.getQuickwit()),
                    new MetadataPolicy(insert.getMetadata()),
                    retryPolicy,
                    sleeper,
                    insert.getQdrant().getVectorSize(),
                    insert.getQuickwit().getCommitMode());
            provider = EmbeddingProviders.fromConfig(httpClient, insert.getEmbeddings());
        } catch (IllegalArgumentException e) {
            log.error("config.invalid {}", e.getMessage());
            return EXIT_CONFIG;
        }

        try {
            preflight(writer, provider, insert.getQdrant().isCreateCollection());
        } catch (ConfigurationException e) {
            log.error("preflight.failed cause={}", e.getMessage());
            return EXIT_CONFIG;
        }
        if (mode == Mode.check) {
            log.info("preflight.ok qdrant={} quickwit={} provider={}",
                    insert.getQdrant().getUrl(), insert.getQuickwit().getUrl(), provider.name());
            return EXIT_OK;
        }
        return runInsert(config, retryPolicy, writer, provider);
    }

    private int runInsert(AppConfig config, RetryPolicy retryPolicy, DualSinkWriter writer, EmbeddingProvider provider) {
        AppConfig.InsertConfig insert = config.getInsert();
        AppConfig.EmbeddingsConfig embeddings = insert.getEmbeddings();
        RunStateStore stateStore = new RunStateStore(Path.of(config.getPaths().getStateDir()));

        Map<String, List<String>> ledger;
        List<Path> targets;
        try {
            ledger = stateStore.loadLedger();
            targets = resolveTargets(config, ledger);
        } catch (IOException e) {
            log.error("insert.targets.unavailable cause={}", e.getMessage());
            return EXIT_CONFIG;
        }
        Map<String, Set<String>> onlyIds = new LinkedHashMap<>();
        if (retryAbandoned) {
            for (Path target : targets) {
                onlyIds.put(target.toString(), new LinkedHashSet<>(ledger.getOrDefault(target.toString(), List.of())));
            }
        }

        int maxParallelFiles = insert.getMaxParallelFiles();
        ExecutorService embedExecutor = Executors.newFixedThreadPool(maxParallelFiles * embeddings.getMaxConcurrency());
        ExecutorService sinkExecutor = Executors.newFixedThreadPool(maxParallelFiles * 2);
        EmbeddingClient embeddingClient = new EmbeddingClient(
                provider,
                new Semaphore(embeddings.getGlobalMaxConcurrency()),
                embedExecutor,
                retryPolicy,
                sleeper,
                embeddings.getRequestBatchSize(),
                embeddings.getMaxConcurrency(),
                embeddings.getMaxInputChars());
        ChunkRecordParser parser = new ChunkRecordParser();
        InsertPipeline pipeline = new InsertPipeline(
                new EmbeddingCache(embeddings.getCacheMaxEntries()),
                new InFlightEmbeddings(),
                embeddingClient,
                writer,
                path -> new JsonlChunkSource(path, parser),
                sinkExecutor,
                insert.getBatchSize(),
                maxParallelFiles);

        // a signal during the run waits for the report and ledger below, not only for the pipeline
        ShutdownGate gate = new ShutdownGate(pipeline::requestStop, Duration.ofMinutes(5));
        gate.register();
        try {
            RunReport report;
            try {
                report = pipeline.run(targets, onlyIds);
            } finally {
                embedExecutor.shutdown();
                sinkExecutor.shutdown();
            }
            return finishRun(stateStore, ledger, report);
        } finally {
            gate.release();
        }
    }

    private int finishRun(RunStateStore stateStore, Map<String, List<String>> ledger, RunReport report) {
        for (FileReport file : report.files()) {
            log.info("Report file={} status={} chunks={} malformed={} skipped={} cacheHits={} computed={} vectors={} documents={} abandoned={}",
                    file.path(), file.status(), file.chunksRead(), file.malformedRecords(), file.skippedRecords(),
                    file.cacheHits(), file.computed(), file.vectorsCommitted(), file.documentsCommitted(),
                    file.abandonedIds().size());
        }
        try {
            stateStore.saveReport(report);
            Map<String, List<String>> next = stateStore.updateLedger(ledger, report);
            log.info("Run state saved stateDir={} ledgerFiles={}", stateStore.stateDir(), next.size());
        } catch (IOException e) {
            log.error("Failed to save run state stateDir={} cause={}", stateStore.stateDir(), e.getMessage());
            return EXIT_ABANDONED;
        }
        return report.allCompleted() ? EXIT_OK : EXIT_ABANDONED;
    }

    private List<Path> resolveTargets(AppConfig config, Map<String, List<String>> ledger) throws IOException {
        List<Path> candidates;
        if (!files.isEmpty()) {
            candidates = files;
        } else if (retryAbandoned) {
            candidates = ledger.keySet().stream().map(Path::of).toList();
        } else {
            Path root = chunkRoot != null ? chunkRoot : Path.of(config.getPaths().getChunkRoot());
            candidates = ChunkFiles.discover(root);
        }
        if (!retryAbandoned) {
            return candidates;
        }
        List<Path> ledgered = candidates.stream().filter(path -> ledger.containsKey(path.toString())).toList();
        log.info("Retrying abandoned chunks files={} chunks={}", ledgered.size(),
                ledgered.stream().mapToInt(path -> ledger.get(path.toString()).size()).sum());
        return ledgered;
    }

    private void preflight(DualSinkWriter writer, EmbeddingProvider provider, boolean createCollection) {
        try {
            provider.checkReachable();
        } catch (IOException e) {
            throw new ConfigurationException("Embedding provider " + provider.name() + " unavailable: " + e.getMessage(), e);
        }
        try {
            writer.prepare(createCollection);
        } catch (IOException e) {
            throw new ConfigurationException("Sink unavailable: " + e.getMessage(), e);
        }
    }

    private QdrantVectorStore qdrant(AppConfig.QdrantConfig qdrant) {
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(qdrant.getRequestTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(qdrant.getRequestTimeoutSeconds()))
                .build();
        return new QdrantVectorStore(client, qdrant.getUrl(), qdrant.getCollection(), qdrant.getVectorSize(),
                qdrant.getDistance(), qdrant.getApiKey());
    }

    private QuickwitSearchIndex quickwit(AppConfig.QuickwitConfig quickwit) {
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(quickwit.getRequestTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(quickwit.getRequestTimeoutSeconds()))
                .build();
        return new QuickwitSearchIndex(client, quickwit.getUrl(), quickwit.getIndexId(),
                quickwit.getCommitTimeoutSeconds(), quickwit.isReplaceExisting());
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
