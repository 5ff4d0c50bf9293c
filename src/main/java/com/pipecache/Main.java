package com.pipecache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pipecache.artifact.FileSystemArtifactLayer;
import com.pipecache.artifact.RemovalResult;
import com.pipecache.document.Document;
import com.pipecache.index.Artifact;
import com.pipecache.index.Selector;
import com.pipecache.runtime.AppConfig;
import com.pipecache.store.ArtifactStoreException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "pipecache",
        mixinStandardHelpOptions = true,
        version = "pipecache 0.1.0",
        description = "Content-addressed artifact store for document pipelines.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "pipecache.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--root", description = "Store root directory, overrides store.root from config")
    Path root;

    @Parameters(description = "Files to store in add mode")
    List<Path> files = new ArrayList<>();

    @Option(names = "--id", description = "Select by logical id (repeatable)")
    List<String> ids;

    @Option(names = "--hash", description = "Select by content hash (repeatable)")
    List<String> hashes;

    @Option(names = "--parent", description = "Select children of a content hash (repeatable)")
    List<String> parentHashes;

    @Option(names = "--tag", description = "Select by metadata value, key=value (repeatable)")
    Map<String, String> tags = new LinkedHashMap<>();

    @Option(names = "--tag-prefix", description = "Select by metadata prefix, key=prefix (repeatable)")
    Map<String, String> tagPrefixes = new LinkedHashMap<>();

    @Option(names = "--after", description = "Select artifacts stored after an ISO-8601 instant")
    Instant storedAfter;

    @Option(names = "--before", description = "Select artifacts stored before an ISO-8601 instant")
    Instant storedBefore;

    @Option(names = "--delete-payloads", description = "In remove mode, also delete payload files", defaultValue = "false")
    boolean deletePayloads;

    enum Mode {
        add,
        select,
        show,
        remove,
        gc,
        stats
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        AppConfig.StoreConfig storeConfig = config.getStore();
        Path storeRoot = root != null ? root : Path.of(storeConfig.getRoot());

        log.info("Starting pipecache in {} mode", mode);
        log.info("Store root={} writePolicy={} readMode={} fileLocking={}",
                storeRoot,
                storeConfig.getWritePolicy(),
                storeConfig.getReadMode(),
                storeConfig.isFileLocking());

        try {
            FileSystemArtifactLayer layer = new FileSystemArtifactLayer(
                    storeRoot,
                    storeConfig.getWritePolicy(),
                    storeConfig.getReadMode(),
                    storeConfig.isFileLocking());
            return switch (mode) {
                case add -> runAdd(layer);
                case select -> runSelect(layer);
                case show -> runShow(layer);
                case remove -> runRemove(layer);
                case gc -> {
                    int deleted = layer.collectGarbage();
                    log.info("Deleted {} orphaned payloads", deleted);
                    yield 0;
                }
                case stats -> {
                    log.info("Artifacts={} payloads={}",
                            layer.index().size(),
                            layer.contentStore().hashes().size());
                    yield 0;
                }
            };
        } catch (ArtifactStoreException e) {
            log.error("Store operation failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int runAdd(FileSystemArtifactLayer layer) throws IOException {
        if (files.isEmpty()) {
            log.error("at least one file is required in add mode");
            return 2;
        }
        List<Document> documents = new ArrayList<>();
        for (Path file : files) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", file.toAbsolutePath().normalize().toUri().toString());
            metadata.put("file_name", file.getFileName().toString());
            documents.add(Document.create(file.toString(), Files.readString(file, StandardCharsets.UTF_8), metadata));
        }
        List<Document> stored = layer.addMissing(documents);
        for (Document document : documents) {
            if (stored.contains(document)) {
                log.info("Stored id={} hash={}", document.logicalId(), document.hash());
            } else {
                log.info("Unchanged, already stored id={} hash={}", document.logicalId(), document.hash());
            }
        }
        return 0;
    }

    private int runSelect(FileSystemArtifactLayer layer) {
        Selector selector = buildSelector();
        if (selector.isEmpty()) {
            log.error("select mode needs at least one of --id, --hash, --parent, --tag, --tag-prefix, --after, --before");
            return 2;
        }
        List<String> matches = layer.index().select(selector).toList();
        for (int i = 0; i < matches.size(); i++) {
            Artifact artifact = layer.index().get(matches.get(i)).orElseThrow();
            log.info("Result #{} id={} hash={} parents={} storedAt={}",
                    i + 1,
                    artifact.logicalId(),
                    artifact.hash(),
                    artifact.parentHashes(),
                    artifact.storedAt().map(Instant::toString).orElse("unknown"));
        }
        log.info("Selected {} artifacts", matches.size());
        return 0;
    }

    private int runShow(FileSystemArtifactLayer layer) {
        if (hashes == null || hashes.isEmpty()) {
            log.error("--hash is required in show mode");
            return 2;
        }
        for (String hash : hashes) {
            Document document = layer.getDocument(hash);
            System.out.println(document.pageContent());
        }
        return 0;
    }

    private int runRemove(FileSystemArtifactLayer layer) {
        Selector selector = buildSelector();
        if (selector.isEmpty()) {
            log.error("remove mode needs at least one selector option");
            return 2;
        }
        RemovalResult result = layer.remove(selector, deletePayloads);
        log.info("Removed artifacts={} payloadsDeleted={}", result.artifactsRemoved(), result.payloadsDeleted());
        return 0;
    }

    Selector buildSelector() {
        Selector.Builder builder = Selector.builder()
                .ids(ids)
                .hashes(hashes)
                .parentHashes(parentHashes)
                .storedAfter(storedAfter)
                .storedBefore(storedBefore);
        tags.forEach(builder::metadataEquals);
        tagPrefixes.forEach(builder::metadataPrefix);
        return builder.build();
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
