package com.apexframe.core.discovery;

import com.apexframe.api.exception.ManifestValidationException;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.manifest.ManifestParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 扩展发现服务
 * <p>
 * 职责：
 * 1. 按顺序扫描配置的根目录，根目录内按名称顺序遍历子目录
 * 2. 并行解析与校验各目录的清单
 * 3. 按发现顺序合并结果：无效清单记为拒绝，重复 ID 保留先发现者
 * </p>
 * 单个目录的失败只记录日志，不会中断扫描。
 */
@Slf4j
@RequiredArgsConstructor
public class ExtensionDiscoveryService {

    private final List<Path> roots;
    private final Executor parseExecutor;

    public DiscoveryReport discover() {
        List<Path> candidates = new ArrayList<>();
        for (Path root : roots) {
            candidates.addAll(candidatesIn(root));
        }
        log.info("Starting extension discovery over {} roots, {} candidate directories", roots.size(), candidates.size());

        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        for (Path dir : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> parse(dir), parseExecutor));
        }

        List<DiscoveredExtension> accepted = new ArrayList<>();
        List<RejectedExtension> rejected = new ArrayList<>();
        List<DuplicateIdWarning> duplicates = new ArrayList<>();
        Map<String, DiscoveredExtension> byId = new LinkedHashMap<>();

        // join 按提交顺序进行，结果保持发现顺序
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome.rejected() != null) {
                rejected.add(outcome.rejected());
                continue;
            }
            if (outcome.accepted() == null) {
                continue;
            }
            DiscoveredExtension found = outcome.accepted();
            DiscoveredExtension kept = byId.get(found.id());
            if (kept != null) {
                DuplicateIdWarning warning = new DuplicateIdWarning(found.id(),
                        kept.manifest().getVersionString(), kept.directory(),
                        found.manifest().getVersionString(), found.directory());
                log.warn(warning.describe());
                duplicates.add(warning);
                continue;
            }
            byId.put(found.id(), found);
            accepted.add(found);
        }

        log.info("Extension discovery finished. Accepted: {}, rejected: {}, duplicates: {}",
                accepted.size(), rejected.size(), duplicates.size());
        return new DiscoveryReport(accepted, rejected, duplicates);
    }

    /**
     * 根目录自身含清单时即为扩展目录，否则取其子目录
     */
    static List<Path> candidatesIn(Path root) {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            log.warn("Extension root does not exist or is not a directory: {}", root.toAbsolutePath());
            return result;
        }
        if (!Files.isReadable(root)) {
            log.error("Extension root is not readable: {}", root.toAbsolutePath());
            return result;
        }
        if (ManifestParser.findManifest(root).isPresent()) {
            result.add(root);
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
            stream.forEach(result::add);
        } catch (IOException e) {
            log.error("Failed to list extension root {}", root.toAbsolutePath(), e);
        }
        result.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return result;
    }

    private Outcome parse(Path dir) {
        Optional<Path> manifestFile = ManifestParser.findManifest(dir);
        if (manifestFile.isEmpty()) {
            log.debug("Skipping {}: no manifest", dir);
            return new Outcome(null, null);
        }
        try {
            ExtensionManifest manifest = ManifestParser.parse(manifestFile.get());
            log.info("Discovered extension: {} v{} at {}", manifest.getId(), manifest.getVersionString(), dir);
            return new Outcome(new DiscoveredExtension(manifest, dir.toAbsolutePath().normalize()), null);
        } catch (ManifestValidationException e) {
            log.error("Rejected manifest {}: {}", manifestFile.get(), e.getProblems());
            return new Outcome(null, new RejectedExtension(dir, manifestFile.get(), e.getProblems()));
        } catch (RuntimeException e) {
            log.error("Failed to read manifest {}", manifestFile.get(), e);
            return new Outcome(null, new RejectedExtension(dir, manifestFile.get(), List.of(String.valueOf(e.getMessage()))));
        }
    }

    private record Outcome(DiscoveredExtension accepted, RejectedExtension rejected) {
    }
}
