package com.purchasingpower.codegraph.service.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.IndexingProperties;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import com.purchasingpower.codegraph.exception.RepositoryDownloadException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.service.RepositorySource;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JGit-backed repository source. Remote URLs are shallow-cloned into
 * {@code app.indexing.workspace-dir}; local directories are used in place.
 */
@Slf4j
@Service
public class GitRepositorySource implements RepositorySource {

    private final IndexingProperties indexing;

    public GitRepositorySource(AppProperties props) {
        this.indexing = props.getIndexing();
    }

    @Override
    public Path download(String url) {
        if (url == null || url.isBlank()) {
            throw new RepositoryDownloadException("Repository URL is required");
        }

        if (isLocalPath(url)) {
            Path local = Path.of(url);
            if (!Files.isDirectory(local)) {
                throw new RepositoryDownloadException("Local repository path does not exist: " + url);
            }
            log.info("📁 Using local repository at {}", local);
            return local;
        }

        File destination = new File(indexing.getWorkspaceDir(), UUID.randomUUID().toString());
        destination.mkdirs();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GIT, "clone", log);
        ctx.logRequest(url, "Destination", destination.getName());
        try (Git git = Git.cloneRepository()
                .setURI(url)
                .setDirectory(destination)
                .setDepth(1)
                .call()) {
            ctx.logResponse("Cloned branch " + git.getRepository().getBranch());
            return destination.toPath();
        } catch (Exception e) {
            ctx.logError("Git clone failed. Cleaning up workspace...", e);
            FileSystemUtils.deleteRecursively(destination);
            throw new RepositoryDownloadException("Git clone failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Path> listSourceFiles(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(root.relativize(p)))
                    .filter(p -> hasSourceExtension(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CodeGraphException("Failed to walk directory: " + root, e);
        }
    }

    @Override
    public String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CodeGraphException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void cleanup(Path root) {
        if (root == null) {
            return;
        }
        Path workspace = Path.of(indexing.getWorkspaceDir()).toAbsolutePath().normalize();
        if (root.toAbsolutePath().normalize().startsWith(workspace)) {
            FileSystemUtils.deleteRecursively(root.toFile());
            log.debug("🧹 Removed workspace {}", root);
        }
    }

    private boolean isLocalPath(String url) {
        return !url.startsWith("http://") && !url.startsWith("https://") && !url.startsWith("git@")
                && !url.startsWith("ssh://");
    }

    private boolean isExcluded(Path relative) {
        for (Path segment : relative) {
            if (indexing.getExcludedDirectories().contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    private boolean hasSourceExtension(String fileName) {
        return indexing.getSourceExtensions().stream().anyMatch(fileName::endsWith);
    }
}
