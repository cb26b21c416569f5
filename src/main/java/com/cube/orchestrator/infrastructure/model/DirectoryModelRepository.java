package com.cube.orchestrator.infrastructure.model;

import com.cube.orchestrator.domain.hook.RepositoryFactory;
import com.cube.orchestrator.domain.model.ModelFile;
import com.cube.orchestrator.domain.model.RequestContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default repository: every regular file under one directory, for all tenants.
 */
@Slf4j
public class DirectoryModelRepository implements RepositoryFactory {

    private final Path root;

    public DirectoryModelRepository(Path root) {
        this.root = root;
    }

    @Override
    public CompletionStage<List<ModelFile>> modelFiles(RequestContext context) {
        if (!Files.isDirectory(root)) {
            log.warn("Model directory {} does not exist, compiling an empty data model", root.toAbsolutePath());
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<ModelFile> files = paths
                    .filter(Files::isRegularFile)
                    .sorted()
                    .map(this::read)
                    .collect(Collectors.toList());
            return CompletableFuture.completedFuture(files);
        } catch (IOException | UncheckedIOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ModelFile read(Path path) {
        try {
            String name = root.relativize(path).toString().replace('\\', '/');
            return new ModelFile(name, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model file " + path, e);
        }
    }
}
