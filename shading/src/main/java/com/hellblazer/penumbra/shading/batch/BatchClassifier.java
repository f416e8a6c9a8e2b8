/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Penumbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.penumbra.shading.batch;

import com.hellblazer.penumbra.geometry.MeshConversionException;
import com.hellblazer.penumbra.geometry.MeshSource;
import com.hellblazer.penumbra.geometry.TriangleMesh;
import com.hellblazer.penumbra.shading.ClassificationResult;
import com.hellblazer.penumbra.shading.ClassifierConfiguration;
import com.hellblazer.penumbra.shading.ContextSet;
import com.hellblazer.penumbra.shading.MeshProperties;
import com.hellblazer.penumbra.shading.WindowClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Classifies many windows against a shared context in parallel.
 * <p>
 * The context is converted once per batch and the ray direction cache is warmed for every distinct window normal
 * before dispatch, so workers only read shared state. Every requested window gets a result at its own index; windows
 * that fail become error results without affecting the rest of the batch.
 *
 * @author hal.hildebrand
 */
public class BatchClassifier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchClassifier.class);

    private final WindowClassifier classifier;
    private final ExecutorService  executor;
    private final boolean          ownsExecutor;
    private volatile boolean       closed;

    public BatchClassifier() {
        this(ClassifierConfiguration.defaults());
    }

    public BatchClassifier(ClassifierConfiguration configuration) {
        this(new WindowClassifier(configuration), Executors.newFixedThreadPool(configuration.getWorkerThreads()),
             true);
    }

    /**
     * Use the caller's executor; it is left running on close
     */
    public BatchClassifier(WindowClassifier classifier, ExecutorService executor) {
        this(classifier, executor, false);
    }

    private BatchClassifier(WindowClassifier classifier, ExecutorService executor, boolean ownsExecutor) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * @throws IllegalArgumentException if the request month is not within [1, 12]
     * @throws IllegalStateException    if the classifier has been closed
     */
    public BatchResult classify(BatchRequest request) {
        Objects.requireNonNull(request, "request");
        if (closed) {
            throw new IllegalStateException("Batch classifier is closed");
        }
        var month = WindowClassifier.toMonth(request.month());
        var mode = request.mode() != null ? request.mode() : classifier.getConfiguration().getCalculationMode();
        long start = System.nanoTime();

        var context = ContextSet.build(request.context());

        int windowCount = request.windows().size();
        var meshes = new ArrayList<TriangleMesh>(windowCount);
        var conversionErrors = new ArrayList<String>(windowCount);
        var normals = new ArrayList<Vector3d>();
        for (var source : request.windows()) {
            var converted = convert(source);
            meshes.add(converted.mesh);
            conversionErrors.add(converted.error);
            if (converted.mesh != null) {
                MeshProperties.of(converted.mesh).ifPresent(p -> normals.add(p.normal()));
            }
        }
        classifier.getDirectionCache().prewarm(normals);

        var futures = new ArrayList<CompletableFuture<ClassificationResult>>(windowCount);
        int shadingCount = 0;
        for (int i = 0; i < windowCount; i++) {
            if (meshes.get(i) == null) {
                futures.add(CompletableFuture.completedFuture(ClassificationResult.error(conversionErrors.get(i))));
                continue;
            }
            var mesh = meshes.get(i);
            var shading = request.shadingFor(i);
            if (shading != null) {
                shadingCount++;
            }
            final int index = i;
            futures.add(
            CompletableFuture.supplyAsync(() -> classifier.classify(mesh, shading, context, month, mode), executor)
                             .exceptionally(e -> {
                                 log.warn("Window {} failed", index, e);
                                 return ClassificationResult.error("Classification failed: " + e.getMessage());
                             }));
        }

        var results = collect(futures);
        var batch = new BatchResult(results, context.size(), context.getSkippedCount(), shadingCount, month, mode);
        log.info("Classified {} windows for {} ({}) in {} ms: {}, {} context items, {} skipped", windowCount, month,
                 mode, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), batch.countsByClassification(),
                 context.size(), context.getSkippedCount());
        return batch;
    }

    private List<ClassificationResult> collect(List<CompletableFuture<ClassificationResult>> futures) {
        var results = new ArrayList<ClassificationResult>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted, abandoning {} remaining windows", futures.size() - i);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    results.add(ClassificationResult.error("Interrupted"));
                }
                break;
            } catch (ExecutionException e) {
                results.add(ClassificationResult.error("Classification failed: " + e.getCause()));
            }
        }
        return results;
    }

    private record Converted(TriangleMesh mesh, String error) {
    }

    private static Converted convert(MeshSource source) {
        if (source == null) {
            return new Converted(null, "No window mesh");
        }
        try {
            var mesh = source.toTriangleMesh();
            return mesh == null ? new Converted(null, "Invalid window mesh") : new Converted(mesh, null);
        } catch (MeshConversionException e) {
            log.warn("Window mesh could not be converted: {}", e.getMessage());
            return new Converted(null, "Mesh conversion failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Window mesh could not be converted", e);
            return new Converted(null, "Mesh conversion failed: " + e);
        }
    }

    /**
     * Shut down the executor if this classifier created it
     */
    @Override
    public void close() {
        closed = true;
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
