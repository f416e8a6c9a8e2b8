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
package com.hellblazer.penumbra.shading;

import com.hellblazer.penumbra.geometry.MeshConversionException;
import com.hellblazer.penumbra.geometry.MeshSource;
import com.hellblazer.penumbra.geometry.TriangleMesh;
import com.hellblazer.penumbra.shading.fsh.CalculationMode;
import com.hellblazer.penumbra.shading.fsh.FshTableLookup;
import com.hellblazer.penumbra.shading.fsh.FshTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Month;
import java.util.List;
import java.util.Objects;

/**
 * Classifies single windows against their shading device and the surrounding context, and looks up the NEN 5060
 * reduction factor.
 * <p>
 * Instances hold no per window state and may be shared by concurrent workers. A window that cannot be analysed yields
 * an {@link Classification#ERROR} result instead of an exception; only structural argument errors such as a null
 * context set or an invalid month are thrown.
 *
 * @author hal.hildebrand
 */
public class WindowClassifier {

    private static final Logger log = LoggerFactory.getLogger(WindowClassifier.class);

    private final ClassifierConfiguration configuration;
    private final FshTables               tables;
    private final RayDirectionCache       directionCache;
    private final SamplePointGenerator    sampler;
    private final ContextPrefilter        prefilter;
    private final ContextRayCaster        contextCaster;
    private final ShadingRayCaster        shadingCaster;
    private final ClassificationDecision  decision;

    public WindowClassifier() {
        this(ClassifierConfiguration.defaults());
    }

    public WindowClassifier(ClassifierConfiguration configuration) {
        this(configuration, FshTables.standard(),
             new RayDirectionCache(configuration.getNormalQuantizationDigits()));
    }

    public WindowClassifier(ClassifierConfiguration configuration, FshTables tables,
                            RayDirectionCache directionCache) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.tables = Objects.requireNonNull(tables, "tables");
        this.directionCache = Objects.requireNonNull(directionCache, "directionCache");
        this.sampler = new SamplePointGenerator(configuration);
        this.prefilter = new ContextPrefilter(configuration);
        this.contextCaster = new ContextRayCaster(configuration);
        this.shadingCaster = new ShadingRayCaster(configuration);
        this.decision = new ClassificationDecision(configuration);
    }

    /**
     * Validate a month number
     *
     * @throws IllegalArgumentException unless 1 <= month <= 12
     */
    public static Month toMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be within [1, 12]: " + month);
        }
        return Month.of(month);
    }

    public ClassifierConfiguration getConfiguration() {
        return configuration;
    }

    public RayDirectionCache getDirectionCache() {
        return directionCache;
    }

    /**
     * Classify a window against a raw context list, converting the context for this call only
     */
    public ClassificationResult classify(MeshSource window, MeshSource shading, List<? extends MeshSource> context,
                                         int month) {
        return classify(window, shading, ContextSet.build(context), toMonth(month));
    }

    public ClassificationResult classify(MeshSource window, MeshSource shading, ContextSet context, int month) {
        return classify(window, shading, context, toMonth(month));
    }

    public ClassificationResult classify(MeshSource window, MeshSource shading, ContextSet context, Month month) {
        return classify(window, shading, context, month, configuration.getCalculationMode());
    }

    /**
     * @param window  the window surface
     * @param shading the attached shading device, or null
     * @param context the surrounding obstructions of the batch
     * @param month   month to look the reduction factor up for
     * @param mode    calculation the reduction factor is for
     */
    public ClassificationResult classify(MeshSource window, MeshSource shading, ContextSet context, Month month,
                                         CalculationMode mode) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(month, "month");
        Objects.requireNonNull(mode, "mode");
        if (window == null) {
            return ClassificationResult.error("No window mesh");
        }
        try {
            return analyse(window, shading, context, month, mode);
        } catch (MeshConversionException e) {
            log.warn("Window mesh could not be converted: {}", e.getMessage());
            return ClassificationResult.error("Mesh conversion failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Window classification failed", e);
            return ClassificationResult.error("Classification failed: " + e);
        }
    }

    private ClassificationResult analyse(MeshSource windowSource, MeshSource shadingSource, ContextSet context,
                                         Month month, CalculationMode mode) throws MeshConversionException {
        var window = WindowRecord.of(windowSource.toTriangleMesh()).orElse(null);
        if (window == null) {
            log.debug("Window mesh has no usable surface");
            return ClassificationResult.error("Invalid window mesh");
        }
        TriangleMesh shading = shadingSource == null ? null : shadingSource.toTriangleMesh();
        boolean shadingPresent = shading != null && shading.getTriangleCount() > 0;

        var samples = sampler.generate(window.bounds(), window.normal());
        var directions = directionCache.get(window.normal());
        var relevant = prefilter.filter(context.getItems(), window);
        double contextAngle = contextCaster.cast(samples, directions, relevant);

        var shadingResult = shadingCaster.cast(window, shading);
        var choice = decision.decide(contextAngle, shadingResult, shadingPresent);

        double fsh = new FshTableLookup(tables, mode).lookup(choice.classification(), window.orientation(), month,
                                                             choice.hoRatio());
        if (log.isDebugEnabled()) {
            log.debug("Window {} facing {}: {} of {} context items relevant, context {} deg, shading {} deg -> {} "
                      + "({}), ho {}, Fsh {}", window.center(), window.orientation(), relevant.size(), context.size(),
                      String.format("%.1f", contextAngle), shadingResult.elevation(), choice.classification(),
                      choice.dominant(), String.format("%.3f", choice.hoRatio()), fsh);
        }
        return new ClassificationResult(choice.classification(), fsh, window.orientation(), choice.hoRatio(),
                                        contextAngle, shadingResult.elevation(), choice.contextBlocked(),
                                        choice.shadingBlocked(), choice.dominant(), null);
    }
}
