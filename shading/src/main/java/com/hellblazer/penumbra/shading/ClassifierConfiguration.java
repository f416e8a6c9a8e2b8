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

import com.hellblazer.penumbra.shading.fsh.CalculationMode;

import java.util.Objects;

/**
 * Configuration for window shading classification. Holds the distance windows, thresholds and sampling constants of
 * the NEN 5060 ray sampling procedure, plus the worker count used by batch classification.
 * <p>
 * Configure before handing the instance to a classifier; classifiers read it but never change it.
 *
 * @author hal.hildebrand
 */
public class ClassifierConfiguration {

    private double          significanceThreshold     = 20.0;
    private double          minRayDistance            = 0.05;
    private double          maxContextDistance        = 500.0;
    private double          maxShadingDistance        = 50.0;
    private double          sampleEdgeOffset          = 0.1;
    private double          sampleWidthFraction       = 0.35;
    private double          contextAverageWeight      = 0.7;
    private int             normalQuantizationDigits  = 4;
    private int             workerThreads             = Runtime.getRuntime().availableProcessors();
    private CalculationMode calculationMode           = CalculationMode.HEATING;

    /**
     * The standard NEN 5060 settings
     */
    public static ClassifierConfiguration defaults() {
        return new ClassifierConfiguration();
    }

    /**
     * Degrees of blocked sky above which an obstruction counts as significant
     */
    public double getSignificanceThreshold() {
        return significanceThreshold;
    }

    /**
     * Hits closer than this are treated as self intersection and ignored
     */
    public double getMinRayDistance() {
        return minRayDistance;
    }

    /**
     * Context hits at or beyond this distance are ignored; also the horizontal prefilter radius
     */
    public double getMaxContextDistance() {
        return maxContextDistance;
    }

    /**
     * Shading device hits at or beyond this distance are ignored
     */
    public double getMaxShadingDistance() {
        return maxShadingDistance;
    }

    /**
     * Vertical inset of the bottom and top sample rows from the window edges
     */
    public double getSampleEdgeOffset() {
        return sampleEdgeOffset;
    }

    /**
     * Horizontal offset of the outer bottom samples, as a fraction of window width
     */
    public double getSampleWidthFraction() {
        return sampleWidthFraction;
    }

    /**
     * Share of the weighted average in the aggregated context angle; the absolute maximum gets the remainder
     */
    public double getContextAverageWeight() {
        return contextAverageWeight;
    }

    /**
     * Decimal digits kept when normals are used as ray direction cache keys
     */
    public int getNormalQuantizationDigits() {
        return normalQuantizationDigits;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public CalculationMode getCalculationMode() {
        return calculationMode;
    }

    // Fluent API for configuration

    public ClassifierConfiguration withSignificanceThreshold(double degrees) {
        if (degrees < 0 || degrees > 90) {
            throw new IllegalArgumentException("Significance threshold must be within [0, 90]: " + degrees);
        }
        this.significanceThreshold = degrees;
        return this;
    }

    public ClassifierConfiguration withMinRayDistance(double distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("Minimum ray distance must not be negative: " + distance);
        }
        this.minRayDistance = distance;
        return this;
    }

    public ClassifierConfiguration withMaxContextDistance(double distance) {
        if (distance <= 0) {
            throw new IllegalArgumentException("Maximum context distance must be positive: " + distance);
        }
        this.maxContextDistance = distance;
        return this;
    }

    public ClassifierConfiguration withMaxShadingDistance(double distance) {
        if (distance <= 0) {
            throw new IllegalArgumentException("Maximum shading distance must be positive: " + distance);
        }
        this.maxShadingDistance = distance;
        return this;
    }

    public ClassifierConfiguration withSampleEdgeOffset(double offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Sample edge offset must not be negative: " + offset);
        }
        this.sampleEdgeOffset = offset;
        return this;
    }

    public ClassifierConfiguration withSampleWidthFraction(double fraction) {
        if (fraction < 0 || fraction > 0.5) {
            throw new IllegalArgumentException("Sample width fraction must be within [0, 0.5]: " + fraction);
        }
        this.sampleWidthFraction = fraction;
        return this;
    }

    public ClassifierConfiguration withContextAverageWeight(double weight) {
        if (weight < 0 || weight > 1) {
            throw new IllegalArgumentException("Context average weight must be within [0, 1]: " + weight);
        }
        this.contextAverageWeight = weight;
        return this;
    }

    public ClassifierConfiguration withNormalQuantizationDigits(int digits) {
        if (digits < 0 || digits > 12) {
            throw new IllegalArgumentException("Quantization digits must be within [0, 12]: " + digits);
        }
        this.normalQuantizationDigits = digits;
        return this;
    }

    public ClassifierConfiguration withWorkerThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Worker threads must be positive: " + threads);
        }
        this.workerThreads = threads;
        return this;
    }

    public ClassifierConfiguration withCalculationMode(CalculationMode mode) {
        this.calculationMode = Objects.requireNonNull(mode, "mode");
        return this;
    }

    @Override
    public String toString() {
        return String.format(
        "ClassifierConfiguration[threshold=%.1f, rayDistance=[%.2f, ctx %.1f / shd %.1f), offset=%.2f, width=%.2f, "
        + "ctxWeight=%.2f, digits=%d, threads=%d, mode=%s]", significanceThreshold, minRayDistance, maxContextDistance,
        maxShadingDistance, sampleEdgeOffset, sampleWidthFraction, contextAverageWeight, normalQuantizationDigits,
        workerThreads, calculationMode);
    }
}
