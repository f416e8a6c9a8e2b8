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

import com.hellblazer.penumbra.geometry.TriangleMesh;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Single window classification cost against a growing number of context buildings.
 *
 * @author hal.hildebrand
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
@State(Scope.Benchmark)
public class WindowClassifierBenchmark {

    @Param({ "0", "10", "100" })
    private int buildings;

    private WindowClassifier classifier;
    private TriangleMesh     window;
    private TriangleMesh     overhang;
    private ContextSet       context;

    public static void main(String[] args) throws RunnerException {
        var options = new OptionsBuilder().include(WindowClassifierBenchmark.class.getSimpleName()).build();
        new Runner(options).run();
    }

    @Setup
    public void setup() {
        classifier = new WindowClassifier();
        window = TestMeshes.southWindow();
        overhang = TestMeshes.southOverhang();

        // Street of blocks south of the window
        var blocks = new ArrayList<TriangleMesh>();
        for (int i = 0; i < buildings; i++) {
            double x = (i % 10) * 25.0 - 125.0;
            double y = -20.0 - (i / 10) * 30.0;
            blocks.add(TestMeshes.box(x, y - 15, 0, x + 20, y, 10 + (i % 7) * 5));
        }
        context = ContextSet.build(blocks);
    }

    @Benchmark
    public ClassificationResult classifyWithOverhang() {
        return classifier.classify(window, overhang, context, 6);
    }

    @Benchmark
    public ClassificationResult classifyWithoutOverhang() {
        return classifier.classify(window, null, context, 6);
    }
}
