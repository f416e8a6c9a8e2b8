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

/**
 * Compares the sky blocked by context against the sky blocked by a shading device and picks the classification.
 * <p>
 * Context blocks from the horizon up to its angle; a device blocks from its angle up to the zenith. Either counts only
 * when it blocks more than the significance threshold, and a device ties in its own favour.
 *
 * @author hal.hildebrand
 */
public class ClassificationDecision {

    /**
     * The decision for one window
     */
    public record Decision(Classification classification, DominantFactor dominant, double hoRatio,
                           double contextBlocked, double shadingBlocked) {
    }

    private final double threshold;

    public ClassificationDecision(ClassifierConfiguration configuration) {
        this.threshold = configuration.getSignificanceThreshold();
    }

    public Decision decide(double contextAngle, ShadingResult shading, boolean shadingPresent) {
        double contextBlocked = contextAngle;
        double shadingBlocked = 90.0 - shading.elevation();

        boolean contextSignificant = contextBlocked > threshold;
        boolean shadingSignificant = shadingPresent && shadingBlocked > threshold;

        if (!contextSignificant && !shadingSignificant) {
            return new Decision(Classification.MINIMAL_OBSTRUCTION, DominantFactor.NEITHER, 0.0, contextBlocked,
                                shadingBlocked);
        }
        if (shadingSignificant && (!contextSignificant || shadingBlocked >= contextBlocked)) {
            return new Decision(Classification.OVERHANG, DominantFactor.SHADING, HoRatio.clamp(shading.hoRatio()),
                                contextBlocked, shadingBlocked);
        }
        return new Decision(Classification.CONTEXT_OBSTRUCTION, DominantFactor.CONTEXT,
                            HoRatio.fromElevation(contextAngle), contextBlocked, shadingBlocked);
    }
}
