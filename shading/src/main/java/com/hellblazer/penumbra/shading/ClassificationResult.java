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
 * The classification of one window.
 *
 * @param classification the obstruction class
 * @param fsh            reduction factor from the NEN 5060 tables, 1.0 when unshaded or unknown
 * @param orientation    compass sector the window faces
 * @param hoRatio        obstruction ratio used for the table lookup, within [0, 2]
 * @param contextAngle   aggregated elevation of the surrounding context in degrees
 * @param shadingAngle   lowest elevation blocked by the shading device, 90 when open
 * @param contextBlocked degrees of sky blocked from the horizon up
 * @param shadingBlocked degrees of sky blocked from the zenith down
 * @param dominant       the factor that decided the classification
 * @param errorMessage   why the window could not be analysed, null unless the classification is an error
 * @author hal.hildebrand
 */
public record ClassificationResult(Classification classification, double fsh, Orientation orientation, double hoRatio,
                                   double contextAngle, double shadingAngle, double contextBlocked,
                                   double shadingBlocked, DominantFactor dominant, String errorMessage) {

    public static ClassificationResult error(String message) {
        return new ClassificationResult(Classification.ERROR, 1.0, Orientation.UNKNOWN, 0.0, 0.0, 90.0, 0.0, 0.0,
                                        DominantFactor.ERROR, message);
    }

    public boolean isError() {
        return classification == Classification.ERROR;
    }
}
