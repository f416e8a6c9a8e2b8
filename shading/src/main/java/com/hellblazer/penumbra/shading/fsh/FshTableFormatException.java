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
package com.hellblazer.penumbra.shading.fsh;

import java.io.IOException;

/**
 * Reduction factor table data that does not have the expected shape or holds values outside [0, 1].
 *
 * @author hal.hildebrand
 */
public class FshTableFormatException extends IOException {

    public FshTableFormatException(String message) {
        super(message);
    }

    public FshTableFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
