/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Nucleon.
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
package com.hellblazer.nucleon.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Argument checks shared by the geometry types. Failures are reported as {@link IllegalArgumentException}s naming the
 * offending argument and its value.
 *
 * @author hal.hildebrand
 */
public final class CheckValue {
    /** Upper bound meaning "no maximum length" */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final Logger log = LoggerFactory.getLogger(CheckValue.class);

    private CheckValue() {
    }

    /**
     * Ensure the array holds between {@code min} and {@code max} elements, inclusive
     *
     * @param name  the argument name used in the failure message
     * @param value the array to check
     * @param min   the minimum length
     * @param max   the maximum length, or {@link #UNBOUNDED}
     * @return the value, for chaining
     */
    public static double[] checkLength(String name, double[] value, int min, int max) {
        Objects.requireNonNull(value, name);
        checkLength(name, Arrays.toString(value), value.length, min, max);
        return value;
    }

    /**
     * Ensure the collection holds between {@code min} and {@code max} elements, inclusive
     *
     * @param name  the argument name used in the failure message
     * @param value the collection to check
     * @param min   the minimum length
     * @param max   the maximum length, or {@link #UNBOUNDED}
     * @return the value, for chaining
     */
    public static <C extends Collection<?>> C checkLength(String name, C value, int min, int max) {
        Objects.requireNonNull(value, name);
        checkLength(name, String.valueOf(value), value.size(), min, max);
        return value;
    }

    private static void checkLength(String name, String rendered, int length, int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("Invalid length range [" + min + ", " + max + "]");
        }
        if (length >= min && length <= max) {
            return;
        }
        String requirement;
        if (max == UNBOUNDED) {
            requirement = "at least of length \"" + min + "\"";
        } else if (min == max) {
            requirement = "of length \"" + min + "\"";
        } else {
            requirement = "of length between \"" + min + "\" and \"" + max + "\"";
        }
        log.debug("Rejecting {}: length {} outside [{}, {}]", name, length, min, max);
        throw new IllegalArgumentException(
        "Unable to set \"" + name + "\" to \"" + rendered + "\" since it must be " + requirement);
    }
}
