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

import javax.vecmath.Tuple3d;

/**
 * The three coordinate axes, tagged {@code x}, {@code y} and {@code z}.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X("x") {
        @Override
        public double of(Tuple3d t) {
            return t.x;
        }
    },
    Y("y") {
        @Override
        public double of(Tuple3d t) {
            return t.y;
        }
    },
    Z("z") {
        @Override
        public double of(Tuple3d t) {
            return t.z;
        }
    };

    private final String tag;

    Axis(String tag) {
        this.tag = tag;
    }

    /**
     * Resolve an axis from its tag. Only the exact lower case tags {@code "x"}, {@code "y"} and {@code "z"} are
     * recognized.
     *
     * @param tag the axis tag
     * @return the axis
     * @throws IllegalArgumentException if the tag is not one of the three axis tags
     */
    public static Axis fromTag(String tag) {
        if (tag == null) {
            throw unknown(null);
        }
        return switch (tag) {
            case "x" -> X;
            case "y" -> Y;
            case "z" -> Z;
            default -> throw unknown(tag);
        };
    }

    private static IllegalArgumentException unknown(String tag) {
        return new IllegalArgumentException("Unknown axis: \"" + tag + "\", must be one of \"x\", \"y\" or \"z\"");
    }

    /**
     * @return the component index of this axis, 0 for x through 2 for z
     */
    public int index() {
        return ordinal();
    }

    /**
     * Answer the component of the tuple along this axis
     */
    public abstract double of(Tuple3d t);

    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
