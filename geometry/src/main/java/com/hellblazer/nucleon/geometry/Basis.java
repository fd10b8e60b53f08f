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

/**
 * The axis aligned planes a slice plot is drawn in.
 *
 * @author hal.hildebrand
 */
public enum Basis {
    XY(Axis.X, Axis.Y), XZ(Axis.X, Axis.Z), YZ(Axis.Y, Axis.Z);

    private final Axis first;
    private final Axis second;

    Basis(Axis first, Axis second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Resolve a basis from its tag, {@code "xy"}, {@code "xz"} or {@code "yz"}
     *
     * @throws IllegalArgumentException if the tag is not one of the three
     */
    public static Basis fromTag(String tag) {
        if (tag == null) {
            throw unknown(null);
        }
        return switch (tag) {
            case "xy" -> XY;
            case "xz" -> XZ;
            case "yz" -> YZ;
            default -> throw unknown(tag);
        };
    }

    private static IllegalArgumentException unknown(String tag) {
        return new IllegalArgumentException(
        "Unknown basis: \"" + tag + "\", must be one of \"xy\", \"xz\" or \"yz\"");
    }

    /**
     * @return the horizontal axis of the plane
     */
    public Axis first() {
        return first;
    }

    /**
     * @return the vertical axis of the plane
     */
    public Axis second() {
        return second;
    }

    public String tag() {
        return first.tag() + second.tag();
    }

    @Override
    public String toString() {
        return tag();
    }
}
