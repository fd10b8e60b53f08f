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

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable axis-aligned bounding box of a region, given by its lower left and upper right corners in [cm].
 * <p>
 * No ordering between the corners is enforced: a box may be expressed with swapped or coincident corners. The widths
 * and the volume are therefore reported as absolute values. Equality is by value, comparing both corners component by
 * component.
 * <p>
 * Corners are copied on the way in and on the way out, so instances may be freely shared between threads.
 *
 * @author hal.hildebrand
 */
public final class BoundingBox {
    private static final Logger log = LoggerFactory.getLogger(BoundingBox.class);

    private static final String LOWER_LEFT  = "lower_left";
    private static final String UPPER_RIGHT = "upper_right";

    private final Point3d lowerLeft;
    private final Point3d upperRight;

    /**
     * Create a box from its two corners
     *
     * @param lowerLeft  the x, y, z coordinates of the lower left corner
     * @param upperRight the x, y, z coordinates of the upper right corner
     */
    public BoundingBox(Tuple3d lowerLeft, Tuple3d upperRight) {
        this.lowerLeft = new Point3d(Objects.requireNonNull(lowerLeft, LOWER_LEFT));
        this.upperRight = new Point3d(Objects.requireNonNull(upperRight, UPPER_RIGHT));
    }

    /**
     * Create a box from its two corners
     *
     * @param lowerLeft  the x, y, z coordinates of the lower left corner
     * @param upperRight the x, y, z coordinates of the upper right corner
     * @throws IllegalArgumentException if either array does not have exactly 3 elements
     */
    public BoundingBox(double[] lowerLeft, double[] upperRight) {
        this(new Point3d(CheckValue.checkLength(LOWER_LEFT, lowerLeft, 3, 3)),
             new Point3d(CheckValue.checkLength(UPPER_RIGHT, upperRight, 3, 3)));
    }

    /**
     * Create a box from two sequences of coordinates
     *
     * @param lowerLeft  the x, y, z coordinates of the lower left corner
     * @param upperRight the x, y, z coordinates of the upper right corner
     * @throws IllegalArgumentException if either sequence does not have exactly 3 elements, or holds a null
     */
    public static BoundingBox of(Iterable<? extends Number> lowerLeft, Iterable<? extends Number> upperRight) {
        return new BoundingBox(toPoint(LOWER_LEFT, lowerLeft), toPoint(UPPER_RIGHT, upperRight));
    }

    /**
     * Answer the tightest box that holds every one of the points
     *
     * @throws IllegalArgumentException if there are no points
     */
    public static BoundingBox enclosing(Iterable<? extends Tuple3d> points) {
        var iterator = Objects.requireNonNull(points, "points").iterator();
        if (!iterator.hasNext()) {
            throw new IllegalArgumentException("Cannot bound an empty set of points");
        }
        var first = iterator.next();
        var min = new Point3d(first);
        var max = new Point3d(first);
        int count = 1;
        while (iterator.hasNext()) {
            var p = iterator.next();
            min.set(Math.min(min.x, p.x), Math.min(min.y, p.y), Math.min(min.z, p.z));
            max.set(Math.max(max.x, p.x), Math.max(max.y, p.y), Math.max(max.z, p.z));
            count++;
        }
        log.trace("Enclosed {} points in [{}, {}]", count, min, max);
        return new BoundingBox(min, max);
    }

    /**
     * @return the box spanning all of space, the bounds of an unbounded region
     */
    public static BoundingBox infinite() {
        var inf = Double.POSITIVE_INFINITY;
        return new BoundingBox(new Point3d(-inf, -inf, -inf), new Point3d(inf, inf, inf));
    }

    private static Point3d toPoint(String name, Iterable<? extends Number> coordinates) {
        Objects.requireNonNull(coordinates, name);
        var values = new ArrayList<Number>();
        for (Number n : coordinates) {
            values.add(n);
        }
        CheckValue.checkLength(name, values, 3, 3);
        if (values.contains(null)) {
            throw new IllegalArgumentException(
            "Unable to set \"" + name + "\" to \"" + values + "\" since it must hold only numbers");
        }
        return new Point3d(values.get(0).doubleValue(), values.get(1).doubleValue(), values.get(2).doubleValue());
    }

    private static int hash(double d) {
        // -0.0 == 0.0, so both must hash alike
        return Double.hashCode(d == 0.0 ? 0.0 : d);
    }

    private static boolean same(Tuple3d a, Tuple3d b) {
        return a.x == b.x && a.y == b.y && a.z == b.z;
    }

    private static String render(Tuple3d t) {
        return "(" + t.x + ", " + t.y + ", " + t.z + ")";
    }

    /**
     * Answer true if the other box lies entirely within this box, boundaries included
     */
    public boolean contains(BoundingBox other) {
        return lowerLeft.x <= other.lowerLeft.x && lowerLeft.y <= other.lowerLeft.y && lowerLeft.z <= other.lowerLeft.z
        && other.upperRight.x <= upperRight.x && other.upperRight.y <= upperRight.y
        && other.upperRight.z <= upperRight.z;
    }

    /**
     * Answer true if the point lies within this box, boundaries included
     */
    public boolean contains(Tuple3d point) {
        return lowerLeft.x <= point.x && point.x <= upperRight.x && lowerLeft.y <= point.y && point.y <= upperRight.y
        && lowerLeft.z <= point.z && point.z <= upperRight.z;
    }

    /**
     * @return the box as the pair (lower left, upper right). The list is unmodifiable and holds copies
     */
    public List<Point3d> corners() {
        return List.of(getLowerLeft(), getUpperRight());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BoundingBox other)) {
            return false;
        }
        return same(lowerLeft, other.lowerLeft) && same(upperRight, other.upperRight);
    }

    /**
     * Answer a new box grown by the padding on every side
     *
     * @param padding the distance to move each face outward, in [cm]
     */
    public BoundingBox expand(double padding) {
        return new BoundingBox(new Point3d(lowerLeft.x - padding, lowerLeft.y - padding, lowerLeft.z - padding),
                               new Point3d(upperRight.x + padding, upperRight.y + padding, upperRight.z + padding));
    }

    /**
     * Answer the bounds of the box projected onto the plane
     *
     * @return {lower left, upper right} along the first axis of the basis, then {lower left, upper right} along the
     * second
     */
    public double[] extent(Basis basis) {
        var a = basis.first();
        var b = basis.second();
        return new double[] { a.of(lowerLeft), a.of(upperRight), b.of(lowerLeft), b.of(upperRight) };
    }

    /**
     * @return x, y, z coordinates of the center of the box in [cm]
     */
    public Point3d getCenter() {
        return new Point3d((lowerLeft.x + upperRight.x) / 2, (lowerLeft.y + upperRight.y) / 2,
                           (lowerLeft.z + upperRight.z) / 2);
    }

    /**
     * @return a copy of the lower left corner
     */
    public Point3d getLowerLeft() {
        return new Point3d(lowerLeft);
    }

    /**
     * @return a copy of the upper right corner
     */
    public Point3d getUpperRight() {
        return new Point3d(upperRight);
    }

    /**
     * @return the volume of the box in [cm^3], never negative
     */
    public double getVolume() {
        return Math.abs((upperRight.x - lowerLeft.x) * (upperRight.y - lowerLeft.y) * (upperRight.z - lowerLeft.z));
    }

    @Override
    public int hashCode() {
        int result = hash(lowerLeft.x);
        result = 31 * result + hash(lowerLeft.y);
        result = 31 * result + hash(lowerLeft.z);
        result = 31 * result + hash(upperRight.x);
        result = 31 * result + hash(upperRight.y);
        return 31 * result + hash(upperRight.z);
    }

    /**
     * Answer the component-wise overlap of the two boxes. Disjoint boxes are not detected; their intersection has
     * inverted corners on the separating axes.
     */
    public BoundingBox intersection(BoundingBox other) {
        return new BoundingBox(new Point3d(Math.max(lowerLeft.x, other.lowerLeft.x),
                                           Math.max(lowerLeft.y, other.lowerLeft.y),
                                           Math.max(lowerLeft.z, other.lowerLeft.z)),
                               new Point3d(Math.min(upperRight.x, other.upperRight.x),
                                           Math.min(upperRight.y, other.upperRight.y),
                                           Math.min(upperRight.z, other.upperRight.z)));
    }

    /**
     * Answer true if this box has the same corners as the pair, compared component by component
     */
    public boolean matches(Tuple3d lowerLeft, Tuple3d upperRight) {
        if (lowerLeft == null || upperRight == null) {
            return false;
        }
        return same(this.lowerLeft, lowerLeft) && same(this.upperRight, upperRight);
    }

    /**
     * Answer true if the pair is a two element list of (lower left, upper right) equal to this box's corners
     */
    public boolean matches(List<? extends Tuple3d> pair) {
        return pair != null && pair.size() == 2 && matches(pair.get(0), pair.get(1));
    }

    @Override
    public String toString() {
        return "BoundingBox(lower_left=" + render(lowerLeft) + ", upper_right=" + render(upperRight) + ")";
    }

    /**
     * Answer a new box shifted by the offset
     */
    public BoundingBox translate(Tuple3d offset) {
        var ll = new Point3d(lowerLeft);
        var ur = new Point3d(upperRight);
        ll.add(offset);
        ur.add(offset);
        return new BoundingBox(ll, ur);
    }

    /**
     * Answer the smallest box holding both boxes
     */
    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(new Point3d(Math.min(lowerLeft.x, other.lowerLeft.x),
                                           Math.min(lowerLeft.y, other.lowerLeft.y),
                                           Math.min(lowerLeft.z, other.lowerLeft.z)),
                               new Point3d(Math.max(upperRight.x, other.upperRight.x),
                                           Math.max(upperRight.y, other.upperRight.y),
                                           Math.max(upperRight.z, other.upperRight.z)));
    }

    /**
     * The width of the box along the axis
     *
     * @param axis the axis
     * @return the absolute distance between the corners along the axis, in [cm]
     */
    public double width(Axis axis) {
        return Math.abs(axis.of(lowerLeft) - axis.of(upperRight));
    }

    /**
     * The width of the box along the tagged axis
     *
     * @param axis one of {@code "x"}, {@code "y"} or {@code "z"}
     * @return the absolute distance between the corners along the axis, in [cm]
     * @throws IllegalArgumentException if the tag is not an axis
     */
    public double width(String axis) {
        return width(Axis.fromTag(axis));
    }

    /**
     * @return the absolute widths along x, y and z
     */
    public Vector3d widths() {
        return new Vector3d(width(Axis.X), width(Axis.Y), width(Axis.Z));
    }
}
