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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the axis and basis tags.
 *
 * @author hal.hildebrand
 */
public class AxisTest {

    @Test
    public void testFromTag() {
        assertSame(Axis.X, Axis.fromTag("x"));
        assertSame(Axis.Y, Axis.fromTag("y"));
        assertSame(Axis.Z, Axis.fromTag("z"));
    }

    @Test
    public void testIndices() {
        assertEquals(0, Axis.X.index());
        assertEquals(1, Axis.Y.index());
        assertEquals(2, Axis.Z.index());
    }

    @Test
    public void testUnknownTags() {
        for (var tag : new String[] { "X", "w", "", "xy", " x", "0" }) {
            var e = assertThrows(IllegalArgumentException.class, () -> Axis.fromTag(tag));
            assertTrue(e.getMessage().contains("Unknown axis"), e.getMessage());
        }
        assertThrows(IllegalArgumentException.class, () -> Axis.fromTag(null));
    }

    @Test
    public void testComponent() {
        var p = new Point3d(1, 2, 3);
        assertEquals(1.0, Axis.X.of(p));
        assertEquals(2.0, Axis.Y.of(p));
        assertEquals(3.0, Axis.Z.of(p));
    }

    @Test
    public void testTagRoundTrip() {
        for (var axis : Axis.values()) {
            assertSame(axis, Axis.fromTag(axis.tag()));
            assertEquals(axis.tag(), axis.toString());
        }
        for (var basis : Basis.values()) {
            assertSame(basis, Basis.fromTag(basis.tag()));
        }
    }

    @Test
    public void testBasis() {
        assertSame(Axis.X, Basis.XY.first());
        assertSame(Axis.Y, Basis.XY.second());
        assertSame(Axis.X, Basis.XZ.first());
        assertSame(Axis.Z, Basis.XZ.second());
        assertSame(Axis.Y, Basis.YZ.first());
        assertSame(Axis.Z, Basis.YZ.second());
        assertEquals("yz", Basis.YZ.toString());

        assertThrows(IllegalArgumentException.class, () -> Basis.fromTag("yx"));
        assertThrows(IllegalArgumentException.class, () -> Basis.fromTag("xyz"));
        assertThrows(IllegalArgumentException.class, () -> Basis.fromTag(null));
    }
}
