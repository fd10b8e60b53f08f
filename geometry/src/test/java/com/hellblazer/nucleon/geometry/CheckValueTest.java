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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CheckValueTest {

    @Test
    public void testExactLength() {
        var value = new double[] { 1, 2, 3 };
        assertSame(value, CheckValue.checkLength("corner", value, 3, 3));

        var e = assertThrows(IllegalArgumentException.class,
                             () -> CheckValue.checkLength("corner", new double[] { 1, 2, 3, 4 }, 3, 3));
        assertEquals("Unable to set \"corner\" to \"[1.0, 2.0, 3.0, 4.0]\" since it must be of length \"3\"",
                     e.getMessage());
    }

    @Test
    public void testMinimumLength() {
        assertDoesNotThrow(() -> CheckValue.checkLength("points", List.of(1, 2, 3, 4, 5), 2, CheckValue.UNBOUNDED));

        var e = assertThrows(IllegalArgumentException.class,
                             () -> CheckValue.checkLength("points", List.of(1), 2, CheckValue.UNBOUNDED));
        assertEquals("Unable to set \"points\" to \"[1]\" since it must be at least of length \"2\"", e.getMessage());
    }

    @Test
    public void testLengthRange() {
        assertDoesNotThrow(() -> CheckValue.checkLength("values", new double[2], 1, 3));

        var e = assertThrows(IllegalArgumentException.class,
                             () -> CheckValue.checkLength("values", List.of(), 1, 3));
        assertEquals("Unable to set \"values\" to \"[]\" since it must be of length between \"1\" and \"3\"",
                     e.getMessage());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> CheckValue.checkLength("values", (double[]) null, 3, 3));
        assertThrows(IllegalArgumentException.class, () -> CheckValue.checkLength("values", new double[3], 4, 2));
    }
}
