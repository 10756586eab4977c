/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.wgccre;

import static com.github.tinemuz.wgccre.Argument.days;
import static com.github.tinemuz.wgccre.PeriodicTerm.cos;
import static com.github.tinemuz.wgccre.PeriodicTerm.sin;
import static com.github.tinemuz.wgccre.TimeBase.DAYS;
import static com.github.tinemuz.wgccre.TimeBase.MILLENNIA;

/**
 * Orientation models from the 2009 WGCCRE report (Archinal et al., 2011).
 *
 * @see Report#WGCCRE_2009
 */
final class Report2009 {

    private Report2009() {}

    static final RotationModel EARTH = new RotationModel(
            AngleSeries.linear(MILLENNIA, 0.00, -0.641),
            AngleSeries.linear(MILLENNIA, 90.00, -0.557),
            AngleSeries.linear(DAYS, 190.147, 360.9856235));

    // Lunar arguments, all linear in days
    static final Argument E1 = days(125.045, -0.0529921);
    static final Argument E2 = days(250.089, -0.1059842);
    static final Argument E3 = days(260.008, 13.0120009);
    static final Argument E4 = days(176.625, 13.3407154);
    static final Argument E5 = days(357.529, 0.9856003);
    static final Argument E6 = days(311.589, 26.4057084);
    static final Argument E7 = days(134.963, 13.0649930);
    static final Argument E8 = days(276.617, 0.3287146);
    static final Argument E9 = days(34.226, 1.7484877);
    static final Argument E10 = days(15.134, -0.1589763);
    static final Argument E11 = days(119.743, 0.0036096);
    static final Argument E12 = days(239.961, 0.1643573);
    static final Argument E13 = days(25.053, 12.9590088);

    /** Secular drift of the lunar prime meridian, degrees per day squared. */
    static final double MOON_W_QUADRATIC = -1.4e-12;

    static final RotationModel MOON = new RotationModel(
            AngleSeries.linear(MILLENNIA, 269.9949, 0.0031,
                    sin(-3.8787, E1),
                    sin(-0.1204, E2),
                    sin(0.0700, E3),
                    sin(-0.0172, E4),
                    sin(0.0072, E6),
                    sin(-0.0052, E10),
                    sin(0.0043, E13)),
            AngleSeries.linear(MILLENNIA, 66.5392, 0.0130,
                    cos(1.5419, E1),
                    cos(0.0239, E2),
                    cos(-0.0278, E3),
                    cos(0.0068, E4),
                    cos(-0.0029, E6),
                    cos(0.0009, E7),
                    cos(0.0008, E10),
                    cos(-0.0009, E13)),
            AngleSeries.quadratic(DAYS, 38.3213, 13.17635815, MOON_W_QUADRATIC,
                    sin(3.5610, E1),
                    sin(0.1208, E2),
                    sin(-0.0642, E3),
                    sin(0.0158, E4),
                    sin(0.0252, E5),
                    sin(-0.0066, E6),
                    sin(-0.0047, E7),
                    sin(-0.0046, E8),
                    sin(0.0028, E9),
                    sin(0.0052, E10),
                    sin(0.0040, E11),
                    sin(0.0019, E12),
                    sin(-0.0044, E13)));
}
