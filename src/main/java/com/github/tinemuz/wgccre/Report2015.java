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
import static com.github.tinemuz.wgccre.Argument.millennia;
import static com.github.tinemuz.wgccre.PeriodicTerm.cos;
import static com.github.tinemuz.wgccre.PeriodicTerm.sin;
import static com.github.tinemuz.wgccre.TimeBase.DAYS;
import static com.github.tinemuz.wgccre.TimeBase.MILLENNIA;

/**
 * Orientation models from the 2015 WGCCRE report (Archinal et al., 2018).
 *
 * <p>Every coefficient below is copied from the report in the order it prints the terms.
 * Subtracted terms are written with a negative amplitude or rate.</p>
 *
 * @see Report#WGCCRE_2015
 */
final class Report2015 {

    private Report2015() {}

    static final RotationModel SOL = new RotationModel(
            AngleSeries.constant(286.13),
            AngleSeries.constant(63.87),
            AngleSeries.linear(DAYS, 84.176, 14.1844000));

    // Mercury libration arguments
    private static final Argument M1 = days(174.7910857, 4.092335);
    private static final Argument M2 = days(349.5821714, 8.184670);
    private static final Argument M3 = days(164.3732571, 12.277005);
    private static final Argument M4 = days(339.1643429, 16.369340);
    private static final Argument M5 = days(153.9554286, 20.461675);

    static final RotationModel MERCURY = new RotationModel(
            AngleSeries.linear(MILLENNIA, 281.0103, -0.0328),
            AngleSeries.linear(MILLENNIA, 61.4155, -0.0049),
            AngleSeries.linear(DAYS, 329.5988, 6.1385108, // (± 0.0037)
                    sin(0.01067257, M1),
                    sin(-0.00112309, M2),
                    sin(-0.00011040, M3),
                    sin(-0.00002539, M4),
                    sin(-0.00000571, M5)));

    static final RotationModel VENUS = new RotationModel(
            AngleSeries.constant(272.76),
            AngleSeries.constant(67.16),
            AngleSeries.linear(DAYS, 160.20, -1.4813688));

    // Mars: alpha, delta and W are fitted separately, so the rates differ in the last digits
    static final RotationModel MARS = new RotationModel(
            AngleSeries.linear(MILLENNIA, 317.269202, -0.10927547,
                    sin(0.000068, millennia(198.991226, 19139.4819985)),
                    sin(0.000238, millennia(226.292679, 38280.8511281)),
                    sin(0.000052, millennia(249.663391, 57420.7251593)),
                    sin(0.000009, millennia(266.183510, 76560.6367950)),
                    sin(0.419057, millennia(79.398797, 0.5042615))),
            AngleSeries.linear(MILLENNIA, 54.432516, -0.05827105,
                    cos(0.000051, millennia(122.433576, 19139.9407476)),
                    cos(0.000141, millennia(43.058401, 38280.8753272)),
                    cos(0.000031, millennia(57.663379, 57420.7517205)),
                    cos(0.000005, millennia(79.476401, 76560.6495004)),
                    cos(1.591274, millennia(166.325722, 0.5042615))),
            AngleSeries.linear(DAYS, 176.049863, 350.891982443297,
                    sin(0.000145, millennia(129.071773, 19140.0328244)),
                    sin(0.000157, millennia(36.352167, 38281.0473591)),
                    sin(0.000040, millennia(56.668646, 57420.9295360)),
                    sin(0.000001, millennia(67.364003, 76560.2552215)),
                    sin(0.000001, millennia(104.792680, 95700.4387578)),
                    sin(0.584542, millennia(95.391654, 0.5042615))));

    private static final Argument JA = millennia(99.360714, 4850.4046);
    private static final Argument JB = millennia(175.895369, 1191.9605);
    private static final Argument JC = millennia(300.323162, 262.5475);
    private static final Argument JD = millennia(114.012305, 6070.2476);
    private static final Argument JE = millennia(49.511251, 64.3000);

    static final RotationModel JUPITER = new RotationModel(
            AngleSeries.linear(MILLENNIA, 268.056595, -0.006499,
                    sin(0.000117, JA),
                    sin(0.000938, JB),
                    sin(0.001432, JC),
                    sin(0.000030, JD),
                    sin(0.002150, JE)),
            AngleSeries.linear(MILLENNIA, 64.495303, 0.002413,
                    cos(0.000050, JA),
                    cos(0.000404, JB),
                    cos(0.000617, JC),
                    cos(-0.000013, JD),
                    cos(0.000926, JE)),
            AngleSeries.linear(DAYS, 284.95, 870.5360000));

    static final RotationModel SATURN = new RotationModel(
            AngleSeries.linear(MILLENNIA, 40.589, -0.036),
            AngleSeries.linear(MILLENNIA, 83.537, -0.004),
            AngleSeries.linear(DAYS, 38.90, 810.7939024));

    static final RotationModel URANUS = new RotationModel(
            AngleSeries.constant(257.311),
            AngleSeries.constant(-15.175),
            AngleSeries.linear(DAYS, 203.81, -501.1600928));

    private static final Argument N = millennia(357.85, 52.316);

    static final RotationModel NEPTUNE = new RotationModel(
            AngleSeries.linear(MILLENNIA, 299.36, 0.0, sin(0.70, N)),
            AngleSeries.linear(MILLENNIA, 43.46, 0.0, cos(-0.51, N)),
            AngleSeries.linear(DAYS, 249.978, 541.1397757, sin(-0.48, N)));
}
