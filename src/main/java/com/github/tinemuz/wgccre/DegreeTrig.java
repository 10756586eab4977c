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

/**
 * Sine and cosine of angles given in degrees.
 *
 * <p>The input is first reduced into [0, 360) so that angles accumulated over millennia do
 * not lean on the native range reduction, and so that {@code x} and {@code x + 360} reduce
 * to the same value. The result is scaled back onto the degree scale (multiplied by 180/π),
 * which is the convention the WGCCRE amplitudes in {@link Report2015} and {@link Report2009}
 * are tabulated against.</p>
 *
 * <p>Each precision has its own conversion constants so a float angle is never converted with
 * double constants or the other way round.</p>
 */
final class DegreeTrig {
    private static final double FULL_TURN = 360.0;
    private static final double D2R = Math.PI / 180.0;
    private static final double R2D = 180.0 / Math.PI;

    private static final float FULL_TURN_F = 360.0f;
    private static final float D2R_F = (float) Math.PI / 180.0f;
    private static final float R2D_F = 180.0f / (float) Math.PI;

    private DegreeTrig() {}

    static double sinD(double x) {
        return Math.sin(wrap360(x) * D2R) * R2D;
    }

    static double cosD(double x) {
        return Math.cos(wrap360(x) * D2R) * R2D;
    }

    static float sinD(float x) {
        return (float) Math.sin(wrap360(x) * D2R_F) * R2D_F;
    }

    static float cosD(float x) {
        return (float) Math.cos(wrap360(x) * D2R_F) * R2D_F;
    }

    /**
     * Floored reduction into [0, 360). Unlike {@code %}, negative input wraps upward.
     * Non-negative input is reduced exactly as {@code x % 360}.
     */
    static double wrap360(double x) {
        double r = x % FULL_TURN;
        if (r < 0.0) {
            r += FULL_TURN;
            // -1e-17 + 360 rounds to 360
            if (r >= FULL_TURN) r = 0.0;
        }
        return r == 0.0 ? 0.0 : r; // folds -0.0
    }

    static float wrap360(float x) {
        float r = x % FULL_TURN_F;
        if (r < 0.0f) {
            r += FULL_TURN_F;
            if (r >= FULL_TURN_F) r = 0.0f;
        }
        return r == 0.0f ? 0.0f : r;
    }
}
