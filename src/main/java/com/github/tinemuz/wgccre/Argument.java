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
 * Angle that grows linearly with time: {@code offsetDeg + rateDeg * x}, where x is
 * selected by {@link #base()}. A decreasing argument is stored with a negative rate.
 */
record Argument(double offsetDeg, double rateDeg, TimeBase base) {

    static Argument days(double offsetDeg, double rateDeg) {
        return new Argument(offsetDeg, rateDeg, TimeBase.DAYS);
    }

    static Argument millennia(double offsetDeg, double rateDeg) {
        return new Argument(offsetDeg, rateDeg, TimeBase.MILLENNIA);
    }

    double at(double millennia, double days) {
        return offsetDeg + (rateDeg * base.select(millennia, days));
    }
}
