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
 * One {@code amplitude * sin(argument)} or {@code amplitude * cos(argument)} correction.
 * Subtracted terms carry a negative amplitude.
 */
record PeriodicTerm(double amplitude, boolean cosine, Argument argument) {

    static PeriodicTerm sin(double amplitude, Argument argument) {
        return new PeriodicTerm(amplitude, false, argument);
    }

    static PeriodicTerm cos(double amplitude, Argument argument) {
        return new PeriodicTerm(amplitude, true, argument);
    }

    double evaluate(double millennia, double days) {
        double angle = argument.at(millennia, days);
        return amplitude * (cosine ? DegreeTrig.cosD(angle) : DegreeTrig.sinD(angle));
    }
}
