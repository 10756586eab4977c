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

import java.util.List;

/**
 * Polynomial in one time variable followed by periodic corrections.
 *
 * <p>Terms are summed strictly left to right: constant, linear, quadratic, then each
 * periodic term in the order the report prints them. Floating-point addition is not
 * associative, so reordering changes the low digits.</p>
 */
record AngleSeries(
        TimeBase base, double constant, double linear, double quadratic, List<PeriodicTerm> terms) {

    AngleSeries {
        terms = List.copyOf(terms);
    }

    static AngleSeries constant(double value) {
        return new AngleSeries(TimeBase.MILLENNIA, value, 0.0, 0.0, List.of());
    }

    static AngleSeries linear(TimeBase base, double constant, double linear, PeriodicTerm... terms) {
        return new AngleSeries(base, constant, linear, 0.0, List.of(terms));
    }

    static AngleSeries quadratic(
            TimeBase base, double constant, double linear, double quadratic, PeriodicTerm... terms) {
        return new AngleSeries(base, constant, linear, quadratic, List.of(terms));
    }

    double evaluate(double millennia, double days) {
        double x = base.select(millennia, days);
        double sum = constant;
        if (linear != 0.0) sum = sum + (linear * x);
        // skipped when absent so that x * x cannot overflow into 0 * Inf
        if (quadratic != 0.0) sum = sum + (quadratic * (x * x));
        for (PeriodicTerm term : terms) {
            sum = sum + term.evaluate(millennia, days);
        }
        return sum;
    }
}
