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
 * Small immutable orientation triple. All angles are degrees.
 *
 * <p>In the report convention the fields are the pole right ascension α, the pole
 * declination δ and the prime meridian W. After {@link WGCCREModel#toVsop87} they hold the
 * two remapped VSOP87 angles, and the third field is always zero.</p>
 */
public final class Orientation {
    /** Pole right ascension α (or the first VSOP87 angle). */
    public final double rightAscensionDeg;

    /** Pole declination δ (or the second VSOP87 angle). */
    public final double declinationDeg;

    /** Prime meridian W (zero in the VSOP87 convention). */
    public final double rotationDeg;

    public Orientation(double rightAscensionDeg, double declinationDeg, double rotationDeg) {
        this.rightAscensionDeg = rightAscensionDeg;
        this.declinationDeg = declinationDeg;
        this.rotationDeg = rotationDeg;
    }

    /** The three angles in order, as a new array. */
    public double[] toArray() {
        return new double[] {rightAscensionDeg, declinationDeg, rotationDeg};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Orientation)) return false;
        Orientation other = (Orientation) o;
        return Double.compare(rightAscensionDeg, other.rightAscensionDeg) == 0
                && Double.compare(declinationDeg, other.declinationDeg) == 0
                && Double.compare(rotationDeg, other.rotationDeg) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(rightAscensionDeg);
        h = 31 * h + Double.hashCode(declinationDeg);
        return 31 * h + Double.hashCode(rotationDeg);
    }

    @Override
    public String toString() {
        return "Orientation[" + rightAscensionDeg + ", " + declinationDeg + ", " + rotationDeg + "]";
    }
}
