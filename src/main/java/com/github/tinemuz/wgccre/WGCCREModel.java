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

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WGCCRE rotational orientation evaluator.
 *
 * <p>This class evaluates the pole direction and prime-meridian angle of the Sun, the
 * planets and the Moon using the closed-form models published in the 2015 and 2009 WGCCRE
 * reports. The main entry point, {@link #orientation(String, double)}, returns the
 * orientation remapped into the convention used by VSOP87 consumers. Use
 * {@link #rawOrientation(String, double)} for the report's own (α, δ, W) convention.</p>
 *
 * <p>Time is given as Julian millennia since the caller's reference epoch. Formulas that are
 * tabulated per day use {@code elapsedMillennia * 365250}. All angles are in degrees. Every
 * method is a pure function of its arguments and is safe to call from any thread.</p>
 */
public final class WGCCREModel {
    private static final Logger log = LoggerFactory.getLogger(WGCCREModel.class);

    /** Days in a Julian millennium. */
    public static final double DAYS_PER_MILLENNIUM = 365250.0;

    // Mean obliquity of the ecliptic at J2000 and the VSOP87 epoch offset (as used by Stellarium)
    private static final double EARTH_AXIAL_TILT_DEG = 23.4392803055555555556;
    private static final double VSOP87_X_OFFSET_DEG = 90.0 - EARTH_AXIAL_TILT_DEG;
    private static final double VSOP87_Y_OFFSET_DEG = 0.0000275;

    // The reports target the present era; further out the models extrapolate
    private static final double REPORT_HORIZON_MILLENNIA = 1.0;
    private static volatile boolean warnedBeyondHorizon = false;

    private WGCCREModel() {}

    /**
     * Orientation of a named body in the VSOP87 convention.
     *
     * This is the single public API most callers need.
     *
     * @param bodyName         exact, case-sensitive body identifier, e.g. {@code "Mars"}
     * @param elapsedMillennia Julian millennia since the reference epoch
     * @return the two VSOP87 angles in [0, 360) followed by zero
     * @throws UnsupportedBodyException if {@code bodyName} is not a supported identifier
     */
    public static Orientation orientation(String bodyName, double elapsedMillennia) {
        return orientation(resolve(bodyName), elapsedMillennia);
    }

    /** Orientation of a body in the VSOP87 convention. */
    public static Orientation orientation(Body body, double elapsedMillennia) {
        return toVsop87(rawOrientation(body, elapsedMillennia));
    }

    /**
     * Orientation of a named body in the report's own convention.
     *
     * @throws UnsupportedBodyException if {@code bodyName} is not a supported identifier
     */
    public static Orientation rawOrientation(String bodyName, double elapsedMillennia) {
        return rawOrientation(resolve(bodyName), elapsedMillennia);
    }

    /** Orientation of a body in the report's own convention. */
    public static Orientation rawOrientation(Body body, double elapsedMillennia) {
        warnIfBeyondHorizon(elapsedMillennia);
        Orientation raw = body.rawOrientation(elapsedMillennia);
        if (log.isDebugEnabled()) {
            log.debug("{} ({} report) at t={} millennia: {}",
                    body, body.report().year(), elapsedMillennia, raw);
        }
        return raw;
    }

    /**
     * Remap a report-convention triple into the VSOP87 convention.
     *
     * <p>The first angle is the pole declination shifted by the complement of the axial
     * tilt. The second is the right ascension plus the prime-meridian correction, turned by
     * 180° and nudged by the epoch offset. Both are reduced into [0, 360), so callers never
     * normalize them again. The third angle is undefined in this convention and is returned
     * as zero.</p>
     */
    public static Orientation toVsop87(Orientation raw) {
        double ra = raw.rightAscensionDeg;
        double de = raw.declinationDeg;
        double correction = raw.rotationDeg;
        return new Orientation(
                DegreeTrig.wrap360(de + VSOP87_X_OFFSET_DEG),
                DegreeTrig.wrap360((ra + correction) - 180.0 + VSOP87_Y_OFFSET_DEG),
                0.0);
    }

    /** Mean obliquity of the Earth's ecliptic used by the VSOP87 remapping, in degrees. */
    public static double axialTilt() {
        return EARTH_AXIAL_TILT_DEG;
    }

    private static Body resolve(String bodyName) {
        Optional<Body> body = Body.fromName(bodyName);
        if (body.isEmpty()) {
            log.warn("Orientation requested for unsupported body '{}'", bodyName);
            throw new UnsupportedBodyException(bodyName);
        }
        return body.get();
    }

    /**
     * Log once when a request lands far from the reference epoch. The result is still
     * computed; the reports simply do not claim accuracy there.
     */
    private static void warnIfBeyondHorizon(double elapsedMillennia) {
        if (warnedBeyondHorizon || !(Math.abs(elapsedMillennia) > REPORT_HORIZON_MILLENNIA)) {
            return;
        }
        synchronized (WGCCREModel.class) {
            if (!warnedBeyondHorizon) {
                warnedBeyondHorizon = true;
                log.warn(
                        "Requested epoch is {} millennia from the reference epoch; "
                                + "WGCCRE models are extrapolated beyond {} millennium",
                        String.format("%.3f", elapsedMillennia),
                        String.format("%.1f", REPORT_HORIZON_MILLENNIA));
            }
        }
    }
}
