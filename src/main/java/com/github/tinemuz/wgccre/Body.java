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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of bodies whose orientation is supported.
 *
 * <p>Each body knows its exact, case-sensitive name, the report its model comes from and the
 * model itself. Lookup by name never aliases or matches partially.</p>
 */
public enum Body {
    SOL("Sol", Report.WGCCRE_2015, Report2015.SOL),
    MERCURY("Mercury", Report.WGCCRE_2015, Report2015.MERCURY),
    VENUS("Venus", Report.WGCCRE_2015, Report2015.VENUS),
    EARTH("Earth", Report.WGCCRE_2009, Report2009.EARTH),
    MOON("Moon", Report.WGCCRE_2009, Report2009.MOON),
    MARS("Mars", Report.WGCCRE_2015, Report2015.MARS),
    JUPITER("Jupiter", Report.WGCCRE_2015, Report2015.JUPITER),
    SATURN("Saturn", Report.WGCCRE_2015, Report2015.SATURN),
    URANUS("Uranus", Report.WGCCRE_2015, Report2015.URANUS),
    NEPTUNE("Neptune", Report.WGCCRE_2015, Report2015.NEPTUNE);

    private static final Map<String, Body> BY_NAME =
            Collections.unmodifiableMap(
                    Arrays.stream(values())
                            .collect(Collectors.toMap(Body::displayName, Function.identity())));

    private final String displayName;
    private final Report report;
    private final RotationModel model;

    Body(String displayName, Report report, RotationModel model) {
        this.displayName = displayName;
        this.report = report;
        this.model = model;
    }

    /** Exact identifier callers use, e.g. {@code "Sol"} or {@code "Jupiter"}. */
    public String displayName() {
        return displayName;
    }

    public Report report() {
        return report;
    }

    RotationModel model() {
        return model;
    }

    /**
     * Orientation in the report's own convention, before any frame conversion.
     *
     * @param elapsedMillennia Julian millennia since the reference epoch
     * @return pole right ascension, pole declination and prime meridian, in degrees
     */
    public Orientation rawOrientation(double elapsedMillennia) {
        return model.evaluate(elapsedMillennia);
    }

    /** Exact-match lookup; {@code null} and unknown names yield an empty result. */
    public static Optional<Body> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * Exact-match lookup that fails loudly.
     *
     * @throws UnsupportedBodyException if {@code name} is not one of the supported identifiers
     */
    public static Body of(String name) {
        return fromName(name).orElseThrow(() -> new UnsupportedBodyException(name));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
