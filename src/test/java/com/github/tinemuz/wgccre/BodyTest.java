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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BodyTest {

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Every supported identifier resolves to its own body")
        void exactNames() {
            List<String> names =
                    List.of("Sol", "Mercury", "Venus", "Earth", "Moon", "Mars",
                            "Jupiter", "Saturn", "Uranus", "Neptune");
            Set<Body> seen = new HashSet<>();
            for (String name : names) {
                Body body = Body.of(name);
                assertEquals(name, body.displayName());
                assertEquals(name, body.toString());
                seen.add(body);
            }
            assertEquals(Body.values().length, seen.size(), "One body per identifier");
        }

        @Test
        @DisplayName("Lookup is case-sensitive with no aliases")
        void noAliases() {
            assertTrue(Body.fromName("sol").isEmpty());
            assertTrue(Body.fromName("SOL").isEmpty());
            assertTrue(Body.fromName("Sun").isEmpty());
            assertTrue(Body.fromName("Jup").isEmpty());
            assertTrue(Body.fromName(null).isEmpty());
            assertThrows(UnsupportedBodyException.class, () -> Body.of("Pluto"));
        }

        @Test
        @DisplayName("Exception message lists the supported bodies")
        void exceptionMessage() {
            UnsupportedBodyException e =
                    assertThrows(UnsupportedBodyException.class, () -> Body.of("Pluto"));
            assertTrue(e.getMessage().contains("'Pluto'"), e.getMessage());
            assertTrue(e.getMessage().contains("Neptune"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("Report Assignment")
    class ReportTests {

        @Test
        @DisplayName("Earth and Moon come from the 2009 report, the rest from 2015")
        void reports() {
            for (Body body : Body.values()) {
                Report expected =
                        body == Body.EARTH || body == Body.MOON ? Report.WGCCRE_2009 : Report.WGCCRE_2015;
                assertEquals(expected, body.report(), body.displayName());
            }
            assertEquals(2009, Report.WGCCRE_2009.year());
            assertTrue(Report.WGCCRE_2015.reference().endsWith("WGCCRE2015reprint.pdf"));
        }
    }

    @Nested
    @DisplayName("Coefficient Tables")
    class TableTests {

        @Test
        @DisplayName("Moon W keeps its quadratic drift term")
        void moonQuadratic() {
            AngleSeries w = Body.MOON.model().primeMeridian();
            assertEquals(-1.4e-12, w.quadratic(), 0.0);
            assertEquals(TimeBase.DAYS, w.base());
            assertEquals(13, w.terms().size(), "Moon W uses all thirteen arguments");
        }

        @Test
        @DisplayName("Only the Moon carries a quadratic term")
        void quadraticOnlyOnMoon() {
            for (Body body : Body.values()) {
                if (body == Body.MOON) continue;
                RotationModel m = body.model();
                assertEquals(0.0, m.rightAscension().quadratic(), 0.0, body.displayName());
                assertEquals(0.0, m.declination().quadratic(), 0.0, body.displayName());
                assertEquals(0.0, m.primeMeridian().quadratic(), 0.0, body.displayName());
            }
        }

        @Test
        @DisplayName("Mercury has five libration terms on W only")
        void mercuryLibration() {
            RotationModel m = Body.MERCURY.model();
            assertTrue(m.rightAscension().terms().isEmpty());
            assertTrue(m.declination().terms().isEmpty());
            assertEquals(5, m.primeMeridian().terms().size());
            for (PeriodicTerm term : m.primeMeridian().terms()) {
                assertEquals(TimeBase.DAYS, term.argument().base());
            }
        }

        @Test
        @DisplayName("Mars alpha, delta and W use distinct arguments")
        void marsIndependentArguments() {
            RotationModel m = Body.MARS.model();
            List<PeriodicTerm> alpha = m.rightAscension().terms();
            List<PeriodicTerm> delta = m.declination().terms();
            List<PeriodicTerm> w = m.primeMeridian().terms();
            assertEquals(5, alpha.size());
            assertEquals(5, delta.size());
            assertEquals(6, w.size());
            for (int i = 0; i < 4; i++) {
                assertNotEquals(alpha.get(i).argument(), delta.get(i).argument());
                assertNotEquals(alpha.get(i).argument(), w.get(i).argument());
                assertNotEquals(delta.get(i).argument(), w.get(i).argument());
            }
            assertTrue(delta.stream().allMatch(PeriodicTerm::cosine), "Mars delta uses cosines");
        }

        @Test
        @DisplayName("Jupiter alpha and delta share the same five arguments")
        void jupiterSharedArguments() {
            RotationModel m = Body.JUPITER.model();
            List<PeriodicTerm> alpha = m.rightAscension().terms();
            List<PeriodicTerm> delta = m.declination().terms();
            assertEquals(5, alpha.size());
            for (int i = 0; i < alpha.size(); i++) {
                assertEquals(alpha.get(i).argument(), delta.get(i).argument());
                assertNotEquals(alpha.get(i).amplitude(), delta.get(i).amplitude(), 0.0);
            }
        }

        @Test
        @DisplayName("Bodies without published perturbations have no periodic terms")
        void unperturbedBodies() {
            for (Body body : List.of(Body.SOL, Body.VENUS, Body.EARTH, Body.SATURN, Body.URANUS)) {
                RotationModel m = body.model();
                assertTrue(m.rightAscension().terms().isEmpty(), body.displayName());
                assertTrue(m.declination().terms().isEmpty(), body.displayName());
                assertTrue(m.primeMeridian().terms().isEmpty(), body.displayName());
            }
        }
    }
}
