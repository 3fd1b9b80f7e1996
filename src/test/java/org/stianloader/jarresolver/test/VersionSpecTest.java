package org.stianloader.jarresolver.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.jarresolver.version.VersionSpec;

public class VersionSpecTest {

    @Test
    public void testComparison() {
        assertTrue(VersionSpec.compare("1.10", "1.9") > 0);
        assertTrue(VersionSpec.compare("1.9", "1.10") < 0);
        assertEquals(0, VersionSpec.compare("1.0", "1.0.0"));
        assertEquals(0, VersionSpec.compare("01.2", "1.02"));
        assertTrue(VersionSpec.compare("2", "1.9.9") > 0);
        assertTrue(VersionSpec.compare("1.0.1", "1.0") > 0);
        assertTrue(VersionSpec.compare("123456789012345678901234567890", "99") > 0);
    }

    @Test
    public void testMalformedComponents() {
        // Non-numeric components are older than numeric ones
        assertTrue(VersionSpec.compare("1.a", "1.0") < 0);
        assertTrue(VersionSpec.compare("1.0", "1.a") > 0);
        assertTrue(VersionSpec.compare("1.a", "1.b") < 0);
        assertEquals(0, VersionSpec.compare("1.rc", "1.rc"));
        assertTrue(VersionSpec.compare("", "0.1") < 0);
    }

    @Test
    public void testOrderingLaws() {
        List<String> versions = Arrays.asList("1.0", "1.0.0", "1.0.1", "1.10", "1.9", "1.a", "2", "0.9", "1.2.3", "1.2.3.1", "x");
        for (String a : versions) {
            assertEquals(0, VersionSpec.compare(a, a), a);
            for (String b : versions) {
                assertEquals(Integer.signum(VersionSpec.compare(a, b)), -Integer.signum(VersionSpec.compare(b, a)), a + " vs " + b);
                for (String c : versions) {
                    if (VersionSpec.compare(a, b) < 0 && VersionSpec.compare(b, c) < 0) {
                        assertTrue(VersionSpec.compare(a, c) < 0, a + " < " + b + " < " + c);
                    }
                }
            }
        }

        List<String> sorted = new ArrayList<>(Arrays.asList("1.10", "1.2", "1.9", "1.a", "0.1"));
        sorted.sort(VersionSpec.COMPARATOR);
        assertEquals(Arrays.asList("0.1", "1.a", "1.2", "1.9", "1.10"), sorted);
    }

    @Test
    public void testParse() {
        VersionSpec exact = VersionSpec.parse(" 1.2.3 ");
        assertFalse(exact.isOpenEnded());
        assertFalse(exact.isLatest());
        assertEquals("1.2.3", exact.getBaseVersion());
        assertEquals(Arrays.asList("1", "2", "3"), exact.getComponents());

        VersionSpec open = VersionSpec.parse("1.2+");
        assertTrue(open.isOpenEnded());
        assertEquals("1.2", open.getBaseVersion());
        assertEquals("1.2+", open.getOriginText());

        assertTrue(VersionSpec.parse("LATEST").isLatest());
        assertFalse(VersionSpec.parse("latest").isLatest());
        assertEquals("", VersionSpec.parse("+").getBaseVersion());
    }

    @Test
    public void testExactConstraints() {
        assertTrue(VersionSpec.satisfies("1.0", "1.0"));
        assertTrue(VersionSpec.satisfies("1.0", "1.0.0"));
        assertFalse(VersionSpec.satisfies("1.0", "1.0.1"));
        assertFalse(VersionSpec.satisfies("1.0", "0.9"));
    }

    @Test
    public void testPrefixBoundedConstraints() {
        assertTrue(VersionSpec.satisfies("1.2.3+", "1.2.3"));
        assertTrue(VersionSpec.satisfies("1.2.3+", "1.2.4"));
        assertTrue(VersionSpec.satisfies("1.2.3+", "1.2.10"));
        assertFalse(VersionSpec.satisfies("1.2.3+", "1.3.0"));
        assertFalse(VersionSpec.satisfies("1.2.3+", "1.2.2"));
        assertFalse(VersionSpec.satisfies("1.2.3+", "2.0"));

        assertTrue(VersionSpec.satisfies("1.0+", "1.0"));
        assertTrue(VersionSpec.satisfies("1.0+", "1.9.9"));
        assertFalse(VersionSpec.satisfies("1.0+", "2.0"));
        assertFalse(VersionSpec.satisfies("1.0+", "0.9"));

        assertTrue(VersionSpec.satisfies("1.2.+", "1.2.0"));
        assertTrue(VersionSpec.satisfies("1.2.+", "1.2.7"));
        assertFalse(VersionSpec.satisfies("1.2.+", "1.3"));

        assertTrue(VersionSpec.satisfies("0+", "0.1"));
        assertTrue(VersionSpec.satisfies("0+", "42.1"));
        assertTrue(VersionSpec.satisfies("+", "3.1.4"));
    }

    @Test
    public void testLatest() {
        List<String> available = Arrays.asList("1.0", "2.1", "2.0");
        assertTrue(VersionSpec.LATEST.isSatisfiedBy("1.0"));
        assertTrue(VersionSpec.LATEST.isSatisfiedBy("2.1", available));
        assertFalse(VersionSpec.LATEST.isSatisfiedBy("2.0", available));
        assertEquals("2.1", VersionSpec.LATEST.selectFrom(available));
    }

    @Test
    public void testSelectFrom() {
        List<String> available = Arrays.asList("1.2.3", "1.2.4", "1.3.0");
        assertEquals("1.2.4", VersionSpec.parse("1.2.3+").selectFrom(available));
        assertEquals("1.3.0", VersionSpec.parse("1+").selectFrom(available));
        assertEquals("1.2.3", VersionSpec.parse("1.2.3").selectFrom(available));
        assertNull(VersionSpec.parse("2.0").selectFrom(available));
    }
}
