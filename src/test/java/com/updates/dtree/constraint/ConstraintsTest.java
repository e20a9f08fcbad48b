package com.updates.dtree.constraint;

import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class ConstraintsTest {

    private static final List<Object> SAMPLES = List.of(
            true, 0L, 32L, 64L, "", "54.0.1", "55", "55.0.3", "55.9", "56", "56.0", "57", "de", "fr", "ja");

    private static final List<Constraint> CONSTRAINTS = List.of(
            Constraint.any(),
            Constraint.equalTo("56.0"),
            Constraint.equalTo(32L),
            Constraint.notEqualTo("56.0"),
            Constraint.notEqualTo("fr"),
            Constraint.lessThan("56"),
            Constraint.atLeast("56"),
            Constraint.between("55", "56.0"),
            new Constraint.Interval("54", "57", Set.of("55.9")),
            Constraint.in(Set.of("fr", "de", "56.0")),
            Constraint.in(Set.of()),
            Constraint.notIn(Set.of("fr", "ja")),
            Constraint.notIn(Set.of()));

    private static Constraint intersect(Constraint a, Constraint b) {
        return Constraints.intersect(a, b).orElse(null);
    }

    @Test
    public void testAnyAbsorbs() {
        for (Constraint c : CONSTRAINTS) {
            if (c.isSatisfiable())
                assertEquals(c, intersect(Constraint.ANY, c));
            else
                assertNull(intersect(Constraint.ANY, c));
        }
    }

    @Test
    public void testEqualsPairs() {
        assertEquals(Constraint.equalTo("fr"), intersect(Constraint.equalTo("fr"), Constraint.equalTo("fr")));
        assertNull(intersect(Constraint.equalTo("fr"), Constraint.equalTo("de")));
        assertEquals(Constraint.equalTo("fr"), intersect(Constraint.equalTo("fr"), Constraint.notEqualTo("de")));
        assertNull(intersect(Constraint.equalTo("fr"), Constraint.notEqualTo("fr")));
    }

    @Test
    public void testEqualsAgainstInterval() {
        assertEquals(Constraint.equalTo("55.0.3"),
                intersect(Constraint.equalTo("55.0.3"), Constraint.lessThan("56")));
        assertNull(intersect(Constraint.equalTo("56.0"), Constraint.lessThan("56")));
        assertEquals(Constraint.equalTo("56"), intersect(Constraint.atLeast("56"), Constraint.equalTo("56")));
        // high bound is exclusive
        assertNull(intersect(Constraint.equalTo("56"), Constraint.between("55", "56")));
    }

    @Test
    public void testIntervalPairs() {
        assertEquals(Constraint.between("55", "56"),
                intersect(Constraint.atLeast("55"), Constraint.lessThan("56")));
        assertEquals(Constraint.between("55.9", "56"),
                intersect(Constraint.between("55", "56"), Constraint.between("55.9", "57")));
        assertNull(intersect(Constraint.lessThan("56"), Constraint.atLeast("56")));
        assertNull(intersect(Constraint.lessThan("55"), Constraint.atLeast("56")));
    }

    @Test
    public void testSetPairs() {
        assertEquals(Constraint.in(Set.of("fr")),
                intersect(Constraint.in(Set.of("fr", "de")), Constraint.in(Set.of("fr", "ja"))));
        assertNull(intersect(Constraint.in(Set.of("fr")), Constraint.in(Set.of("de"))));
        assertEquals(Constraint.in(Set.of("de")),
                intersect(Constraint.in(Set.of("fr", "de")), Constraint.notIn(Set.of("fr", "ja"))));
        assertNull(intersect(Constraint.in(Set.of("fr")), Constraint.notIn(Set.of("fr"))));
        assertEquals(Constraint.notIn(Set.of("fr", "de", "ja")),
                intersect(Constraint.notIn(Set.of("fr", "de")), Constraint.notIn(Set.of("ja"))));
    }

    @Test
    public void testNotEqualsPairs() {
        assertEquals(Constraint.notEqualTo("fr"), intersect(Constraint.notEqualTo("fr"), Constraint.notEqualTo("fr")));
        assertEquals(Constraint.notIn(Set.of("fr", "de")),
                intersect(Constraint.notEqualTo("fr"), Constraint.notEqualTo("de")));
        assertEquals(Constraint.in(Set.of("de")),
                intersect(Constraint.notEqualTo("fr"), Constraint.in(Set.of("fr", "de"))));
        assertEquals(Constraint.notIn(Set.of("fr", "de")),
                intersect(Constraint.notEqualTo("fr"), Constraint.notIn(Set.of("de"))));
    }

    @Test
    public void testNotEqualsInsideIntervalBecomesExclusion() {
        Constraint c = intersect(Constraint.lessThan("56"), Constraint.notEqualTo("55.0.3"));
        assertEquals(new Constraint.Interval(null, "56", Set.of("55.0.3")), c);
        assertFalse(c.test("55.0.3"));
        assertTrue(c.test("55.0.2"));
        assertFalse(c.test("56"));

        // A point outside the interval leaves it as is.
        assertEquals(Constraint.lessThan("56"), intersect(Constraint.lessThan("56"), Constraint.notEqualTo("57")));
    }

    @Test
    public void testIntervalAgainstSets() {
        assertEquals(Constraint.in(Set.of("55.9")),
                intersect(Constraint.between("55", "56"), Constraint.in(Set.of("55.9", "56.0", "54"))));
        assertNull(intersect(Constraint.lessThan("50"), Constraint.in(Set.of("55.9"))));
        assertEquals(new Constraint.Interval("55", "56", Set.of("55.9")),
                intersect(Constraint.between("55", "56"), Constraint.notIn(Set.of("55.9", "57"))));
    }

    @Test
    public void testEmptyInSetIsUnsatisfiable() {
        Constraint empty = Constraint.in(Set.of());
        assertFalse(empty.isSatisfiable());
        for (Constraint c : CONSTRAINTS)
            assertNull(intersect(empty, c));
    }

    @Test
    public void testIntegerIntervalEmptiedByExclusions() {
        assertFalse(new Constraint.Interval(32L, 33L, Set.of(32L)).isSatisfiable());
        assertFalse(new Constraint.Interval(30, 33, Set.of(30, 31, 32)).isSatisfiable());
        assertTrue(new Constraint.Interval(30, 33, Set.of(30, 32)).isSatisfiable());

        Constraint below33 = intersect(Constraint.lessThan(33), Constraint.notEqualTo(32));
        assertNull(intersect(below33, Constraint.atLeast(32)));
        assertNull(intersect(Constraint.between(32, 34), Constraint.notIn(Set.of(32, 33))));
        assertEquals(Constraint.equalTo(33L),
                intersect(Constraint.equalTo(33), intersect(Constraint.between(32, 34), Constraint.notEqualTo(32))));
    }

    @Test
    public void testBooleanIntervalEmptiedByExclusions() {
        // [-inf, true) holds only false
        assertNull(intersect(Constraint.lessThan(true), Constraint.notEqualTo(false)));
        // both booleans excluded, negative integers remain
        assertTrue(new Constraint.Interval(null, 0L, Set.of(false, true)).isSatisfiable());
        assertFalse(new Constraint.Interval(null, Long.MIN_VALUE, Set.of(false, true)).isSatisfiable());
    }

    @Test
    public void testWideIntervalsStaySatisfiable() {
        assertTrue(new Constraint.Interval(Long.MIN_VALUE, Long.MAX_VALUE, Set.of(0L, 1L)).isSatisfiable());
        assertTrue(new Constraint.Interval(true, null, Set.of(true)).isSatisfiable());
    }

    /** Intersection must accept exactly the values both operands accept. */
    @Test
    public void testIntersectionIsExactAndCommutative() {
        for (Constraint a : CONSTRAINTS) {
            for (Constraint b : CONSTRAINTS) {
                Optional<Constraint> ab = Constraints.intersect(a, b);
                Optional<Constraint> ba = Constraints.intersect(b, a);
                assertEquals(a + " / " + b, ab, ba);
                for (Object v : SAMPLES) {
                    boolean expected = a.isSatisfiable() && b.isSatisfiable() && a.test(v) && b.test(v);
                    boolean actual = ab.isPresent() && ab.get().test(v);
                    assertEquals(a + " / " + b + " on " + v, expected, actual);
                }
            }
        }
    }

    @Test
    public void testIntersectionIsAssociativeOnSamples() {
        for (Constraint a : CONSTRAINTS) {
            for (Constraint b : CONSTRAINTS) {
                for (Constraint c : CONSTRAINTS) {
                    Optional<Constraint> left = Constraints.intersect(a, b).flatMap(x -> Constraints.intersect(x, c));
                    Optional<Constraint> right = Constraints.intersect(b, c).flatMap(x -> Constraints.intersect(a, x));
                    for (Object v : SAMPLES) {
                        assertEquals(left.isPresent() && left.get().test(v),
                                right.isPresent() && right.get().test(v));
                    }
                }
            }
        }
    }

    @Test
    public void testSelfIntersection() {
        for (Constraint c : CONSTRAINTS)
            assertEquals(c.isSatisfiable(), Constraints.intersect(c, c).isPresent());
    }

    @Test
    public void testComplementPartitionsTheSamples() {
        for (Constraint c : CONSTRAINTS) {
            if (!c.isSatisfiable())
                continue;
            for (Object v : SAMPLES) {
                int hits = c.test(v) ? 1 : 0;
                for (Constraint piece : c.complement())
                    if (piece.test(v))
                        hits++;
                assertEquals(c + " on " + v, 1, hits);
            }
        }
    }

    @Test
    public void testToString() {
        assertEquals("*", Constraint.any().toString());
        assertEquals("== \"fr\"", Constraint.equalTo("fr").toString());
        assertEquals("[-inf, \"56\")", Constraint.lessThan("56").toString());
        assertEquals("[\"54\", \"57\") except {\"55.9\"}",
                new Constraint.Interval("54", "57", Set.of("55.9")).toString());
        assertEquals("not in {\"fr\", \"ja\"}", Constraint.notIn(Set.of("ja", "fr")).toString());
    }
}
