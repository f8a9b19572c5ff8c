package com.geoengine.data;

import com.geoengine.geometry.Envelope;
import com.geoengine.geometry.Geometry;
import com.geoengine.geometry.GeometryType;
import com.geoengine.geometry.jts.JtsGeometry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureTest {

    private static final Style HIGHWAY = () -> "highway";

    @Test
    void defaultId_isFreshPerFeature() {
        Feature a = new Feature();
        Feature b = new Feature();

        assertNotNull(a.getId());
        assertNotEquals(a, b);
    }

    @Test
    void equality_isByIdOnly() {
        Feature a = new Feature("x", JtsGeometry.point(0, 0), AttributeTable.of("k", 1));
        Feature b = new Feature("x", null, new AttributeTable());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void constructor_doesNotShareCallersAttributeTable() {
        AttributeTable shared = AttributeTable.of("kind", "road");
        Feature road = new Feature(null, shared);
        Feature river = new Feature(null, shared);

        river.getAttributes().put("kind", "river");
        shared.put("lanes", 2);

        assertNotSame(road.getAttributes(), river.getAttributes());
        assertNotSame(shared, road.getAttributes());
        assertEquals("road", road.getAttributes().getString("kind").orElseThrow());
        assertFalse(road.getAttributes().exists("lanes"));
    }

    @Test
    void copy_keepsIdAndDeepCopiesAttributesAndGeometry() {
        Feature original = new Feature("f1", JtsGeometry.point(1, 2), AttributeTable.of("name", "A1"));
        original.setStyle(HIGHWAY);

        Feature copy = original.copy();
        copy.getAttributes().put("name", "changed");

        assertEquals(original, copy);
        assertEquals("A1", original.getAttributes().getString("name").orElseThrow());
        assertNotSame(original.getGeometry(), copy.getGeometry());
        assertEquals(original.getGeometry(), copy.getGeometry());
        assertSame(HIGHWAY, copy.getStyle());
    }

    @Test
    void copyWithId_givesNewIdentity() {
        Feature original = new Feature("f1", null, AttributeTable.of("name", "A1"));

        Feature copy = original.copyWithId("f9");

        assertNotEquals(original, copy);
        assertEquals(original.getAttributes(), copy.getAttributes());
    }

    @Test
    void boundingBox_nullWithoutGeometry() {
        assertNull(new Feature().getBoundingBox());
        assertEquals(Envelope.ofPoint(3, 4), new Feature(JtsGeometry.point(3, 4)).getBoundingBox());
    }

    @Test
    void isValid_trueWithoutGeometry() {
        assertTrue(new Feature().isValid());
        assertFalse(new Feature(JtsGeometry.fromWkt("POLYGON ((0 0, 10 10, 0 10, 10 0, 0 0))")).isValid());
    }

    @Test
    void distance_maxValueWhenGeometryMissing() {
        Feature a = new Feature(JtsGeometry.point(0, 0));
        Feature b = new Feature(JtsGeometry.point(3, 4));

        assertEquals(5.0, a.distance(b), 1e-9);
        assertEquals(Double.MAX_VALUE, a.distance(new Feature()));
    }

    @Test
    void transform_replacesGeometryOnly() {
        Feature f = new Feature("f", JtsGeometry.point(1, 1), AttributeTable.of("k", "v"));
        Geometry shifted = JtsGeometry.point(101, 101);

        f.transform(g -> shifted);

        assertSame(shifted, f.getGeometry());
        assertEquals(GeometryType.POINT, f.getGeometry().getGeometryType());
        assertEquals("v", f.getAttributes().getString("k").orElseThrow());
    }

    @Test
    void transform_noOpWithoutGeometryAndRejectsNull() {
        Feature f = new Feature();
        f.transform(g -> {
            throw new AssertionError("must not be called");
        });

        assertNull(f.getGeometry());
        assertThrows(IllegalArgumentException.class, () -> f.transform(null));
    }

    @Test
    void constructor_rejectsNullId() {
        assertThrows(IllegalArgumentException.class, () -> new Feature(null, null, null));
    }
}
