package com.geoengine.data;

import com.geoengine.geometry.CoordinateTransformation;
import com.geoengine.geometry.Envelope;
import com.geoengine.geometry.Geometry;

import java.util.Objects;
import java.util.UUID;

/**
 * A geographic entity: optional geometry, an attribute table and an optional shared style.
 * <p>
 * The id is fixed at construction and is the sole basis of {@link #equals(Object)}: two features
 * with the same id are equal even when their geometry or attributes differ. Geometry and
 * attributes are exclusively owned by this feature; the style is shared.
 */
public final class Feature {

    private final Object id;
    private final AttributeTable attributes;
    private Geometry geometry;
    private Style style;

    /** Feature with a fresh random id, no geometry and empty attributes. */
    public Feature() {
        this(UUID.randomUUID(), null, new AttributeTable());
    }

    public Feature(Geometry geometry) {
        this(UUID.randomUUID(), geometry, new AttributeTable());
    }

    public Feature(Geometry geometry, AttributeTable attributes) {
        this(UUID.randomUUID(), geometry, attributes);
    }

    /** {@code attributes} is copied; later changes to the caller's table do not reach this feature. */
    public Feature(Object id, Geometry geometry, AttributeTable attributes) {
        if (id == null) {
            throw new IllegalArgumentException("Feature id must not be null");
        }
        this.id = id;
        this.geometry = geometry;
        this.attributes = attributes != null ? attributes.copy() : new AttributeTable();
    }

    public Object getId() {
        return id;
    }

    /** Geometry or null. */
    public Geometry getGeometry() {
        return geometry;
    }

    public void setGeometry(Geometry geometry) {
        this.geometry = geometry;
    }

    public AttributeTable getAttributes() {
        return attributes;
    }

    /** Shorthand for {@code getAttributes().get(name)}. */
    public AttributeValue getAttribute(String name) {
        return attributes.get(name);
    }

    public Style getStyle() {
        return style;
    }

    public void setStyle(Style style) {
        this.style = style;
    }

    public boolean hasGeometry() {
        return geometry != null;
    }

    /** True when there is no geometry or the geometry reports itself valid. */
    public boolean isValid() {
        return geometry == null || geometry.isValid();
    }

    /** Envelope of the geometry; null when there is no geometry. */
    public Envelope getBoundingBox() {
        return geometry != null ? geometry.getEnvelope() : null;
    }

    /**
     * Distance between the two geometries, or {@link Double#MAX_VALUE} when either feature has none.
     */
    public double distance(Feature other) {
        Objects.requireNonNull(other, "other");
        if (geometry == null || other.geometry == null) {
            return Double.MAX_VALUE;
        }
        return geometry.distance(other.geometry);
    }

    /**
     * Replaces the geometry with its transformed form. Attributes and style are untouched;
     * a feature without geometry is left as is.
     */
    public void transform(CoordinateTransformation transformation) {
        if (transformation == null) {
            throw new IllegalArgumentException("transformation must not be null");
        }
        if (geometry != null) {
            geometry = transformation.transform(geometry);
        }
    }

    /**
     * Copy with the same id (so {@code copy().equals(this)}), deep-copied geometry and
     * attributes, and the same style reference.
     */
    public Feature copy() {
        return copyWithId(id);
    }

    /** Like {@link #copy()} but with a different identity. */
    public Feature copyWithId(Object newId) {
        Feature copy = new Feature(newId, geometry != null ? geometry.copy() : null, attributes);
        copy.style = style;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Feature)) return false;
        return id.equals(((Feature) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Feature[id=" + id + ", geometry=" + (geometry != null ? geometry.getGeometryType() : "none")
                + ", attributes=" + attributes.size() + "]";
    }
}
