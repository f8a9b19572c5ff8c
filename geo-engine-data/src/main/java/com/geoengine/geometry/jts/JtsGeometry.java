package com.geoengine.geometry.jts;

import com.geoengine.geometry.Envelope;
import com.geoengine.geometry.Geometry;
import com.geoengine.geometry.GeometryType;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.Objects;

/**
 * {@link Geometry} backed by a JTS geometry. Distance to another {@code JtsGeometry} is exact;
 * against foreign implementations it falls back to envelope distance.
 */
public final class JtsGeometry implements Geometry {

    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), 0);

    private final org.locationtech.jts.geom.Geometry delegate;

    public JtsGeometry(org.locationtech.jts.geom.Geometry delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static JtsGeometry point(double x, double y) {
        return new JtsGeometry(FACTORY.createPoint(new Coordinate(x, y)));
    }

    /** Line through the given coordinates, supplied as x0, y0, x1, y1, ... */
    public static JtsGeometry lineString(double... xy) {
        if (xy.length < 4 || xy.length % 2 != 0) {
            throw new IllegalArgumentException("lineString needs an even number of ordinates (at least two points)");
        }
        Coordinate[] coords = new Coordinate[xy.length / 2];
        for (int i = 0; i < coords.length; i++) {
            coords[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
        }
        return new JtsGeometry(FACTORY.createLineString(coords));
    }

    public static JtsGeometry fromWkt(String wkt) {
        Objects.requireNonNull(wkt, "wkt");
        try {
            return new JtsGeometry(new WKTReader(FACTORY).read(wkt));
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid WKT: " + e.getMessage(), e);
        }
    }

    public org.locationtech.jts.geom.Geometry unwrap() {
        return delegate;
    }

    @Override
    public Envelope getEnvelope() {
        if (delegate.isEmpty()) {
            return null;
        }
        org.locationtech.jts.geom.Envelope e = delegate.getEnvelopeInternal();
        return new Envelope(e.getMinX(), e.getMinY(), e.getMaxX(), e.getMaxY());
    }

    @Override
    public boolean intersects(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        if (delegate.isEmpty()) {
            return false;
        }
        org.locationtech.jts.geom.Geometry rect = FACTORY.toGeometry(new org.locationtech.jts.geom.Envelope(
                envelope.getMinX(), envelope.getMaxX(), envelope.getMinY(), envelope.getMaxY()));
        return delegate.intersects(rect);
    }

    @Override
    public double distance(Geometry other) {
        Objects.requireNonNull(other, "other");
        if (other instanceof JtsGeometry jts) {
            return delegate.distance(jts.delegate);
        }
        Envelope mine = getEnvelope();
        Envelope theirs = other.getEnvelope();
        if (mine == null || theirs == null) {
            return Double.MAX_VALUE;
        }
        return mine.distance(theirs);
    }

    @Override
    public Geometry copy() {
        return new JtsGeometry(delegate.copy());
    }

    @Override
    public GeometryType getGeometryType() {
        if (delegate.isEmpty()) {
            return GeometryType.NONE;
        }
        switch (delegate.getGeometryType()) {
            case "Point":
                return GeometryType.POINT;
            case "LineString":
                return GeometryType.LINE_STRING;
            case "LinearRing":
                return GeometryType.LINEAR_RING;
            case "Polygon":
                return GeometryType.POLYGON;
            case "MultiPoint":
                return GeometryType.MULTI_POINT;
            case "MultiLineString":
                return GeometryType.MULTI_LINE_STRING;
            case "MultiPolygon":
                return GeometryType.MULTI_POLYGON;
            case "GeometryCollection":
                return GeometryType.GEOMETRY_COLLECTION;
            default:
                return GeometryType.UNKNOWN;
        }
    }

    @Override
    public boolean isValid() {
        return delegate.isValid();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JtsGeometry)) return false;
        return delegate.equalsExact(((JtsGeometry) o).delegate);
    }

    @Override
    public int hashCode() {
        return delegate.getEnvelopeInternal().hashCode();
    }

    @Override
    public String toString() {
        return delegate.toText();
    }
}
