package com.example.bpmn_transformer.util;

import com.example.bpmn_transformer.model.Box;
import com.example.bpmn_transformer.model.Point;

import java.util.Collection;
import java.util.function.Function;

/**
 * Pure geometry for generated shapes and edges.
 */
public final class LayoutGeometry {

    private LayoutGeometry() {}

    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /**
     * Point on the side of {@code box} facing {@code (tx, ty)}: left/right when
     * the horizontal displacement from the center dominates (ties go horizontal),
     * top/bottom otherwise. The free coordinate is clamped to that side.
     */
    public static Point edgeAnchor(Box box, double tx, double ty) {
        double dx = tx - box.centerX();
        double dy = ty - box.centerY();

        if (Math.abs(dx) >= Math.abs(dy)) {
            double x = dx >= 0 ? box.right() : box.left();
            return new Point(x, clamp(ty, box.top(), box.bottom()));
        }
        double y = dy >= 0 ? box.bottom() : box.top();
        return new Point(clamp(tx, box.left(), box.right()), y);
    }

    /** Anchor on {@code from} facing the center of {@code toward}. */
    public static Point edgeAnchor(Box from, Box toward) {
        return edgeAnchor(from, toward.centerX(), toward.centerY());
    }

    /**
     * Union of the boxes of {@code ids}, each resolved by {@code lookup} (null
     * falls back to {@code placeholder}), grown by {@code padding} on every side.
     */
    public static <K> Box enclosingBox(Collection<K> ids, Function<K, Box> lookup, Box placeholder, double padding) {
        if (ids.isEmpty()) throw new IllegalArgumentException("no boxes to enclose");
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (K id : ids) {
            Box b = lookup.apply(id);
            if (b == null) b = placeholder;
            minX = Math.min(minX, b.left());
            minY = Math.min(minY, b.top());
            maxX = Math.max(maxX, b.right());
            maxY = Math.max(maxY, b.bottom());
        }
        minX -= padding;
        minY -= padding;
        maxX += padding;
        maxY += padding;
        return new Box(minX, minY, maxX - minX, maxY - minY);
    }

    /** Straight connector from the right-middle of {@code source} to the left-middle of {@code target}. */
    public static Point[] forwardConnector(Box source, Box target) {
        return new Point[] {
                new Point(source.right(), source.centerY()),
                new Point(target.left(), target.centerY())
        };
    }
}
