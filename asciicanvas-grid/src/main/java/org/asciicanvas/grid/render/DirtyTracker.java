package org.asciicanvas.grid.render;

/**
 * Accumulates the cells changed since the last render pull.
 * <p>
 * Holds a bounding rectangle plus a sticky full-redraw flag. An empty rectangle without the flag
 * is still reported as needing a full redraw, so a never-rendered surface is painted completely.
 */
public final class DirtyTracker {

    private DirtyRect dirty = DirtyRect.empty();
    private boolean fullRedrawRequested;

    public void markDirty(int x, int y) {
        dirty = dirty.include(x, y);
    }

    public void markRegionDirty(int x1, int y1, int x2, int y2) {
        dirty = dirty.union(DirtyRect.fromPoints(x1, y1, x2, y2));
    }

    public void markRegionDirty(DirtyRect rect) {
        dirty = dirty.union(rect);
    }

    public void requestFullRedraw() {
        fullRedrawRequested = true;
    }

    public boolean isFullRedrawRequested() {
        return fullRedrawRequested;
    }

    public DirtyRect getDirtyRect() {
        return dirty;
    }

    public boolean needsFullRedraw() {
        return fullRedrawRequested || dirty.isEmpty();
    }

    /**
     * True when something was marked or a full redraw was requested since the last clear.
     */
    public boolean hasPendingChanges() {
        return fullRedrawRequested || !dirty.isEmpty();
    }

    public void clear() {
        dirty = DirtyRect.empty();
        fullRedrawRequested = false;
    }

    @Override
    public String toString() {
        return "DirtyTracker{" + "dirty=" + dirty + ", fullRedrawRequested=" + fullRedrawRequested + '}';
    }
}
