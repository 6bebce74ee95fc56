package com.modeldoc.loader.ast;

import java.util.List;

/** A complete {@code ADDEQ [TOP|BOTTOM], ... ;} block. Void regions are already dropped. */
public final class BlockNode {
    private final Placement placement;
    private final List<RegionNode> regions;
    private final SourceLocation location;

    public BlockNode(Placement placement, List<RegionNode> regions, SourceLocation location) {
        this.placement = placement;
        this.regions = List.copyOf(regions);
        this.location = location;
    }

    public Placement getPlacement() {
        return placement;
    }

    public List<RegionNode> getRegions() {
        return regions;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
