package com.modeldoc.loader.ast;

import java.util.ArrayList;
import java.util.List;

public final class ModelFileNode {
    private final String sourceName;
    private final List<BlockNode> blocks;

    public ModelFileNode(String sourceName, List<BlockNode> blocks) {
        this.sourceName = sourceName;
        this.blocks = List.copyOf(blocks);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<BlockNode> getBlocks() {
        return blocks;
    }

    /** All regions of all blocks, in file order. */
    public List<RegionNode> getRegions() {
        List<RegionNode> regions = new ArrayList<>();
        for (BlockNode block : blocks) {
            regions.addAll(block.getRegions());
        }
        return regions;
    }

    public int getEquationCount() {
        int count = 0;
        for (BlockNode block : blocks) {
            for (RegionNode region : block.getRegions()) {
                count += region.getEquations().size();
            }
        }
        return count;
    }
}
