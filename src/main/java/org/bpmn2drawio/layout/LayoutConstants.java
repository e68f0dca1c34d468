package org.bpmn2drawio.layout;

/**
 * Spacing used by automatic layout, in diagram pixels.
 */
public final class LayoutConstants {
    public static final double MARGIN = 50;
    public static final double POOL_HEADER = 40;
    public static final double LANE_HEADER = 30;
    public static final double LANE_PADDING = 20;
    public static final double RANK_SEPARATION = 80;
    public static final double SLOT_GAP = 40;
    public static final double POOL_GAP = 40;
    public static final double MIN_LANE_EXTENT = 120;

    private LayoutConstants() {
    }
}
