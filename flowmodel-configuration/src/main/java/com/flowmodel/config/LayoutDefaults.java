package com.flowmodel.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Default geometry for presentation entries, in 1/100th of mm. Any missing or non-positive value in
 * a layout file falls back to the {@link #BUILT_IN} value.
 */
public final class LayoutDefaults {

    private static final int DEFAULT_MARGIN = 500;
    private static final int DEFAULT_HORIZONTAL_GAP = 1000;
    private static final int DEFAULT_VERTICAL_GAP = 800;
    private static final int DEFAULT_IF_NODE_SIZE = 400;
    private static final int DEFAULT_ACTION_WIDTH = 3000;
    private static final int DEFAULT_ACTION_HEIGHT = 1500;
    private static final int DEFAULT_EQUATION_WIDTH = 3000;
    private static final int DEFAULT_EQUATION_HEIGHT = 1500;
    private static final int DEFAULT_EQUATION_COLUMNS = 4;
    private static final int DEFAULT_STATE_WIDTH = 4000;
    private static final int DEFAULT_STATE_HEIGHT = 2500;
    private static final int DEFAULT_STATE_COLUMNS = 3;
    private static final int DEFAULT_WHEN_START_X = 500;
    private static final int DEFAULT_WHEN_START_Y = 500;
    private static final int DEFAULT_WHEN_BRANCH_OFFSET = 300;
    private static final int DEFAULT_LABEL_WIDTH = 1000;
    private static final int DEFAULT_LABEL_HEIGHT = 500;

    /** Values used when no layout file is found. */
    public static final LayoutDefaults BUILT_IN = new LayoutDefaults(
            null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);

    private final int margin;
    private final int horizontalGap;
    private final int verticalGap;
    private final int ifNodeSize;
    private final int actionWidth;
    private final int actionHeight;
    private final int equationWidth;
    private final int equationHeight;
    private final int equationColumns;
    private final int stateWidth;
    private final int stateHeight;
    private final int stateColumns;
    private final int whenStartX;
    private final int whenStartY;
    private final int whenBranchOffset;
    private final int labelWidth;
    private final int labelHeight;

    @JsonCreator
    public LayoutDefaults(
            @JsonProperty("margin") Integer margin,
            @JsonProperty("horizontalGap") Integer horizontalGap,
            @JsonProperty("verticalGap") Integer verticalGap,
            @JsonProperty("ifNodeSize") Integer ifNodeSize,
            @JsonProperty("actionWidth") Integer actionWidth,
            @JsonProperty("actionHeight") Integer actionHeight,
            @JsonProperty("equationWidth") Integer equationWidth,
            @JsonProperty("equationHeight") Integer equationHeight,
            @JsonProperty("equationColumns") Integer equationColumns,
            @JsonProperty("stateWidth") Integer stateWidth,
            @JsonProperty("stateHeight") Integer stateHeight,
            @JsonProperty("stateColumns") Integer stateColumns,
            @JsonProperty("whenStartX") Integer whenStartX,
            @JsonProperty("whenStartY") Integer whenStartY,
            @JsonProperty("whenBranchOffset") Integer whenBranchOffset,
            @JsonProperty("labelWidth") Integer labelWidth,
            @JsonProperty("labelHeight") Integer labelHeight) {
        this.margin = pick(margin, DEFAULT_MARGIN);
        this.horizontalGap = pick(horizontalGap, DEFAULT_HORIZONTAL_GAP);
        this.verticalGap = pick(verticalGap, DEFAULT_VERTICAL_GAP);
        this.ifNodeSize = pick(ifNodeSize, DEFAULT_IF_NODE_SIZE);
        this.actionWidth = pick(actionWidth, DEFAULT_ACTION_WIDTH);
        this.actionHeight = pick(actionHeight, DEFAULT_ACTION_HEIGHT);
        this.equationWidth = pick(equationWidth, DEFAULT_EQUATION_WIDTH);
        this.equationHeight = pick(equationHeight, DEFAULT_EQUATION_HEIGHT);
        this.equationColumns = pick(equationColumns, DEFAULT_EQUATION_COLUMNS);
        this.stateWidth = pick(stateWidth, DEFAULT_STATE_WIDTH);
        this.stateHeight = pick(stateHeight, DEFAULT_STATE_HEIGHT);
        this.stateColumns = pick(stateColumns, DEFAULT_STATE_COLUMNS);
        this.whenStartX = pick(whenStartX, DEFAULT_WHEN_START_X);
        this.whenStartY = pick(whenStartY, DEFAULT_WHEN_START_Y);
        this.whenBranchOffset = pick(whenBranchOffset, DEFAULT_WHEN_BRANCH_OFFSET);
        this.labelWidth = pick(labelWidth, DEFAULT_LABEL_WIDTH);
        this.labelHeight = pick(labelHeight, DEFAULT_LABEL_HEIGHT);
    }

    private static int pick(Integer value, int fallback) {
        return (value != null && value > 0) ? value : fallback;
    }

    public int getMargin() {
        return margin;
    }

    public int getHorizontalGap() {
        return horizontalGap;
    }

    public int getVerticalGap() {
        return verticalGap;
    }

    public int getIfNodeSize() {
        return ifNodeSize;
    }

    public int getActionWidth() {
        return actionWidth;
    }

    public int getActionHeight() {
        return actionHeight;
    }

    public int getEquationWidth() {
        return equationWidth;
    }

    public int getEquationHeight() {
        return equationHeight;
    }

    /** Equations per row before wrapping in a net diagram. */
    public int getEquationColumns() {
        return equationColumns;
    }

    public int getStateWidth() {
        return stateWidth;
    }

    public int getStateHeight() {
        return stateHeight;
    }

    public int getStateColumns() {
        return stateColumns;
    }

    public int getWhenStartX() {
        return whenStartX;
    }

    public int getWhenStartY() {
        return whenStartY;
    }

    public int getWhenBranchOffset() {
        return whenBranchOffset;
    }

    public int getLabelWidth() {
        return labelWidth;
    }

    public int getLabelHeight() {
        return labelHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayoutDefaults that = (LayoutDefaults) o;
        return margin == that.margin && horizontalGap == that.horizontalGap && verticalGap == that.verticalGap
                && ifNodeSize == that.ifNodeSize && actionWidth == that.actionWidth && actionHeight == that.actionHeight
                && equationWidth == that.equationWidth && equationHeight == that.equationHeight
                && equationColumns == that.equationColumns && stateWidth == that.stateWidth
                && stateHeight == that.stateHeight && stateColumns == that.stateColumns
                && whenStartX == that.whenStartX && whenStartY == that.whenStartY
                && whenBranchOffset == that.whenBranchOffset
                && labelWidth == that.labelWidth && labelHeight == that.labelHeight;
    }

    @Override
    public int hashCode() {
        return Objects.hash(margin, horizontalGap, verticalGap, ifNodeSize, actionWidth, actionHeight,
                equationWidth, equationHeight, equationColumns, stateWidth, stateHeight, stateColumns,
                whenStartX, whenStartY, whenBranchOffset, labelWidth, labelHeight);
    }
}
