package com.flowmodel.materializer.placement;

import com.flowmodel.config.LayoutDefaults;
import com.flowmodel.graph.Box;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.PlanRef;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default geometry for presented elements. Pure: boxes depend only on the layout defaults, the
 * ordinal of the element and the boxes already present, so identical inputs give identical boxes.
 * Caller-supplied positions and sizes always win.
 */
public final class PlacementEngine {

    private final LayoutDefaults defaults;

    public PlacementEngine(LayoutDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public LayoutDefaults getDefaults() {
        return defaults;
    }

    public Size equationSize() {
        return new Size(defaults.getEquationWidth(), defaults.getEquationHeight());
    }

    public Size stateSize() {
        return new Size(defaults.getStateWidth(), defaults.getStateHeight());
    }

    /** State machine box large enough for two rows of states. */
    public Size stateMachineSize() {
        int columns = defaults.getStateColumns();
        int width = 2 * defaults.getMargin() + columns * defaults.getStateWidth() + (columns - 1) * defaults.getHorizontalGap();
        int height = 2 * defaults.getMargin() + 2 * defaults.getStateHeight() + defaults.getVerticalGap();
        return new Size(width, height);
    }

    /**
     * Next free cell of a diagram grid. The cell is chosen by ordinal ({@code equationColumns} per
     * row) and moved down until it no longer overlaps an existing entry.
     */
    public Box placeInDiagram(List<Box> existing, Size size) {
        int columns = defaults.getEquationColumns();
        int ordinal = existing.size();
        int x = defaults.getMargin() + (ordinal % columns) * (defaults.getEquationWidth() + defaults.getHorizontalGap());
        int y = defaults.getMargin() + (ordinal / columns) * (defaults.getEquationHeight() + defaults.getVerticalGap());
        return freeBelow(Box.of(x, y, size.width(), size.height()), existing);
    }

    /** Grid cell of the next state inside its state machine. */
    public Box placeState(Box machine, List<Box> existingStates) {
        int columns = defaults.getStateColumns();
        int ordinal = existingStates.size();
        int x = machine.left() + defaults.getMargin() + (ordinal % columns) * (defaults.getStateWidth() + defaults.getHorizontalGap());
        int y = machine.top() + defaults.getMargin() + (ordinal / columns) * (defaults.getStateHeight() + defaults.getVerticalGap());
        return freeBelow(Box.of(x, y, defaults.getStateWidth(), defaults.getStateHeight()), existingStates);
    }

    /**
     * If block anchored at {@code origin}: decisions in columns by depth, actions stacked in one
     * column right of the deepest decision, each decision on the row of its first action.
     */
    public IfLayout layoutIf(Point origin, BranchShape root) {
        int columns = decisionColumns(root);
        int actionX = origin.x() + defaults.getMargin() + columns * (defaults.getIfNodeSize() + defaults.getHorizontalGap());
        Map<PlanRef, Box> boxes = new LinkedHashMap<>();
        placeBranch(root, 0, origin, actionX, new int[]{0}, boxes);
        return new IfLayout(enclose(origin, boxes.values()), boxes);
    }

    /**
     * When block anchored at {@code origin}: branch actions stacked from the start offset, each
     * label shifted into its action by the branch offset.
     */
    public WhenLayout layoutWhen(Point origin, List<WhenShape> branches) {
        Map<PlanRef, Box> actions = new LinkedHashMap<>();
        Map<PlanRef, Box> labels = new LinkedHashMap<>();
        int step = defaults.getActionHeight() + defaults.getVerticalGap();
        for (int k = 0; k < branches.size(); k++) {
            WhenShape shape = branches.get(k);
            Point position = shape.position() != null ? shape.position()
                    : new Point(origin.x() + defaults.getWhenStartX(), origin.y() + defaults.getWhenStartY() + k * step);
            Size size = shape.size() != null ? shape.size() : new Size(defaults.getActionWidth(), defaults.getActionHeight());
            Box action = new Box(position, size);
            actions.put(shape.action(), action);
            int labelWidth = shape.labelWidth() != null ? shape.labelWidth() : defaults.getLabelWidth();
            labels.put(shape.branch(), Box.of(origin.x() + defaults.getWhenStartX() + defaults.getWhenBranchOffset(),
                    action.top() + defaults.getWhenBranchOffset(), labelWidth, defaults.getLabelHeight()));
        }
        return new WhenLayout(enclose(origin, actions.values()), actions, labels);
    }

    private int placeBranch(BranchShape shape, int depth, Point origin, int actionX, int[] row, Map<PlanRef, Box> boxes) {
        if (shape instanceof ActionShape action) {
            Point position = action.position() != null ? action.position()
                    : new Point(actionX, origin.y() + defaults.getMargin() + row[0] * (defaults.getActionHeight() + defaults.getVerticalGap()));
            Size size = action.size() != null ? action.size() : new Size(defaults.getActionWidth(), defaults.getActionHeight());
            row[0]++;
            boxes.put(action.ifAction(), new Box(position, size));
            return position.y();
        }
        DecisionShape decision = (DecisionShape) shape;
        boxes.put(decision.node(), null);
        int firstY = placeBranch(decision.thenBranch(), depth + 1, origin, actionX, row, boxes);
        placeBranch(decision.elseBranch(), depth + 1, origin, actionX, row, boxes);
        int size = defaults.getIfNodeSize();
        Point position = decision.position() != null ? decision.position()
                : new Point(origin.x() + defaults.getMargin() + depth * (size + defaults.getHorizontalGap()), firstY);
        boxes.put(decision.node(), new Box(position, new Size(size, size)));
        return firstY;
    }

    private static int decisionColumns(BranchShape shape) {
        if (shape instanceof DecisionShape d) {
            return 1 + Math.max(decisionColumns(d.thenBranch()), decisionColumns(d.elseBranch()));
        }
        return 0;
    }

    private Box enclose(Point origin, Collection<Box> boxes) {
        int right = origin.x() + defaults.getMargin();
        int bottom = origin.y() + defaults.getMargin();
        for (Box b : boxes) {
            right = Math.max(right, b.right());
            bottom = Math.max(bottom, b.bottom());
        }
        return Box.of(origin.x(), origin.y(),
                right - origin.x() + defaults.getMargin(), bottom - origin.y() + defaults.getMargin());
    }

    private Box freeBelow(Box candidate, List<Box> existing) {
        Box box = candidate;
        boolean moved = true;
        while (moved) {
            moved = false;
            for (Box other : existing) {
                if (box.overlaps(other)) {
                    box = Box.of(box.left(), other.bottom() + defaults.getVerticalGap(), box.size().width(), box.size().height());
                    moved = true;
                }
            }
        }
        return box;
    }
}
