/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import net.scoreworks.engraving.castoff.SplitPlan;
import net.scoreworks.engraving.exceptions.ContractViolationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribute the content of one measure over several target measures. Containers (staves, layers and editorial
 * elements) are copied into every segment, layer elements are copied with their subtree into the segment their onset
 * falls in, control elements into the segment of their start element. Time points and spans of the copies are
 * pointed to the copied elements at the end.
 */
public class CastOffFunctor extends MutableFunctor {
    private final SplitPlan plan;
    private final List<Measure> targets;
    /** per segment copies of the container currently visited */
    private final Deque<List<Node>> segmentParents = new ArrayDeque<>();
    private final Map<Node, Node> copies = new IdentityHashMap<>();
    private Measure source;

    public CastOffFunctor(PassContext context, SplitPlan plan, List<Measure> targets) {
        super(context);
        if (targets == null || targets.size() != plan.getSegmentCount())
            throw new ContractViolationException("Cast-off with " + plan + " needs " + plan.getSegmentCount()
                    + " target measures");
        for (Measure target : targets) {
            if (target == null)
                throw new ContractViolationException("Cast-off target measure is missing");
        }
        this.plan = plan;
        this.targets = targets;
    }

    @Override
    public FunctorCode visitMeasure(Measure measure) {
        if (source != null)
            throw new ContractViolationException("Cast-off runs on a single measure");
        source = measure;
        segmentParents.push(new ArrayList<>(targets));
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitStaff(Staff staff) {
        return copyContainer(staff);
    }

    @Override
    public FunctorCode visitStaffEnd(Staff staff) {
        segmentParents.pop();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayer(Layer layer) {
        return copyContainer(layer);
    }

    @Override
    public FunctorCode visitLayerEnd(Layer layer) {
        segmentParents.pop();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitEditorialElement(EditorialElement element) {
        return copyContainer(element);
    }

    @Override
    public FunctorCode visitEditorialElementEnd(EditorialElement element) {
        segmentParents.pop();
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode visitLayerElement(LayerElement element) {
        if (element.getOnset() == null)
            throw new ContractViolationException(element + " has no onset, align the document horizontally first");
        int segment = plan.getSegmentIndex(element.getOnset());
        attach(segmentParents.peek().get(segment), deepCopy(element));
        return FunctorCode.SKIP_CHILDREN;
    }

    @Override
    public FunctorCode visitControlElement(ControlElement element) {
        int segment = 0;
        if (element.hasCapability(Capability.TIME_POINT)) {
            LayerElementView start = element.getCapabilityData(Capability.TIME_POINT).getStart();
            if (start.getOnset() != null)
                segment = plan.getSegmentIndex(start.getOnset());
        }
        attach(targets.get(segment), deepCopy(element));
        return FunctorCode.SKIP_CHILDREN;
    }

    @Override
    public FunctorCode visitMeasureEnd(Measure measure) {
        segmentParents.pop();
        for (Node copy : copies.values()) {
            remapTimeReferences(copy);
        }
        return FunctorCode.CONTINUE;
    }

    private FunctorCode copyContainer(Node node) {
        List<Node> parents = segmentParents.peek();
        List<Node> segments = new ArrayList<>();
        for (int i = 0; i < parents.size(); i++) {
            Node copy = node.copyAttributes();
            if (i == 0)
                node.transferIdentityTo(copy);
            attach(parents.get(i), copy);
            segments.add(copy);
        }
        segmentParents.push(segments);
        return FunctorCode.CONTINUE;
    }

    private Node deepCopy(Node node) {
        Node copy = node.copyAttributes();
        node.transferIdentityTo(copy);
        copies.put(node, copy);
        for (Node child : node.getChildren()) {
            attach(copy, deepCopy(child));
        }
        return copy;
    }

    private void attach(Node parent, Node child) {
        if (!parent.addChild(child))
            throw new ContractViolationException(parent + " rejected " + child + " during cast-off");
    }

    private void remapTimeReferences(Node copy) {
        if (copy.hasCapability(Capability.TIME_SPANNING)) {
            TimeSpan remapped = copy.getCapabilityData(Capability.TIME_SPANNING).remapElements(copies);
            copy.updateCapabilityData(Capability.TIME_SPANNING, remapped);
            if (copy.hasCapability(Capability.TIME_POINT))
                copy.updateCapabilityData(Capability.TIME_POINT, remapped);
        }
        else if (copy.hasCapability(Capability.TIME_POINT)) {
            TimePoint point = copy.getCapabilityData(Capability.TIME_POINT);
            copy.updateCapabilityData(Capability.TIME_POINT, point.remapElements(copies));
        }
    }
}
