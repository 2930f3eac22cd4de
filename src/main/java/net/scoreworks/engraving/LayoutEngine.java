/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.castoff.CastOffTransformer;
import net.scoreworks.engraving.castoff.SplitPlan;
import net.scoreworks.engraving.functors.*;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Run the layout passes over a document in the order they depend on each other. Each pass gets a fresh
 * {@link PassContext}. The passes can also be run one by one, in which case the caller is responsible for the order:
 * resets before the passes filling in drawing data, horizontal before vertical alignment, vertical alignment before
 * placing systems and ledger lines.
 */
public class LayoutEngine {
    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    private final Doc doc;

    public LayoutEngine(@NotNull Doc doc) {
        this.doc = doc;
    }

    public Doc getDoc() {
        return doc;
    }

    /**
     * Compute the complete layout. Running it again without changing the document gives the same geometry
     */
    public void layOut() {
        LOG.debug("Laying out {}", doc);
        resetData();
        prepareTimeSpanning();
        prepareCrossStaff();
        alignHorizontally();
        resetVerticalAlignment();
        alignVertically();
        alignSystems();
        calcLedgerLines();
        calcStems();
    }

    public void resetData() {
        run(new ResetDataFunctor(new PassContext(doc)));
    }

    public void prepareTimeSpanning() {
        run(new PrepareTimeSpanningFunctor(new PassContext(doc)));
    }

    public void prepareCrossStaff() {
        run(new PrepareCrossStaffFunctor(new PassContext(doc)));
    }

    public void alignHorizontally() {
        run(new AlignHorizontallyFunctor(new PassContext(doc)));
    }

    public void resetVerticalAlignment() {
        run(new ResetVerticalAlignmentFunctor(new PassContext(doc)));
    }

    public void alignVertically() {
        run(new AlignVerticallyFunctor(new PassContext(doc)));
    }

    public void alignSystems() {
        run(new AlignSystemsFunctor(new PassContext(doc)));
    }

    public void calcLedgerLines() {
        run(new CalcLedgerLinesFunctor(new PassContext(doc)));
    }

    public void calcStems() {
        run(new CalcStemFunctor(new PassContext(doc)));
    }

    /**
     * Split a measure of this document into the given target measures
     * @see CastOffTransformer#castOff(Measure, SplitPlan, List)
     */
    public void castOff(Measure source, SplitPlan plan, List<Measure> targets) {
        CastOffTransformer.castOff(source, plan, targets);
    }

    /**
     * @return the node with this identifier, null if the document has none
     */
    public NodeView findById(String id) {
        FindByIdFunctor functor = new FindByIdFunctor(new PassContext(doc), id);
        doc.process(functor);
        return functor.getFound();
    }

    public LayoutSnapshot snapshot() {
        GeometrySnapshotFunctor functor = new GeometrySnapshotFunctor(new PassContext(doc));
        doc.process(functor);
        return functor.getSnapshot();
    }

    private void run(MutableFunctor functor) {
        LOG.debug("Running {} on {}", functor.getClass().getSimpleName(), doc);
        doc.process(functor);
    }
}
