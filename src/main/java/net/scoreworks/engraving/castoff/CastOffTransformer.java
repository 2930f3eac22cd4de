/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.castoff;

import net.scoreworks.engraving.Doc;
import net.scoreworks.engraving.Measure;
import net.scoreworks.engraving.exceptions.ContractViolationException;
import net.scoreworks.engraving.functors.CastOffFunctor;
import net.scoreworks.engraving.functors.PassContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Split the content of a measure into several measures. The source measure is left in place, the caller decides
 * whether to detach it afterwards.
 */
public final class CastOffTransformer {
    private static final Logger LOG = LoggerFactory.getLogger(CastOffTransformer.class);

    private CastOffTransformer() {}

    /**
     * Copy the staves and layers of source into every target measure and distribute the layer elements by onset.
     * The copies in the first target take over the identifiers of the source nodes.
     * @param targets one empty measure per segment of the plan
     * @throws ContractViolationException if source is not horizontally aligned, a target is missing or a target
     * rejects a copy
     */
    public static void castOff(Measure source, SplitPlan plan, List<Measure> targets) {
        Doc doc = source.getDoc();
        if (doc == null || !doc.isHorizontallyAligned())
            throw new ContractViolationException(source + " needs to be horizontally aligned before the cast-off");
        source.process(new CastOffFunctor(new PassContext(doc), plan, targets));
        LOG.debug("Cast off {} into {} measures at {}", source, targets.size(), plan.getBreaks());
    }
}
