package net.scoreworks.engraving.functors;

import net.scoreworks.engraving.*;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class FunctorTests {
    Measure measure;
    Staff staff1, staff2;
    Note note1;

    static class RecordingFunctor extends MutableFunctor {
        final List<String> calls = new ArrayList<>();
        final Map<Node, FunctorCode> codes = new HashMap<>();
        final Map<Node, FunctorCode> endCodes = new HashMap<>();

        RecordingFunctor() {
            super(new PassContext(null));
        }

        @Override
        public FunctorCode visitNode(Node node) {
            calls.add(name(node));
            return codes.getOrDefault(node, FunctorCode.CONTINUE);
        }

        @Override
        public FunctorCode visitNodeEnd(Node node) {
            calls.add("/" + name(node));
            return endCodes.getOrDefault(node, FunctorCode.CONTINUE);
        }

        private static String name(Node node) {
            String name = node.getKind().name().toLowerCase(Locale.ROOT);
            if (node.is(NodeKind.STAFF))
                name += node.asStaff().getN();
            return name;
        }
    }

    @BeforeEach
    public void createMeasure() {
        measure = new Measure();
        staff1 = new Staff(1);
        staff2 = new Staff(2);
        measure.addChild(staff1);
        measure.addChild(staff2);
        staff1.addChild(new Layer());
        staff2.addChild(new Layer());
        note1 = TestScores.quarter(PitchName.C, 4);
        staff1.getLayer(1).addChild(note1);
        staff2.getLayer(1).addChild(TestScores.quarter(PitchName.E, 4));
    }

    @Test
    public void testPreOrder() {
        RecordingFunctor functor = new RecordingFunctor();
        Assertions.assertEquals(FunctorCode.CONTINUE, measure.process(functor));
        Assertions.assertEquals(List.of("measure",
                "staff1", "layer", "note", "/note", "/layer", "/staff1",
                "staff2", "layer", "note", "/note", "/layer", "/staff2",
                "/measure"), functor.calls);
    }

    @Test
    public void testSkipChildren() {
        RecordingFunctor functor = new RecordingFunctor();
        functor.codes.put(staff1, FunctorCode.SKIP_CHILDREN);
        measure.process(functor);
        Assertions.assertEquals(List.of("measure",
                "staff1", "/staff1",
                "staff2", "layer", "note", "/note", "/layer", "/staff2",
                "/measure"), functor.calls);
    }

    @Test
    public void testSkipSiblings() {
        RecordingFunctor functor = new RecordingFunctor();
        functor.codes.put(staff1, FunctorCode.SKIP_SIBLINGS);
        Assertions.assertEquals(FunctorCode.CONTINUE, measure.process(functor));
        Assertions.assertEquals(List.of("measure", "staff1", "/staff1", "/measure"), functor.calls);
    }

    @Test
    public void testSkipSiblingsFromEndHandler() {
        RecordingFunctor functor = new RecordingFunctor();
        functor.endCodes.put(note1.getParent(), FunctorCode.SKIP_SIBLINGS);
        measure.process(functor);
        Assertions.assertEquals(List.of("measure",
                "staff1", "layer", "note", "/note", "/layer", "/staff1",
                "staff2", "layer", "note", "/note", "/layer", "/staff2",
                "/measure"), functor.calls);
    }

    @Test
    public void testStopEndsTraversal() {
        RecordingFunctor functor = new RecordingFunctor();
        functor.codes.put(note1, FunctorCode.STOP);
        Assertions.assertEquals(FunctorCode.STOP, measure.process(functor));
        Assertions.assertEquals(List.of("measure", "staff1", "layer", "note"), functor.calls);
    }

    @Test
    public void testStopFromEndHandler() {
        RecordingFunctor functor = new RecordingFunctor();
        functor.endCodes.put(staff1, FunctorCode.STOP);
        Assertions.assertEquals(FunctorCode.STOP, measure.process(functor));
        Assertions.assertEquals(List.of("measure", "staff1", "layer", "note", "/note", "/layer", "/staff1"),
                functor.calls);
    }

    @Test
    public void testFindById() {
        FindByIdFunctor functor = new FindByIdFunctor(new PassContext(null), note1.getId());
        Assertions.assertEquals(FunctorCode.STOP, measure.process(functor));
        Assertions.assertSame(note1, functor.getFound());

        FindByIdFunctor missing = new FindByIdFunctor(new PassContext(null), "unknown");
        Assertions.assertEquals(FunctorCode.CONTINUE, measure.process(missing));
        Assertions.assertNull(missing.getFound());
    }
}
