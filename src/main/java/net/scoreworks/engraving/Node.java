/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import net.scoreworks.engraving.exceptions.ContractViolationException;
import net.scoreworks.engraving.exceptions.IllegalDataModelException;
import net.scoreworks.engraving.functors.ConstFunctor;
import net.scoreworks.engraving.functors.FunctorCode;
import net.scoreworks.engraving.functors.MutableFunctor;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;


/**
 * Base class for each element of the document tree. A node owns its children, has one and only one parent once it is
 * added to the tree, and keeps a non-owning reference to that parent. Children can only be added through
 * {@link #addChild(Node)}, which checks them against the kinds the parent accepts.
 */
public abstract class Node implements NodeView {
    private static final Logger LOG = LoggerFactory.getLogger(Node.class);

    private final NodeKind kind;

    /**
     * Persistent identifier, kept when the document is exported again
     */
    private String id;

    /**
     * Reference to the parent, null as long as the node is not part of a tree
     */
    private Node parent;

    private final List<Node> children = new ArrayList<>();

    /**
     * Enabled capabilities with their side data
     */
    private final Map<Capability<?>, Object> capabilities = new LinkedHashMap<>();

    protected Node(NodeKind kind) {
        this.kind = kind;
        this.id = generateId(kind);
    }

    /**
     * Copy the attributes of another node. Children, parent and drawing data are not copied and the copy gets an
     * identifier of its own
     */
    protected Node(Node other) {
        this.kind = other.kind;
        this.id = generateId(kind);
        this.capabilities.putAll(other.capabilities);
    }

    public static String generateId(NodeKind kind) {
        return kind.getIdPrefix() + RandomStringUtils.randomAlphanumeric(10).toLowerCase(Locale.ROOT);
    }

    /**
     * @return a new node with the same attributes, without children and with all drawing data reset as if it was
     * freshly constructed
     */
    public abstract Node copyAttributes();

    /**
     * Hand the identifier of this node to its copy and take a newly generated one. Afterwards, exactly one of the two
     * nodes carries the original identifier.
     */
    public void transferIdentityTo(Node copy) {
        if (copy.kind != kind)
            throw new ContractViolationException("Can't transfer identity of " + this + " to " + copy);
        copy.id = id;
        id = generateId(kind);
    }

    @Override
    public NodeKind getKind() {
        return kind;
    }

    public boolean is(NodeKind kind) {
        return this.kind == kind;
    }

    @Override
    public String getId() {
        return id;
    }

    public void setId(String id) {
        Validate.notBlank(id, "identifier must not be blank");
        this.id = id;
    }

    @Override
    public Node getParent() {
        return parent;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Node> getChildren(NodeKind kind) {
        List<Node> result = new ArrayList<>();
        for (Node child : children) {
            if (child.kind == kind)
                result.add(child);
        }
        return result;
    }

    @Override
    public int getChildCount(NodeKind kind) {
        int count = 0;
        for (Node child : children) {
            if (child.kind == kind)
                count++;
        }
        return count;
    }

    public int getChildCount() {
        return children.size();
    }

    /**
     * Append a child if its kind is accepted by this node. A rejected child leaves this node untouched.
     * @return false if the child was rejected
     * @throws ContractViolationException if the child already has a parent or is this node or one of its ancestors
     */
    public boolean addChild(Node child) {
        if (child.parent != null)
            throw new ContractViolationException(child + " already belongs to " + child.parent);
        for (Node it = this; it != null; it = it.parent) {
            if (it == child)
                throw new ContractViolationException("Can't add " + child + " below itself");
        }
        if (!isSupportedChild(child)) {
            LOG.debug("{} does not accept {}", this, child);
            return false;
        }
        child.parent = this;
        children.add(child);
        return true;
    }

    /**
     * Decide whether a child can be added. Implementations may complete the child before it gets added, e.g. by
     * numbering it. Nodes accept no children unless they override this
     */
    protected boolean isSupportedChild(Node child) {
        return false;
    }

    @Override
    public Node getFirstAncestor(NodeKind kind) {
        Node it = parent;
        while (it != null) {
            if (it.kind == kind)
                return it;
            it = it.parent;
        }
        return null;
    }

    /**
     * @return the document this node belongs to, or null if it is not attached to one
     */
    public Doc getDoc() {
        if (kind == NodeKind.DOC)
            return (Doc) this;
        Node doc = getFirstAncestor(NodeKind.DOC);
        return doc == null ? null : (Doc) doc;
    }


    //==========CAPABILITIES=======================================================

    /**
     * Enable a capability. This has to happen before the document runs its first layout pass
     * @throws ContractViolationException if the document of this node has already been laid out
     */
    public <T> void enableCapability(Capability<T> capability, T data) {
        Validate.notNull(data, "capability %s needs side data", capability);
        Doc doc = getDoc();
        if (doc != null && doc.isLayoutStarted())
            throw new ContractViolationException("Can't enable " + capability + " on " + this + " after layout started");
        capabilities.put(capability, data);
    }

    /**
     * Replace the side data of a capability that is already enabled
     */
    public <T> void updateCapabilityData(Capability<T> capability, T data) {
        Validate.notNull(data, "capability %s needs side data", capability);
        if (!capabilities.containsKey(capability))
            throw new IllegalDataModelException(this, "has no capability " + capability + " to update");
        capabilities.put(capability, data);
    }

    @Override
    public boolean hasCapability(Capability<?> capability) {
        return capabilities.containsKey(capability);
    }

    @Override
    public <T> T getCapabilityData(Capability<T> capability) {
        Object data = capabilities.get(capability);
        if (data == null)
            throw new IllegalDataModelException(this, "has no capability " + capability);
        return capability.getDataType().cast(data);
    }


    //==========KIND ACCESSORS=====================================================

    private void checkKind(NodeKind expected) {
        if (kind != expected)
            throw new IllegalDataModelException(this, "is not of kind " + expected);
    }

    public Doc asDoc() {
        checkKind(NodeKind.DOC);
        return (Doc) this;
    }

    public Page asPage() {
        checkKind(NodeKind.PAGE);
        return (Page) this;
    }

    public StaffSystem asSystem() {
        checkKind(NodeKind.SYSTEM);
        return (StaffSystem) this;
    }

    public ScoreDef asScoreDef() {
        checkKind(NodeKind.SCORE_DEF);
        return (ScoreDef) this;
    }

    public StaffDef asStaffDef() {
        checkKind(NodeKind.STAFF_DEF);
        return (StaffDef) this;
    }

    public Measure asMeasure() {
        checkKind(NodeKind.MEASURE);
        return (Measure) this;
    }

    public Staff asStaff() {
        checkKind(NodeKind.STAFF);
        return (Staff) this;
    }

    public Layer asLayer() {
        checkKind(NodeKind.LAYER);
        return (Layer) this;
    }

    public LayerElement asLayerElement() {
        if (!kind.isLayerElement())
            throw new IllegalDataModelException(this, "is not a layer element");
        return (LayerElement) this;
    }

    public Note asNote() {
        checkKind(NodeKind.NOTE);
        return (Note) this;
    }

    public Clef asClef() {
        checkKind(NodeKind.CLEF);
        return (Clef) this;
    }

    public Verse asVerse() {
        checkKind(NodeKind.VERSE);
        return (Verse) this;
    }


    //==========TRAVERSAL==========================================================

    /**
     * Run a traversal in pre-order, depth first: entry handler, children in order, end handler.
     * @return {@link FunctorCode#STOP} if the traversal was aborted, {@link FunctorCode#SKIP_SIBLINGS} if the caller
     * should not visit the remaining siblings of this node, {@link FunctorCode#CONTINUE} otherwise
     */
    public FunctorCode process(MutableFunctor functor) {
        FunctorCode code = accept(functor);
        if (code == FunctorCode.STOP)
            return FunctorCode.STOP;
        if (code == FunctorCode.CONTINUE) {
            //handlers are allowed to change the tree, so iterate over a snapshot
            for (Node child : new ArrayList<>(children)) {
                FunctorCode childCode = child.process(functor);
                if (childCode == FunctorCode.STOP)
                    return FunctorCode.STOP;
                if (childCode == FunctorCode.SKIP_SIBLINGS)
                    break;
            }
        }
        FunctorCode endCode = acceptEnd(functor);
        if (endCode == FunctorCode.STOP)
            return FunctorCode.STOP;
        if (code == FunctorCode.SKIP_SIBLINGS || endCode == FunctorCode.SKIP_SIBLINGS)
            return FunctorCode.SKIP_SIBLINGS;
        return FunctorCode.CONTINUE;
    }

    @Override
    public FunctorCode process(ConstFunctor functor) {
        FunctorCode code = accept(functor);
        if (code == FunctorCode.STOP)
            return FunctorCode.STOP;
        if (code == FunctorCode.CONTINUE) {
            for (Node child : children) {
                FunctorCode childCode = child.process(functor);
                if (childCode == FunctorCode.STOP)
                    return FunctorCode.STOP;
                if (childCode == FunctorCode.SKIP_SIBLINGS)
                    break;
            }
        }
        FunctorCode endCode = acceptEnd(functor);
        if (endCode == FunctorCode.STOP)
            return FunctorCode.STOP;
        if (code == FunctorCode.SKIP_SIBLINGS || endCode == FunctorCode.SKIP_SIBLINGS)
            return FunctorCode.SKIP_SIBLINGS;
        return FunctorCode.CONTINUE;
    }

    //dispatch to the handler of the kind group, overridden by each kind

    protected FunctorCode accept(MutableFunctor functor) {
        return functor.visitNode(this);
    }

    protected FunctorCode acceptEnd(MutableFunctor functor) {
        return functor.visitNodeEnd(this);
    }

    protected FunctorCode accept(ConstFunctor functor) {
        return functor.visitNode(this);
    }

    protected FunctorCode acceptEnd(ConstFunctor functor) {
        return functor.visitNodeEnd(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
