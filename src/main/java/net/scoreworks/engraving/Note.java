/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving;

import java.util.ArrayList;
import java.util.List;

/**
 * A note, positioned on the staff either by an explicit staff location or by its pitch and the clef in effect
 */
public class Note extends LayerElement {
    private PitchName pname;
    private int oct = 4;
    /** explicit staff location, 0 being the bottom line, null if derived from the pitch */
    private Integer loc;
    private boolean colored;

    private transient int drawingLoc;

    public Note() {
        super(NodeKind.NOTE);
    }

    public Note(PitchName pname, int oct) {
        this();
        this.pname = pname;
        this.oct = oct;
    }

    private Note(Note other) {
        super(other);
        this.pname = other.pname;
        this.oct = other.oct;
        this.loc = other.loc;
        this.colored = other.colored;
    }

    @Override
    public Note copyAttributes() {
        return new Note(this);
    }

    @Override
    protected boolean isSupportedChild(Node child) {
        return child.is(NodeKind.VERSE);
    }

    public PitchName getPname() {
        return pname;
    }

    public int getOct() {
        return oct;
    }

    public void setPitch(PitchName pname, int oct) {
        this.pname = pname;
        this.oct = oct;
    }

    /**
     * @return true if the note head is filled with the alternate color, e.g. for coloration in mensural notation
     */
    public boolean isColored() {
        return colored;
    }

    public void setColored(boolean colored) {
        this.colored = colored;
    }

    public boolean hasLoc() {
        return loc != null;
    }

    public Integer getLoc() {
        return loc;
    }

    public void setLoc(Integer loc) {
        this.loc = loc;
    }

    /**
     * Staff location of the pitch with a clef, 0 being the bottom line
     */
    public int calcLoc(ClefShape clefShape, int clefLine) {
        if (loc != null)
            return loc;
        if (pname == null)
            return 0;
        int clefLoc = (clefLine - 1) * 2;
        int clefStep = clefShape.getOctave() * 7 + clefShape.getPitch().getStep();
        return oct * 7 + pname.getStep() - clefStep + clefLoc;
    }

    public int getDrawingLoc() {
        return drawingLoc;
    }

    public void setDrawingLoc(int drawingLoc) {
        this.drawingLoc = drawingLoc;
    }

    public List<Verse> getVerses() {
        List<Verse> verses = new ArrayList<>();
        for (Node child : getChildren(NodeKind.VERSE)) {
            verses.add(child.asVerse());
        }
        return verses;
    }
}
