/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.io;

import net.scoreworks.engraving.*;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Build a document from the event lists of the voices of a mensural piece. The result has one page with one system
 * holding a single unmeasured measure, with one staff per voice. Voices without events get a hidden staff.
 * Durations follow the mensuration in effect in each voice, a minim lasting half a whole note. An explicit length
 * given in minims overrides the value of the note type.
 * <p>
 * Supported events are Clef (or key signature), Dot, Mensuration, Note, OriginalText and Rest. Others are skipped.
 */
public class EventListImporter {
    private static final Logger LOG = LoggerFactory.getLogger(EventListImporter.class);

    private static final Map<String, ClefShape> CLEF_SHAPES = Map.of(
            "C", ClefShape.C,
            "F", ClefShape.F,
            "G", ClefShape.G,
            "Frnd", ClefShape.F,
            "Fsqr", ClefShape.F);

    private static final Map<String, PitchName> PITCH_NAMES = Map.of(
            "C", PitchName.C,
            "D", PitchName.D,
            "E", PitchName.E,
            "F", PitchName.F,
            "G", PitchName.G,
            "A", PitchName.A,
            "B", PitchName.B);

    /** written accidentals of key signatures, flats by default */
    private static final Map<String, String> ACCIDENTALS = Map.of(
            "Bmol", "f",
            "BmolDouble", "f",
            "Bqua", "n",
            "Diesis", "s");

    private static final String DEFAULT_TYPE = "Brevis";

    private final LayoutOptions options;

    public EventListImporter() {
        this(new LayoutOptions());
    }

    public EventListImporter(LayoutOptions options) {
        this.options = options;
    }

    /**
     * @param voices event lists by voice, voice i becomes the staff with number i + 1. A null or empty list gives a
     *               hidden staff
     */
    public Doc importVoices(List<List<ImportEvent>> voices) {
        Validate.notEmpty(voices, "a piece needs at least one voice");
        Doc doc = new Doc(options);
        doc.setType(DocType.PAGE_BASED);
        Page page = new Page();
        doc.addChild(page);
        StaffSystem system = new StaffSystem();
        page.addChild(system);

        ScoreDef scoreDef = new ScoreDef();
        system.addChild(scoreDef);
        for (int i = 0; i < voices.size(); i++) {
            StaffDef staffDef = new StaffDef(i + 1);
            staffDef.setLines(5);
            staffDef.setNotationType(NotationType.MENSURAL);
            staffDef.setClef(ClefShape.C, 1);
            scoreDef.addChild(staffDef);
        }

        Measure measure = new Measure(false);
        measure.setN("1");
        system.addChild(measure);
        for (int i = 0; i < voices.size(); i++) {
            List<ImportEvent> events = voices.get(i);
            Staff staff = new Staff(i + 1);
            if (events == null || events.isEmpty()) {
                staff.setVisible(false);
                measure.addChild(staff);
                continue;
            }
            Voice voice = new Voice(new Layer(1));
            for (ImportEvent event : events) {
                readEvent(event, voice);
            }
            staff.addChild(voice.layer);
            measure.addChild(staff);
        }
        LOG.debug("Imported {} voices into {}", voices.size(), doc);
        return doc;
    }

    private void readEvent(ImportEvent event, Voice voice) {
        Layer layer = voice.layer;
        switch (event.getName()) {
            case "Clef":
                if (isClef(event))
                    layer.addChild(createClef(event));
                else
                    layer.addChild(createKeySig(event));
                break;
            case "Dot":
                layer.addChild(new GenericLayerElement("dot"));
                break;
            case "Mensuration":
                voice.mensuration.update(event);
                layer.addChild(createMensur(voice.mensuration));
                break;
            case "Note":
                layer.addChild(createNote(event, voice));
                break;
            case "OriginalText":
                LOG.debug("Original text is not imported: {}", event);
                break;
            case "Rest":
                Rest rest = new Rest();
                rest.setDuration(readDuration(event, voice.mensuration));
                layer.addChild(rest);
                break;
            default:
                LOG.warn("Unsupported event '{}'", event.getName());
        }
    }

    private static boolean isClef(ImportEvent event) {
        //signatures are encoded as clefs as well
        return !event.has("Signature") && CLEF_SHAPES.containsKey(event.getString("Appearance"));
    }

    private static Clef createClef(ImportEvent event) {
        int line = (event.getInt("StaffLoc", 1) + 1) / 2;
        return new Clef(CLEF_SHAPES.getOrDefault(event.getString("Appearance"), ClefShape.C), line);
    }

    private static GenericLayerElement createKeySig(ImportEvent event) {
        GenericLayerElement keySig = new GenericLayerElement("keySig");
        keySig.setAttribute("accid", ACCIDENTALS.getOrDefault(event.getString("Appearance"), "f"));
        PitchName pname = PITCH_NAMES.getOrDefault(event.getString("LetterName"), PitchName.C);
        keySig.setAttribute("pname", pname.name());
        keySig.setAttribute("oct", String.valueOf(readOctave(event, pname)));
        keySig.setAttribute("loc", String.valueOf(event.getInt("StaffLoc", 1) - 1));
        return keySig;
    }

    private static GenericLayerElement createMensur(Mensuration mensuration) {
        GenericLayerElement mensur = new GenericLayerElement("mensur");
        mensur.setAttribute("prolatio", String.valueOf(mensuration.getProlatio()));
        mensur.setAttribute("tempus", String.valueOf(mensuration.getTempus()));
        mensur.setAttribute("modusminor", String.valueOf(mensuration.getModusMinor()));
        mensur.setAttribute("modusmaior", String.valueOf(mensuration.getModusMaior()));
        mensur.setAttribute("sign", mensuration.getTempus() == 3 ? "O" : "C");
        mensur.setAttribute("dot", String.valueOf(mensuration.getProlatio() == 3));
        return mensur;
    }

    private static Note createNote(ImportEvent event, Voice voice) {
        PitchName pname = PITCH_NAMES.getOrDefault(event.getString("LetterName"), PitchName.C);
        Note note = new Note(pname, readOctave(event, pname));
        note.setDuration(readDuration(event, voice.mensuration));
        note.setColored(event.has("Colored"));
        if (event.has("Syllable")) {
            Syl syl = new Syl(event.getString("Syllable"));
            if (event.has("WordEnd")) {
                syl.setWordPos(WordPosition.TERMINAL);
                voice.inWord = false;
            }
            else {
                syl.setWordPos(voice.inWord ? WordPosition.MEDIAL : WordPosition.INITIAL);
                voice.inWord = true;
            }
            Verse verse = new Verse(1);
            verse.addChild(syl);
            note.addChild(verse);
        }
        return note;
    }

    private static int readOctave(ImportEvent event, PitchName pname) {
        int oct = event.getInt("OctaveNum", 4);
        //octaves are counted from A
        if (pname != PitchName.A && pname != PitchName.B)
            oct++;
        return oct;
    }

    private static Fraction readDuration(ImportEvent event, Mensuration mensuration) {
        Fraction minims;
        if (event.has("Num") && event.has("Den")) {
            int den = event.getInt("Den", 1);
            if (den <= 0)
                throw new IllegalArgumentException("Length of " + event + " needs a positive denominator");
            minims = Fraction.getFraction(event.getInt("Num", 1), den);
        }
        else {
            minims = mensuration.getMinims(event.getString("Type"));
            if (minims == null)
                minims = mensuration.getMinims(DEFAULT_TYPE);
        }
        return minims.divideBy(Fraction.getFraction(2, 1));
    }

    /**
     * State kept while reading the events of one voice
     */
    private static class Voice {
        final Layer layer;
        final Mensuration mensuration = new Mensuration();
        /** true after a syllable that does not end its word */
        boolean inWord;

        Voice(Layer layer) {
            this.layer = layer;
        }
    }
}
