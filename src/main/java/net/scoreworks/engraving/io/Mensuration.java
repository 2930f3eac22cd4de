/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.engraving.io;

import org.apache.commons.lang3.math.Fraction;

/**
 * Mensuration in effect in one voice. Each level divides the next higher note value into 2 (imperfect) or
 * 3 (perfect) parts. Everything is imperfect until a mensuration sign says otherwise
 */
class Mensuration {
    private int prolatio = 2;
    private int tempus = 2;
    private int modusMinor = 2;
    private int modusMaior = 2;

    /**
     * Take the levels an event sets, the others stay in effect
     */
    void update(ImportEvent event) {
        prolatio = readLevel(event, "Prolatio", prolatio);
        tempus = readLevel(event, "Tempus", tempus);
        modusMinor = readLevel(event, "ModusMinor", modusMinor);
        modusMaior = readLevel(event, "ModusMaior", modusMaior);
    }

    private static int readLevel(ImportEvent event, String key, int current) {
        return event.getInt(key, current) == 3 ? 3 : 2;
    }

    int getProlatio() {
        return prolatio;
    }

    int getTempus() {
        return tempus;
    }

    int getModusMinor() {
        return modusMinor;
    }

    int getModusMaior() {
        return modusMaior;
    }

    /**
     * @return the length of a note value in minims, or null for unknown values
     */
    Fraction getMinims(String type) {
        switch (type) {
            case "Maxima":
                return Fraction.getFraction(modusMaior * modusMinor * tempus * prolatio, 1);
            case "Longa":
                return Fraction.getFraction(modusMinor * tempus * prolatio, 1);
            case "Brevis":
                return Fraction.getFraction(tempus * prolatio, 1);
            case "Semibrevis":
                return Fraction.getFraction(prolatio, 1);
            case "Minima":
                return Fraction.ONE;
            case "Semiminima":
                return Fraction.ONE_HALF;
            case "Fusa":
                return Fraction.ONE_QUARTER;
            case "Semifusa":
                return Fraction.getFraction(1, 8);
            default:
                return null;
        }
    }
}
