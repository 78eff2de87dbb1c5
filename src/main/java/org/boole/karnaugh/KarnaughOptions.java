package org.boole.karnaugh;

/**
 * Opzioni di generazione della mappa.
 *
 * @param autoGroup riporta i gruppi nella mappa e nelle celle
 * @param findMinimizedForm calcola le forme SOP e POS semplificate
 */
public record KarnaughOptions(boolean autoGroup, boolean findMinimizedForm) {

    public static KarnaughOptions defaults() {
        return new KarnaughOptions(true, true);
    }

    public KarnaughOptions withAutoGroup(boolean value) {
        return new KarnaughOptions(value, findMinimizedForm);
    }

    public KarnaughOptions withFindMinimizedForm(boolean value) {
        return new KarnaughOptions(autoGroup, value);
    }
}
