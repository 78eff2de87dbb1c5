package org.boole.circuit;

/**
 * Disposizione delle porte nel piano.
 */
public enum LayoutStrategy {

    /** Posizioni assegnate durante la costruzione, avanzando a ogni porta logica */
    BUILD_ORDER,

    /** Colonne per livello di profondità, righe in ordine di costruzione */
    LEVELED
}
