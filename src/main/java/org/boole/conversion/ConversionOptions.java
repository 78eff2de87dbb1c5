package org.boole.conversion;

/**
 * @param canonical restituisce la forma canonica; se false applica la riduzione per assorbimento
 * @param showSteps registra i passi intermedi
 */
public record ConversionOptions(boolean canonical, boolean showSteps) {

    public static ConversionOptions defaults() {
        return new ConversionOptions(true, true);
    }

    public ConversionOptions withCanonical(boolean value) {
        return new ConversionOptions(value, showSteps);
    }

    public ConversionOptions withShowSteps(boolean value) {
        return new ConversionOptions(canonical, value);
    }
}
