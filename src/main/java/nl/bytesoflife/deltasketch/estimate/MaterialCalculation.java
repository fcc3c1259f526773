package nl.bytesoflife.deltasketch.estimate;

/**
 * Material quantities for one room. Areas in square feet, lengths in linear feet.
 */
public record MaterialCalculation(
        double flooringSquareFeet,
        double flooringWaste,
        double flooringTotal,
        double paintableArea,
        int paintGallons,
        int primerGallons,
        double baseboardLinearFeet,
        double crownMoldingLinearFeet,
        double casingLinearFeet,
        double ceilingSquareFeet,
        int ceilingTiles
) {
    public double trimLinearFeet() {
        return baseboardLinearFeet + crownMoldingLinearFeet + casingLinearFeet;
    }
}
