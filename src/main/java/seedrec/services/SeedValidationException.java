package seedrec.services;

/**
 * Seed ohne ID oder Medientyp; wird vor jeder Discovery geworfen
 */
public class SeedValidationException extends IllegalArgumentException {

    public SeedValidationException(String message) {
        super(message);
    }
}
