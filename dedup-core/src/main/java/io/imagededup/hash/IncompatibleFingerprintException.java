package io.imagededup.hash;

/**
 * Exception thrown when comparing fingerprints of different kinds.
 */
public class IncompatibleFingerprintException extends RuntimeException {

    private final String expected;
    private final String actual;

    public IncompatibleFingerprintException(Fingerprint expected, Fingerprint actual) {
        super(String.format(
            "Cannot compare fingerprints of different kinds. Expected '%s/%d' but found '%s/%d'",
            expected.algorithm(), expected.bitLength(), actual.algorithm(), actual.bitLength()
        ));
        this.expected = expected.algorithm() + "/" + expected.bitLength();
        this.actual = actual.algorithm() + "/" + actual.bitLength();
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
