package io.methodfinder.scan;

/**
 * Invalid scan input: empty target class or method, or a scan root that is missing or not a
 * directory. Raised before any class file is read.
 */
public class ScanInputException extends Exception {

    private static final long serialVersionUID = 1L;

    public ScanInputException(String message) {
        super(message);
    }
}
