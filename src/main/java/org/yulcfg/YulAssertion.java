package org.yulcfg;

/**
 * Thrown when the graph handed to the exporter breaks a structural guarantee
 * of the stage that built it. Not recoverable; no partial document is produced.
 */
public class YulAssertion extends IllegalStateException {

    public YulAssertion(String message) {
        super(message);
    }

    public static void check(boolean condition, String message) {
        if (!condition) throw new YulAssertion(message);
    }
}
