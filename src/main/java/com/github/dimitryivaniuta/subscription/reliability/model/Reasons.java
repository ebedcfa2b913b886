package com.github.dimitryivaniuta.subscription.reliability.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Failure reason text stored with quarantined events.
 */
public final class Reasons {

    public static final int MAX_LENGTH = 4000;

    private Reasons() {
    }

    public static String of(Throwable ex) {
        var sw = new StringWriter();
        ex.printStackTrace(new PrintWriter(sw));
        return truncate(sw.toString());
    }

    public static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() > MAX_LENGTH ? reason.substring(0, MAX_LENGTH) : reason;
    }
}
