package com.upgradedoctor.check;

import com.upgradedoctor.check.result.DiagnosticResult;

import java.io.PrintWriter;

/**
 * Optional capability of a {@link Check}: custom rendering of a result's impacted objects in
 * verbose output. Checks that do not implement it get {@link DefaultVerboseFormatter}.
 */
public interface VerboseOutputFormatter {

    void formatVerboseOutput(PrintWriter out, DiagnosticResult result);

    /** The check itself when it implements this interface, otherwise {@code fallback}. */
    static VerboseOutputFormatter forCheck(Check check, VerboseOutputFormatter fallback) {
        return check instanceof VerboseOutputFormatter custom ? custom : fallback;
    }
}
