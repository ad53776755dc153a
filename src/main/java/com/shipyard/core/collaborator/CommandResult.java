package com.shipyard.core.collaborator;

/**
 * Exit status and captured output of a command or container run.
 */
public record CommandResult(int exitCode, String output) {

    public CommandResult {
        output = output != null ? output : "";
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Last {@code maxChars} characters of output, for inclusion in reports. */
    public String outputTail(int maxChars) {
        if (output.length() <= maxChars) {
            return output;
        }
        return "..." + output.substring(output.length() - maxChars);
    }
}
