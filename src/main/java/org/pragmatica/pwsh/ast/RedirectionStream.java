package org.pragmatica.pwsh.ast;

/**
 * Output streams a redirection can read from or merge into.
 */
public enum RedirectionStream {
    ALL,
    OUTPUT,
    ERROR,
    WARNING,
    VERBOSE,
    DEBUG,
    INFORMATION
}
