package org.bhavforge.cli.commands;

/**
 * Report rendering selected with {@code --format}.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
