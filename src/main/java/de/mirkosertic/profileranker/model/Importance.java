package de.mirkosertic.profileranker.model;

/**
 * How strongly an ideal-profile criterion is wanted.
 */
public enum Importance {
    REQUIRED,
    PREFERRED,
    OPTIONAL
}
