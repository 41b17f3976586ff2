package ru.tigran.researchsignalengine.validation;

/**
 * Request element identified by a label (section, theme, codebook group).
 */
public interface Labeled {
    String label();
}
