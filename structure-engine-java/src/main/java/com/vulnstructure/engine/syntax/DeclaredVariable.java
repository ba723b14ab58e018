package com.vulnstructure.engine.syntax;

/**
 * A name introduced by a declaration or parameter declaration.
 */
public record DeclaredVariable(
    String name,
    String type,
    boolean pointer,
    boolean array,
    int line
) {}
