package org.splc.compiler.frontend.ast;

/**
 * @param text The string contents, without quotes.
 * @param line The source line.
 */
public record StringOutput(String text, int line) implements OutputNode {
}
