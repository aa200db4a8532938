package org.splc.compiler.api;

/**
 * One line of the final program.
 *
 * @param address The numeric address of the instruction.
 * @param text The rendered instruction, without the address.
 */
public record NumberedLine(int address, String text) {

    @Override
    public String toString() {
        return address + " " + text;
    }
}
