package org.opstranslate.vro.errorhandling.models;

/**
 * A try/catch/finally construct found in a script. Offsets refer to the original script.
 *
 * @param tryStart    offset of the {@code try} keyword
 * @param end         offset just past the last closing brace of the construct
 * @param tryBody     statements of the try block
 * @param catchVar    name bound by {@code catch (e)}, or null
 * @param catchBody   statements of the catch block, null for a bare try/finally
 * @param finallyBody statements of the finally block, null when there is none
 */
public record ErrorHandlingBlock(
        int tryStart,
        int end,
        String tryBody,
        String catchVar,
        String catchBody,
        String finallyBody
) {
    public boolean hasCatch() {
        return catchBody != null;
    }

    public boolean hasFinally() {
        return finallyBody != null;
    }
}
