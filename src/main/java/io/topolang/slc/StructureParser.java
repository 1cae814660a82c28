package io.topolang.slc;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rebuilds the brace skeleton of rendered set text. Every {@code {...}} becomes a
 * nested set; everything other than braces is skipped, so leaf symbols and
 * integers are not recovered. Runs on an explicit stack and handles any nesting
 * depth without native recursion.
 */
public final class StructureParser {
    private StructureParser() {}

    /**
     * Returns the first complete top-level set. Text after its closing brace is ignored.
     *
     * @throws UnexpectedCloseBraceException on a {@code }} with nothing open
     * @throws IncompleteInputException      if no top-level set is closed
     */
    public static SetTerm parse(String text) {
        Deque<SetTerm.Builder> stack = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '{') {
                stack.push(SetTerm.builder());
            } else if (ch == '}') {
                if (stack.isEmpty()) throw new UnexpectedCloseBraceException(i);
                SetTerm completed = stack.pop().build();
                if (stack.isEmpty()) return completed;
                stack.peek().add(completed);
            }
        }
        if (stack.isEmpty()) throw new IncompleteInputException("no set in input", text.length());
        throw new IncompleteInputException(stack.size() + " unclosed '{' at end of input", text.length());
    }
}
