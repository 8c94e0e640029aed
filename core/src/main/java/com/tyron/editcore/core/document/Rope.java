package com.tyron.editcore.core.document;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, persistent text rope.
 * <p>
 * A balanced binary tree whose leaves hold short strings. Every node caches its length (in UTF-16 units) and
 * its number of {@code '\n'} characters, so offset and line lookups descend the tree instead of scanning the text.
 * Edits return a new rope that shares all untouched subtrees with the receiver; undo snapshots hold on to old
 * versions.
 * </p>
 */
public abstract class Rope {

    static final int MAX_LEAF_LENGTH = 512;
    static final int MAX_DEPTH = 48;

    public static final Rope EMPTY = new Leaf("");

    Rope() {
    }

    public static Rope of(@NotNull String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() <= MAX_LEAF_LENGTH) {
            return text.isEmpty() ? EMPTY : new Leaf(text);
        }
        List<Rope> leaves = new ArrayList<>(text.length() / MAX_LEAF_LENGTH + 1);
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(text.length(), start + MAX_LEAF_LENGTH);
            // keep surrogate pairs inside one leaf
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            leaves.add(new Leaf(text.substring(start, end)));
            start = end;
        }
        return build(leaves, 0, leaves.size());
    }

    public abstract int length();

    /**
     * @return Number of {@code '\n'} characters in this rope.
     */
    public abstract int lineBreakCount();

    public int lineCount() {
        return lineBreakCount() + 1;
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    abstract int depth();

    public abstract char charAt(int index);

    /**
     * @return Offset of the first character of {@code line}, i.e. one past its preceding {@code '\n'}.
     */
    public int lineStartOffset(int line) {
        if (line < 0 || line > lineBreakCount()) {
            throw new IndexOutOfBoundsException("line " + line + " is out of bounds for lineCount=" + lineCount());
        }
        return line == 0 ? 0 : offsetAfterBreak(line);
    }

    /**
     * @return The line containing {@code offset}, which equals the number of line breaks before it.
     */
    public int lineOfOffset(int offset) {
        checkOffset(offset);
        return breaksBefore(offset);
    }

    // Offset just past the n-th (1-based) line break.
    abstract int offsetAfterBreak(int n);

    abstract int breaksBefore(int offset);

    abstract void appendTo(StringBuilder out, int start, int end);

    abstract void collectLeaves(List<Rope> out);

    public String substring(int start, int end) {
        checkRange(start, end);
        if (start == end) {
            return "";
        }
        StringBuilder out = new StringBuilder(end - start);
        appendTo(out, start, end);
        return out.toString();
    }

    public Rope insert(int offset, @NotNull String text) {
        return replace(offset, offset, text);
    }

    public Rope delete(int start, int end) {
        return replace(start, end, "");
    }

    public Rope replace(int start, int end, @NotNull String text) {
        checkRange(start, end);
        Objects.requireNonNull(text, "text");
        if (start == end && text.isEmpty()) {
            return this;
        }
        Rope result = concat(slice(0, start), of(text));
        return concat(result, slice(end, length()));
    }

    /**
     * @return The rope covering {@code [start, end)}, sharing structure with this one.
     */
    public Rope slice(int start, int end) {
        checkRange(start, end);
        if (start == 0 && end == length()) {
            return this;
        }
        if (start == end) {
            return EMPTY;
        }
        return sliceUnchecked(start, end);
    }

    abstract Rope sliceUnchecked(int start, int end);

    public static Rope concat(@NotNull Rope left, @NotNull Rope right) {
        if (left.isEmpty()) return right;
        if (right.isEmpty()) return left;
        if (left instanceof Leaf l && right instanceof Leaf r
                && l.text.length() + r.text.length() <= MAX_LEAF_LENGTH) {
            return new Leaf(l.text + r.text);
        }
        Node node = new Node(left, right);
        if (node.depth > MAX_DEPTH) {
            return rebalance(node);
        }
        return node;
    }

    static Rope rebalance(Rope rope) {
        List<Rope> leaves = new ArrayList<>();
        rope.collectLeaves(leaves);
        return build(leaves, 0, leaves.size());
    }

    private static Rope build(List<Rope> leaves, int from, int to) {
        int count = to - from;
        if (count == 0) return EMPTY;
        if (count == 1) return leaves.get(from);
        int mid = from + count / 2;
        return new Node(build(leaves, from, mid), build(leaves, mid, to));
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + length());
        }
    }

    private void checkRange(int start, int end) {
        if (start < 0 || end < start || end > length()) {
            throw new IndexOutOfBoundsException("range [" + start + ", " + end + ") is out of bounds for length=" + length());
        }
    }

    @Override
    public String toString() {
        return substring(0, length());
    }

    static final class Leaf extends Rope {
        final String text;
        private final int lineBreaks;

        Leaf(String text) {
            this.text = text;
            int breaks = 0;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') breaks++;
            }
            this.lineBreaks = breaks;
        }

        @Override
        public int length() {
            return text.length();
        }

        @Override
        public int lineBreakCount() {
            return lineBreaks;
        }

        @Override
        int depth() {
            return 0;
        }

        @Override
        public char charAt(int index) {
            return text.charAt(index);
        }

        @Override
        int offsetAfterBreak(int n) {
            int seen = 0;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n' && ++seen == n) {
                    return i + 1;
                }
            }
            throw new IllegalStateException("break " + n + " not in leaf with " + lineBreaks + " breaks");
        }

        @Override
        int breaksBefore(int offset) {
            if (offset == text.length()) return lineBreaks;
            int breaks = 0;
            for (int i = 0; i < offset; i++) {
                if (text.charAt(i) == '\n') breaks++;
            }
            return breaks;
        }

        @Override
        void appendTo(StringBuilder out, int start, int end) {
            out.append(text, start, end);
        }

        @Override
        void collectLeaves(List<Rope> out) {
            if (!text.isEmpty()) out.add(this);
        }

        @Override
        Rope sliceUnchecked(int start, int end) {
            return new Leaf(text.substring(start, end));
        }

        @Override
        public String toString() {
            return text;
        }
    }

    static final class Node extends Rope {
        final Rope left;
        final Rope right;
        private final int length;
        private final int lineBreaks;
        private final int depth;

        Node(Rope left, Rope right) {
            this.left = left;
            this.right = right;
            this.length = left.length() + right.length();
            this.lineBreaks = left.lineBreakCount() + right.lineBreakCount();
            this.depth = Math.max(left.depth(), right.depth()) + 1;
        }

        @Override
        public int length() {
            return length;
        }

        @Override
        public int lineBreakCount() {
            return lineBreaks;
        }

        @Override
        int depth() {
            return depth;
        }

        @Override
        public char charAt(int index) {
            int leftLength = left.length();
            return index < leftLength ? left.charAt(index) : right.charAt(index - leftLength);
        }

        @Override
        int offsetAfterBreak(int n) {
            int leftBreaks = left.lineBreakCount();
            if (n <= leftBreaks) {
                return left.offsetAfterBreak(n);
            }
            return left.length() + right.offsetAfterBreak(n - leftBreaks);
        }

        @Override
        int breaksBefore(int offset) {
            int leftLength = left.length();
            if (offset <= leftLength) {
                return left.breaksBefore(offset);
            }
            return left.lineBreakCount() + right.breaksBefore(offset - leftLength);
        }

        @Override
        void appendTo(StringBuilder out, int start, int end) {
            int leftLength = left.length();
            if (start < leftLength) {
                left.appendTo(out, start, Math.min(end, leftLength));
            }
            if (end > leftLength) {
                right.appendTo(out, Math.max(0, start - leftLength), end - leftLength);
            }
        }

        @Override
        void collectLeaves(List<Rope> out) {
            left.collectLeaves(out);
            right.collectLeaves(out);
        }

        @Override
        Rope sliceUnchecked(int start, int end) {
            int leftLength = left.length();
            if (end <= leftLength) {
                return left.slice(start, end);
            }
            if (start >= leftLength) {
                return right.slice(start - leftLength, end - leftLength);
            }
            return concat(left.slice(start, leftLength), right.slice(0, end - leftLength));
        }
    }
}
