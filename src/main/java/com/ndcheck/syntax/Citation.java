package com.ndcheck.syntax;

/**
 * A reference from a justification to an earlier line or to a whole closed subproof.
 */
public sealed interface Citation permits Citation.LineRef, Citation.RangeRef {

    record LineRef(int line) implements Citation {
        @Override
        public String toString() {
            return String.valueOf(line);
        }
    }

    record RangeRef(int first, int last) implements Citation {
        public RangeRef {
            if (first >= last) {
                throw new IllegalArgumentException("Range must run from a lower to a higher line: " + first + "-" + last);
            }
        }

        @Override
        public String toString() {
            return first + "-" + last;
        }
    }
}
